package io.github.yok.aquifer.core.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 帯水層の窒素循環（好気的無機化・脱窒・硝化・再曝気）の反応速度式です。
 *
 * <ul>
 * <li>{@code aeroMin = r_aeromin · O2/(O2+kO2) · DON}</li>
 * <li>{@code denitri = r_denitr · NO3/(NO3+kNO3) · kO2/(O2+kO2) · DON}</li>
 * <li>{@code nitri = r_nitri · O2 · NH3}</li>
 * <li>{@code aeration = r_aera · (O2_sol − O2)}</li>
 * </ul>
 */
public final class NitrogenCycleKinetics implements ReactionKinetics {

    @Override
    public ReactionRates computeRates(double[] don, double[] oxygen, double[] nitrate,
            double[] ammonia, ParameterSet parameters) {

        checkNotNull(don, "don は null 不可です");
        checkNotNull(oxygen, "oxygen は null 不可です");
        checkNotNull(nitrate, "nitrate は null 不可です");
        checkNotNull(ammonia, "ammonia は null 不可です");
        checkNotNull(parameters, "parameters は null 不可です");
        int n = don.length;
        checkArgument(oxygen.length == n && nitrate.length == n && ammonia.length == n,
                "濃度配列の長さが揃っていません: DON=%s, O2=%s, NO3=%s, NH3=%s", n, oxygen.length,
                nitrate.length, ammonia.length);

        double rAeroMin = parameters.getAerobicMineralizationRate();
        double rDenitr = parameters.getDenitrificationRate();
        double rNitri = parameters.getNitrificationRate();
        double rAera = parameters.getAerationRate();
        double kO2 = parameters.getOxygenHalfSaturation();
        double kNo3 = parameters.getNitrateHalfSaturation();
        double o2Sol = parameters.getOxygenSolubility();

        double[] aeroMin = new double[n];
        double[] denitri = new double[n];
        double[] nitri = new double[n];
        double[] aeration = new double[n];

        for (int i = 0; i < n; i++) {
            double o2 = oxygen[i];

            // Michaelis-Menten 型の酸素制限と酸素阻害（和は 1）
            double oxygenLimitation = o2 / (o2 + kO2);
            double oxygenInhibition = kO2 / (o2 + kO2);
            double nitrateLimitation = nitrate[i] / (nitrate[i] + kNo3);

            aeroMin[i] = rAeroMin * oxygenLimitation * don[i];
            denitri[i] = rDenitr * nitrateLimitation * oxygenInhibition * don[i];
            nitri[i] = rNitri * o2 * ammonia[i];
            aeration[i] = rAera * (o2Sol - o2);
        }
        return new ReactionRates(aeroMin, denitri, nitri, aeration);
    }
}
