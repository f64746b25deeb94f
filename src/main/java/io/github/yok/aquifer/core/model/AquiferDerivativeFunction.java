package io.github.yok.aquifer.core.model;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.aquifer.core.grid.Grid;
import io.github.yok.aquifer.core.model.ReactionKinetics.ReactionRates;
import io.github.yok.aquifer.core.model.TransportOperator.TransportResult;
import io.github.yok.aquifer.core.state.DerivativeResult;
import io.github.yok.aquifer.core.state.DerivativeResult.BoundaryFlux;
import io.github.yok.aquifer.core.state.DerivativeResult.ReactionTotals;
import io.github.yok.aquifer.core.state.StateLayout;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;

/**
 * 帯水層の移流・分散・反応を合成した微分関数です。
 *
 * <p>
 * 化学種ごとに輸送演算子を 1 回、反応速度式を全体で 1 回呼び出し、化学量論で合成します。
 * </p>
 *
 * <pre>
 * dDON = T_DON − aeroMin − denitri
 * dO2  = T_O2  + aeration − aeroMin − 2·nitri
 * dNO3 = T_NO3 − (4/5)·denitri + nitri
 * dNH3 = T_NH3 + (aeroMin + denitri)·(16/106) − nitri
 * dN2  = T_N2  + (2/5)·denitri
 * </pre>
 */
@Getter
public final class AquiferDerivativeFunction implements DerivativeFunction {

    /**
     * 格子です。
     */
    private final Grid grid;

    /**
     * パラメータセットです。
     */
    private final ParameterSet parameters;

    /**
     * 輸送演算子です。
     */
    private final TransportOperator transportOperator;

    /**
     * 反応速度式です。
     */
    private final ReactionKinetics kinetics;

    /**
     * 状態ベクトルの並びです。
     */
    private final StateLayout stateLayout;

    /**
     * 微分関数を生成します。
     *
     * @param grid 格子です（null 不可）
     * @param parameters パラメータセットです（null 不可）
     * @param transportOperator 輸送演算子です（null 不可）
     * @param kinetics 反応速度式です（null 不可）
     * @throws NullPointerException 引数が null の場合に発生します
     */
    public AquiferDerivativeFunction(Grid grid, ParameterSet parameters,
            TransportOperator transportOperator, ReactionKinetics kinetics) {
        this.grid = checkNotNull(grid, "grid は null 不可です");
        this.parameters = checkNotNull(parameters, "parameters は null 不可です");
        this.transportOperator = checkNotNull(transportOperator, "transportOperator は null 不可です");
        this.kinetics = checkNotNull(kinetics, "kinetics は null 不可です");
        this.stateLayout = new StateLayout(grid.cellCount());
    }

    @Override
    public StateLayout layout() {
        return stateLayout;
    }

    @Override
    public DerivativeResult evaluate(double time, double[] state) {
        stateLayout.requireSize(state);

        int n = grid.cellCount();
        double dx = grid.cellWidth();
        double porosity = parameters.getPorosity();
        double velocity = parameters.getAdvectiveVelocity();
        double dispersion = parameters.dispersionCoefficient();

        // 1) 化学種ごとの輸送
        Map<Species, double[]> slices = new EnumMap<>(Species.class);
        Map<Species, TransportResult> transport = new EnumMap<>(Species.class);
        for (Species s : Species.values()) {
            double[] c = stateLayout.slice(state, s);
            slices.put(s, c);
            transport.put(s, transportOperator.apply(c, s.riverConcentration(parameters),
                    dispersion, velocity, porosity, grid));
        }

        // 2) 反応速度
        ReactionRates rates = kinetics.computeRates(slices.get(Species.DON),
                slices.get(Species.O2), slices.get(Species.NO3), slices.get(Species.NH3),
                parameters);
        double[] aeroMin = rates.getAerobicMineralization();
        double[] denitri = rates.getDenitrification();
        double[] nitri = rates.getNitrification();
        double[] aeration = rates.getAeration();

        // 3) 化学量論で合成
        double[] tDon = transport.get(Species.DON).getRateOfChange();
        double[] tO2 = transport.get(Species.O2).getRateOfChange();
        double[] tNo3 = transport.get(Species.NO3).getRateOfChange();
        double[] tNh3 = transport.get(Species.NH3).getRateOfChange();
        double[] tN2 = transport.get(Species.N2).getRateOfChange();

        double[] derivative = stateLayout.zeros();
        int oDon = stateLayout.index(Species.DON, 0);
        int oO2 = stateLayout.index(Species.O2, 0);
        int oNo3 = stateLayout.index(Species.NO3, 0);
        int oNh3 = stateLayout.index(Species.NH3, 0);
        int oN2 = stateLayout.index(Species.N2, 0);

        for (int i = 0; i < n; i++) {
            derivative[oDon + i] = tDon[i] - aeroMin[i] - denitri[i];
            derivative[oO2 + i] = tO2[i] + aeration[i] - aeroMin[i]
                    - Stoichiometry.OXYGEN_PER_NITRIFICATION * nitri[i];
            derivative[oNo3 + i] =
                    tNo3[i] - Stoichiometry.NITRATE_PER_DENITRIFICATION * denitri[i] + nitri[i];
            derivative[oNh3 + i] = tNh3[i]
                    + (aeroMin[i] + denitri[i]) * Stoichiometry.AMMONIA_PER_MINERALIZATION
                    - nitri[i];
            derivative[oN2 + i] =
                    tN2[i] + Stoichiometry.DINITROGEN_PER_DENITRIFICATION * denitri[i];
        }

        // 4) 診断量（領域積分と境界フラックス）
        double cellVolume = dx * porosity;
        ReactionTotals totals = new ReactionTotals(integrate(aeroMin, cellVolume),
                integrate(denitri, cellVolume), integrate(nitri, cellVolume),
                integrate(aeration, cellVolume));

        Map<Species, BoundaryFlux> fluxes = new EnumMap<>(Species.class);
        for (Species s : Species.values()) {
            TransportResult t = transport.get(s);
            fluxes.put(s, new BoundaryFlux(t.fluxUp(), t.fluxDown()));
        }

        return new DerivativeResult(derivative, rates, totals, fluxes);
    }

    /**
     * セルごとの速度を領域積分します（Σ rate·dx·VF）。
     *
     * @param rate セルごとの速度です
     * @param cellVolume セルあたりの水相体積（dx·VF）です
     * @return 積分値です
     */
    private static double integrate(double[] rate, double cellVolume) {
        double sum = 0.0;
        for (double r : rate) {
            sum += r;
        }
        return sum * cellVolume;
    }
}
