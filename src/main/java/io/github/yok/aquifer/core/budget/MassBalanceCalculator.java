package io.github.yok.aquifer.core.budget;

import io.github.yok.aquifer.core.model.Species;
import io.github.yok.aquifer.core.model.Stoichiometry;
import io.github.yok.aquifer.core.state.DerivativeResult;
import io.github.yok.aquifer.core.state.DerivativeResult.BoundaryFlux;
import io.github.yok.aquifer.core.state.DerivativeResult.ReactionTotals;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 化学種ごとの物質収支の閉合差を計算するクラスです。
 *
 * <p>
 * 閉合差 = 流入フラックス − 流出フラックス + 化学量論で重み付けした反応総量 です。 これは任意の状態で {@code Σ dC·dx·VF} に等しく、定常状態では 0
 * に近づきます。
 * </p>
 */
public final class MassBalanceCalculator {

    /**
     * 化学種ごとの閉合差 [mmol/(m²·d)] を計算します。
     *
     * @param result 微分関数の評価結果です
     * @return 化学種ごとの閉合差（変更不可）です
     * @throws IllegalArgumentException result が null の場合に発生します
     */
    public Map<Species, Double> closures(DerivativeResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        ReactionTotals t = result.getTotals();
        double aeroMin = t.getAerobicMineralization();
        double denitri = t.getDenitrification();
        double nitri = t.getNitrification();
        double aeration = t.getAeration();

        Map<Species, Double> closures = new EnumMap<>(Species.class);
        closures.put(Species.DON, net(result, Species.DON) - aeroMin - denitri);
        closures.put(Species.O2, net(result, Species.O2) + aeration - aeroMin
                - Stoichiometry.OXYGEN_PER_NITRIFICATION * nitri);
        closures.put(Species.NO3, net(result, Species.NO3)
                - Stoichiometry.NITRATE_PER_DENITRIFICATION * denitri + nitri);
        closures.put(Species.NH3, net(result, Species.NH3)
                + (aeroMin + denitri) * Stoichiometry.AMMONIA_PER_MINERALIZATION - nitri);
        closures.put(Species.N2,
                net(result, Species.N2) + Stoichiometry.DINITROGEN_PER_DENITRIFICATION * denitri);
        return Collections.unmodifiableMap(closures);
    }

    private static double net(DerivativeResult result, Species species) {
        BoundaryFlux flux = result.boundaryFlux(species);
        return flux.getUp() - flux.getDown();
    }
}
