package io.github.yok.aquifer.core.budget;

import io.github.yok.aquifer.core.model.Species;
import io.github.yok.aquifer.core.state.DerivativeResult;
import io.github.yok.aquifer.core.state.DerivativeResult.BoundaryFlux;
import io.github.yok.aquifer.core.state.DerivativeResult.ReactionTotals;
import io.github.yok.aquifer.core.state.SteadyState;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 定常状態の診断量（反応総量 4 項目と境界フラックス 10 項目）を名前付きの表に射影するクラスです。
 *
 * <p>
 * 値の計算は行わず、{@link DerivativeResult} の項目をそのまま取り出します。 キーの並びは反応総量 → 化学種順の (up, down) で固定です。
 * </p>
 */
public final class BudgetAggregator {

    /**
     * 好気的無機化の総量のキーです。
     */
    public static final String AEROBIC_MINERALIZATION_TOTAL = "aerobicMineralization.total";

    /**
     * 脱窒の総量のキーです。
     */
    public static final String DENITRIFICATION_TOTAL = "denitrification.total";

    /**
     * 硝化の総量のキーです。
     */
    public static final String NITRIFICATION_TOTAL = "nitrification.total";

    /**
     * 再曝気の総量のキーです。
     */
    public static final String AERATION_TOTAL = "aeration.total";

    /**
     * 定常状態から収支表を作成します。
     *
     * @param steadyState 定常状態です
     * @return 14 項目の収支表（変更不可、挿入順）です
     * @throws IllegalArgumentException steadyState が null の場合に発生します
     */
    public Map<String, Double> aggregate(SteadyState steadyState) {
        if (steadyState == null) {
            throw new IllegalArgumentException("steadyState は null 不可です");
        }
        DerivativeResult result = steadyState.getDerivative();
        ReactionTotals totals = result.getTotals();

        Map<String, Double> budget = new LinkedHashMap<>();
        budget.put(AEROBIC_MINERALIZATION_TOTAL, totals.getAerobicMineralization());
        budget.put(DENITRIFICATION_TOTAL, totals.getDenitrification());
        budget.put(NITRIFICATION_TOTAL, totals.getNitrification());
        budget.put(AERATION_TOTAL, totals.getAeration());

        for (Species s : Species.values()) {
            BoundaryFlux flux = result.boundaryFlux(s);
            budget.put(fluxUpKey(s), flux.getUp());
            budget.put(fluxDownKey(s), flux.getDown());
        }
        return Collections.unmodifiableMap(budget);
    }

    /**
     * 上流端フラックスのキー（例: {@code DON.flux.up}）を返します。
     *
     * @param species 化学種です
     * @return キーです
     */
    public static String fluxUpKey(Species species) {
        return species.name() + ".flux.up";
    }

    /**
     * 下流端フラックスのキー（例: {@code DON.flux.down}）を返します。
     *
     * @param species 化学種です
     * @return キーです
     */
    public static String fluxDownKey(Species species) {
        return species.name() + ".flux.down";
    }
}
