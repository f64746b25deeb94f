package io.github.yok.aquifer.out;

import io.github.yok.aquifer.core.grid.Grid;
import io.github.yok.aquifer.core.model.Species;
import io.github.yok.aquifer.core.state.SteadyState;
import java.util.Map;

/**
 * 計算結果を出力するインタフェースです。
 */
public interface ResultWriter {

    /**
     * 定常状態と収支を出力します。
     *
     * @param steadyState 定常状態です
     * @param grid 格子です
     * @param budget 収支表です
     * @param closures 化学種ごとの物質収支の閉合差です
     */
    void write(SteadyState steadyState, Grid grid, Map<String, Double> budget,
            Map<Species, Double> closures);
}
