package io.github.yok.aquifer.core.model;

import io.github.yok.aquifer.core.grid.Grid;
import lombok.Value;

/**
 * 1 化学種の移流・分散による濃度変化を計算する輸送演算子を表すインタフェースです。
 *
 * <p>
 * 上流端は固定濃度（Dirichlet）、下流端はゼロ勾配（Neumann）を前提とします。 離散化スキームを差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface TransportOperator {

    /**
     * 界面フラックスと各セルの濃度変化率を計算します。
     *
     * @param concentration セル濃度（長さ N）です
     * @param upstreamConcentration 上流端の固定濃度 C_up です
     * @param dispersion 分散係数 D [m²/d] です
     * @param velocity 移流速度 v [m/d] です
     * @param volumeFraction 体積分率（空隙率）VF です
     * @param grid 格子です
     * @return 輸送計算の結果です
     * @throws IllegalArgumentException 配列長が格子と一致しない場合などに発生します
     */
    TransportResult apply(double[] concentration, double upstreamConcentration, double dispersion,
            double velocity, double volumeFraction, Grid grid);

    /**
     * 輸送計算の結果を保持するクラスです。
     *
     * <p>
     * フラックスの単位は mmol/(m²·d)（バルク断面積あたり）で、下流向きを正とします。
     * </p>
     */
    @Value
    class TransportResult {

        /**
         * 各セルの濃度変化率 dC/dt（長さ N）です。
         */
        double[] rateOfChange;

        /**
         * 界面フラックス（長さ N+1）です。
         */
        double[] faceFluxes;

        /**
         * 上流端フラックス flux[0] を返します。
         *
         * @return 上流端フラックスです
         */
        public double fluxUp() {
            return faceFluxes[0];
        }

        /**
         * 下流端フラックス flux[N] を返します。
         *
         * @return 下流端フラックスです
         */
        public double fluxDown() {
            return faceFluxes[faceFluxes.length - 1];
        }
    }
}
