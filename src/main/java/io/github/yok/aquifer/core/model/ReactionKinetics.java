package io.github.yok.aquifer.core.model;

import java.util.Arrays;
import lombok.Value;

/**
 * セルごとの生物地球化学反応速度を計算するインタフェースです。
 *
 * <p>
 * 実装は純粋関数（状態を持たない）である必要があります。複数スレッドから同時に呼ばれることがあります。
 * </p>
 */
public interface ReactionKinetics {

    /**
     * 現在の濃度から 4 種類の反応速度を計算します。
     *
     * @param don DON 濃度（長さ N）です
     * @param oxygen O2 濃度（長さ N）です
     * @param nitrate NO3 濃度（長さ N）です
     * @param ammonia NH3 濃度（長さ N）です
     * @param parameters パラメータセットです
     * @return セルごとの反応速度です
     * @throws IllegalArgumentException 配列長が揃っていない場合に発生します
     */
    ReactionRates computeRates(double[] don, double[] oxygen, double[] nitrate, double[] ammonia,
            ParameterSet parameters);

    /**
     * セルごとの反応速度 [mmol/(m³·d)] を保持するクラスです。
     *
     * <p>
     * 状態に依存するため、微分評価のたびに作り直します（キャッシュしません）。
     * </p>
     */
    @Value
    class ReactionRates {

        /**
         * 好気的無機化速度 aeroMin です。
         */
        double[] aerobicMineralization;

        /**
         * 脱窒速度 denitri です。
         */
        double[] denitrification;

        /**
         * 硝化速度 nitri です。
         */
        double[] nitrification;

        /**
         * 再曝気速度 aeration です（O2 が飽和濃度を超えると負になります）。
         */
        double[] aeration;

        /**
         * 反応速度を生成します。各配列はコピーして保持します。
         *
         * @param aerobicMineralization 好気的無機化速度です
         * @param denitrification 脱窒速度です
         * @param nitrification 硝化速度です
         * @param aeration 再曝気速度です
         */
        public ReactionRates(double[] aerobicMineralization, double[] denitrification,
                double[] nitrification, double[] aeration) {
            this.aerobicMineralization = aerobicMineralization.clone();
            this.denitrification = denitrification.clone();
            this.nitrification = nitrification.clone();
            this.aeration = aeration.clone();
        }

        public double[] getAerobicMineralization() {
            return Arrays.copyOf(aerobicMineralization, aerobicMineralization.length);
        }

        public double[] getDenitrification() {
            return Arrays.copyOf(denitrification, denitrification.length);
        }

        public double[] getNitrification() {
            return Arrays.copyOf(nitrification, nitrification.length);
        }

        public double[] getAeration() {
            return Arrays.copyOf(aeration, aeration.length);
        }
    }
}
