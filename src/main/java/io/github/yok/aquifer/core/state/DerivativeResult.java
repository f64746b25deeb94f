package io.github.yok.aquifer.core.state;

import io.github.yok.aquifer.core.model.ReactionKinetics.ReactionRates;
import io.github.yok.aquifer.core.model.Species;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.Value;

/**
 * 微分関数の評価結果（濃度変化率ベクトルと診断量）を保持するクラスです。
 *
 * <p>
 * 定常ソルバと収支集計の双方が参照する唯一の出力です。
 * </p>
 */
@Value
public class DerivativeResult {

    /**
     * 濃度変化率ベクトル（長さ 5N、状態ベクトルと同じ並び）です。
     */
    double[] derivative;

    /**
     * セルごとの反応速度です。
     */
    ReactionRates rates;

    /**
     * 領域積分した反応量（Σ rate·dx·VF）です。
     */
    ReactionTotals totals;

    /**
     * 化学種ごとの境界フラックスです。
     */
    Map<Species, BoundaryFlux> boundaryFluxes;

    /**
     * 評価結果を生成します。濃度変化率ベクトルはコピーして保持します。
     *
     * @param derivative 濃度変化率ベクトルです
     * @param rates セルごとの反応速度です
     * @param totals 領域積分した反応量です
     * @param boundaryFluxes 化学種ごとの境界フラックスです
     * @throws IllegalArgumentException derivative が null の場合に発生します
     */
    public DerivativeResult(double[] derivative, ReactionRates rates, ReactionTotals totals,
            Map<Species, BoundaryFlux> boundaryFluxes) {
        if (derivative == null) {
            throw new IllegalArgumentException("derivative は null 不可です");
        }
        this.derivative = Arrays.copyOf(derivative, derivative.length);
        this.rates = rates;
        this.totals = totals;
        this.boundaryFluxes = boundaryFluxes.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(boundaryFluxes));
    }

    /**
     * 濃度変化率ベクトルを返します。
     *
     * @return 濃度変化率ベクトルのコピーです
     */
    public double[] getDerivative() {
        return Arrays.copyOf(derivative, derivative.length);
    }

    /**
     * 濃度変化率の最大絶対値を返します。
     *
     * @return 最大絶対値です（NaN を含む場合は NaN）
     */
    public double maxAbsDerivative() {
        double max = 0.0;
        for (double d : derivative) {
            if (Double.isNaN(d)) {
                return Double.NaN;
            }
            max = Math.max(max, Math.abs(d));
        }
        return max;
    }

    /**
     * 指定化学種の境界フラックスを返します。
     *
     * @param species 化学種です
     * @return 境界フラックスです
     * @throws IllegalStateException 境界フラックスが記録されていない場合に発生します
     */
    public BoundaryFlux boundaryFlux(Species species) {
        BoundaryFlux flux = boundaryFluxes.get(species);
        if (flux == null) {
            throw new IllegalStateException("境界フラックスが記録されていません: " + species);
        }
        return flux;
    }

    /**
     * 領域積分した反応量 [mmol/(m²·d)] を保持するクラスです。
     */
    @Value
    public static class ReactionTotals {

        /**
         * 好気的無機化の総量です。
         */
        double aerobicMineralization;

        /**
         * 脱窒の総量です。
         */
        double denitrification;

        /**
         * 硝化の総量です。
         */
        double nitrification;

        /**
         * 再曝気の総量です。
         */
        double aeration;
    }

    /**
     * 1 化学種の上流端・下流端フラックス [mmol/(m²·d)] を保持するクラスです。
     */
    @Value
    public static class BoundaryFlux {

        /**
         * 上流端（x=0）から流入するフラックスです。
         */
        double up;

        /**
         * 下流端（x=L）から流出するフラックスです。
         */
        double down;
    }
}
