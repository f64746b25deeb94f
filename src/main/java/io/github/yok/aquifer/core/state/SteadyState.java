package io.github.yok.aquifer.core.state;

import io.github.yok.aquifer.core.model.Species;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import lombok.Value;

/**
 * 収束した定常状態を保持するクラスです。
 *
 * <p>
 * 定常ソルバが収束した場合にのみ生成されます。未収束の状態ベクトルがこのクラスで返ることはありません。
 * </p>
 */
@Value
public class SteadyState {

    /**
     * 状態ベクトルの並びです。
     */
    StateLayout layout;

    /**
     * 収束した状態ベクトル（長さ 5N、全成分 0 以上）です。
     */
    double[] state;

    /**
     * 収束状態で評価した微分関数の結果です。
     */
    DerivativeResult derivative;

    /**
     * 収束までに実行した反復回数です。
     */
    int iterations;

    /**
     * 収束時の残差（濃度変化率）の最大絶対値です。
     */
    double residualMaxNorm;

    /**
     * 定常状態を生成します。状態ベクトルはコピーして保持します。
     *
     * @param layout 状態ベクトルの並びです
     * @param state 収束した状態ベクトルです
     * @param derivative 収束状態で評価した微分関数の結果です
     * @param iterations 反復回数です
     * @param residualMaxNorm 収束時の残差の最大絶対値です
     * @throws IllegalArgumentException state が null の場合に発生します
     */
    public SteadyState(StateLayout layout, double[] state, DerivativeResult derivative,
            int iterations, double residualMaxNorm) {
        if (state == null) {
            throw new IllegalArgumentException("state は null 不可です");
        }
        this.layout = layout;
        this.state = Arrays.copyOf(state, state.length);
        this.derivative = derivative;
        this.iterations = iterations;
        this.residualMaxNorm = residualMaxNorm;
    }

    /**
     * 状態ベクトルを返します。
     *
     * @return 状態ベクトルのコピーです
     */
    public double[] getState() {
        return Arrays.copyOf(state, state.length);
    }

    /**
     * 1 化学種のセル濃度分布を返します。
     *
     * @param species 化学種です
     * @return 長さ N の濃度配列（コピー）です
     */
    public double[] profile(Species species) {
        return layout.slice(state, species);
    }

    /**
     * 全化学種のセル濃度分布を返します。
     *
     * @return 化学種ごとの濃度配列です
     */
    public Map<Species, double[]> profiles() {
        Map<Species, double[]> profiles = new EnumMap<>(Species.class);
        for (Species s : Species.values()) {
            profiles.put(s, profile(s));
        }
        return profiles;
    }
}
