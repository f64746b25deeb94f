package io.github.yok.aquifer.core.state;

import io.github.yok.aquifer.core.model.Species;
import java.util.Arrays;
import lombok.Value;

/**
 * 状態ベクトル（長さ 5N）の並びを表すクラスです。
 *
 * <p>
 * 状態ベクトルは化学種ごとの長さ N の配列を {@link Species} の宣言順に連結したもの（化学種ブロック順、セル非インタリーブ）です。 化学種 s・セル i
 * の成分は {@code s.index()·N + i} にあります。
 * </p>
 */
@Value
public class StateLayout {

    /**
     * セル数 N です。
     */
    int cellCount;

    /**
     * 並びを生成します。
     *
     * @param cellCount セル数 N（1 以上）
     * @throws IllegalArgumentException cellCount が 1 未満の場合に発生します
     */
    public StateLayout(int cellCount) {
        if (cellCount <= 0) {
            throw new IllegalArgumentException("cellCount は 1 以上が必要です: " + cellCount);
        }
        this.cellCount = cellCount;
    }

    /**
     * 化学種数を返します。
     *
     * @return 化学種数です
     */
    public int speciesCount() {
        return Species.count();
    }

    /**
     * 状態ベクトルの長さ 5N を返します。
     *
     * @return 状態ベクトルの長さです
     */
    public int size() {
        return speciesCount() * cellCount;
    }

    /**
     * 化学種 s・セル i の成分位置を返します。
     *
     * @param species 化学種です
     * @param cell セル番号（0 始まり）です
     * @return 状態ベクトル内の位置です
     */
    public int index(Species species, int cell) {
        return species.index() * cellCount + cell;
    }

    /**
     * 状態ベクトルから 1 化学種の配列を切り出します（コピー）。
     *
     * @param state 状態ベクトルです
     * @param species 化学種です
     * @return 長さ N の配列です
     * @throws IllegalArgumentException 状態ベクトルの長さが不正な場合に発生します
     */
    public double[] slice(double[] state, Species species) {
        requireSize(state);
        int from = species.index() * cellCount;
        return Arrays.copyOfRange(state, from, from + cellCount);
    }

    /**
     * 1 化学種の配列を状態ベクトルへ書き込みます。
     *
     * @param state 書き込み先の状態ベクトルです
     * @param species 化学種です
     * @param values 長さ N の配列です
     * @throws IllegalArgumentException 配列長が不正な場合に発生します
     */
    public void put(double[] state, Species species, double[] values) {
        requireSize(state);
        if (values == null || values.length != cellCount) {
            throw new IllegalArgumentException("values の長さが N と一致しません: "
                    + (values == null ? "null" : values.length) + " vs " + cellCount);
        }
        System.arraycopy(values, 0, state, species.index() * cellCount, cellCount);
    }

    /**
     * 全成分 0 の状態ベクトルを生成します。
     *
     * @return 状態ベクトルです
     */
    public double[] zeros() {
        return new double[size()];
    }

    /**
     * 状態ベクトルの長さが 5N であることを検証します。
     *
     * @param state 状態ベクトルです
     * @throws IllegalArgumentException null または長さ不一致の場合に発生します
     */
    public void requireSize(double[] state) {
        if (state == null) {
            throw new IllegalArgumentException("state は null 不可です");
        }
        if (state.length != size()) {
            throw new IllegalArgumentException(
                    "state の長さが 5N と一致しません: " + state.length + " vs " + size());
        }
    }
}
