package io.github.yok.aquifer.core.model;

import io.github.yok.aquifer.core.state.DerivativeResult;
import io.github.yok.aquifer.core.state.StateLayout;

/**
 * 状態ベクトルから濃度変化率（時間微分）を計算する微分関数を表すインタフェースです。
 *
 * <p>
 * 定常ソルバはこの関数を残差関数（およびヤコビアンの差分元）として繰り返し呼び出します。 実装は純粋関数である必要があり、異なる状態ベクトルに対して並行に呼び出せることが前提です。
 * </p>
 */
public interface DerivativeFunction {

    /**
     * 状態ベクトルの並びを返します。
     *
     * @return 状態ベクトルの並びです
     */
    StateLayout layout();

    /**
     * 濃度変化率と診断量を計算します。
     *
     * @param time 時刻です（定常問題のため使用しません）
     * @param state 状態ベクトル（長さ 5N）です。変更しません
     * @return 評価結果です
     * @throws IllegalArgumentException 状態ベクトルの長さが不正な場合に発生します
     */
    DerivativeResult evaluate(double time, double[] state);
}
