package io.github.yok.aquifer.core.solver;

import lombok.Getter;

/**
 * 定常ソルバの求解失敗を表す例外の基底クラスです。
 *
 * <p>
 * 失敗時に途中の状態ベクトルは返しません。呼び出し側は初期値や許容誤差を変えて再試行できます。
 * </p>
 */
@Getter
public abstract class SteadyStateSolveException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 失敗までに実行した反復回数です。
     */
    private final int iterations;

    /**
     * 最後に評価できた残差の最大絶対値です（評価できなかった場合は NaN）。
     */
    private final double lastResidualMaxNorm;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     * @param iterations 実行した反復回数です
     * @param lastResidualMaxNorm 最後の残差の最大絶対値です
     * @param cause 原因です（null 可）
     */
    protected SteadyStateSolveException(String message, int iterations,
            double lastResidualMaxNorm, Throwable cause) {
        super(message, cause);
        this.iterations = iterations;
        this.lastResidualMaxNorm = lastResidualMaxNorm;
    }
}
