package io.github.yok.aquifer.core.solver;

/**
 * 反復回数の上限に達しても残差が許容誤差を満たさなかった場合に発生する例外です。
 */
public class NonConvergenceException extends SteadyStateSolveException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     * @param iterations 実行した反復回数です
     * @param lastResidualMaxNorm 最後の残差の最大絶対値です
     */
    public NonConvergenceException(String message, int iterations, double lastResidualMaxNorm) {
        super(message, iterations, lastResidualMaxNorm, null);
    }
}
