package io.github.yok.aquifer.core.solver;

/**
 * 非負射影を行うと反復が停滞し、非負の状態のまま残差を減らせない場合に発生する例外です。
 */
public class NonPhysicalStateException extends SteadyStateSolveException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     * @param iterations 実行した反復回数です
     * @param lastResidualMaxNorm 最後の残差の最大絶対値です
     */
    public NonPhysicalStateException(String message, int iterations, double lastResidualMaxNorm) {
        super(message, iterations, lastResidualMaxNorm, null);
    }
}
