package io.github.yok.aquifer.core.solver;

/**
 * 残差・ヤコビアン・線形方程式の解に NaN や無限大が現れた場合、または線形方程式が解けない場合に発生する例外です。
 */
public class NumericalInstabilityException extends SteadyStateSolveException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     * @param iterations 実行した反復回数です
     * @param lastResidualMaxNorm 最後の残差の最大絶対値です
     */
    public NumericalInstabilityException(String message, int iterations,
            double lastResidualMaxNorm) {
        super(message, iterations, lastResidualMaxNorm, null);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message 詳細メッセージです
     * @param iterations 実行した反復回数です
     * @param lastResidualMaxNorm 最後の残差の最大絶対値です
     * @param cause 原因です
     */
    public NumericalInstabilityException(String message, int iterations,
            double lastResidualMaxNorm, Throwable cause) {
        super(message, iterations, lastResidualMaxNorm, cause);
    }
}
