package io.github.yok.aquifer.core.linearalgebra;

/**
 * ニュートン反復の線形方程式を解くバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリや分解法（疎 LU、帯行列 LU など）を差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface LinearSystemBackend {

    /**
     * 対角シフト付きの線形方程式 {@code (shift·I − J)·x = rhs} を解きます。
     *
     * <p>
     * shift = 0 のとき純粋なニュートン方程式 {@code −J·x = rhs} です。
     * </p>
     *
     * @param jacobian ヤコビアン J です
     * @param shift 対角シフト（0 以上）です
     * @param rhs 右辺ベクトル（化学種ブロック順）です
     * @return 解ベクトル（化学種ブロック順）です
     * @throws IllegalArgumentException 引数の次元が不正な場合に発生します
     * @throws IllegalStateException 分解または求解に失敗した場合に発生します
     */
    double[] solveShifted(BlockTridiagonalMatrix jacobian, double shift, double[] rhs);
}
