package io.github.yok.aquifer.core.linearalgebra;

import lombok.Getter;

/**
 * セル単位の小ブロック（化学種数×化学種数）からなるブロック三重対角行列です。
 *
 * <p>
 * 輸送は隣接セルのみ、反応は同一セル内の化学種間のみを結合するため、ヤコビアンはこの形になります。 行・列のベクトル表現は状態ベクトルと同じ化学種ブロック順（{@code species·N + cell}）です。
 * </p>
 *
 * <ul>
 * <li>{@code diagonal[c][r][s]} = ∂F(c, r)/∂x(c, s)</li>
 * <li>{@code lower[c][r][s]} = ∂F(c, r)/∂x(c−1, s)（c=0 では未使用）</li>
 * <li>{@code upper[c][r][s]} = ∂F(c, r)/∂x(c+1, s)（c=N−1 では未使用）</li>
 * </ul>
 */
@Getter
public final class BlockTridiagonalMatrix {

    /**
     * セル数 N です。
     */
    private final int cellCount;

    /**
     * ブロックサイズ（化学種数）です。
     */
    private final int blockSize;

    /**
     * 下側ブロックです。
     */
    private final double[][][] lower;

    /**
     * 対角ブロックです。
     */
    private final double[][][] diagonal;

    /**
     * 上側ブロックです。
     */
    private final double[][][] upper;

    /**
     * 全要素 0 の行列を生成します。
     *
     * @param cellCount セル数（1 以上）
     * @param blockSize ブロックサイズ（1 以上）
     * @throws IllegalArgumentException 引数が 1 未満の場合に発生します
     */
    public BlockTridiagonalMatrix(int cellCount, int blockSize) {
        if (cellCount <= 0) {
            throw new IllegalArgumentException("cellCount は 1 以上が必要です: " + cellCount);
        }
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blockSize は 1 以上が必要です: " + blockSize);
        }
        this.cellCount = cellCount;
        this.blockSize = blockSize;
        this.lower = new double[cellCount][blockSize][blockSize];
        this.diagonal = new double[cellCount][blockSize][blockSize];
        this.upper = new double[cellCount][blockSize][blockSize];
    }

    /**
     * 行列の次元（cellCount·blockSize）を返します。
     *
     * @return 次元です
     */
    public int dimension() {
        return cellCount * blockSize;
    }

    /**
     * 状態ベクトル（化学種ブロック順）での位置を返します。
     *
     * @param cell セル番号です
     * @param component ブロック内の成分番号（化学種）です
     * @return ベクトル内の位置です
     */
    public int naturalIndex(int cell, int component) {
        return component * cellCount + cell;
    }

    /**
     * セル内で成分を並べた順（{@code cell·blockSize + component}）での位置を返します。
     *
     * <p>
     * この順に並べると帯幅が {@code 2·blockSize − 1} に収まるため、疎 LU 分解のフィルインを抑えられます。
     * </p>
     *
     * @param cell セル番号です
     * @param component ブロック内の成分番号です
     * @return ベクトル内の位置です
     */
    public int interleavedIndex(int cell, int component) {
        return cell * blockSize + component;
    }

    /**
     * 全要素が有限値かどうかを判定します。
     *
     * @return 全要素が有限値なら true です
     */
    public boolean isFinite() {
        return allFinite(lower) && allFinite(diagonal) && allFinite(upper);
    }

    private static boolean allFinite(double[][][] blocks) {
        for (double[][] block : blocks) {
            for (double[] row : block) {
                for (double v : row) {
                    if (!Double.isFinite(v)) {
                        return false;
                    }
                }
            }
        }
        return true;
    }
}
