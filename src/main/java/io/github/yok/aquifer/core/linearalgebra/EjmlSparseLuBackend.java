package io.github.yok.aquifer.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.interfaces.linsol.LinearSolverSparse;
import org.ejml.ops.DConvertMatrixStruct;
import org.ejml.sparse.FillReducing;
import org.ejml.sparse.csc.factory.LinearSolverFactory_DSCC;

/**
 * EJML の疎行列（CSC 形式）LU 分解で、ブロック三重対角系を解くクラスです。
 *
 * <p>
 * 行・列をセル内インタリーブ順（{@code cell·m + species}）に並べ替えてから組み立てるため、 行列は帯幅 2m−1 の帯行列となり、並べ替えなし（
 * {@link FillReducing#NONE}）でもフィルインは帯内に収まります。
 * </p>
 */
public final class EjmlSparseLuBackend implements LinearSystemBackend {

    @Override
    public double[] solveShifted(BlockTridiagonalMatrix jacobian, double shift, double[] rhs) {
        if (jacobian == null) {
            throw new IllegalArgumentException("jacobian は null 不可です");
        }
        if (rhs == null || rhs.length != jacobian.dimension()) {
            throw new IllegalArgumentException("rhs の長さが行列の次元と一致しません: "
                    + (rhs == null ? "null" : rhs.length) + " vs " + jacobian.dimension());
        }
        if (!(shift >= 0.0) || !Double.isFinite(shift)) {
            throw new IllegalArgumentException("shift は 0 以上の有限値が必要です: " + shift);
        }

        int n = jacobian.getCellCount();
        int m = jacobian.getBlockSize();
        int dim = jacobian.dimension();

        // (shift·I − J) を CSC 形式に組み立てます。
        DMatrixSparseCSC matrix = assemble(jacobian, shift);

        // 右辺をインタリーブ順に並べ替えます。
        DMatrixRMaj b = new DMatrixRMaj(dim, 1);
        for (int c = 0; c < n; c++) {
            for (int s = 0; s < m; s++) {
                b.set(jacobian.interleavedIndex(c, s), 0, rhs[jacobian.naturalIndex(c, s)]);
            }
        }

        LinearSolverSparse<DMatrixSparseCSC, DMatrixRMaj> solver =
                LinearSolverFactory_DSCC.lu(FillReducing.NONE);
        if (!solver.setA(matrix)) {
            throw new IllegalStateException("疎 LU 分解に失敗しました（EJML、行列が特異の可能性があります）");
        }

        DMatrixRMaj x = new DMatrixRMaj(dim, 1);
        solver.solve(b, x);

        // 化学種ブロック順に戻します。
        double[] result = new double[dim];
        for (int c = 0; c < n; c++) {
            for (int s = 0; s < m; s++) {
                double v = x.get(jacobian.interleavedIndex(c, s), 0);
                if (!Double.isFinite(v)) {
                    throw new IllegalStateException(
                            "線形方程式の解に有限でない値が含まれます: cell=" + c + ", component=" + s);
                }
                result[jacobian.naturalIndex(c, s)] = v;
            }
        }
        return result;
    }

    /**
     * {@code shift·I − J} をインタリーブ順の CSC 行列として組み立てます。
     *
     * <p>
     * 各 (行, 列) は 1 度だけ追加します（三つ組の重複を作りません）。対角要素は 0 でも必ず格納します。
     * </p>
     *
     * @param jacobian ヤコビアンです
     * @param shift 対角シフトです
     * @return CSC 行列です
     */
    private static DMatrixSparseCSC assemble(BlockTridiagonalMatrix jacobian, double shift) {
        int n = jacobian.getCellCount();
        int m = jacobian.getBlockSize();
        int dim = jacobian.dimension();

        double[][][] lower = jacobian.getLower();
        double[][][] diagonal = jacobian.getDiagonal();
        double[][][] upper = jacobian.getUpper();

        DMatrixSparseTriplet triplet = new DMatrixSparseTriplet(dim, dim, 3 * n * m * m);
        for (int c = 0; c < n; c++) {
            for (int r = 0; r < m; r++) {
                int row = jacobian.interleavedIndex(c, r);
                for (int s = 0; s < m; s++) {
                    double d = -diagonal[c][r][s];
                    if (r == s) {
                        triplet.addItem(row, jacobian.interleavedIndex(c, s), d + shift);
                    } else if (d != 0.0) {
                        triplet.addItem(row, jacobian.interleavedIndex(c, s), d);
                    }
                    if (c > 0 && lower[c][r][s] != 0.0) {
                        triplet.addItem(row, jacobian.interleavedIndex(c - 1, s),
                                -lower[c][r][s]);
                    }
                    if (c < n - 1 && upper[c][r][s] != 0.0) {
                        triplet.addItem(row, jacobian.interleavedIndex(c + 1, s),
                                -upper[c][r][s]);
                    }
                }
            }
        }
        return DConvertMatrixStruct.convert(triplet, (DMatrixSparseCSC) null);
    }
}
