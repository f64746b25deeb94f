package io.github.yok.aquifer.core.linearalgebra;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@Slf4j
class EjmlSparseLuBackendTest {

    private EjmlSparseLuBackend backend;

    @BeforeEach
    void setUp() {
        backend = new EjmlSparseLuBackend();
    }

    @Test
    @DisplayName("1×1: (0 − (−2))·x = 4 の解は 2")
    void solveShifted_scalar_shouldSolve() {
        BlockTridiagonalMatrix j = new BlockTridiagonalMatrix(1, 1);
        j.getDiagonal()[0][0][0] = -2.0;

        double[] x = backend.solveShifted(j, 0.0, new double[] {4.0});

        assertArrayEquals(new double[] {2.0}, x, 1e-14);
    }

    @Test
    @DisplayName("ランダムなブロック三重対角系: 密行列 LU の解と一致し、残差が十分小さい")
    void solveShifted_randomSystem_shouldMatchDenseSolve() {
        // ARRANGE
        int n = 12;
        int m = 5;
        double shift = 0.5;
        BlockTridiagonalMatrix j = randomDiagonallyDominant(n, m, new Random(11L));
        double[] rhs = new double[j.dimension()];
        Random random = new Random(12L);
        for (int k = 0; k < rhs.length; k++) {
            rhs[k] = random.nextDouble() - 0.5;
        }

        // ACT
        double[] x = backend.solveShifted(j, shift, rhs);

        // ASSERT: (shift·I − J)·x = rhs
        double[] jx = BlockTridiagonalMatrices.multiply(j, x);
        double residual = 0.0;
        for (int k = 0; k < rhs.length; k++) {
            residual = Math.max(residual, Math.abs(shift * x[k] - jx[k] - rhs[k]));
        }
        log.info("残差max = {}", residual);
        assertTrue(residual < 1e-12);

        // 密行列（化学種ブロック順）で解き直して比較
        DMatrixRMaj a = toDense(j, shift);
        DMatrixRMaj b = new DMatrixRMaj(rhs.length, 1, true, rhs);
        DMatrixRMaj dense = new DMatrixRMaj(rhs.length, 1);
        assertTrue(CommonOps_DDRM.solve(a, b, dense));
        for (int k = 0; k < rhs.length; k++) {
            assertEquals(dense.get(k, 0), x[k], 1e-11);
        }
    }

    @Test
    @DisplayName("右辺の長さ不一致・負のシフトは IllegalArgumentException")
    void solveShifted_invalidInput_shouldThrow() {
        BlockTridiagonalMatrix j = new BlockTridiagonalMatrix(3, 2);

        assertThrows(IllegalArgumentException.class,
                () -> backend.solveShifted(j, 1.0, new double[5]));
        assertThrows(IllegalArgumentException.class,
                () -> backend.solveShifted(j, -1.0, new double[6]));
        assertThrows(IllegalArgumentException.class,
                () -> backend.solveShifted(null, 1.0, new double[6]));
    }

    private static BlockTridiagonalMatrix randomDiagonallyDominant(int n, int m, Random random) {
        BlockTridiagonalMatrix j = new BlockTridiagonalMatrix(n, m);
        for (int c = 0; c < n; c++) {
            for (int r = 0; r < m; r++) {
                for (int s = 0; s < m; s++) {
                    j.getDiagonal()[c][r][s] = random.nextDouble() - 0.5;
                    j.getLower()[c][r][s] = c > 0 ? random.nextDouble() - 0.5 : 0.0;
                    j.getUpper()[c][r][s] = c < n - 1 ? random.nextDouble() - 0.5 : 0.0;
                }
                // 負の対角優位（反応・分散の安定な系に相当）
                j.getDiagonal()[c][r][r] = -4.0 * m;
            }
        }
        return j;
    }

    private static DMatrixRMaj toDense(BlockTridiagonalMatrix j, double shift) {
        int n = j.getCellCount();
        int m = j.getBlockSize();
        DMatrixRMaj a = new DMatrixRMaj(j.dimension(), j.dimension());
        for (int c = 0; c < n; c++) {
            for (int r = 0; r < m; r++) {
                int row = j.naturalIndex(c, r);
                a.add(row, row, shift);
                for (int s = 0; s < m; s++) {
                    a.add(row, j.naturalIndex(c, s), -j.getDiagonal()[c][r][s]);
                    if (c > 0) {
                        a.add(row, j.naturalIndex(c - 1, s), -j.getLower()[c][r][s]);
                    }
                    if (c < n - 1) {
                        a.add(row, j.naturalIndex(c + 1, s), -j.getUpper()[c][r][s]);
                    }
                }
            }
        }
        return a;
    }
}
