package io.github.yok.aquifer.core.solver;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.aquifer.core.grid.UniformGrid1D;
import io.github.yok.aquifer.core.linearalgebra.BlockTridiagonalMatrices;
import io.github.yok.aquifer.core.linearalgebra.BlockTridiagonalMatrix;
import io.github.yok.aquifer.core.model.AquiferDerivativeFunction;
import io.github.yok.aquifer.core.model.DerivativeFunction;
import io.github.yok.aquifer.core.model.NitrogenCycleKinetics;
import io.github.yok.aquifer.core.model.ParameterSet;
import io.github.yok.aquifer.core.model.ReactionKinetics.ReactionRates;
import io.github.yok.aquifer.core.model.UpwindTransportOperator;
import io.github.yok.aquifer.core.state.DerivativeResult;
import io.github.yok.aquifer.core.state.DerivativeResult.ReactionTotals;
import io.github.yok.aquifer.core.state.StateLayout;
import java.util.Collections;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@Slf4j
class FiniteDifferenceJacobianTest {

    @Test
    @DisplayName("線形関数 F = A·x + b: 差分ヤコビアンは A に一致する")
    void evaluate_linearFunction_shouldRecoverMatrix() {
        // ARRANGE
        int n = 8;
        BlockTridiagonalMatrix a = randomMatrix(n, 5, new Random(3L));
        DerivativeFunction linear = linearFunction(a);
        double[] x = randomState(linear.layout(), new Random(4L));
        double[] f = linear.evaluate(0.0, x).getDerivative();

        // ACT
        BlockTridiagonalMatrix j = new FiniteDifferenceJacobian(linear, false).evaluate(x, f);

        // ASSERT
        for (int c = 0; c < n; c++) {
            for (int r = 0; r < 5; r++) {
                for (int s = 0; s < 5; s++) {
                    assertEquals(a.getDiagonal()[c][r][s], j.getDiagonal()[c][r][s], 1e-5);
                    if (c > 0) {
                        assertEquals(a.getLower()[c][r][s], j.getLower()[c][r][s], 1e-5);
                    }
                    if (c < n - 1) {
                        assertEquals(a.getUpper()[c][r][s], j.getUpper()[c][r][s], 1e-5);
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("色分け差分は 1 列ずつの差分と一致し、並列評価でも結果は同じ")
    void evaluate_aquiferModel_coloredMatchesColumnwiseAndParallel() {
        // ARRANGE
        UniformGrid1D grid = new UniformGrid1D(14.0, 7);
        DerivativeFunction function = new AquiferDerivativeFunction(grid,
                ParameterSet.reference(), new UpwindTransportOperator(),
                new NitrogenCycleKinetics());
        StateLayout layout = function.layout();
        double[] x = randomState(layout, new Random(5L));
        double[] f = function.evaluate(0.0, x).getDerivative();

        // ACT
        BlockTridiagonalMatrix sequential =
                new FiniteDifferenceJacobian(function, false).evaluate(x, f);
        BlockTridiagonalMatrix parallel =
                new FiniteDifferenceJacobian(function, true).evaluate(x, f);

        // ASSERT
        double maxDiff = 0.0;
        for (int c = 0; c < 7; c++) {
            for (int s = 0; s < 5; s++) {
                int k = sequential.naturalIndex(c, s);
                double[] perturbed = x.clone();
                double h = 1.5e-8 * Math.max(Math.abs(x[k]), 1.0);
                perturbed[k] = x[k] + h;
                h = perturbed[k] - x[k];
                double[] fp = function.evaluate(0.0, perturbed).getDerivative();
                for (int r = 0; r < 5; r++) {
                    int row = sequential.naturalIndex(c, r);
                    double expected = (fp[row] - f[row]) / h;
                    double actual = sequential.getDiagonal()[c][r][s];
                    maxDiff = Math.max(maxDiff, Math.abs(expected - actual));
                    assertEquals(expected, actual, 1e-6 * Math.max(1.0, Math.abs(expected)));
                }
            }
        }
        log.info("1 列ずつの差分との最大差 = {}", maxDiff);

        for (int c = 0; c < 7; c++) {
            for (int r = 0; r < 5; r++) {
                assertArrayEquals(sequential.getDiagonal()[c][r], parallel.getDiagonal()[c][r],
                        0.0);
                assertArrayEquals(sequential.getLower()[c][r], parallel.getLower()[c][r], 0.0);
                assertArrayEquals(sequential.getUpper()[c][r], parallel.getUpper()[c][r], 0.0);
            }
        }
    }

    @Test
    @DisplayName("基準状態の F(x) の長さが不正なら IllegalArgumentException")
    void evaluate_wrongDerivativeLength_shouldThrow() {
        DerivativeFunction linear = linearFunction(new BlockTridiagonalMatrix(2, 5));
        FiniteDifferenceJacobian jacobian = new FiniteDifferenceJacobian(linear, false);

        assertThrows(IllegalArgumentException.class,
                () -> jacobian.evaluate(new double[10], new double[9]));
        assertThrows(NullPointerException.class, () -> new FiniteDifferenceJacobian(null, false));
    }

    static DerivativeFunction linearFunction(BlockTridiagonalMatrix a) {
        StateLayout layout = new StateLayout(a.getCellCount());
        return new DerivativeFunction() {
            @Override
            public StateLayout layout() {
                return layout;
            }

            @Override
            public DerivativeResult evaluate(double time, double[] state) {
                layout.requireSize(state);
                double[] f = BlockTridiagonalMatrices.multiply(a, state);
                for (int k = 0; k < f.length; k++) {
                    f[k] += 1.0 + 0.1 * k;
                }
                return new DerivativeResult(f, noRates(), new ReactionTotals(0.0, 0.0, 0.0, 0.0),
                        Collections.emptyMap());
            }
        };
    }

    static ReactionRates noRates() {
        return new ReactionRates(new double[0], new double[0], new double[0], new double[0]);
    }

    private static BlockTridiagonalMatrix randomMatrix(int n, int m, Random random) {
        BlockTridiagonalMatrix a = new BlockTridiagonalMatrix(n, m);
        for (int c = 0; c < n; c++) {
            for (int r = 0; r < m; r++) {
                for (int s = 0; s < m; s++) {
                    a.getDiagonal()[c][r][s] = 4.0 * random.nextDouble() - 2.0;
                    a.getLower()[c][r][s] = c > 0 ? 4.0 * random.nextDouble() - 2.0 : 0.0;
                    a.getUpper()[c][r][s] = c < n - 1 ? 4.0 * random.nextDouble() - 2.0 : 0.0;
                }
            }
        }
        return a;
    }

    private static double[] randomState(StateLayout layout, Random random) {
        double[] x = layout.zeros();
        for (int k = 0; k < x.length; k++) {
            x[k] = 100.0 * random.nextDouble();
        }
        return x;
    }
}
