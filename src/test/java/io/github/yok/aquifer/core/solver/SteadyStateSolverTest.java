package io.github.yok.aquifer.core.solver;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.aquifer.app.AquiferProperties;
import io.github.yok.aquifer.core.budget.MassBalanceCalculator;
import io.github.yok.aquifer.core.grid.UniformGrid1D;
import io.github.yok.aquifer.core.linearalgebra.EjmlSparseLuBackend;
import io.github.yok.aquifer.core.model.AquiferDerivativeFunction;
import io.github.yok.aquifer.core.model.DerivativeFunction;
import io.github.yok.aquifer.core.model.NitrogenCycleKinetics;
import io.github.yok.aquifer.core.model.ParameterSet;
import io.github.yok.aquifer.core.model.Species;
import io.github.yok.aquifer.core.model.UpwindTransportOperator;
import io.github.yok.aquifer.core.state.DerivativeResult;
import io.github.yok.aquifer.core.state.DerivativeResult.ReactionTotals;
import io.github.yok.aquifer.core.state.RiverStateInitializer;
import io.github.yok.aquifer.core.state.StateLayout;
import io.github.yok.aquifer.core.state.SteadyState;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@Slf4j
class SteadyStateSolverTest {

    private AquiferProperties.Solver settings;

    @BeforeEach
    void setUp() {
        settings = new AquiferProperties.Solver();
    }

    private SteadyStateSolver solverFor(DerivativeFunction function) {
        return new SteadyStateSolver(function, new FiniteDifferenceJacobian(function, false),
                new EjmlSparseLuBackend(), settings);
    }

    private static AquiferDerivativeFunction model(double length, int cellCount,
            ParameterSet parameters) {
        return new AquiferDerivativeFunction(new UniformGrid1D(length, cellCount), parameters,
                new UpwindTransportOperator(), new NitrogenCycleKinetics());
    }

    @Test
    @DisplayName("基準シナリオ（L=500, N=500）: ゼロ状態から収束し、残差・非負性・物理的な形状を満たす")
    void solve_referenceScenario_shouldConvergeToPhysicalState() {
        // ARRANGE
        ParameterSet p = ParameterSet.reference();
        AquiferDerivativeFunction function = model(500.0, 500, p);
        StateLayout layout = function.layout();

        // ACT
        SteadyState steady = solverFor(function).solve(layout.zeros());
        log.info("反復回数 = {}, 残差max = {}", steady.getIterations(),
                steady.getResidualMaxNorm());

        // ASSERT: 残差
        double[] x = steady.getState();
        double[] f = function.evaluate(0.0, x).getDerivative();
        for (int k = 0; k < x.length; k++) {
            assertTrue(Math.abs(f[k]) <= 1e-10 + 1e-10 * Math.abs(x[k]),
                    "residual at " + k + " = " + f[k]);
            assertTrue(x[k] >= 0.0);
        }

        // DON は流下方向に単調減少
        double[] don = steady.profile(Species.DON);
        for (int i = 1; i < don.length; i++) {
            assertTrue(don[i] <= don[i - 1] + 1e-6, "DON increases at cell " + i);
        }
        assertTrue(don[0] < p.getRiverDon());

        // O2 は [0, O2_sol]
        for (double o2 : steady.profile(Species.O2)) {
            assertTrue(o2 >= 0.0 && o2 <= p.getOxygenSolubility());
        }

        // 反応総量は非負
        ReactionTotals totals = steady.getDerivative().getTotals();
        assertTrue(totals.getAerobicMineralization() >= 0.0);
        assertTrue(totals.getDenitrification() >= 0.0);
        assertTrue(totals.getNitrification() >= 0.0);
        assertTrue(totals.getAeration() >= 0.0);

        // 定常状態では物質収支の閉合差はほぼ 0
        Map<Species, Double> closures =
                new MassBalanceCalculator().closures(steady.getDerivative());
        for (Map.Entry<Species, Double> e : closures.entrySet()) {
            log.info("閉合差 {} = {}", e.getKey(), e.getValue());
            assertEquals(0.0, e.getValue(), 1e-6);
        }
    }

    @Test
    @DisplayName("河川水濃度の初期状態からでも同じ定常解に収束する")
    void solve_fromRiverState_shouldReachSameSolution() {
        ParameterSet p = ParameterSet.reference();
        AquiferDerivativeFunction function = model(100.0, 50, p);
        SteadyStateSolver solver = solverFor(function);

        SteadyState fromZero = solver.solve(function.layout().zeros());
        SteadyState fromRiver =
                solver.solve(new RiverStateInitializer(function.layout(), p).create());

        assertArrayEquals(fromZero.getState(), fromRiver.getState(), 1e-5);
    }

    @Test
    @DisplayName("境界条件: 分散が小さく格子が細かいと、上流端セルは河川水濃度に近く、下流端は勾配が 0 に近い")
    void solve_fineGridSmallDispersion_shouldHonourBoundaryConditions() {
        // ARRANGE
        ParameterSet p = ParameterSet.reference().toBuilder().dispersivity(0.1).build();
        AquiferDerivativeFunction function = model(100.0, 1000, p);

        // ACT
        SteadyState steady = solverFor(function).solve(function.layout().zeros());

        // ASSERT
        for (Species s : Species.values()) {
            double[] c = steady.profile(s);
            double scale = Math.max(s.riverConcentration(p),
                    Arrays.stream(c).max().orElse(0.0));
            int n = c.length;
            log.info("{}: C[0]={}, 河川水={}, C[N-2]={}, C[N-1]={}", s, c[0],
                    s.riverConcentration(p), c[n - 2], c[n - 1]);
            assertEquals(s.riverConcentration(p), c[0], 0.05 * scale + 1e-9);
            assertEquals(c[n - 2], c[n - 1], 0.01 * scale + 1e-9);
        }
    }

    @Test
    @DisplayName("格子細分化: 粗い格子と細かい格子の差は細分化ごとに縮小する（1次精度）")
    void solve_gridRefinement_shouldConverge() {
        ParameterSet p = ParameterSet.reference();
        double[][] coarse = solveProfiles(p, 50);
        double[][] medium = solveProfiles(p, 100);
        double[][] fine = solveProfiles(p, 200);

        double diff1 = maxDifferenceToPairAverages(coarse, medium);
        double diff2 = maxDifferenceToPairAverages(medium, fine);
        log.info("N=50→100 の差 = {}, N=100→200 の差 = {}", diff1, diff2);

        assertTrue(diff1 > 0.0);
        assertTrue(diff2 <= 0.75 * diff1);
    }

    @Test
    @DisplayName("最大反復回数が少なすぎると NonConvergenceException（途中状態は返さない）")
    void solve_tooFewIterations_shouldThrowNonConvergence() {
        settings.setMaxIterations(2);
        AquiferDerivativeFunction function = model(100.0, 50, ParameterSet.reference());

        NonConvergenceException e = assertThrows(NonConvergenceException.class,
                () -> solverFor(function).solve(function.layout().zeros()));

        assertEquals(2, e.getIterations());
        assertTrue(e.getLastResidualMaxNorm() > 0.0);
    }

    @Test
    @DisplayName("残差に NaN が現れると NumericalInstabilityException")
    void solve_nanResidual_shouldThrowNumericalInstability() {
        DerivativeFunction nan = constantFunction(new StateLayout(4), Double.NaN);

        assertThrows(NumericalInstabilityException.class,
                () -> solverFor(nan).solve(nan.layout().zeros()));
    }

    @Test
    @DisplayName("根が負の領域にしかない F = −1 − x は非負射影で停滞し NonPhysicalStateException")
    void solve_negativeRoot_shouldThrowNonPhysicalState() {
        StateLayout layout = new StateLayout(3);
        DerivativeFunction negativeRoot = new DerivativeFunction() {
            @Override
            public StateLayout layout() {
                return layout;
            }

            @Override
            public DerivativeResult evaluate(double time, double[] state) {
                double[] f = new double[state.length];
                for (int k = 0; k < f.length; k++) {
                    f[k] = -1.0 - state[k];
                }
                return result(f);
            }
        };

        NonPhysicalStateException e = assertThrows(NonPhysicalStateException.class,
                () -> solverFor(negativeRoot).solve(layout.zeros()));

        assertEquals(settings.getMaxStalledProjections(), e.getIterations());
    }

    @Test
    @DisplayName("初期状態の長さ不正・不正な設定は IllegalArgumentException")
    void solve_invalidInput_shouldThrow() {
        AquiferDerivativeFunction function = model(10.0, 5, ParameterSet.reference());
        SteadyStateSolver solver = solverFor(function);

        assertThrows(IllegalArgumentException.class, () -> solver.solve(new double[24]));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(null));

        settings.setAbsoluteTolerance(0.0);
        assertThrows(IllegalArgumentException.class, () -> solverFor(function));
    }

    private double[][] solveProfiles(ParameterSet p, int cellCount) {
        AquiferDerivativeFunction function = model(100.0, cellCount, p);
        SteadyState steady = solverFor(function).solve(function.layout().zeros());
        double[][] profiles = new double[Species.count()][];
        for (Species s : Species.values()) {
            profiles[s.index()] = steady.profile(s);
        }
        return profiles;
    }

    private static double maxDifferenceToPairAverages(double[][] coarse, double[][] fine) {
        double max = 0.0;
        for (int s = 0; s < coarse.length; s++) {
            for (int i = 0; i < coarse[s].length; i++) {
                double average = 0.5 * (fine[s][2 * i] + fine[s][2 * i + 1]);
                max = Math.max(max, Math.abs(coarse[s][i] - average));
            }
        }
        return max;
    }

    private static DerivativeFunction constantFunction(StateLayout layout, double value) {
        return new DerivativeFunction() {
            @Override
            public StateLayout layout() {
                return layout;
            }

            @Override
            public DerivativeResult evaluate(double time, double[] state) {
                double[] f = new double[state.length];
                Arrays.fill(f, value);
                return result(f);
            }
        };
    }

    private static DerivativeResult result(double[] derivative) {
        return new DerivativeResult(derivative, FiniteDifferenceJacobianTest.noRates(),
                new ReactionTotals(0.0, 0.0, 0.0, 0.0), Collections.emptyMap());
    }
}
