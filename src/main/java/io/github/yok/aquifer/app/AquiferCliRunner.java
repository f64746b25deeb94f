package io.github.yok.aquifer.app;

import io.github.yok.aquifer.core.budget.BudgetAggregator;
import io.github.yok.aquifer.core.budget.MassBalanceCalculator;
import io.github.yok.aquifer.core.grid.Grid;
import io.github.yok.aquifer.core.model.ParameterSet;
import io.github.yok.aquifer.core.model.Species;
import io.github.yok.aquifer.core.solver.SteadyStateSolveException;
import io.github.yok.aquifer.core.solver.SteadyStateSolver;
import io.github.yok.aquifer.core.state.RiverStateInitializer;
import io.github.yok.aquifer.core.state.StateLayout;
import io.github.yok.aquifer.core.state.StateVectorInitializer;
import io.github.yok.aquifer.core.state.SteadyState;
import io.github.yok.aquifer.out.ResultWriter;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で aquifer-solver を実行するクラスです。
 *
 * <p>
 * 初期状態から定常解を求め、収支表と物質収支の閉合差を表示したうえで CSV に出力します。
 * </p>
 *
 * <p>
 * 定常解が求まらない場合は上流端濃度の一様分布から 1 回だけ再試行します。再試行でも求まらなければエラーを記録し、何も出力せずに終了します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AquiferCliRunner implements CommandLineRunner {

    /**
     * aquifer-solver の設定値（aquifer.*）です。
     */
    private final AquiferProperties properties;

    /**
     * 格子です。
     */
    private final Grid grid;

    /**
     * パラメータセットです。
     */
    private final ParameterSet parameterSet;

    /**
     * 初期状態の生成ロジックです。
     */
    private final StateVectorInitializer stateVectorInitializer;

    /**
     * 定常ソルバです。
     */
    private final SteadyStateSolver steadyStateSolver;

    /**
     * 収支集計ロジックです。
     */
    private final BudgetAggregator budgetAggregator;

    /**
     * 物質収支の閉合差の計算ロジックです。
     */
    private final MassBalanceCalculator massBalanceCalculator;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== aquifer-solver start: steady-state advection-dispersion-reaction ===");
        System.out.print(properties.toMultilineString());

        System.out.println("入力: L=" + fmt5(grid.length()) + ", N=" + grid.cellCount() + ", dx="
                + fmt5(grid.cellWidth()) + ", 初期状態="
                + properties.getSolver().getInitialState());

        SteadyState steadyState = solve();
        if (steadyState == null) {
            return;
        }

        Map<String, Double> budget = budgetAggregator.aggregate(steadyState);
        Map<Species, Double> closures =
                massBalanceCalculator.closures(steadyState.getDerivative());

        resultWriter.write(steadyState, grid, budget, closures);

        System.out.println("結果: iterations=" + steadyState.getIterations() + ", 残差max="
                + fmt5e(steadyState.getResidualMaxNorm()));
        for (Map.Entry<String, Double> e : budget.entrySet()) {
            System.out.println("収支: " + e.getKey() + "=" + fmt5(e.getValue()));
        }
        for (Map.Entry<Species, Double> e : closures.entrySet()) {
            System.out.println("閉合差: " + e.getKey() + "=" + fmt5e(e.getValue()));
        }
    }

    /**
     * 定常解を求めます。設定した初期状態で失敗した場合は上流端濃度の一様分布から再試行します。
     *
     * @return 定常状態です（再試行でも求まらなかった場合は null）
     */
    private SteadyState solve() {
        try {
            return steadyStateSolver.solve(stateVectorInitializer.create());
        } catch (SteadyStateSolveException e) {
            logFailure(e);
            if (properties.getSolver()
                    .getInitialState() == AquiferProperties.Solver.InitialState.RIVER) {
                return null;
            }
        }

        log.warn("初期状態を上流端濃度（RIVER）に切り替えて再試行します");
        StateVectorInitializer river =
                new RiverStateInitializer(new StateLayout(grid.cellCount()), parameterSet);
        try {
            return steadyStateSolver.solve(river.create());
        } catch (SteadyStateSolveException e) {
            logFailure(e);
            return null;
        }
    }

    /**
     * 定常解が求まらなかったことを記録します。
     *
     * @param e 求解失敗の例外です
     */
    private static void logFailure(SteadyStateSolveException e) {
        log.error("定常解が求まりませんでした（{}）：{}（反復回数={}、残差max={}）",
                e.getClass().getSimpleName(), e.getMessage(), e.getIterations(),
                fmt5e(e.getLastResidualMaxNorm()));
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    /**
     * 数値を指数表記（仮数部 小数点以下5桁）に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5e(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }
}
