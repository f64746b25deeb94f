package io.github.yok.aquifer.app;

import io.github.yok.aquifer.core.budget.BudgetAggregator;
import io.github.yok.aquifer.core.budget.MassBalanceCalculator;
import io.github.yok.aquifer.core.grid.Grid;
import io.github.yok.aquifer.core.grid.UniformGrid1D;
import io.github.yok.aquifer.core.linearalgebra.EjmlSparseLuBackend;
import io.github.yok.aquifer.core.linearalgebra.LinearSystemBackend;
import io.github.yok.aquifer.core.model.AquiferDerivativeFunction;
import io.github.yok.aquifer.core.model.DerivativeFunction;
import io.github.yok.aquifer.core.model.NitrogenCycleKinetics;
import io.github.yok.aquifer.core.model.ParameterSet;
import io.github.yok.aquifer.core.model.ReactionKinetics;
import io.github.yok.aquifer.core.model.TransportOperator;
import io.github.yok.aquifer.core.model.UpwindTransportOperator;
import io.github.yok.aquifer.core.solver.FiniteDifferenceJacobian;
import io.github.yok.aquifer.core.solver.JacobianEvaluator;
import io.github.yok.aquifer.core.solver.SteadyStateSolver;
import io.github.yok.aquifer.core.state.RiverStateInitializer;
import io.github.yok.aquifer.core.state.StateVectorInitializer;
import io.github.yok.aquifer.core.state.ZeroStateInitializer;
import io.github.yok.aquifer.out.CsvResultWriter;
import io.github.yok.aquifer.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 1 次元帯水層の移流・分散・反応モデルと定常ソルバの Bean 定義を行う設定クラスです。
 *
 * <p>
 * 等間隔格子・風上差分輸送・窒素循環反応式を組み合わせた微分関数に、差分ヤコビアンと EJML 疎 LU を用いた定常ソルバ一式を組み立てます。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class SteadyStateConfiguration {

    /**
     * aquifer-solver の設定値（aquifer.*）です。
     */
    private final AquiferProperties p;

    /**
     * 格子を生成します。
     *
     * @return 格子です
     */
    @Bean
    public Grid grid() {
        return new UniformGrid1D(p.getGrid().getLength(), p.getGrid().getCellCount());
    }

    /**
     * パラメータセットを生成します。
     *
     * @return パラメータセットです
     */
    @Bean
    public ParameterSet parameterSet() {
        AquiferProperties.Parameters q = p.getParameters();
        return ParameterSet.builder()
                .aerobicMineralizationRate(q.getAerobicMineralizationRate())
                .denitrificationRate(q.getDenitrificationRate())
                .nitrificationRate(q.getNitrificationRate())
                .aerationRate(q.getAerationRate())
                .advectiveVelocity(q.getAdvectiveVelocity())
                .dispersivity(q.getDispersivity())
                .oxygenHalfSaturation(q.getOxygenHalfSaturation())
                .nitrateHalfSaturation(q.getNitrateHalfSaturation())
                .riverDon(q.getRiverDon())
                .riverOxygen(q.getRiverOxygen())
                .riverNitrate(q.getRiverNitrate())
                .riverAmmonia(q.getRiverAmmonia())
                .oxygenSolubility(q.getOxygenSolubility())
                .porosity(q.getPorosity())
                .build();
    }

    /**
     * 輸送演算子を生成します。
     *
     * @return 輸送演算子です
     */
    @Bean
    public TransportOperator transportOperator() {
        return new UpwindTransportOperator();
    }

    /**
     * 反応速度式を生成します。
     *
     * @return 反応速度式です
     */
    @Bean
    public ReactionKinetics reactionKinetics() {
        return new NitrogenCycleKinetics();
    }

    /**
     * 微分関数を生成します。
     *
     * @param grid 格子です
     * @param parameterSet パラメータセットです
     * @param transportOperator 輸送演算子です
     * @param reactionKinetics 反応速度式です
     * @return 微分関数です
     */
    @Bean
    public DerivativeFunction derivativeFunction(Grid grid, ParameterSet parameterSet,
            TransportOperator transportOperator, ReactionKinetics reactionKinetics) {
        return new AquiferDerivativeFunction(grid, parameterSet, transportOperator,
                reactionKinetics);
    }

    /**
     * 初期状態の生成ロジックを生成します。
     *
     * @param derivativeFunction 微分関数です（状態ベクトルの並びを参照します）
     * @param parameterSet パラメータセットです
     * @return 初期状態の生成ロジックです
     */
    @Bean
    public StateVectorInitializer stateVectorInitializer(DerivativeFunction derivativeFunction,
            ParameterSet parameterSet) {
        switch (p.getSolver().getInitialState()) {
            case RIVER:
                return new RiverStateInitializer(derivativeFunction.layout(), parameterSet);
            case ZERO:
            default:
                return new ZeroStateInitializer(derivativeFunction.layout());
        }
    }

    /**
     * ヤコビアン評価器を生成します。
     *
     * @param derivativeFunction 微分関数です
     * @return ヤコビアン評価器です
     */
    @Bean
    public JacobianEvaluator jacobianEvaluator(DerivativeFunction derivativeFunction) {
        return new FiniteDifferenceJacobian(derivativeFunction,
                p.getSolver().isParallelJacobian());
    }

    /**
     * 線形方程式バックエンドを生成します。
     *
     * @return 線形方程式バックエンドです
     */
    @Bean
    public LinearSystemBackend linearSystemBackend() {
        return new EjmlSparseLuBackend();
    }

    /**
     * 定常ソルバを生成します。
     *
     * @param derivativeFunction 微分関数です
     * @param jacobianEvaluator ヤコビアン評価器です
     * @param linearSystemBackend 線形方程式バックエンドです
     * @return 定常ソルバです
     */
    @Bean
    public SteadyStateSolver steadyStateSolver(DerivativeFunction derivativeFunction,
            JacobianEvaluator jacobianEvaluator, LinearSystemBackend linearSystemBackend) {
        return new SteadyStateSolver(derivativeFunction, jacobianEvaluator, linearSystemBackend,
                p.getSolver());
    }

    /**
     * 収支集計ロジックを生成します。
     *
     * @return 収支集計ロジックです
     */
    @Bean
    public BudgetAggregator budgetAggregator() {
        return new BudgetAggregator();
    }

    /**
     * 物質収支の閉合差の計算ロジックを生成します。
     *
     * @return 閉合差の計算ロジックです
     */
    @Bean
    public MassBalanceCalculator massBalanceCalculator() {
        return new MassBalanceCalculator();
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
