package io.github.yok.aquifer.core.solver;

import io.github.yok.aquifer.app.AquiferProperties;
import io.github.yok.aquifer.core.linearalgebra.BlockTridiagonalMatrix;
import io.github.yok.aquifer.core.linearalgebra.LinearSystemBackend;
import io.github.yok.aquifer.core.model.DerivativeFunction;
import io.github.yok.aquifer.core.state.DerivativeResult;
import io.github.yok.aquifer.core.state.StateLayout;
import io.github.yok.aquifer.core.state.SteadyState;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 微分関数の値を 0 に近づけて定常状態を求めるソルバです。
 *
 * <p>
 * 擬似時間継続法（pseudo-transient continuation）による減衰付きニュートン法です。 各反復で {@code (I/Δτ − J)·δ = F}
 * を解き、更新後の負の成分を 0 に射影します。 Δτ は受理したステップごとに増やし、十分大きくなると純粋なニュートン法として 2 次収束します。
 * </p>
 *
 * <ul>
 * <li>残差ノルムが {@code maxResidualGrowth} 倍を超えて増えた、または有限でないステップは棄却し、Δτ を 1/4 にして再試行します</li>
 * <li>収束判定は全成分で {@code |F_i| <= atol + rtol·|C_i|} です</li>
 * <li>失敗時は {@link NonConvergenceException}・{@link NonPhysicalStateException}・
 * {@link NumericalInstabilityException} のいずれかを送出し、途中の状態は返しません</li>
 * </ul>
 *
 * <p>
 * 求解ごとの作業ベクトルはメソッド内に閉じており、同じインスタンスを異なる初期状態で並行に使えます。
 * </p>
 */
@Getter
@Slf4j
public final class SteadyStateSolver {

    /**
     * ステップ棄却時に Δτ に掛ける係数です。
     */
    private static final double REJECTION_FACTOR = 0.25;

    /**
     * 1 ステップでの Δτ の最大増加率です。
     */
    private static final double MAX_GROWTH_PER_STEP = 1e3;

    /**
     * 微分関数（残差関数）です。
     */
    private final DerivativeFunction function;

    /**
     * ヤコビアン評価器です。
     */
    private final JacobianEvaluator jacobianEvaluator;

    /**
     * 線形方程式バックエンドです。
     */
    private final LinearSystemBackend linearSystemBackend;

    /**
     * 最大反復回数です。
     */
    private final int maxIterations;

    /**
     * 残差の絶対許容誤差です。
     */
    private final double absoluteTolerance;

    /**
     * 残差の相対許容誤差です。
     */
    private final double relativeTolerance;

    /**
     * 擬似時間刻みの初期値です。
     */
    private final double initialPseudoTimeStep;

    /**
     * 受理ステップでの擬似時間刻みの最小増加率です。
     */
    private final double pseudoTimeStepGrowth;

    /**
     * 擬似時間刻みの上限です。
     */
    private final double maxPseudoTimeStep;

    /**
     * 擬似時間刻みの下限です。
     */
    private final double minPseudoTimeStep;

    /**
     * 1 ステップで許容する残差ノルムの増加倍率です。
     */
    private final double maxResidualGrowth;

    /**
     * 非負射影で停滞した反復の連続許容回数です。
     */
    private final int maxStalledProjections;

    /**
     * 定常ソルバを生成します。
     *
     * @param function 微分関数です（null 不可）
     * @param jacobianEvaluator ヤコビアン評価器です（null 不可）
     * @param linearSystemBackend 線形方程式バックエンドです（null 不可）
     * @param settings ソルバ設定です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public SteadyStateSolver(DerivativeFunction function, JacobianEvaluator jacobianEvaluator,
            LinearSystemBackend linearSystemBackend, AquiferProperties.Solver settings) {

        if (function == null) {
            throw new IllegalArgumentException("function は null 不可です");
        }
        if (jacobianEvaluator == null) {
            throw new IllegalArgumentException("jacobianEvaluator は null 不可です");
        }
        if (linearSystemBackend == null) {
            throw new IllegalArgumentException("linearSystemBackend は null 不可です");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings は null 不可です");
        }

        int maxIter = settings.getMaxIterations();
        double atol = settings.getAbsoluteTolerance();
        double rtol = settings.getRelativeTolerance();
        double dt0 = settings.getInitialPseudoTimeStep();
        double growth = settings.getPseudoTimeStepGrowth();
        double dtMax = settings.getMaxPseudoTimeStep();
        double dtMin = settings.getMinPseudoTimeStep();
        double residualGrowth = settings.getMaxResidualGrowth();
        int maxStalled = settings.getMaxStalledProjections();

        if (maxIter <= 0) {
            throw new IllegalArgumentException("solver.maxIterations は 1 以上が必要です: " + maxIter);
        }
        if (!(atol > 0.0)) {
            throw new IllegalArgumentException(
                    "solver.absoluteTolerance は 0 より大きい必要があります: " + atol);
        }
        if (!(rtol >= 0.0)) {
            throw new IllegalArgumentException("solver.relativeTolerance は 0 以上が必要です: " + rtol);
        }
        if (!(dtMin > 0.0)) {
            throw new IllegalArgumentException(
                    "solver.minPseudoTimeStep は 0 より大きい必要があります: " + dtMin);
        }
        if (!(dt0 >= dtMin && dt0 <= dtMax)) {
            throw new IllegalArgumentException(
                    "solver.initialPseudoTimeStep は [minPseudoTimeStep, maxPseudoTimeStep] が必要です: "
                            + dt0);
        }
        if (!(growth >= 1.0)) {
            throw new IllegalArgumentException(
                    "solver.pseudoTimeStepGrowth は 1 以上が必要です: " + growth);
        }
        if (!(residualGrowth >= 1.0)) {
            throw new IllegalArgumentException(
                    "solver.maxResidualGrowth は 1 以上が必要です: " + residualGrowth);
        }
        if (maxStalled <= 0) {
            throw new IllegalArgumentException(
                    "solver.maxStalledProjections は 1 以上が必要です: " + maxStalled);
        }

        this.function = function;
        this.jacobianEvaluator = jacobianEvaluator;
        this.linearSystemBackend = linearSystemBackend;
        this.maxIterations = maxIter;
        this.absoluteTolerance = atol;
        this.relativeTolerance = rtol;
        this.initialPseudoTimeStep = dt0;
        this.pseudoTimeStepGrowth = growth;
        this.maxPseudoTimeStep = dtMax;
        this.minPseudoTimeStep = dtMin;
        this.maxResidualGrowth = residualGrowth;
        this.maxStalledProjections = maxStalled;
    }

    /**
     * 初期状態から反復して定常状態を求めます。
     *
     * @param initialState 初期状態ベクトル（長さ 5N）です。負の成分は 0 に射影してから使います
     * @return 収束した定常状態です
     * @throws IllegalArgumentException initialState が null、または長さが不正な場合に発生します
     * @throws NonConvergenceException 反復回数の上限に達した、または擬似時間刻みが下限を下回った場合に発生します
     * @throws NonPhysicalStateException 非負射影で反復が停滞した場合に発生します
     * @throws NumericalInstabilityException NaN・無限大が現れた、または線形方程式が解けない場合に発生します
     */
    public SteadyState solve(double[] initialState) {
        StateLayout layout = function.layout();
        layout.requireSize(initialState);

        long t0 = System.nanoTime();

        double[] x = initialState.clone();
        if (!allFinite(x)) {
            throw new NumericalInstabilityException("初期状態に有限でない値が含まれます", 0, Double.NaN);
        }
        projectNonNegative(x);

        DerivativeResult current = function.evaluate(0.0, x);
        double[] f = current.getDerivative();
        if (!allFinite(f)) {
            throw new NumericalInstabilityException("初期状態で残差に有限でない値が現れました", 0, Double.NaN);
        }
        double norm = l2Norm(f);
        double maxNorm = current.maxAbsDerivative();
        double dt = initialPseudoTimeStep;
        int stalled = 0;

        log.info("定常解の探索を開始します。未知数={}（N={}）、最大反復={}、許容誤差（絶対）={}、許容誤差（相対）={}、"
                + "初期Δτ={}、初期残差max={}", layout.size(), layout.getCellCount(), maxIterations,
                fmt5e(absoluteTolerance), fmt5e(relativeTolerance), fmt5e(dt),
                fmt5e(maxNorm));

        for (int iter = 1; iter <= maxIterations; iter++) {
            if (isConverged(f, x)) {
                return converged(layout, x, current, iter - 1, maxNorm, t0);
            }

            // 1) ヤコビアン
            BlockTridiagonalMatrix jacobian = jacobianEvaluator.evaluate(x, f);
            if (!jacobian.isFinite()) {
                log.warn("ヤコビアンに有限でない値が現れました。反復={}", iter);
                throw new NumericalInstabilityException("ヤコビアンに有限でない値が現れました", iter, maxNorm);
            }

            // 2) (I/Δτ − J)·δ = F
            double[] step;
            try {
                step = linearSystemBackend.solveShifted(jacobian, 1.0 / dt, f);
            } catch (IllegalStateException e) {
                log.warn("線形方程式の求解に失敗しました。反復={}、Δτ={}", iter, fmt5e(dt));
                throw new NumericalInstabilityException("線形方程式の求解に失敗しました", iter, maxNorm, e);
            }

            // 3) 更新と非負射影
            double[] trial = new double[x.length];
            for (int i = 0; i < x.length; i++) {
                trial[i] = x[i] + step[i];
            }
            boolean projected = projectNonNegative(trial);

            // 4) 試行点の残差
            DerivativeResult trialResult = function.evaluate(0.0, trial);
            double[] trialF = trialResult.getDerivative();
            boolean finite = allFinite(trialF);
            double trialNorm = finite ? l2Norm(trialF) : Double.NaN;

            if (!finite || trialNorm > norm * maxResidualGrowth) {
                dt *= REJECTION_FACTOR;
                log.debug("ステップを棄却しました。反復={}、試行残差L2={}、現在残差L2={}、新しいΔτ={}", iter,
                        fmt5e(trialNorm), fmt5e(norm), fmt5e(dt));
                if (dt < minPseudoTimeStep) {
                    log.warn("擬似時間刻みが下限を下回りました。反復={}、Δτ={}", iter, fmt5e(dt));
                    if (!finite) {
                        throw new NumericalInstabilityException(
                                "残差に有限でない値が現れ、擬似時間刻みを縮めても回復しませんでした", iter, maxNorm);
                    }
                    throw new NonConvergenceException("擬似時間刻みが下限を下回りました", iter, maxNorm);
                }
                continue;
            }

            // 5) 非負射影による停滞の検知
            double change = maxAbsDifference(trial, x);
            if (projected && change <= stallThreshold(x)) {
                stalled++;
                if (stalled >= maxStalledProjections) {
                    log.warn("非負射影で反復が停滞しました。反復={}、連続停滞={}", iter, stalled);
                    throw new NonPhysicalStateException(
                            "非負射影で反復が停滞しました（非負の状態では残差を減らせません）", iter, maxNorm);
                }
            } else {
                stalled = 0;
            }

            // 6) Δτ の更新（残差比による SER 則、受理時は最低でも pseudoTimeStepGrowth 倍）
            double ratio = (trialNorm > 0.0) ? norm / trialNorm : MAX_GROWTH_PER_STEP;
            double growth = (ratio >= 1.0)
                    ? Math.min(Math.max(ratio, pseudoTimeStepGrowth), MAX_GROWTH_PER_STEP)
                    : ratio;
            dt = Math.min(maxPseudoTimeStep, Math.max(minPseudoTimeStep, dt * growth));

            x = trial;
            current = trialResult;
            f = trialF;
            norm = trialNorm;
            maxNorm = current.maxAbsDerivative();

            log.info("定常反復 {} / {}：残差max={}（許容={}）[{}]、残差L2={}、Δτ={}、変化量max={}、射影={}", iter,
                    maxIterations, fmt5e(maxNorm), fmt5e(absoluteTolerance),
                    isConverged(f, x) ? "OK" : "NG", fmt5e(norm), fmt5e(dt), fmt5e(change),
                    projected);
        }

        if (isConverged(f, x)) {
            return converged(layout, x, current, maxIterations, maxNorm, t0);
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.warn("定常解が未収束で終了しました。反復回数={}、所要時間={}ms（残差max={}）", maxIterations, elapsedMs,
                fmt5e(maxNorm));
        throw new NonConvergenceException("最大反復回数に達しても収束しませんでした", maxIterations, maxNorm);
    }

    /**
     * 全成分で {@code |F_i| <= atol + rtol·|C_i|} を満たすかどうかを判定します。
     *
     * @param f 残差です
     * @param x 状態です
     * @return 収束していれば true です
     */
    private boolean isConverged(double[] f, double[] x) {
        for (int i = 0; i < f.length; i++) {
            if (!(Math.abs(f[i]) <= absoluteTolerance + relativeTolerance * Math.abs(x[i]))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 非負射影で停滞したとみなす変化量の閾値を返します。
     *
     * @param x 現在の状態です
     * @return 閾値です
     */
    private double stallThreshold(double[] x) {
        double scale = 0.0;
        for (double v : x) {
            scale = Math.max(scale, Math.abs(v));
        }
        return absoluteTolerance + relativeTolerance * scale;
    }

    private SteadyState converged(StateLayout layout, double[] x, DerivativeResult result,
            int iterations, double maxNorm, long t0) {
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("定常解が収束しました。反復回数={}、所要時間={}ms（残差max={}）", iterations, elapsedMs,
                fmt5e(maxNorm));
        return new SteadyState(layout, x, result, iterations, maxNorm);
    }

    /**
     * 負の成分を 0 に射影します。
     *
     * @param x 対象の状態です（直接書き換えます）
     * @return 1 成分でも射影した場合は true です
     */
    private static boolean projectNonNegative(double[] x) {
        boolean projected = false;
        for (int i = 0; i < x.length; i++) {
            if (x[i] < 0.0) {
                x[i] = 0.0;
                projected = true;
            }
        }
        return projected;
    }

    private static boolean allFinite(double[] v) {
        for (double d : v) {
            if (!Double.isFinite(d)) {
                return false;
            }
        }
        return true;
    }

    private static double l2Norm(double[] v) {
        double sum = 0.0;
        for (double d : v) {
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    private static double maxAbsDifference(double[] a, double[] b) {
        double max = 0.0;
        for (int i = 0; i < a.length; i++) {
            max = Math.max(max, Math.abs(a[i] - b[i]));
        }
        return max;
    }

    /**
     * 数値を有効数字6桁の指数表記に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5e(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }
}
