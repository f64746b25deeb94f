package io.github.yok.aquifer.core.solver;

import io.github.yok.aquifer.core.linearalgebra.BlockTridiagonalMatrix;

/**
 * 微分関数のヤコビアンを評価するインタフェースです。
 */
public interface JacobianEvaluator {

    /**
     * 状態 x におけるヤコビアン ∂F/∂x を評価します。
     *
     * @param state 状態ベクトルです（変更しません）
     * @param derivativeAtState state で評価済みの F(x) です
     * @return ブロック三重対角のヤコビアンです
     */
    BlockTridiagonalMatrix evaluate(double[] state, double[] derivativeAtState);
}
