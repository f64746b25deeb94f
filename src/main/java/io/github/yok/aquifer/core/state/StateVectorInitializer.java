package io.github.yok.aquifer.core.state;

/**
 * 定常ソルバに渡す初期状態ベクトルを生成するインターフェースです。
 */
public interface StateVectorInitializer {

    /**
     * 初期状態ベクトル（長さ 5N）を生成します。
     *
     * @return 初期状態ベクトルです
     */
    double[] create();
}
