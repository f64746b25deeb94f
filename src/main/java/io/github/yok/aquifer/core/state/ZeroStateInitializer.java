package io.github.yok.aquifer.core.state;

/**
 * 全化学種・全セルの濃度を 0 とする初期状態を生成します。
 */
public final class ZeroStateInitializer implements StateVectorInitializer {

    private final StateLayout layout;

    /**
     * 初期値生成器を作成します。
     *
     * @param layout 状態ベクトルの並びです
     * @throws IllegalArgumentException layout が null の場合に発生します
     */
    public ZeroStateInitializer(StateLayout layout) {
        if (layout == null) {
            throw new IllegalArgumentException("layout は null 不可です");
        }
        this.layout = layout;
    }

    @Override
    public double[] create() {
        return layout.zeros();
    }
}
