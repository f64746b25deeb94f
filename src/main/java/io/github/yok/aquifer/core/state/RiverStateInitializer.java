package io.github.yok.aquifer.core.state;

import io.github.yok.aquifer.core.model.ParameterSet;
import io.github.yok.aquifer.core.model.Species;
import java.util.Arrays;

/**
 * 各化学種を河川水（上流端）濃度で一様に満たした初期状態を生成します。
 *
 * <p>
 * 河川水が帯水層を押し出した直後の状態に相当します。N2 は河川水に含まれないため 0 です。
 * </p>
 */
public final class RiverStateInitializer implements StateVectorInitializer {

    private final StateLayout layout;
    private final ParameterSet parameters;

    /**
     * 初期値生成器を作成します。
     *
     * @param layout 状態ベクトルの並びです
     * @param parameters パラメータセットです
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public RiverStateInitializer(StateLayout layout, ParameterSet parameters) {
        if (layout == null) {
            throw new IllegalArgumentException("layout は null 不可です");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters は null 不可です");
        }
        this.layout = layout;
        this.parameters = parameters;
    }

    @Override
    public double[] create() {
        double[] state = layout.zeros();
        for (Species s : Species.values()) {
            double[] values = new double[layout.getCellCount()];
            Arrays.fill(values, s.riverConcentration(parameters));
            layout.put(state, s, values);
        }
        return state;
    }
}
