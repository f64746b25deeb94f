package io.github.yok.aquifer.core.model;

/**
 * 反応と化学種を結び付ける化学量論係数です。
 *
 * <p>
 * 微分関数と物質収支の計算は必ずこの定数を参照し、係数を二重に定義しないようにします。
 * </p>
 */
public final class Stoichiometry {

    /**
     * 有機物分解 1 単位あたりに放出される NH3（Redfield 比 16/106）です。
     */
    public static final double AMMONIA_PER_MINERALIZATION = 16.0 / 106.0;

    /**
     * 脱窒 1 単位あたりに消費される NO3 です。
     */
    public static final double NITRATE_PER_DENITRIFICATION = 4.0 / 5.0;

    /**
     * 脱窒 1 単位あたりに生成される N2 です。
     */
    public static final double DINITROGEN_PER_DENITRIFICATION = 2.0 / 5.0;

    /**
     * 硝化 1 単位あたりに消費される O2 です。
     */
    public static final double OXYGEN_PER_NITRIFICATION = 2.0;

    private Stoichiometry() {}
}
