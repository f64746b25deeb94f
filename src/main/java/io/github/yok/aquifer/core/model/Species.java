package io.github.yok.aquifer.core.model;

/**
 * 状態ベクトルを構成する化学種です。
 *
 * <p>
 * 宣言順が状態ベクトル内の並び（DON, O2, NO3, NH3, N2）そのものです。並びを変えると状態ベクトルの解釈が壊れるため、変更しないでください。
 * </p>
 */
public enum Species {

    /**
     * 溶存有機態窒素（有機物）です。
     */
    DON,

    /**
     * 溶存酸素です。
     */
    O2,

    /**
     * 硝酸です。
     */
    NO3,

    /**
     * アンモニアです。
     */
    NH3,

    /**
     * 窒素ガスです（河川水には含まれない前提です）。
     */
    N2;

    /**
     * 状態ベクトル内でのブロック番号（0 始まり）を返します。
     *
     * @return ブロック番号です
     */
    public int index() {
        return ordinal();
    }

    /**
     * 化学種の数を返します。
     *
     * @return 化学種の数（5）です
     */
    public static int count() {
        return values().length;
    }

    /**
     * 上流端（河川水）の固定濃度を返します。
     *
     * @param parameters パラメータセットです
     * @return 上流端濃度 [mmol/m³] です（N2 は常に 0）
     */
    public double riverConcentration(ParameterSet parameters) {
        switch (this) {
            case DON:
                return parameters.getRiverDon();
            case O2:
                return parameters.getRiverOxygen();
            case NO3:
                return parameters.getRiverNitrate();
            case NH3:
                return parameters.getRiverAmmonia();
            case N2:
                return 0.0;
            default:
                throw new IllegalStateException("未知の化学種です: " + this);
        }
    }
}
