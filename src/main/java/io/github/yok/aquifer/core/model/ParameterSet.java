package io.github.yok.aquifer.core.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 帯水層モデルの物理定数・反応速度定数をまとめた不変クラスです。
 *
 * <p>
 * 単位は長さ m、時間 d（日）、濃度 mmol/m³ で統一します。 生成時に検証を行い、以後は変更されないため、全ての求解で読み取り専用として共有できます。
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ParameterSet {

    /**
     * 好気的無機化の速度定数 r_aeromin [1/d] です。
     */
    private final double aerobicMineralizationRate;

    /**
     * 脱窒の速度定数 r_denitr [1/d] です。
     */
    private final double denitrificationRate;

    /**
     * 硝化の2次速度定数 r_nitri [m³/(mmol·d)] です。
     */
    private final double nitrificationRate;

    /**
     * 再曝気（酸素の飽和濃度への緩和）速度定数 r_aera [1/d] です。
     */
    private final double aerationRate;

    /**
     * 移流速度 v_adv [m/d] です。
     */
    private final double advectiveVelocity;

    /**
     * 分散長 a [m] です。
     */
    private final double dispersivity;

    /**
     * 酸素の半飽和定数 kO2 [mmol/m³] です。
     */
    private final double oxygenHalfSaturation;

    /**
     * 硝酸の半飽和定数 kNO3 [mmol/m³] です。
     */
    private final double nitrateHalfSaturation;

    /**
     * 河川水（上流端）の DON 濃度 riverDON [mmol/m³] です。
     */
    private final double riverDon;

    /**
     * 河川水（上流端）の O2 濃度 riverO2 [mmol/m³] です。
     */
    private final double riverOxygen;

    /**
     * 河川水（上流端）の NO3 濃度 riverNO3 [mmol/m³] です。
     */
    private final double riverNitrate;

    /**
     * 河川水（上流端）の NH3 濃度 riverNH3 [mmol/m³] です。
     */
    private final double riverAmmonia;

    /**
     * 酸素の飽和濃度 O2_sol [mmol/m³] です。
     */
    private final double oxygenSolubility;

    /**
     * 空隙率（移動相の体積分率）por [-] です。
     */
    private final double porosity;

    /**
     * パラメータセットを生成します。
     *
     * @param aerobicMineralizationRate r_aeromin（0 より大きい）
     * @param denitrificationRate r_denitr（0 より大きい）
     * @param nitrificationRate r_nitri（0 より大きい）
     * @param aerationRate r_aera（0 より大きい）
     * @param advectiveVelocity v_adv（0 より大きい）
     * @param dispersivity 分散長 a（0 以上）
     * @param oxygenHalfSaturation kO2（0 より大きい）
     * @param nitrateHalfSaturation kNO3（0 より大きい）
     * @param riverDon riverDON（0 以上）
     * @param riverOxygen riverO2（0 以上）
     * @param riverNitrate riverNO3（0 以上）
     * @param riverAmmonia riverNH3（0 以上）
     * @param oxygenSolubility O2_sol（0 以上）
     * @param porosity 空隙率（0 より大きく 1 以下）
     * @throws InvalidParameterException 値が範囲外、または有限でない場合に発生します
     */
    @Builder(toBuilder = true)
    public ParameterSet(double aerobicMineralizationRate, double denitrificationRate,
            double nitrificationRate, double aerationRate, double advectiveVelocity,
            double dispersivity, double oxygenHalfSaturation, double nitrateHalfSaturation,
            double riverDon, double riverOxygen, double riverNitrate, double riverAmmonia,
            double oxygenSolubility, double porosity) {

        requirePositive("r_aeromin", aerobicMineralizationRate);
        requirePositive("r_denitr", denitrificationRate);
        requirePositive("r_nitri", nitrificationRate);
        requirePositive("r_aera", aerationRate);
        requirePositive("v_adv", advectiveVelocity);
        requireNonNegative("a", dispersivity);
        // 濃度 0 での割り算を避けるため、半飽和定数は厳密に正が必要です。
        requirePositive("kO2", oxygenHalfSaturation);
        requirePositive("kNO3", nitrateHalfSaturation);
        requireNonNegative("riverDON", riverDon);
        requireNonNegative("riverO2", riverOxygen);
        requireNonNegative("riverNO3", riverNitrate);
        requireNonNegative("riverNH3", riverAmmonia);
        requireNonNegative("O2_sol", oxygenSolubility);
        requirePositive("por", porosity);
        if (porosity > 1.0) {
            throw new InvalidParameterException("por は (0, 1] が必要です: " + porosity);
        }

        this.aerobicMineralizationRate = aerobicMineralizationRate;
        this.denitrificationRate = denitrificationRate;
        this.nitrificationRate = nitrificationRate;
        this.aerationRate = aerationRate;
        this.advectiveVelocity = advectiveVelocity;
        this.dispersivity = dispersivity;
        this.oxygenHalfSaturation = oxygenHalfSaturation;
        this.nitrateHalfSaturation = nitrateHalfSaturation;
        this.riverDon = riverDon;
        this.riverOxygen = riverOxygen;
        this.riverNitrate = riverNitrate;
        this.riverAmmonia = riverAmmonia;
        this.oxygenSolubility = oxygenSolubility;
        this.porosity = porosity;
    }

    /**
     * 基準シナリオのパラメータセットを返します。
     *
     * <p>
     * application.yml の既定値（aquifer.parameters.*）と同じ値です。
     * </p>
     *
     * @return 基準パラメータセットです
     */
    public static ParameterSet reference() {
        return ParameterSet.builder()
                .aerobicMineralizationRate(0.1)
                .denitrificationRate(0.05)
                .nitrificationRate(0.001)
                .aerationRate(0.005)
                .advectiveVelocity(1.0)
                .dispersivity(5.0)
                .oxygenHalfSaturation(20.0)
                .nitrateHalfSaturation(10.0)
                .riverDon(100.0)
                .riverOxygen(250.0)
                .riverNitrate(50.0)
                .riverAmmonia(10.0)
                .oxygenSolubility(300.0)
                .porosity(0.4)
                .build();
    }

    /**
     * 分散係数 D = a·v_adv [m²/d] を返します。
     *
     * @return 分散係数です
     */
    public double dispersionCoefficient() {
        return dispersivity * advectiveVelocity;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0) || !Double.isFinite(value)) {
            throw new InvalidParameterException(name + " は 0 より大きい有限値が必要です: " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0.0) || !Double.isFinite(value)) {
            throw new InvalidParameterException(name + " は 0 以上の有限値が必要です: " + value);
        }
    }
}
