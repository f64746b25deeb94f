package io.github.yok.aquifer.app;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * aquifer-solver の設定値（aquifer.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。 単位は長さ m、時間 d（日）、濃度 mmol/m³ です。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "aquifer")
public class AquiferProperties {

    /**
     * 格子設定です。
     */
    @Valid
    private Grid grid = new Grid();

    /**
     * 物理パラメータ設定です。
     */
    @Valid
    private Parameters parameters = new Parameters();

    /**
     * 定常ソルバ設定です。
     */
    @Valid
    private Solver solver = new Solver();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "aquifer")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Grid g = getGrid();
        Parameters p = getParameters();
        Solver s = getSolver();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(512).append(nl);

        appendSection(sb, nl, "grid",
                // length: 領域長 L [m]
                "length", g.getLength(),
                // cellCount: セル数 N
                "cellCount", g.getCellCount());

        appendSection(sb, nl, "parameters",
                "aerobicMineralizationRate", p.getAerobicMineralizationRate(),
                "denitrificationRate", p.getDenitrificationRate(),
                "nitrificationRate", p.getNitrificationRate(),
                "aerationRate", p.getAerationRate(),
                "advectiveVelocity", p.getAdvectiveVelocity(),
                "dispersivity", p.getDispersivity(),
                "oxygenHalfSaturation", p.getOxygenHalfSaturation(),
                "nitrateHalfSaturation", p.getNitrateHalfSaturation(),
                "riverDon", p.getRiverDon(),
                "riverOxygen", p.getRiverOxygen(),
                "riverNitrate", p.getRiverNitrate(),
                "riverAmmonia", p.getRiverAmmonia(),
                "oxygenSolubility", p.getOxygenSolubility(),
                "porosity", p.getPorosity());

        appendSection(sb, nl, "solver",
                // maxIterations: 最大反復回数
                "maxIterations", s.getMaxIterations(),
                // absoluteTolerance / relativeTolerance: |F_i| <= atol + rtol·|C_i| で収束
                "absoluteTolerance", s.getAbsoluteTolerance(),
                "relativeTolerance", s.getRelativeTolerance(),
                // 擬似時間刻み Δτ の初期値・増加率・上下限
                "initialPseudoTimeStep", s.getInitialPseudoTimeStep(),
                "pseudoTimeStepGrowth", s.getPseudoTimeStepGrowth(),
                "maxPseudoTimeStep", s.getMaxPseudoTimeStep(),
                "minPseudoTimeStep", s.getMinPseudoTimeStep(),
                // maxResidualGrowth: 1 ステップで許容する残差ノルムの増加倍率
                "maxResidualGrowth", s.getMaxResidualGrowth(),
                // maxStalledProjections: 非負射影で停滞した反復の連続許容回数
                "maxStalledProjections", s.getMaxStalledProjections(),
                // parallelJacobian: 差分ヤコビアンの色グループを並列評価するかどうか
                "parallelJacobian", s.isParallelJacobian(),
                // initialState: 初期状態（ZERO/RIVER）
                "initialState", s.getInitialState());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(kvPairs[i]).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Grid {

        /**
         * 領域長 L [m] です。
         */
        @Positive
        private double length = 500.0;

        /**
         * セル数 N です。
         */
        @Positive
        private int cellCount = 500;
    }

    /**
     * 物理パラメータ（ParameterSet の各項目）です。
     */
    @Data
    public static class Parameters {

        /**
         * 好気的無機化の速度定数 r_aeromin [1/d] です。
         */
        @Positive
        private double aerobicMineralizationRate = 0.1;

        /**
         * 脱窒の速度定数 r_denitr [1/d] です。
         */
        @Positive
        private double denitrificationRate = 0.05;

        /**
         * 硝化の2次速度定数 r_nitri [m³/(mmol·d)] です。
         */
        @Positive
        private double nitrificationRate = 0.001;

        /**
         * 再曝気速度定数 r_aera [1/d] です。
         */
        @Positive
        private double aerationRate = 0.005;

        /**
         * 移流速度 v_adv [m/d] です。
         */
        @Positive
        private double advectiveVelocity = 1.0;

        /**
         * 分散長 a [m] です。
         */
        @PositiveOrZero
        private double dispersivity = 5.0;

        /**
         * 酸素の半飽和定数 kO2 [mmol/m³] です。
         */
        @Positive
        private double oxygenHalfSaturation = 20.0;

        /**
         * 硝酸の半飽和定数 kNO3 [mmol/m³] です。
         */
        @Positive
        private double nitrateHalfSaturation = 10.0;

        /**
         * 河川水の DON 濃度です。
         */
        @PositiveOrZero
        private double riverDon = 100.0;

        /**
         * 河川水の O2 濃度です。
         */
        @PositiveOrZero
        private double riverOxygen = 250.0;

        /**
         * 河川水の NO3 濃度です。
         */
        @PositiveOrZero
        private double riverNitrate = 50.0;

        /**
         * 河川水の NH3 濃度です。
         */
        @PositiveOrZero
        private double riverAmmonia = 10.0;

        /**
         * 酸素の飽和濃度 O2_sol です。
         */
        @PositiveOrZero
        private double oxygenSolubility = 300.0;

        /**
         * 空隙率 por（0 より大きく 1 以下）です。
         */
        @Positive
        private double porosity = 0.4;
    }

    @Data
    public static class Solver {

        /**
         * 最大反復回数です。
         */
        @Positive
        private int maxIterations = 200;

        /**
         * 残差の絶対許容誤差です。
         */
        @Positive
        private double absoluteTolerance = 1e-10;

        /**
         * 残差の相対許容誤差（濃度に対する比）です。
         */
        @PositiveOrZero
        private double relativeTolerance = 1e-10;

        /**
         * 擬似時間刻み Δτ の初期値 [d] です。
         */
        @Positive
        private double initialPseudoTimeStep = 1.0;

        /**
         * 受理したステップごとに Δτ に掛ける最小の増加率です（1 より大きい値）。
         */
        @Positive
        private double pseudoTimeStepGrowth = 2.0;

        /**
         * Δτ の上限です（十分大きいと純粋なニュートン法になります）。
         */
        @Positive
        private double maxPseudoTimeStep = 1e12;

        /**
         * Δτ の下限です。これを下回ると求解失敗とします。
         */
        @Positive
        private double minPseudoTimeStep = 1e-10;

        /**
         * 1 ステップで許容する残差ノルムの増加倍率です（超えたステップは棄却します）。
         */
        @Positive
        private double maxResidualGrowth = 10.0;

        /**
         * 非負射影で停滞した反復の連続許容回数です。
         */
        @Positive
        private int maxStalledProjections = 5;

        /**
         * 差分ヤコビアンの色グループを並列評価するかどうかです。
         */
        private boolean parallelJacobian = false;

        /**
         * 初期状態の種類です。
         */
        @NotNull
        private InitialState initialState = InitialState.ZERO;

        public enum InitialState {
            /**
             * 全成分 0 です。
             */
            ZERO,

            /**
             * 各化学種を河川水濃度で一様に満たします。
             */
            RIVER
        }
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotEmpty
        private String dir = "./out";
    }
}
