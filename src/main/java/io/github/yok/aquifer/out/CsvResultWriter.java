package io.github.yok.aquifer.out;

import io.github.yok.aquifer.core.grid.Grid;
import io.github.yok.aquifer.core.model.ReactionKinetics.ReactionRates;
import io.github.yok.aquifer.core.model.Species;
import io.github.yok.aquifer.core.state.SteadyState;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（N はセル数）。
 * </p>
 *
 * <ul>
 * <li>{@code aquifer_profile_N=500.csv}（セル中心 x と 5 化学種の濃度）</li>
 * <li>{@code aquifer_rates_N=500.csv}（セル中心 x と 4 種類の反応速度）</li>
 * <li>{@code aquifer_budget_N=500.csv}（収支表・物質収支の閉合差・反復回数などの key/value）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "aquifer";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 定常状態と収支を出力します。
     *
     * @param steadyState 定常状態です
     * @param grid 格子です
     * @param budget 収支表です
     * @param closures 化学種ごとの物質収支の閉合差です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(SteadyState steadyState, Grid grid, Map<String, Double> budget,
            Map<Species, Double> closures) {

        if (steadyState == null) {
            throw new IllegalArgumentException("steadyState は null 不可です");
        }
        if (grid == null) {
            throw new IllegalArgumentException("grid は null 不可です");
        }
        if (budget == null || closures == null) {
            throw new IllegalArgumentException("budget/closures は null 不可です");
        }
        if (steadyState.getLayout().getCellCount() != grid.cellCount()) {
            throw new IllegalArgumentException("定常状態と格子のセル数が一致しません: "
                    + steadyState.getLayout().getCellCount() + " vs " + grid.cellCount());
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 濃度分布
            writeProfileCsv(steadyState, grid);

            // 2) 反応速度分布
            writeRatesCsv(steadyState, grid);

            // 3) 収支（境界フラックス・反応総量・閉合差・反復回数）
            writeBudgetCsv(steadyState, grid, budget, closures);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 濃度分布を出力します。
     *
     * @param steadyState 定常状態です
     * @param grid 格子です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeProfileCsv(SteadyState steadyState, Grid grid) throws IOException {
        Path file = outputDir.resolve(buildFileName("profile", grid.cellCount()));

        double[] x = grid.cellCenters();
        Map<Species, double[]> profiles = steadyState.profiles();

        String[] header = new String[Species.count() + 1];
        header[0] = "x";
        for (Species s : Species.values()) {
            header[s.index() + 1] = s.name();
        }

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader(header)
                        .build().print(w)) {

            for (int i = 0; i < x.length; i++) {
                Object[] record = new Object[header.length];
                record[0] = x[i];
                for (Species s : Species.values()) {
                    record[s.index() + 1] = profiles.get(s)[i];
                }
                pr.printRecord(record);
            }
        }
    }

    /**
     * 反応速度分布を出力します。
     *
     * @param steadyState 定常状態です
     * @param grid 格子です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeRatesCsv(SteadyState steadyState, Grid grid) throws IOException {
        Path file = outputDir.resolve(buildFileName("rates", grid.cellCount()));

        double[] x = grid.cellCenters();
        ReactionRates rates = steadyState.getDerivative().getRates();
        double[] aeroMin = rates.getAerobicMineralization();
        double[] denitri = rates.getDenitrification();
        double[] nitri = rates.getNitrification();
        double[] aeration = rates.getAeration();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("x", "aerobicMineralization", "denitrification",
                                "nitrification", "aeration")
                        .build().print(w)) {

            for (int i = 0; i < x.length; i++) {
                pr.printRecord(x[i], aeroMin[i], denitri[i], nitri[i], aeration[i]);
            }
        }
    }

    /**
     * 収支を出力します。
     *
     * @param steadyState 定常状態です
     * @param grid 格子です
     * @param budget 収支表です
     * @param closures 物質収支の閉合差です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeBudgetCsv(SteadyState steadyState, Grid grid, Map<String, Double> budget,
            Map<Species, Double> closures) throws IOException {

        Path file = outputDir.resolve(buildFileName("budget", grid.cellCount()));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            for (Map.Entry<String, Double> e : budget.entrySet()) {
                pr.printRecord(e.getKey(), e.getValue());
            }
            for (Map.Entry<Species, Double> e : closures.entrySet()) {
                pr.printRecord(e.getKey().name() + ".closure", e.getValue());
            }

            pr.printRecord("grid.length", grid.length());
            pr.printRecord("grid.cellCount", grid.cellCount());
            pr.printRecord("solver.iterations", steadyState.getIterations());
            pr.printRecord("solver.residualMaxNorm", steadyState.getResidualMaxNorm());
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code aquifer_profile_N=500.csv}
     * </p>
     *
     * @param kind 量の識別子（profile/rates/budget）
     * @param cellCount セル数 N です
     * @return ファイル名です
     */
    static String buildFileName(String kind, int cellCount) {
        return FILE_HEAD + "_" + kind + "_N=" + cellCount + ".csv";
    }
}
