package io.github.yok.aquifer.core.grid;

import java.util.Arrays;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 等間隔の 1 次元格子（上流端 x=0、下流端 x=L）です。
 *
 * <p>
 * セル i（0 始まり）は界面 i と i+1 に挟まれ、セル中心は {@code (i + 0.5)·dx} にあります。 不変なので、複数の求解で共有できます。
 * </p>
 */
@ToString(of = {"length", "cellCount", "cellWidth"})
@EqualsAndHashCode(of = {"length", "cellCount"})
public final class UniformGrid1D implements Grid {

    /**
     * 領域長 L [m] です。
     */
    private final double length;

    /**
     * セル数 N です。
     */
    private final int cellCount;

    /**
     * セル幅 dx = L/N [m] です。
     */
    private final double cellWidth;

    /**
     * セル中心位置です。
     */
    private final double[] cellCenters;

    /**
     * 界面位置です。
     */
    private final double[] faces;

    /**
     * 等間隔格子を生成します。
     *
     * @param length 領域長 L [m]（0 より大きい有限値）
     * @param cellCount セル数 N（1 以上）
     * @throws InvalidGridException L ≦ 0、L が有限でない、または N ≦ 0 の場合に発生します
     */
    public UniformGrid1D(double length, int cellCount) {
        if (!(length > 0.0) || !Double.isFinite(length)) {
            throw new InvalidGridException("grid.length は 0 より大きい有限値が必要です: " + length);
        }
        if (cellCount <= 0) {
            throw new InvalidGridException("grid.cellCount は 1 以上が必要です: " + cellCount);
        }
        this.length = length;
        this.cellCount = cellCount;
        this.cellWidth = length / cellCount;

        this.faces = new double[cellCount + 1];
        for (int i = 0; i <= cellCount; i++) {
            faces[i] = i * cellWidth;
        }
        // 丸め誤差で下流端が L からずれないようにします。
        faces[cellCount] = length;

        this.cellCenters = new double[cellCount];
        for (int i = 0; i < cellCount; i++) {
            cellCenters[i] = (i + 0.5) * cellWidth;
        }
    }

    @Override
    public int cellCount() {
        return cellCount;
    }

    @Override
    public double length() {
        return length;
    }

    @Override
    public double cellWidth() {
        return cellWidth;
    }

    @Override
    public double[] cellCenters() {
        return Arrays.copyOf(cellCenters, cellCenters.length);
    }

    @Override
    public double[] faces() {
        return Arrays.copyOf(faces, faces.length);
    }
}
