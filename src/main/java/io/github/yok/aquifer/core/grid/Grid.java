package io.github.yok.aquifer.core.grid;

/**
 * 1次元の有限体積格子（セル集合）を表すインタフェースです。
 *
 * <p>
 * 輸送演算子は格子の具体的な生成方法を意識せず、セル数・セル幅・セル中心/界面位置のみを利用します。
 * </p>
 */
public interface Grid {

    /**
     * セル数 N を返します。
     *
     * @return セル数です（1 以上）
     */
    int cellCount();

    /**
     * 領域長 L [m] を返します。
     *
     * @return 領域長です
     */
    double length();

    /**
     * セル幅 dx [m] を返します。
     *
     * @return セル幅です
     */
    double cellWidth();

    /**
     * セル中心位置（長さ N）を返します。
     *
     * @return セル中心位置の配列です（呼び出し側で変更しても格子には影響しません）
     */
    double[] cellCenters();

    /**
     * 界面位置（長さ N+1）を返します。
     *
     * @return 界面位置の配列です（呼び出し側で変更しても格子には影響しません）
     */
    double[] faces();
}
