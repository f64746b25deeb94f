package io.github.yok.aquifer.core.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.aquifer.core.grid.Grid;

/**
 * 1次風上差分（移流）と中心差分（分散）による有限体積輸送演算子です。
 *
 * <p>
 * 界面 i（0 ≦ i ≦ N）のフラックスは次のとおりです。
 * </p>
 *
 * <ul>
 * <li>内部界面: {@code -VF·D·(C[i]-C[i-1])/dx + VF·v·C_upwind}</li>
 * <li>上流端（i=0）: 上流端濃度 C_up をゴーストセル値として同じ式を適用します（Dirichlet）</li>
 * <li>下流端（i=N）: 最終セルをゼロ勾配で外挿するため、分散項はなく {@code VF·v·C[N-1]} のみです（Neumann）</li>
 * </ul>
 *
 * <p>
 * 濃度変化率は {@code dC[i] = -(flux[i+1]-flux[i])/(dx·VF)} です。 同じ界面フラックスを隣接セルで打ち消し合うため、
 * {@code Σ dC[i]·dx·VF = flux[0] - flux[N]} が成り立ちます。
 * </p>
 */
public final class UpwindTransportOperator implements TransportOperator {

    @Override
    public TransportResult apply(double[] concentration, double upstreamConcentration,
            double dispersion, double velocity, double volumeFraction, Grid grid) {

        checkNotNull(concentration, "concentration は null 不可です");
        checkNotNull(grid, "grid は null 不可です");
        int n = grid.cellCount();
        checkArgument(concentration.length == n, "concentration の長さが N と一致しません: %s vs %s",
                concentration.length, n);
        checkArgument(volumeFraction > 0.0, "volumeFraction は 0 より大きい必要があります: %s",
                volumeFraction);
        checkArgument(dispersion >= 0.0, "dispersion は 0 以上が必要です: %s", dispersion);

        double dx = grid.cellWidth();
        double[] flux = new double[n + 1];

        // 上流端: C_up をゴーストセル（中心間距離 dx）として扱います。
        flux[0] = faceFlux(upstreamConcentration, concentration[0], dispersion, velocity,
                volumeFraction, dx);

        // 内部界面
        for (int i = 1; i < n; i++) {
            flux[i] = faceFlux(concentration[i - 1], concentration[i], dispersion, velocity,
                    volumeFraction, dx);
        }

        // 下流端: ゼロ勾配のため移流項のみ
        double last = concentration[n - 1];
        flux[n] = volumeFraction * velocity * last;

        double[] rate = new double[n];
        double storage = dx * volumeFraction;
        for (int i = 0; i < n; i++) {
            rate[i] = -(flux[i + 1] - flux[i]) / storage;
        }
        return new TransportResult(rate, flux);
    }

    /**
     * 左右のセル濃度から界面フラックスを計算します。
     *
     * @param left 界面の上流側（x の小さい側）の濃度です
     * @param right 界面の下流側の濃度です
     * @param dispersion 分散係数です
     * @param velocity 移流速度です（符号で風上側を選びます）
     * @param volumeFraction 体積分率です
     * @param dx セル中心間距離です
     * @return 界面フラックスです
     */
    private static double faceFlux(double left, double right, double dispersion, double velocity,
            double volumeFraction, double dx) {
        double diffusive = -volumeFraction * dispersion * (right - left) / dx;
        double upwind = (velocity >= 0.0) ? left : right;
        double advective = volumeFraction * velocity * upwind;
        return diffusive + advective;
    }
}
