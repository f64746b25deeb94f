package io.github.yok.aquifer.core.model;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.aquifer.core.grid.Grid;
import io.github.yok.aquifer.core.grid.UniformGrid1D;
import io.github.yok.aquifer.core.model.TransportOperator.TransportResult;
import java.util.Arrays;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@Slf4j
class UpwindTransportOperatorTest {

    private UpwindTransportOperator operator;

    // 試験条件: dx = 2 m
    private static final double VF = 0.4;
    private static final double V = 1.0;
    private static final double D = 3.0;

    @BeforeEach
    void setUp() {
        operator = new UpwindTransportOperator();
    }

    @Test
    @DisplayName("手計算: 内部界面は分散+風上移流、上流端は C_up をゴーストセル、下流端は移流のみ")
    void apply_smallGrid_shouldMatchHandComputedFluxes() {
        // ARRANGE
        Grid grid = new UniformGrid1D(6.0, 3); // dx = 2
        double[] c = {4.0, 2.0, 1.0};
        double cUp = 10.0;

        // 手計算:
        // flux[0] = -0.4·3·(4-10)/2 + 0.4·1·10 = 3.6 + 4.0 = 7.6
        // flux[1] = -0.4·3·(2-4)/2 + 0.4·1·4 = 1.2 + 1.6 = 2.8
        // flux[2] = -0.4·3·(1-2)/2 + 0.4·1·2 = 0.6 + 0.8 = 1.4
        // flux[3] = 0.4·1·1 = 0.4
        // dC[i] = -(flux[i+1]-flux[i]) / (2·0.4)
        //   dC[0] = (7.6-2.8)/0.8 = 6.0, dC[1] = (2.8-1.4)/0.8 = 1.75, dC[2] = (1.4-0.4)/0.8 = 1.25

        // ACT
        TransportResult result = operator.apply(c, cUp, D, V, VF, grid);

        // ASSERT
        log.info("界面フラックス: {}", Arrays.toString(result.getFaceFluxes()));
        log.info("濃度変化率:     {}", Arrays.toString(result.getRateOfChange()));

        assertArrayEquals(new double[] {7.6, 2.8, 1.4, 0.4}, result.getFaceFluxes(), 1e-12);
        assertArrayEquals(new double[] {6.0, 1.75, 1.25}, result.getRateOfChange(), 1e-12);
        assertEquals(7.6, result.fluxUp(), 1e-12);
        assertEquals(0.4, result.fluxDown(), 1e-12);
    }

    @Test
    @DisplayName("保存性: Σ dC·dx·VF = flux_up − flux_down（任意の濃度分布）")
    void apply_randomProfile_shouldSatisfyDiscreteDivergenceIdentity() {
        // ARRANGE
        Grid grid = new UniformGrid1D(37.0, 41);
        Random random = new Random(20240601L);
        double[] c = new double[grid.cellCount()];
        for (int i = 0; i < c.length; i++) {
            c[i] = 300.0 * random.nextDouble();
        }

        // ACT
        TransportResult result = operator.apply(c, 123.0, D, V, VF, grid);

        // ASSERT
        double sum = 0.0;
        for (double r : result.getRateOfChange()) {
            sum += r * grid.cellWidth() * VF;
        }
        double expected = result.fluxUp() - result.fluxDown();
        log.info("Σ dC·dx·VF = {}, flux_up − flux_down = {}", sum, expected);

        assertEquals(expected, sum, 1e-9 * Math.max(1.0, Math.abs(result.fluxUp())));
    }

    @Test
    @DisplayName("一様分布 C = C_up: 内部は変化なし、下流端も変化なし")
    void apply_uniformAtBoundaryValue_shouldBeSteady() {
        Grid grid = new UniformGrid1D(10.0, 10);
        double[] c = new double[10];
        Arrays.fill(c, 7.0);

        TransportResult result = operator.apply(c, 7.0, D, V, VF, grid);

        for (double r : result.getRateOfChange()) {
            assertEquals(0.0, r, 1e-12);
        }
        // 流入・流出とも移流フラックス VF·v·C
        assertEquals(VF * V * 7.0, result.fluxUp(), 1e-12);
        assertEquals(VF * V * 7.0, result.fluxDown(), 1e-12);
    }

    @Test
    @DisplayName("純移流（D=0）: 上流端フラックスは C_up·v·VF、セル0の変化率は C_up·v/dx")
    void apply_pureAdvectionZeroState_shouldInjectBoundaryValue() {
        Grid grid = new UniformGrid1D(5.0, 5); // dx = 1
        double[] c = new double[5];

        TransportResult result = operator.apply(c, 100.0, 0.0, V, VF, grid);

        assertEquals(100.0 * V * VF, result.fluxUp(), 1e-12);
        assertEquals(100.0 * V / 1.0, result.getRateOfChange()[0], 1e-12);
        for (int i = 1; i < 5; i++) {
            assertEquals(0.0, result.getRateOfChange()[i], 0.0);
        }
        assertEquals(0.0, result.fluxDown(), 0.0);
    }

    @Test
    @DisplayName("負の流速: 風上側（下流側セル）の濃度を使う")
    void apply_negativeVelocity_shouldSelectDownstreamSide() {
        Grid grid = new UniformGrid1D(2.0, 2); // dx = 1
        double[] c = {1.0, 5.0};

        TransportResult result = operator.apply(c, 0.0, 0.0, -2.0, 1.0, grid);

        // 内部界面: VF·v·C[1] = -2·5 = -10
        assertEquals(-10.0, result.getFaceFluxes()[1], 1e-12);
        // 上流端: 風上はセル0
        assertEquals(-2.0, result.fluxUp(), 1e-12);
    }

    @Test
    @DisplayName("配列長が N と一致しなければ IllegalArgumentException")
    void apply_lengthMismatch_shouldThrow() {
        Grid grid = new UniformGrid1D(10.0, 10);

        assertThrows(IllegalArgumentException.class,
                () -> operator.apply(new double[9], 0.0, D, V, VF, grid));
        assertThrows(IllegalArgumentException.class,
                () -> operator.apply(new double[10], 0.0, D, V, 0.0, grid));
    }
}
