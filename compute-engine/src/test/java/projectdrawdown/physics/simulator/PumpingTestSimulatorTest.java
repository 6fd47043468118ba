package projectdrawdown.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import projectdrawdown.config.HeterogeneityConfig;
import projectdrawdown.config.PumpingTestConfig;
import projectdrawdown.config.PumpingTestConfig.GridMode;
import projectdrawdown.config.SolverConfig;
import projectdrawdown.domain.aquifer.ZonePartition;
import projectdrawdown.domain.simulation.HeadResult;
import projectdrawdown.domain.simulation.PointwiseHeadResult;
import projectdrawdown.domain.simulation.StructuredHeadResult;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Slf4j
class PumpingTestSimulatorTest {

    private static final double INF = Double.POSITIVE_INFINITY;

    private static final double[][] THEIS_CLOSED = {
            {-0.24959540821048085, -0.14506367943154536, -0.08971484639870983},
            {-0.4310510557745736, -0.32132822598150224, -0.257783131815409}
    };
    private static final double[][] THEIS_STEHFEST = {
            {-0.24959542706475968, -0.14506403451595268, -0.08971518327490696},
            {-0.4310510866404986, -0.32132824940753657, -0.25778314919569034}
    };

    private PumpingTestSimulator simulator;
    private PumpingTestConfig test;

    @BeforeEach
    void setUp() {
        simulator = new PumpingTestSimulator();
        test = PumpingTestConfig.getTestingPumpingTest();
    }

    @AfterEach
    void tearDown() {
        simulator.close();
    }

    private static StructuredHeadResult structured(HeadResult result) {
        assertThat(result).isInstanceOf(StructuredHeadResult.class);
        return (StructuredHeadResult) result;
    }

    private static void assertGrid(double[][] expected, StructuredHeadResult actual, double relativeTolerance) {
        assertEquals(expected.length, actual.getHeads().length);
        for (int t = 0; t < expected.length; t++) {
            for (int r = 0; r < expected[t].length; r++) {
                assertEquals(expected[t][r], actual.headAt(t, r), Math.abs(expected[t][r]) * relativeTolerance,
                        String.format("Tiempo %d, radio %d", t, r));
            }
        }
    }

    @Nested
    @DisplayName("Acuífero homogéneo")
    class Homogeneous {

        @Test
        @DisplayName("Pozo puntual en dominio infinito: solución cerrada de Theis")
        void theis_pointWellUnbounded_shouldUseClosedForm() {
            StructuredHeadResult result = structured(simulator.theis(test, 1e-3, 1e-3));

            assertGrid(THEIS_CLOSED, result, 1e-10);
        }

        @Test
        @DisplayName("Stehfest de orden 12 sobre una zona reproduce Theis")
        void simulate_singleZone_shouldReproduceTheis() {
            ZonePartition partition = ZonePartition.homogeneous(0.0, INF, 1e-3, 1e-3);

            StructuredHeadResult result = structured(simulator.simulate(test, partition));
            log.info("Theis por Stehfest: {}", Arrays.deepToString(result.getHeads()));

            assertGrid(THEIS_STEHFEST, result, 1e-6);
            assertGrid(THEIS_CLOSED, result, 1e-5);
        }

        @Test
        @DisplayName("Pozo con radio finito y frontera exterior: vía Laplace de una zona")
        void theis_boundedDomain_shouldUseLaplacePath() {
            PumpingTestConfig bounded = test.withWellRadius(0.1).withOuterRadius(20.0);

            StructuredHeadResult result = structured(simulator.theis(bounded, 1e-3, 1e-3));

            assertGrid(new double[][]{
                    {-0.24982446732640132, -0.14525167301197808, -0.089867961339951},
                    {-0.4288462197348529, -0.3190470642504084, -0.25537597482525043}
            }, result, 1e-6);
        }

        @Test
        @DisplayName("Un modelo de discos con zonas iguales equivale a Theis")
        void diskModel_identicalZones_shouldMatchTheis() {
            StructuredHeadResult result = structured(simulator.diskModel(test, new double[]{1.5, 2.5},
                    new double[]{1e-3, 1e-3, 1e-3}, new double[]{1e-3, 1e-3, 1e-3}));

            assertGrid(THEIS_CLOSED, result, 1e-5);
        }
    }

    @Nested
    @DisplayName("Modelo de discos")
    class DiskModel {

        @Test
        @DisplayName("Dos zonas, frontera en r = 2: valores de referencia")
        void diskModel_twoZones_shouldMatchReference() {
            StructuredHeadResult result = structured(simulator.diskModel(test, new double[]{2.0},
                    new double[]{1e-3, 2e-3}, new double[]{1e-3, 1e-3}));

            assertGrid(new double[][]{
                    {-0.20312814124334752, -0.09605674877510247, -0.06636862107715319},
                    {-0.29785979076950403, -0.18784251214407724, -0.1558259713729678}
            }, result, 1e-6);
        }

        @Test
        @DisplayName("Pozo de radio finito y frontera exterior fija")
        void diskModel_finiteWellAndBoundary_shouldMatchReference() {
            PumpingTestConfig bounded = test.withWellRadius(0.1).withOuterRadius(10.0);

            StructuredHeadResult result = structured(simulator.diskModel(bounded, new double[]{2.0},
                    new double[]{1e-3, 2e-3}, new double[]{1e-3, 2e-3}));

            assertGrid(new double[][]{
                    {-0.18605104971747516, -0.07845606658877988, -0.049088685615801174},
                    {-0.2382173626268162, -0.12790750152842748, -0.09565027907164961}
            }, result, 1e-6);
        }

        @Test
        @DisplayName("Con bombeo, el nivel crece con el radio y baja con el tiempo")
        void diskModel_pumping_shouldBeMonotonic() {
            PumpingTestConfig dense = test
                    .withRadii(new double[]{0.5, 1.0, 2.0, 4.0, 8.0})
                    .withTimes(new double[]{10.0, 100.0, 1000.0});

            StructuredHeadResult result = structured(simulator.diskModel(dense, new double[]{2.0, 5.0},
                    new double[]{1e-3, 5e-3, 2e-3}, new double[]{1e-3, 1e-4, 1e-3}));

            for (int t = 0; t < 3; t++) {
                for (int r = 1; r < 5; r++) {
                    assertThat(result.headAt(t, r)).isGreaterThanOrEqualTo(result.headAt(t, r - 1));
                }
            }
            for (int r = 0; r < 5; r++) {
                for (int t = 1; t < 3; t++) {
                    assertThat(result.headAt(t, r)).isLessThanOrEqualTo(result.headAt(t - 1, r));
                }
            }
        }
    }

    @Nested
    @DisplayName("Forma de la salida")
    class OutputShape {

        @Test
        @DisplayName("El nivel de referencia se suma a todos los puntos")
        void referenceHead_shouldShiftWholeGrid() {
            StructuredHeadResult base = structured(simulator.theis(test, 1e-3, 1e-3));
            StructuredHeadResult shifted = structured(simulator.theis(test.withReferenceHead(2.0), 1e-3, 1e-3));

            for (int t = 0; t < 2; t++) {
                for (int r = 0; r < 3; r++) {
                    assertEquals(base.headAt(t, r) + 2.0, shifted.headAt(t, r), 1e-12);
                }
            }
        }

        @Test
        @DisplayName("Modo por puntos: diagonal de la malla completa")
        void pointwise_shouldReturnDiagonal() {
            PumpingTestConfig square = test.withTimes(new double[]{10.0, 100.0, 1000.0});
            double[] zoneRadii = {2.0};
            double[] t = {1e-3, 2e-3};
            double[] s = {1e-3, 1e-3};

            StructuredHeadResult grid = structured(simulator.diskModel(square, zoneRadii, t, s));
            HeadResult paired = simulator.diskModel(square.withGridMode(GridMode.POINTWISE), zoneRadii, t, s);

            assertThat(paired).isInstanceOf(PointwiseHeadResult.class);
            assertThat(paired.getLayout()).isEqualTo(GridMode.POINTWISE);
            assertArrayEquals(grid.diagonal().getHeads(), ((PointwiseHeadResult) paired).getHeads(), 0.0);
        }
    }

    @Nested
    @DisplayName("Acuífero heterogéneo")
    class Heterogeneous {

        @Test
        @DisplayName("Theis extendido 2D con varianza despreciable tiende a Theis")
        void extTheis2D_vanishingVariance_shouldApproachTheis() {
            HeterogeneityConfig aquifer = HeterogeneityConfig.getTestingAquifer().withLogVariance(1e-8);

            StructuredHeadResult result = structured(simulator.extTheis2D(test, aquifer, 1e-3));

            assertGrid(THEIS_CLOSED, result, 1e-4);
        }

        @Test
        @DisplayName("Theis extendido 2D: la heterogeneidad con media armónica aumenta el descenso cerca del pozo")
        void extTheis2D_harmonicWell_shouldDeepenDrawdownNearWell() {
            StructuredHeadResult homogeneous = structured(simulator.theis(test, 1e-3, 1e-3));
            StructuredHeadResult heterogeneous = structured(
                    simulator.extTheis2D(test, HeterogeneityConfig.getTestingAquifer(), 1e-3));
            log.info("Theis extendido 2D: {}", Arrays.deepToString(heterogeneous.getHeads()));

            assertThat(heterogeneous.headAt(1, 0)).isLessThan(homogeneous.headAt(1, 0));
            assertGrid(new double[][]{
                    {-0.3381231, -0.17430066, -0.09492601},
                    {-0.58557452, -0.40907021, -0.31112835}
            }, heterogeneous, 1e-6);
        }

        @Test
        @DisplayName("Theis extendido 3D isótropo de espesor unidad: valores de referencia")
        void extTheis3D_isotropicUnitThickness_shouldMatchReference() {
            HeterogeneityConfig aquifer = HeterogeneityConfig.getTestingAquifer();

            StructuredHeadResult result = structured(simulator.extTheis3D(test, aquifer, 1e-3));
            log.info("Theis extendido 3D: {}", Arrays.deepToString(result.getHeads()));

            assertGrid(new double[][]{
                    {-0.32845576, -0.16741654, -0.09134294},
                    {-0.54238241, -0.36982686, -0.27754856}
            }, result, 1e-6);
        }

        @Test
        @DisplayName("Theis extendido 3D: el caudal se reparte en el espesor")
        void extTheis3D_shouldScaleWithThickness() {
            HeterogeneityConfig aquifer = HeterogeneityConfig.getTestingAquifer().withAnisotropyRatio(0.5);

            StructuredHeadResult thin = structured(simulator.extTheis3D(test, aquifer, 1e-3));
            StructuredHeadResult thick = structured(simulator.extTheis3D(test, aquifer.withThickness(2.0), 1e-3));

            for (int t = 0; t < 2; t++) {
                for (int r = 0; r < 3; r++) {
                    assertEquals(0.5 * thin.headAt(t, r), thick.headAt(t, r), Math.abs(thin.headAt(t, r)) * 1e-12);
                }
            }
        }

        @Test
        @DisplayName("Un número de discos menor que 2 debe rechazarse")
        void extTheis2D_singlePartition_shouldThrow() {
            HeterogeneityConfig aquifer = HeterogeneityConfig.getTestingAquifer().withPartitions(1);

            assertThatThrownBy(() -> simulator.extTheis2D(test, aquifer, 1e-3))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Validación de entrada")
    class Validation {

        @Test
        @DisplayName("Modo por puntos con longitudes distintas")
        void pointwise_mismatchedLengths_shouldThrow() {
            assertThatThrownBy(() -> simulator.theis(test.withGridMode(GridMode.POINTWISE), 1e-3, 1e-3))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("coincidir");
        }

        @Test
        @DisplayName("Orden de Stehfest impar o menor que 2")
        void invalidStehfestOrder_shouldThrow() {
            assertThatThrownBy(() -> simulator.theis(test.withStehfestOrder(7), 1e-3, 1e-3))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> simulator.theis(test.withStehfestOrder(0), 1e-3, 1e-3))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Radios dentro del pozo, tiempos no positivos y propiedades no positivas")
        void invalidPoints_shouldThrow() {
            assertThatThrownBy(() -> simulator.theis(test.withWellRadius(1.5), 1e-3, 1e-3))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> simulator.theis(test.withTimes(new double[]{0.0, 10.0}), 1e-3, 1e-3))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> simulator.theis(test, -1e-3, 1e-3))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> simulator.theis(test.withOuterRadius(0.0), 1e-3, 1e-3))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Radios de zona desordenados o fuera del dominio")
        void invalidZoneRadii_shouldThrow() {
            double[] t = {1e-3, 1e-3, 1e-3};
            assertThatThrownBy(() -> simulator.diskModel(test, new double[]{3.0, 2.0}, t, t))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> simulator.diskModel(test.withOuterRadius(2.5), new double[]{2.0, 3.0}, t, t))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Con varios hilos el ensayo da el mismo resultado que en secuencial")
    void parallelSimulator_shouldMatchSequential() {
        PumpingTestConfig longer = test.withTimes(new double[]{1.0, 10.0, 100.0, 1000.0});
        double[] zoneRadii = {2.0};
        double[] t = {1e-3, 2e-3};
        double[] s = {1e-3, 1e-3};

        StructuredHeadResult sequential = structured(simulator.diskModel(longer, zoneRadii, t, s));
        StructuredHeadResult parallel;
        try (PumpingTestSimulator pooled = new PumpingTestSimulator(SolverConfig.builder().cpuProcessorCount(3).build())) {
            parallel = structured(pooled.diskModel(longer, zoneRadii, t, s));
        }

        for (int i = 0; i < 4; i++) {
            assertArrayEquals(sequential.profileAt(i), parallel.profileAt(i), 0.0);
        }
    }
}
