package projectdrawdown.physics.solver.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectdrawdown.physics.model.WellValue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class WellFlowEquationsTest {

    private static final double[] RADII = {1.0, 2.0, 3.0};

    private static void assertRelative(double[] expected, double[] actual, double tolerance) {
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], actual[i], Math.abs(expected[i]) * tolerance, "Índice " + i);
        }
    }

    @Test
    @DisplayName("Theis: valores de referencia en la malla 2 x 3")
    void theis_shouldMatchReference() {
        double[][] heads = WellFlowEquations.theis(RADII, new double[]{10.0, 100.0}, 1e-3, 1e-3, -1e-3);

        assertRelative(new double[]{-0.24959540821048085, -0.14506367943154536, -0.08971484639870983}, heads[0], 1e-10);
        assertRelative(new double[]{-0.4310510557745736, -0.32132822598150224, -0.257783131815409}, heads[1], 1e-10);
    }

    @Test
    @DisplayName("Thiem: nivel logarítmico respecto al radio de referencia")
    void thiem_shouldMatchReference() {
        double[] heads = WellFlowEquations.thiem(RADII, 10.0, 0.001, -0.001, 0.0);

        assertRelative(new double[]{-0.3664678, -0.25615, -0.19161822}, heads, 1e-6);
        assertThat(WellFlowEquations.thiem(new double[]{10.0}, 10.0, 0.001, -0.001, 1.5)[0]).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Thiem extendido 2D (media armónica en el pozo)")
    void extThiem2D_shouldMatchReference() {
        double[] heads = WellFlowEquations.extThiem2D(RADII, 10.0, 0.001, 1.0, 10.0, -0.001, 0.0,
                WellValue.harmonicMean(), 1.6);

        assertRelative(new double[]{-0.5308459627684508, -0.3536302893531488, -0.25419374501740194}, heads, 1e-10);
    }

    @Test
    @DisplayName("Thiem extendido 3D isótropo (media armónica en el pozo)")
    void extThiem3D_shouldMatchReference() {
        double[] heads = WellFlowEquations.extThiem3D(RADII, 10.0, 0.001, 1.0, 10.0, 1.0, -0.001, 1.0, 0.0,
                WellValue.harmonicMean(), 1.6);

        assertRelative(new double[]{-0.48828025817550647, -0.31472059141946707, -0.22043022024582196}, heads, 1e-10);
    }

    @Test
    @DisplayName("Thiem extendido 2D con varianza despreciable tiende a Thiem")
    void extThiem2D_vanishingVariance_shouldApproachThiem() {
        double[] extended = WellFlowEquations.extThiem2D(RADII, 10.0, 0.001, 1e-8, 10.0, -0.001, 0.0,
                WellValue.harmonicMean(), 1.6);
        double[] homogeneous = WellFlowEquations.thiem(RADII, 10.0, 0.001, -0.001, 0.0);

        assertRelative(homogeneous, extended, 1e-6);
    }

    @Test
    @DisplayName("Radios o radio de referencia no positivos deben rechazarse")
    void invalidRadii_shouldThrow() {
        assertThatThrownBy(() -> WellFlowEquations.thiem(new double[]{0.0}, 10.0, 1e-3, -1e-3, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WellFlowEquations.thiem(RADII, 0.0, 1e-3, -1e-3, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WellFlowEquations.extThiem3D(RADII, 10.0, 1e-3, 1.0, 10.0, 1.0, -1e-3, 0.0, 0.0,
                WellValue.harmonicMean(), 1.6))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
