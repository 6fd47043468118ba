package projectdrawdown.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Parámetros de llamada de un ensayo de bombeo transitorio.
 * <p>
 * Agrupa los puntos de evaluación (radios y tiempos), la condición de bombeo,
 * las fronteras del dominio radial y los ajustes de la inversión numérica.
 * Es un objeto de valor inmutable; las variantes se crean con {@code withX(...)}.
 */
@Value
@Builder
@With
@Jacksonized
public class PumpingTestConfig {

    /**
     * Radios de evaluación [m]. Deben ser positivos y no menores que el radio del pozo.
     */
    double[] radii;

    /**
     * Instantes de evaluación [s]. Deben ser estrictamente positivos.
     */
    double[] times;

    /**
     * Caudal de bombeo [m³/s]. Negativo para extracción.
     */
    double pumpingRate;

    /**
     * Radio interior (cara del pozo). 0 equivale a un pozo puntual.
     */
    @Builder.Default
    double wellRadius = 0.0;

    /**
     * Radio exterior del acuífero. Infinito para un acuífero no acotado.
     */
    @Builder.Default
    double outerRadius = Double.POSITIVE_INFINITY;

    /**
     * Nivel de referencia en la frontera exterior, sumado a todo el resultado.
     */
    @Builder.Default
    double referenceHead = 0.0;

    /**
     * Número de términos del algoritmo de Stehfest (par, mayor que 1).
     */
    @Builder.Default
    int stehfestOrder = 12;

    /**
     * Forma de la salida: malla completa tiempo x radio o pares (radio, tiempo).
     */
    @Builder.Default
    GridMode gridMode = GridMode.STRUCTURED;

    @JsonIgnore
    public boolean isPointWell() {
        return wellRadius == 0.0;
    }

    @JsonIgnore
    public boolean isUnbounded() {
        return Double.isInfinite(outerRadius);
    }

    /**
     * Escenario de referencia: pozo puntual en acuífero infinito, tres radios y dos tiempos.
     */
    public static PumpingTestConfig getTestingPumpingTest() {
        return PumpingTestConfig.builder()
                .radii(new double[]{1.0, 2.0, 3.0})
                .times(new double[]{10.0, 100.0})
                .pumpingRate(-1e-3)
                .build();
    }

    /**
     * Disposición de los puntos de evaluación.
     */
    public enum GridMode {
        /**
         * Producto cartesiano: cada tiempo se evalúa en todos los radios.
         */
        STRUCTURED,

        /**
         * Puntos emparejados: el i-ésimo tiempo con el i-ésimo radio.
         * Ambos arrays deben tener la misma longitud.
         */
        POINTWISE
    }
}
