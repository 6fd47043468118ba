package projectdrawdown.physics.model;

/**
 * Define el contrato para los modelos que convierten la estadística de un
 * acuífero heterogéneo en un perfil radial efectivo de la propiedad
 * hidráulica (transmisividad o conductividad) alrededor del pozo.
 * <p>
 * El perfil pasa de un valor en el pozo a un valor de campo lejano; las
 * implementaciones son deterministas e inmutables.
 */
public interface UpscaledPropertyModel {

    /**
     * Valor efectivo de la propiedad a una distancia {@code radius} del pozo.
     */
    double valueAt(double radius);

    /**
     * Valor en el centro del pozo ({@code r = 0}).
     */
    default double getWellValue() {
        return valueAt(0.0);
    }

    /**
     * Límite del perfil cuando {@code r → ∞}.
     */
    double getFarFieldValue();

    /**
     * Radio a partir del cual el perfil difiere del valor de campo lejano
     * en menos de {@code relativeError} (relativo).
     *
     * @param relativeError Error relativo admitido, en (0, 1).
     */
    double cutoffRadius(double relativeError);

    default double[] profile(double[] radii) {
        double[] values = new double[radii.length];
        for (int i = 0; i < radii.length; i++) {
            values[i] = valueAt(radii[i]);
        }
        return values;
    }

    /**
     * Validación común para el error relativo de corte.
     */
    static void checkRelativeError(double relativeError) {
        if (!(relativeError > 0.0 && relativeError < 1.0)) {
            throw new IllegalArgumentException("El error relativo respecto al campo lejano debe estar en (0, 1): " + relativeError);
        }
    }
}
