package projectdrawdown.physics.model;

import lombok.Getter;
import projectdrawdown.config.HeterogeneityConfig;

/**
 * Conductividad efectiva radial en 3D con anisotropía vertical ("Coarse Graining").
 * <p>
 * <pre>
 *   K(r)   = K_efu · exp( χ / (1 + (prop·r / (ℓ·e^(1/3)))²)^(3/2) )
 *   K_efu  = K_G · exp( σ² (1/2 - a(e)) )
 * </pre>
 * con {@code a(e)} la función de anisotropía. χ vale {@code σ²(a(e) - 1)} con la
 * media armónica, {@code σ² a(e)} con la aritmética y {@code ln(K_w / K_efu)}
 * con un valor explícito.
 */
public class CoarseGrainedConductivity implements UpscaledPropertyModel {

    @Getter
    private final double effectiveConductivity;
    @Getter
    private final double correlationLength;
    @Getter
    private final double anisotropyRatio;
    @Getter
    private final double chi;

    // (prop / (ℓ·e^(1/3)))²
    private final double scale;

    /**
     * @param geometricMean         Media geométrica K_G (> 0).
     * @param logVariance           Varianza log-normal σ² (> 0).
     * @param correlationLength     Longitud de correlación horizontal ℓ (> 0).
     * @param anisotropyRatio       Relación de anisotropía e, en (0, 1].
     * @param proportionalityFactor Factor de proporcionalidad del escalado (> 0).
     * @param wellValue             Política para el valor en el pozo.
     */
    public CoarseGrainedConductivity(double geometricMean, double logVariance, double correlationLength,
                                     double anisotropyRatio, double proportionalityFactor, WellValue wellValue) {
        if (!(geometricMean > 0.0)) {
            throw new IllegalArgumentException("La conductividad media geométrica debe ser positiva.");
        }
        if (!(logVariance > 0.0)) {
            throw new IllegalArgumentException("La varianza debe ser positiva.");
        }
        if (!(correlationLength > 0.0)) {
            throw new IllegalArgumentException("La longitud de correlación debe ser positiva.");
        }
        if (!(proportionalityFactor > 0.0)) {
            throw new IllegalArgumentException("El factor de proporcionalidad debe ser positivo.");
        }
        double aniso = anisotropy(anisotropyRatio);

        this.correlationLength = correlationLength;
        this.anisotropyRatio = anisotropyRatio;
        this.effectiveConductivity = geometricMean * Math.exp(logVariance * (0.5 - aniso));

        double denominator = correlationLength * Math.cbrt(anisotropyRatio);
        this.scale = (proportionalityFactor / denominator) * (proportionalityFactor / denominator);

        switch (wellValue.kind()) {
            case ARITHMETIC_MEAN -> this.chi = logVariance * aniso;
            case EXPLICIT -> this.chi = Math.log(wellValue.value()) - Math.log(effectiveConductivity);
            default -> this.chi = logVariance * (aniso - 1.0);
        }
    }

    public static CoarseGrainedConductivity from(HeterogeneityConfig config) {
        return new CoarseGrainedConductivity(
                config.getGeometricMean(),
                config.getLogVariance(),
                config.getCorrelationLength(),
                config.getAnisotropyRatio(),
                config.getProportionalityFactor(),
                config.getWellValue());
    }

    /**
     * Función de anisotropía {@code a(e)} para la relación de longitudes de
     * correlación vertical/horizontal. Crece de 0 (e → 0) a 1/3 (isótropo).
     *
     * @param e Relación de anisotropía en (0, 1].
     */
    public static double anisotropy(double e) {
        if (!(e > 0.0 && e <= 1.0)) {
            throw new IllegalArgumentException("La relación de anisotropía debe estar en (0, 1]: " + e);
        }
        if (e == 1.0) {
            return 1.0 / 3.0;
        }
        double oneMinusE2 = 1.0 - e * e;
        return e / (2.0 * oneMinusE2)
                * (Math.atan(Math.sqrt(1.0 / (e * e) - 1.0)) / Math.sqrt(oneMinusE2) - e);
    }

    @Override
    public double valueAt(double radius) {
        double base = Math.sqrt(1.0 + scale * radius * radius);
        return effectiveConductivity * Math.exp(chi / (base * base * base));
    }

    @Override
    public double getFarFieldValue() {
        return effectiveConductivity;
    }

    @Override
    public double cutoffRadius(double relativeError) {
        UpscaledPropertyModel.checkRelativeError(relativeError);
        double bound = chi > 0.0 ? Math.log1p(relativeError) : Math.log1p(-relativeError);
        if (Math.abs(chi) <= Math.abs(bound)) {
            return correlationLength;
        }
        // (1 + C r²)^(3/2) = χ / bound
        double base = Math.pow(chi / bound, 2.0 / 3.0);
        return Math.sqrt((base - 1.0) / scale);
    }
}
