package projectdrawdown.physics.model;

import lombok.Getter;
import projectdrawdown.config.HeterogeneityConfig;

/**
 * Transmisividad efectiva radial en 2D ("Coarse Graining").
 * <p>
 * Para una transmisividad log-normal con correlación gaussiana el perfil es
 * <pre>
 *   T(r) = T_G · exp( χ / (1 + (prop·r/ℓ)²) )
 * </pre>
 * donde χ fija el valor en el pozo: {@code -σ²/2} con la media armónica,
 * {@code +σ²/2} con la aritmética y {@code ln(T_w/T_G)} con un valor explícito.
 * Lejos del pozo el perfil tiende a la media geométrica.
 */
public class CoarseGrainedTransmissivity implements UpscaledPropertyModel {

    @Getter
    private final double geometricMean;
    @Getter
    private final double correlationLength;
    @Getter
    private final double proportionalityFactor;
    /**
     * Exponente en el pozo, ya resuelto desde la política {@link WellValue}.
     */
    @Getter
    private final double chi;

    /**
     * @param geometricMean         Media geométrica T_G (> 0).
     * @param logVariance           Varianza log-normal σ² (> 0).
     * @param correlationLength     Longitud de correlación ℓ (> 0).
     * @param proportionalityFactor Factor de proporcionalidad del escalado (> 0).
     * @param wellValue             Política para el valor en el pozo.
     */
    public CoarseGrainedTransmissivity(double geometricMean, double logVariance, double correlationLength,
                                       double proportionalityFactor, WellValue wellValue) {
        if (!(geometricMean > 0.0)) {
            throw new IllegalArgumentException("La transmisividad media geométrica debe ser positiva.");
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
        this.geometricMean = geometricMean;
        this.correlationLength = correlationLength;
        this.proportionalityFactor = proportionalityFactor;

        switch (wellValue.kind()) {
            case ARITHMETIC_MEAN -> this.chi = logVariance / 2.0;
            case EXPLICIT -> this.chi = Math.log(wellValue.value()) - Math.log(geometricMean);
            default -> this.chi = -logVariance / 2.0;
        }
    }

    public static CoarseGrainedTransmissivity from(HeterogeneityConfig config) {
        return new CoarseGrainedTransmissivity(
                config.getGeometricMean(),
                config.getLogVariance(),
                config.getCorrelationLength(),
                config.getProportionalityFactor(),
                config.getWellValue());
    }

    @Override
    public double valueAt(double radius) {
        double scaled = proportionalityFactor * radius / correlationLength;
        return geometricMean * Math.exp(chi / (1.0 + scaled * scaled));
    }

    @Override
    public double getFarFieldValue() {
        return geometricMean;
    }

    @Override
    public double cutoffRadius(double relativeError) {
        UpscaledPropertyModel.checkRelativeError(relativeError);
        // T/T_G - 1 tiene el signo de χ
        double bound = chi > 0.0 ? Math.log1p(relativeError) : Math.log1p(-relativeError);
        if (Math.abs(chi) <= Math.abs(bound)) {
            return correlationLength;
        }
        return correlationLength / proportionalityFactor * Math.sqrt(chi / bound - 1.0);
    }
}
