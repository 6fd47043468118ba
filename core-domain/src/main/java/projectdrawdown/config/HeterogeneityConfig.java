package projectdrawdown.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;
import projectdrawdown.physics.model.WellValue;

/**
 * Descripción estadística de un acuífero heterogéneo.
 * <p>
 * La propiedad (transmisividad en 2D, conductividad en 3D) sigue una distribución
 * log-normal con función de correlación gaussiana. Estos parámetros alimentan los
 * modelos de escalado ({@code CoarseGrainedTransmissivity}, {@code CoarseGrainedConductivity})
 * que generan el perfil radial efectivo usado por el modelo de discos.
 */
@Value
@Builder
@With
@Jacksonized
public class HeterogeneityConfig {

    /**
     * Media geométrica de la propiedad (T_G o K_G).
     */
    double geometricMean;

    /**
     * Varianza del logaritmo de la propiedad (σ²).
     */
    double logVariance;

    /**
     * Longitud de correlación horizontal [m].
     */
    double correlationLength;

    /**
     * Relación de anisotropía entre longitudes de correlación vertical y horizontal (0, 1].
     * Solo se usa en 3D.
     */
    @Builder.Default
    double anisotropyRatio = 1.0;

    /**
     * Espesor del acuífero [m]. Solo se usa en 3D.
     */
    @Builder.Default
    double thickness = 1.0;

    /**
     * Factor de proporcionalidad del procedimiento de escalado.
     */
    @Builder.Default
    double proportionalityFactor = 1.6;

    /**
     * Valor de la propiedad en el pozo.
     */
    @Builder.Default
    WellValue wellValue = WellValue.harmonicMean();

    /**
     * Error relativo admitido respecto al valor de campo lejano, usado para situar
     * el último radio de la partición.
     */
    @Builder.Default
    double farFieldRelativeError = 0.01;

    /**
     * Número de discos en que se divide el dominio radial.
     */
    @Builder.Default
    int partitions = 30;

    public static HeterogeneityConfig getTestingAquifer() {
        return HeterogeneityConfig.builder()
                .geometricMean(1e-3)
                .logVariance(1.0)
                .correlationLength(10.0)
                .build();
    }
}
