package projectdrawdown.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Configuración del motor numérico (no del acuífero).
 */
@Value
@Builder
@With
@Jacksonized
public class SolverConfig {

    /**
     * Número de hilos CPU para repartir los instantes de la inversión.
     * Con 1 (por defecto) todo se evalúa en el hilo llamante.
     */
    @Builder.Default
    int cpuProcessorCount = 1;

    @JsonIgnore
    public boolean isParallel() {
        return cpuProcessorCount > 1;
    }

    public static SolverConfig sequential() {
        return SolverConfig.builder().build();
    }
}
