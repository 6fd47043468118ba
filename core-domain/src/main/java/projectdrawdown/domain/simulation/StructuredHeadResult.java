package projectdrawdown.domain.simulation;

import lombok.Builder;
import lombok.Value;
import projectdrawdown.config.PumpingTestConfig.GridMode;

/**
 * Resultado sobre la malla completa tiempo x radio.
 * <p>
 * Layout: {@code heads[timeIndex][radiusIndex]}, igual que la salida de la
 * inversión de Laplace.
 */
@Value
@Builder
public class StructuredHeadResult implements HeadResult {

    double[] times;

    double[] radii;

    /**
     * Niveles indexados por [tiempo][radio].
     */
    double[][] heads;

    long computationTime;

    public double headAt(int timeIndex, int radiusIndex) {
        return heads[timeIndex][radiusIndex];
    }

    /**
     * Perfil radial (copia) en un instante.
     */
    public double[] profileAt(int timeIndex) {
        return heads[timeIndex].clone();
    }

    /**
     * Evolución temporal en un radio (curva de descenso de un piezómetro).
     */
    public double[] timeSeriesAt(int radiusIndex) {
        double[] series = new double[times.length];
        for (int t = 0; t < times.length; t++) {
            series[t] = heads[t][radiusIndex];
        }
        return series;
    }

    /**
     * Extrae la diagonal {@code heads[i][i]} como resultado de puntos emparejados.
     *
     * @throws IllegalStateException si la malla no es cuadrada.
     */
    public PointwiseHeadResult diagonal() {
        if (times.length != radii.length) {
            throw new IllegalStateException(String.format(
                    "La diagonal requiere una malla cuadrada (%d tiempos, %d radios).", times.length, radii.length));
        }
        double[] values = new double[times.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = heads[i][i];
        }
        return PointwiseHeadResult.builder()
                .times(times.clone())
                .radii(radii.clone())
                .heads(values)
                .computationTime(computationTime)
                .build();
    }

    @Override
    public GridMode getLayout() {
        return GridMode.STRUCTURED;
    }

    @Override
    public int getPointCount() {
        return times.length * radii.length;
    }
}
