package projectdrawdown.domain.simulation;

import lombok.Builder;
import lombok.Value;
import projectdrawdown.config.PumpingTestConfig.GridMode;

/**
 * Resultado sobre puntos (radio, tiempo) emparejados elemento a elemento.
 */
@Value
@Builder
public class PointwiseHeadResult implements HeadResult {

    double[] times;

    double[] radii;

    /**
     * {@code heads[i]} es el nivel en {@code radii[i]} en el instante {@code times[i]}.
     */
    double[] heads;

    long computationTime;

    public double headAt(int index) {
        return heads[index];
    }

    @Override
    public GridMode getLayout() {
        return GridMode.POINTWISE;
    }

    @Override
    public int getPointCount() {
        return heads.length;
    }
}
