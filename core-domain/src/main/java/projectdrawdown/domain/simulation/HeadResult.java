package projectdrawdown.domain.simulation;

import projectdrawdown.config.PumpingTestConfig.GridMode;

/**
 * Contrato común para los resultados de nivel piezométrico.
 * <p>
 * Desacopla la forma de la salida (malla completa tiempo x radio o puntos
 * emparejados) de quien la consume. El tipo concreto lo decide el
 * {@link GridMode} del llamante, nunca un redimensionado posterior.
 */
public interface HeadResult {

    /**
     * Instantes evaluados [s], en el orden de la petición.
     */
    double[] getTimes();

    /**
     * Radios evaluados [m], en el orden de la petición.
     */
    double[] getRadii();

    /**
     * Tiempo de cómputo en milisegundos (métrica de rendimiento).
     */
    long getComputationTime();

    /**
     * Disposición de los valores.
     */
    GridMode getLayout();

    /**
     * Número total de valores de nivel almacenados.
     */
    int getPointCount();
}
