package projectdrawdown.physics.solver;

/**
 * Identificación común de las piezas numéricas del ensayo de bombeo: la
 * función de nivel en el espacio de Laplace y el algoritmo que la invierte.
 * El simulador la usa para dejar en el log qué combinación resolvió cada ensayo.
 */
public interface SolverComponent {

    /**
     * Nombre corto, estable entre ejecuciones.
     */
    String getName();

    /**
     * Resumen de la configuración concreta de la instancia (zonas, orden de inversión...).
     */
    default String getDescription() {
        return getName();
    }
}
