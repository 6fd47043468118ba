package projectdrawdown.physics.solver;

/**
 * Función vectorial en el espacio de Laplace: para cada parámetro {@code s}
 * devuelve un valor por punto de evaluación.
 */
@FunctionalInterface
public interface LaplaceSpaceFunction {

    /**
     * Evalúa la función en un único parámetro de Laplace real.
     *
     * @param s Parámetro de Laplace (> 0).
     * @return Un valor por punto de evaluación.
     */
    double[] solveAt(double s);

    /**
     * Evaluación por lotes sobre todos los nodos de un instante.
     * El inversor llama a este método una sola vez por tiempo.
     *
     * @return Matriz {@code [nodo][punto]}.
     */
    default double[][] evaluate(double[] nodes) {
        double[][] values = new double[nodes.length][];
        for (int k = 0; k < nodes.length; k++) {
            values[k] = solveAt(nodes[k]);
        }
        return values;
    }
}
