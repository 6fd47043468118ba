package projectdrawdown.physics.solver;

public interface LaplaceInversion extends SolverComponent {
    /**
     * Devuelve la transformada inversa de {@code function} en cada instante.
     *
     * @param times Instantes de evaluación (> 0).
     * @return Matriz {@code [tiempo][punto]}.
     */
    double[][] invert(LaplaceSpaceFunction function, double[] times);
}
