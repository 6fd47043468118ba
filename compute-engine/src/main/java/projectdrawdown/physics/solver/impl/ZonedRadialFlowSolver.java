package projectdrawdown.physics.solver.impl;

import cern.colt.matrix.DoubleMatrix1D;
import cern.colt.matrix.DoubleMatrix2D;
import cern.colt.matrix.impl.DenseDoubleMatrix1D;
import cern.colt.matrix.impl.SparseDoubleMatrix2D;
import cern.colt.matrix.linalg.LUDecompositionQuick;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectdrawdown.domain.aquifer.ZonePartition;
import projectdrawdown.physics.solver.LaplaceSpaceFunction;
import projectdrawdown.physics.solver.SolverComponent;

import static projectdrawdown.physics.special.ModifiedBessel.i0;
import static projectdrawdown.physics.special.ModifiedBessel.i1;
import static projectdrawdown.physics.special.ModifiedBessel.k0;
import static projectdrawdown.physics.special.ModifiedBessel.k1;

/**
 * Solución en el espacio de Laplace del flujo radial transitorio en un acuífero
 * confinado dividido en discos concéntricos.
 * <p>
 * En cada zona la solución es {@code h(r) = A·I0(Cs·r) + B·K0(Cs·r)} con
 * {@code Cs = sqrt(s·S/T)}. Los coeficientes salen de:
 * <ul>
 * <li>la condición de bombeo en el radio interior,</li>
 * <li>continuidad de nivel y de flujo en cada frontera entre zonas,</li>
 * <li>nivel nulo en la frontera exterior (o acotación en el infinito).</li>
 * </ul>
 * Una zona se resuelve en forma cerrada; varias zonas montan un sistema
 * pentadiagonal de tamaño 2N que se resuelve con LU con pivoteo (Colt).
 * Con pozo de radio finito, la condición de bombeo actúa sobre {@code A0} y
 * {@code B0} (columnas 0 y 1), no sobre la columna 2 como en la formulación
 * por diagonales de la que procede el método.
 * <p>
 * Los valores no finitos (desbordamiento de I0 a argumentos grandes, sistema
 * singular) se sustituyen por cero. La instancia es inmutable y segura entre hilos.
 */
@Slf4j
public class ZonedRadialFlowSolver implements LaplaceSpaceFunction, SolverComponent {

    @Getter
    private final ZonePartition partition;
    @Getter
    private final double pumpingRate;
    private final double[] radii;

    // Zona de cada radio de evaluación (-1 fuera del dominio)
    private final int[] zoneOfRadius;
    // sqrt(S_i / T_i)
    private final double[] lambda;
    // Qw / (2π T0)
    private final double wellFlux;
    private final boolean matrixPath;

    public ZonedRadialFlowSolver(ZonePartition partition, double pumpingRate, double[] radii) {
        this(partition, pumpingRate, radii, false);
    }

    /**
     * @param forceMatrixPath Resuelve por el sistema lineal aunque haya una sola zona.
     */
    ZonedRadialFlowSolver(ZonePartition partition, double pumpingRate, double[] radii, boolean forceMatrixPath) {
        if (partition == null) {
            throw new IllegalArgumentException("La partición no puede ser nula.");
        }
        if (radii == null) {
            throw new IllegalArgumentException("Los radios de evaluación no pueden ser nulos.");
        }
        if (Double.isNaN(pumpingRate) || Double.isInfinite(pumpingRate)) {
            throw new IllegalArgumentException("El caudal de bombeo debe ser finito: " + pumpingRate);
        }
        for (double r : radii) {
            if (!(r > 0.0) || Double.isInfinite(r)) {
                throw new IllegalArgumentException("Los radios de evaluación deben ser positivos y finitos: " + r);
            }
        }

        this.partition = partition;
        this.pumpingRate = pumpingRate;
        this.radii = radii.clone();
        this.matrixPath = forceMatrixPath || partition.getZoneCount() > 1;

        int zones = partition.getZoneCount();
        this.lambda = new double[zones];
        for (int i = 0; i < zones; i++) {
            lambda[i] = Math.sqrt(partition.getStorativityAt(i) / partition.getTransmissivityAt(i));
        }
        this.wellFlux = pumpingRate / (2.0 * Math.PI * partition.getTransmissivityAt(0));

        this.zoneOfRadius = new int[this.radii.length];
        for (int p = 0; p < this.radii.length; p++) {
            zoneOfRadius[p] = partition.zoneIndexOf(this.radii[p]);
        }
    }

    public double[] getRadii() {
        return radii.clone();
    }

    @Override
    public double[] solveAt(double s) {
        if (!(s > 0.0) || Double.isInfinite(s)) {
            throw new IllegalArgumentException("El parámetro de Laplace debe ser positivo y finito: " + s);
        }
        double[] coefficients = matrixPath ? solveSystem(s) : solveSingleZone(s);
        return heads(s, coefficients);
    }

    /**
     * Coeficientes (A, B) de una única zona en forma cerrada.
     */
    private double[] solveSingleZone(double s) {
        double cs = Math.sqrt(s) * lambda[0];
        double qs = wellFlux / s;
        double r0 = partition.getInnerRadius();
        double rn = partition.getOuterRadius();
        boolean unbounded = partition.isUnbounded();

        double a;
        double b;
        if (partition.isPointWell()) {
            b = qs;
            a = unbounded ? 0.0 : -qs * k0(cs * rn) / i0(cs * rn);
        } else if (unbounded) {
            a = 0.0;
            b = qs / (cs * r0 * k1(cs * r0));
        } else {
            double det = i1(cs * r0) * k0(cs * rn) + k1(cs * r0) * i0(cs * rn);
            a = -qs / (cs * r0) * k0(cs * rn) / det;
            b = qs / (cs * r0) * i0(cs * rn) / det;
        }
        return maskNonFinite(new double[]{a, b}, s);
    }

    /**
     * Monta y resuelve el sistema {@code M·X = V} de tamaño 2N.
     * Incógnitas: {@code X[2i] = A_i}, {@code X[2i+1] = B_i}.
     */
    private double[] solveSystem(double s) {
        int zones = partition.getZoneCount();
        int size = 2 * zones;
        double sqrtS = Math.sqrt(s);

        double[] cs = new double[zones];
        for (int i = 0; i < zones; i++) {
            cs[i] = sqrtS * lambda[i];
        }

        DoubleMatrix2D matrix = new SparseDoubleMatrix2D(size, size);
        DoubleMatrix1D rhs = new DenseDoubleMatrix1D(size);

        // Condición de bombeo
        rhs.setQuick(0, wellFlux / s);
        double r0 = partition.getInnerRadius();
        if (partition.isPointWell()) {
            matrix.setQuick(0, 1, 1.0);
        } else {
            double x0 = cs[0] * r0;
            matrix.setQuick(0, 0, -x0 * i1(x0));
            matrix.setQuick(0, 1, x0 * k1(x0));
        }

        // Continuidad de nivel (fila 2i+1) y de flujo (fila 2i+2)
        for (int i = 0; i < zones - 1; i++) {
            double boundary = partition.getBoundaryAt(i + 1);
            double inner = cs[i] * boundary;
            double outer = cs[i + 1] * boundary;
            double ratio = partition.getTransmissivityAt(i) / partition.getTransmissivityAt(i + 1)
                    * lambda[i] / lambda[i + 1];

            matrix.setQuick(2 * i + 1, 2 * i, i0(inner));
            matrix.setQuick(2 * i + 1, 2 * i + 1, k0(inner));
            matrix.setQuick(2 * i + 1, 2 * i + 2, -i0(outer));
            matrix.setQuick(2 * i + 1, 2 * i + 3, -k0(outer));

            matrix.setQuick(2 * i + 2, 2 * i, ratio * i1(inner));
            matrix.setQuick(2 * i + 2, 2 * i + 1, -ratio * k1(inner));
            matrix.setQuick(2 * i + 2, 2 * i + 2, -i1(outer));
            matrix.setQuick(2 * i + 2, 2 * i + 3, k1(outer));
        }

        // Frontera exterior
        if (partition.isUnbounded()) {
            matrix.setQuick(size - 1, size - 2, 1.0);
        } else {
            double xn = cs[zones - 1] * partition.getOuterRadius();
            matrix.setQuick(size - 1, size - 2, i0(xn));
            matrix.setQuick(size - 1, size - 1, k0(xn));
        }

        // Tolerancia 0: solo un pivote exactamente nulo cuenta como singular
        LUDecompositionQuick lu = new LUDecompositionQuick(0.0);
        lu.decompose(matrix);
        if (!lu.isNonsingular()) {
            log.warn("Sistema singular para s = {} ({} zonas). Se devuelven coeficientes nulos.", s, zones);
            return new double[size];
        }
        lu.solve(rhs);
        return maskNonFinite(rhs.toArray(), s);
    }

    private double[] heads(double s, double[] coefficients) {
        double sqrtS = Math.sqrt(s);
        double[] result = new double[radii.length];
        int masked = 0;
        for (int p = 0; p < radii.length; p++) {
            int zone = zoneOfRadius[p];
            if (zone < 0) {
                continue;
            }
            double x = sqrtS * lambda[zone] * radii[p];
            double value = coefficients[2 * zone] * i0(x) + coefficients[2 * zone + 1] * k0(x);
            if (Double.isFinite(value)) {
                result[p] = value;
            } else {
                masked++;
            }
        }
        if (masked > 0) {
            log.debug("{} niveles no finitos sustituidos por cero (s = {}).", masked, s);
        }
        return result;
    }

    private static double[] maskNonFinite(double[] values, double s) {
        int masked = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                values[i] = 0.0;
                masked++;
            }
        }
        if (masked > 0) {
            log.debug("{} coeficientes no finitos sustituidos por cero (s = {}).", masked, s);
        }
        return values;
    }

    @Override
    public String getName() {
        return "Zoned Radial Flow";
    }

    @Override
    public String getDescription() {
        return "Flujo radial transitorio por zonas en el espacio de Laplace ("
                + partition.getZoneCount() + " zonas, " + radii.length + " radios).";
    }
}
