package projectdrawdown.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import projectdrawdown.config.HeterogeneityConfig;
import projectdrawdown.config.PumpingTestConfig;
import projectdrawdown.config.PumpingTestConfig.GridMode;
import projectdrawdown.config.SolverConfig;
import projectdrawdown.domain.aquifer.ZonePartition;
import projectdrawdown.domain.simulation.HeadResult;
import projectdrawdown.domain.simulation.StructuredHeadResult;
import projectdrawdown.factory.ZonePartitionFactory;
import projectdrawdown.physics.model.CoarseGrainedConductivity;
import projectdrawdown.physics.model.CoarseGrainedTransmissivity;
import projectdrawdown.physics.model.UpscaledPropertyModel;
import projectdrawdown.physics.solver.LaplaceInversion;
import projectdrawdown.physics.solver.impl.StehfestInversion;
import projectdrawdown.physics.solver.impl.WellFlowEquations;
import projectdrawdown.physics.solver.impl.ZonedRadialFlowSolver;

import java.util.HashMap;
import java.util.Map;

/**
 * Orquestador de los ensayos de bombeo transitorios.
 * <p>
 * Responsabilidades:
 * 1. Validar los parámetros de llamada antes de cualquier cálculo.
 * 2. Construir la {@link ZonePartition} de cada escenario (discos, homogéneo, heterogéneo).
 * 3. Invertir la solución de Laplace con Stehfest y dar forma a la salida.
 * 4. Sumar el nivel de referencia.
 * <p>
 * Mantiene un inversor por orden de Stehfest; al cerrarse libera sus hilos.
 */
@Slf4j
public class PumpingTestSimulator implements AutoCloseable {

    private final SolverConfig solverConfig;
    private final Map<Integer, StehfestInversion> inversions = new HashMap<>();

    public PumpingTestSimulator() {
        this(SolverConfig.sequential());
    }

    public PumpingTestSimulator(SolverConfig solverConfig) {
        this.solverConfig = solverConfig;
        log.info("PumpingTestSimulator inicializado (hilos: {}).", solverConfig.getCpuProcessorCount());
    }

    /**
     * Modelo de discos: transmisividad y almacenamiento constantes por zona.
     *
     * @param zoneRadii        Radios interiores entre zonas (N-1 valores, ordenados).
     * @param transmissivities Transmisividad por zona (N valores).
     * @param storativities    Almacenamiento por zona (N valores).
     */
    public HeadResult diskModel(PumpingTestConfig test, double[] zoneRadii,
                                double[] transmissivities, double[] storativities) {
        checkTest(test);
        ZonePartition partition = ZonePartitionFactory.diskModel(
                test.getWellRadius(), test.getOuterRadius(), zoneRadii, transmissivities, storativities);
        return simulate(test, partition);
    }

    /**
     * Theis en un acuífero homogéneo. Con pozo puntual y dominio no acotado se usa
     * la solución cerrada; en otro caso, la solución de una zona en Laplace.
     */
    public HeadResult theis(PumpingTestConfig test, double transmissivity, double storativity) {
        checkTest(test);
        ZonePartition partition = ZonePartitionFactory.homogeneous(
                test.getWellRadius(), test.getOuterRadius(), transmissivity, storativity);
        if (!(test.isPointWell() && test.isUnbounded())) {
            return simulate(test, partition);
        }

        long startTime = System.currentTimeMillis();
        double[][] heads = WellFlowEquations.theis(
                test.getRadii(), test.getTimes(), transmissivity, storativity, test.getPumpingRate());
        return shape(test, heads, System.currentTimeMillis() - startTime);
    }

    /**
     * Theis extendido en 2D: transmisividad heterogénea log-normal escalada por
     * "Coarse Graining" y discretizada en discos logarítmicos.
     */
    public HeadResult extTheis2D(PumpingTestConfig test, HeterogeneityConfig aquifer, double storativity) {
        checkTest(test);
        checkHeterogeneity(aquifer);
        CoarseGrainedTransmissivity model = CoarseGrainedTransmissivity.from(aquifer);
        ZonePartition partition = heterogeneousPartition(test, aquifer, model, storativity);
        return simulate(test, partition);
    }

    /**
     * Theis extendido en 3D: conductividad heterogénea con anisotropía vertical.
     * El caudal se reparte en el espesor del acuífero.
     */
    public HeadResult extTheis3D(PumpingTestConfig test, HeterogeneityConfig aquifer, double storativity) {
        checkTest(test);
        checkHeterogeneity(aquifer);
        if (!(aquifer.getThickness() > 0.0)) {
            throw new IllegalArgumentException("El espesor del acuífero debe ser positivo.");
        }
        CoarseGrainedConductivity model = CoarseGrainedConductivity.from(aquifer);
        ZonePartition partition = heterogeneousPartition(test, aquifer, model, storativity);
        PumpingTestConfig perThickness = test.withPumpingRate(test.getPumpingRate() / aquifer.getThickness());
        return simulate(perThickness, partition);
    }

    /**
     * Entrada genérica: ensayo sobre una partición ya construida.
     */
    public HeadResult simulate(PumpingTestConfig test, ZonePartition partition) {
        checkTest(test);
        if (partition == null) {
            throw new IllegalArgumentException("La partición no puede ser nula.");
        }
        for (double r : test.getRadii()) {
            if (r < partition.getInnerRadius()) {
                throw new IllegalArgumentException("Los radios de evaluación deben ser >= radio del pozo: " + r);
            }
        }

        long startTime = System.currentTimeMillis();
        log.info("Iniciando ensayo: {} zonas, {} radios, {} tiempos (Stehfest {}).",
                partition.getZoneCount(), test.getRadii().length, test.getTimes().length, test.getStehfestOrder());

        ZonedRadialFlowSolver solver = new ZonedRadialFlowSolver(partition, test.getPumpingRate(), test.getRadii());
        LaplaceInversion inversion = inversionFor(test.getStehfestOrder());
        log.debug("{} | {}", solver.getDescription(), inversion.getDescription());
        double[][] heads = inversion.invert(solver, test.getTimes());

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Ensayo completado en {} ms.", elapsed);
        return shape(test, heads, elapsed);
    }

    private ZonePartition heterogeneousPartition(PumpingTestConfig test, HeterogeneityConfig aquifer,
                                                 UpscaledPropertyModel model, double storativity) {
        double lastRadius = model.cutoffRadius(aquifer.getFarFieldRelativeError());
        log.debug("Radio de corte del perfil escalado: {} (error {}).", lastRadius, aquifer.getFarFieldRelativeError());
        return ZonePartitionFactory.logarithmic(aquifer.getPartitions(), test.getWellRadius(), test.getOuterRadius(),
                lastRadius, model, storativity);
    }

    private synchronized LaplaceInversion inversionFor(int order) {
        return inversions.computeIfAbsent(order, o -> new StehfestInversion(o, solverConfig));
    }

    /**
     * Aplica el modo de salida y suma el nivel de referencia.
     */
    private HeadResult shape(PumpingTestConfig test, double[][] heads, long elapsed) {
        double referenceHead = test.getReferenceHead();
        if (referenceHead != 0.0) {
            for (double[] row : heads) {
                for (int r = 0; r < row.length; r++) {
                    row[r] += referenceHead;
                }
            }
        }

        StructuredHeadResult grid = StructuredHeadResult.builder()
                .times(test.getTimes().clone())
                .radii(test.getRadii().clone())
                .heads(heads)
                .computationTime(elapsed)
                .build();
        return test.getGridMode() == GridMode.POINTWISE ? grid.diagonal() : grid;
    }

    private static void checkTest(PumpingTestConfig test) {
        if (test == null) {
            throw new IllegalArgumentException("La configuración del ensayo no puede ser nula.");
        }
        double[] radii = test.getRadii();
        double[] times = test.getTimes();
        if (radii == null || times == null) {
            throw new IllegalArgumentException("Los radios y los tiempos son obligatorios.");
        }
        if (!(test.getWellRadius() >= 0.0)) {
            throw new IllegalArgumentException("El radio del pozo debe ser >= 0.");
        }
        if (!(test.getOuterRadius() > test.getWellRadius())) {
            throw new IllegalArgumentException("El radio exterior debe ser mayor que el radio del pozo.");
        }
        for (double r : radii) {
            if (r < test.getWellRadius() || !(r > 0.0)) {
                throw new IllegalArgumentException("Los radios deben ser positivos y no menores que el radio del pozo: " + r);
            }
        }
        for (double t : times) {
            if (!(t > 0.0)) {
                throw new IllegalArgumentException("Los tiempos deben ser positivos: " + t);
            }
        }
        if (test.getGridMode() == GridMode.POINTWISE && radii.length != times.length) {
            throw new IllegalArgumentException(String.format(
                    "En modo por puntos el número de radios (%d) y de tiempos (%d) debe coincidir.",
                    radii.length, times.length));
        }
        int order = test.getStehfestOrder();
        if (order <= 1 || order % 2 != 0) {
            throw new IllegalArgumentException("El orden de Stehfest debe ser par y mayor que 1: " + order);
        }
        if (Double.isNaN(test.getPumpingRate()) || Double.isInfinite(test.getPumpingRate())) {
            throw new IllegalArgumentException("El caudal de bombeo debe ser finito.");
        }
    }

    private static void checkHeterogeneity(HeterogeneityConfig aquifer) {
        if (aquifer == null) {
            throw new IllegalArgumentException("La descripción del acuífero no puede ser nula.");
        }
        if (aquifer.getPartitions() <= 1) {
            throw new IllegalArgumentException("El número de discos debe ser mayor que 1: " + aquifer.getPartitions());
        }
        if (!(aquifer.getFarFieldRelativeError() > 0.0 && aquifer.getFarFieldRelativeError() < 1.0)) {
            throw new IllegalArgumentException(
                    "El error relativo respecto al campo lejano debe estar en (0, 1): " + aquifer.getFarFieldRelativeError());
        }
    }

    @Override
    public synchronized void close() {
        inversions.values().forEach(StehfestInversion::close);
        inversions.clear();
        log.debug("PumpingTestSimulator cerrado.");
    }
}
