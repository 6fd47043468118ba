package projectdrawdown.physics.solver.impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectdrawdown.config.SolverConfig;
import projectdrawdown.physics.solver.LaplaceInversion;
import projectdrawdown.physics.solver.LaplaceSpaceFunction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Inversión numérica de la transformada de Laplace por el algoritmo de Stehfest.
 * <p>
 * Para cada instante {@code t} se evalúa la función en los nodos reales
 * {@code s_k = k·ln2/t}, {@code k = 1..order}, y se combina
 * <pre>
 *   f(t) ≈ (ln2 / t) · Σ w_k · F(s_k)
 * </pre>
 * Los pesos {@code w_k} dependen solo del orden y se calculan una vez por proceso.
 * <p>
 * Con {@link SolverConfig#isParallel()} los instantes se reparten en un pool fijo
 * de hilos; cada tarea escribe su propia fila del resultado.
 */
@Slf4j
public class StehfestInversion implements LaplaceInversion, AutoCloseable {

    private static final double LN2 = Math.log(2.0);

    // Tabla de pesos por orden. Nunca se expone el array interno.
    private static final Map<Integer, double[]> COEFFICIENT_CACHE = new ConcurrentHashMap<>();

    @Getter
    private final int order;
    private final double[] weights;
    private final ExecutorService threadPool;

    public StehfestInversion(int order) {
        this(order, SolverConfig.sequential());
    }

    public StehfestInversion(int order, SolverConfig config) {
        checkOrder(order);
        this.order = order;
        this.weights = cachedCoefficients(order);
        this.threadPool = config.isParallel() ? Executors.newFixedThreadPool(config.getCpuProcessorCount()) : null;
        log.debug("StehfestInversion inicializada (orden: {}, hilos: {}).", order, config.getCpuProcessorCount());
    }

    /**
     * Pesos de Stehfest para un orden par.
     * <pre>
     *   w_k = (-1)^(k+M) Σ_{j=⌊(k+1)/2⌋}^{min(k,M)} j^M (2j)! / ((M-j)! j! (j-1)! (k-j)! (2j-k)!)
     * </pre>
     * con {@code M = order/2}.
     *
     * @return Copia de la tabla, {@code order} valores.
     * @throws IllegalArgumentException si el orden no es par o es menor que 2.
     */
    public static double[] coefficients(int order) {
        checkOrder(order);
        return cachedCoefficients(order).clone();
    }

    private static double[] cachedCoefficients(int order) {
        return COEFFICIENT_CACHE.computeIfAbsent(order, StehfestInversion::computeCoefficients);
    }

    private static double[] computeCoefficients(int order) {
        int half = order / 2;
        double[] factorial = new double[order + 1];
        factorial[0] = 1.0;
        for (int i = 1; i <= order; i++) {
            factorial[i] = factorial[i - 1] * i;
        }

        double[] w = new double[order];
        for (int k = 1; k <= order; k++) {
            double sum = 0.0;
            for (int j = (k + 1) / 2; j <= Math.min(k, half); j++) {
                sum += Math.pow(j, half) * factorial[2 * j]
                        / (factorial[half - j] * factorial[j] * factorial[j - 1] * factorial[k - j] * factorial[2 * j - k]);
            }
            w[k - 1] = ((k + half) % 2 == 0) ? sum : -sum;
        }
        return w;
    }

    private static void checkOrder(int order) {
        if (order < 2 || order % 2 != 0) {
            throw new IllegalArgumentException("El orden de Stehfest debe ser par y mayor que 1: " + order);
        }
    }

    @Override
    public double[][] invert(LaplaceSpaceFunction function, double[] times) {
        if (function == null) {
            throw new IllegalArgumentException("La función de Laplace no puede ser nula.");
        }
        if (times == null) {
            throw new IllegalArgumentException("Los tiempos no pueden ser nulos.");
        }
        for (double t : times) {
            if (!(t > 0.0) || Double.isInfinite(t)) {
                throw new IllegalArgumentException("Los tiempos deben ser positivos y finitos: " + t);
            }
        }

        double[][] result = new double[times.length][];
        if (threadPool == null || times.length < 2) {
            for (int i = 0; i < times.length; i++) {
                result[i] = invertAt(function, times[i]);
            }
            return result;
        }

        List<Callable<Void>> tasks = new ArrayList<>(times.length);
        for (int i = 0; i < times.length; i++) {
            final int index = i;
            tasks.add(() -> {
                result[index] = invertAt(function, times[index]);
                return null;
            });
        }

        List<Future<Void>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Inversión de Laplace interrumpida.", e);
        }

        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Inversión de Laplace interrumpida.", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Fallo al evaluar la función de Laplace.", e.getCause());
            }
        }
        return result;
    }

    private double[] invertAt(LaplaceSpaceFunction function, double time) {
        double factor = LN2 / time;
        double[] nodes = new double[order];
        for (int k = 0; k < order; k++) {
            nodes[k] = (k + 1) * factor;
        }

        double[][] values = function.evaluate(nodes);
        if (values == null || values.length != order) {
            throw new IllegalStateException("La función de Laplace debe devolver un vector por nodo.");
        }

        int points = values[0].length;
        double[] row = new double[points];
        for (int k = 0; k < order; k++) {
            if (values[k].length != points) {
                throw new IllegalStateException("La función de Laplace devolvió vectores de longitud distinta.");
            }
            double w = weights[k];
            for (int p = 0; p < points; p++) {
                row[p] += w * values[k][p];
            }
        }
        for (int p = 0; p < points; p++) {
            row[p] *= factor;
        }
        return row;
    }

    @Override
    public String getName() {
        return "Stehfest";
    }

    @Override
    public String getDescription() {
        return "Inversión de Laplace de Gaver-Stehfest con " + order + " nodos reales por instante.";
    }

    @Override
    public void close() {
        if (threadPool != null) {
            threadPool.shutdown();
            log.debug("Pool de inversión cerrado.");
        }
    }
}
