package projectdrawdown.physics.special;

/**
 * Integrales exponenciales {@code E1(x)} y {@code Ei(x)} para argumento real.
 * <p>
 * Para argumentos negativos se usa el valor principal real:
 * {@code E1(x) = -Ei(-x)} y {@code Ei(x) = -E1(-x)}.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class ExponentialIntegral {

    /**
     * Constante de Euler-Mascheroni.
     */
    public static final double EULER_GAMMA = 0.5772156649015329;

    private static final int MAX_ITERATIONS = 500;
    private static final double EPSILON = 1e-16;
    private static final double FPMIN = 1e-300;

    // Por encima de este valor Ei usa la serie asintótica
    private static final double EI_ASYMPTOTIC_LIMIT = 40.0;

    private ExponentialIntegral() {}

    /**
     * Integral exponencial {@code E1(x) = ∫_x^∞ e^{-t}/t dt}.
     */
    public static double e1(double x) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        if (x == 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        if (x < 0.0) {
            return -ei(-x);
        }
        if (x <= 1.0) {
            return e1Series(x);
        }
        return e1ContinuedFraction(x);
    }

    /**
     * Integral exponencial {@code Ei(x) = -VP ∫_{-x}^∞ e^{-t}/t dt}.
     */
    public static double ei(double x) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        if (x == 0.0) {
            return Double.NEGATIVE_INFINITY;
        }
        if (x < 0.0) {
            return -e1(-x);
        }
        if (x < EI_ASYMPTOTIC_LIMIT) {
            return eiSeries(x);
        }
        return eiAsymptotic(x);
    }

    // E1(x) = -γ - ln x - Σ_{k>=1} (-x)^k / (k·k!)
    private static double e1Series(double x) {
        double sum = 0.0;
        double factor = 1.0;
        for (int k = 1; k <= MAX_ITERATIONS; k++) {
            factor *= -x / k;
            double term = factor / k;
            sum += term;
            if (Math.abs(term) < Math.abs(sum) * EPSILON) {
                break;
            }
        }
        return -EULER_GAMMA - Math.log(x) - sum;
    }

    // Fracción continua de Lentz, convergente para x > 1
    private static double e1ContinuedFraction(double x) {
        double b = x + 1.0;
        double c = 1.0 / FPMIN;
        double d = 1.0 / b;
        double h = d;
        for (int i = 1; i <= MAX_ITERATIONS; i++) {
            double an = -(double) i * i;
            b += 2.0;
            d = 1.0 / (an * d + b);
            c = b + an / c;
            double delta = c * d;
            h *= delta;
            if (Math.abs(delta - 1.0) < EPSILON) {
                break;
            }
        }
        return h * Math.exp(-x);
    }

    // Ei(x) = γ + ln x + Σ_{k>=1} x^k / (k·k!)
    private static double eiSeries(double x) {
        double sum = 0.0;
        double factor = 1.0;
        for (int k = 1; k <= MAX_ITERATIONS; k++) {
            factor *= x / k;
            double term = factor / k;
            sum += term;
            if (term < sum * EPSILON) {
                break;
            }
        }
        return EULER_GAMMA + Math.log(x) + sum;
    }

    // Ei(x) ~ e^x / x · Σ k! / x^k, truncada en el término mínimo
    private static double eiAsymptotic(double x) {
        double sum = 1.0;
        double term = 1.0;
        for (int k = 1; k <= MAX_ITERATIONS; k++) {
            double next = term * k / x;
            if (next >= term || next < EPSILON * sum) {
                break;
            }
            term = next;
            sum += term;
        }
        return Math.exp(x) / x * sum;
    }
}
