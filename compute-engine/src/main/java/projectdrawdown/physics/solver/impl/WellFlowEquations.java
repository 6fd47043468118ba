package projectdrawdown.physics.solver.impl;

import projectdrawdown.physics.model.CoarseGrainedConductivity;
import projectdrawdown.physics.model.CoarseGrainedTransmissivity;
import projectdrawdown.physics.model.WellValue;

import static projectdrawdown.physics.special.ExponentialIntegral.e1;
import static projectdrawdown.physics.special.ExponentialIntegral.ei;

/**
 * Biblioteca estática de soluciones analíticas para el flujo hacia un pozo.
 * <p>
 * Incluye la función de pozo de Theis (transitorio, homogéneo) y las soluciones
 * estacionarias de Thiem y Thiem extendido (2D y 3D) para acuíferos
 * heterogéneos descritos por su estadística log-normal.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class WellFlowEquations {

    private WellFlowEquations() {}

    /**
     * Solución de Theis en un punto: {@code Qw / (4πT) · E1(r²S / (4Tt))}.
     */
    public static double theisWellFunction(double radius, double time, double transmissivity,
                                           double storativity, double pumpingRate) {
        double u = radius * radius * storativity / (4.0 * transmissivity * time);
        return pumpingRate / (4.0 * Math.PI * transmissivity) * e1(u);
    }

    /**
     * Malla {@code [tiempo][radio]} de la solución de Theis.
     */
    public static double[][] theis(double[] radii, double[] times, double transmissivity,
                                   double storativity, double pumpingRate) {
        double[][] heads = new double[times.length][radii.length];
        for (int t = 0; t < times.length; t++) {
            for (int r = 0; r < radii.length; r++) {
                heads[t][r] = theisWellFunction(radii[r], times[t], transmissivity, storativity, pumpingRate);
            }
        }
        return heads;
    }

    /**
     * Solución estacionaria de Thiem en un acuífero homogéneo.
     *
     * @param referenceRadius Radio de referencia donde el nivel vale {@code referenceHead}.
     */
    public static double[] thiem(double[] radii, double referenceRadius, double transmissivity,
                                 double pumpingRate, double referenceHead) {
        checkSteadyState(radii, referenceRadius);
        if (!(transmissivity > 0.0)) {
            throw new IllegalArgumentException("La transmisividad debe ser positiva.");
        }
        double[] heads = new double[radii.length];
        for (int i = 0; i < radii.length; i++) {
            heads[i] = -pumpingRate / (2.0 * Math.PI * transmissivity) * Math.log(radii[i] / referenceRadius)
                    + referenceHead;
        }
        return heads;
    }

    /**
     * Thiem extendido en 2D para una transmisividad log-normal con correlación gaussiana.
     *
     * @param geometricMean Media geométrica T_G.
     * @param logVariance   Varianza σ².
     * @param wellValue     Política para el valor en el pozo (por defecto media armónica).
     */
    public static double[] extThiem2D(double[] radii, double referenceRadius, double geometricMean,
                                      double logVariance, double correlationLength, double pumpingRate,
                                      double referenceHead, WellValue wellValue, double proportionalityFactor) {
        checkSteadyState(radii, referenceRadius);
        CoarseGrainedTransmissivity model = new CoarseGrainedTransmissivity(
                geometricMean, logVariance, correlationLength, proportionalityFactor, wellValue);

        double chi = model.getChi();
        double q = -pumpingRate / (4.0 * Math.PI * geometricMean);
        double c = (proportionalityFactor / correlationLength) * (proportionalityFactor / correlationLength);
        double decay = Math.exp(-chi);

        double refArgument = chi / (1.0 + c * referenceRadius * referenceRadius);
        double refTerm = ei(-refArgument) + decay * e1(refArgument - chi);

        double[] heads = new double[radii.length];
        for (int i = 0; i < radii.length; i++) {
            double argument = chi / (1.0 + c * radii[i] * radii[i]);
            double term = -ei(-argument) - decay * e1(argument - chi);
            heads[i] = q * (term + refTerm) + referenceHead;
        }
        return heads;
    }

    /**
     * Thiem extendido en 3D para una conductividad log-normal con anisotropía vertical.
     * El caudal se interpreta por unidad de espesor; {@code thickness} solo se valida.
     *
     * @param anisotropyRatio Relación de anisotropía e en (0, 1].
     */
    public static double[] extThiem3D(double[] radii, double referenceRadius, double geometricMean,
                                      double logVariance, double correlationLength, double anisotropyRatio,
                                      double pumpingRate, double thickness, double referenceHead,
                                      WellValue wellValue, double proportionalityFactor) {
        checkSteadyState(radii, referenceRadius);
        if (!(thickness > 0.0)) {
            throw new IllegalArgumentException("El espesor del acuífero debe ser positivo.");
        }
        CoarseGrainedConductivity model = new CoarseGrainedConductivity(
                geometricMean, logVariance, correlationLength, anisotropyRatio, proportionalityFactor, wellValue);

        double chi = model.getChi();
        double q = -pumpingRate / (2.0 * Math.PI * model.getEffectiveConductivity());
        double scaled = proportionalityFactor / correlationLength / Math.cbrt(anisotropyRatio);
        double c = scaled * scaled;

        double sub11 = Math.sqrt(1.0 + c * referenceRadius * referenceRadius);
        double[] heads = new double[radii.length];
        for (int i = 0; i < radii.length; i++) {
            double sub12 = Math.sqrt(1.0 + c * radii[i] * radii[i]);
            double sub21 = Math.log(sub12 + 1.0) - Math.log(sub11 + 1.0) - (1.0 / sub12 - 1.0 / sub11);
            double sub22 = Math.log(sub12) - Math.log(sub11)
                    - (0.5 / (sub12 * sub12) - 0.5 / (sub11 * sub11))
                    - (0.25 / Math.pow(sub12, 4) - 0.25 / Math.pow(sub11, 4));

            double value = Math.exp(-chi) * (Math.log(radii[i]) - Math.log(referenceRadius))
                    + sub21 * Math.sinh(chi)
                    + sub22 * (1.0 - Math.cosh(chi));
            heads[i] = q * value + referenceHead;
        }
        return heads;
    }

    private static void checkSteadyState(double[] radii, double referenceRadius) {
        if (radii == null) {
            throw new IllegalArgumentException("Los radios no pueden ser nulos.");
        }
        if (!(referenceRadius > 0.0)) {
            throw new IllegalArgumentException("El radio de referencia debe ser positivo.");
        }
        for (double r : radii) {
            if (!(r > 0.0)) {
                throw new IllegalArgumentException("Los radios deben ser positivos: " + r);
            }
        }
    }
}
