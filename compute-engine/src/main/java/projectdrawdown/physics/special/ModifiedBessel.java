package projectdrawdown.physics.special;

import cern.jet.math.Bessel;

/**
 * Funciones de Bessel modificadas de orden 0 y 1 para argumento real.
 * <p>
 * Delegan en {@link Bessel} (Colt). Para {@code x <= 0} las funciones K devuelven
 * su límite {@code +∞} en lugar de lanzar excepción; el solver enmascara después
 * cualquier valor no finito.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class ModifiedBessel {

    private ModifiedBessel() {}

    public static double i0(double x) {
        return Bessel.i0(x);
    }

    public static double i1(double x) {
        return Bessel.i1(x);
    }

    public static double k0(double x) {
        if (x <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return Bessel.k0(x);
    }

    public static double k1(double x) {
        if (x <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return Bessel.k1(x);
    }
}
