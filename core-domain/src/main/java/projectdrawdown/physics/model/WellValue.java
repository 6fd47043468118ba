package projectdrawdown.physics.model;

import java.util.Objects;

/**
 * Política para el valor de la propiedad hidráulica en el pozo.
 * <p>
 * Variante cerrada con tres casos. Cada modelo de escalado la resuelve una única
 * vez a un escalar (el exponente χ); el núcleo numérico nunca ve la etiqueta.
 *
 * @param kind  Caso de la política.
 * @param value Valor explícito (solo con {@link Kind#EXPLICIT}; NaN en los demás casos).
 */
public record WellValue(Kind kind, double value) {

    public WellValue {
        Objects.requireNonNull(kind, "El tipo de valor en el pozo no puede ser nulo.");
        if (kind == Kind.EXPLICIT && (!(value > 0.0) || Double.isInfinite(value))) {
            throw new IllegalArgumentException("El valor explícito en el pozo debe ser positivo y finito: " + value);
        }
    }

    public static WellValue harmonicMean() {
        return new WellValue(Kind.HARMONIC_MEAN, Double.NaN);
    }

    public static WellValue arithmeticMean() {
        return new WellValue(Kind.ARITHMETIC_MEAN, Double.NaN);
    }

    public static WellValue explicit(double value) {
        return new WellValue(Kind.EXPLICIT, value);
    }

    public enum Kind {
        /**
         * Media armónica de la distribución (límite de flujo en serie).
         */
        HARMONIC_MEAN,

        /**
         * Media aritmética de la distribución (límite de flujo en paralelo).
         */
        ARITHMETIC_MEAN,

        /**
         * Valor medido o impuesto por el usuario.
         */
        EXPLICIT
    }
}
