package projectdrawdown.domain.aquifer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Partición inmutable del dominio radial en discos concéntricos.
 * <p>
 * Los radios {@code r0 < r1 < ... < rN} delimitan N zonas; la zona {@code i}
 * ocupa {@code [r_i, r_{i+1})} y tiene transmisividad y almacenamiento constantes.
 * {@code r0} puede ser 0 (pozo puntual) y {@code rN} puede ser infinito
 * (acuífero no acotado).
 * <p>
 * Una vez construida no puede modificarse: los arrays se clonan al entrar y al
 * salir, de modo que es segura para compartirse entre hilos durante la inversión.
 */
public final class ZonePartition {

    private final double[] boundaries;
    private final double[] transmissivities;
    private final double[] storativities;

    /**
     * @param boundaries       Radios frontera, N+1 valores estrictamente crecientes y no negativos.
     * @param transmissivities Transmisividad de cada zona (N valores > 0).
     * @param storativities    Coeficiente de almacenamiento de cada zona (N valores > 0).
     */
    @JsonCreator
    public ZonePartition(@JsonProperty("boundaries") double[] boundaries,
                         @JsonProperty("transmissivities") double[] transmissivities,
                         @JsonProperty("storativities") double[] storativities) {
        Objects.requireNonNull(boundaries, "Los radios frontera no pueden ser nulos.");
        Objects.requireNonNull(transmissivities, "El array de transmisividades no puede ser nulo.");
        Objects.requireNonNull(storativities, "El array de almacenamientos no puede ser nulo.");

        if (transmissivities.length == 0) {
            throw new IllegalArgumentException("La partición debe contener al menos una zona.");
        }
        if (boundaries.length != transmissivities.length + 1 || storativities.length != transmissivities.length) {
            throw new IllegalArgumentException(String.format(
                    "Dimensiones incoherentes: %d radios frontera para %d transmisividades y %d almacenamientos "
                            + "(se esperan N+1, N y N).",
                    boundaries.length, transmissivities.length, storativities.length));
        }
        if (!(boundaries[0] >= 0.0)) {
            throw new IllegalArgumentException("El radio del pozo debe ser >= 0.");
        }
        for (int i = 0; i < boundaries.length - 1; i++) {
            if (!(boundaries[i] < boundaries[i + 1])) {
                throw new IllegalArgumentException(String.format(
                        "Los radios de las zonas deben ser estrictamente crecientes: r[%d]=%s, r[%d]=%s.",
                        i, boundaries[i], i + 1, boundaries[i + 1]));
            }
        }
        for (int i = 0; i < transmissivities.length; i++) {
            if (!(transmissivities[i] > 0.0) || Double.isInfinite(transmissivities[i])) {
                throw new IllegalArgumentException(String.format(
                        "La transmisividad de la zona %d debe ser positiva y finita (%s).", i, transmissivities[i]));
            }
            if (!(storativities[i] > 0.0) || Double.isInfinite(storativities[i])) {
                throw new IllegalArgumentException(String.format(
                        "El almacenamiento de la zona %d debe ser positivo y finito (%s).", i, storativities[i]));
            }
        }

        this.boundaries = boundaries.clone();
        this.transmissivities = transmissivities.clone();
        this.storativities = storativities.clone();
    }

    /**
     * Acuífero homogéneo entre {@code innerRadius} y {@code outerRadius}.
     */
    public static ZonePartition homogeneous(double innerRadius, double outerRadius,
                                            double transmissivity, double storativity) {
        return new ZonePartition(
                new double[]{innerRadius, outerRadius},
                new double[]{transmissivity},
                new double[]{storativity});
    }

    @JsonIgnore
    public int getZoneCount() {
        return transmissivities.length;
    }

    @JsonIgnore
    public double getInnerRadius() {
        return boundaries[0];
    }

    @JsonIgnore
    public double getOuterRadius() {
        return boundaries[boundaries.length - 1];
    }

    @JsonIgnore
    public boolean isPointWell() {
        return boundaries[0] == 0.0;
    }

    @JsonIgnore
    public boolean isUnbounded() {
        return Double.isInfinite(getOuterRadius());
    }

    public double getBoundaryAt(int index) {
        return boundaries[index];
    }

    public double getTransmissivityAt(int zone) {
        return transmissivities[zone];
    }

    public double getStorativityAt(int zone) {
        return storativities[zone];
    }

    /**
     * Índice de la zona que contiene {@code radius}, con {@code r_i <= radius < r_{i+1}}.
     *
     * @return El índice de la zona, o -1 si el radio queda fuera del dominio.
     */
    public int zoneIndexOf(double radius) {
        if (!(radius >= boundaries[0]) || !(radius < getOuterRadius())) {
            return -1;
        }
        int index = Arrays.binarySearch(boundaries, radius);
        // Coincidencia exacta: el radio pertenece a la zona que empieza en él
        return index >= 0 ? index : -index - 2;
    }

    public double[] getBoundaries() {
        return boundaries.clone();
    }

    public double[] getTransmissivities() {
        return transmissivities.clone();
    }

    public double[] getStorativities() {
        return storativities.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ZonePartition)) return false;
        ZonePartition that = (ZonePartition) o;
        return Arrays.equals(boundaries, that.boundaries)
                && Arrays.equals(transmissivities, that.transmissivities)
                && Arrays.equals(storativities, that.storativities);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(boundaries);
        result = 31 * result + Arrays.hashCode(transmissivities);
        result = 31 * result + Arrays.hashCode(storativities);
        return result;
    }

    @Override
    public String toString() {
        return "ZonePartition{zones=" + getZoneCount()
                + ", boundaries=" + Arrays.toString(boundaries) + '}';
    }
}
