package projectdrawdown.factory;

import lombok.extern.slf4j.Slf4j;
import projectdrawdown.domain.aquifer.ZonePartition;
import projectdrawdown.physics.model.UpscaledPropertyModel;

import java.util.Arrays;

/**
 * Fábrica de instancias de {@link ZonePartition}.
 * <p>
 * Cubre los tres escenarios del simulador:
 * <ol>
 * <li>Acuífero homogéneo (una sola zona).</li>
 * <li>Modelo de discos con radios interiores elegidos por el usuario.</li>
 * <li>Discos logarítmicos cuyas propiedades salen de un modelo de escalado
 * ({@link UpscaledPropertyModel}), usado por los ensayos heterogéneos.</li>
 * </ol>
 */
@Slf4j
public final class ZonePartitionFactory {

    private ZonePartitionFactory() {
        // Clase de utilidad
    }

    public static ZonePartition homogeneous(double wellRadius, double outerRadius,
                                            double transmissivity, double storativity) {
        checkDomain(wellRadius, outerRadius);
        return ZonePartition.homogeneous(wellRadius, outerRadius, transmissivity, storativity);
    }

    /**
     * Modelo de discos: {@code [rwell, zoneRadii..., rinf]}.
     *
     * @param zoneRadii        Radios interiores de separación entre zonas (N-1 valores).
     * @param transmissivities Transmisividad de cada disco (N valores).
     * @param storativities    Almacenamiento de cada disco (N valores).
     */
    public static ZonePartition diskModel(double wellRadius, double outerRadius, double[] zoneRadii,
                                          double[] transmissivities, double[] storativities) {
        checkDomain(wellRadius, outerRadius);
        if (zoneRadii == null) {
            throw new IllegalArgumentException("Los radios de las zonas no pueden ser nulos.");
        }
        for (int i = 0; i < zoneRadii.length; i++) {
            if (i > 0 && !(zoneRadii[i - 1] < zoneRadii[i])) {
                throw new IllegalArgumentException("Los radios de las zonas no están ordenados: " + Arrays.toString(zoneRadii));
            }
            if (!(zoneRadii[i] > wellRadius)) {
                throw new IllegalArgumentException("Los radios de las zonas deben ser mayores que el radio del pozo: " + zoneRadii[i]);
            }
            if (!(zoneRadii[i] < outerRadius)) {
                throw new IllegalArgumentException("Los radios de las zonas deben ser menores que el radio exterior: " + zoneRadii[i]);
            }
        }

        double[] boundaries = new double[zoneRadii.length + 2];
        boundaries[0] = wellRadius;
        System.arraycopy(zoneRadii, 0, boundaries, 1, zoneRadii.length);
        boundaries[boundaries.length - 1] = outerRadius;
        return new ZonePartition(boundaries, transmissivities, storativities);
    }

    /**
     * Discos espaciados uniformemente en {@code log(1 + r)}, con la transmisividad
     * de cada disco tomada del perfil de escalado y almacenamiento uniforme.
     * <p>
     * Si el dominio no está acotado o {@code lastRadius < outerRadius}, se colocan
     * {@code parts} radios entre el pozo y {@code lastRadius} y el último disco se
     * extiende hasta {@code outerRadius} con el valor de campo lejano. Los demás
     * discos toman el perfil en {@code parts - 1} puntos equiespaciados en
     * {@code log(1 + r)} entre el pozo y {@code lastRadius}. En otro caso se
     * reparten {@code parts + 1} radios entre el pozo y la frontera exterior y cada
     * disco toma el perfil en su punto medio logarítmico.
     *
     * @param parts       Número de discos (>= 1).
     * @param lastRadius  Radio a partir del cual la propiedad es la de campo lejano.
     * @param model       Perfil radial efectivo de la propiedad.
     * @param storativity Almacenamiento, común a todos los discos.
     */
    public static ZonePartition logarithmic(int parts, double wellRadius, double outerRadius, double lastRadius,
                                            UpscaledPropertyModel model, double storativity) {
        checkDomain(wellRadius, outerRadius);
        if (parts < 1) {
            throw new IllegalArgumentException("El número de discos debe ser al menos 1: " + parts);
        }
        if (!(lastRadius > 0.0)) {
            throw new IllegalArgumentException("El último radio de la partición debe ser positivo: " + lastRadius);
        }

        double[] boundaries = logarithmicBoundaries(parts, wellRadius, outerRadius, lastRadius);
        int zones = boundaries.length - 1;
        double[] transmissivities = new double[zones];
        double[] storativities = new double[zones];
        Arrays.fill(storativities, storativity);

        double last = effectiveLastRadius(wellRadius, lastRadius);
        if (endsInFarField(outerRadius, last)) {
            double[] samples = new double[zones - 1];
            fillLogSpaced(samples, samples.length, wellRadius, last);
            for (int i = 0; i < samples.length; i++) {
                transmissivities[i] = model.valueAt(samples[i]);
            }
            transmissivities[zones - 1] = model.getFarFieldValue();
        } else {
            transmissivities[0] = model.valueAt(wellRadius);
            for (int i = 1; i < zones; i++) {
                double midpoint = Math.expm1(0.5 * (Math.log1p(boundaries[i]) + Math.log1p(boundaries[i + 1])));
                transmissivities[i] = model.valueAt(midpoint);
            }
        }

        log.debug("Partición logarítmica: {} discos entre {} y {} (último radio {}).",
                zones, wellRadius, outerRadius, lastRadius);
        return new ZonePartition(boundaries, transmissivities, storativities);
    }

    static double[] logarithmicBoundaries(int parts, double wellRadius, double outerRadius, double lastRadius) {
        double last = effectiveLastRadius(wellRadius, lastRadius);

        double[] boundaries;
        if (endsInFarField(outerRadius, last)) {
            boundaries = new double[parts + 1];
            fillLogSpaced(boundaries, parts, wellRadius, last);
            boundaries[parts] = outerRadius;
        } else {
            boundaries = new double[parts + 1];
            fillLogSpaced(boundaries, parts + 1, wellRadius, outerRadius);
        }
        return boundaries;
    }

    // Un corte dentro del pozo no aporta nada: se desplaza fuera de él
    private static double effectiveLastRadius(double wellRadius, double lastRadius) {
        return lastRadius > wellRadius ? lastRadius : 2.0 * wellRadius;
    }

    private static boolean endsInFarField(double outerRadius, double last) {
        return Double.isInfinite(outerRadius) || last < outerRadius;
    }

    private static void fillLogSpaced(double[] target, int count, double from, double to) {
        if (count == 0) {
            return;
        }
        double logFrom = Math.log1p(from);
        double logTo = Math.log1p(to);
        target[0] = from;
        for (int i = 1; i < count; i++) {
            target[i] = Math.expm1(logFrom + (logTo - logFrom) * i / (count - 1));
        }
        if (count > 1) {
            target[count - 1] = to;
        }
    }

    private static void checkDomain(double wellRadius, double outerRadius) {
        if (!(wellRadius >= 0.0) || Double.isInfinite(wellRadius)) {
            throw new IllegalArgumentException("El radio del pozo debe ser >= 0 y finito: " + wellRadius);
        }
        if (!(outerRadius > wellRadius)) {
            throw new IllegalArgumentException("El radio exterior debe ser mayor que el radio del pozo: " + outerRadius);
        }
    }
}
