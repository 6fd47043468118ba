package projectdrawdown.io;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import projectdrawdown.config.HeterogeneityConfig;
import projectdrawdown.config.PumpingTestConfig;
import projectdrawdown.domain.aquifer.ZonePartition;
import projectdrawdown.domain.simulation.HeadResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura y escritura de escenarios y resultados en JSON.
 * <p>
 * Los escenarios ({@link PumpingTestConfig}, {@link HeterogeneityConfig},
 * {@link ZonePartition}) se leen desde disco y los resultados
 * ({@link HeadResult}) se escriben con indentación legible. Las fronteras
 * infinitas se aceptan como {@code Infinity}, con o sin comillas.
 */
@Slf4j
public class JsonFileHandler {

    // Thread-safe una vez configurado
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        return JsonMapper.builder()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .build();
    }

    public PumpingTestConfig readPumpingTest(Path path) throws IOException {
        return readFromFile(path, PumpingTestConfig.class);
    }

    public HeterogeneityConfig readHeterogeneity(Path path) throws IOException {
        return readFromFile(path, HeterogeneityConfig.class);
    }

    public ZonePartition readPartition(Path path) throws IOException {
        return readFromFile(path, ZonePartition.class);
    }

    public void writeResult(HeadResult result, Path path) throws IOException {
        writeToFile(result, path);
    }

    /**
     * Serializa un objeto en {@code path}, creando los directorios que falten.
     * Si el archivo existe se sobrescribe.
     *
     * @throws IOException Si falla la escritura.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Escribiendo {} en {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura JSON completada.");
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Reconstruye un objeto de tipo {@code objectType} desde un archivo JSON.
     * <p>
     * Las violaciones de dominio detectadas por los constructores (por ejemplo,
     * radios no crecientes en una partición) llegan como {@link IOException}
     * envolviendo la {@link IllegalArgumentException} original.
     *
     * @throws IOException Si el archivo no existe, no se puede leer o su contenido no es válido.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Leyendo {} como {}", path.toAbsolutePath(), objectType.getSimpleName());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o interpretar el archivo JSON {}", path.toAbsolutePath(), e);
            throw e;
        }
    }
}
