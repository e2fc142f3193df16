package complexreactor.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import complexreactor.config.ReactorScenario;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Persistencia de escenarios de reactor ({@link ReactorScenario}) en archivos JSON.
 * <p>
 * Formato:
 * <pre>
 * { "config": { "conversion": 1.0, "twoOutputs": true, "splitRatio": 0.7 }, "inputA": 1.0, "inputB": 1.0 }
 * </pre>
 * Los campos ausentes de {@code config} toman los valores por defecto del reactor.
 * Los rangos no se comprueban aquí: los valida el {@code ReactorModel} al construirse.
 */
@Slf4j
public class ScenarioFileHandler {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectReader SCENARIO_READER = MAPPER.readerFor(ReactorScenario.class);
    private static final ObjectWriter SCENARIO_WRITER = MAPPER.writerFor(ReactorScenario.class).withDefaultPrettyPrinter();

    /**
     * Escribe el escenario en la ruta indicada, creando los directorios que falten.
     *
     * @throws IOException Si falla la escritura.
     */
    public void writeScenario(ReactorScenario scenario, String filePath) throws IOException {
        if (scenario == null) {
            throw new IllegalArgumentException("No se puede guardar un escenario nulo.");
        }
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Guardando escenario {} en {}", scenario, path);

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            SCENARIO_WRITER.writeValue(path.toFile(), scenario);
        } catch (IOException e) {
            log.error("No se pudo guardar el escenario en {}", path, e);
            throw e;
        }
    }

    /**
     * Lee un escenario desde JSON.
     *
     * @return El escenario leído, nunca nulo.
     * @throws IOException Si el archivo no existe, está vacío, contiene {@code null} o el JSON no es un escenario válido.
     */
    public ReactorScenario readScenario(String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Cargando escenario desde {}", path);

        if (!Files.exists(path)) {
            throw new IOException("El archivo de escenario no existe: " + path);
        }

        ReactorScenario scenario;
        try {
            scenario = SCENARIO_READER.readValue(path.toFile());
        } catch (JsonProcessingException e) {
            log.error("Escenario mal formado en {}", path, e);
            throw new IOException("El escenario " + path.getFileName() + " no es válido: " + e.getOriginalMessage(), e);
        }

        if (scenario == null) {
            throw new IOException("El escenario " + path.getFileName() + " está vacío (null).");
        }
        return scenario;
    }
}
