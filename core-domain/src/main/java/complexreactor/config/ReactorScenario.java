package complexreactor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * Describe una ejecución completa: configuración del reactor y cantidades de A y B.
 * <p>
 * Pensado para leerse desde JSON:
 * <pre>
 * { "config": { "conversion": 1.0, "twoOutputs": true, "splitRatio": 0.7 }, "inputA": 1.0, "inputB": 1.0 }
 * </pre>
 *
 * @param config Parámetros del reactor. Si falta, se usan {@link ReactorConfig#defaults()}.
 * @param inputA Cantidad del reactivo A.
 * @param inputB Cantidad del reactivo B.
 */
@Builder
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReactorScenario(
        ReactorConfig config,
        double inputA,
        double inputB
) {
    public ReactorScenario {
        config = Objects.requireNonNullElseGet(config, ReactorConfig::defaults);
    }
}
