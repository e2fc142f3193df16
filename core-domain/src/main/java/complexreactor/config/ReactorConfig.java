package complexreactor.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * Objeto de valor inmutable con los parámetros de operación de un reactor.
 * <p>
 * No se valida aquí: la validación ocurre al construir el {@code ReactorModel}.
 *
 * @param conversion Fracción (0..1) del reactivo limitante que reacciona.
 * @param twoOutputs true si la reacción produce R y S, false si solo produce R.
 * @param splitRatio Fracción (0..1) de lo reaccionado que va a R. Ignorada con un solo producto.
 */
@Builder(toBuilder = true)
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReactorConfig(
        double conversion,
        boolean twoOutputs,
        double splitRatio
) {
    public static final double DEFAULT_CONVERSION = 0.5;
    public static final double DEFAULT_SPLIT_RATIO = 0.5;

    public static ReactorConfig defaults() {
        return new ReactorConfig(DEFAULT_CONVERSION, false, DEFAULT_SPLIT_RATIO);
    }

    /**
     * Constructor para JSON: los campos ausentes toman los mismos valores por defecto que el reactor.
     */
    @JsonCreator
    public static ReactorConfig fromJson(@JsonProperty("conversion") Double conversion,
                                         @JsonProperty("twoOutputs") Boolean twoOutputs,
                                         @JsonProperty("splitRatio") Double splitRatio) {
        return new ReactorConfig(
                Objects.requireNonNullElse(conversion, DEFAULT_CONVERSION),
                Objects.requireNonNullElse(twoOutputs, Boolean.FALSE),
                Objects.requireNonNullElse(splitRatio, DEFAULT_SPLIT_RATIO));
    }
}
