package complexreactor.physics.model;

import complexreactor.config.ReactorConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Modelo de un reactor "complejo" simplificado: 2 entradas (A, B) y 1 o 2 salidas (R, S).
 * <p>
 * Asume estequiometría 1:1 (1 A + 1 B -> productos):
 * <ul>
 * <li>limiting = min(A, B)</li>
 * <li>reacted = limiting * conversion</li>
 * <li>Un solo producto: R = reacted.</li>
 * <li>Dos productos: R = reacted * splitRatio, S = reacted * (1 - splitRatio).</li>
 * </ul>
 * Ejemplo: A=1, B=1, conversion=1.0, twoOutputs=true, splitRatio=0.7 -> R=0.7, S=0.3
 * <p>
 * Los parámetros se validan antes de asignarse: una llamada fallida deja el estado intacto.
 * <p>
 * No es thread-safe. Si se comparte entre hilos, el llamador debe sincronizar la instancia completa.
 */
@Slf4j
public class ReactorModel {

    private static final double[] NO_OUTPUTS = new double[0];

    @Getter
    private double inputA;
    @Getter
    private double inputB;
    @Getter
    private double conversion;
    @Getter
    private boolean twoOutputs;
    @Getter
    private double splitRatio;

    // Último resultado (vacío si no se ha ejecutado o tras reset)
    private double[] lastOutputs = NO_OUTPUTS;

    public ReactorModel() {
        this(ReactorConfig.DEFAULT_CONVERSION, false, ReactorConfig.DEFAULT_SPLIT_RATIO);
    }

    public ReactorModel(double conversion) {
        this(conversion, false, ReactorConfig.DEFAULT_SPLIT_RATIO);
    }

    public ReactorModel(double conversion, boolean twoOutputs) {
        this(conversion, twoOutputs, ReactorConfig.DEFAULT_SPLIT_RATIO);
    }

    /**
     * @param conversion Fracción (0..1) del reactivo limitante que reacciona.
     * @param twoOutputs Si es true la reacción da 2 productos (R y S), si no solo R.
     * @param splitRatio Fracción de lo reaccionado que va a R (0..1). Se ignora con un solo producto.
     * @throws IllegalArgumentException si conversion o splitRatio no están en [0,1].
     */
    public ReactorModel(double conversion, boolean twoOutputs, double splitRatio) {
        validateParams(conversion, splitRatio);
        this.conversion = conversion;
        this.twoOutputs = twoOutputs;
        this.splitRatio = splitRatio;
    }

    /**
     * @throws IllegalArgumentException si la configuración es nula o tiene valores fuera de rango.
     */
    public ReactorModel(ReactorConfig config) {
        this(requireConfig(config).conversion(), config.twoOutputs(), config.splitRatio());
    }

    /**
     * Establece las cantidades de los reactivos A y B.
     *
     * @throws IllegalArgumentException si a o b son negativos. Las entradas previas se conservan.
     */
    public void setInputs(double a, double b) {
        // !(x >= 0) también rechaza NaN
        if (!(a >= 0.0) || !(b >= 0.0)) {
            throw new IllegalArgumentException("Las entradas deben ser no negativas (A=" + a + ", B=" + b + ").");
        }
        this.inputA = a;
        this.inputB = b;
        log.debug("Entradas establecidas: A={}, B={}", a, b);
    }

    /**
     * @throws IllegalArgumentException si el valor no está en [0,1].
     */
    public void setConversion(double conversion) {
        validateParams(conversion, this.splitRatio);
        this.conversion = conversion;
        log.debug("Conversión establecida: {}", conversion);
    }

    public void setTwoOutputs(boolean twoOutputs) {
        this.twoOutputs = twoOutputs;
        log.debug("Modo de salida: {}", twoOutputs ? "R+S" : "R");
    }

    /**
     * @param splitRatio Fracción asignada a R. Con un solo producto se ignora, pero igualmente se valida.
     * @throws IllegalArgumentException si el valor no está en [0,1].
     */
    public void setSplitRatio(double splitRatio) {
        validateParams(this.conversion, splitRatio);
        this.splitRatio = splitRatio;
        log.debug("Split ratio establecido: {}", splitRatio);
    }

    /**
     * Ejecuta la reacción con las entradas y parámetros actuales.
     * <p>
     * No modifica A ni B: llamadas repetidas sin cambios devuelven el mismo resultado.
     *
     * @return {R} con un solo producto, {R, S} con dos. Es una copia del resultado almacenado.
     */
    public double[] runReaction() {
        double limiting = Math.min(inputA, inputB);
        double reacted = limiting * conversion;

        if (!twoOutputs) {
            lastOutputs = new double[]{reacted};
        } else {
            double r = reacted * splitRatio;
            double s = reacted * (1.0 - splitRatio);
            lastOutputs = new double[]{r, s};
        }

        log.debug("Reacción: limitante={}, reaccionado={}, salidas={}", limiting, reacted, Arrays.toString(lastOutputs));
        return lastOutputs.clone();
    }

    /**
     * Pone las entradas a cero y descarta el último resultado.
     */
    public void reset() {
        inputA = 0.0;
        inputB = 0.0;
        lastOutputs = NO_OUTPUTS;
        log.debug("Reactor reiniciado.");
    }

    /**
     * @param index 0 para R, 1 para S (si existe).
     * @return El valor del producto en el último resultado.
     * @throws IndexOutOfBoundsException si no hay resultado o el índice no es válido.
     */
    public double getLastOutput(int index) {
        if (index < 0 || index >= lastOutputs.length) {
            throw new IndexOutOfBoundsException("El índice de salida " + index + " está fuera de rango (salidas disponibles: " + lastOutputs.length + ").");
        }
        return lastOutputs[index];
    }

    public double[] getLastOutputs() {
        return lastOutputs.clone();
    }

    public int getOutputCount() {
        return lastOutputs.length;
    }

    public boolean hasOutputs() {
        return lastOutputs.length > 0;
    }

    /**
     * Instantánea de la configuración actual (sin entradas ni resultados).
     */
    public ReactorConfig toConfig() {
        return new ReactorConfig(conversion, twoOutputs, splitRatio);
    }

    private static ReactorConfig requireConfig(ReactorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("La configuración del reactor no puede ser nula.");
        }
        return config;
    }

    private static void validateParams(double conversion, double splitRatio) {
        if (!isFraction(conversion)) {
            throw new IllegalArgumentException("conversion debe estar en [0,1] (recibido: " + conversion + ").");
        }
        if (!isFraction(splitRatio)) {
            throw new IllegalArgumentException("splitRatio debe estar en [0,1] (recibido: " + splitRatio + ").");
        }
    }

    private static boolean isFraction(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
