package complexreactor.factory;

import complexreactor.config.ReactorConfig;
import complexreactor.config.ReactorScenario;
import complexreactor.io.ScenarioFileHandler;
import complexreactor.physics.model.ReactorModel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Fábrica de instancias de {@link ReactorModel} a partir de configuraciones y escenarios.
 * <p>
 * Toda la validación la hace el propio modelo: un valor fuera de rango en la
 * configuración o en las entradas termina en {@link IllegalArgumentException}.
 */
@Slf4j
public class ReactorFactory {

    private final ScenarioFileHandler scenarioFileHandler;

    public ReactorFactory() {
        this(new ScenarioFileHandler());
    }

    public ReactorFactory(ScenarioFileHandler scenarioFileHandler) {
        this.scenarioFileHandler = scenarioFileHandler;
    }

    public static ReactorModel create(ReactorConfig config) {
        return new ReactorModel(config);
    }

    /**
     * Crea el reactor y carga las entradas del escenario (sin ejecutar la reacción).
     *
     * @throws IllegalArgumentException Si el escenario es nulo o contiene valores fuera de rango.
     */
    public static ReactorModel fromScenario(ReactorScenario scenario) {
        if (scenario == null) {
            throw new IllegalArgumentException("El escenario del reactor no puede ser nulo.");
        }
        ReactorModel reactor = create(scenario.config());
        reactor.setInputs(scenario.inputA(), scenario.inputB());
        return reactor;
    }

    /**
     * Crea el reactor, carga las entradas y ejecuta una reacción.
     *
     * @return Salidas de la reacción ({R} o {R, S}).
     */
    public static double[] runScenario(ReactorScenario scenario) {
        return fromScenario(scenario).runReaction();
    }

    /**
     * Lee un escenario desde un archivo JSON y devuelve el reactor listo para ejecutar.
     *
     * @throws IOException              Si el archivo no existe o no se puede parsear.
     * @throws IllegalArgumentException Si el escenario contiene valores fuera de rango.
     */
    public ReactorModel loadScenario(String filePath) throws IOException {
        ReactorScenario scenario = scenarioFileHandler.readScenario(filePath);
        log.info("Escenario cargado: {}", scenario);
        return fromScenario(scenario);
    }

    /**
     * Guarda el estado actual del reactor (configuración y entradas) como escenario JSON.
     */
    public void saveScenario(ReactorModel reactor, String filePath) throws IOException {
        ReactorScenario scenario = ReactorScenario.builder()
                .config(reactor.toConfig())
                .inputA(reactor.getInputA())
                .inputB(reactor.getInputB())
                .build();
        scenarioFileHandler.writeScenario(scenario, filePath);
    }
}
