package complexreactor.factory;

import complexreactor.config.ReactorConfig;
import complexreactor.config.ReactorScenario;
import complexreactor.io.ScenarioFileHandler;
import complexreactor.physics.model.ReactorModel;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Slf4j
@ExtendWith(MockitoExtension.class)
class ReactorFactoryTest {

    private static final double TOLERANCE = 1e-9;

    @Mock
    private ScenarioFileHandler mockScenarioHandler;

    private ReactorFactory factory;

    @BeforeEach
    void setUp() {
        factory = new ReactorFactory(mockScenarioHandler);
    }

    @Test
    @DisplayName("create: la configuración se traslada íntegra al reactor")
    void create_shouldApplyConfiguration() {
        ReactorConfig config = ReactorConfig.builder()
                .conversion(0.9)
                .twoOutputs(true)
                .splitRatio(0.2)
                .build();

        ReactorModel reactor = ReactorFactory.create(config);

        assertEquals(config, reactor.toConfig());
        assertEquals(0.0, reactor.getInputA());
        assertFalse(reactor.hasOutputs());
    }

    @Test
    @DisplayName("create: configuración fuera de rango lanza IllegalArgumentException")
    void create_invalidConfig_shouldThrow() {
        ReactorConfig invalid = ReactorConfig.defaults().withSplitRatio(1.5);

        assertThrows(IllegalArgumentException.class, () -> ReactorFactory.create(invalid));
    }

    @Test
    @DisplayName("create/fromScenario: configuración o escenario nulos lanzan IllegalArgumentException")
    void nullInputs_shouldThrowIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> ReactorFactory.create(null));
        assertThrows(IllegalArgumentException.class, () -> ReactorFactory.fromScenario(null));
        assertThrows(IllegalArgumentException.class, () -> ReactorFactory.runScenario(null));
    }

    @Test
    @DisplayName("runScenario: coincide con construir y ejecutar el reactor directamente")
    void runScenario_shouldMatchDirectExecution() {
        ReactorScenario scenario = new ReactorScenario(new ReactorConfig(1.0, true, 0.7), 1.0, 1.0);

        double[] out = ReactorFactory.runScenario(scenario);

        ReactorModel direct = new ReactorModel(1.0, true, 0.7);
        direct.setInputs(1.0, 1.0);
        assertArrayEquals(direct.runReaction(), out, TOLERANCE);
    }

    @Test
    @DisplayName("fromScenario: sin config se usan los valores por defecto")
    void fromScenario_withoutConfig_shouldUseDefaults() {
        ReactorScenario scenario = ReactorScenario.builder().inputA(2.0).inputB(2.0).build();

        ReactorModel reactor = ReactorFactory.fromScenario(scenario);

        assertEquals(ReactorConfig.defaults(), reactor.toConfig());
        assertEquals(1.0, reactor.runReaction()[0], TOLERANCE);
    }

    @Test
    @DisplayName("fromScenario: entradas negativas lanzan IllegalArgumentException")
    void fromScenario_negativeInputs_shouldThrow() {
        ReactorScenario scenario = new ReactorScenario(ReactorConfig.defaults(), -1.0, 2.0);

        assertThrows(IllegalArgumentException.class, () -> ReactorFactory.fromScenario(scenario));
    }

    @Test
    @DisplayName("loadScenario: delega la lectura en ScenarioFileHandler y carga las entradas")
    void loadScenario_shouldReadFromHandler() throws IOException {
        ReactorScenario scenario = new ReactorScenario(new ReactorConfig(1.0, false, 0.5), 0.5, 10.0);
        when(mockScenarioHandler.readScenario("scenario.json")).thenReturn(scenario);

        ReactorModel reactor = factory.loadScenario("scenario.json");

        assertEquals(0.5, reactor.getInputA());
        assertEquals(10.0, reactor.getInputB());
        assertEquals(0.5, reactor.runReaction()[0], TOLERANCE);
    }

    @Test
    @DisplayName("loadScenario: los errores de lectura se propagan al llamador")
    void loadScenario_ioError_shouldPropagate() throws IOException {
        when(mockScenarioHandler.readScenario("missing.json"))
                .thenThrow(new IOException("El archivo especificado no existe"));

        assertThrows(IOException.class, () -> factory.loadScenario("missing.json"));
    }

    @Test
    @DisplayName("saveScenario: guarda configuración y entradas actuales")
    void saveScenario_shouldWriteCurrentState() throws IOException {
        ReactorModel reactor = new ReactorModel(0.3, true, 0.6);
        reactor.setInputs(4.0, 8.0);

        factory.saveScenario(reactor, "out.json");

        ArgumentCaptor<ReactorScenario> captor = ArgumentCaptor.forClass(ReactorScenario.class);
        verify(mockScenarioHandler).writeScenario(captor.capture(), eq("out.json"));
        ReactorScenario saved = captor.getValue();
        log.info("Escenario guardado: {}", saved);

        assertEquals(new ReactorConfig(0.3, true, 0.6), saved.config());
        assertEquals(4.0, saved.inputA());
        assertEquals(8.0, saved.inputB());
    }
}
