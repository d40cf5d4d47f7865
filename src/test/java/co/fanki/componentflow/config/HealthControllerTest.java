package co.fanki.componentflow.config;

import co.fanki.componentflow.analysis.domain.ast.TypeScriptSyntaxEngine;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link HealthController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class HealthControllerTest {

    @Test
    void whenCheckingReadiness_shouldReportParserVersion() {
        final TypeScriptSyntaxEngine engine = mock(TypeScriptSyntaxEngine.class);
        when(engine.compilerVersion()).thenReturn("4.9.5");

        final HealthController controller = new HealthController(engine);
        final ResponseEntity<Map<String, Object>> ready = controller.ready();

        assertEquals("up", controller.health());
        assertEquals("ready", ready.getBody().get("status"));
        assertEquals("4.9.5", ready.getBody().get("typescript"));
    }
}
