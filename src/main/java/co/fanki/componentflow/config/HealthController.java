package co.fanki.componentflow.config;

import co.fanki.componentflow.analysis.domain.ast.TypeScriptSyntaxEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness and readiness endpoints.
 *
 * <p>{@code /ready} reports the TypeScript version the parser runs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    private final TypeScriptSyntaxEngine engine;

    /**
     * Creates a new HealthController.
     *
     * @param theEngine the parser runtime
     */
    public HealthController(final TypeScriptSyntaxEngine theEngine) {
        this.engine = theEngine;
    }

    /**
     * Returns health status.
     *
     * @return "up" if the service is running
     */
    @GetMapping("/health")
    public String health() {
        return "up";
    }

    /**
     * Readiness probe.
     *
     * @return the status and the parser version
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        return ResponseEntity.ok(Map.of(
                "status", "ready",
                "typescript", engine.compilerVersion()));
    }

}
