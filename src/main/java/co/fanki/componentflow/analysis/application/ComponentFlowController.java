package co.fanki.componentflow.analysis.application;

import co.fanki.componentflow.analysis.application.ComponentFlowService.AnalyzeRequest;
import co.fanki.componentflow.analysis.application.ComponentFlowService.ComponentFlowAnalysis;
import co.fanki.componentflow.analysis.application.ComponentFlowService.MarkupElementsRequest;
import co.fanki.componentflow.analysis.domain.MarkupElementStats;
import co.fanki.componentflow.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for component-flow analyses.
 *
 * <p>Request-level failures (missing project root or entry files, invalid
 * configuration) answer 400 with {@code error} and {@code errorCode}.
 * Per-file failures are part of a normal 200 result.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/component-flow")
@Tag(name = "Component Flow",
        description = "Build the component-flow graph of React sources")
public class ComponentFlowController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ComponentFlowController.class);

    private final ComponentFlowService componentFlowService;

    /**
     * Creates a new ComponentFlowController.
     *
     * @param theComponentFlowService the component flow service
     */
    public ComponentFlowController(
            final ComponentFlowService theComponentFlowService) {
        this.componentFlowService = theComponentFlowService;
    }

    /**
     * Builds the flow graphs of the requested entry files.
     *
     * @param request the analysis request
     * @return the analysis, or 400 for an invalid request
     */
    @Operation(
            summary = "Analyze component flow",
            description = "Parses the entry files, follows the components"
                    + " they render through imports and records every"
                    + " conditional render on the way.")
    @ApiResponses({
            @ApiResponse(responseCode = "200",
                    description = "Analysis completed",
                    content = @Content(schema = @Schema(
                            implementation = ComponentFlowAnalysis.class))),
            @ApiResponse(responseCode = "400",
                    description = "Invalid request or configuration")
    })
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(
            @RequestBody final AnalyzeRequest request) {

        LOG.info("Component flow request for: {}",
                request == null ? null : request.projectRoot());

        try {
            return ResponseEntity.ok(componentFlowService.analyze(request));
        } catch (final DomainException e) {
            LOG.warn("Component flow request rejected: {}", e.getMessage());
            return badRequest(e.getMessage(), e.getErrorCode());
        } catch (final IllegalArgumentException e) {
            LOG.warn("Invalid configuration: {}", e.getMessage());
            return badRequest(e.getMessage(), "INVALID_CONFIG");
        }
    }

    /**
     * Counts the markup elements rendered by one file.
     *
     * @param request the file and filter
     * @return the statistics, or 400 for an invalid request
     */
    @Operation(summary = "Markup element statistics",
            description = "Counts the native tags the components of one"
                    + " file render, grouped by tag.")
    @PostMapping("/markup-elements")
    public ResponseEntity<?> markupElements(
            @RequestBody final MarkupElementsRequest request) {
        try {
            final MarkupElementStats stats =
                    componentFlowService.analyzeMarkupElements(request);
            return ResponseEntity.ok(stats);
        } catch (final DomainException e) {
            LOG.warn("Markup element request rejected: {}", e.getMessage());
            return badRequest(e.getMessage(), e.getErrorCode());
        } catch (final IllegalArgumentException e) {
            LOG.warn("Invalid markup filter: {}", e.getMessage());
            return badRequest(e.getMessage(), "INVALID_CONFIG");
        }
    }

    private static ResponseEntity<Map<String, String>> badRequest(
            final String message, final String errorCode) {
        final Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("errorCode", errorCode);
        return ResponseEntity.badRequest().body(body);
    }
}
