package co.fanki.componentflow.config;

import co.fanki.componentflow.analysis.application.ComponentFlowService;
import co.fanki.componentflow.analysis.application.ComponentFlowService.AnalyzeRequest;
import co.fanki.componentflow.analysis.application.ComponentFlowService.MarkupElementsRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Exposes the component-flow analysis as MCP tools over stdio.
 *
 * <p>When the {@code mcp.server.stdio} property is set to {@code true},
 * this configuration starts an MCP server that communicates via
 * stdin/stdout using the JSON-RPC protocol. Logging goes to stderr so
 * stdout stays the protocol channel.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final String HTML_ELEMENT_FILTER_SCHEMA = """
            {
              "type": "object",
              "description": "Which native tags are tracked",
              "properties": {
                "includeAll": { "type": "boolean" },
                "includeTags": {
                  "type": "array", "items": { "type": "string" }
                },
                "excludeTags": {
                  "type": "array", "items": { "type": "string" }
                },
                "captureTextContent": { "type": "boolean" },
                "maxTextLength": { "type": "integer", "minimum": 0 }
              }
            }
            """;

    private static final String ANALYZE_COMPONENT_FLOW_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "projectRoot": {
                  "type": "string",
                  "description": "Absolute path of the project root"
                },
                "srcDirectory": {
                  "type": "string",
                  "description": "Source directory relative to the root (defaults to src)"
                },
                "entryFiles": {
                  "type": "array",
                  "description": "Entry files, relative to the root or absolute",
                  "items": { "type": "string" }
                },
                "components": {
                  "type": "array",
                  "description": "Known component definitions",
                  "items": {
                    "type": "object",
                    "properties": {
                      "name": { "type": "string" },
                      "filePath": { "type": "string" }
                    },
                    "required": ["name", "filePath"]
                  }
                },
                "config": {
                  "type": "object",
                  "properties": {
                    "maxDepth": { "type": "integer", "minimum": 1 },
                    "includeExternalComponents": { "type": "boolean" },
                    "excludePatterns": {
                      "type": "array", "items": { "type": "string" }
                    },
                    "includeHtmlElements": { "type": "boolean" },
                    "htmlElementFilter": %s
                  }
                }
              },
              "required": ["projectRoot", "entryFiles"]
            }
            """.formatted(HTML_ELEMENT_FILTER_SCHEMA);

    private static final String ANALYZE_MARKUP_ELEMENTS_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "projectRoot": {
                  "type": "string",
                  "description": "Absolute path of the project root"
                },
                "filePath": {
                  "type": "string",
                  "description": "The file, relative to the root or absolute"
                },
                "htmlElementFilter": %s
              },
              "required": ["filePath"]
            }
            """.formatted(HTML_ELEMENT_FILTER_SCHEMA);

    /**
     * Creates the stdio transport provider for MCP communication.
     *
     * @param objectMapper the Jackson ObjectMapper for JSON serialization
     * @return the stdio server transport provider
     */
    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates and configures the MCP synchronous server with all tools.
     *
     * @param transportProvider the stdio transport provider
     * @param componentFlowService the service behind the tools
     * @param objectMapper the Jackson ObjectMapper for arguments and
     *        responses
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final ComponentFlowService componentFlowService,
            final ObjectMapper objectMapper) {

        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("component-flow-server", "0.0.1")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .build();

        server.addTool(analyzeComponentFlowTool(componentFlowService,
                objectMapper));
        server.addTool(analyzeMarkupElementsTool(componentFlowService,
                objectMapper));

        LOG.info("MCP stdio server initialized with 2 tools");

        return server;
    }

    /**
     * Keeps the JVM alive while the MCP server is running.
     *
     * @return the command line runner that blocks on a latch
     */
    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    private McpServerFeatures.SyncToolSpecification analyzeComponentFlowTool(
            final ComponentFlowService componentFlowService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("analyze_component_flow",
                        "Build the component-flow graph of a React project"
                                + " from its entry files. Returns, per"
                                + " entry, the tree of rendered components"
                                + " with their conditional renders"
                                + " (ternary, &&/||, if/else, switch,"
                                + " early return), the external packages"
                                + " used and a summary.",
                        ANALYZE_COMPONENT_FLOW_SCHEMA),
                (exchange, arguments) -> {
                    try {
                        final AnalyzeRequest request = objectMapper
                                .convertValue(arguments, AnalyzeRequest.class);
                        return toCallToolResult(objectMapper,
                                componentFlowService.analyze(request));
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private McpServerFeatures.SyncToolSpecification analyzeMarkupElementsTool(
            final ComponentFlowService componentFlowService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("analyze_markup_elements",
                        "Count the native markup tags the components of"
                                + " one file render, grouped by tag.",
                        ANALYZE_MARKUP_ELEMENTS_SCHEMA),
                (exchange, arguments) -> {
                    try {
                        final MarkupElementsRequest request = objectMapper
                                .convertValue(arguments,
                                        MarkupElementsRequest.class);
                        return toCallToolResult(objectMapper,
                                componentFlowService
                                        .analyzeMarkupElements(request));
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private CallToolResult toCallToolResult(final ObjectMapper objectMapper,
            final Object result) {
        try {
            final String json = objectMapper.writeValueAsString(result);
            return new CallToolResult(
                    List.of(new McpSchema.TextContent(json)), false);
        } catch (final Exception e) {
            return errorResult(e);
        }
    }

    private CallToolResult errorResult(final Exception e) {
        LOG.error("Tool execution error", e);
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
