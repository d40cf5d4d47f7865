package co.fanki.componentflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Component Flow Server Application.
 *
 * <p>Entry point of the service that builds component-flow graphs for
 * React/JSX/TSX source trees. The graphs are available through a REST
 * API and, when started with {@code mcp.server.stdio=true}, as an MCP
 * tool over stdin/stdout.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ComponentFlowServerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(ComponentFlowServerApplication.class, args);
    }

}
