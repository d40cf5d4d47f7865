package co.fanki.componentflow.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Component Flow Server.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Component Flow Server API")
                        .description("""
                                Component Flow Server - builds the component-flow graph of a
                                React/JSX/TSX source tree starting from its entry files.

                                ## Features
                                - **Flow graph**: which components render which, conditionally or not
                                - **Conditional renders**: ternaries, && / ||, if/else, switch, early returns
                                - **External dependencies**: packages whose components are rendered
                                - **Markup elements**: optional tracking of native tags

                                ## MCP Tools
                                - `analyze_component_flow` - Build the flow graph of entry files
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
