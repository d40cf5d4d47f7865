package co.fanki.componentflow.config;

import co.fanki.componentflow.analysis.domain.ast.TypeScriptSyntaxEngine;
import co.fanki.componentflow.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Wires the parser runtime.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class ComponentFlowConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            ComponentFlowConfiguration.class);

    /**
     * Starts the TypeScript compiler inside GraalJS. The context is closed
     * with the application.
     *
     * @param properties the service properties
     * @return the parser
     */
    @Bean(destroyMethod = "close")
    TypeScriptSyntaxEngine typeScriptSyntaxEngine(
            final ComponentFlowProperties properties) {
        try {
            final TypeScriptSyntaxEngine engine = new TypeScriptSyntaxEngine(
                    properties.parser().typescriptVersion());
            LOG.info("TypeScript {} parser ready", engine.compilerVersion());
            return engine;
        } catch (final IOException e) {
            throw new DomainException("Could not load the TypeScript parser",
                    "PARSER_UNAVAILABLE", e);
        }
    }
}
