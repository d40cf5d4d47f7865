package co.fanki.componentflow.config;

import co.fanki.componentflow.analysis.domain.FlowAnalysisConfig;
import co.fanki.componentflow.analysis.domain.ast.TypeScriptSyntaxEngine;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Service defaults bound from {@code component-flow.*}.
 *
 * <p>Requests override these per run; whatever a request leaves out falls
 * back to the values here.</p>
 *
 * @param maxDepth the default depth bound
 * @param includeExternalComponents whether external leaves are kept
 * @param excludePatterns the default exclude globs, null for the built-in
 *        ones
 * @param includeHtmlElements whether markup elements are tracked
 * @param srcDirectory the source directory relative to the project root
 * @param parser the parser settings
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@ConfigurationProperties(prefix = "component-flow")
public record ComponentFlowProperties(
        @DefaultValue("10") int maxDepth,
        @DefaultValue("true") boolean includeExternalComponents,
        List<String> excludePatterns,
        @DefaultValue("false") boolean includeHtmlElements,
        @DefaultValue("src") String srcDirectory,
        @DefaultValue Parser parser) {

    /**
     * Returns the built-in defaults, the same ones an empty
     * {@code application.yml} yields.
     *
     * @return the defaults
     */
    public static ComponentFlowProperties defaults() {
        return new ComponentFlowProperties(10, true,
                FlowAnalysisConfig.DEFAULT_EXCLUDE_PATTERNS, false, "src",
                new Parser(TypeScriptSyntaxEngine.DEFAULT_TYPESCRIPT_VERSION));
    }

    /**
     * Returns the exclude globs to start from.
     *
     * @return the configured globs, or the built-in ones when unset
     */
    public List<String> effectiveExcludePatterns() {
        return excludePatterns == null
                ? FlowAnalysisConfig.DEFAULT_EXCLUDE_PATTERNS
                : excludePatterns;
    }

    /**
     * Parser settings.
     *
     * @param typescriptVersion the TypeScript WebJar version to load when
     *        the classpath does not tell
     */
    public record Parser(@DefaultValue("4.9.5") String typescriptVersion) {
    }
}
