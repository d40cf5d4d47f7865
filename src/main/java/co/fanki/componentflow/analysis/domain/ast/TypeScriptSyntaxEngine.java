package co.fanki.componentflow.analysis.domain.ast;

import co.fanki.componentflow.shared.Preconditions;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Parses JSX/TSX sources with the TypeScript compiler running inside a
 * GraalJS polyglot context.
 *
 * <p>The compiler is loaded from the {@code org.webjars.npm:typescript}
 * WebJar on the classpath, followed by {@code js/component-ast.js}, which
 * exposes {@code parseComponentSource(text, fileName)}. That function
 * returns a compact JSON tree (or null on syntax errors) that is read into
 * {@link SyntaxNode}s with Jackson.</p>
 *
 * <p>The context is created once and reused for every file, then closed
 * via {@link #close()}. GraalJS contexts are single-threaded, so
 * {@link #parse(String, String)} is synchronized.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class TypeScriptSyntaxEngine implements SourceParser, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(
            TypeScriptSyntaxEngine.class);

    /** Used when the WebJar metadata cannot be read. */
    public static final String DEFAULT_TYPESCRIPT_VERSION = "4.9.5";

    private static final String WEBJAR_POM_PROPERTIES =
            "META-INF/maven/org.webjars.npm/typescript/pom.properties";

    private static final String COMPILER_RESOURCE =
            "META-INF/resources/webjars/typescript/%s/lib/typescript.js";

    private static final String BRIDGE_RESOURCE = "js/component-ast.js";

    private static final ObjectMapper MAPPER = new ObjectMapper(
            JsonFactory.builder()
                    .streamReadConstraints(StreamReadConstraints.builder()
                            .maxNestingDepth(20_000)
                            .build())
                    .build());

    /** Polyfill for the Node.js globals the compiler probes at load. */
    private static final String PROCESS_POLYFILL = """
            if (typeof globalThis.process === 'undefined') {
                globalThis.process = { env: {} };
            }
            if (typeof globalThis.console === 'undefined') {
                globalThis.console = {
                    log: function() {},
                    warn: function() {},
                    error: function() {}
                };
            }
            """;

    private final Context context;
    private final Value parseFunction;
    private final String compilerVersion;

    /**
     * Creates a new engine using the TypeScript WebJar on the classpath.
     *
     * @throws IOException if the compiler or bridge script cannot be loaded
     */
    public TypeScriptSyntaxEngine() throws IOException {
        this(DEFAULT_TYPESCRIPT_VERSION);
    }

    /**
     * Creates a new engine.
     *
     * @param fallbackVersion the WebJar version to load when the version
     *        cannot be detected from the WebJar metadata
     * @throws IOException if the compiler or bridge script cannot be loaded
     */
    public TypeScriptSyntaxEngine(final String fallbackVersion)
            throws IOException {

        Preconditions.requireNonBlank(fallbackVersion,
                "TypeScript version is required");

        final String version = detectWebJarVersion(fallbackVersion);
        final String compilerSource = loadFromClasspath(
                String.format(COMPILER_RESOURCE, version));
        final String bridgeSource = loadFromClasspath(BRIDGE_RESOURCE);

        LOG.info("TypeScript compiler {} loaded ({} bytes)",
                version, compilerSource.length());

        this.context = createContext();

        try {
            context.eval("js", PROCESS_POLYFILL);
            context.eval(Source.newBuilder("js", compilerSource,
                    "typescript.js").build());
            context.eval(Source.newBuilder("js", bridgeSource,
                    "component-ast.js").build());

            this.parseFunction = context.getBindings("js")
                    .getMember("parseComponentSource");

            if (parseFunction == null || !parseFunction.canExecute()) {
                throw new IllegalStateException(
                        "parseComponentSource function not found in "
                                + BRIDGE_RESOURCE);
            }

            this.compilerVersion = context.getBindings("js")
                    .getMember("typescriptVersion").execute().asString();
        } catch (final IOException | RuntimeException e) {
            context.close();
            throw e;
        }
    }

    /** {@inheritDoc} */
    @Override
    public synchronized SyntaxNode parse(final String sourceText,
            final String fileName) {

        if (sourceText == null) {
            return null;
        }

        try {
            final Value result = parseFunction.execute(
                    sourceText, fileName == null ? "" : fileName);
            if (result == null || result.isNull()) {
                LOG.debug("Syntax errors in {}", fileName);
                return null;
            }
            return SyntaxNode.fromJson(MAPPER.readTree(result.asString()));
        } catch (final RuntimeException | IOException e) {
            LOG.warn("Failed to parse {}: {}", fileName, e.getMessage());
            return null;
        }
    }

    /**
     * Returns the version reported by the loaded compiler.
     *
     * @return the TypeScript version, never null
     */
    public String compilerVersion() {
        return compilerVersion;
    }

    /** {@inheritDoc} */
    @Override
    public synchronized void close() {
        context.close();
    }

    /**
     * Creates a sandboxed GraalJS context with no I/O access.
     *
     * <p>No statement limit is applied: loading the compiler alone runs
     * millions of statements.</p>
     */
    private static Context createContext() {
        return Context.newBuilder("js")
                .allowExperimentalOptions(true)
                .option("js.ecmascript-version", "2022")
                .option("engine.WarnInterpreterOnly", "false")
                .build();
    }

    /**
     * Reads the WebJar version from its Maven metadata.
     */
    private static String detectWebJarVersion(final String fallback) {
        try (InputStream is = TypeScriptSyntaxEngine.class.getClassLoader()
                .getResourceAsStream(WEBJAR_POM_PROPERTIES)) {
            if (is == null) {
                return fallback;
            }
            final Properties properties = new Properties();
            properties.load(is);
            return properties.getProperty("version", fallback);
        } catch (final IOException e) {
            LOG.warn("Could not read TypeScript WebJar metadata, using {}",
                    fallback, e);
            return fallback;
        }
    }

    private static String loadFromClasspath(final String resource)
            throws IOException {
        try (InputStream is = TypeScriptSyntaxEngine.class.getClassLoader()
                .getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException(
                        "Resource not found on classpath: " + resource);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
