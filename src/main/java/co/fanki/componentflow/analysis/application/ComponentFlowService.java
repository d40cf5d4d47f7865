package co.fanki.componentflow.analysis.application;

import co.fanki.componentflow.analysis.domain.ErrorType;
import co.fanki.componentflow.analysis.domain.ExternalDependency;
import co.fanki.componentflow.analysis.domain.ExternalDependencyCollector;
import co.fanki.componentflow.analysis.domain.FileKey;
import co.fanki.componentflow.analysis.domain.FlowAnalysisConfig;
import co.fanki.componentflow.analysis.domain.FlowAnalysisError;
import co.fanki.componentflow.analysis.domain.FlowGraphBuilder;
import co.fanki.componentflow.analysis.domain.FlowNode;
import co.fanki.componentflow.analysis.domain.MarkupElementStats;
import co.fanki.componentflow.analysis.domain.ast.SourceParser;
import co.fanki.componentflow.analysis.domain.conditional.MarkupElementFilter;
import co.fanki.componentflow.analysis.domain.imports.ImportClassificationPolicy;
import co.fanki.componentflow.analysis.domain.resolution.ComponentDefinition;
import co.fanki.componentflow.analysis.domain.resolution.ComponentRegistry;
import co.fanki.componentflow.config.ComponentFlowProperties;
import co.fanki.componentflow.shared.DomainException;
import co.fanki.componentflow.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs component-flow analyses for REST and MCP callers.
 *
 * <p>Each call builds its own {@link FlowGraphBuilder}, so runs share no
 * state besides the parser. Entries are analyzed one after the other in
 * a single builder: a component reached from several entries is scanned
 * once. A failure in one entry is recorded and the next entry still
 * runs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ComponentFlowService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ComponentFlowService.class);

    private static final String INVALID_REQUEST = "INVALID_REQUEST";

    private final SourceParser parser;
    private final ComponentFlowProperties properties;

    /**
     * Creates a new ComponentFlowService.
     *
     * @param theParser the source parser
     * @param theProperties the service defaults
     */
    public ComponentFlowService(final SourceParser theParser,
            final ComponentFlowProperties theProperties) {
        this.parser = Preconditions.requireNonNull(theParser,
                "Source parser is required");
        this.properties = Preconditions.requireNonNull(theProperties,
                "Properties are required");
    }

    /**
     * Builds the flow graphs of the requested entry files.
     *
     * @param request the analysis request
     * @return the graphs, the external dependencies, a summary and every
     *         recorded failure
     * @throws DomainException when the request lacks a project root or
     *         entry files
     * @throws IllegalArgumentException when the configuration is invalid
     */
    public ComponentFlowAnalysis analyze(final AnalyzeRequest request) {
        validate(request);
        final FlowAnalysisConfig config = toConfig(request.config());

        final Path root = Path.of(request.projectRoot())
                .toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            LOG.warn("Project root not found: {}", root);
            return ComponentFlowAnalysis.failed(config,
                    new FlowAnalysisError(ErrorType.FILE_NOT_FOUND,
                            "Project root not found",
                            FileKey.normalize(root)));
        }

        final Path sourceRoot = root.resolve(srcDirectory(
                request.srcDirectory())).normalize();

        LOG.info("Analyzing {} entries under {}", request.entryFiles().size(),
                root);

        final FlowGraphBuilder builder = new FlowGraphBuilder(parser, config,
                ImportClassificationPolicy.forProject(root, sourceRoot),
                registry(root, request.components()));

        final List<EntryFlow> entries = new ArrayList<>();
        final List<FlowAnalysisError> entryErrors = new ArrayList<>();
        final ExternalDependencyCollector collector =
                new ExternalDependencyCollector();

        for (final String entryFile : request.entryFiles()) {
            final Path entry = resolve(root, entryFile);
            final String entryPath = FileKey.normalize(entry);
            FlowNode flow = null;
            try {
                flow = builder.build(entry);
            } catch (final RuntimeException e) {
                LOG.warn("Failed to analyze entry {}", entryPath, e);
                entryErrors.add(new FlowAnalysisError(ErrorType.PARSING_ERROR,
                        "Failed to analyze entry: " + e.getMessage(),
                        entryPath));
            }
            entries.add(new EntryFlow(entryPath, flow));
            collector.collect(entryPath, flow);
            LOG.info("Entry {} done: {}", entryPath,
                    flow == null ? "no component" : flow.name());
        }

        final List<FlowAnalysisError> errors =
                new ArrayList<>(builder.errors());
        errors.addAll(entryErrors);

        final List<ExternalDependency> dependencies = collector.dependencies();
        final FlowSummary summary = summarize(entries, builder, dependencies,
                config);

        LOG.info("Analysis finished: {} components, {} conditional renders,"
                + " {} errors", summary.totalComponents(),
                summary.totalConditionalRenders(), errors.size());

        return new ComponentFlowAnalysis(entries, dependencies, summary,
                errors);
    }

    /**
     * Counts the markup elements the components of one file render.
     *
     * @param request the file and filter
     * @return the statistics
     * @throws DomainException when the request lacks a file
     */
    public MarkupElementStats analyzeMarkupElements(
            final MarkupElementsRequest request) {
        Preconditions.requireDomain(
                request != null && !isBlank(request.filePath()),
                "filePath is required", INVALID_REQUEST);
        final Path root = isBlank(request.projectRoot())
                ? Path.of("").toAbsolutePath()
                : Path.of(request.projectRoot()).toAbsolutePath().normalize();
        final Path file = resolve(root, request.filePath());

        final FlowAnalysisConfig config = FlowAnalysisConfig.builder()
                .includeHtmlElements(true)
                .markupFilter(toFilter(request.htmlElementFilter()))
                .build();

        final FlowGraphBuilder builder = new FlowGraphBuilder(parser, config,
                ImportClassificationPolicy.forProject(root,
                        root.resolve(properties.srcDirectory())),
                ComponentRegistry.empty());
        return builder.analyzeMarkupElements(file);
    }

    private static void validate(final AnalyzeRequest request) {
        Preconditions.requireDomain(
                request != null && !isBlank(request.projectRoot()),
                "projectRoot is required", INVALID_REQUEST);
        Preconditions.requireDomain(request.entryFiles() != null
                && !request.entryFiles().isEmpty(),
                "At least one entry file is required", INVALID_REQUEST);
    }

    private FlowAnalysisConfig toConfig(final ConfigRequest request) {
        final FlowAnalysisConfig.Builder builder = FlowAnalysisConfig.builder()
                .maxDepth(properties.maxDepth())
                .includeExternalComponents(
                        properties.includeExternalComponents())
                .excludePatterns(properties.effectiveExcludePatterns())
                .includeHtmlElements(properties.includeHtmlElements());

        if (request == null) {
            return builder.build();
        }
        if (request.maxDepth() != null) {
            builder.maxDepth(request.maxDepth());
        }
        if (request.includeExternalComponents() != null) {
            builder.includeExternalComponents(
                    request.includeExternalComponents());
        }
        if (request.excludePatterns() != null) {
            builder.excludePatterns(request.excludePatterns());
        }
        if (request.includeHtmlElements() != null) {
            builder.includeHtmlElements(request.includeHtmlElements());
        }
        if (request.htmlElementFilter() != null) {
            builder.markupFilter(toFilter(request.htmlElementFilter()));
        }
        return builder.build();
    }

    private static MarkupElementFilter toFilter(
            final HtmlElementFilterRequest request) {
        final MarkupElementFilter defaults = MarkupElementFilter.defaults();
        if (request == null) {
            return defaults;
        }
        return new MarkupElementFilter(
                request.includeAll() != null
                        ? request.includeAll() : defaults.includeAll(),
                request.includeTags() != null
                        ? Set.copyOf(request.includeTags())
                        : defaults.includeTags(),
                request.excludeTags() != null
                        ? Set.copyOf(request.excludeTags())
                        : defaults.excludeTags(),
                request.captureTextContent() != null
                        ? request.captureTextContent()
                        : defaults.captureTextContent(),
                request.maxTextLength() != null
                        ? request.maxTextLength() : defaults.maxTextLength());
    }

    private String srcDirectory(final String requested) {
        return isBlank(requested) ? properties.srcDirectory() : requested;
    }

    private static ComponentRegistry registry(final Path root,
            final List<ComponentEntry> components) {
        if (components == null || components.isEmpty()) {
            return ComponentRegistry.empty();
        }
        final List<ComponentDefinition> definitions = new ArrayList<>();
        for (final ComponentEntry component : components) {
            if (isBlank(component.name()) || isBlank(component.filePath())) {
                LOG.debug("Skipping incomplete component entry {}", component);
                continue;
            }
            definitions.add(new ComponentDefinition(component.name(),
                    resolve(root, component.filePath())));
        }
        return ComponentRegistry.of(definitions);
    }

    private static Path resolve(final Path root, final String file) {
        final Path path = Path.of(file);
        return (path.isAbsolute() ? path : root.resolve(path))
                .toAbsolutePath().normalize();
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

    // -- Summary -------------------------------------------------------------

    private static FlowSummary summarize(final List<EntryFlow> entries,
            final FlowGraphBuilder builder,
            final List<ExternalDependency> dependencies,
            final FlowAnalysisConfig config) {

        int maxDepth = 0;
        int depthSum = 0;
        int flows = 0;
        for (final EntryFlow entry : entries) {
            if (entry.flow() == null) {
                continue;
            }
            final int depth = treeDepth(entry.flow(), new IdentityHashMap<>(),
                    Collections.newSetFromMap(new IdentityHashMap<>()));
            maxDepth = Math.max(maxDepth, depth);
            depthSum += depth;
            flows++;
        }
        final double averageDepth = flows == 0 ? 0 : (double) depthSum / flows;

        return new FlowSummary(entries.size(),
                builder.analyzedComponents().size(),
                builder.conditionalRenderCount(),
                dependencies.size(),
                maxDepth,
                averageDepth,
                config.includeHtmlElements());
    }

    /**
     * Longest chain of child edges below a node. Heights are memoized per
     * node instance, so a shared node counts its deepest path wherever it
     * is reached.
     */
    private static int treeDepth(final FlowNode node,
            final Map<FlowNode, Integer> heights, final Set<FlowNode> onPath) {
        final Integer known = heights.get(node);
        if (known != null) {
            return known;
        }
        if (!onPath.add(node)) {
            return 0;
        }
        int deepest = 0;
        for (final FlowNode child : node.children()) {
            deepest = Math.max(deepest, 1 + treeDepth(child, heights, onPath));
        }
        onPath.remove(node);
        heights.put(node, deepest);
        return deepest;
    }

    // -- Requests and results ------------------------------------------------

    /**
     * Request to analyze the component flow of a project.
     *
     * @param projectRoot the project root directory
     * @param srcDirectory the source directory relative to the root, the
     *        configured default when null
     * @param entryFiles the entry files, relative to the root or absolute
     * @param components known component definitions, may be null
     * @param config run configuration overrides, may be null
     */
    public record AnalyzeRequest(
            String projectRoot,
            String srcDirectory,
            List<String> entryFiles,
            List<ComponentEntry> components,
            ConfigRequest config) {}

    /**
     * A known component definition.
     *
     * @param name the component name
     * @param filePath the defining file, relative to the root or absolute
     */
    public record ComponentEntry(String name, String filePath) {}

    /**
     * Per-run configuration; null fields keep the service defaults.
     *
     * @param maxDepth the depth bound
     * @param includeExternalComponents whether external leaves are kept
     * @param excludePatterns the exclude globs
     * @param includeHtmlElements whether markup elements are tracked
     * @param htmlElementFilter the markup element filter
     */
    public record ConfigRequest(
            Integer maxDepth,
            Boolean includeExternalComponents,
            List<String> excludePatterns,
            Boolean includeHtmlElements,
            HtmlElementFilterRequest htmlElementFilter) {}

    /**
     * Markup element filter overrides; null fields keep the defaults.
     *
     * @param includeAll accept every tag that is not excluded
     * @param includeTags the tags to accept
     * @param excludeTags the tags never accepted
     * @param captureTextContent whether static text is captured
     * @param maxTextLength the captured text limit
     */
    public record HtmlElementFilterRequest(
            Boolean includeAll,
            List<String> includeTags,
            List<String> excludeTags,
            Boolean captureTextContent,
            Integer maxTextLength) {}

    /**
     * Request for the markup element statistics of one file.
     *
     * @param projectRoot the project root, the working directory when null
     * @param filePath the file, relative to the root or absolute
     * @param htmlElementFilter the filter overrides, may be null
     */
    public record MarkupElementsRequest(
            String projectRoot,
            String filePath,
            HtmlElementFilterRequest htmlElementFilter) {}

    /**
     * The flow graph of one entry file.
     *
     * @param entryFile the normalized entry path
     * @param flow the root node, null when the entry yields no component
     */
    public record EntryFlow(String entryFile, FlowNode flow) {}

    /**
     * Aggregated figures of one analysis.
     *
     * @param totalEntries the number of entry files
     * @param totalComponents the number of files scanned into nodes
     * @param totalConditionalRenders the distinct conditional constructs
     * @param totalExternalDependencies the distinct external packages
     * @param maxDepth the deepest level reached below any entry
     * @param averageDepth the mean of the per-entry deepest levels
     * @param includeHtmlElements whether markup elements were tracked
     */
    public record FlowSummary(
            int totalEntries,
            int totalComponents,
            int totalConditionalRenders,
            int totalExternalDependencies,
            int maxDepth,
            double averageDepth,
            boolean includeHtmlElements) {}

    /**
     * Result of a component-flow analysis.
     *
     * @param entries one flow per entry file, in request order
     * @param externalDependencies the external packages rendered
     * @param summary the aggregated figures
     * @param errors every failure recorded during the run
     */
    public record ComponentFlowAnalysis(
            List<EntryFlow> entries,
            List<ExternalDependency> externalDependencies,
            FlowSummary summary,
            List<FlowAnalysisError> errors) {

        static ComponentFlowAnalysis failed(final FlowAnalysisConfig config,
                final FlowAnalysisError error) {
            return new ComponentFlowAnalysis(List.of(), List.of(),
                    new FlowSummary(0, 0, 0, 0, 0, 0,
                            config.includeHtmlElements()),
                    List.of(error));
        }
    }
}
