package co.fanki.componentflow.analysis.domain;

import co.fanki.componentflow.analysis.domain.ast.SourceParser;
import co.fanki.componentflow.analysis.domain.ast.SyntaxNode;
import co.fanki.componentflow.analysis.domain.conditional.CasePattern;
import co.fanki.componentflow.analysis.domain.conditional.ComponentReference;
import co.fanki.componentflow.analysis.domain.conditional.ConditionalPattern;
import co.fanki.componentflow.analysis.domain.conditional.ConditionalPatternClassifier;
import co.fanki.componentflow.analysis.domain.conditional.ExtractedReferences;
import co.fanki.componentflow.analysis.domain.conditional.MarkupElementReference;
import co.fanki.componentflow.analysis.domain.conditional.ReferenceExpander;
import co.fanki.componentflow.analysis.domain.imports.ImportClassificationPolicy;
import co.fanki.componentflow.analysis.domain.imports.ImportExtractor;
import co.fanki.componentflow.analysis.domain.resolution.ComponentDefinition;
import co.fanki.componentflow.analysis.domain.resolution.ComponentRegistry;
import co.fanki.componentflow.analysis.domain.resolution.ReferenceResolver;
import co.fanki.componentflow.analysis.domain.resolution.Resolution;
import co.fanki.componentflow.analysis.domain.returns.ComponentDefinitionFinder;
import co.fanki.componentflow.analysis.domain.returns.ComponentFunction;
import co.fanki.componentflow.analysis.domain.returns.FileComponents;
import co.fanki.componentflow.analysis.domain.returns.ReturnPoint;
import co.fanki.componentflow.analysis.domain.returns.ReturnPointAnalyzer;
import co.fanki.componentflow.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the flow graph reachable from a component file.
 *
 * <p>Each file goes from not started to in progress to done. A file that
 * is done returns its memoized node unchanged. A file that is in progress
 * (a cycle) or beyond {@code maxDepth} yields null without recursing.
 * References are resolved through the {@link ReferenceResolver}; internal
 * ones are scanned one level deeper, or become a leaf once the next level
 * would reach {@code maxDepth}, so the edge stays visible.</p>
 *
 * <p>Every conditional construct is materialized once per run, keyed by
 * file, condition text and position. Per-file failures are recorded as
 * {@link FlowAnalysisError}s and the file contributes no node; they never
 * propagate.</p>
 *
 * <p>Not thread-safe: an instance owns its caches and is meant for one
 * sequential run. Call {@link #reset()} to start over.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FlowGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowGraphBuilder.class);

    private final SourceParser parser;
    private final FlowAnalysisConfig config;
    private final ComponentRegistry registry;
    private final ReferenceResolver resolver;

    private final ImportExtractor importExtractor = new ImportExtractor();
    private final ComponentDefinitionFinder finder =
            new ComponentDefinitionFinder();
    private final ReferenceExpander expander;
    private final ReturnPointAnalyzer returnPointAnalyzer;

    private final Map<FileKey, FlowNode> memo = new LinkedHashMap<>();
    private final Set<FileKey> inProgress = new HashSet<>();
    private final Set<String> emittedConditionals = new HashSet<>();
    private final List<FlowAnalysisError> errors = new ArrayList<>();

    /**
     * Creates a new builder.
     *
     * @param theParser the source parser, never null
     * @param theConfig the run configuration, never null
     * @param thePolicy the import classification policy, never null
     * @param theRegistry the component registry, never null
     */
    public FlowGraphBuilder(final SourceParser theParser,
            final FlowAnalysisConfig theConfig,
            final ImportClassificationPolicy thePolicy,
            final ComponentRegistry theRegistry) {
        this.parser = Preconditions.requireNonNull(theParser,
                "Source parser is required");
        this.config = Preconditions.requireNonNull(theConfig,
                "Configuration is required");
        this.registry = Preconditions.requireNonNull(theRegistry,
                "Component registry is required");
        this.resolver = new ReferenceResolver(
                Preconditions.requireNonNull(thePolicy,
                        "Classification policy is required"),
                theRegistry, theConfig.includeExternalComponents());
        this.expander = new ReferenceExpander(
                theConfig.includeHtmlElements(), theConfig.markupFilter());
        this.returnPointAnalyzer = new ReturnPointAnalyzer(
                new ConditionalPatternClassifier(expander), expander);
    }

    /**
     * Builds the flow graph of an entry file.
     *
     * @param file the entry file
     * @return the root node, or null when the file yields no component
     */
    public FlowNode build(final Path file) {
        Preconditions.requireNonNull(file, "File is required");
        return buildFile(file.toAbsolutePath().normalize(), 0);
    }

    /**
     * Returns the failures recorded since construction or the last reset.
     *
     * @return the errors in the order they happened
     */
    public List<FlowAnalysisError> errors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Returns every component scanned so far.
     *
     * @return the memoized nodes in scan completion order
     */
    public List<FlowNode> analyzedComponents() {
        return List.copyOf(memo.values());
    }

    /**
     * Returns how many conditional renders were materialized.
     *
     * @return the number of distinct conditional constructs
     */
    public int conditionalRenderCount() {
        return emittedConditionals.size();
    }

    /**
     * Returns the configuration this builder runs with.
     *
     * @return the run configuration, never null
     */
    public FlowAnalysisConfig config() {
        return config;
    }

    /**
     * Clears every cache: memoized nodes, cycle guard, conditional
     * identities, resolution outcomes and recorded errors.
     */
    public void reset() {
        memo.clear();
        inProgress.clear();
        emittedConditionals.clear();
        errors.clear();
        resolver.reset();
    }

    /**
     * Counts the markup elements the components of a file render, whether
     * or not markup tracking is enabled for graph building.
     *
     * @param file the file to inspect
     * @return the statistics; empty when the file cannot be parsed
     */
    public MarkupElementStats analyzeMarkupElements(final Path file) {
        Preconditions.requireNonNull(file, "File is required");
        final Path normalized = file.toAbsolutePath().normalize();
        final String filePath = FileKey.normalize(normalized);

        final ParsedFile parsed = parse(normalized);
        if (parsed == null) {
            return new MarkupElementStats(filePath, 0, Map.of(), 0);
        }

        final ReferenceExpander markupExpander =
                new ReferenceExpander(true, config.markupFilter());
        final ReturnPointAnalyzer analyzer = new ReturnPointAnalyzer(
                new ConditionalPatternClassifier(markupExpander),
                markupExpander);

        final Map<String, Integer> byTag = new TreeMap<>();
        int total = 0;
        int withText = 0;
        for (final ComponentFunction component
                : parsed.components.components()) {
            for (final ReturnPoint point
                    : analyzer.analyze(component, parsed.source)) {
                for (final MarkupElementReference element
                        : point.directMarkupReferences()) {
                    total++;
                    byTag.merge(element.tagName(), 1, Integer::sum);
                    if (element.textContent() != null) {
                        withText++;
                    }
                }
            }
        }
        return new MarkupElementStats(filePath, total, byTag, withText);
    }

    /**
     * Builds the node of one file at the given depth.
     *
     * @param file the absolute, normalized file
     * @param depth the depth of the file in the current walk
     * @return the node, or null for cycles, the depth bound, excluded
     *         files and failures
     */
    FlowNode buildFile(final Path file, final int depth) {
        final FileKey key = FileKey.of(file);

        final FlowNode memoized = memo.get(key);
        if (memoized != null) {
            LOG.debug("Memo hit for {}", key);
            return memoized;
        }
        if (depth >= config.maxDepth() || inProgress.contains(key)) {
            return null;
        }
        if (config.isExcluded(file)) {
            LOG.debug("Skipping excluded file {}", key);
            return null;
        }

        inProgress.add(key);
        try {
            final FlowNode node = scan(file, key, depth);
            if (node != null) {
                memo.put(key, node);
            }
            return node;
        } catch (final RuntimeException e) {
            LOG.warn("Failed to analyze {}", key, e);
            errors.add(new FlowAnalysisError(ErrorType.PARSING_ERROR,
                    "Failed to analyze component: " + e.getMessage(),
                    key.value()));
            return null;
        } finally {
            inProgress.remove(key);
        }
    }

    private FlowNode scan(final Path file, final FileKey key,
            final int depth) {

        final ParsedFile parsed = parse(file);
        if (parsed == null) {
            return null;
        }
        if (parsed.components.isEmpty()) {
            errors.add(new FlowAnalysisError(ErrorType.INVALID_JSX,
                    "No component rendering markup found", key.value()));
            return null;
        }

        final String name = componentName(parsed.components, file);

        final List<ReturnPoint> points = new ArrayList<>();
        for (final ComponentFunction component
                : parsed.components.components()) {
            points.addAll(returnPointAnalyzer.analyze(component,
                    parsed.source));
        }

        final List<ConditionalRender> renders = new ArrayList<>();
        final Set<ConditionalPattern> seen =
                Collections.newSetFromMap(new IdentityHashMap<>());
        final Set<String> identities = new HashSet<>();
        final Map<String, FlowNode> children = new LinkedHashMap<>();
        final List<MarkupElementReference> markup = new ArrayList<>();

        for (final ReturnPoint point : points) {
            for (final ConditionalPattern pattern : point.patterns()) {
                if (!seen.add(pattern)) {
                    continue;
                }
                final String identity = ConditionalRender.identity(
                        key.value(), pattern.conditionText(),
                        pattern.position());
                if (emittedConditionals.contains(identity)
                        || !identities.add(identity)) {
                    continue;
                }
                renders.add(toRender(pattern, file, key, depth));
            }
            for (final FlowNode child : resolveAll(
                    point.directReferences(), file, depth)) {
                children.putIfAbsent(child.identity(), child);
            }
            markup.addAll(point.directMarkupReferences());
        }

        // Only a completed scan consumes its conditional identities.
        emittedConditionals.addAll(identities);

        LOG.debug("Scanned {} as {}: {} children, {} conditionals",
                key, name, children.size(), renders.size());

        return new FlowNode(name, key.value(), false, null, renders,
                new ArrayList<>(children.values()), markup);
    }

    private ParsedFile parse(final Path file) {
        final String filePath = FileKey.normalize(file);
        final String source;
        try {
            source = Files.readString(file);
        } catch (final NoSuchFileException e) {
            errors.add(new FlowAnalysisError(ErrorType.FILE_NOT_FOUND,
                    "File not found", filePath));
            return null;
        } catch (final IOException e) {
            LOG.warn("Could not read {}", filePath, e);
            errors.add(new FlowAnalysisError(ErrorType.FILE_NOT_FOUND,
                    "Could not read file: " + e.getMessage(), filePath));
            return null;
        }

        final SyntaxNode program = parser.parse(source,
                file.getFileName().toString());
        if (program == null) {
            LOG.warn("Could not parse {}", filePath);
            errors.add(new FlowAnalysisError(ErrorType.PARSING_ERROR,
                    "Source could not be parsed", filePath));
            return null;
        }

        resolver.registerImports(file, importExtractor.extract(program));
        return new ParsedFile(source, finder.find(program));
    }

    private String componentName(final FileComponents components,
            final Path file) {
        final String primary = components.primaryName();
        if (primary != null) {
            return primary;
        }
        final ComponentDefinition definition = registry.findByPath(file);
        if (definition != null) {
            return definition.name();
        }
        return ComponentRegistry.baseName(file);
    }

    private ConditionalRender toRender(final ConditionalPattern pattern,
            final Path file, final FileKey key, final int depth) {

        final List<FlowNode> truePath = resolveAll(
                pattern.trueBranch().components(), file, depth);
        final List<FlowNode> falsePath = pattern.hasFalseBranch()
                ? resolveAll(pattern.falseBranch().components(), file, depth)
                : null;

        final List<CaseRender> cases = new ArrayList<>();
        for (final CasePattern casePattern : pattern.cases()) {
            cases.add(new CaseRender(casePattern.label(), resolveAll(
                    casePattern.references().components(), file, depth)));
        }

        final ExtractedReferences falseBranch = pattern.falseBranch();
        return new ConditionalRender(
                pattern.kind(),
                pattern.conditionText(),
                truePath,
                falsePath,
                cases,
                pattern.trueBranch().markupElements(),
                falseBranch == null ? null : falseBranch.markupElements(),
                key.value(),
                pattern.position());
    }

    /**
     * Resolves references to nodes, de-duplicated by edge identity.
     */
    private List<FlowNode> resolveAll(
            final List<ComponentReference> references, final Path file,
            final int depth) {
        final Map<String, FlowNode> nodes = new LinkedHashMap<>();
        for (final ComponentReference reference : references) {
            final FlowNode node = resolveChild(reference, file, depth);
            if (node != null) {
                nodes.putIfAbsent(node.identity(), node);
            }
        }
        return new ArrayList<>(nodes.values());
    }

    private FlowNode resolveChild(final ComponentReference reference,
            final Path file, final int depth) {

        final Resolution resolution;
        try {
            resolution = resolver.resolve(reference.name(), file);
        } catch (final RuntimeException e) {
            LOG.warn("Failed to resolve {} in {}", reference.name(), file, e);
            errors.add(new FlowAnalysisError(ErrorType.RESOLUTION_ERROR,
                    "Failed to resolve " + reference.name() + ": "
                            + e.getMessage(),
                    FileKey.normalize(file)));
            return null;
        }

        if (resolution == null) {
            return null;
        }
        if (resolution.isExternal()) {
            return resolution.externalLeaf();
        }

        final Path target = resolution.internalPath();
        final int childDepth = depth + 1;
        if (childDepth >= config.maxDepth()) {
            return FlowNode.leaf(reference.name(), FileKey.normalize(target));
        }

        final FlowNode child = buildFile(target, childDepth);
        return child == null ? null : child.withName(reference.name());
    }

    /** Source text and components of a parsed file. */
    private record ParsedFile(String source, FileComponents components) {
    }
}
