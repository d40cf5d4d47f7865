package co.fanki.componentflow.analysis.domain;

import co.fanki.componentflow.analysis.domain.conditional.MarkupElementFilter;
import co.fanki.componentflow.shared.Preconditions;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * The settings of one analysis run.
 *
 * <p>Validated on {@link Builder#build()}, so an invalid configuration
 * fails before any file is scanned.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowAnalysisConfig {

    /** Default depth bound. */
    public static final int DEFAULT_MAX_DEPTH = 10;

    /** Default exclusions. */
    public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
            "**/node_modules/**", "**/.next/**", "**/dist/**");

    private final int maxDepth;
    private final boolean includeExternalComponents;
    private final List<String> excludePatterns;
    private final List<PathMatcher> compiledExcludes;
    private final boolean includeHtmlElements;
    private final MarkupElementFilter markupFilter;

    private FlowAnalysisConfig(final Builder builder) {
        this.maxDepth = builder.maxDepth;
        this.includeExternalComponents = builder.includeExternalComponents;
        this.excludePatterns = List.copyOf(builder.excludePatterns);
        this.includeHtmlElements = builder.includeHtmlElements;
        this.markupFilter = builder.markupFilter;

        final List<PathMatcher> compiled = new ArrayList<>();
        for (final String glob : excludePatterns) {
            compiled.add(FileSystems.getDefault().getPathMatcher(
                    "glob:" + glob));
        }
        this.compiledExcludes = List.copyOf(compiled);
    }

    /**
     * Returns the default configuration.
     *
     * @return the defaults
     */
    public static FlowAnalysisConfig defaults() {
        return builder().build();
    }

    /**
     * Starts a builder holding the defaults.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public int maxDepth() {
        return maxDepth;
    }

    public boolean includeExternalComponents() {
        return includeExternalComponents;
    }

    public List<String> excludePatterns() {
        return excludePatterns;
    }

    public boolean includeHtmlElements() {
        return includeHtmlElements;
    }

    public MarkupElementFilter markupFilter() {
        return markupFilter;
    }

    /**
     * Checks a file against the exclude globs. Globs follow
     * {@link java.nio.file.FileSystem#getPathMatcher(String)}: {@code **}
     * crosses directories, and {@code {a,b}} and {@code [abc]} are
     * supported.
     *
     * @param file the file to check
     * @return true when some glob matches its absolute, normalized path
     */
    public boolean isExcluded(final Path file) {
        final Path path = file.toAbsolutePath().normalize();
        for (final PathMatcher matcher : compiledExcludes) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    /** Builder of {@link FlowAnalysisConfig}. */
    public static final class Builder {

        private int maxDepth = DEFAULT_MAX_DEPTH;
        private boolean includeExternalComponents = true;
        private List<String> excludePatterns =
                new ArrayList<>(DEFAULT_EXCLUDE_PATTERNS);
        private boolean includeHtmlElements;
        private MarkupElementFilter markupFilter =
                MarkupElementFilter.defaults();

        private Builder() {
        }

        /**
         * Sets how deep the graph is expanded; must be at least 1.
         *
         * @param theMaxDepth the depth bound
         * @return this builder
         */
        public Builder maxDepth(final int theMaxDepth) {
            this.maxDepth = theMaxDepth;
            return this;
        }

        public Builder includeExternalComponents(final boolean include) {
            this.includeExternalComponents = include;
            return this;
        }

        /**
         * Replaces the exclude globs.
         *
         * @param patterns the globs, null for none
         * @return this builder
         */
        public Builder excludePatterns(final List<String> patterns) {
            this.excludePatterns = patterns == null
                    ? new ArrayList<>() : new ArrayList<>(patterns);
            return this;
        }

        public Builder includeHtmlElements(final boolean include) {
            this.includeHtmlElements = include;
            return this;
        }

        public Builder markupFilter(final MarkupElementFilter filter) {
            this.markupFilter = filter;
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @return the configuration
         * @throws IllegalArgumentException when a setting is invalid
         */
        public FlowAnalysisConfig build() {
            Preconditions.require(maxDepth >= 1,
                    "maxDepth must be >= 1 but was " + maxDepth);
            Preconditions.requireNonNull(markupFilter,
                    "Markup filter is required");
            for (final String pattern : excludePatterns) {
                Preconditions.requireNonBlank(pattern,
                        "Exclude patterns must not be blank");
            }
            return new FlowAnalysisConfig(this);
        }
    }
}
