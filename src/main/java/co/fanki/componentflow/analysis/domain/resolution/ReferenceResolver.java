package co.fanki.componentflow.analysis.domain.resolution;

import co.fanki.componentflow.analysis.domain.FileKey;
import co.fanki.componentflow.analysis.domain.imports.ImportClassificationPolicy;
import co.fanki.componentflow.analysis.domain.imports.ImportKind;
import co.fanki.componentflow.analysis.domain.imports.ImportRecord;
import co.fanki.componentflow.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a component name, as used in one file, to an external leaf or
 * to the internal file that defines it.
 *
 * <p>Steps: native tags and framework intrinsics are rejected; the file's
 * imports are searched for the name; a matching import is classified by
 * the {@link ImportClassificationPolicy}; external imports give a leaf
 * (unless external components are disabled), internal ones are resolved
 * on disk, falling back to the {@link ComponentRegistry} and then to an
 * external leaf when neither knows the file. A name with no import goes
 * straight to the registry.</p>
 *
 * <p>Outcomes, including misses, are cached per file and name for the
 * lifetime of the instance or until {@link #reset()}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReferenceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReferenceResolver.class);

    private final ImportClassificationPolicy policy;
    private final ComponentRegistry registry;
    private final boolean includeExternalComponents;

    private final Map<String, Resolution> cache = new HashMap<>();
    private final Map<FileKey, List<ImportRecord>> imports = new HashMap<>();

    /**
     * Creates a new resolver.
     *
     * @param thePolicy the import classification policy, never null
     * @param theRegistry the component registry, never null
     * @param theIncludeExternalComponents whether external components are
     *        kept as leaves or dropped
     */
    public ReferenceResolver(final ImportClassificationPolicy thePolicy,
            final ComponentRegistry theRegistry,
            final boolean theIncludeExternalComponents) {
        this.policy = Preconditions.requireNonNull(thePolicy,
                "Classification policy is required");
        this.registry = Preconditions.requireNonNull(theRegistry,
                "Component registry is required");
        this.includeExternalComponents = theIncludeExternalComponents;
    }

    /**
     * Records the imports of a file, read once when the file is parsed.
     *
     * @param file the importing file
     * @param records its import records
     */
    public void registerImports(final Path file,
            final List<ImportRecord> records) {
        imports.put(FileKey.of(file), List.copyOf(records));
    }

    /**
     * Returns the recorded imports of a file.
     *
     * @param file the file
     * @return the import records, empty when none were recorded
     */
    public List<ImportRecord> importsOf(final Path file) {
        return imports.getOrDefault(FileKey.of(file), List.of());
    }

    /**
     * Resolves one reference.
     *
     * @param name the referenced name
     * @param fromFile the file the reference appears in
     * @return the resolution, or null when the reference cannot be
     *         resolved and must be dropped
     */
    public Resolution resolve(final String name, final Path fromFile) {
        Preconditions.requireNonBlank(name, "Reference name is required");
        Preconditions.requireNonNull(fromFile, "File is required");

        final String key = FileKey.of(fromFile).value() + "::" + name;
        if (cache.containsKey(key)) {
            return cache.get(key);
        }

        final Resolution resolution = doResolve(name, fromFile);
        cache.put(key, resolution);

        if (resolution == null) {
            LOG.debug("Unresolved reference {} in {}", name, fromFile);
        }
        return resolution;
    }

    /**
     * Clears the resolution cache and recorded imports.
     */
    public void reset() {
        cache.clear();
        imports.clear();
    }

    /**
     * Returns how many outcomes are cached, misses included.
     *
     * @return the cache size
     */
    public int cachedResolutions() {
        return cache.size();
    }

    private Resolution doResolve(final String name, final Path fromFile) {
        if (ImportClassificationPolicy.isNativeTag(name)
                || ImportClassificationPolicy.isIntrinsic(name)) {
            return null;
        }

        final ImportRecord match = findImport(name, fromFile);
        if (match == null) {
            return fromRegistry(name);
        }

        final ImportKind kind = policy.classify(match.modulePath(), fromFile);
        if (kind == ImportKind.EXTERNAL) {
            return includeExternalComponents
                    ? Resolution.external(name, match.modulePath())
                    : null;
        }

        final Path file = policy.pathResolver()
                .resolve(match.modulePath(), fromFile);
        if (file != null) {
            return Resolution.internal(file);
        }
        final Resolution registered = fromRegistry(name);
        if (registered != null) {
            return registered;
        }
        // Imported but nowhere on disk: keep the edge as an opaque leaf.
        return includeExternalComponents
                ? Resolution.external(name, match.modulePath())
                : null;
    }

    private ImportRecord findImport(final String name, final Path fromFile) {
        for (final ImportRecord record : importsOf(fromFile)) {
            if (record.provides(name)) {
                return record;
            }
        }
        return null;
    }

    private Resolution fromRegistry(final String name) {
        final ComponentDefinition definition = registry.findByName(name);
        return definition == null
                ? null : Resolution.internal(definition.filePath());
    }
}
