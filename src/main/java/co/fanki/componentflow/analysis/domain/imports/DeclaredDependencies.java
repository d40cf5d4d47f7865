package co.fanki.componentflow.analysis.domain.imports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The package names a project declares in its {@code package.json}.
 *
 * <p>Reads {@code dependencies}, {@code devDependencies} and
 * {@code peerDependencies}, and always adds the framework packages a
 * React project implies. A missing or unreadable manifest is logged and
 * leaves only those framework packages.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DeclaredDependencies {

    private static final Logger LOG = LoggerFactory.getLogger(
            DeclaredDependencies.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final List<String> SECTIONS = List.of(
            "dependencies", "devDependencies", "peerDependencies");

    private static final List<String> IMPLICIT = List.of(
            "react", "react-dom", "next", "@types/react",
            "@types/react-dom", "@types/node", "typescript");

    private final Set<String> packages;

    private DeclaredDependencies(final Set<String> thePackages) {
        this.packages = Collections.unmodifiableSet(thePackages);
    }

    /**
     * Loads the declared dependencies of a project.
     *
     * @param projectRoot the directory holding {@code package.json}
     * @return the declared dependencies, never null
     */
    public static DeclaredDependencies load(final Path projectRoot) {
        final Set<String> packages = new LinkedHashSet<>(IMPLICIT);
        if (projectRoot == null) {
            return new DeclaredDependencies(packages);
        }

        final Path manifest = projectRoot.resolve("package.json");
        if (!Files.isRegularFile(manifest)) {
            LOG.debug("No package.json in {}, using framework packages only",
                    projectRoot);
            return new DeclaredDependencies(packages);
        }

        try {
            final JsonNode root = MAPPER.readTree(manifest.toFile());
            for (final String section : SECTIONS) {
                final JsonNode entries = root.path(section);
                final Iterator<String> names = entries.fieldNames();
                while (names.hasNext()) {
                    packages.add(names.next());
                }
            }
            LOG.debug("Loaded {} declared packages from {}",
                    packages.size(), manifest);
        } catch (final IOException e) {
            LOG.warn("Could not read {}, classifying imports heuristically",
                    manifest, e);
        }
        return new DeclaredDependencies(packages);
    }

    /**
     * Creates an instance from explicit package names, plus the implicit
     * framework packages.
     *
     * @param names the declared package names
     * @return the declared dependencies
     */
    public static DeclaredDependencies of(final String... names) {
        final Set<String> packages = new LinkedHashSet<>(IMPLICIT);
        packages.addAll(List.of(names));
        return new DeclaredDependencies(packages);
    }

    /**
     * Checks whether a package is declared.
     *
     * @param packageName the package name, such as {@code @mui/material}
     * @return true when declared
     */
    public boolean contains(final String packageName) {
        return packageName != null && packages.contains(packageName);
    }

    /**
     * Returns the declared package names.
     *
     * @return the package names, framework packages first, unmodifiable
     */
    public Set<String> packages() {
        return packages;
    }
}
