package co.fanki.componentflow.analysis.domain.imports;

import co.fanki.componentflow.shared.Preconditions;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves module specifiers to source files on disk.
 *
 * <p>A specifier is tried as written, then with the extensions
 * {@code .tsx .ts .jsx .js}, then as a directory with an
 * {@code index} file in the same extension order. Alias ({@code @/},
 * {@code ~/}) and bare specifiers are tried against the source root,
 * {@code <project>/src} and the project root, in that order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ModulePathResolver {

    private static final List<String> EXTENSIONS = List.of(
            ".tsx", ".ts", ".jsx", ".js");

    private final Path projectRoot;
    private final Path sourceRoot;

    /**
     * Creates a new resolver.
     *
     * @param theProjectRoot the project root, never null
     * @param theSourceRoot the source directory, never null
     */
    public ModulePathResolver(final Path theProjectRoot,
            final Path theSourceRoot) {
        this.projectRoot = Preconditions.requireNonNull(theProjectRoot,
                "Project root is required").toAbsolutePath().normalize();
        this.sourceRoot = Preconditions.requireNonNull(theSourceRoot,
                "Source root is required").toAbsolutePath().normalize();
    }

    /**
     * Resolves a specifier used in a file.
     *
     * @param modulePath the specifier as written
     * @param fromFile the importing file
     * @return the resolved file, or null
     */
    public Path resolve(final String modulePath, final Path fromFile) {
        if (ImportClassificationPolicy.isRelative(modulePath)) {
            return resolveRelative(modulePath, fromFile);
        }
        if (ImportClassificationPolicy.isAlias(modulePath)) {
            return resolveAlias(modulePath);
        }
        return resolveBare(modulePath);
    }

    /**
     * Resolves a {@code ./} or {@code ../} specifier.
     *
     * @param modulePath the relative specifier
     * @param fromFile the importing file
     * @return the resolved file, or null
     */
    public Path resolveRelative(final String modulePath, final Path fromFile) {
        if (fromFile == null) {
            return null;
        }
        final Path directory = fromFile.toAbsolutePath().getParent();
        if (directory == null) {
            return null;
        }
        return resolveFile(directory.resolve(modulePath).normalize());
    }

    /**
     * Resolves an {@code @/} or {@code ~/} specifier.
     *
     * @param modulePath the alias specifier
     * @return the resolved file, or null
     */
    public Path resolveAlias(final String modulePath) {
        return resolveBare(modulePath.substring(2));
    }

    /**
     * Resolves a specifier against the base directories.
     *
     * @param modulePath the specifier, without alias prefix
     * @return the resolved file, or null
     */
    public Path resolveBare(final String modulePath) {
        if (modulePath == null || modulePath.isBlank()) {
            return null;
        }
        for (final Path base : baseDirectories()) {
            final Path resolved = resolveFile(base.resolve(modulePath)
                    .normalize());
            if (resolved != null) {
                return resolved;
            }
        }
        return null;
    }

    /**
     * Checks whether a file lies under the source root or the project
     * root, outside {@code node_modules}.
     *
     * @param file the file to check
     * @return true for project source files
     */
    public boolean isProjectSource(final Path file) {
        final Path normalized = file.toAbsolutePath().normalize();
        if (isInNodeModules(normalized)) {
            return false;
        }
        return normalized.startsWith(sourceRoot)
                || normalized.startsWith(projectRoot);
    }

    /**
     * Checks whether a path goes through a {@code node_modules}
     * directory.
     *
     * @param file the path to check
     * @return true when inside node_modules
     */
    public static boolean isInNodeModules(final Path file) {
        for (final Path segment : file) {
            if ("node_modules".equals(segment.toString())) {
                return true;
            }
        }
        return false;
    }

    private List<Path> baseDirectories() {
        final List<Path> bases = new ArrayList<>();
        bases.add(sourceRoot);
        final Path conventionalSource = projectRoot.resolve("src");
        if (!bases.contains(conventionalSource)) {
            bases.add(conventionalSource);
        }
        if (!bases.contains(projectRoot)) {
            bases.add(projectRoot);
        }
        return bases;
    }

    private static Path resolveFile(final Path base) {
        if (hasSourceExtension(base) && Files.isRegularFile(base)) {
            return base;
        }
        for (final String extension : EXTENSIONS) {
            final Path candidate = base.resolveSibling(
                    base.getFileName() + extension);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        if (Files.isDirectory(base)) {
            for (final String extension : EXTENSIONS) {
                final Path candidate = base.resolve("index" + extension);
                if (Files.isRegularFile(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private static boolean hasSourceExtension(final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        final String name = fileName.toString();
        for (final String extension : EXTENSIONS) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
