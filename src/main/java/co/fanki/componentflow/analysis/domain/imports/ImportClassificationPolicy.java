package co.fanki.componentflow.analysis.domain.imports;

import co.fanki.componentflow.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether an import path points at project code or at a
 * dependency.
 *
 * <p>First match wins:</p>
 * <ol>
 *   <li>relative path ({@code ./}, {@code ../}): internal</li>
 *   <li>alias path ({@code @/}, {@code ~/}): internal</li>
 *   <li>framework runtime module ({@code react}, {@code next/link}, ...):
 *       external</li>
 *   <li>package name without an internal directory shape, declared in
 *       {@code package.json}: external</li>
 *   <li>resolvable on disk: external inside {@code node_modules},
 *       internal inside the project</li>
 *   <li>unresolved but starting with a conventional source directory
 *       ({@code components/}, {@code lib/}, ...): internal</li>
 *   <li>anything else: external</li>
 * </ol>
 *
 * <p>Also holds the allow-lists of native markup tags and framework
 * intrinsic components, which never resolve to a file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ImportClassificationPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(
            ImportClassificationPolicy.class);

    private static final Set<String> FRAMEWORK_MODULES = Set.of(
            "react", "react-dom", "react/jsx-runtime",
            "react/jsx-dev-runtime", "react-dom/client", "react-dom/server",
            "next/link", "next/image", "next/head", "next/script",
            "next/router", "next/navigation", "next/app", "next/document",
            "next/error", "next/font", "next/headers", "next/cookies",
            "next/cache", "next/server");

    private static final Pattern INTERNAL_DIRECTORY = Pattern.compile(
            "^(components|src|app|lib|utils|hooks|pages|styles|types"
                    + "|constants)/");

    private static final Set<String> NATIVE_TAGS = Set.of(
            "div", "span", "p", "h1", "h2", "h3", "h4", "h5", "h6", "a",
            "img", "button", "input", "form", "label", "select", "option",
            "textarea", "table", "thead", "tbody", "tr", "td", "th", "ul",
            "ol", "li", "nav", "header", "footer", "main", "section",
            "article", "aside", "figure", "figcaption", "video", "audio",
            "canvas", "svg", "path", "circle", "rect", "line", "polygon",
            "iframe", "embed", "object", "pre", "code", "blockquote", "hr",
            "br", "strong", "em", "small", "mark", "del", "ins", "sub",
            "sup");

    private static final Set<String> INTRINSICS = Set.of(
            "Fragment", "Suspense", "StrictMode", "Profiler",
            "React.Fragment", "React.Suspense", "React.StrictMode",
            "React.Profiler", "Transition", "SuspenseList",
            "ConcurrentMode", "unstable_ConcurrentMode");

    private final DeclaredDependencies dependencies;
    private final ModulePathResolver pathResolver;

    /**
     * Creates a new policy.
     *
     * @param theDependencies the project's declared packages, never null
     * @param thePathResolver the resolver for on-disk lookups, never null
     */
    public ImportClassificationPolicy(
            final DeclaredDependencies theDependencies,
            final ModulePathResolver thePathResolver) {
        this.dependencies = Preconditions.requireNonNull(theDependencies,
                "Declared dependencies are required");
        this.pathResolver = Preconditions.requireNonNull(thePathResolver,
                "Path resolver is required");
    }

    /**
     * Creates a policy for a project, reading its {@code package.json}.
     *
     * @param projectRoot the project root, never null
     * @param sourceRoot the source directory, never null
     * @return the policy
     */
    public static ImportClassificationPolicy forProject(
            final Path projectRoot, final Path sourceRoot) {
        return new ImportClassificationPolicy(
                DeclaredDependencies.load(projectRoot),
                new ModulePathResolver(projectRoot, sourceRoot));
    }

    /**
     * Classifies one import path used in one file.
     *
     * @param modulePath the specifier as written
     * @param fromFile the importing file
     * @return the import kind, never null
     */
    public ImportKind classify(final String modulePath, final Path fromFile) {
        Preconditions.requireNonBlank(modulePath, "Module path is required");

        if (isRelative(modulePath) || isAlias(modulePath)) {
            return ImportKind.INTERNAL;
        }
        if (FRAMEWORK_MODULES.contains(modulePath)) {
            return ImportKind.EXTERNAL;
        }

        final boolean internalShape =
                INTERNAL_DIRECTORY.matcher(modulePath).find();
        if (!internalShape && dependencies.contains(packageName(modulePath))) {
            return ImportKind.EXTERNAL;
        }

        final Path resolved = pathResolver.resolveBare(modulePath);
        if (resolved != null) {
            if (ModulePathResolver.isInNodeModules(resolved)) {
                return ImportKind.EXTERNAL;
            }
            if (pathResolver.isProjectSource(resolved)) {
                return ImportKind.INTERNAL;
            }
        }

        if (internalShape) {
            return ImportKind.INTERNAL;
        }

        LOG.debug("Unknown import {} in {}, assuming external",
                modulePath, fromFile);
        return ImportKind.EXTERNAL;
    }

    /**
     * Returns the resolver used to find internal modules on disk.
     *
     * @return the module path resolver, never null
     */
    public ModulePathResolver pathResolver() {
        return pathResolver;
    }

    /**
     * Checks for a {@code ./} or {@code ../} specifier.
     *
     * @param modulePath the specifier
     * @return true when relative
     */
    public static boolean isRelative(final String modulePath) {
        return modulePath != null
                && (modulePath.startsWith("./") || modulePath.startsWith("../")
                        || ".".equals(modulePath) || "..".equals(modulePath));
    }

    /**
     * Checks for an {@code @/} or {@code ~/} specifier.
     *
     * @param modulePath the specifier
     * @return true when aliased
     */
    public static boolean isAlias(final String modulePath) {
        return modulePath != null
                && (modulePath.startsWith("@/") || modulePath.startsWith("~/"));
    }

    /**
     * Returns the package a specifier belongs to: the first segment, or
     * the first two for scoped packages ({@code @mui/material/Button}
     * gives {@code @mui/material}).
     *
     * @param modulePath the specifier
     * @return the package name
     */
    public static String packageName(final String modulePath) {
        Preconditions.requireNonBlank(modulePath, "Module path is required");
        final String[] segments = modulePath.split("/");
        if (modulePath.startsWith("@") && segments.length > 1) {
            return segments[0] + "/" + segments[1];
        }
        return segments[0];
    }

    /**
     * Checks whether a name is a native markup tag. Case-sensitive:
     * {@code button} is native, {@code Button} is a component.
     *
     * @param name the reference name
     * @return true for native tags
     */
    public static boolean isNativeTag(final String name) {
        return name != null && NATIVE_TAGS.contains(name);
    }

    /**
     * Checks whether a name is a framework intrinsic such as
     * {@code Suspense} or {@code React.Fragment}.
     *
     * @param name the reference name
     * @return true for intrinsics
     */
    public static boolean isIntrinsic(final String name) {
        return name != null && INTRINSICS.contains(name);
    }
}
