package co.fanki.componentflow.analysis.domain.resolution;

import co.fanki.componentflow.analysis.domain.FileKey;
import co.fanki.componentflow.shared.Preconditions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Project-wide index of component definitions, the last resort of
 * reference resolution.
 *
 * <p>Each definition is reachable by its name, by its file name without
 * extension and, for {@code index} files, by the PascalCase name of the
 * enclosing directory ({@code user-card/index.tsx} gives
 * {@code UserCard}). The first definition registered under a name
 * wins.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ComponentRegistry {

    private final Map<String, ComponentDefinition> byName =
            new LinkedHashMap<>();
    private final Map<FileKey, ComponentDefinition> byPath =
            new LinkedHashMap<>();
    private final List<ComponentDefinition> definitions = new ArrayList<>();

    private ComponentRegistry() {
    }

    /**
     * Creates an empty registry.
     *
     * @return the registry
     */
    public static ComponentRegistry empty() {
        return new ComponentRegistry();
    }

    /**
     * Creates a registry holding the given definitions.
     *
     * @param definitions the definitions, never null
     * @return the registry
     */
    public static ComponentRegistry of(
            final Collection<ComponentDefinition> definitions) {
        Preconditions.requireNonNull(definitions, "Definitions are required");
        final ComponentRegistry registry = new ComponentRegistry();
        for (final ComponentDefinition definition : definitions) {
            registry.register(definition);
        }
        return registry;
    }

    private void register(final ComponentDefinition definition) {
        definitions.add(definition);
        byName.putIfAbsent(definition.name(), definition);
        byPath.putIfAbsent(FileKey.of(definition.filePath()), definition);

        final String baseName = baseName(definition.filePath());
        if (baseName.isEmpty()) {
            return;
        }
        if ("index".equals(baseName)) {
            final Path directory = definition.filePath().getParent();
            if (directory != null && directory.getFileName() != null) {
                byName.putIfAbsent(
                        pascalCase(directory.getFileName().toString()),
                        definition);
            }
        } else {
            byName.putIfAbsent(baseName, definition);
        }
    }

    /**
     * Looks a component up by name.
     *
     * @param name the component name
     * @return the definition, or null when unknown
     */
    public ComponentDefinition findByName(final String name) {
        return name == null ? null : byName.get(name);
    }

    /**
     * Looks a component up by the file that defines it.
     *
     * @param file the file
     * @return the definition, or null when unknown
     */
    public ComponentDefinition findByPath(final Path file) {
        return file == null ? null : byPath.get(FileKey.of(file));
    }

    /**
     * Returns every registered definition.
     *
     * @return the definitions in registration order, unmodifiable
     */
    public List<ComponentDefinition> definitions() {
        return Collections.unmodifiableList(definitions);
    }

    /**
     * Returns how many definitions are registered.
     *
     * @return the number of definitions
     */
    public int size() {
        return definitions.size();
    }

    /**
     * Returns the file name of a path without its extension.
     *
     * @param file the path
     * @return the base name, empty when the path has no file name
     */
    public static String baseName(final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return "";
        }
        final String name = fileName.toString();
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Converts {@code user-card}, {@code user_card} or {@code userCard}
     * to {@code UserCard}.
     *
     * @param value the value to convert
     * @return the PascalCase value
     */
    public static String pascalCase(final String value) {
        final StringBuilder result = new StringBuilder();
        for (final String part : value.split("[-_.\\s]+")) {
            if (!part.isEmpty()) {
                result.append(Character.toUpperCase(part.charAt(0)))
                        .append(part.substring(1));
            }
        }
        return result.toString();
    }
}
