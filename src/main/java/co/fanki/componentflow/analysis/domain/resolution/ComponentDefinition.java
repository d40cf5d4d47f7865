package co.fanki.componentflow.analysis.domain.resolution;

import co.fanki.componentflow.shared.Preconditions;

import java.nio.file.Path;

/**
 * A component known to the project-wide registry.
 *
 * @param name the component name
 * @param filePath the file that defines it
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ComponentDefinition(String name, Path filePath) {

    /** Validates and normalizes the path. */
    public ComponentDefinition {
        Preconditions.requireNonBlank(name, "Component name is required");
        Preconditions.requireNonNull(filePath, "File path is required");
        filePath = filePath.toAbsolutePath().normalize();
    }
}
