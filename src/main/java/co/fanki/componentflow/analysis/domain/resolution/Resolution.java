package co.fanki.componentflow.analysis.domain.resolution;

import co.fanki.componentflow.analysis.domain.FlowNode;
import co.fanki.componentflow.shared.Preconditions;

import java.nio.file.Path;

/**
 * The outcome of resolving one reference: either an external leaf or an
 * internal file for the builder to scan. Unresolved references have no
 * resolution at all.
 *
 * @param externalLeaf the leaf node of an external component, else null
 * @param internalPath the defining file of an internal component, else
 *        null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Resolution(FlowNode externalLeaf, Path internalPath) {

    /** Validates that exactly one side is set. */
    public Resolution {
        Preconditions.require((externalLeaf == null) != (internalPath == null),
                "A resolution is either external or internal");
    }

    /**
     * Creates an external resolution.
     *
     * @param name the component name
     * @param modulePath the module it is imported from
     * @return the resolution
     */
    public static Resolution external(final String name,
            final String modulePath) {
        return new Resolution(FlowNode.external(name, modulePath), null);
    }

    /**
     * Creates an internal resolution.
     *
     * @param file the defining file
     * @return the resolution
     */
    public static Resolution internal(final Path file) {
        return new Resolution(null, file.toAbsolutePath().normalize());
    }

    public boolean isExternal() {
        return externalLeaf != null;
    }
}
