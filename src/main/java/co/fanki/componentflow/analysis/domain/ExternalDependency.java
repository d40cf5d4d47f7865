package co.fanki.componentflow.analysis.domain;

import java.util.List;

/**
 * A package whose components the analyzed entries render.
 *
 * @param name the package name, scoped packages keep their scope
 * @param usedIn the entry files that reach the package, in first-use order
 * @param usageCount how many external leaves point into the package
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExternalDependency(String name, List<String> usedIn,
        int usageCount) {

    /** Copies. */
    public ExternalDependency {
        usedIn = usedIn == null ? List.of() : List.copyOf(usedIn);
    }
}
