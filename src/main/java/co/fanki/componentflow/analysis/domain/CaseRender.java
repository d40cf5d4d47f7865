package co.fanki.componentflow.analysis.domain;

import co.fanki.componentflow.shared.Preconditions;
import co.fanki.componentflow.shared.ValueObject;

import java.util.List;

/**
 * The resolved subtrees of one switch case.
 *
 * @param label the case test source text, or {@code default}
 * @param path the nodes the case renders
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CaseRender(String label, List<FlowNode> path)
        implements ValueObject {

    /** Validates and copies. */
    public CaseRender {
        Preconditions.requireNonNull(label, "Case label is required");
        path = path == null ? List.of() : List.copyOf(path);
    }
}
