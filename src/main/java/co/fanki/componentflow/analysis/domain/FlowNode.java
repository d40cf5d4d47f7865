package co.fanki.componentflow.analysis.domain;

import co.fanki.componentflow.analysis.domain.conditional.MarkupElementReference;
import co.fanki.componentflow.shared.Preconditions;
import co.fanki.componentflow.shared.ValueObject;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A component in the flow graph.
 *
 * <p>Internal nodes carry the file they were scanned from, their
 * conditional renders and their children. External nodes are leaves with
 * an empty file path and the module they were imported from. Within one
 * run a file is scanned once; call sites that reach it under different
 * names get relabeled copies sharing the same lists.</p>
 *
 * @param name the component name, as invoked at the call site
 * @param filePath the normalized path of the file, empty when external
 * @param external whether the component comes from a dependency
 * @param source the module path of an external component, else null
 * @param conditionalRenders the conditional constructs of the component
 * @param children every component rendered, conditionally or not,
 *        de-duplicated
 * @param markupElements the tracked markup elements rendered directly
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowNode(
        String name,
        String filePath,
        @JsonProperty("isExternal") boolean external,
        String source,
        List<ConditionalRender> conditionalRenders,
        List<FlowNode> children,
        List<MarkupElementReference> markupElements) implements ValueObject {

    /** Validates and copies. */
    public FlowNode {
        Preconditions.requireNonBlank(name, "Node name is required");
        Preconditions.requireNonNull(filePath, "File path is required");
        Preconditions.require(!external || filePath.isEmpty(),
                "External nodes have no file path");
        conditionalRenders = conditionalRenders == null
                ? List.of() : List.copyOf(conditionalRenders);
        children = children == null ? List.of() : List.copyOf(children);
        markupElements = markupElements == null
                ? List.of() : List.copyOf(markupElements);
        Preconditions.require(!external
                || (children.isEmpty() && conditionalRenders.isEmpty()),
                "External nodes are leaves");
    }

    /**
     * Creates an external leaf.
     *
     * @param name the component name
     * @param source the module it was imported from, may be null
     * @return the external node
     */
    public static FlowNode external(final String name, final String source) {
        return new FlowNode(name, "", true, source, List.of(), List.of(),
                List.of());
    }

    /**
     * Creates an internal node whose subtree is not expanded, used when
     * the depth bound is reached.
     *
     * @param name the component name
     * @param filePath the normalized file path
     * @return the leaf node
     */
    public static FlowNode leaf(final String name, final String filePath) {
        return new FlowNode(name, filePath, false, null, List.of(),
                List.of(), List.of());
    }

    /**
     * Returns this node under another call-site name, sharing the same
     * subtree.
     *
     * @param newName the call-site name
     * @return this node when the name is unchanged, else a relabeled copy
     */
    public FlowNode withName(final String newName) {
        if (name.equals(newName)) {
            return this;
        }
        return new FlowNode(newName, filePath, external, source,
                conditionalRenders, children, markupElements);
    }

    /**
     * Returns the edge identity of this node: its file for internal
     * nodes, {@code external:<name>} for external ones.
     *
     * @return the identity
     */
    public String identity() {
        return external ? "external:" + name : filePath;
    }
}
