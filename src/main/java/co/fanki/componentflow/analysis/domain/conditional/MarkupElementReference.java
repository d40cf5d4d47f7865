package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.analysis.domain.ast.SourcePosition;
import co.fanki.componentflow.shared.Preconditions;
import co.fanki.componentflow.shared.ValueObject;

import java.util.Map;

/**
 * A native markup element tracked when markup elements are enabled.
 *
 * @param tagName the tag, such as {@code button}
 * @param props the attribute source texts keyed by attribute name
 * @param hasChildren whether the element has any child
 * @param textContent the captured static text, or null
 * @param position where the element appears
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MarkupElementReference(
        String tagName,
        Map<String, String> props,
        boolean hasChildren,
        String textContent,
        SourcePosition position) implements ValueObject {

    /** Validates and copies. */
    public MarkupElementReference {
        Preconditions.requireNonBlank(tagName, "Tag name is required");
        Preconditions.requireNonNull(position, "Position is required");
        props = props == null ? Map.of() : Map.copyOf(props);
    }
}
