package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.analysis.domain.ast.SourcePosition;
import co.fanki.componentflow.shared.Preconditions;

import java.util.Map;

/**
 * A use-site of a component found in markup or in a render expression.
 *
 * <p>Transient: produced by the classifier and consumed right away by
 * reference resolution.</p>
 *
 * @param name the referenced name, such as {@code Header} or
 *        {@code Icons.Home}
 * @param props the attribute source texts keyed by attribute name
 * @param position where the reference appears
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ComponentReference(
        String name,
        Map<String, String> props,
        SourcePosition position) {

    /** Validates and copies. */
    public ComponentReference {
        Preconditions.requireNonBlank(name, "Reference name is required");
        Preconditions.requireNonNull(position, "Position is required");
        props = props == null ? Map.of() : Map.copyOf(props);
    }
}
