package co.fanki.componentflow.analysis.domain.conditional;

import java.util.ArrayList;
import java.util.List;

/**
 * The component and markup references found in one branch or expression.
 *
 * @param components the component references, in source order
 * @param markupElements the tracked markup elements, in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExtractedReferences(
        List<ComponentReference> components,
        List<MarkupElementReference> markupElements) {

    private static final ExtractedReferences EMPTY =
            new ExtractedReferences(List.of(), List.of());

    /** Copies both lists. */
    public ExtractedReferences {
        components = components == null ? List.of() : List.copyOf(components);
        markupElements = markupElements == null
                ? List.of() : List.copyOf(markupElements);
    }

    /**
     * Returns an instance with no references.
     *
     * @return the empty instance
     */
    public static ExtractedReferences empty() {
        return EMPTY;
    }

    /**
     * Whether neither components nor markup elements were found.
     *
     * @return true when empty
     */
    public boolean isEmpty() {
        return components.isEmpty() && markupElements.isEmpty();
    }

    /**
     * Concatenates this instance with another one.
     *
     * @param other the references to append
     * @return a new instance holding both
     */
    public ExtractedReferences plus(final ExtractedReferences other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        final List<ComponentReference> allComponents =
                new ArrayList<>(components);
        allComponents.addAll(other.components);
        final List<MarkupElementReference> allMarkup =
                new ArrayList<>(markupElements);
        allMarkup.addAll(other.markupElements);
        return new ExtractedReferences(allComponents, allMarkup);
    }
}
