package co.fanki.componentflow.analysis.domain.returns;

import co.fanki.componentflow.analysis.domain.ast.SourcePosition;
import co.fanki.componentflow.analysis.domain.conditional.ComponentReference;
import co.fanki.componentflow.analysis.domain.conditional.ConditionalPattern;
import co.fanki.componentflow.analysis.domain.conditional.MarkupElementReference;
import co.fanki.componentflow.shared.Preconditions;

import java.util.List;

/**
 * One markup-producing exit of a component function.
 *
 * <p>{@code patterns} lists the enclosing if/switch statements (outermost
 * first), then the early-exit pattern when this exit is one, then the
 * conditionals inside the returned expression. Enclosing patterns are
 * shared instances across the exits of the same statement.</p>
 *
 * @param patterns the conditional patterns governing this exit
 * @param directReferences every component referenced by the returned
 *        expression
 * @param directMarkupReferences the tracked markup elements of the
 *        returned expression
 * @param position where the return statement (or implicit body) starts
 * @param implicit whether this is the body of an expression-bodied arrow
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ReturnPoint(
        List<ConditionalPattern> patterns,
        List<ComponentReference> directReferences,
        List<MarkupElementReference> directMarkupReferences,
        SourcePosition position,
        boolean implicit) {

    /** Validates and copies. */
    public ReturnPoint {
        Preconditions.requireNonNull(position, "Position is required");
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        directReferences = directReferences == null
                ? List.of() : List.copyOf(directReferences);
        directMarkupReferences = directMarkupReferences == null
                ? List.of() : List.copyOf(directMarkupReferences);
    }

    /**
     * Whether this exit is governed by at least one conditional.
     *
     * @return true when there is any pattern
     */
    public boolean hasConditional() {
        return !patterns.isEmpty();
    }
}
