package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.analysis.domain.ast.SourcePosition;
import co.fanki.componentflow.shared.Preconditions;

import java.util.List;

/**
 * A classified conditional construct, before its references are resolved.
 *
 * @param kind the construct kind
 * @param conditionText the condition source text, kept opaque
 * @param trueBranch the references of the primary branch
 * @param falseBranch the references of the alternative branch, null when
 *        the construct has none
 * @param cases the per-case references of a switch, empty otherwise
 * @param position where the construct starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ConditionalPattern(
        ConditionalKind kind,
        String conditionText,
        ExtractedReferences trueBranch,
        ExtractedReferences falseBranch,
        List<CasePattern> cases,
        SourcePosition position) {

    /** Validates and copies. */
    public ConditionalPattern {
        Preconditions.requireNonNull(kind, "Kind is required");
        Preconditions.requireNonNull(conditionText,
                "Condition text is required");
        Preconditions.requireNonNull(trueBranch, "True branch is required");
        Preconditions.requireNonNull(position, "Position is required");
        cases = cases == null ? List.of() : List.copyOf(cases);
    }

    /**
     * Whether the construct has an alternative branch.
     *
     * @return true when the false branch is present
     */
    public boolean hasFalseBranch() {
        return falseBranch != null;
    }
}
