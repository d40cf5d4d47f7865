package co.fanki.componentflow.analysis.domain;

import co.fanki.componentflow.analysis.domain.ast.SourcePosition;
import co.fanki.componentflow.analysis.domain.conditional.ConditionalKind;
import co.fanki.componentflow.analysis.domain.conditional.MarkupElementReference;
import co.fanki.componentflow.shared.Preconditions;
import co.fanki.componentflow.shared.ValueObject;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A conditional construct with its branches resolved to flow nodes.
 *
 * <p>Identified by file, condition text and position; each identity is
 * materialized once per run.</p>
 *
 * @param kind the construct kind
 * @param conditionText the condition source text, never evaluated
 * @param truePath the nodes rendered by the primary branch
 * @param falsePath the nodes rendered by the alternative, null when the
 *        construct has no alternative
 * @param caseBranches the per-case nodes of a switch, empty otherwise
 * @param markupTrue the tracked markup elements of the primary branch
 * @param markupFalse the tracked markup elements of the alternative,
 *        null when there is none
 * @param filePath the normalized path of the declaring file
 * @param position where the construct starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionalRender(
        ConditionalKind kind,
        String conditionText,
        List<FlowNode> truePath,
        List<FlowNode> falsePath,
        List<CaseRender> caseBranches,
        List<MarkupElementReference> markupTrue,
        List<MarkupElementReference> markupFalse,
        String filePath,
        SourcePosition position) implements ValueObject {

    /** Validates and copies. */
    public ConditionalRender {
        Preconditions.requireNonNull(kind, "Kind is required");
        Preconditions.requireNonNull(conditionText,
                "Condition text is required");
        Preconditions.requireNonNull(filePath, "File path is required");
        Preconditions.requireNonNull(position, "Position is required");
        truePath = truePath == null ? List.of() : List.copyOf(truePath);
        falsePath = falsePath == null ? null : List.copyOf(falsePath);
        caseBranches = caseBranches == null
                ? List.of() : List.copyOf(caseBranches);
        markupTrue = markupTrue == null ? List.of() : List.copyOf(markupTrue);
        markupFalse = markupFalse == null ? null : List.copyOf(markupFalse);
    }

    /**
     * Returns the identity of this render within one run.
     *
     * @return {@code file::condition::line:column}
     */
    public String identity() {
        return identity(filePath, conditionText, position);
    }

    /**
     * Computes the identity of a conditional construct.
     *
     * @param filePath the normalized file path
     * @param conditionText the condition source text
     * @param position the construct position
     * @return {@code file::condition::line:column}
     */
    public static String identity(final String filePath,
            final String conditionText, final SourcePosition position) {
        return filePath + "::" + conditionText + "::" + position;
    }
}
