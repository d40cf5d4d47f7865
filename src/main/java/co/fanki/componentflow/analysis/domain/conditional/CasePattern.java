package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.shared.Preconditions;

/**
 * The references of one switch case.
 *
 * @param label the case test source text, or {@code default}
 * @param references the references rendered by the case body
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CasePattern(String label, ExtractedReferences references) {

    /** Validates. */
    public CasePattern {
        Preconditions.requireNonNull(label, "Case label is required");
        Preconditions.requireNonNull(references, "References are required");
    }
}
