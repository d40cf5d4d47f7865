package co.fanki.componentflow.analysis.domain;

import co.fanki.componentflow.shared.Preconditions;

/**
 * A failure recorded during a run. Never thrown: the run continues with
 * the remaining files.
 *
 * @param type the failure kind
 * @param message a human readable description
 * @param filePath the file involved, may be empty
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowAnalysisError(
        ErrorType type,
        String message,
        String filePath) {

    /** Validates. */
    public FlowAnalysisError {
        Preconditions.requireNonNull(type, "Error type is required");
        Preconditions.requireNonNull(message, "Message is required");
        filePath = filePath == null ? "" : filePath;
    }
}
