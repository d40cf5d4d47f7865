package co.fanki.componentflow.analysis.domain.ast;

import co.fanki.componentflow.shared.Preconditions;
import co.fanki.componentflow.shared.ValueObject;

/**
 * A location inside a source file.
 *
 * @param line the 1-based line number
 * @param column the 0-based column
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourcePosition(int line, int column) implements ValueObject {

    /** Validates the coordinates. */
    public SourcePosition {
        Preconditions.requirePositive(line, "Line must be 1-based");
        Preconditions.requireNonNegative(column, "Column must be >= 0");
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
