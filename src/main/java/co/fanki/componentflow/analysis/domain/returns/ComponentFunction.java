package co.fanki.componentflow.analysis.domain.returns;

import co.fanki.componentflow.analysis.domain.ast.SyntaxNode;
import co.fanki.componentflow.shared.Preconditions;

/**
 * A function that renders markup and follows the component naming
 * convention.
 *
 * @param name the component name, null for an anonymous default export
 * @param function the function node (declaration, expression or arrow)
 * @param defaultExport whether the function is the file's default export
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ComponentFunction(
        String name,
        SyntaxNode function,
        boolean defaultExport) {

    /** Validates. */
    public ComponentFunction {
        Preconditions.requireNonNull(function, "Function node is required");
        Preconditions.require(function.kind().isFunction(),
                "Not a function: " + function.rawKind());
    }
}
