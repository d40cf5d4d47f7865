package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.analysis.domain.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the return statements of one function body in source order.
 *
 * <p>Enters blocks, if/else, switch cases, try/catch/finally, loops and
 * labeled statements; never enters nested functions.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ReturnStatements {

    private ReturnStatements() {
    }

    /**
     * Collects the return statements reachable from a statement.
     *
     * @param statement the function body or any statement within it
     * @return the return statements with an argument, in source order
     */
    public static List<SyntaxNode> of(final SyntaxNode statement) {
        final List<SyntaxNode> returns = new ArrayList<>();
        collect(statement, returns);
        return returns;
    }

    /**
     * Checks whether a statement holds a return that produces markup.
     *
     * @param statement the statement to inspect, may be null
     * @return true when at least one such return exists
     */
    public static boolean hasMarkupReturn(final SyntaxNode statement) {
        for (final SyntaxNode returned : of(statement)) {
            if (ElementClassifier.containsMarkup(returned.field("argument"))) {
                return true;
            }
        }
        return false;
    }

    private static void collect(final SyntaxNode statement,
            final List<SyntaxNode> returns) {
        if (statement == null) {
            return;
        }
        switch (statement.kind()) {
            case RETURN:
                if (statement.has("argument")) {
                    returns.add(statement);
                }
                break;
            case BLOCK:
            case CASE:
            case SWITCH:
                for (final SyntaxNode child : statement.children()) {
                    collect(child, returns);
                }
                break;
            case IF:
                collect(statement.field("consequent"), returns);
                collect(statement.field("alternate"), returns);
                break;
            case TRY:
                collect(statement.field("block"), returns);
                collect(statement.field("handler"), returns);
                collect(statement.field("finalizer"), returns);
                break;
            case LOOP:
            case LABELED:
                collect(statement.field("body"), returns);
                break;
            default:
                break;
        }
    }
}
