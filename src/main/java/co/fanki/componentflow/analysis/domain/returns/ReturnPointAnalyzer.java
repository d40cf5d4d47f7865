package co.fanki.componentflow.analysis.domain.returns;

import co.fanki.componentflow.analysis.domain.ast.SyntaxKind;
import co.fanki.componentflow.analysis.domain.ast.SyntaxNode;
import co.fanki.componentflow.analysis.domain.conditional.ConditionalPattern;
import co.fanki.componentflow.analysis.domain.conditional.ConditionalPatternClassifier;
import co.fanki.componentflow.analysis.domain.conditional.ElementClassifier;
import co.fanki.componentflow.analysis.domain.conditional.ExtractedReferences;
import co.fanki.componentflow.analysis.domain.conditional.ReferenceExpander;
import co.fanki.componentflow.analysis.domain.conditional.ReturnStatements;
import co.fanki.componentflow.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates the markup-producing exits of a component function.
 *
 * <p>Explicit returns are found inside blocks, if/else, switch cases,
 * try/catch/finally, loops and labeled statements, never inside nested
 * functions. An expression-bodied arrow has one implicit exit.</p>
 *
 * <p>When a function has several markup exits, every exit but the last
 * one whose returned expression holds no conditional of its own is an
 * early exit.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReturnPointAnalyzer {

    private final ConditionalPatternClassifier classifier;
    private final ReferenceExpander expander;

    /**
     * Creates a new analyzer.
     *
     * @param theClassifier the conditional classifier, never null
     * @param theExpander the reference expander, never null
     */
    public ReturnPointAnalyzer(final ConditionalPatternClassifier theClassifier,
            final ReferenceExpander theExpander) {
        this.classifier = Preconditions.requireNonNull(theClassifier,
                "Classifier is required");
        this.expander = Preconditions.requireNonNull(theExpander,
                "Reference expander is required");
    }

    /**
     * Lists the markup exits of one component.
     *
     * @param component the component function, never null
     * @param source the source text of the file
     * @return the return points in source order, never null
     */
    public List<ReturnPoint> analyze(final ComponentFunction component,
            final String source) {
        Preconditions.requireNonNull(component, "Component is required");

        final SyntaxNode body = component.function().field("body");
        if (body == null) {
            return List.of();
        }

        if (!body.is(SyntaxKind.BLOCK)) {
            if (!ElementClassifier.containsMarkup(body)) {
                return List.of();
            }
            final ExtractedReferences references =
                    expander.expand(body, source);
            return List.of(new ReturnPoint(
                    classifier.classifyExpression(body, source),
                    references.components(),
                    references.markupElements(),
                    body.position(), true));
        }

        final List<Exit> exits = new ArrayList<>();
        collectExits(body, List.of(), source, exits);

        final List<ReturnPoint> points = new ArrayList<>();
        for (int i = 0; i < exits.size(); i++) {
            final Exit exit = exits.get(i);
            final SyntaxNode argument = exit.statement.field("argument");

            final List<ConditionalPattern> expressionPatterns =
                    classifier.classifyExpression(argument, source);

            final List<ConditionalPattern> patterns =
                    new ArrayList<>(exit.enclosing);
            final boolean earlyExit = exits.size() > 1
                    && i < exits.size() - 1
                    && expressionPatterns.isEmpty();
            if (earlyExit) {
                patterns.add(classifier.earlyExit(exit.statement, source));
            }
            patterns.addAll(expressionPatterns);

            final ExtractedReferences references =
                    expander.expand(argument, source);
            points.add(new ReturnPoint(patterns,
                    references.components(),
                    references.markupElements(),
                    exit.statement.position(), false));
        }
        return points;
    }

    private void collectExits(final SyntaxNode statement,
            final List<ConditionalPattern> enclosing, final String source,
            final List<Exit> exits) {
        if (statement == null) {
            return;
        }
        switch (statement.kind()) {
            case RETURN:
                if (ElementClassifier.containsMarkup(
                        statement.field("argument"))) {
                    exits.add(new Exit(statement, enclosing));
                }
                break;
            case BLOCK:
            case CASE:
                for (final SyntaxNode child : statement.children()) {
                    collectExits(child, enclosing, source, exits);
                }
                break;
            case IF: {
                if (ReturnStatements.hasMarkupReturn(statement)) {
                    final List<ConditionalPattern> nested = with(enclosing,
                            classifier.classifyIf(statement, source));
                    collectExits(statement.field("consequent"), nested,
                            source, exits);
                    collectExits(statement.field("alternate"), nested,
                            source, exits);
                }
                break;
            }
            case SWITCH: {
                if (ReturnStatements.hasMarkupReturn(statement)) {
                    final List<ConditionalPattern> nested = with(enclosing,
                            classifier.classifySwitch(statement, source));
                    for (final SyntaxNode clause : statement.children()) {
                        collectExits(clause, nested, source, exits);
                    }
                }
                break;
            }
            case TRY:
                collectExits(statement.field("block"), enclosing, source,
                        exits);
                collectExits(statement.field("handler"), enclosing, source,
                        exits);
                collectExits(statement.field("finalizer"), enclosing, source,
                        exits);
                break;
            case LOOP:
            case LABELED:
                collectExits(statement.field("body"), enclosing, source,
                        exits);
                break;
            default:
                break;
        }
    }

    private static List<ConditionalPattern> with(
            final List<ConditionalPattern> enclosing,
            final ConditionalPattern pattern) {
        final List<ConditionalPattern> nested = new ArrayList<>(enclosing);
        nested.add(pattern);
        return List.copyOf(nested);
    }

    /** A markup return with the statement patterns enclosing it. */
    private record Exit(SyntaxNode statement,
            List<ConditionalPattern> enclosing) {
    }
}
