package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.analysis.domain.ast.SyntaxKind;
import co.fanki.componentflow.analysis.domain.ast.SyntaxNode;
import co.fanki.componentflow.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies markup-producing expressions and statements into
 * conditional patterns.
 *
 * <p>Expression level: a ternary yields one pattern with both branches;
 * {@code cond && X} yields a pattern only when {@code X} holds a
 * reference; {@code a || b} and {@code a ?? b} yield one when either side
 * does. Conditionals nested inside a branch are flattened into that
 * branch. Markup elements and fragments are searched through their
 * children for further conditionals.</p>
 *
 * <p>Statement level: if/else and switch statements, plus the early-exit
 * pattern built for a return point.</p>
 *
 * <p>A sub-expression that cannot be expanded yields an empty branch; it
 * never aborts the classification of the rest of the file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ConditionalPatternClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(
            ConditionalPatternClassifier.class);

    /** Condition text of early-exit patterns. */
    public static final String EARLY_RETURN = "early return";

    /** Label of the default clause of a switch. */
    public static final String DEFAULT_CASE = "default";

    private final ReferenceExpander expander;

    /**
     * Creates a new classifier.
     *
     * @param theExpander the reference expander, never null
     */
    public ConditionalPatternClassifier(final ReferenceExpander theExpander) {
        this.expander = Preconditions.requireNonNull(theExpander,
                "Reference expander is required");
    }

    /**
     * Classifies one markup-producing expression, such as the argument of
     * a return statement.
     *
     * @param expression the expression, may be null
     * @param source the source text of the file
     * @return the patterns found, in source order; never null
     */
    public List<ConditionalPattern> classifyExpression(
            final SyntaxNode expression, final String source) {
        final List<ConditionalPattern> patterns = new ArrayList<>();
        classifyExpression(expression, source, patterns);
        return patterns;
    }

    /**
     * Classifies an if statement.
     *
     * <p>The true branch holds the references of the consequent, the
     * false branch those of the alternate; it is null when there is no
     * else.</p>
     *
     * @param statement the if statement, never null
     * @param source the source text of the file
     * @return the if/else pattern
     */
    public ConditionalPattern classifyIf(final SyntaxNode statement,
            final String source) {
        require(statement, SyntaxKind.IF);

        final ExtractedReferences trueBranch =
                safeExpandStatement(statement.field("consequent"), source);
        final ExtractedReferences falseBranch = statement.has("alternate")
                ? safeExpandStatement(statement.field("alternate"), source)
                : null;

        return new ConditionalPattern(ConditionalKind.IF_ELSE,
                conditionText(statement.field("test"), source),
                trueBranch, falseBranch, List.of(), statement.position());
    }

    /**
     * Classifies a switch statement.
     *
     * <p>The true branch is the union of all cases; each case is also
     * kept apart, labeled with its test text or {@code default}.</p>
     *
     * @param statement the switch statement, never null
     * @param source the source text of the file
     * @return the switch pattern
     */
    public ConditionalPattern classifySwitch(final SyntaxNode statement,
            final String source) {
        require(statement, SyntaxKind.SWITCH);

        ExtractedReferences union = ExtractedReferences.empty();
        final List<CasePattern> cases = new ArrayList<>();

        for (final SyntaxNode clause : statement.children()) {
            final ExtractedReferences references =
                    safeExpandStatement(clause, source);
            final String label = clause.has("test")
                    ? conditionText(clause.field("test"), source)
                    : DEFAULT_CASE;
            cases.add(new CasePattern(label, references));
            union = union.plus(references);
        }

        return new ConditionalPattern(ConditionalKind.SWITCH,
                conditionText(statement.field("discriminant"), source),
                union, null, cases, statement.position());
    }

    /**
     * Builds the early-exit pattern of a return statement.
     *
     * @param returnStatement the return statement, never null
     * @param source the source text of the file
     * @return the early-exit pattern
     */
    public ConditionalPattern earlyExit(final SyntaxNode returnStatement,
            final String source) {
        require(returnStatement, SyntaxKind.RETURN);
        return new ConditionalPattern(ConditionalKind.EARLY_EXIT,
                EARLY_RETURN,
                safeExpand(returnStatement.field("argument"), source),
                null, List.of(), returnStatement.position());
    }

    private void classifyExpression(final SyntaxNode expression,
            final String source, final List<ConditionalPattern> patterns) {
        if (expression == null) {
            return;
        }
        switch (expression.kind()) {
            case CONDITIONAL:
                patterns.add(ternary(expression, source));
                break;
            case LOGICAL: {
                final ConditionalPattern pattern = logical(expression, source);
                if (pattern != null) {
                    patterns.add(pattern);
                }
                break;
            }
            case JSX_ELEMENT:
            case JSX_FRAGMENT:
                for (final SyntaxNode child : expression.children()) {
                    if (child.is(SyntaxKind.JSX_EXPRESSION_CONTAINER)) {
                        classifyExpression(child.field("expression"), source,
                                patterns);
                    } else if (child.kind().isMarkup()) {
                        classifyExpression(child, source, patterns);
                    }
                }
                break;
            default:
                break;
        }
    }

    private ConditionalPattern ternary(final SyntaxNode expression,
            final String source) {
        return new ConditionalPattern(ConditionalKind.TERNARY,
                conditionText(expression.field("test"), source),
                safeExpand(expression.field("consequent"), source),
                safeExpand(expression.field("alternate"), source),
                List.of(), expression.position());
    }

    private ConditionalPattern logical(final SyntaxNode expression,
            final String source) {
        final SyntaxNode left = expression.field("left");
        final SyntaxNode right = expression.field("right");
        final String condition = conditionText(left, source);

        if ("&&".equals(expression.operator())) {
            final ExtractedReferences trueBranch = safeExpand(right, source);
            if (trueBranch.isEmpty()) {
                return null;
            }
            return new ConditionalPattern(ConditionalKind.LOGICAL_AND_OR,
                    condition, trueBranch, null, List.of(),
                    expression.position());
        }

        final ExtractedReferences trueBranch = safeExpand(left, source);
        final ExtractedReferences falseBranch = safeExpand(right, source);
        if (trueBranch.isEmpty() && falseBranch.isEmpty()) {
            return null;
        }
        return new ConditionalPattern(ConditionalKind.LOGICAL_AND_OR,
                condition, trueBranch, falseBranch, List.of(),
                expression.position());
    }

    private ExtractedReferences safeExpand(final SyntaxNode expression,
            final String source) {
        try {
            return expander.expand(expression, source);
        } catch (final RuntimeException e) {
            LOG.debug("Could not expand {}, branch left empty",
                    expression, e);
            return ExtractedReferences.empty();
        }
    }

    private ExtractedReferences safeExpandStatement(
            final SyntaxNode statement, final String source) {
        try {
            return expander.expandStatement(statement, source);
        } catch (final RuntimeException e) {
            LOG.debug("Could not expand {}, branch left empty",
                    statement, e);
            return ExtractedReferences.empty();
        }
    }

    private static String conditionText(final SyntaxNode node,
            final String source) {
        return node == null ? "" : node.text(source).trim();
    }

    private static void require(final SyntaxNode node,
            final SyntaxKind kind) {
        Preconditions.requireNonNull(node, kind.code() + " node is required");
        Preconditions.require(node.is(kind),
                "Expected " + kind.code() + " but got " + node.rawKind());
    }
}
