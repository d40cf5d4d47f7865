package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.analysis.domain.ast.SyntaxKind;
import co.fanki.componentflow.analysis.domain.ast.SyntaxNode;
import co.fanki.componentflow.shared.Preconditions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands an expression or statement into the component and markup
 * references it may render.
 *
 * <p>Recurses through markup elements and fragments (children, expression
 * containers and markup-valued attributes), ternaries (both sides),
 * {@code &&} (right side), {@code ||} and {@code ??} (both sides),
 * arrays, calls and capitalized identifiers or member chains. A call
 * counts as a reference when its callee name is capitalized; its function
 * arguments are expanded too, so {@code items.map(i => <Row/>)} yields
 * {@code Row}.</p>
 *
 * <p>Markup elements are only collected when enabled, and then only the
 * tags accepted by the {@link MarkupElementFilter}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReferenceExpander {

    private final boolean includeMarkupElements;
    private final MarkupElementFilter filter;

    /**
     * Creates a new expander.
     *
     * @param theIncludeMarkupElements whether markup elements are tracked
     * @param theFilter the markup tag filter, never null
     */
    public ReferenceExpander(final boolean theIncludeMarkupElements,
            final MarkupElementFilter theFilter) {
        this.includeMarkupElements = theIncludeMarkupElements;
        this.filter = Preconditions.requireNonNull(theFilter,
                "Markup filter is required");
    }

    /**
     * Expands one expression.
     *
     * @param expression the expression, may be null
     * @param source the source text of the file
     * @return the references found, never null
     */
    public ExtractedReferences expand(final SyntaxNode expression,
            final String source) {
        final Collector collector = new Collector();
        expandExpression(expression, source, collector);
        return collector.toReferences();
    }

    /**
     * Expands one statement: returns, expression statements, blocks,
     * nested if/else and switch statements, try, loop and labeled bodies.
     *
     * @param statement the statement, may be null
     * @param source the source text of the file
     * @return the references found, never null
     */
    public ExtractedReferences expandStatement(final SyntaxNode statement,
            final String source) {
        final Collector collector = new Collector();
        expandStatement(statement, source, collector);
        return collector.toReferences();
    }

    private void expandStatement(final SyntaxNode statement,
            final String source, final Collector collector) {
        if (statement == null) {
            return;
        }
        switch (statement.kind()) {
            case RETURN:
                expandExpression(statement.field("argument"), source,
                        collector);
                break;
            case EXPRESSION_STATEMENT:
                expandExpression(statement.field("expression"), source,
                        collector);
                break;
            case BLOCK:
            case CASE:
                for (final SyntaxNode child : statement.children()) {
                    expandStatement(child, source, collector);
                }
                break;
            case IF:
                expandStatement(statement.field("consequent"), source,
                        collector);
                expandStatement(statement.field("alternate"), source,
                        collector);
                break;
            case SWITCH:
                for (final SyntaxNode clause : statement.children()) {
                    expandStatement(clause, source, collector);
                }
                break;
            case TRY:
                expandStatement(statement.field("block"), source, collector);
                expandStatement(statement.field("handler"), source,
                        collector);
                expandStatement(statement.field("finalizer"), source,
                        collector);
                break;
            case LOOP:
            case LABELED:
                expandStatement(statement.field("body"), source, collector);
                break;
            default:
                break;
        }
    }

    private void expandExpression(final SyntaxNode node, final String source,
            final Collector collector) {
        if (node == null) {
            return;
        }
        switch (node.kind()) {
            case JSX_ELEMENT:
                expandElement(node, source, collector);
                break;
            case JSX_FRAGMENT:
                expandMarkupChildren(node, source, collector);
                break;
            case JSX_EXPRESSION_CONTAINER:
            case SPREAD:
                expandExpression(node.field("expression"), source, collector);
                break;
            case CONDITIONAL:
                expandExpression(node.field("consequent"), source, collector);
                expandExpression(node.field("alternate"), source, collector);
                break;
            case LOGICAL:
                if (!"&&".equals(node.operator())) {
                    expandExpression(node.field("left"), source, collector);
                }
                expandExpression(node.field("right"), source, collector);
                break;
            case ARRAY:
                for (final SyntaxNode element : node.children()) {
                    expandExpression(element, source, collector);
                }
                break;
            case CALL:
                expandCall(node, source, collector);
                break;
            case IDENTIFIER:
            case MEMBER: {
                final String name = ElementClassifier.dottedName(node);
                if (ElementClassifier.isCapitalized(name)) {
                    collector.components.add(new ComponentReference(
                            name, Map.of(), node.position()));
                }
                break;
            }
            default:
                break;
        }
    }

    private void expandElement(final SyntaxNode element, final String source,
            final Collector collector) {

        final String name = ElementClassifier.elementName(element);
        final ElementKind kind = ElementClassifier.classify(name);

        if (kind == ElementKind.COMPONENT) {
            collector.components.add(new ComponentReference(
                    name, props(element, source), element.position()));
        } else if (kind == ElementKind.MARKUP_ELEMENT
                && includeMarkupElements && filter.accepts(name)) {
            collector.markupElements.add(new MarkupElementReference(
                    name,
                    props(element, source),
                    !element.children().isEmpty(),
                    filter.capture(staticText(element)),
                    element.position()));
        }

        final SyntaxNode attributes = element.field("attributes");
        if (attributes != null) {
            for (final SyntaxNode attribute : attributes.children()) {
                final SyntaxNode value = attribute.field("value");
                if (attribute.is(SyntaxKind.JSX_ATTRIBUTE)
                        && ElementClassifier.containsMarkup(value)) {
                    expandExpression(value, source, collector);
                }
            }
        }

        expandMarkupChildren(element, source, collector);
    }

    private void expandMarkupChildren(final SyntaxNode markup,
            final String source, final Collector collector) {
        for (final SyntaxNode child : markup.children()) {
            if (child.kind().isMarkup()
                    || child.is(SyntaxKind.JSX_EXPRESSION_CONTAINER)) {
                expandExpression(child, source, collector);
            }
        }
    }

    private void expandCall(final SyntaxNode call, final String source,
            final Collector collector) {

        final String callee = ElementClassifier.dottedName(
                call.field("callee"));
        if (ElementClassifier.isCapitalized(callee)) {
            collector.components.add(new ComponentReference(
                    callee, Map.of(), call.position()));
        }

        for (final SyntaxNode argument : call.children()) {
            if (argument.kind().isFunction()) {
                expandFunctionResults(argument, source, collector);
            } else if (ElementClassifier.containsMarkup(argument)) {
                expandExpression(argument, source, collector);
            }
        }
    }

    /**
     * Expands what an inline function returns, without entering functions
     * nested inside it.
     */
    private void expandFunctionResults(final SyntaxNode function,
            final String source, final Collector collector) {
        final SyntaxNode body = function.field("body");
        if (body == null) {
            return;
        }
        if (!body.is(SyntaxKind.BLOCK)) {
            expandExpression(body, source, collector);
            return;
        }
        for (final SyntaxNode returned : ReturnStatements.of(body)) {
            expandExpression(returned.field("argument"), source, collector);
        }
    }

    private static Map<String, String> props(final SyntaxNode element,
            final String source) {
        final Map<String, String> props = new LinkedHashMap<>();
        final SyntaxNode attributes = element.field("attributes");
        if (attributes == null) {
            return props;
        }
        for (final SyntaxNode attribute : attributes.children()) {
            if (attribute.is(SyntaxKind.JSX_SPREAD_ATTRIBUTE)) {
                final String spread = attribute.field("expression") == null
                        ? "" : attribute.field("expression").text(source);
                props.put("..." + spread, spread);
                continue;
            }
            final SyntaxNode value = attribute.field("value");
            if (value == null) {
                props.put(attribute.name(), "true");
            } else if (value.is(SyntaxKind.STRING_LITERAL)) {
                props.put(attribute.name(), value.value());
            } else if (value.is(SyntaxKind.JSX_EXPRESSION_CONTAINER)) {
                final SyntaxNode expression = value.field("expression");
                props.put(attribute.name(),
                        expression == null ? "" : expression.text(source));
            } else {
                props.put(attribute.name(), value.text(source));
            }
        }
        return props;
    }

    private static String staticText(final SyntaxNode element) {
        final StringBuilder text = new StringBuilder();
        for (final SyntaxNode child : element.children()) {
            if (child.is(SyntaxKind.JSX_TEXT) && child.value() != null) {
                if (text.length() > 0) {
                    text.append(' ');
                }
                text.append(child.value().trim());
            }
        }
        return text.toString();
    }

    /** Mutable accumulator for one expansion. */
    private static final class Collector {
        private final List<ComponentReference> components = new ArrayList<>();
        private final List<MarkupElementReference> markupElements =
                new ArrayList<>();

        private ExtractedReferences toReferences() {
            return new ExtractedReferences(components, markupElements);
        }
    }
}
