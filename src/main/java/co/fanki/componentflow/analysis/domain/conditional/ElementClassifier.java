package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.analysis.domain.ast.SyntaxKind;
import co.fanki.componentflow.analysis.domain.ast.SyntaxNode;

/**
 * Shape-based classification of markup names and nodes.
 *
 * <p>Every "is this a component" and "does this produce markup" decision
 * of the engine goes through this class. All methods are pure.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ElementClassifier {

    private ElementClassifier() {
    }

    /**
     * Classifies a tag or reference name.
     *
     * <p>Dotted names ({@code Foo.Bar}, {@code motion.div}) are
     * components, namespaced and hyphenated names ({@code svg:rect},
     * {@code my-widget}) are markup elements, otherwise the case of the
     * first letter decides.</p>
     *
     * @param name the element name, may be null
     * @return the element kind, never null
     */
    public static ElementKind classify(final String name) {
        if (name == null || name.isBlank()) {
            return ElementKind.UNKNOWN;
        }
        if (name.indexOf(':') >= 0 || name.indexOf('-') >= 0) {
            return ElementKind.MARKUP_ELEMENT;
        }
        if (name.indexOf('.') > 0) {
            return ElementKind.COMPONENT;
        }
        final char first = name.charAt(0);
        if (Character.isUpperCase(first)) {
            return ElementKind.COMPONENT;
        }
        if (Character.isLowerCase(first)) {
            return ElementKind.MARKUP_ELEMENT;
        }
        return ElementKind.UNKNOWN;
    }

    /**
     * Checks the naming convention for components and component
     * functions: an uppercase first letter.
     *
     * @param name the name to check, may be null
     * @return true when the name starts with an uppercase letter
     */
    public static boolean isCapitalized(final String name) {
        return name != null && !name.isEmpty()
                && Character.isUpperCase(name.charAt(0));
    }

    /**
     * Returns the tag name of a markup element, or an empty string for
     * fragments and other nodes.
     *
     * @param node the node, may be null
     * @return the element name, never null
     */
    public static String elementName(final SyntaxNode node) {
        if (node == null || !node.is(SyntaxKind.JSX_ELEMENT)
                || node.name() == null) {
            return "";
        }
        return node.name();
    }

    /**
     * Returns the dotted name of an identifier or member chain, such as
     * {@code Icons.Home} or {@code React.memo}.
     *
     * @param node the node, may be null
     * @return the dotted name, or null for computed members and other
     *         expressions
     */
    public static String dottedName(final SyntaxNode node) {
        if (node == null) {
            return null;
        }
        if (node.is(SyntaxKind.IDENTIFIER)) {
            return node.name();
        }
        if (node.is(SyntaxKind.MEMBER) && node.name() != null) {
            final SyntaxNode object = node.field("object");
            if (object != null && "ThisKeyword".equals(object.rawKind())) {
                return "this." + node.name();
            }
            final String objectName = dottedName(object);
            return objectName == null ? null : objectName + "." + node.name();
        }
        return null;
    }

    /**
     * Checks whether an expression or statement produces markup.
     *
     * <p>Markup elements and fragments do; conditionals, logical and
     * binary expressions, arrays, expression containers and member chains
     * do when one of their operands does; calls do when an argument does
     * ({@code items.map(i => <Row/>)}); functions and blocks do when one
     * of their returns does.</p>
     *
     * @param node the node to inspect, may be null
     * @return true when markup can be produced
     */
    public static boolean containsMarkup(final SyntaxNode node) {
        if (node == null) {
            return false;
        }
        switch (node.kind()) {
            case JSX_ELEMENT:
            case JSX_FRAGMENT:
                return true;
            case CONDITIONAL:
                return containsMarkup(node.field("consequent"))
                        || containsMarkup(node.field("alternate"));
            case LOGICAL:
            case BINARY:
                return containsMarkup(node.field("left"))
                        || containsMarkup(node.field("right"));
            case ARRAY:
            case CALL:
                return anyContainsMarkup(node);
            case SPREAD:
            case JSX_EXPRESSION_CONTAINER:
                return containsMarkup(node.field("expression"));
            case RETURN:
                return containsMarkup(node.field("argument"));
            case BLOCK:
                return anyContainsMarkup(node);
            case ARROW_FUNCTION:
            case FUNCTION_EXPRESSION:
            case FUNCTION_DECLARATION:
                return containsMarkup(node.field("body"));
            case MEMBER:
                return containsMarkup(node.field("object"));
            default:
                return false;
        }
    }

    private static boolean anyContainsMarkup(final SyntaxNode node) {
        for (final SyntaxNode child : node.children()) {
            if (containsMarkup(child)) {
                return true;
            }
        }
        return false;
    }
}
