package co.fanki.componentflow.analysis.domain.returns;

import co.fanki.componentflow.analysis.domain.ast.SyntaxKind;
import co.fanki.componentflow.analysis.domain.ast.SyntaxNode;
import co.fanki.componentflow.analysis.domain.conditional.ElementClassifier;
import co.fanki.componentflow.analysis.domain.conditional.ReturnStatements;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Finds the component functions of a parsed file.
 *
 * <p>A component is a function declaration, or a variable initialized
 * with an arrow or function expression, at any depth, whose name is
 * capitalized and which returns markup. Default-exported functions need
 * no name. {@code memo} and {@code forwardRef} wrappers, bare or through
 * {@code React.}, are unwrapped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ComponentDefinitionFinder {

    private static final Set<String> WRAPPERS = Set.of(
            "memo", "forwardRef", "React.memo", "React.forwardRef");

    private static final List<String> NESTED_FIELDS = List.of("body",
            "init", "expression", "consequent", "alternate", "block",
            "handler", "finalizer");

    /**
     * Lists the components of a file.
     *
     * @param program the program node, never null
     * @return the components found
     */
    public FileComponents find(final SyntaxNode program) {
        final List<ComponentFunction> components = new ArrayList<>();
        final String[] defaultExportName = new String[1];
        visit(program, components, defaultExportName);
        return new FileComponents(components, defaultExportName[0]);
    }

    /**
     * Checks whether a function renders markup through any of its exits.
     *
     * @param function the function node
     * @return true when an exit produces markup
     */
    public static boolean rendersMarkup(final SyntaxNode function) {
        final SyntaxNode body = function.field("body");
        if (body == null) {
            return false;
        }
        if (body.is(SyntaxKind.BLOCK)) {
            return ReturnStatements.hasMarkupReturn(body);
        }
        return ElementClassifier.containsMarkup(body);
    }

    private void visit(final SyntaxNode node,
            final List<ComponentFunction> components,
            final String[] defaultExportName) {

        switch (node.kind()) {
            case FUNCTION_DECLARATION: {
                final boolean isDefault = "default".equals(node.flags());
                if ((isDefault || ElementClassifier.isCapitalized(node.name()))
                        && rendersMarkup(node)) {
                    components.add(new ComponentFunction(
                            node.name(), node, isDefault));
                }
                break;
            }
            case VARIABLE_DECLARATOR: {
                final SyntaxNode init = unwrapWrappers(node.field("init"));
                if (init != null && init.kind().isFunction()
                        && ElementClassifier.isCapitalized(node.name())
                        && rendersMarkup(init)) {
                    components.add(new ComponentFunction(
                            node.name(), init, false));
                    visitChildren(init, components, defaultExportName);
                    return;
                }
                break;
            }
            case EXPORT_DEFAULT: {
                final SyntaxNode exported =
                        unwrapWrappers(node.field("expression"));
                if (exported != null && exported.is(SyntaxKind.IDENTIFIER)) {
                    defaultExportName[0] = exported.name();
                    return;
                }
                if (exported != null && exported.kind().isFunction()
                        && rendersMarkup(exported)) {
                    components.add(new ComponentFunction(
                            exported.name(), exported, true));
                    visitChildren(exported, components, defaultExportName);
                    return;
                }
                break;
            }
            default:
                break;
        }
        visitChildren(node, components, defaultExportName);
    }

    private void visitChildren(final SyntaxNode node,
            final List<ComponentFunction> components,
            final String[] defaultExportName) {
        for (final SyntaxNode child : node.children()) {
            visit(child, components, defaultExportName);
        }
        for (final String field : NESTED_FIELDS) {
            final SyntaxNode child = node.field(field);
            if (child != null) {
                visit(child, components, defaultExportName);
            }
        }
    }

    private static SyntaxNode unwrapWrappers(final SyntaxNode node) {
        SyntaxNode current = node;
        while (current != null && current.is(SyntaxKind.CALL)
                && WRAPPERS.contains(
                        ElementClassifier.dottedName(current.field("callee")))
                && !current.children().isEmpty()) {
            current = current.children().get(0);
        }
        return current;
    }
}
