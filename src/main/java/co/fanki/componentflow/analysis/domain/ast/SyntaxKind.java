package co.fanki.componentflow.analysis.domain.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * The node kinds produced by the syntax engine.
 *
 * <p>Only the kinds the flow analysis inspects are named; everything else
 * maps to {@link #OTHER} and keeps its raw kind on the node.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum SyntaxKind {

    PROGRAM("Program"),
    IMPORT("Import"),
    IMPORT_DEFAULT("ImportDefault"),
    IMPORT_NAMESPACE("ImportNamespace"),
    IMPORT_SPECIFIER("ImportSpecifier"),
    EXPORT_DEFAULT("ExportDefault"),
    FUNCTION_DECLARATION("FunctionDeclaration"),
    FUNCTION_EXPRESSION("FunctionExpression"),
    ARROW_FUNCTION("ArrowFunction"),
    VARIABLE_DECLARATION("VariableDeclaration"),
    VARIABLE_DECLARATOR("VariableDeclarator"),
    BLOCK("Block"),
    RETURN("Return"),
    IF("If"),
    SWITCH("Switch"),
    CASE("Case"),
    EXPRESSION_STATEMENT("ExpressionStatement"),
    TRY("Try"),
    LOOP("Loop"),
    LABELED("Labeled"),
    JSX_ELEMENT("JsxElement"),
    JSX_FRAGMENT("JsxFragment"),
    JSX_TEXT("JsxText"),
    JSX_EXPRESSION_CONTAINER("JsxExpressionContainer"),
    JSX_ATTRIBUTES("JsxAttributes"),
    JSX_ATTRIBUTE("JsxAttribute"),
    JSX_SPREAD_ATTRIBUTE("JsxSpreadAttribute"),
    CONDITIONAL("Conditional"),
    LOGICAL("Logical"),
    BINARY("Binary"),
    CALL("Call"),
    MEMBER("Member"),
    IDENTIFIER("Identifier"),
    ARRAY("Array"),
    SPREAD("Spread"),
    STRING_LITERAL("StringLiteral"),
    NUMERIC_LITERAL("NumericLiteral"),
    NULL("Null"),
    BOOLEAN_LITERAL("BooleanLiteral"),
    OTHER("Other");

    private static final Map<String, SyntaxKind> BY_CODE = new HashMap<>();

    static {
        for (final SyntaxKind kind : values()) {
            BY_CODE.put(kind.code, kind);
        }
    }

    private final String code;

    SyntaxKind(final String theCode) {
        this.code = theCode;
    }

    /**
     * Returns the kind code used in the engine's JSON tree.
     *
     * @return the kind code, never null
     */
    public String code() {
        return code;
    }

    /**
     * Resolves a kind code, falling back to {@link #OTHER}.
     *
     * @param code the code from the JSON tree, may be null
     * @return the matching kind, never null
     */
    public static SyntaxKind fromCode(final String code) {
        if (code == null) {
            return OTHER;
        }
        return BY_CODE.getOrDefault(code, OTHER);
    }

    /**
     * Whether this kind introduces a new function scope.
     *
     * @return true for declarations, expressions and arrows
     */
    public boolean isFunction() {
        return this == FUNCTION_DECLARATION
                || this == FUNCTION_EXPRESSION
                || this == ARROW_FUNCTION;
    }

    /**
     * Whether this kind is a markup element or fragment.
     *
     * @return true for JSX elements and fragments
     */
    public boolean isMarkup() {
        return this == JSX_ELEMENT || this == JSX_FRAGMENT;
    }
}
