package co.fanki.componentflow.analysis.domain.ast;

import co.fanki.componentflow.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable node of a parsed source file.
 *
 * <p>Offsets are UTF-16 code unit offsets into the original text, so
 * {@link #text(String)} can slice the exact source of any node. Named
 * sub-nodes live in {@link #field(String)}; ordered ones (statements,
 * markup children, call arguments, switch cases) in
 * {@link #children()}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SyntaxNode {

    private final SyntaxKind kind;
    private final String rawKind;
    private final int start;
    private final int end;
    private final int line;
    private final int column;
    private final String name;
    private final String operator;
    private final String value;
    private final String flags;
    private final Map<String, SyntaxNode> fields;
    private final List<SyntaxNode> children;

    private SyntaxNode(final String theRawKind, final int theStart,
            final int theEnd, final int theLine, final int theColumn,
            final String theName, final String theOperator,
            final String theValue, final String theFlags,
            final Map<String, SyntaxNode> theFields,
            final List<SyntaxNode> theChildren) {
        this.rawKind = Preconditions.requireNonNull(theRawKind,
                "Node kind is required");
        this.kind = SyntaxKind.fromCode(theRawKind);
        this.start = theStart;
        this.end = theEnd;
        this.line = theLine;
        this.column = theColumn;
        this.name = theName;
        this.operator = theOperator;
        this.value = theValue;
        this.flags = theFlags;
        this.fields = Collections.unmodifiableMap(theFields);
        this.children = Collections.unmodifiableList(theChildren);
    }

    /**
     * Builds a node tree from the JSON produced by the syntax engine.
     *
     * @param json the JSON node, never null
     * @return the root syntax node
     */
    public static SyntaxNode fromJson(final JsonNode json) {
        Preconditions.requireNonNull(json, "JSON tree is required");

        final Map<String, SyntaxNode> fields = new LinkedHashMap<>();
        final JsonNode fieldsJson = json.get("f");
        if (fieldsJson != null && fieldsJson.isObject()) {
            final Iterator<Map.Entry<String, JsonNode>> it =
                    fieldsJson.fields();
            while (it.hasNext()) {
                final Map.Entry<String, JsonNode> entry = it.next();
                fields.put(entry.getKey(), fromJson(entry.getValue()));
            }
        }

        final List<SyntaxNode> children = new ArrayList<>();
        final JsonNode childrenJson = json.get("ch");
        if (childrenJson != null && childrenJson.isArray()) {
            for (final JsonNode child : childrenJson) {
                children.add(fromJson(child));
            }
        }

        return new SyntaxNode(
                json.path("k").asText(SyntaxKind.OTHER.code()),
                json.path("s").asInt(0),
                json.path("e").asInt(0),
                Math.max(1, json.path("l").asInt(1)),
                Math.max(0, json.path("c").asInt(0)),
                textOrNull(json, "n"),
                textOrNull(json, "op"),
                textOrNull(json, "v"),
                textOrNull(json, "x"),
                fields,
                children);
    }

    private static String textOrNull(final JsonNode json, final String key) {
        final JsonNode node = json.get(key);
        return node == null || node.isNull() ? null : node.asText();
    }

    public SyntaxKind kind() {
        return kind;
    }

    /**
     * Returns the kind as reported by the engine, useful for
     * {@link SyntaxKind#OTHER} nodes.
     *
     * @return the raw kind, never null
     */
    public String rawKind() {
        return rawKind;
    }

    /**
     * Checks the kind of this node.
     *
     * @param expected the kind to compare with
     * @return true when this node has the expected kind
     */
    public boolean is(final SyntaxKind expected) {
        return kind == expected;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    /**
     * Returns where this node starts.
     *
     * @return the position, never null
     */
    public SourcePosition position() {
        return new SourcePosition(line, column);
    }

    /**
     * The identifier, tag or declaration name, when the kind has one.
     *
     * @return the name or null
     */
    public String name() {
        return name;
    }

    public String operator() {
        return operator;
    }

    /**
     * The literal value: import module path, string or text content.
     *
     * @return the value or null
     */
    public String value() {
        return value;
    }

    /**
     * Declaration flags: {@code default}, {@code export} or {@code type}.
     *
     * @return the flags or null
     */
    public String flags() {
        return flags;
    }

    /**
     * Returns a named sub-node.
     *
     * @param fieldName the field name, such as {@code test} or
     *        {@code body}
     * @return the sub-node or null when absent
     */
    public SyntaxNode field(final String fieldName) {
        return fields.get(fieldName);
    }

    /**
     * Checks whether a named sub-node is present.
     *
     * @param fieldName the field name
     * @return true when present
     */
    public boolean has(final String fieldName) {
        return fields.containsKey(fieldName);
    }

    public List<SyntaxNode> children() {
        return children;
    }

    /**
     * Slices the source text covered by this node.
     *
     * @param source the full text of the file this node was parsed from
     * @return the node's text, empty when the offsets fall outside
     */
    public String text(final String source) {
        if (source == null || start < 0 || end > source.length()
                || start > end) {
            return "";
        }
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return rawKind + (name != null ? "(" + name + ")" : "")
                + "@" + line + ":" + column;
    }
}
