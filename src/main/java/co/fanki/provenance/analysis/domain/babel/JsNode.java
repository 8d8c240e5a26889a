package co.fanki.provenance.analysis.domain.babel;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view over one node of a Babel AST JSON document.
 *
 * <p>Babel emits every node as a JSON object with a {@code type} field,
 * named child fields, and a {@code loc} block holding 1-indexed line
 * numbers. This wrapper exposes those fields with null-tolerant accessors
 * so the analyzers can pattern-match on node types without dealing with
 * Jackson's missing and null nodes.</p>
 *
 * <p>Wrappers are created on demand and carry no identity of their own;
 * compare {@link #json()} when identity matters.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class JsNode {

    /** Fields that carry metadata rather than child nodes. */
    private static final Set<String> METADATA_FIELDS = Set.of(
            "type", "loc", "start", "end", "range", "extra",
            "leadingComments", "trailingComments", "innerComments",
            "comments", "tokens");

    private final JsonNode json;

    private JsNode(final JsonNode theJson) {
        this.json = theJson;
    }

    /**
     * Wraps a JSON value as an AST node.
     *
     * @param json the JSON value, may be null
     * @return the node, or null if the value is not an object with a type
     */
    public static JsNode of(final JsonNode json) {
        if (json == null || !json.isObject() || !json.hasNonNull("type")) {
            return null;
        }
        return new JsNode(json);
    }

    /** Returns the Babel node type, e.g. {@code MemberExpression}. */
    public String type() {
        return json.get("type").asText();
    }

    /**
     * Checks the node type.
     *
     * @param type the expected type
     * @return true if this node has the given type
     */
    public boolean is(final String type) {
        return type().equals(type);
    }

    /**
     * Checks the node type against several candidates.
     *
     * @param types the accepted types
     * @return true if this node has any of the given types
     */
    public boolean isAnyOf(final String... types) {
        final String actual = type();
        for (final String type : types) {
            if (actual.equals(type)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a single child node.
     *
     * @param field the field name
     * @return the child, or null when absent or not a node
     */
    public JsNode child(final String field) {
        return of(json.get(field));
    }

    /**
     * Returns a list-valued child field.
     *
     * <p>Holes (e.g. the elided slot in {@code [a, , b]}) are kept as null
     * entries so positional indexes stay aligned with the source.</p>
     *
     * @param field the field name
     * @return the children, empty when the field is absent
     */
    public List<JsNode> children(final String field) {
        final JsonNode array = json.get(field);
        if (array == null || !array.isArray()) {
            return List.of();
        }
        final List<JsNode> result = new ArrayList<>(array.size());
        for (final JsonNode element : array) {
            result.add(of(element));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns every direct child node in field order.
     *
     * <p>Used by the generic traversal. Metadata such as {@code loc} and
     * comments is skipped.</p>
     *
     * @return the child nodes, never null
     */
    public List<JsNode> childNodes() {
        final List<JsNode> result = new ArrayList<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (METADATA_FIELDS.contains(field.getKey())) {
                continue;
            }
            final JsonNode value = field.getValue();
            if (value.isArray()) {
                for (final JsonNode element : value) {
                    final JsNode node = of(element);
                    if (node != null) {
                        result.add(node);
                    }
                }
            } else {
                final JsNode node = of(value);
                if (node != null) {
                    result.add(node);
                }
            }
        }
        return result;
    }

    /**
     * Returns a textual field.
     *
     * @param field the field name
     * @return the text, or null when absent or not a string
     */
    public String text(final String field) {
        final JsonNode value = json.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    /** Returns the {@code name} field of identifiers and JSX names. */
    public String name() {
        return text("name");
    }

    /**
     * Returns a boolean field.
     *
     * @param field the field name
     * @return the flag, false when absent
     */
    public boolean flag(final String field) {
        return json.path(field).asBoolean(false);
    }

    /**
     * Renders the {@code value} of a numeric literal the way JavaScript's
     * {@code String(n)} would for the common cases: integral values print
     * without a fraction.
     *
     * @return the number text, or null when there is no numeric value
     */
    public String numberText() {
        final JsonNode value = json.get("value");
        if (value == null) {
            return null;
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (!value.isNumber()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.asText();
        }
        final double number = value.asDouble();
        if (number == Math.rint(number) && Math.abs(number) < 1e21) {
            return String.valueOf((long) number);
        }
        return String.valueOf(number);
    }

    /**
     * Returns the 1-indexed start line of this node.
     *
     * @return the line, or 0 when the node carries no location
     */
    public int line() {
        final JsonNode line = json.path("loc").path("start").path("line");
        return line.isNumber() ? line.asInt() : 0;
    }

    /** Returns the underlying JSON object. */
    public JsonNode json() {
        return json;
    }

    @Override
    public String toString() {
        return type() + "@" + line();
    }
}
