package co.fanki.provenance.analysis.domain;

import co.fanki.provenance.analysis.domain.babel.JsNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Resolves property-access chains whose shape is fully known statically.
 *
 * <p>Static property names become {@code .name}, computed string literal
 * properties become {@code ["literal"]} and computed numeric literal
 * properties become {@code [n]}. Any other computed property, a private
 * name, or a root that is not a plain identifier ({@code this}, a call
 * result, ...) makes the chain unresolvable.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class StaticMemberPathResolver {

    private StaticMemberPathResolver() {
    }

    /**
     * Resolves an identifier or a member-access chain.
     *
     * @param expr the expression, may be null
     * @return the root and path, empty when the chain is not static
     */
    public static Optional<MemberPath> resolve(final JsNode expr) {
        if (expr == null) {
            return Optional.empty();
        }
        final Deque<String> parts = new ArrayDeque<>();
        JsNode current = expr;
        while (isMemberAccess(current)) {
            final String part = segment(current);
            if (part == null) {
                return Optional.empty();
            }
            parts.addFirst(part);
            current = current.child("object");
            if (current == null) {
                return Optional.empty();
            }
        }
        if (!current.is("Identifier")) {
            return Optional.empty();
        }
        return Optional.of(new MemberPath(current.name(),
                String.join("", parts)));
    }

    /**
     * Checks whether a node is a property access, optional or not.
     *
     * @param node the node, may be null
     * @return true for member and optional member expressions
     */
    public static boolean isMemberAccess(final JsNode node) {
        return node != null
                && node.isAnyOf("MemberExpression", "OptionalMemberExpression");
    }

    private static String segment(final JsNode member) {
        final JsNode property = member.child("property");
        if (property == null) {
            return null;
        }
        if (!member.flag("computed")) {
            return property.is("Identifier") ? "." + property.name() : null;
        }
        if (property.is("StringLiteral")) {
            return "[\"" + property.text("value") + "\"]";
        }
        if (property.is("NumericLiteral")) {
            return "[" + property.numberText() + "]";
        }
        return null;
    }
}
