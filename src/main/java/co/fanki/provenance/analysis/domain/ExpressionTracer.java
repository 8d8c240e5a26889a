package co.fanki.provenance.analysis.domain;

import co.fanki.provenance.analysis.domain.babel.JsNode;
import co.fanki.provenance.analysis.domain.babel.SpanFactory;
import co.fanki.provenance.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks an expression back to the places its value comes from.
 *
 * <p>Each visited sub-expression appends one or more nodes to a
 * {@link ProvenanceChain}: literals, identifiers and the initializers
 * they are bound to, imports, property accesses, calls, operators,
 * environment variable reads. Identifiers are followed through the
 * module's {@link BindingTable}, so a value can be traced across local
 * declarations to the literal or import that produced it.</p>
 *
 * <p>The walk is bounded: it stops descending past
 * {@link #MAX_DEPTH} nested levels or once the chain is full, and an
 * identifier is expanded at most once per trace. It always returns,
 * whatever the shape of the input.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ExpressionTracer {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExpressionTracer.class);

    /** Deepest nesting level that is still expanded. */
    public static final int MAX_DEPTH = 8;

    private final BindingTable bindings;

    private final SpanFactory spans;

    /**
     * Creates a tracer for one module.
     *
     * @param theBindings the fully populated binding table of the module
     * @param theSpans the span factory of the module
     */
    public ExpressionTracer(final BindingTable theBindings,
            final SpanFactory theSpans) {
        this.bindings = Preconditions.requireNonNull(theBindings,
                "Binding table is required");
        this.spans = Preconditions.requireNonNull(theSpans,
                "Span factory is required");
    }

    /**
     * Traces an expression into a fresh chain.
     *
     * @param expr the expression to trace
     * @return the provenance chain
     */
    public ProvenanceChain trace(final JsNode expr) {
        final ProvenanceChain chain = new ProvenanceChain();
        traceExpression(expr, chain, 0, new HashSet<>());
        return chain;
    }

    /**
     * Appends the provenance of an expression to a chain.
     *
     * @param expr the expression, ignored when null
     * @param chain the chain to extend
     * @param depth the current nesting level, 0 for the traced root
     * @param seen identifiers already expanded in this trace
     */
    public void traceExpression(final JsNode expr,
            final ProvenanceChain chain, final int depth,
            final Set<String> seen) {

        if (expr == null) {
            return;
        }
        if (depth > MAX_DEPTH || chain.isFull()) {
            chain.markTruncated();
            LOG.debug("Trace bound reached at {} (depth {}, {} nodes)",
                    spans.of(expr), depth, chain.size());
            return;
        }

        switch (expr.type()) {
            case "StringLiteral" -> chain.append(ProvenanceNode.literal(
                    spans.of(expr), LiteralKind.STRING));
            case "NumericLiteral", "BigIntLiteral" -> chain.append(
                    ProvenanceNode.literal(spans.of(expr), LiteralKind.NUMBER));
            case "BooleanLiteral", "NullLiteral" -> chain.append(
                    ProvenanceNode.literal(spans.of(expr), LiteralKind.OTHER));
            case "Identifier" -> traceIdentifier(expr, chain, depth, seen);
            case "MemberExpression", "OptionalMemberExpression" ->
                    traceMember(expr, chain, depth, seen);
            case "CallExpression", "OptionalCallExpression" ->
                    traceCall(expr, chain, depth, seen);
            case "NewExpression" -> traceConstructor(expr, chain, depth, seen);
            case "TemplateLiteral" -> {
                chain.append(ProvenanceNode.op(spans.of(expr), "template"));
                for (final JsNode part : expr.children("expressions")) {
                    traceExpression(part, chain, depth + 1, seen);
                }
            }
            case "BinaryExpression" -> traceOperands(expr,
                    "binary:" + expr.text("operator"), chain, depth, seen,
                    "left", "right");
            case "LogicalExpression" -> traceOperands(expr,
                    "logical:" + expr.text("operator"), chain, depth, seen,
                    "left", "right");
            case "UnaryExpression" -> traceOperands(expr,
                    "unary:" + expr.text("operator"), chain, depth, seen,
                    "argument");
            case "UpdateExpression" -> traceOperands(expr, "update", chain,
                    depth, seen, "argument");
            case "ConditionalExpression" -> traceOperands(expr, "cond", chain,
                    depth, seen, "test", "consequent", "alternate");
            case "ObjectExpression" -> traceObject(expr, chain, depth, seen);
            case "ArrayExpression" -> traceArray(expr, chain, depth, seen);
            default -> chain.append(ProvenanceNode.unknown(spans.of(expr)));
        }
    }

    private void traceIdentifier(final JsNode ident,
            final ProvenanceChain chain, final int depth,
            final Set<String> seen) {

        final String name = ident.name();
        chain.append(ProvenanceNode.ident(spans.of(ident), name));

        if (!seen.add(name)) {
            return;
        }

        final Optional<Binding> binding = bindings.lookup(name);
        if (binding.isEmpty()) {
            return;
        }
        final Binding bound = binding.get();
        if (bound.hasInit()) {
            chain.append(ProvenanceNode.init(spans.of(bound.init())));
            traceExpression(bound.init(), chain, depth + 1, seen);
        }
        if (bound.isImport()) {
            chain.append(ProvenanceNode.importOf(bound.definingSpan(),
                    bound.importInfo().source(),
                    bound.importInfo().imported()));
        }
    }

    private void traceMember(final JsNode member,
            final ProvenanceChain chain, final int depth,
            final Set<String> seen) {

        final String envKey = envKey(member);
        if (envKey != null) {
            chain.append(ProvenanceNode.env(spans.of(member), envKey));
            return;
        }

        chain.append(ProvenanceNode.member(spans.of(member)));
        traceExpression(member.child("object"), chain, depth + 1, seen);

        final JsNode property = member.child("property");
        if (member.flag("computed") && property != null
                && !property.is("PrivateName")) {
            traceExpression(property, chain, depth + 1, seen);
        }
    }

    private void traceCall(final JsNode call, final ProvenanceChain chain,
            final int depth, final Set<String> seen) {

        final JsNode callee = call.child("callee");
        String calleeName = ProvenanceNode.EXPR_CALLEE;
        String calleeSpan = spans.of(call);
        String fnDefSpan = null;

        if (callee != null && callee.is("Identifier")) {
            calleeName = callee.name();
            calleeSpan = spans.of(callee);
            fnDefSpan = bindings.lookup(calleeName)
                    .map(b -> b.fnBodySpan() != null
                            ? b.fnBodySpan() : b.definingSpan())
                    .orElse(null);
        } else if (StaticMemberPathResolver.isMemberAccess(callee)) {
            calleeName = ProvenanceNode.MEMBER_CALLEE;
            calleeSpan = spans.of(callee);
        }

        chain.append(ProvenanceNode.call(spans.of(call), calleeName,
                calleeSpan, fnDefSpan));
        traceArguments(call.children("arguments"), chain, depth, seen);
    }

    private void traceConstructor(final JsNode newExpr,
            final ProvenanceChain chain, final int depth,
            final Set<String> seen) {

        final JsNode callee = newExpr.child("callee");
        final String calleeName = callee != null && callee.is("Identifier")
                ? callee.name()
                : ProvenanceNode.EXPR_CALLEE;

        chain.append(ProvenanceNode.ctor(spans.of(newExpr), calleeName));
        traceArguments(newExpr.children("arguments"), chain, depth, seen);
    }

    private void traceArguments(final List<JsNode> arguments,
            final ProvenanceChain chain, final int depth,
            final Set<String> seen) {
        for (final JsNode argument : arguments) {
            if (argument == null
                    || argument.isAnyOf("SpreadElement", "ArgumentPlaceholder")) {
                continue;
            }
            traceExpression(argument, chain, depth + 1, seen);
        }
    }

    private void traceOperands(final JsNode expr, final String op,
            final ProvenanceChain chain, final int depth,
            final Set<String> seen, final String... operandFields) {
        chain.append(ProvenanceNode.op(spans.of(expr), op));
        for (final String field : operandFields) {
            traceExpression(expr.child(field), chain, depth + 1, seen);
        }
    }

    private void traceObject(final JsNode object,
            final ProvenanceChain chain, final int depth,
            final Set<String> seen) {

        for (final JsNode property : object.children("properties")) {
            if (property == null || !property.is("ObjectProperty")
                    || property.flag("computed")) {
                continue;
            }
            final JsNode keyNode = property.child("key");
            final String key = staticKey(keyNode);
            if (key == null) {
                continue;
            }
            chain.append(ProvenanceNode.objectProp(spans.of(keyNode), key));
            traceExpression(property.child("value"), chain, depth + 1, seen);
        }
    }

    private void traceArray(final JsNode array, final ProvenanceChain chain,
            final int depth, final Set<String> seen) {

        final List<JsNode> elements = array.children("elements");
        for (int index = 0; index < elements.size(); index++) {
            final JsNode element = elements.get(index);
            if (element == null || element.is("SpreadElement")) {
                continue;
            }
            chain.append(ProvenanceNode.arrayElem(spans.of(element), index));
            traceExpression(element, chain, depth + 1, seen);
        }
    }

    /**
     * Returns the key of an object property when it is written as an
     * identifier, a string literal or a numeric literal.
     *
     * @param key the property key node, may be null
     * @return the key text, or null for any other key shape
     */
    static String staticKey(final JsNode key) {
        if (key == null) {
            return null;
        }
        return switch (key.type()) {
            case "Identifier" -> key.name();
            case "StringLiteral" -> key.text("value");
            case "NumericLiteral" -> key.numberText();
            default -> null;
        };
    }

    /**
     * Matches {@code process.env.X} and {@code import.meta.env.X}.
     *
     * @param member a member expression
     * @return the variable name X, or null when the pattern does not match
     */
    private static String envKey(final JsNode member) {
        final JsNode property = member.child("property");
        final JsNode object = member.child("object");
        if (member.flag("computed") || property == null
                || !property.is("Identifier")
                || !StaticMemberPathResolver.isMemberAccess(object)) {
            return null;
        }

        final JsNode envProperty = object.child("property");
        if (object.flag("computed") || envProperty == null
                || !envProperty.is("Identifier")
                || !"env".equals(envProperty.name())) {
            return null;
        }

        final JsNode root = object.child("object");
        if (root == null) {
            return null;
        }
        if (root.is("Identifier") && "process".equals(root.name())) {
            return property.name();
        }
        if (root.is("MetaProperty")) {
            final JsNode meta = root.child("meta");
            final JsNode metaProperty = root.child("property");
            if (meta != null && "import".equals(meta.name())
                    && metaProperty != null
                    && "meta".equals(metaProperty.name())) {
                return property.name();
            }
        }
        return null;
    }
}
