package co.fanki.provenance.analysis.domain;

import co.fanki.provenance.analysis.domain.babel.JsNode;
import co.fanki.provenance.analysis.domain.babel.SpanFactory;
import co.fanki.provenance.shared.Preconditions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Records the identifier and member reads an expression depends on.
 *
 * <p>Identifier reads follow the identifier's initializer so that reads
 * nested in a local declaration are attributed to the expression using
 * it. Each initializer is followed once per collection, and nesting is
 * bounded by {@link #MAX_DEPTH}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SymbolReferenceCollector {

    /** Deepest nesting level that is still collected. */
    static final int MAX_DEPTH = 32;

    private final BindingTable bindings;

    private final SpanFactory spans;

    /**
     * Creates a collector for one module.
     *
     * @param theBindings the fully populated binding table of the module
     * @param theSpans the span factory of the module
     */
    public SymbolReferenceCollector(final BindingTable theBindings,
            final SpanFactory theSpans) {
        this.bindings = Preconditions.requireNonNull(theBindings,
                "Binding table is required");
        this.spans = Preconditions.requireNonNull(theSpans,
                "Span factory is required");
    }

    /**
     * Collects the symbol reads of an expression.
     *
     * @param expr the expression
     * @return the reads in discovery order
     */
    public List<SymbolRef> collectSymbolRefs(final JsNode expr) {
        final List<SymbolRef> refs = new ArrayList<>();
        collect(expr, refs, 0, new HashSet<>());
        return refs;
    }

    /**
     * Appends the symbol reads of an expression.
     *
     * @param expr the expression, ignored when null
     * @param refs the list to extend
     * @param depth the current nesting level
     * @param followed identifiers whose initializer was already followed
     */
    void collect(final JsNode expr, final List<SymbolRef> refs,
            final int depth, final Set<String> followed) {
        if (expr == null || depth > MAX_DEPTH) {
            return;
        }

        if (expr.is("Identifier")) {
            final String name = expr.name();
            refs.add(new SymbolRef(spans.file(), name, "", spans.of(expr)));
            if (followed.add(name)) {
                bindings.lookup(name)
                        .filter(Binding::hasInit)
                        .ifPresent(b -> collect(b.init(), refs, depth + 1,
                                followed));
            }
        } else if (StaticMemberPathResolver.isMemberAccess(expr)) {
            StaticMemberPathResolver.resolve(expr).ifPresent(path ->
                    refs.add(new SymbolRef(spans.file(), path.root(),
                            path.path(), spans.of(expr))));
            collect(expr.child("object"), refs, depth + 1, followed);
            final JsNode property = expr.child("property");
            if (expr.flag("computed") && property != null
                    && !property.is("PrivateName")) {
                collect(property, refs, depth + 1, followed);
            }
        } else if (expr.isAnyOf("CallExpression", "OptionalCallExpression")) {
            final JsNode callee = expr.child("callee");
            if (callee != null
                    && !callee.isAnyOf("Super", "V8IntrinsicIdentifier")) {
                collect(callee, refs, depth + 1, followed);
            }
            for (final JsNode argument : expr.children("arguments")) {
                if (argument == null || argument.isAnyOf("SpreadElement",
                        "ArgumentPlaceholder")) {
                    continue;
                }
                collect(argument, refs, depth + 1, followed);
            }
        }
    }
}
