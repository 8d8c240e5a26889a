package co.fanki.provenance.analysis.domain;

import co.fanki.provenance.analysis.domain.babel.AstWalker;
import co.fanki.provenance.analysis.domain.babel.JsNode;
import co.fanki.provenance.analysis.domain.babel.SpanFactory;
import co.fanki.provenance.shared.Preconditions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Traces the data every JSX element of a module renders.
 *
 * <p>An element renders the expressions in its expression-container
 * children and in its expression-container attribute values. All of
 * them are traced into one chain per element, which is then ranked and
 * summarized. Elements without rendered expressions are skipped, as are
 * elements whose name is in the skip list.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class JsxElementTracer {

    private final ExpressionTracer tracer;

    private final SymbolReferenceCollector symbolRefs;

    private final SpanFactory spans;

    private final Set<String> skippedElements;

    /**
     * Creates a JSX element tracer.
     *
     * @param theTracer the module's expression tracer
     * @param theSymbolRefs the module's symbol reference collector
     * @param theSpans the span factory of the module
     * @param theSkippedElements element names never traced
     */
    public JsxElementTracer(final ExpressionTracer theTracer,
            final SymbolReferenceCollector theSymbolRefs,
            final SpanFactory theSpans,
            final Set<String> theSkippedElements) {
        this.tracer = Preconditions.requireNonNull(theTracer,
                "Expression tracer is required");
        this.symbolRefs = Preconditions.requireNonNull(theSymbolRefs,
                "Symbol reference collector is required");
        this.spans = Preconditions.requireNonNull(theSpans,
                "Span factory is required");
        this.skippedElements = Set.copyOf(theSkippedElements);
    }

    /**
     * Traces every JSX element of a module.
     *
     * @param program the module's Program node
     * @return one entry per element rendering at least one expression,
     *         in source order
     */
    public List<ElementProvenance> traceElements(final JsNode program) {
        final List<ElementProvenance> result = new ArrayList<>();
        AstWalker.walk(program, node -> {
            if (node.is("JSXElement")) {
                final ElementProvenance element = traceElement(node);
                if (element != null) {
                    result.add(element);
                }
            }
        });
        return result;
    }

    /**
     * Traces one JSX element.
     *
     * @param element a JSXElement node
     * @return the element provenance, or null when the element is skipped
     *         or renders no expression
     */
    public ElementProvenance traceElement(final JsNode element) {
        final JsNode opening = element.child("openingElement");
        if (opening == null) {
            return null;
        }
        final String name = elementName(opening.child("name"));
        if (name == null || skippedElements.contains(name)) {
            return null;
        }

        final List<JsNode> rendered = renderedExpressions(element, opening);
        if (rendered.isEmpty()) {
            return null;
        }

        final ProvenanceChain chain = new ProvenanceChain();
        final Set<String> seen = new HashSet<>();
        final List<SymbolRef> refs = new ArrayList<>();
        for (final JsNode expr : rendered) {
            tracer.traceExpression(expr, chain, 0, seen);
            refs.addAll(symbolRefs.collectSymbolRefs(expr));
        }

        return new ElementProvenance(name, spans.of(opening), chain,
                CandidateRanker.rankCandidates(chain),
                CandidateRanker.aggregateKinds(chain), List.copyOf(refs));
    }

    private static List<JsNode> renderedExpressions(final JsNode element,
            final JsNode opening) {
        final List<JsNode> result = new ArrayList<>();
        for (final JsNode attribute : opening.children("attributes")) {
            if (attribute != null && attribute.is("JSXAttribute")) {
                addContained(attribute.child("value"), result);
            }
        }
        for (final JsNode child : element.children("children")) {
            addContained(child, result);
        }
        return result;
    }

    private static void addContained(final JsNode container,
            final List<JsNode> result) {
        if (container == null || !container.is("JSXExpressionContainer")) {
            return;
        }
        final JsNode expr = container.child("expression");
        if (expr != null && !expr.is("JSXEmptyExpression")) {
            result.add(expr);
        }
    }

    /**
     * Renders a JSX element name: {@code div}, {@code ui.Card} or
     * {@code svg:path}.
     *
     * @param name the name node
     * @return the name, or null when the node is missing
     */
    static String elementName(final JsNode name) {
        if (name == null) {
            return null;
        }
        return switch (name.type()) {
            case "JSXIdentifier" -> name.name();
            case "JSXMemberExpression" -> {
                final String object = elementName(name.child("object"));
                final String property = elementName(name.child("property"));
                yield object == null || property == null
                        ? null : object + "." + property;
            }
            case "JSXNamespacedName" -> {
                final String namespace = elementName(name.child("namespace"));
                final String local = elementName(name.child("name"));
                yield namespace == null || local == null
                        ? null : namespace + ":" + local;
            }
            default -> null;
        };
    }
}
