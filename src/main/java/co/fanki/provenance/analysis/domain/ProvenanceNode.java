package co.fanki.provenance.analysis.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;

/**
 * One step of a provenance chain.
 *
 * <p>A tagged union: {@link #kind()} selects which of the optional fields
 * are meaningful, and every node carries a span. Instances are created
 * through the per-kind factories, which are the only way to get a
 * well-formed combination of fields. Consumers dispatch with a
 * {@code switch} over {@link ProvenanceKind}.</p>
 *
 * <p>For {@link ProvenanceKind#CALL} the span is the call site and is
 * written as {@code callsite} instead of {@code span}.</p>
 *
 * @param kind the node kind
 * @param span the source span of the node
 * @param valueKind literal category, set for LITERAL
 * @param name identifier name, set for IDENT
 * @param source module specifier, set for IMPORT
 * @param imported imported name, set for IMPORT
 * @param key property key for OBJECT_PROP, variable name for ENV
 * @param index element index, set for ARRAY_ELEM
 * @param callee callee name, set for CALL and CTOR
 * @param calleeSpan span of the callee expression, set for CALL
 * @param fnDefSpan span of the called function's definition, set for
 *                  CALL when the callee resolves to a module binding
 * @param op operator tag, set for OP
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProvenanceNode(
        ProvenanceKind kind,
        @JsonIgnore String span,
        @JsonProperty("value_kind") LiteralKind valueKind,
        String name,
        String source,
        String imported,
        String key,
        Integer index,
        String callee,
        @JsonProperty("callee_span") String calleeSpan,
        @JsonProperty("fn_def_span") String fnDefSpan,
        String op
) {

    /** Callee name used for method calls. */
    public static final String MEMBER_CALLEE = "<member>";

    /** Callee name used when the callee is neither a name nor a member. */
    public static final String EXPR_CALLEE = "<expr>";

    public static ProvenanceNode literal(final String span,
            final LiteralKind valueKind) {
        return new ProvenanceNode(ProvenanceKind.LITERAL, span, valueKind,
                null, null, null, null, null, null, null, null, null);
    }

    public static ProvenanceNode ident(final String span, final String name) {
        return new ProvenanceNode(ProvenanceKind.IDENT, span, null, name,
                null, null, null, null, null, null, null, null);
    }

    public static ProvenanceNode init(final String span) {
        return new ProvenanceNode(ProvenanceKind.INIT, span, null, null,
                null, null, null, null, null, null, null, null);
    }

    public static ProvenanceNode importOf(final String span,
            final String source, final String imported) {
        return new ProvenanceNode(ProvenanceKind.IMPORT, span, null, null,
                source, imported, null, null, null, null, null, null);
    }

    public static ProvenanceNode member(final String span) {
        return new ProvenanceNode(ProvenanceKind.MEMBER, span, null, null,
                null, null, null, null, null, null, null, null);
    }

    public static ProvenanceNode objectProp(final String span,
            final String key) {
        return new ProvenanceNode(ProvenanceKind.OBJECT_PROP, span, null,
                null, null, null, key, null, null, null, null, null);
    }

    public static ProvenanceNode arrayElem(final String span,
            final int index) {
        return new ProvenanceNode(ProvenanceKind.ARRAY_ELEM, span, null,
                null, null, null, null, index, null, null, null, null);
    }

    /**
     * Creates a call node.
     *
     * @param callsite the span of the whole call expression
     * @param callee the callee name, {@link #MEMBER_CALLEE} or
     *               {@link #EXPR_CALLEE}
     * @param calleeSpan the span of the callee
     * @param fnDefSpan the definition span of the callee, may be null
     * @return the node
     */
    public static ProvenanceNode call(final String callsite,
            final String callee, final String calleeSpan,
            final String fnDefSpan) {
        return new ProvenanceNode(ProvenanceKind.CALL, callsite, null, null,
                null, null, null, null, callee, calleeSpan, fnDefSpan, null);
    }

    public static ProvenanceNode ctor(final String span,
            final String callee) {
        return new ProvenanceNode(ProvenanceKind.CTOR, span, null, null,
                null, null, null, null, callee, null, null, null);
    }

    public static ProvenanceNode op(final String span, final String op) {
        return new ProvenanceNode(ProvenanceKind.OP, span, null, null, null,
                null, null, null, null, null, null, op);
    }

    public static ProvenanceNode env(final String span, final String key) {
        return new ProvenanceNode(ProvenanceKind.ENV, span, null, null, null,
                null, key, null, null, null, null, null);
    }

    public static ProvenanceNode unknown(final String span) {
        return new ProvenanceNode(ProvenanceKind.UNKNOWN, span, null, null,
                null, null, null, null, null, null, null, null);
    }

    /** Returns the call site span of a CALL node, same as the span. */
    public String callsite() {
        return span;
    }

    /** Writes the span under its wire name, callsite for calls. */
    @JsonAnyGetter
    public Map<String, Object> location() {
        return Collections.singletonMap(
                kind == ProvenanceKind.CALL ? "callsite" : "span", span);
    }
}
