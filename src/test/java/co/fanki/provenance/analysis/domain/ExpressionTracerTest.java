package co.fanki.provenance.analysis.domain;

import co.fanki.provenance.analysis.domain.babel.JsNode;
import co.fanki.provenance.analysis.domain.babel.SpanFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static co.fanki.provenance.analysis.domain.babel.Ast.array;
import static co.fanki.provenance.analysis.domain.babel.Ast.arrow;
import static co.fanki.provenance.analysis.domain.babel.Ast.binary;
import static co.fanki.provenance.analysis.domain.babel.Ast.bool;
import static co.fanki.provenance.analysis.domain.babel.Ast.call;
import static co.fanki.provenance.analysis.domain.babel.Ast.computedProp;
import static co.fanki.provenance.analysis.domain.babel.Ast.conditional;
import static co.fanki.provenance.analysis.domain.babel.Ast.declare;
import static co.fanki.provenance.analysis.domain.babel.Ast.function;
import static co.fanki.provenance.analysis.domain.babel.Ast.id;
import static co.fanki.provenance.analysis.domain.babel.Ast.importDecl;
import static co.fanki.provenance.analysis.domain.babel.Ast.importMetaEnv;
import static co.fanki.provenance.analysis.domain.babel.Ast.importNamed;
import static co.fanki.provenance.analysis.domain.babel.Ast.index;
import static co.fanki.provenance.analysis.domain.babel.Ast.js;
import static co.fanki.provenance.analysis.domain.babel.Ast.logical;
import static co.fanki.provenance.analysis.domain.babel.Ast.member;
import static co.fanki.provenance.analysis.domain.babel.Ast.newExpr;
import static co.fanki.provenance.analysis.domain.babel.Ast.nullLiteral;
import static co.fanki.provenance.analysis.domain.babel.Ast.num;
import static co.fanki.provenance.analysis.domain.babel.Ast.object;
import static co.fanki.provenance.analysis.domain.babel.Ast.processEnv;
import static co.fanki.provenance.analysis.domain.babel.Ast.program;
import static co.fanki.provenance.analysis.domain.babel.Ast.prop;
import static co.fanki.provenance.analysis.domain.babel.Ast.spread;
import static co.fanki.provenance.analysis.domain.babel.Ast.str;
import static co.fanki.provenance.analysis.domain.babel.Ast.template;
import static co.fanki.provenance.analysis.domain.babel.Ast.unary;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ExpressionTracer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ExpressionTracerTest {

    private static final String FILE = "src/App.jsx";

    // -- Literals ------------------------------------------------------------

    @Test
    void whenTracing_givenLiterals_shouldAppendOneLiteralWithItsCategory() {
        assertSingleLiteral(str("Hi", 3), LiteralKind.STRING);
        assertSingleLiteral(num(42, 3), LiteralKind.NUMBER);
        assertSingleLiteral(bool(true, 3), LiteralKind.OTHER);
        assertSingleLiteral(nullLiteral(3), LiteralKind.OTHER);

        final ObjectNode bigint = num(0, 3);
        bigint.put("type", "BigIntLiteral").put("value", "10");
        assertSingleLiteral(bigint, LiteralKind.NUMBER);
    }

    // -- Identifiers ---------------------------------------------------------

    @Test
    void whenTracing_givenConstIdentifier_shouldFollowInitializer() {
        final ExpressionTracer tracer = tracerFor(
                declare("const", "title", str("Hi", 2), 2));

        final ProvenanceChain chain = tracer.trace(js(id("title", 5)));

        assertEquals(List.of(ProvenanceKind.IDENT, ProvenanceKind.INIT,
                ProvenanceKind.LITERAL), kinds(chain));
        assertEquals("title", chain.get(0).name());
        assertEquals(FILE + ":5", chain.get(0).span());
        assertEquals(FILE + ":2", chain.get(1).span());
        assertEquals(LiteralKind.STRING, chain.get(2).valueKind());
    }

    @Test
    void whenTracing_givenImportedIdentifier_shouldEndWithImport() {
        final ExpressionTracer tracer = tracerFor(importDecl("./config", 1,
                importNamed("CONFIG", "CONFIG", 1)));

        final ProvenanceChain chain = tracer.trace(js(id("CONFIG", 7)));

        assertEquals(List.of(ProvenanceKind.IDENT, ProvenanceKind.IMPORT),
                kinds(chain));
        assertEquals("./config", chain.get(1).source());
        assertEquals("CONFIG", chain.get(1).imported());
        assertEquals(FILE + ":1", chain.get(1).span());
    }

    @Test
    void whenTracing_givenUnboundIdentifier_shouldAppendOnlyIdent() {
        final ProvenanceChain chain = tracerFor().trace(js(id("window", 1)));

        assertEquals(List.of(ProvenanceKind.IDENT), kinds(chain));
    }

    @Test
    void whenTracing_givenSelfReferentialBinding_shouldTerminate() {
        // let count = count + 1;
        final ExpressionTracer tracer = tracerFor(declare("let", "count",
                binary("+", id("count", 1), num(1, 1), 1), 1));

        final ProvenanceChain chain = tracer.trace(js(id("count", 4)));

        assertEquals(List.of(ProvenanceKind.IDENT, ProvenanceKind.INIT,
                ProvenanceKind.OP, ProvenanceKind.IDENT,
                ProvenanceKind.LITERAL), kinds(chain));
        assertFalse(chain.isTruncated());
    }

    @Test
    void whenTracing_givenMutuallyRecursiveBindings_shouldExpandEachOnce() {
        final ExpressionTracer tracer = tracerFor(
                declare("const", "a", id("b", 1), 1),
                declare("const", "b", id("a", 2), 2));

        final ProvenanceChain chain = tracer.trace(js(id("a", 3)));

        assertEquals(List.of(ProvenanceKind.IDENT, ProvenanceKind.INIT,
                ProvenanceKind.IDENT, ProvenanceKind.INIT,
                ProvenanceKind.IDENT), kinds(chain));
    }

    // -- Member access and environment variables -----------------------------

    @Test
    void whenTracing_givenProcessEnv_shouldAppendSingleEnvNode() {
        final ProvenanceChain chain = tracerFor().trace(
                js(processEnv("API_KEY", 2)));

        assertEquals(1, chain.size());
        assertEquals(ProvenanceKind.ENV, chain.get(0).kind());
        assertEquals("API_KEY", chain.get(0).key());
    }

    @Test
    void whenTracing_givenImportMetaEnv_shouldAppendSingleEnvNode() {
        final ProvenanceChain chain = tracerFor().trace(
                js(importMetaEnv("VITE_URL", 2)));

        assertEquals(1, chain.size());
        assertEquals("VITE_URL", chain.get(0).key());
    }

    @Test
    void whenTracing_givenOtherEnvLikeAccess_shouldTraceAsMember() {
        final ProvenanceChain chain = tracerFor().trace(
                js(member(member(id("config", 1), "env", 1), "URL", 1)));

        assertEquals(ProvenanceKind.MEMBER, chain.get(0).kind());
        assertTrue(kinds(chain).contains(ProvenanceKind.IDENT));
    }

    @Test
    void whenTracing_givenComputedMember_shouldTraceObjectAndProperty() {
        final ProvenanceChain chain = tracerFor().trace(
                js(index(id("items", 1), id("i", 1), 1)));

        assertEquals(List.of(ProvenanceKind.MEMBER, ProvenanceKind.IDENT,
                ProvenanceKind.IDENT), kinds(chain));
        assertEquals("i", chain.get(2).name());
    }

    // -- Calls ---------------------------------------------------------------

    @Test
    void whenTracing_givenCallOfLocalFunction_shouldLinkFunctionBody() {
        final ExpressionTracer tracer = tracerFor(function("format", 4));

        final ProvenanceChain chain = tracer.trace(js(call(id("format", 9),
                9, str("a", 9), spread(id("rest", 9), 9))));

        assertEquals(List.of(ProvenanceKind.CALL, ProvenanceKind.LITERAL),
                kinds(chain));
        final ProvenanceNode callNode = chain.get(0);
        assertEquals("format", callNode.callee());
        assertEquals(FILE + ":9", callNode.callsite());
        assertEquals(FILE + ":4", callNode.fnDefSpan());
    }

    @Test
    void whenTracing_givenMethodCall_shouldUseMemberCallee() {
        final ProvenanceChain chain = tracerFor().trace(
                js(call(member(id("api", 2), "get", 2), 2)));

        assertEquals(1, chain.size());
        assertEquals(ProvenanceNode.MEMBER_CALLEE, chain.get(0).callee());
        assertNull(chain.get(0).fnDefSpan());
    }

    @Test
    void whenTracing_givenCallOfCallResult_shouldUseExpressionCallee() {
        final ProvenanceChain chain = tracerFor().trace(
                js(call(call(id("make", 1), 1), 1)));

        assertEquals(ProvenanceNode.EXPR_CALLEE, chain.get(0).callee());
    }

    @Test
    void whenTracing_givenConstructor_shouldAppendCtorAndTraceArguments() {
        final ProvenanceChain chain = tracerFor().trace(
                js(newExpr(id("Date", 1), 1, num(0, 1))));

        assertEquals(List.of(ProvenanceKind.CTOR, ProvenanceKind.LITERAL),
                kinds(chain));
        assertEquals("Date", chain.get(0).callee());
    }

    // -- Operators -----------------------------------------------------------

    @Test
    void whenTracing_givenOperators_shouldTagOpWithOperator() {
        assertEquals("template", tracerFor().trace(
                js(template(1, id("name", 1)))).get(0).op());
        assertEquals("binary:+", tracerFor().trace(
                js(binary("+", str("a", 1), str("b", 1), 1))).get(0).op());
        assertEquals("unary:!", tracerFor().trace(
                js(unary("!", id("ok", 1), 1))).get(0).op());
        assertEquals("logical:??", tracerFor().trace(
                js(logical("??", id("a", 1), str("b", 1), 1))).get(0).op());
    }

    @Test
    void whenTracing_givenConditional_shouldTraceAllOperands() {
        final ProvenanceChain chain = tracerFor().trace(js(conditional(
                id("ok", 1), str("yes", 1), str("no", 1), 1)));

        assertEquals("cond", chain.get(0).op());
        assertEquals(List.of(ProvenanceKind.OP, ProvenanceKind.IDENT,
                ProvenanceKind.LITERAL, ProvenanceKind.LITERAL), kinds(chain));
    }

    // -- Structures ----------------------------------------------------------

    @Test
    void whenTracing_givenObject_shouldSkipComputedAndSpreadProperties() {
        final ObjectNode spreadProperty = spread(id("rest", 1), 1);

        final ProvenanceChain chain = tracerFor().trace(js(object(1,
                prop("label", str("Save", 2), 2),
                prop(num(3, 3), str("three", 3), 3),
                computedProp(id("k", 4), num(1, 4), 4),
                spreadProperty)));

        assertEquals(List.of(ProvenanceKind.OBJECT_PROP,
                ProvenanceKind.LITERAL, ProvenanceKind.OBJECT_PROP,
                ProvenanceKind.LITERAL), kinds(chain));
        assertEquals("label", chain.get(0).key());
        assertEquals("3", chain.get(2).key());
    }

    @Test
    void whenTracing_givenArrayWithHoleAndSpread_shouldKeepSourceIndexes() {
        final ProvenanceChain chain = tracerFor().trace(js(array(1,
                str("a", 1), null, spread(id("more", 1), 1), str("d", 1))));

        assertEquals(List.of(ProvenanceKind.ARRAY_ELEM,
                ProvenanceKind.LITERAL, ProvenanceKind.ARRAY_ELEM,
                ProvenanceKind.LITERAL), kinds(chain));
        assertEquals(0, chain.get(0).index());
        assertEquals(3, chain.get(2).index());
    }

    @Test
    void whenTracing_givenUnsupportedExpression_shouldAppendUnknown() {
        final ProvenanceChain chain = tracerFor().trace(
                js(arrow(id("x", 1), 1)));

        assertEquals(List.of(ProvenanceKind.UNKNOWN), kinds(chain));
    }

    // -- Bounds --------------------------------------------------------------

    @Test
    void whenTracing_givenDeeplyNestedExpression_shouldStopAtDepthBound() {
        ObjectNode expr = str("deep", 1);
        for (int i = 0; i < 30; i++) {
            expr = unary("!", expr, 1);
        }

        final ProvenanceChain chain = tracerFor().trace(js(expr));

        assertEquals(ExpressionTracer.MAX_DEPTH + 1, chain.size());
        assertTrue(chain.isTruncated());
    }

    @Test
    void whenTracing_givenHugeArray_shouldCapChainLength() {
        final ObjectNode[] elements = new ObjectNode[500];
        for (int i = 0; i < elements.length; i++) {
            elements[i] = str("item" + i, 1);
        }

        final ProvenanceChain chain = tracerFor().trace(
                js(array(1, elements)));

        assertEquals(ProvenanceChain.MAX_NODES, chain.size());
        assertTrue(chain.isTruncated());
    }

    @Test
    void whenTracing_givenNodeWithoutLocation_shouldUseLineZero() {
        final ProvenanceChain chain = tracerFor().trace(js(str("x", 0)));

        assertEquals(FILE + ":0", chain.get(0).span());
    }

    // -- helpers -------------------------------------------------------------

    private static ExpressionTracer tracerFor(final ObjectNode... body) {
        final SpanFactory spans = new SpanFactory(FILE);
        final JsNode program = js(program(body));
        return new ExpressionTracer(BindingTable.collect(program, spans),
                spans);
    }

    private static void assertSingleLiteral(final ObjectNode literal,
            final LiteralKind expected) {
        final ProvenanceChain chain = tracerFor().trace(js(literal));
        assertEquals(1, chain.size());
        assertEquals(ProvenanceKind.LITERAL, chain.get(0).kind());
        assertEquals(expected, chain.get(0).valueKind());
    }

    private static List<ProvenanceKind> kinds(final ProvenanceChain chain) {
        final List<ProvenanceKind> kinds = new ArrayList<>();
        for (final ProvenanceNode node : chain.nodes()) {
            kinds.add(node.kind());
        }
        return kinds;
    }
}
