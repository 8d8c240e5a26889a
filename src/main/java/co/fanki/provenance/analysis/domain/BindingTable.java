package co.fanki.provenance.analysis.domain;

import co.fanki.provenance.analysis.domain.Binding.ImportInfo;
import co.fanki.provenance.analysis.domain.babel.AstWalker;
import co.fanki.provenance.analysis.domain.babel.JsNode;
import co.fanki.provenance.analysis.domain.babel.SpanFactory;
import co.fanki.provenance.shared.Preconditions;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Module-global symbol table.
 *
 * <p>The scope is flat: a name declared in an inner block overwrites an
 * outer declaration of the same name, and the last declaration in source
 * order wins. Only plain identifier targets are recorded; destructuring
 * patterns are ignored.</p>
 *
 * <p>The table must be fully populated (see {@link #collect}) before any
 * expression of the module is traced, because a reference may precede
 * its declaration in source order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class BindingTable {

    private final Map<String, Binding> bindings = new HashMap<>();

    /**
     * Builds the table for a whole module.
     *
     * @param program the module's Program node
     * @param spans the span factory of the module
     * @return the populated table
     */
    public static BindingTable collect(final JsNode program,
            final SpanFactory spans) {
        Preconditions.requireNonNull(spans, "Span factory is required");

        final BindingTable table = new BindingTable();
        AstWalker.walk(program, node -> {
            switch (node.type()) {
                case "VariableDeclarator" -> table.recordDeclarator(node, spans);
                case "FunctionDeclaration" -> table.recordFunction(node, spans);
                case "ImportDeclaration" -> table.recordImports(node, spans);
                default -> {
                    // not a binding site
                }
            }
        });
        return table;
    }

    /**
     * Records a binding, replacing any earlier binding of the same name.
     *
     * @param name the identifier
     * @param definingSpan the span of the declaring identifier
     * @param init the initializer, may be null
     * @param importInfo the import information, may be null
     * @param fnBodySpan the function body span, may be null
     */
    public void record(final String name, final String definingSpan,
            final JsNode init, final ImportInfo importInfo,
            final String fnBodySpan) {
        Preconditions.requireNonBlank(name, "Binding name is required");
        Preconditions.requireNonBlank(definingSpan,
                "Defining span is required");
        bindings.put(name, new Binding(name, definingSpan, init, importInfo,
                fnBodySpan));
    }

    /**
     * Looks up the binding of a name.
     *
     * @param name the identifier
     * @return the binding, empty when the name is not bound in the module
     */
    public Optional<Binding> lookup(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bindings.get(name));
    }

    /** Returns the number of bound names. */
    public int size() {
        return bindings.size();
    }

    private void recordDeclarator(final JsNode declarator,
            final SpanFactory spans) {
        final JsNode id = declarator.child("id");
        if (id == null || !id.is("Identifier")) {
            return;
        }
        record(id.name(), spans.of(id), declarator.child("init"), null, null);
    }

    private void recordFunction(final JsNode function,
            final SpanFactory spans) {
        final JsNode id = function.child("id");
        if (id == null) {
            return;
        }
        record(id.name(), spans.of(id), null, null,
                spans.of(function.child("body")));
    }

    private void recordImports(final JsNode declaration,
            final SpanFactory spans) {
        final JsNode sourceNode = declaration.child("source");
        final String source = sourceNode == null ? null
                : sourceNode.text("value");
        if (source == null) {
            return;
        }
        for (final JsNode specifier : declaration.children("specifiers")) {
            if (specifier == null) {
                continue;
            }
            final JsNode local = specifier.child("local");
            if (local == null || local.name() == null) {
                continue;
            }
            record(local.name(), spans.of(local), null,
                    new ImportInfo(source, importedName(specifier)), null);
        }
    }

    /**
     * Returns the name a specifier imports: {@code default} for default
     * imports, {@code *} for namespace imports, the imported name
     * otherwise.
     *
     * @param specifier an import specifier node
     * @return the imported name
     */
    static String importedName(final JsNode specifier) {
        if (specifier.is("ImportDefaultSpecifier")) {
            return "default";
        }
        if (specifier.is("ImportNamespaceSpecifier")) {
            return "*";
        }
        final JsNode imported = specifier.child("imported");
        if (imported == null) {
            return specifier.child("local").name();
        }
        return imported.is("StringLiteral")
                ? imported.text("value")
                : imported.name();
    }
}
