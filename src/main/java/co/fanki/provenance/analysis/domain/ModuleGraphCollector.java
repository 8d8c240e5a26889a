package co.fanki.provenance.analysis.domain;

import co.fanki.provenance.analysis.domain.ModuleGraph.DefinitionRow;
import co.fanki.provenance.analysis.domain.ModuleGraph.ExportRow;
import co.fanki.provenance.analysis.domain.ModuleGraph.ImportRow;
import co.fanki.provenance.analysis.domain.ModuleGraph.LiteralIndexRow;
import co.fanki.provenance.analysis.domain.ModuleGraph.MutationRow;
import co.fanki.provenance.analysis.domain.ModuleGraph.ReexportRow;
import co.fanki.provenance.analysis.domain.babel.AstWalker;
import co.fanki.provenance.analysis.domain.babel.JsNode;
import co.fanki.provenance.analysis.domain.babel.SpanFactory;
import co.fanki.provenance.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Extracts the {@link ModuleGraph} of a module in a single traversal.
 *
 * <p>Rows are appended in source order. Exported declarations are
 * handled at their export statement, which yields both their definition
 * row and their export row, and are skipped when the traversal reaches
 * the declaration itself.</p>
 *
 * <p>Mutation targets the {@link StaticMemberPathResolver} cannot
 * resolve, such as {@code arr[i] = 5}, are dropped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ModuleGraphCollector {

    /** Deepest structure nesting indexed by literal harvesting. */
    static final int MAX_HARVEST_DEPTH = 32;

    private final SpanFactory spans;

    private final List<ImportRow> imports = new ArrayList<>();
    private final List<ExportRow> exports = new ArrayList<>();
    private final List<ReexportRow> reexports = new ArrayList<>();
    private final List<DefinitionRow> definitions = new ArrayList<>();
    private final List<MutationRow> mutations = new ArrayList<>();
    private final List<LiteralIndexRow> literalIndex = new ArrayList<>();

    /** Declarations already recorded by their export statement. */
    private final Set<JsonNode> exportedDeclarations =
            Collections.newSetFromMap(new IdentityHashMap<>());

    private ModuleGraphCollector(final SpanFactory theSpans) {
        this.spans = theSpans;
    }

    /**
     * Collects the graph of a module.
     *
     * @param program the module's Program node
     * @param spans the span factory of the module
     * @return the module graph
     */
    public static ModuleGraph collect(final JsNode program,
            final SpanFactory spans) {
        Preconditions.requireNonNull(spans, "Span factory is required");

        final ModuleGraphCollector collector = new ModuleGraphCollector(spans);
        AstWalker.walk(program, collector::visit);
        return new ModuleGraph(spans.file(), collector.imports,
                collector.exports, collector.reexports, collector.definitions,
                collector.mutations, collector.literalIndex);
    }

    private void visit(final JsNode node) {
        switch (node.type()) {
            case "ImportDeclaration" -> visitImport(node);
            case "ExportNamedDeclaration" -> visitNamedExport(node);
            case "ExportDefaultDeclaration" -> visitDefaultExport(node);
            case "ExportAllDeclaration" -> visitExportAll(node);
            case "VariableDeclaration" -> {
                if (!exportedDeclarations.contains(node.json())) {
                    defineVariables(node, null);
                }
            }
            case "FunctionDeclaration", "ClassDeclaration" -> {
                if (!exportedDeclarations.contains(node.json())) {
                    defineNamed(node);
                }
            }
            case "AssignmentExpression" -> recordMutation(node.child("left"),
                    MutationKind.ASSIGN, node);
            case "UpdateExpression" -> recordMutation(node.child("argument"),
                    MutationKind.UPDATE, node);
            case "CallExpression", "OptionalCallExpression" ->
                    visitCall(node);
            default -> {
                // carries no module-level information
            }
        }
    }

    private void visitImport(final JsNode declaration) {
        final String source = sourceOf(declaration);
        if (source == null) {
            return;
        }
        for (final JsNode specifier : declaration.children("specifiers")) {
            if (specifier == null) {
                continue;
            }
            final JsNode local = specifier.child("local");
            if (local == null) {
                continue;
            }
            imports.add(new ImportRow(local.name(),
                    BindingTable.importedName(specifier), source,
                    spans.of(specifier)));
        }
    }

    private void visitNamedExport(final JsNode export) {
        final String source = sourceOf(export);
        final JsNode declaration = export.child("declaration");

        if (source != null) {
            for (final JsNode specifier : export.children("specifiers")) {
                if (specifier == null) {
                    continue;
                }
                final String exported = exportName(specifier.child("exported"));
                if (specifier.is("ExportNamespaceSpecifier")) {
                    reexports.add(new ReexportRow(exported, "*", source,
                            spans.of(specifier)));
                } else if (specifier.is("ExportSpecifier")) {
                    reexports.add(new ReexportRow(exported,
                            exportName(specifier.child("local")), source,
                            spans.of(specifier)));
                }
            }
        } else if (declaration != null) {
            if (declaration.is("VariableDeclaration")) {
                exportedDeclarations.add(declaration.json());
                defineVariables(declaration, export);
            } else if (declaration.isAnyOf("FunctionDeclaration",
                    "ClassDeclaration")) {
                exportedDeclarations.add(declaration.json());
                final JsNode id = defineNamed(declaration);
                if (id != null) {
                    exports.add(new ExportRow(id.name(), id.name(),
                            spans.of(id)));
                }
            }
        } else {
            for (final JsNode specifier : export.children("specifiers")) {
                if (specifier == null || !specifier.is("ExportSpecifier")) {
                    continue;
                }
                final JsNode local = specifier.child("local");
                if (local == null || !local.is("Identifier")) {
                    continue;
                }
                exports.add(new ExportRow(
                        exportName(specifier.child("exported")),
                        local.name(), spans.of(local)));
            }
        }
    }

    private void visitDefaultExport(final JsNode export) {
        final JsNode declaration = export.child("declaration");
        if (declaration == null) {
            return;
        }
        switch (declaration.type()) {
            case "Identifier" -> exports.add(new ExportRow("default",
                    declaration.name(), spans.of(declaration)));
            case "FunctionDeclaration", "ClassDeclaration" -> {
                exportedDeclarations.add(declaration.json());
                final JsNode id = defineNamed(declaration);
                if (id != null) {
                    exports.add(new ExportRow("default", id.name(),
                            spans.of(id)));
                }
            }
            case "ObjectExpression", "ArrayExpression" ->
                    harvestLiterals("default", declaration, "", 0);
            default -> {
                // anonymous values have no local name to export
            }
        }
    }

    private void visitExportAll(final JsNode export) {
        final String source = sourceOf(export);
        if (source == null) {
            return;
        }
        final JsNode exported = export.child("exported");
        reexports.add(new ReexportRow(
                exported == null ? "*" : exportName(exported), "*", source,
                spans.of(export)));
    }

    /**
     * Records definition rows for every identifier declarator; when the
     * declaration is exported, also records export rows and indexes the
     * string literals of the initializers.
     */
    private void defineVariables(final JsNode declaration,
            final JsNode export) {
        final DefinitionKind kind = DefinitionKind.ofDeclaration(
                declaration.text("kind"));
        for (final JsNode declarator : declaration.children("declarations")) {
            if (declarator == null) {
                continue;
            }
            final JsNode id = declarator.child("id");
            if (id == null || !id.is("Identifier")) {
                continue;
            }
            definitions.add(new DefinitionRow(id.name(), kind,
                    spans.of(declarator)));
            if (export != null) {
                exports.add(new ExportRow(id.name(), id.name(), spans.of(id)));
                harvestLiterals(id.name(), declarator.child("init"), "", 0);
            }
        }
    }

    /**
     * Records the definition row of a function or class declaration.
     *
     * @return the declaration's id, or null for anonymous declarations
     */
    private JsNode defineNamed(final JsNode declaration) {
        final JsNode id = declaration.child("id");
        if (id == null || id.name() == null) {
            return null;
        }
        final DefinitionKind kind = declaration.is("ClassDeclaration")
                ? DefinitionKind.CLASS : DefinitionKind.FUNC;
        definitions.add(new DefinitionRow(id.name(), kind, spans.of(id)));
        return id;
    }

    private void visitCall(final JsNode call) {
        final JsNode callee = call.child("callee");
        if (!StaticMemberPathResolver.isMemberAccess(callee)
                || callee.flag("computed")) {
            return;
        }
        final JsNode property = callee.child("property");
        if (property == null || !property.is("Identifier")) {
            return;
        }
        final JsNode receiver = callee.child("object");

        if (receiver != null && receiver.is("Identifier")
                && "Object".equals(receiver.name())
                && "assign".equals(property.name())) {
            final List<JsNode> arguments = call.children("arguments");
            if (!arguments.isEmpty()) {
                recordMutation(arguments.get(0), MutationKind.OBJECT_ASSIGN,
                        call);
            }
            return;
        }

        final MutationKind kind = MutationKind.ofMethod(property.name());
        if (kind != null) {
            recordMutation(receiver, kind, call);
        }
    }

    private void recordMutation(final JsNode target, final MutationKind kind,
            final JsNode at) {
        StaticMemberPathResolver.resolve(target).ifPresent(path ->
                mutations.add(new MutationRow(path.root(), path.path(), kind,
                        spans.of(at))));
    }

    /**
     * Indexes the string literals reachable from an exported value through
     * object properties ({@code a.b}) and array elements ({@code a[0]}).
     */
    private void harvestLiterals(final String exportName, final JsNode node,
            final String prefix, final int depth) {
        if (node == null || depth > MAX_HARVEST_DEPTH) {
            return;
        }
        switch (node.type()) {
            case "ObjectExpression" -> {
                for (final JsNode property : node.children("properties")) {
                    if (property == null || !property.is("ObjectProperty")
                            || property.flag("computed")) {
                        continue;
                    }
                    final String key = ExpressionTracer.staticKey(
                            property.child("key"));
                    if (key == null) {
                        continue;
                    }
                    harvestLiterals(exportName, property.child("value"),
                            prefix.isEmpty() ? key : prefix + "." + key,
                            depth + 1);
                }
            }
            case "ArrayExpression" -> {
                final List<JsNode> elements = node.children("elements");
                for (int index = 0; index < elements.size(); index++) {
                    final JsNode element = elements.get(index);
                    if (element == null || element.is("SpreadElement")) {
                        continue;
                    }
                    harvestLiterals(exportName, element,
                            prefix + "[" + index + "]", depth + 1);
                }
            }
            case "StringLiteral" -> literalIndex.add(new LiteralIndexRow(
                    exportName, prefix, node.text("value"), spans.of(node)));
            case "TemplateLiteral" -> {
                final String text = staticTemplateText(node);
                if (text != null) {
                    literalIndex.add(new LiteralIndexRow(exportName, prefix,
                            text, spans.of(node)));
                }
            }
            default -> {
                // only string leaves are indexed
            }
        }
    }

    /** Returns the cooked text of a template literal without substitutions. */
    private static String staticTemplateText(final JsNode template) {
        if (!template.children("expressions").isEmpty()) {
            return null;
        }
        final List<JsNode> quasis = template.children("quasis");
        if (quasis.size() != 1 || quasis.get(0) == null) {
            return null;
        }
        final JsonNode cooked = quasis.get(0).json().path("value")
                .path("cooked");
        return cooked.isTextual() ? cooked.asText() : null;
    }

    private static String sourceOf(final JsNode declaration) {
        final JsNode source = declaration.child("source");
        return source == null ? null : source.text("value");
    }

    /** Reads an export name written as an identifier or a string. */
    private static String exportName(final JsNode name) {
        if (name == null) {
            return null;
        }
        return name.is("StringLiteral") ? name.text("value") : name.name();
    }
}
