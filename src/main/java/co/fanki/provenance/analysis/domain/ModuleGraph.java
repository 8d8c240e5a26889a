package co.fanki.provenance.analysis.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structural summary of one module.
 *
 * <p>Holds what the module imports, exports and re-exports, the names it
 * defines, the values it mutates, and the string literals reachable from
 * its exported structures. Every row carries the span it was read
 * from.</p>
 *
 * @param file the logical file path of the module
 * @param imports one row per import specifier
 * @param exports one row per exported local name
 * @param reexports one row per name re-exported from another module
 * @param definitions one row per declared name
 * @param mutations one row per statically resolvable mutation
 * @param literalIndex one row per string literal of an exported structure
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ModuleGraph(
        String file,
        List<ImportRow> imports,
        List<ExportRow> exports,
        List<ReexportRow> reexports,
        @JsonProperty("defs") List<DefinitionRow> definitions,
        List<MutationRow> mutations,
        @JsonProperty("literal_index") List<LiteralIndexRow> literalIndex
) {

    /**
     * Creates a graph holding immutable copies of the rows.
     */
    public ModuleGraph {
        imports = List.copyOf(imports);
        exports = List.copyOf(exports);
        reexports = List.copyOf(reexports);
        definitions = List.copyOf(definitions);
        mutations = List.copyOf(mutations);
        literalIndex = List.copyOf(literalIndex);
    }

    /**
     * An imported name.
     *
     * @param local the local alias in this module
     * @param imported {@code default}, {@code *} or the imported name
     * @param source the module specifier
     * @param span where the specifier is written
     */
    public record ImportRow(String local, String imported, String source,
            String span) {}

    /**
     * A name this module exports from its own scope.
     *
     * @param exported the name visible to importers
     * @param local the local name it is bound to
     * @param span where the export is written
     */
    public record ExportRow(String exported, String local, String span) {}

    /**
     * A name this module forwards from another module.
     *
     * @param exported the name visible to importers
     * @param imported the name in the source module, {@code *} for all
     * @param source the module specifier
     * @param span where the re-export is written
     */
    public record ReexportRow(String exported, String imported,
            String source, String span) {}

    /**
     * A declared name.
     *
     * @param local the declared name
     * @param kind how it is declared
     * @param span where it is declared
     */
    public record DefinitionRow(String local, DefinitionKind kind,
            String span) {}

    /**
     * A write to a module value.
     *
     * @param root the identifier at the root of the written path
     * @param path the written path below the root, empty for the root
     * @param kind the kind of write
     * @param span where the write happens
     */
    public record MutationRow(String root, String path, MutationKind kind,
            String span) {}

    /**
     * A string literal inside an exported structure.
     *
     * @param exportName the exported name holding the structure
     * @param path the dotted and bracket-indexed path to the literal
     * @param text the literal text
     * @param span where the literal is written
     */
    public record LiteralIndexRow(
            @JsonProperty("export_name") String exportName,
            String path,
            String text,
            String span) {}

    /** Returns the total number of rows of all kinds. */
    public int rowCount() {
        return imports.size() + exports.size() + reexports.size()
                + definitions.size() + mutations.size() + literalIndex.size();
    }
}
