package co.fanki.provenance.analysis.application;

import co.fanki.provenance.analysis.domain.ModuleGraph;
import co.fanki.provenance.analysis.domain.ModuleGraph.ImportRow;
import co.fanki.provenance.analysis.domain.ModuleGraph.LiteralIndexRow;
import co.fanki.provenance.analysis.domain.ModuleGraph.MutationRow;
import co.fanki.provenance.shared.DomainException;
import co.fanki.provenance.shared.Preconditions;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Answers downstream tooling queries over the current build's module
 * graphs.
 *
 * <p>Queries read the registry of the current build as it is at call
 * time. Results are ordered by file path, then by row order within each
 * file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ModuleGraphQueryService {

    private final ProvenanceService provenanceService;

    /**
     * Creates a new ModuleGraphQueryService.
     *
     * @param theProvenanceService the service owning the build registry
     */
    public ModuleGraphQueryService(
            final ProvenanceService theProvenanceService) {
        this.provenanceService = theProvenanceService;
    }

    /**
     * Returns the graph of one module.
     *
     * @param file the module's file path
     * @return the module graph
     * @throws DomainException with {@code MODULE_NOT_FOUND} when the module
     *         was not analyzed in the current build
     */
    public ModuleGraph graph(final String file) {
        Preconditions.requireNonBlank(file, "File is required");
        return provenanceService.registry().find(file)
                .orElseThrow(() -> new DomainException(
                        "Module not found: " + file
                                + ". Use list_modules to see analyzed"
                                + " modules.",
                        DomainException.MODULE_NOT_FOUND));
    }

    /** @return the sorted file paths of the analyzed modules */
    public List<String> modules() {
        return provenanceService.registry().files();
    }

    /**
     * Finds exported string literals containing a text.
     *
     * @param text the text to look for, case-insensitive
     * @return the matching literal index rows with their file
     */
    public List<LiteralMatch> findLiteral(final String text) {
        Preconditions.requireNonBlank(text, "Text is required");
        final String needle = text.toLowerCase(Locale.ROOT);

        final List<LiteralMatch> matches = new ArrayList<>();
        for (final ModuleGraph graph : provenanceService.registry().graphs()) {
            for (final LiteralIndexRow row : graph.literalIndex()) {
                if (row.text().toLowerCase(Locale.ROOT).contains(needle)) {
                    matches.add(new LiteralMatch(graph.file(), row));
                }
            }
        }
        return matches;
    }

    /**
     * Finds every mutation of a root identifier across modules.
     *
     * @param root the mutated root identifier, e.g. {@code state}
     * @return the mutation rows with their file
     */
    public List<MutationMatch> findMutations(final String root) {
        Preconditions.requireNonBlank(root, "Root is required");

        final List<MutationMatch> matches = new ArrayList<>();
        for (final ModuleGraph graph : provenanceService.registry().graphs()) {
            for (final MutationRow row : graph.mutations()) {
                if (root.equals(row.root())) {
                    matches.add(new MutationMatch(graph.file(), row));
                }
            }
        }
        return matches;
    }

    /**
     * Finds the imports of a source module across modules.
     *
     * @param source the import source exactly as written, e.g.
     *        {@code ./config}
     * @return the import rows with their file
     */
    public List<ImportMatch> findImporters(final String source) {
        Preconditions.requireNonBlank(source, "Source is required");

        final List<ImportMatch> matches = new ArrayList<>();
        for (final ModuleGraph graph : provenanceService.registry().graphs()) {
            for (final ImportRow row : graph.imports()) {
                if (source.equals(row.source())) {
                    matches.add(new ImportMatch(graph.file(), row));
                }
            }
        }
        return matches;
    }

    /**
     * A literal index row and the module declaring it.
     *
     * @param file the module's file path
     * @param literal the literal index row
     */
    public record LiteralMatch(String file, LiteralIndexRow literal) {}

    /**
     * A mutation row and the module performing it.
     *
     * @param file the module's file path
     * @param mutation the mutation row
     */
    public record MutationMatch(String file, MutationRow mutation) {}

    /**
     * An import row and the importing module.
     *
     * @param file the importing module's file path
     * @param importRow the import row
     */
    public record ImportMatch(String file, ImportRow importRow) {}
}
