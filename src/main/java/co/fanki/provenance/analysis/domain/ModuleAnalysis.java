package co.fanki.provenance.analysis.domain;

import java.util.List;

/**
 * The result of analyzing one module.
 *
 * @param file the module's file path
 * @param skipped true when the file was excluded from analysis
 * @param graph the module graph, null when skipped
 * @param elements the provenance of every JSX element that renders data
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ModuleAnalysis(
        String file,
        boolean skipped,
        ModuleGraph graph,
        List<ElementProvenance> elements
) {

    public ModuleAnalysis {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    /**
     * Creates the result of a file excluded from analysis.
     *
     * @param file the file path
     * @return a skipped analysis with no graph and no elements
     */
    public static ModuleAnalysis skipped(final String file) {
        return new ModuleAnalysis(file, true, null, List.of());
    }
}
