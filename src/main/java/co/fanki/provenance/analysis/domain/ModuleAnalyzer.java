package co.fanki.provenance.analysis.domain;

import co.fanki.provenance.analysis.domain.babel.JsNode;
import co.fanki.provenance.analysis.domain.babel.SpanFactory;
import co.fanki.provenance.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Entry point of the analysis of one module.
 *
 * <p>Analysis runs in two phases. The binding table is populated from the
 * whole module first, so that tracing never depends on declaration order.
 * Then the module graph is collected and registered, and every JSX element
 * is traced against the complete table.</p>
 *
 * <p>Instances are stateless and can be shared across threads. Every call
 * builds its own binding table and collectors; the registry is the only
 * shared state and it is written under the module's own file key.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ModuleAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            ModuleAnalyzer.class);

    private final Set<String> skippedElements;

    /**
     * Creates an analyzer.
     *
     * @param theSkippedElements JSX element names that are never traced
     */
    public ModuleAnalyzer(final Set<String> theSkippedElements) {
        this.skippedElements = Set.copyOf(Preconditions.requireNonNull(
                theSkippedElements, "Skipped elements are required"));
    }

    /**
     * Analyzes one module and registers its graph.
     *
     * @param program the module's Program node
     * @param filePath the module's logical file path
     * @param registry the registry of the current build
     * @return the module analysis
     */
    public ModuleAnalysis analyze(final JsNode program, final String filePath,
            final ModuleGraphRegistry registry) {
        Preconditions.requireNonNull(program, "Program is required");
        Preconditions.requireNonBlank(filePath, "File path is required");
        Preconditions.requireNonNull(registry, "Registry is required");

        final SpanFactory spans = new SpanFactory(filePath);
        final BindingTable bindings = BindingTable.collect(program, spans);

        final ModuleGraph graph = ModuleGraphCollector.collect(program, spans);
        registry.register(graph);

        final JsxElementTracer elements = new JsxElementTracer(
                new ExpressionTracer(bindings, spans),
                new SymbolReferenceCollector(bindings, spans),
                spans, skippedElements);
        final List<ElementProvenance> traced = elements.traceElements(program);

        LOG.debug("Analyzed {}: {} bindings, {} graph rows, {} elements",
                filePath, bindings.size(), graph.rowCount(), traced.size());

        return new ModuleAnalysis(filePath, false, graph, traced);
    }
}
