package co.fanki.provenance.analysis.application;

import co.fanki.provenance.analysis.domain.ElementProvenance;
import co.fanki.provenance.analysis.domain.ModuleAnalysis;
import co.fanki.provenance.analysis.domain.ModuleAnalyzer;
import co.fanki.provenance.analysis.domain.ModuleGraphRegistry;
import co.fanki.provenance.analysis.domain.babel.BabelAstReader;
import co.fanki.provenance.analysis.domain.babel.JsNode;
import co.fanki.provenance.analysis.domain.babel.SpanFactory;
import co.fanki.provenance.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.AntPathMatcher;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Analyzes modules of the current build.
 *
 * <p>The service owns the build's {@link ModuleGraphRegistry}. Every
 * analyzed module registers its graph there, and {@link #startBuild()}
 * swaps in a fresh registry so graphs of a previous build never leak into
 * the next one. Analysis itself is stateless, so concurrent requests for
 * different files are safe.</p>
 *
 * <p>Files under {@code node_modules}, or matching one of the configured
 * exclude globs, are skipped: they produce no graph and no elements.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ProvenanceService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProvenanceService.class);

    private static final String NODE_MODULES = "node_modules";

    private final AtomicReference<ModuleGraphRegistry> registry =
            new AtomicReference<>(new ModuleGraphRegistry());

    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    private final List<String> excludes;

    private final ModuleAnalyzer analyzer;

    /**
     * Creates a new ProvenanceService.
     *
     * @param theExcludes comma-separated globs of files never analyzed
     * @param theSkipComponents comma-separated JSX element names that are
     *        never traced
     */
    public ProvenanceService(
            @Value("${provenance.exclude:}") final String theExcludes,
            @Value("${provenance.skip-components:}")
            final String theSkipComponents) {
        this.excludes = List.copyOf(split(theExcludes));
        this.analyzer = new ModuleAnalyzer(split(theSkipComponents));
    }

    /**
     * Analyzes one module against the current build.
     *
     * @param filePath the module's logical file path
     * @param astJson the module's Babel AST as JSON text
     * @return the analysis, or a skipped result for excluded files
     */
    public ModuleAnalysis analyze(final String filePath,
            final String astJson) {
        Preconditions.requireNonBlank(filePath, "File path is required");
        Preconditions.requireNonBlank(astJson, "AST is required");

        if (isExcluded(filePath)) {
            LOG.debug("Skipping excluded file {}", filePath);
            return ModuleAnalysis.skipped(filePath);
        }
        return analyzeProgram(filePath, BabelAstReader.readProgram(astJson));
    }

    /**
     * Analyzes one module against the current build.
     *
     * @param filePath the module's logical file path
     * @param ast the module's Babel AST, a File or Program node
     * @return the analysis, or a skipped result for excluded files
     */
    public ModuleAnalysis analyze(final String filePath, final JsonNode ast) {
        Preconditions.requireNonBlank(filePath, "File path is required");
        Preconditions.requireNonNull(ast, "AST is required");

        if (isExcluded(filePath)) {
            LOG.debug("Skipping excluded file {}", filePath);
            return ModuleAnalysis.skipped(filePath);
        }
        return analyzeProgram(filePath, BabelAstReader.toProgram(ast));
    }

    /**
     * Analyzes one module and keeps the elements starting at a line.
     *
     * <p>Editors identify a rendered element by its file and the line of
     * its opening tag.</p>
     *
     * @param filePath the module's logical file path
     * @param ast the module's Babel AST, a File or Program node
     * @param line the 1-indexed line of the element's opening tag
     * @return the matching elements, empty when none match
     */
    public List<ElementProvenance> traceLine(final String filePath,
            final JsonNode ast, final int line) {
        Preconditions.requireLine(line, "Line must be positive");

        return analyze(filePath, ast).elements().stream()
                .filter(element -> SpanFactory.lineOf(element.span()) == line)
                .toList();
    }

    /**
     * Starts a new build, discarding every graph of the previous one.
     *
     * @return the number of graphs discarded
     */
    public int startBuild() {
        final ModuleGraphRegistry previous =
                registry.getAndSet(new ModuleGraphRegistry());
        LOG.info("Started a new build, discarded {} module graphs",
                previous.size());
        return previous.size();
    }

    /** @return the registry of the current build */
    public ModuleGraphRegistry registry() {
        return registry.get();
    }

    /**
     * Checks whether a file is excluded from analysis.
     *
     * @param filePath the file path
     * @return true for dependency files and configured excludes
     */
    boolean isExcluded(final String filePath) {
        if (filePath.contains(NODE_MODULES)) {
            return true;
        }
        final String normalized = filePath.replace('\\', '/');
        for (final String pattern : excludes) {
            if (pathMatcher.match(pattern, normalized)) {
                return true;
            }
        }
        return false;
    }

    private ModuleAnalysis analyzeProgram(final String filePath,
            final JsNode program) {
        final ModuleAnalysis analysis =
                analyzer.analyze(program, filePath, registry.get());

        LOG.info("Analyzed {}: {} elements with provenance",
                filePath, analysis.elements().size());

        return analysis;
    }

    private static Set<String> split(final String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        final Set<String> values = new LinkedHashSet<>();
        Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .forEach(values::add);
        return values;
    }
}
