package co.fanki.provenance.analysis.application;

import co.fanki.provenance.analysis.domain.ElementProvenance;
import co.fanki.provenance.analysis.domain.ModuleAnalysis;
import co.fanki.provenance.shared.DomainException;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for analyzing modules.
 *
 * <p>The host parses each module with {@code @babel/parser} and posts the
 * resulting AST together with the module's logical file path. The module
 * graph is registered in the current build as a side effect.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/provenance")
@Tag(name = "Provenance",
        description = "Trace rendered data back to its source spans")
public class ProvenanceController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProvenanceController.class);

    private final ProvenanceService provenanceService;

    /**
     * Creates a new ProvenanceController.
     *
     * @param theProvenanceService the provenance service
     */
    public ProvenanceController(
            final ProvenanceService theProvenanceService) {
        this.provenanceService = theProvenanceService;
    }

    /**
     * Analyzes one module.
     *
     * @param request the file path and AST of the module
     * @return the module analysis
     */
    @PostMapping("/analyze")
    @Operation(summary = "Analyze a module",
            description = "Collects the module graph of a Babel AST and"
                    + " traces every JSX element that renders data.")
    public ResponseEntity<?> analyze(
            @RequestBody final AnalyzeRequest request) {

        LOG.info("Analyze request for {}", request.filePath());

        try {
            final ModuleAnalysis analysis =
                    provenanceService.analyze(request.filePath(),
                            request.ast());
            return ResponseEntity.ok(analysis);
        } catch (final DomainException e) {
            LOG.warn("Analysis of {} failed: {}", request.filePath(),
                    e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        } catch (final IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage()));
        }
    }

    /**
     * Traces the elements whose opening tag starts at a line.
     *
     * @param request the file path, AST and line
     * @return the provenance of the matching elements
     */
    @PostMapping("/trace")
    @Operation(summary = "Trace elements at a line",
            description = "Returns the provenance of the JSX elements whose"
                    + " opening tag starts at the given line.")
    public ResponseEntity<?> trace(@RequestBody final TraceRequest request) {

        LOG.info("Trace request for {}:{}", request.filePath(),
                request.line());

        try {
            final List<ElementProvenance> elements =
                    provenanceService.traceLine(request.filePath(),
                            request.ast(), request.line());
            return ResponseEntity.ok(elements);
        } catch (final DomainException e) {
            LOG.warn("Trace of {} failed: {}", request.filePath(),
                    e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        } catch (final IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage()));
        }
    }

    /**
     * Request body for module analysis.
     *
     * @param filePath the module's logical file path
     * @param ast the Babel AST, a File or Program node
     */
    public record AnalyzeRequest(String filePath, JsonNode ast) {}

    /**
     * Request body for tracing the elements at a line.
     *
     * @param filePath the module's logical file path
     * @param ast the Babel AST, a File or Program node
     * @param line the 1-indexed line of the element's opening tag
     */
    public record TraceRequest(String filePath, JsonNode ast, int line) {}
}
