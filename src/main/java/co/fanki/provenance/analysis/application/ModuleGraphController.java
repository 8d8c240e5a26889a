package co.fanki.provenance.analysis.application;

import co.fanki.provenance.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for querying the module graphs of the current build.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/module-graphs")
@Tag(name = "Module Graphs",
        description = "Query imports, exports, mutations and literals")
public class ModuleGraphController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ModuleGraphController.class);

    private final ModuleGraphQueryService queryService;

    /**
     * Creates a new ModuleGraphController.
     *
     * @param theQueryService the module graph query service
     */
    public ModuleGraphController(
            final ModuleGraphQueryService theQueryService) {
        this.queryService = theQueryService;
    }

    /** @return the analyzed module file paths */
    @GetMapping
    @Operation(summary = "List analyzed modules")
    public ResponseEntity<List<String>> modules() {
        return ResponseEntity.ok(queryService.modules());
    }

    /**
     * Returns the graph of one module.
     *
     * @param file the module's file path
     * @return the module graph
     */
    @GetMapping("/graph")
    @Operation(summary = "Get the graph of a module")
    public ResponseEntity<?> graph(@RequestParam final String file) {
        return respond(() -> queryService.graph(file));
    }

    /**
     * Finds exported string literals containing a text.
     *
     * @param text the text, case-insensitive
     * @return the matching literals
     */
    @GetMapping("/literals")
    @Operation(summary = "Find exported string literals",
            description = "Case-insensitive search over the literal index"
                    + " of every analyzed module.")
    public ResponseEntity<?> literals(@RequestParam final String text) {
        return respond(() -> queryService.findLiteral(text));
    }

    /**
     * Finds the mutations of a root identifier.
     *
     * @param root the root identifier
     * @return the matching mutations
     */
    @GetMapping("/mutations")
    @Operation(summary = "Find mutations of a root identifier")
    public ResponseEntity<?> mutations(@RequestParam final String root) {
        return respond(() -> queryService.findMutations(root));
    }

    /**
     * Finds the modules importing a source.
     *
     * @param source the import source as written
     * @return the matching imports
     */
    @GetMapping("/importers")
    @Operation(summary = "Find importers of a module")
    public ResponseEntity<?> importers(@RequestParam final String source) {
        return respond(() -> queryService.findImporters(source));
    }

    private ResponseEntity<?> respond(final Supplier<?> query) {
        try {
            return ResponseEntity.ok(query.get());
        } catch (final DomainException e) {
            LOG.warn("Module graph query failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }
}
