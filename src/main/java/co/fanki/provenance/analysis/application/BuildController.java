package co.fanki.provenance.analysis.application;

import co.fanki.provenance.analysis.application.ModuleMapWriter.WrittenModuleMap;
import co.fanki.provenance.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for the build lifecycle.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/builds")
@Tag(name = "Builds", description = "Start builds and export module maps")
public class BuildController {

    private static final Logger LOG = LoggerFactory.getLogger(
            BuildController.class);

    private final ProvenanceService provenanceService;

    private final ModuleMapWriter moduleMapWriter;

    /**
     * Creates a new BuildController.
     *
     * @param theProvenanceService the provenance service
     * @param theModuleMapWriter the module map writer
     */
    public BuildController(final ProvenanceService theProvenanceService,
            final ModuleMapWriter theModuleMapWriter) {
        this.provenanceService = theProvenanceService;
        this.moduleMapWriter = theModuleMapWriter;
    }

    /**
     * Starts a new build.
     *
     * @return the number of module graphs discarded
     */
    @PostMapping
    @Operation(summary = "Start a new build",
            description = "Discards every module graph of the previous"
                    + " build.")
    public ResponseEntity<Map<String, Integer>> start() {
        final int discarded = provenanceService.startBuild();
        return ResponseEntity.ok(Map.of("discarded", discarded));
    }

    /**
     * Exports the module map of the current build.
     *
     * @return the written file and module count
     */
    @PostMapping("/current/module-map")
    @Operation(summary = "Export the module map",
            description = "Writes every module graph of the current build"
                    + " to the configured module map file.")
    public ResponseEntity<?> exportModuleMap() {
        try {
            final WrittenModuleMap written = moduleMapWriter.write();
            return ResponseEntity.ok(written);
        } catch (final DomainException e) {
            LOG.warn("Module map export failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }
}
