package co.fanki.provenance.config;

import co.fanki.provenance.analysis.application.ProvenanceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check controller providing endpoints for liveness and readiness
 * probes.
 *
 * <p>Provides /health for basic liveness check and /ready reporting how
 * many modules the current build holds.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthCheckController {

    private final ProvenanceService provenanceService;

    /**
     * Creates a new HealthCheckController.
     *
     * @param theProvenanceService the service owning the build registry
     */
    public HealthCheckController(
            final ProvenanceService theProvenanceService) {
        this.provenanceService = theProvenanceService;
    }

    /**
     * Liveness probe endpoint.
     *
     * @return "up" if the service is running
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("up");
    }

    /**
     * Readiness probe endpoint.
     *
     * @return status map with the size of the current build
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        return ResponseEntity.ok(Map.of(
                "status", "ready",
                "modules", provenanceService.registry().size()));
    }

}
