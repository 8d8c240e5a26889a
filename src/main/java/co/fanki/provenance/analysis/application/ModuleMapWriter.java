package co.fanki.provenance.analysis.application;

import co.fanki.provenance.analysis.domain.ModuleGraph;
import co.fanki.provenance.shared.DomainException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the current build's module graphs as a JSON module map.
 *
 * <p>The map is a single object keyed by file path, files sorted, each
 * value being the module graph of that file. Parent directories are
 * created when missing and an existing map is overwritten.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ModuleMapWriter {

    private static final Logger LOG = LoggerFactory.getLogger(
            ModuleMapWriter.class);

    private final ObjectMapper objectMapper;

    private final ProvenanceService provenanceService;

    private final Path target;

    /**
     * Creates a new ModuleMapWriter.
     *
     * @param theObjectMapper the object mapper used for serialization
     * @param theProvenanceService the service owning the build registry
     * @param theTarget the module map file path
     */
    public ModuleMapWriter(final ObjectMapper theObjectMapper,
            final ProvenanceService theProvenanceService,
            @Value("${provenance.module-map-path:.codepress/module-map.json}")
            final String theTarget) {
        this.objectMapper = theObjectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.provenanceService = theProvenanceService;
        this.target = Paths.get(theTarget);
    }

    /**
     * Writes the module map of the current build.
     *
     * @return the written module map
     * @throws DomainException with {@code EXPORT_FAILED} when the file
     *         cannot be written
     */
    public WrittenModuleMap write() {
        final List<ModuleGraph> graphs =
                provenanceService.registry().graphs();

        final Map<String, ModuleGraph> map = new LinkedHashMap<>();
        for (final ModuleGraph graph : graphs) {
            map.put(graph.file(), graph);
        }

        try {
            final Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(target.toFile(), map);
        } catch (final IOException e) {
            LOG.error("Failed to write module map to {}", target, e);
            throw new DomainException(
                    "Failed to write module map to " + target + ": "
                            + e.getMessage(),
                    DomainException.EXPORT_FAILED, e);
        }

        LOG.info("Wrote module map with {} modules to {}",
                map.size(), target);

        return new WrittenModuleMap(target.toString(), map.size());
    }

    /**
     * The outcome of a module map export.
     *
     * @param path the written file path
     * @param modules the number of modules written
     */
    public record WrittenModuleMap(String path, int modules) {}
}
