package co.fanki.provenance.analysis.domain;

import co.fanki.provenance.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Module graphs of one build, keyed by file path.
 *
 * <p>Files are analyzed independently and may register concurrently.
 * Registering a file that is already present replaces its graph, which
 * is what happens when a module is re-analyzed during the same build.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ModuleGraphRegistry {

    private final Map<String, ModuleGraph> graphs = new ConcurrentHashMap<>();

    /**
     * Registers a module graph under its file path.
     *
     * @param graph the graph to register
     */
    public void register(final ModuleGraph graph) {
        Preconditions.requireNonNull(graph, "Module graph is required");
        graphs.put(graph.file(), graph);
    }

    /**
     * Finds the graph of a file.
     *
     * @param file the file path
     * @return the graph, or empty when the file was not analyzed
     */
    public Optional<ModuleGraph> find(final String file) {
        if (file == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(graphs.get(file));
    }

    /**
     * Returns the registered file paths, sorted.
     *
     * @return an immutable sorted list
     */
    public List<String> files() {
        final List<String> files = new ArrayList<>(graphs.keySet());
        files.sort(String::compareTo);
        return List.copyOf(files);
    }

    /**
     * Returns the registered graphs ordered by file path.
     *
     * @return an immutable list
     */
    public List<ModuleGraph> graphs() {
        return files().stream()
                .map(graphs::get)
                .filter(graph -> graph != null)
                .toList();
    }

    /** @return the number of registered graphs */
    public int size() {
        return graphs.size();
    }
}
