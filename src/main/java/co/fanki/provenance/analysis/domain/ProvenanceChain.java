package co.fanki.provenance.analysis.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only, bounded sequence of provenance nodes.
 *
 * <p>The chain never grows beyond {@link #MAX_NODES}; appends past the
 * cap are dropped and the chain is flagged as truncated. Everything
 * appended before that point stays valid.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ProvenanceChain {

    /** Hard cap on the number of nodes in one chain. */
    public static final int MAX_NODES = 128;

    private final List<ProvenanceNode> nodes = new ArrayList<>();

    private boolean truncated;

    /**
     * Appends a node unless the chain is full.
     *
     * @param node the node to append
     * @return true if the node was appended
     */
    public boolean append(final ProvenanceNode node) {
        if (isFull()) {
            truncated = true;
            return false;
        }
        nodes.add(node);
        return true;
    }

    /** Checks whether the chain reached its cap. */
    public boolean isFull() {
        return nodes.size() >= MAX_NODES;
    }

    /** Checks whether any append or descent was cut by a bound. */
    public boolean isTruncated() {
        return truncated;
    }

    /** Marks the chain as cut short by a bound. */
    void markTruncated() {
        truncated = true;
    }

    /** Returns the number of nodes. */
    public int size() {
        return nodes.size();
    }

    /**
     * Returns the node at a position.
     *
     * @param position the 0-based position
     * @return the node
     */
    public ProvenanceNode get(final int position) {
        return nodes.get(position);
    }

    /** Returns the nodes in discovery order (unmodifiable). */
    @JsonValue
    public List<ProvenanceNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }
}
