package co.fanki.provenance.analysis.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a provenance chain into edit candidates and a kind summary.
 *
 * <p>Candidates keep the order in which the tracer discovered them, so
 * the spans closest to the traced expression come first. Identifiers,
 * operators and unknown nodes never become candidates.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CandidateRanker {

    private CandidateRanker() {
    }

    /**
     * Derives the edit candidates of a chain.
     *
     * @param chain the provenance chain
     * @return the candidates, deduplicated by (reason, target) keeping the
     *         first occurrence, in discovery order
     */
    public static List<Candidate> rankCandidates(final ProvenanceChain chain) {
        final Set<Candidate> candidates = new LinkedHashSet<>();
        for (final ProvenanceNode node : chain.nodes()) {
            final CandidateReason reason = reasonFor(node.kind());
            if (reason == null) {
                continue;
            }
            candidates.add(new Candidate(node.span(), reason));
            if (node.kind() == ProvenanceKind.CALL && node.fnDefSpan() != null) {
                candidates.add(new Candidate(node.fnDefSpan(),
                        CandidateReason.FN_DEF));
            }
        }
        return List.copyOf(candidates);
    }

    /**
     * Summarizes which kinds of nodes a chain contains.
     *
     * @param chain the provenance chain
     * @return the sorted, distinct lowercase kind tags
     */
    public static List<String> aggregateKinds(final ProvenanceChain chain) {
        final Set<String> kinds = new TreeSet<>();
        for (final ProvenanceNode node : chain.nodes()) {
            kinds.add(node.kind().tag());
        }
        return new ArrayList<>(kinds);
    }

    private static CandidateReason reasonFor(final ProvenanceKind kind) {
        return switch (kind) {
            case LITERAL -> CandidateReason.LITERAL;
            case INIT -> CandidateReason.CONST_INIT;
            case MEMBER -> CandidateReason.MEMBER;
            case OBJECT_PROP, ARRAY_ELEM -> CandidateReason.STRUCTURAL;
            case CALL -> CandidateReason.CALLSITE;
            case CTOR -> CandidateReason.CONSTRUCTOR;
            case IMPORT -> CandidateReason.IMPORT;
            case ENV -> CandidateReason.ENV;
            case IDENT, OP, UNKNOWN -> null;
        };
    }
}
