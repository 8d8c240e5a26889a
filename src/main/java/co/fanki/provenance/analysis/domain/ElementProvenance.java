package co.fanki.provenance.analysis.domain;

import java.util.List;

/**
 * Provenance of the data a rendered JSX element displays.
 *
 * @param element the element name, e.g. {@code h1} or {@code ui.Card}
 * @param span the span of the element's opening tag
 * @param chain the provenance chain of all rendered expressions
 * @param candidates the ranked edit candidates
 * @param kinds the sorted kind tags present in the chain
 * @param symbolRefs the symbol reads of the rendered expressions
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ElementProvenance(
        String element,
        String span,
        ProvenanceChain chain,
        List<Candidate> candidates,
        List<String> kinds,
        List<SymbolRef> symbolRefs
) {
}
