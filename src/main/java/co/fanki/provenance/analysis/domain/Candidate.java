package co.fanki.provenance.analysis.domain;

/**
 * A source span suggested as the place to edit a traced value.
 *
 * <p>Two candidates are the same when both target and reason match.</p>
 *
 * @param target the span to edit
 * @param reason why the span is suggested
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Candidate(String target, CandidateReason reason) {}
