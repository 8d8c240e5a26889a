package co.fanki.provenance.analysis.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a span is suggested as an edit target.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum CandidateReason {

    LITERAL("literal"),
    CONST_INIT("const-init"),
    MEMBER("member"),
    /** An object property or array element holding the value. */
    STRUCTURAL("structural"),
    CALLSITE("callsite"),
    /** The definition of a function whose result is the value. */
    FN_DEF("fn-def"),
    CONSTRUCTOR("constructor"),
    IMPORT("import"),
    ENV("env");

    private final String tag;

    CandidateReason(final String theTag) {
        this.tag = theTag;
    }

    /** Returns the lowercase tag of this reason. */
    @JsonValue
    public String tag() {
        return tag;
    }
}
