package co.fanki.provenance.analysis.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tag of a {@link ProvenanceNode}.
 *
 * <p>Each kind carries the lowercase tag reported by
 * {@link CandidateRanker#aggregateKinds}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ProvenanceKind {

    /** A string, number, boolean or null literal. */
    LITERAL("literal"),
    /** A reference to an identifier. */
    IDENT("ident"),
    /** The initializer of a referenced binding. */
    INIT("init"),
    /** A binding introduced by an import declaration. */
    IMPORT("import"),
    /** A property access. */
    MEMBER("member"),
    /** A statically keyed property of an object literal. */
    OBJECT_PROP("object"),
    /** An element of an array literal. */
    ARRAY_ELEM("array"),
    /** A function or method call. */
    CALL("call"),
    /** A constructor call. */
    CTOR("ctor"),
    /** An operator combining other values. */
    OP("op"),
    /** An environment variable read. */
    ENV("env"),
    /** Any expression the tracer does not model. */
    UNKNOWN("unknown");

    private final String tag;

    ProvenanceKind(final String theTag) {
        this.tag = theTag;
    }

    /** Returns the lowercase tag of this kind. */
    @JsonValue
    public String tag() {
        return tag;
    }
}
