package co.fanki.provenance.analysis.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a literal value.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum LiteralKind {

    STRING("string"),
    NUMBER("number"),
    /** Booleans and null. */
    OTHER("other");

    private final String tag;

    LiteralKind(final String theTag) {
        this.tag = theTag;
    }

    /** Returns the lowercase tag of this category. */
    @JsonValue
    public String tag() {
        return tag;
    }
}
