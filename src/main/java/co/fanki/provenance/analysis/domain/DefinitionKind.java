package co.fanki.provenance.analysis.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a module-level name was declared.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DefinitionKind {

    VAR("var"),
    LET("let"),
    CONST("const"),
    FUNC("func"),
    CLASS("class");

    private final String tag;

    DefinitionKind(final String theTag) {
        this.tag = theTag;
    }

    /**
     * Maps a variable declaration keyword to its kind.
     *
     * @param keyword {@code var}, {@code let} or {@code const}; anything
     *                else (e.g. {@code using}) is reported as var
     * @return the definition kind
     */
    public static DefinitionKind ofDeclaration(final String keyword) {
        if ("let".equals(keyword)) {
            return LET;
        }
        if ("const".equals(keyword)) {
            return CONST;
        }
        return VAR;
    }

    /** Returns the lowercase tag of this kind. */
    @JsonValue
    public String tag() {
        return tag;
    }
}
