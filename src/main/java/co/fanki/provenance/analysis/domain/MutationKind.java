package co.fanki.provenance.analysis.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a module value is mutated.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum MutationKind {

    /** {@code x = ...}, {@code x.y += ...}. */
    ASSIGN("assign"),
    /** {@code x++}, {@code --x.y}. */
    UPDATE("update"),
    /** {@code Object.assign(x, ...)}. */
    OBJECT_ASSIGN("call:Object.assign"),
    /** {@code x.push(...)}, {@code unshift}, {@code splice}. */
    PUSH("call:push"),
    /** {@code x.set(...)}, {@code setIn}. */
    SET("call:set");

    private final String tag;

    MutationKind(final String theTag) {
        this.tag = theTag;
    }

    /**
     * Maps a method name to the mutation it performs on its receiver.
     *
     * @param method the called method name
     * @return the mutation kind, or null when the method is not known to
     *         mutate its receiver
     */
    public static MutationKind ofMethod(final String method) {
        if (method == null) {
            return null;
        }
        return switch (method) {
            case "push", "unshift", "splice" -> PUSH;
            case "set", "setIn" -> SET;
            default -> null;
        };
    }

    /** Returns the tag of this kind. */
    @JsonValue
    public String tag() {
        return tag;
    }
}
