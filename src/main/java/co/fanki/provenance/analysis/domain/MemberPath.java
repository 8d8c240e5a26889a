package co.fanki.provenance.analysis.domain;

/**
 * A property-access chain reduced to its root identifier.
 *
 * <p>For {@code a.b["c"][0]} the root is {@code a} and the path is
 * {@code .b["c"][0]}. A bare identifier has an empty path.</p>
 *
 * @param root the root identifier
 * @param path the textual access path, empty for the root itself
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MemberPath(String root, String path) {}
