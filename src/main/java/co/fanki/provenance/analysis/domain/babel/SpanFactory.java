package co.fanki.provenance.analysis.domain.babel;

/**
 * Formats source spans for one module.
 *
 * <p>A span is {@code "<file>:<line>"} with a 1-indexed line, or
 * {@code "<file>:0"} when the node has no location.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SpanFactory {

    private final String file;

    /**
     * Creates a span factory for the given module.
     *
     * @param theFile the logical file path used as span prefix
     */
    public SpanFactory(final String theFile) {
        this.file = theFile;
    }

    /**
     * Returns the span of a node.
     *
     * @param node the node, may be null
     * @return the span, with line 0 when the location is unknown
     */
    public String of(final JsNode node) {
        return file + ":" + (node == null ? 0 : node.line());
    }

    /**
     * Returns the line component of a span.
     *
     * @param span a span produced by any span factory
     * @return the line, or 0 when the span carries none
     */
    public static int lineOf(final String span) {
        final int colon = span.lastIndexOf(':');
        if (colon < 0) {
            return 0;
        }
        try {
            return Integer.parseInt(span.substring(colon + 1));
        } catch (final NumberFormatException e) {
            return 0;
        }
    }

    /** Returns the logical file path. */
    public String file() {
        return file;
    }
}
