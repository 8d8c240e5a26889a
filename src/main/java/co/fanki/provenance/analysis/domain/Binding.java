package co.fanki.provenance.analysis.domain;

import co.fanki.provenance.analysis.domain.babel.JsNode;

/**
 * What a module-level identifier is bound to.
 *
 * @param name the identifier
 * @param definingSpan the span of the declaring identifier
 * @param init the initializer expression, null when there is none
 * @param importInfo the import this binding comes from, null otherwise
 * @param fnBodySpan the span of the function body for function
 *                   declarations, null otherwise
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Binding(
        String name,
        String definingSpan,
        JsNode init,
        ImportInfo importInfo,
        String fnBodySpan
) {

    /**
     * The module and exported name an import binding refers to.
     *
     * @param source the module specifier, e.g. {@code "./config"}
     * @param imported the imported name, {@code default} or {@code *}
     *                 for default and namespace imports
     */
    public record ImportInfo(String source, String imported) {}

    /** Checks whether the binding has an initializer to follow. */
    public boolean hasInit() {
        return init != null;
    }

    /** Checks whether the binding was introduced by an import. */
    public boolean isImport() {
        return importInfo != null;
    }
}
