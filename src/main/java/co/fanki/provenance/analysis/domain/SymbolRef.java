package co.fanki.provenance.analysis.domain;

/**
 * A read of a module symbol, optionally through a property path.
 *
 * @param file the logical file path of the module
 * @param local the symbol (or root identifier of a member chain)
 * @param path the property path below the symbol, empty for the symbol
 * @param span where the read happens
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SymbolRef(String file, String local, String path, String span) {}
