package co.fanki.provenance.analysis.domain.babel;

import co.fanki.provenance.shared.DomainException;
import co.fanki.provenance.shared.Preconditions;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the Babel AST JSON document supplied by the host parser.
 *
 * <p>Accepts either the {@code File} node emitted by
 * {@code @babel/parser} or a bare {@code Program} node, and always
 * returns the {@code Program}. Deeply nested expressions produce deeply
 * nested JSON, so the nesting limit is raised well above Jackson's
 * default.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class BabelAstReader {

    /** Maximum JSON nesting accepted for one AST document. */
    public static final int MAX_NESTING_DEPTH = 10_000;

    private static final ObjectMapper MAPPER = new ObjectMapper(
            JsonFactory.builder()
                    .streamReadConstraints(StreamReadConstraints.builder()
                            .maxNestingDepth(MAX_NESTING_DEPTH)
                            .build())
                    .build());

    private BabelAstReader() {
    }

    /**
     * Parses an AST document and returns its program node.
     *
     * @param astJson the JSON text of a File or Program node
     * @return the program node
     * @throws DomainException if the text is not a Babel AST
     */
    public static JsNode readProgram(final String astJson) {
        Preconditions.requireNonBlank(astJson, "AST document is required");
        final JsonNode tree;
        try {
            tree = MAPPER.readTree(astJson);
        } catch (final JsonProcessingException e) {
            throw new DomainException("AST document is not valid JSON: "
                    + e.getOriginalMessage(), DomainException.INVALID_AST, e);
        }
        return toProgram(tree);
    }

    /**
     * Returns the program node of an already parsed AST document.
     *
     * @param tree the File or Program JSON object
     * @return the program node
     * @throws DomainException if the tree is not a Babel AST
     */
    public static JsNode toProgram(final JsonNode tree) {
        final JsNode root = JsNode.of(tree);
        if (root == null) {
            throw new DomainException("AST document has no node type",
                    DomainException.INVALID_AST);
        }
        if (root.is("Program")) {
            return root;
        }
        if (root.is("File")) {
            final JsNode program = root.child("program");
            if (program != null && program.is("Program")) {
                return program;
            }
        }
        throw new DomainException("Expected a File or Program node, got "
                + root.type(), DomainException.INVALID_AST);
    }
}
