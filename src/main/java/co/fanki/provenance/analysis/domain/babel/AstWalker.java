package co.fanki.provenance.analysis.domain.babel;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Pre-order traversal of a Babel AST.
 *
 * <p>Nodes are visited in source order, parents before children. The
 * walk keeps its own work stack instead of recursing, so the depth of
 * the analyzed tree is bounded by heap, not by the thread's stack.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AstWalker {

    private AstWalker() {
    }

    /**
     * Visits every node reachable from the root.
     *
     * @param root the root node, ignored when null
     * @param visitor the callback invoked once per node
     */
    public static void walk(final JsNode root, final Consumer<JsNode> visitor) {
        if (root == null) {
            return;
        }
        final Deque<JsNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final JsNode node = stack.pop();
            visitor.accept(node);
            final List<JsNode> children = node.childNodes();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }
}
