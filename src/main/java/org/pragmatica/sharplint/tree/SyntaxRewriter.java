package org.pragmatica.sharplint.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first tree transformation that preserves identity.
 *
 * <p>Children are visited once each, in source order. A node is rebuilt only when at least one child came back
 * as a different instance; otherwise the original node is returned as is. Subclasses override
 * {@link #visitNode(SyntaxNode)} or {@link #visitToken(SyntaxToken)} and delegate to the base implementation
 * for elements they leave alone.
 */
public abstract class SyntaxRewriter {

    public SyntaxElement visit(SyntaxElement element) {
        return element instanceof SyntaxNode node
               ? visitNode(node)
               : visitToken((SyntaxToken) element);
    }

    /**
     * Rewrite a root node. Roots must stay nodes, so a rewriter that turns the root into a token is rejected.
     */
    public SyntaxNode rewrite(SyntaxNode root) {
        if (visit(root) instanceof SyntaxNode result) {
            return result;
        }
        throw new IllegalStateException("Rewriter replaced root node " + root.kind() + " with a token");
    }

    public SyntaxElement visitNode(SyntaxNode node) {
        List<SyntaxElement> rewritten = null;
        var children = node.children();
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            var result = visit(child);
            if (result != child && rewritten == null) {
                rewritten = new ArrayList<>(children.subList(0, i));
            }
            if (rewritten != null) {
                rewritten.add(result);
            }
        }
        return rewritten == null
               ? node
               : node.withChildren(rewritten);
    }

    public SyntaxElement visitToken(SyntaxToken token) {
        return token;
    }
}
