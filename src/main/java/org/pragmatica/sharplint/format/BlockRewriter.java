package org.pragmatica.sharplint.format;

import org.pragmatica.sharplint.tree.SyntaxElement;
import org.pragmatica.sharplint.tree.SyntaxNode;
import org.pragmatica.sharplint.tree.SyntaxRewriter;
import org.pragmatica.sharplint.tree.SyntaxToken;

/**
 * Splices a {@link FormattedBlock} back into the tree it was computed from.
 *
 * <p>The captured block and preceding token are matched by reference, never by value, so an equal-looking block
 * elsewhere in the tree is left alone.
 */
final class BlockRewriter extends SyntaxRewriter {
    private final FormattedBlock formatted;

    BlockRewriter(FormattedBlock formatted) {
        this.formatted = formatted;
    }

    @Override
    public SyntaxElement visitToken(SyntaxToken token) {
        if (token == formatted.precedingToken()) {
            return formatted.newPrecedingToken()
                            .orElse(token);
        }
        return super.visitToken(token);
    }

    @Override
    public SyntaxElement visitNode(SyntaxNode node) {
        if (node == formatted.originalBlock()) {
            return formatted.newBlock();
        }
        return super.visitNode(node);
    }
}
