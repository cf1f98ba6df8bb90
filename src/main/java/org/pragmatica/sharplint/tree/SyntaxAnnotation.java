package org.pragmatica.sharplint.tree;

/**
 * Markers attached to nodes by tree construction helpers.
 */
public enum SyntaxAnnotation {
    /**
     * Node built by {@link SyntaxFactory} whose layout is still subject to formatting.
     * Removed once a rewrite commits the node's trivia as literal text.
     */
    FORMAT
}
