package org.pragmatica.sharplint.tree;

/**
 * Element of a lossless C# syntax tree - either a node or a token.
 * Elements are immutable and carry no position; positions come from the {@link SyntaxTree}
 * snapshot that contains them.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {
    SyntaxKind kind();

    /**
     * Length of the element's text including all leading and trailing trivia.
     */
    int fullWidth();

    /**
     * Source text including trivia. Concatenating the full text of all children gives the parent's full text.
     */
    default String fullText() {
        var sb = new StringBuilder(fullWidth());
        writeTo(sb);
        return sb.toString();
    }

    /**
     * Source text without the leading trivia of the first token and the trailing trivia of the last token.
     */
    String text();

    TriviaList leadingTrivia();

    TriviaList trailingTrivia();

    void writeTo(StringBuilder sb);

    default boolean isKind(SyntaxKind expected) {
        return kind() == expected;
    }
}
