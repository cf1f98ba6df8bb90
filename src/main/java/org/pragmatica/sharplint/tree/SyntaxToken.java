package org.pragmatica.sharplint.tree;

import java.util.Objects;

/**
 * Lexical unit with its attached trivia.
 *
 * <p>Leading trivia starts at the beginning of the token's line (or right after the previous token's
 * trailing trivia); trailing trivia runs up to and including the first line break after the token.
 *
 * <p>Being a record, two tokens with the same kind, text and trivia are {@code equals}. Tree rewriting
 * never relies on that: substitution compares references captured from one tree snapshot.
 */
public record SyntaxToken(
    SyntaxKind kind,
    String text,
    TriviaList leadingTrivia,
    TriviaList trailingTrivia) implements SyntaxElement {

    public SyntaxToken {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(leadingTrivia, "leadingTrivia");
        Objects.requireNonNull(trailingTrivia, "trailingTrivia");
        if (!kind.isToken()) {
            throw new IllegalArgumentException("Not a token kind: " + kind);
        }
    }

    public static SyntaxToken token(SyntaxKind kind, String text) {
        return new SyntaxToken(kind, text, TriviaList.EMPTY, TriviaList.EMPTY);
    }

    /**
     * Token of a kind with fixed spelling (punctuation or keyword) and no trivia.
     */
    public static SyntaxToken token(SyntaxKind kind) {
        if (kind.text()
                .isEmpty()) {
            throw new IllegalArgumentException("Kind has no fixed text: " + kind);
        }
        return token(kind, kind.text());
    }

    public SyntaxToken withLeadingTrivia(TriviaList trivia) {
        return new SyntaxToken(kind, text, trivia, trailingTrivia);
    }

    public SyntaxToken withTrailingTrivia(TriviaList trivia) {
        return new SyntaxToken(kind, text, leadingTrivia, trivia);
    }

    public SyntaxToken withKind(SyntaxKind newKind) {
        return new SyntaxToken(newKind, text, leadingTrivia, trailingTrivia);
    }

    @Override
    public int fullWidth() {
        return leadingTrivia.width() + text.length() + trailingTrivia.width();
    }

    @Override
    public void writeTo(StringBuilder sb) {
        leadingTrivia.writeTo(sb);
        sb.append(text);
        trailingTrivia.writeTo(sb);
    }

    @Override
    public String toString() {
        return kind + "[" + text + "]";
    }
}
