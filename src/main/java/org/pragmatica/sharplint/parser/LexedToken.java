package org.pragmatica.sharplint.parser;

import org.pragmatica.sharplint.tree.SourceSpan;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxToken;

import java.util.Optional;

/**
 * Token produced by {@link CSharpLexer}, with the span of its text (trivia excluded).
 * Malformed input yields a {@link SyntaxKind#BAD_TOKEN} that carries a problem description.
 */
public record LexedToken(SyntaxToken token, SourceSpan span, Optional<String> problem) {

    public static LexedToken of(SyntaxToken token, SourceSpan span) {
        return new LexedToken(token, span, Optional.empty());
    }

    public static LexedToken bad(SyntaxToken token, SourceSpan span, String problem) {
        return new LexedToken(token, span, Optional.of(problem));
    }

    public SyntaxKind kind() {
        return token.kind();
    }

    public String text() {
        return token.text();
    }

    public boolean isKind(SyntaxKind kind) {
        return token.kind() == kind;
    }

    /**
     * Whether this token touches the next one, with no trivia in between.
     */
    public boolean isAdjacentTo(LexedToken next) {
        return token.trailingTrivia()
                    .isEmpty() && next.token()
                                      .leadingTrivia()
                                      .isEmpty();
    }

    public LexedToken withKind(SyntaxKind kind) {
        return new LexedToken(token.withKind(kind), span, problem);
    }
}
