package org.pragmatica.sharplint.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Construction of synthesized tokens, trivia and nodes.
 */
public final class SyntaxFactory {
    private SyntaxFactory() {}

    public static Trivia whitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t') {
                throw new IllegalArgumentException("Whitespace trivia may contain only spaces and tabs");
            }
        }
        return Trivia.whitespace(text);
    }

    public static Trivia endOfLine(String text) {
        if (!text.equals("\n") && !text.equals("\r\n") && !text.equals("\r")) {
            throw new IllegalArgumentException("Not a line break: " + escape(text));
        }
        return Trivia.endOfLine(text);
    }

    public static SyntaxToken token(SyntaxKind kind, TriviaList leading, TriviaList trailing) {
        return new SyntaxToken(kind, kind.text(), leading, trailing);
    }

    /**
     * New block node marked with {@link SyntaxAnnotation#FORMAT}.
     */
    public static SyntaxNode block(SyntaxToken openBrace, List<SyntaxNode> statements, SyntaxToken closeBrace) {
        if (openBrace.kind() != SyntaxKind.OPEN_BRACE_TOKEN || closeBrace.kind() != SyntaxKind.CLOSE_BRACE_TOKEN) {
            throw new IllegalArgumentException("Block must be delimited by braces");
        }
        var children = new ArrayList<SyntaxElement>(statements.size() + 2);
        children.add(openBrace);
        children.addAll(statements);
        children.add(closeBrace);
        return new SyntaxNode(SyntaxKind.BLOCK, children).withAnnotation(SyntaxAnnotation.FORMAT);
    }

    static String escape(String text) {
        return text.replace("\r", "\\r")
                   .replace("\n", "\\n")
                   .replace("\t", "\\t");
    }
}
