package org.pragmatica.sharplint.format;

import org.pragmatica.sharplint.tree.SyntaxFactory;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxNode;
import org.pragmatica.sharplint.tree.SyntaxToken;
import org.pragmatica.sharplint.tree.SyntaxTree;
import org.pragmatica.sharplint.tree.TriviaList;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Lays a block out over several lines: each brace and each statement on its own line, indented by structure.
 *
 * <p>Only trivia at the edges of the braces and statements changes. Comments are kept, statement internals are
 * not touched, and a block that is already laid out this way comes back unchanged in text.
 *
 * <p>Outside the block only the token before the open brace is rewritten. When a line break is appended after
 * the close brace, the token that follows keeps its own leading trivia, so a continuation such as {@code else},
 * {@code catch}, {@code finally} or the {@code while} of a {@code do} loop starts at column 1 until the file is
 * reindented.
 */
public final class BlockFormatter {
    private static final Set<SyntaxKind> CLOSE_BRACE_FOLLOWERS = EnumSet.of(SyntaxKind.CLOSE_PAREN_TOKEN,
                                                                            SyntaxKind.COMMA_TOKEN,
                                                                            SyntaxKind.SEMICOLON_TOKEN);

    private final IndentationCalculator indentation;

    public BlockFormatter(FormattingOptions options) {
        this.indentation = new IndentationCalculator(options);
    }

    public FormattedBlock format(SyntaxTree tree, SyntaxNode block) {
        if (block.kind() != SyntaxKind.BLOCK) {
            throw new IllegalArgumentException("Expected a block, got " + block.kind());
        }
        var openBrace = block.firstToken();
        var closeBrace = block.lastToken();
        var precedingToken = tree.previousToken(openBrace)
                                 .orElseThrow(() -> new IllegalArgumentException("Block has no preceding token"));

        int steps = indentation.blockSteps(tree, block);
        var braceIndent = indentation.render(steps);
        var statementIndent = indentation.render(steps + 1);
        var eol = indentation.options()
                             .endOfLineTrivia();

        var newOpenBrace = SyntaxFactory.token(SyntaxKind.OPEN_BRACE_TOKEN,
                                               indented(openBrace.leadingTrivia(), braceIndent),
                                               openBrace.trailingTrivia()
                                                        .withoutTrailingWhitespace(true)
                                                        .add(eol));

        var statements = new ArrayList<SyntaxNode>();
        for (var statement : block.childNodes()) {
            statements.add(statement.withLeadingTrivia(indented(statement.leadingTrivia(), statementIndent))
                                    .withTrailingTrivia(statement.trailingTrivia()
                                                                 .withoutTrailingWhitespace(true)
                                                                 .add(eol)));
        }

        var closeTrailing = closeBrace.trailingTrivia()
                                      .withoutTrailingWhitespace();
        boolean followedByPunctuation = tree.nextToken(closeBrace)
                                            .map(next -> CLOSE_BRACE_FOLLOWERS.contains(next.kind()))
                                            .orElse(false);
        if (!followedByPunctuation && !closeTrailing.endsWithEndOfLine()) {
            closeTrailing = closeTrailing.add(eol);
        }
        var newCloseBrace = SyntaxFactory.token(SyntaxKind.CLOSE_BRACE_TOKEN,
                                                indented(closeBrace.leadingTrivia(), braceIndent),
                                                closeTrailing);

        var newBlock = SyntaxFactory.block(newOpenBrace, statements, newCloseBrace);
        return new FormattedBlock(block, newBlock, precedingToken, reformatPreceding(tree, precedingToken, openBrace));
    }

    /**
     * The token before the open brace gets a line break when it ends on the line the brace starts on.
     */
    private Optional<SyntaxToken> reformatPreceding(SyntaxTree tree, SyntaxToken precedingToken, SyntaxToken openBrace) {
        int precedingEndLine = tree.span(precedingToken)
                                   .end()
                                   .line();
        int braceLine = tree.span(openBrace)
                            .start()
                            .line();
        if (precedingEndLine != braceLine) {
            return Optional.empty();
        }
        var trailing = precedingToken.trailingTrivia()
                                     .withoutTrailingWhitespace(true)
                                     .add(indentation.options()
                                                     .endOfLineTrivia());
        return Optional.of(precedingToken.withTrailingTrivia(trailing));
    }

    private static TriviaList indented(TriviaList leading, String indent) {
        var trimmed = leading.withoutTrailingWhitespace();
        return indent.isEmpty()
               ? trimmed
               : trimmed.add(SyntaxFactory.whitespace(indent));
    }
}
