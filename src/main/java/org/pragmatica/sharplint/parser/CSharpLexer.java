package org.pragmatica.sharplint.parser;

import org.pragmatica.sharplint.tree.SourceLocation;
import org.pragmatica.sharplint.tree.SourceSpan;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxToken;
import org.pragmatica.sharplint.tree.Trivia;
import org.pragmatica.sharplint.tree.TriviaList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lexer for C# source text.
 *
 * <p>Every character of the input ends up either in a token's text or in one of its trivia lists, so the
 * concatenated full text of the produced tokens is the input. A token's trailing trivia stops after the first
 * line break; anything that follows belongs to the next token's leading trivia. The last token is always
 * {@link SyntaxKind#END_OF_FILE_TOKEN}.
 */
public final class CSharpLexer {
    private static final int MAX_INPUT_SIZE = 10_000_000;
    private static final String NUMBER_SUFFIXES = "fFdDmMuUlL";

    private final String input;
    private int pos;
    private int line;
    private int column;
    private boolean atLineStart;

    private CSharpLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.atLineStart = true;
    }

    public static List<LexedToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Source input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new CSharpLexer(input).tokenizeAll();
    }

    private record Scan(SyntaxKind kind, Optional<String> problem) {
        static Scan ok(SyntaxKind kind) {
            return new Scan(kind, Optional.empty());
        }

        static Scan bad(String problem) {
            return new Scan(SyntaxKind.BAD_TOKEN, Optional.of(problem));
        }
    }

    private List<LexedToken> tokenizeAll() {
        var tokens = new ArrayList<LexedToken>();
        while (true) {
            var leading = scanTrivia(false);
            if (isAtEnd()) {
                var eof = new SyntaxToken(SyntaxKind.END_OF_FILE_TOKEN, "", leading, TriviaList.EMPTY);
                tokens.add(LexedToken.of(eof, currentSpan()));
                return tokens;
            }
            var start = currentLocation();
            var scan = nextToken(start);
            var span = span(start);
            atLineStart = false;
            var trailing = scanTrivia(true);
            var token = new SyntaxToken(scan.kind(), span.extract(input), leading, trailing);
            tokens.add(new LexedToken(token, span, scan.problem()));
        }
    }

    private Scan nextToken(SourceLocation start) {
        char c = peek();
        // Verbatim and interpolated strings
        if (c == '@' && peekAt(1) == '"') {
            return scanVerbatimString();
        }
        if (isInterpolatedStringStart()) {
            return scanInterpolatedString();
        }
        // Identifiers, verbatim identifiers and keywords
        if (c == '@' && isIdentifierStart(peekAt(1))) {
            advance();
            scanIdentifierPart();
            return Scan.ok(SyntaxKind.IDENTIFIER_TOKEN);
        }
        if (isIdentifierStart(c)) {
            scanIdentifierPart();
            var text = input.substring(start.offset(), pos);
            return Scan.ok(SyntaxKind.keyword(text)
                                     .orElse(SyntaxKind.IDENTIFIER_TOKEN));
        }
        if (isDigit(c) || (c == '.' && isDigit(peekAt(1)))) {
            return scanNumber();
        }
        if (c == '"') {
            return scanString();
        }
        if (c == '\'') {
            return scanCharacter();
        }
        // Comment that never ends: the trivia scanner left it in place
        if (c == '/' && peekAt(1) == '*') {
            while (!isAtEnd()) {
                advance();
            }
            return Scan.bad("Unterminated comment");
        }
        return scanPunctuation();
    }

    private void scanIdentifierPart() {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
    }

    private Scan scanNumber() {
        if (peek() == '0' && (peekAt(1) == 'x' || peekAt(1) == 'X')) {
            advance();
            advance();
            while (!isAtEnd() && (isHexDigit(peek()) || peek() == '_')) {
                advance();
            }
        }else if (peek() == '0' && (peekAt(1) == 'b' || peekAt(1) == 'B')) {
            advance();
            advance();
            while (!isAtEnd() && (peek() == '0' || peek() == '1' || peek() == '_')) {
                advance();
            }
        }else {
            scanDigits();
            if (!isAtEnd() && peek() == '.' && isDigit(peekAt(1))) {
                advance();
                scanDigits();
            }
            if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
                int sign = (peekAt(1) == '+' || peekAt(1) == '-')
                           ? 1
                           : 0;
                if (isDigit(peekAt(1 + sign))) {
                    advance();
                    if (sign == 1) {
                        advance();
                    }
                    scanDigits();
                }
            }
        }
        while (!isAtEnd() && NUMBER_SUFFIXES.indexOf(peek()) >= 0) {
            advance();
        }
        return Scan.ok(SyntaxKind.NUMERIC_LITERAL_TOKEN);
    }

    private void scanDigits() {
        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            advance();
        }
    }

    private Scan scanString() {
        return skipQuoted('"')
               ? Scan.ok(SyntaxKind.STRING_LITERAL_TOKEN)
               : Scan.bad("Unterminated string literal");
    }

    private Scan scanCharacter() {
        int start = pos;
        if (!skipQuoted('\'')) {
            return Scan.bad("Unterminated character literal");
        }
        return pos - start == 2
               ? Scan.bad("Empty character literal")
               : Scan.ok(SyntaxKind.CHARACTER_LITERAL_TOKEN);
    }

    /**
     * Skip a regular quoted literal with backslash escapes. The literal may not span lines.
     */
    private boolean skipQuoted(char quote) {
        advance();
        // skip opening quote
        while (!isAtEnd() && peek() != quote) {
            if (isLineBreak(peek())) {
                return false;
            }
            if (peek() == '\\' && pos + 1 < input.length() && !isLineBreak(peekAt(1))) {
                advance();
            }
            advance();
        }
        if (isAtEnd()) {
            return false;
        }
        advance();
        // skip closing quote
        return true;
    }

    private Scan scanVerbatimString() {
        advance();
        advance();
        // skip @"
        while (!isAtEnd()) {
            char c = advance();
            if (c == '"') {
                if (isAtEnd() || peek() != '"') {
                    return Scan.ok(SyntaxKind.STRING_LITERAL_TOKEN);
                }
                advance();
                // doubled quote
            }
        }
        return Scan.bad("Unterminated verbatim string literal");
    }

    private boolean isInterpolatedStringStart() {
        char c = peek();
        return (c == '$' && peekAt(1) == '"')
               || (c == '$' && peekAt(1) == '@' && peekAt(2) == '"')
               || (c == '@' && peekAt(1) == '$' && peekAt(2) == '"');
    }

    /**
     * Interpolated strings are kept as one opaque literal token. Holes are tracked only to find the closing quote.
     */
    private Scan scanInterpolatedString() {
        boolean verbatim = false;
        while (peek() != '"') {
            verbatim |= advance() == '@';
        }
        advance();
        int depth = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (depth > 0) {
                if (c == '{') {
                    depth++ ;
                    advance();
                }else if (c == '}') {
                    depth-- ;
                    advance();
                }else if (c == '"' || c == '\'') {
                    if (!skipQuoted(c)) {
                        return Scan.bad("Unterminated string literal in interpolation");
                    }
                }else {
                    advance();
                }
                continue;
            }
            if (c == '"') {
                advance();
                if (verbatim && !isAtEnd() && peek() == '"') {
                    advance();
                    continue;
                }
                return Scan.ok(SyntaxKind.STRING_LITERAL_TOKEN);
            }
            if (!verbatim && isLineBreak(c)) {
                break;
            }
            if (!verbatim && c == '\\') {
                advance();
                if (isAtEnd()) {
                    break;
                }
                advance();
            }else if ((c == '{' && peekAt(1) == '{') || (c == '}' && peekAt(1) == '}')) {
                advance();
                advance();
            }else {
                if (c == '{') {
                    depth++ ;
                }
                advance();
            }
        }
        return Scan.bad("Unterminated interpolated string literal");
    }

    private Scan scanPunctuation() {
        for (var punctuation : SyntaxKind.punctuationByLength()) {
            if (!input.startsWith(punctuation, pos)) {
                continue;
            }
            // "a?.5:b" is a conditional, not a conditional access
            if (punctuation.equals("?.") && isDigit(peekAt(2))) {
                continue;
            }
            for (int i = 0; i < punctuation.length(); i++) {
                advance();
            }
            return Scan.ok(SyntaxKind.punctuation(punctuation)
                                     .orElseThrow());
        }
        char c = advance();
        return Scan.bad("Unexpected character '" + c + "'");
    }

    private TriviaList scanTrivia(boolean trailing) {
        var items = new ArrayList<Trivia>();
        while (!isAtEnd()) {
            char c = peek();
            int start = pos;
            if (isWhitespace(c)) {
                while (!isAtEnd() && isWhitespace(peek())) {
                    advance();
                }
                items.add(new Trivia.Whitespace(input.substring(start, pos)));
            }else if (isLineBreak(c)) {
                advance();
                if (c == '\r' && !isAtEnd() && peek() == '\n') {
                    advance();
                }
                items.add(new Trivia.EndOfLine(input.substring(start, pos)));
                atLineStart = true;
                if (trailing) {
                    break;
                }
            }else if (c == '/' && peekAt(1) == '/') {
                skipToEndOfLine();
                items.add(new Trivia.SingleLineComment(input.substring(start, pos)));
                atLineStart = false;
            }else if (c == '/' && peekAt(1) == '*') {
                int close = input.indexOf("*/", pos + 2);
                if (close < 0) {
                    // left for the token scanner to report
                    break;
                }
                while (pos < close + 2) {
                    advance();
                }
                items.add(new Trivia.MultiLineComment(input.substring(start, pos)));
                atLineStart = false;
            }else if (c == '#' && atLineStart && !trailing) {
                skipToEndOfLine();
                items.add(new Trivia.Directive(input.substring(start, pos)));
            }else {
                break;
            }
        }
        return TriviaList.of(items);
    }

    private void skipToEndOfLine() {
        while (!isAtEnd() && !isLineBreak(peek())) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int ahead) {
        int index = pos + ahead;
        return index < input.length()
               ? input.charAt(index)
               : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++ );
        boolean lineBreak = c == '\n' || (c == '\r' && (isAtEnd() || peek() != '\n'));
        if (lineBreak) {
            line++ ;
            column = 1;
        }else {
            column++ ;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan currentSpan() {
        var loc = currentLocation();
        return SourceSpan.at(loc);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B' || c == '\u00A0' || c == '\uFEFF';
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
