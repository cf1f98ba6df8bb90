package org.pragmatica.sharplint.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.Trivia;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CSharpLexerTest {

    @Test
    void keywordsIdentifiersAndPunctuation_areClassified() {
        var tokens = CSharpLexer.tokenize("public int count;");

        assertThat(tokens).extracting(LexedToken::kind)
                          .containsExactly(SyntaxKind.PUBLIC_KEYWORD,
                                           SyntaxKind.INT_KEYWORD,
                                           SyntaxKind.IDENTIFIER_TOKEN,
                                           SyntaxKind.SEMICOLON_TOKEN,
                                           SyntaxKind.END_OF_FILE_TOKEN);
        assertThat(tokens.get(2).text()).isEqualTo("count");
    }

    @Test
    void contextualKeywords_areLexedAsIdentifiers() {
        var tokens = CSharpLexer.tokenize("partial get yield");

        assertThat(tokens).extracting(LexedToken::kind)
                          .startsWith(SyntaxKind.IDENTIFIER_TOKEN,
                                      SyntaxKind.IDENTIFIER_TOKEN,
                                      SyntaxKind.IDENTIFIER_TOKEN);
    }

    @Test
    void trailingTrivia_endsAtFirstLineBreak() {
        var tokens = CSharpLexer.tokenize("a; // note\n\n  b;");

        var semicolon = tokens.get(1).token();
        assertThat(semicolon.trailingTrivia().fullText()).isEqualTo(" // note\n");
        assertThat(semicolon.trailingTrivia().endsWithEndOfLine()).isTrue();

        var b = tokens.get(2).token();
        assertThat(b.leadingTrivia().fullText()).isEqualTo("\n  ");
        assertThat(b.leadingTrivia().get(0)).isInstanceOf(Trivia.EndOfLine.class);
    }

    @Test
    void triviaAtEndOfFile_belongsToEndOfFileToken() {
        var tokens = CSharpLexer.tokenize("x\n\n/* tail */ ");

        var eof = tokens.get(tokens.size() - 1);
        assertThat(eof.kind()).isEqualTo(SyntaxKind.END_OF_FILE_TOKEN);
        assertThat(eof.token().leadingTrivia().fullText()).isEqualTo("\n/* tail */ ");
    }

    @Test
    void directiveAtLineStart_isTrivia() {
        var tokens = CSharpLexer.tokenize("#region Fields\nint x;\n#endregion\n");

        assertThat(tokens.get(0).kind()).isEqualTo(SyntaxKind.INT_KEYWORD);
        assertThat(tokens.get(0).token().leadingTrivia().get(0)).isInstanceOf(Trivia.Directive.class);
    }

    @Test
    void maximalMunch_prefersLongestPunctuation() {
        var tokens = CSharpLexer.tokenize("a ??= b => c");

        assertThat(tokens).extracting(LexedToken::kind)
                          .contains(SyntaxKind.QUESTION_QUESTION_EQUALS_TOKEN, SyntaxKind.EQUALS_GREATER_THAN_TOKEN);
    }

    @Test
    void literals_areSingleTokens() {
        var tokens = CSharpLexer.tokenize("0x1F 1.5e3f @\"a\"\"b\" $\"x{y}z\" 'c' \"s\\\"t\"");

        assertThat(tokens).extracting(LexedToken::kind)
                          .containsExactly(SyntaxKind.NUMERIC_LITERAL_TOKEN,
                                           SyntaxKind.NUMERIC_LITERAL_TOKEN,
                                           SyntaxKind.STRING_LITERAL_TOKEN,
                                           SyntaxKind.STRING_LITERAL_TOKEN,
                                           SyntaxKind.CHARACTER_LITERAL_TOKEN,
                                           SyntaxKind.STRING_LITERAL_TOKEN,
                                           SyntaxKind.END_OF_FILE_TOKEN);
    }

    @Test
    void unterminatedString_yieldsBadToken() {
        var tokens = CSharpLexer.tokenize("var s = \"open");

        var bad = tokens.stream()
                        .filter(token -> token.isKind(SyntaxKind.BAD_TOKEN))
                        .findFirst();
        assertThat(bad).isPresent();
        assertThat(bad.get().problem()).contains("Unterminated string literal");
    }

    @Test
    void spans_excludeTrivia() {
        var tokens = CSharpLexer.tokenize("a\n  bb");

        var span = tokens.get(1).span();
        assertThat(span.start().line()).isEqualTo(2);
        assertThat(span.start().column()).isEqualTo(3);
        assertThat(span.length()).isEqualTo(2);
    }

    @Test
    void oversizedInput_isRejected() {
        var huge = " ".repeat(10_000_001);

        assertThatThrownBy(() -> CSharpLexer.tokenize(huge)).isInstanceOf(IllegalArgumentException.class);
    }
}
