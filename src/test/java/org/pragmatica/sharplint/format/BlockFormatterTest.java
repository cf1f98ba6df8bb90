package org.pragmatica.sharplint.format;

import org.junit.jupiter.api.Test;
import org.pragmatica.sharplint.parser.CSharpParser;
import org.pragmatica.sharplint.tree.SyntaxAnnotation;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxNode;
import org.pragmatica.sharplint.tree.SyntaxNodes;
import org.pragmatica.sharplint.tree.SyntaxToken;
import org.pragmatica.sharplint.tree.SyntaxTree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockFormatterTest {

    private final BlockFormatter formatter = new BlockFormatter(FormattingOptions.DEFAULT);

    @Test
    void singleLineIfBlock_isSpreadOverLines() {
        var tree = parse(inMethod("if (x) { DoWork(); }"));
        var block = block(tree, 1);

        var formatted = formatter.format(tree, block);

        assertThat(formatted.originalBlock()).isSameAs(block);
        assertThat(formatted.newBlock().fullText()).isEqualTo("        {\n            DoWork();\n        }\n");
        assertThat(formatted.newBlock().hasAnnotation(SyntaxAnnotation.FORMAT)).isTrue();
        assertThat(formatted.precedingToken().kind()).isEqualTo(SyntaxKind.CLOSE_PAREN_TOKEN);
        assertThat(formatted.newPrecedingToken()).map(SyntaxToken::fullText)
                                                 .contains(")\n");
    }

    @Test
    void alreadyFormattedBlock_keepsItsText() {
        var tree = parse("""
            class Foo
            {
                void Bar()
                {
                    if (x)
                    {
                        DoWork();
                    }
                }
            }
            """);
        var block = block(tree, 1);

        var formatted = formatter.format(tree, block);

        assertThat(formatted.newBlock().fullText()).isEqualTo(block.fullText());
        assertThat(formatted.newPrecedingToken()).isEmpty();
    }

    @Test
    void lambdaBody_keepsCloseBraceNextToParenthesis() {
        var tree = parse(inMethod("Run(() => { DoWork(); });"));

        var formatted = formatter.format(tree, block(tree, 1));

        assertThat(formatted.newBlock().fullText())
            .isEqualTo("            {\n                DoWork();\n            }");
        assertThat(formatted.precedingToken().kind()).isEqualTo(SyntaxKind.EQUALS_GREATER_THAN_TOKEN);
        assertThat(formatted.newPrecedingToken()).map(SyntaxToken::fullText)
                                                 .contains("=>\n");
    }

    @Test
    void lambdaArgument_keepsCloseBraceNextToComma() {
        var tree = parse(inMethod("F(() => { A(); }, 1);"));

        var formatted = formatter.format(tree, block(tree, 1));

        assertThat(formatted.newBlock().fullText())
            .isEqualTo("            {\n                A();\n            }");
    }

    @Test
    void lambdaInitializer_keepsCloseBraceNextToSemicolon() {
        var tree = parse(inMethod("Action a = () => { A(); };"));

        var formatted = formatter.format(tree, block(tree, 1));

        assertThat(formatted.newBlock().fullText())
            .isEqualTo("            {\n                A();\n            }");
    }

    @Test
    void tokenAfterCloseBrace_keepsItsOwnTrivia() {
        var tree = parse(inMethod("if (x) { A(); } else { B(); }"));
        var elseKeyword = tree.tokens()
                              .stream()
                              .filter(token -> token.kind() == SyntaxKind.ELSE_KEYWORD)
                              .findFirst()
                              .orElseThrow();

        var formatted = formatter.format(tree, block(tree, 1));

        assertThat(formatted.newBlock().fullText()).isEqualTo("        {\n            A();\n        }\n");
        assertThat(formatted.newBlock().tokens()).doesNotContain(elseKeyword);
        assertThat(elseKeyword.leadingTrivia().isEmpty()).isTrue();
    }

    @Test
    void comments_arePreserved() {
        var tree = parse(inMethod("if (x) { /* a */ DoWork(); } // done"));

        var formatted = formatter.format(tree, block(tree, 1));

        assertThat(formatted.newBlock().fullText())
            .isEqualTo("        { /* a */\n            DoWork();\n        } // done\n");
    }

    @Test
    void emptyBlock_getsBracesOnSeparateLines() {
        var tree = parse(inMethod("while (x) { }"));

        var formatted = formatter.format(tree, block(tree, 1));

        assertThat(formatted.newBlock().fullText()).isEqualTo("        {\n        }\n");
    }

    @Test
    void tabsAndCarriageReturns_followOptions() {
        var tabbed = new BlockFormatter(FormattingOptions.DEFAULT.withTabs(true)
                                                                 .withEndOfLine("\r\n"));
        var tree = parse(inMethod("if (x) { DoWork(); }"));

        var formatted = tabbed.format(tree, block(tree, 1));

        assertThat(formatted.newBlock().fullText()).isEqualTo("\t\t{\r\n\t\t\tDoWork();\r\n\t\t}\n");
        assertThat(formatted.newPrecedingToken()).map(SyntaxToken::fullText)
                                                 .contains(")\r\n");
    }

    @Test
    void nonBlockNode_isRejected() {
        var tree = parse(inMethod("DoWork();"));
        var statement = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.EXPRESSION_STATEMENT)
                                   .get(0);

        assertThatThrownBy(() -> formatter.format(tree, statement))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("EXPRESSION_STATEMENT");
    }

    private static String inMethod(String statement) {
        return "class Foo\n{\n    void Bar()\n    {\n        " + statement + "\n    }\n}\n";
    }

    private static SyntaxTree parse(String source) {
        return CSharpParser.parse(source).unwrap();
    }

    private static SyntaxNode block(SyntaxTree tree, int index) {
        return SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.BLOCK)
                          .get(index);
    }
}
