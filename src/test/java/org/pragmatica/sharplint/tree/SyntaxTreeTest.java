package org.pragmatica.sharplint.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.sharplint.parser.CSharpParser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyntaxTreeTest {

    private static final String SOURCE = """
        class Foo
        {
            int field;
        }
        """;

    private final SyntaxTree tree = CSharpParser.parse(SOURCE).unwrap();

    @Test
    void spans_areComputedFromText() {
        var field = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.FIELD_DECLARATION).get(0);

        var span = tree.span(field);
        assertThat(span.start()).isEqualTo(SourceLocation.at(3, 5, 16));
        assertThat(span.extract(SOURCE)).isEqualTo("int field;");
        assertThat(tree.fullSpan(field).extract(SOURCE)).isEqualTo("    int field;\n");
    }

    @Test
    void parentAndAncestors_followStructure() {
        var field = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.FIELD_DECLARATION).get(0);

        assertThat(tree.parent(field)).map(SyntaxNode::kind).contains(SyntaxKind.CLASS_DECLARATION);
        assertThat(tree.ancestors(field)).extracting(SyntaxNode::kind)
                                         .containsExactly(SyntaxKind.CLASS_DECLARATION, SyntaxKind.COMPILATION_UNIT);
        assertThat(tree.parent(tree.root())).isEmpty();
    }

    @Test
    void nextAndPreviousToken_walkTokenStream() {
        var open = tree.tokens().get(2);

        assertThat(open.kind()).isEqualTo(SyntaxKind.OPEN_BRACE_TOKEN);
        assertThat(tree.previousToken(open)).map(SyntaxToken::text).contains("Foo");
        assertThat(tree.nextToken(open)).map(SyntaxToken::kind).contains(SyntaxKind.INT_KEYWORD);
        assertThat(tree.previousToken(tree.tokens().get(0))).isEmpty();
    }

    @Test
    void findToken_includesTrivia() {
        // offset 13 is inside the indentation before "int"
        assertThat(tree.findToken(13)).map(SyntaxToken::kind).contains(SyntaxKind.INT_KEYWORD);
        assertThat(tree.findToken(SOURCE.length())).map(SyntaxToken::kind).contains(SyntaxKind.END_OF_FILE_TOKEN);
        assertThat(tree.findToken(-1)).isEmpty();
    }

    @Test
    void findNode_returnsInnermostOrOutermost() {
        var fieldSpan = tree.span(SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.FIELD_DECLARATION).get(0));

        assertThat(tree.findNode(fieldSpan, true)).map(SyntaxNode::kind).contains(SyntaxKind.FIELD_DECLARATION);

        var typeSpan = tree.span(SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.TYPE).get(0));
        assertThat(tree.findNode(typeSpan, true)).map(SyntaxNode::kind).contains(SyntaxKind.TYPE);
    }

    @Test
    void foreignElements_areRejected() {
        var other = CSharpParser.parse(SOURCE).unwrap();

        assertThat(tree.contains(other.root())).isFalse();
        assertThatThrownBy(() -> tree.parent(other.root())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withRoot_sameRootReturnsSameSnapshot() {
        assertThat(tree.withRoot(tree.root())).isSameAs(tree);
        assertThat(tree.lineCount()).isEqualTo(5);
    }

    @Test
    void nodeTrivia_editsRebuildOnlyTheSpine() {
        var classNode = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.CLASS_DECLARATION).get(0);

        var edited = classNode.withLeadingTrivia(TriviaList.of(new Trivia.SingleLineComment("// hi"),
                                                               Trivia.endOfLine("\n")));

        assertThat(edited.fullText()).isEqualTo("// hi\n" + classNode.fullText());
        assertThat(edited.children().get(2)).isSameAs(classNode.children().get(2));
    }
}
