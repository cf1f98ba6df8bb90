package org.pragmatica.sharplint.format;

import org.junit.jupiter.api.Test;
import org.pragmatica.sharplint.error.Diagnostic;
import org.pragmatica.sharplint.parser.CSharpParser;
import org.pragmatica.sharplint.rules.DiagnosticSink;
import org.pragmatica.sharplint.rules.layout.SingleLineBlockRule;
import org.pragmatica.sharplint.tree.SyntaxAnnotation;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxNodes;
import org.pragmatica.sharplint.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SingleLineBlockFixTest {

    private final SingleLineBlockFix fix = new SingleLineBlockFix(FormattingOptions.DEFAULT);

    @Test
    void computeFix_reformatsBlockAtDiagnostic() {
        var tree = parse("""
            class Foo
            {
                void Bar()
                {
                    if (x) { DoWork(); }
                }
            }
            """);

        var fixed = fix.computeFix(tree, diagnostics(tree).get(0));

        assertThat(fixed).map(SyntaxTree::text)
                         .contains("""
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
        assertThat(diagnostics(fixed.orElseThrow())).isEmpty();
    }

    @Test
    void computeFix_isEmptyWhenLocationIsNotABlock() {
        var tree = parse("""
            class Foo
            {
                int field;
            }
            """);
        var field = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.FIELD_DECLARATION)
                               .get(0);

        assertThat(fix.computeFix(tree, tree.span(field))).isEmpty();
    }

    @Test
    void computeFix_leavesUntouchedSubtreesIdentical() {
        var tree = parse("""
            class Foo
            {
                void A()
                {
                    if (x) { Y(); }
                }

                void B()
                {
                    Z();
                }
            }
            """);
        var untouched = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.METHOD_DECLARATION)
                                   .get(1);

        var fixed = fix.computeFix(tree, diagnostics(tree).get(0)).orElseThrow();

        assertThat(SyntaxNodes.descendantsOfKind(fixed.root(), SyntaxKind.METHOD_DECLARATION)
                              .get(1)).isSameAs(untouched);
        assertThat(SyntaxNodes.descendants(fixed.root(), node -> node.hasAnnotation(SyntaxAnnotation.FORMAT)))
            .isEmpty();
        assertThat(fixed.text()).endsWith("""
                void B()
                {
                    Z();
                }
            }
            """);
    }

    @Test
    void computeFix_replacesOnlyTheLocatedInstanceAmongEqualBlocks() {
        var tree = parse("""
            class Foo
            {
                void Bar()
                {
                    if (x) { Y(); }
                    if (x) { Y(); }
                }
            }
            """);
        var blocks = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.BLOCK);
        var first = blocks.get(1);
        assertThat(first).isEqualTo(blocks.get(2))
                         .isNotSameAs(blocks.get(2));

        var fixed = fix.computeFix(tree, diagnostics(tree).get(1)).orElseThrow();

        assertThat(SyntaxNodes.descendantsOfKind(fixed.root(), SyntaxKind.BLOCK)
                              .get(1)).isSameAs(first);
        assertThat(fixed.text()).isEqualTo("""
            class Foo
            {
                void Bar()
                {
                    if (x) { Y(); }
                    if (x)
                    {
                        Y();
                    }
                }
            }
            """);
    }

    @Test
    void fixAll_handlesNestedBlocks() {
        var tree = parse("""
            class Foo
            {
                void Bar()
                {
                    if (a) { if (b) { X(); } }
                }
            }
            """);

        var fixed = fix.fixAll(tree);

        assertThat(fixed.text()).isEqualTo("""
            class Foo
            {
                void Bar()
                {
                    if (a)
                    {
                        if (b)
                        {
                            X();
                        }
                    }
                }
            }
            """);
    }

    @Test
    void fixAll_keepsSurroundingText() {
        var tree = parse("""
            class Foo
            {
                // first
                void Bar()
                {
                    if (x) { A(); } // cleanup
                    var n = 1;
                    while (n > 0) { n--; }
                }
            }
            """);

        var fixed = fix.fixAll(tree);

        assertThat(diagnostics(fixed)).isEmpty();
        assertThat(fixed.text()).isEqualTo("""
            class Foo
            {
                // first
                void Bar()
                {
                    if (x)
                    {
                        A();
                    } // cleanup
                    var n = 1;
                    while (n > 0)
                    {
                        n--;
                    }
                }
            }
            """);
    }

    @Test
    void fixAll_returnsSameTreeWhenNothingToFix() {
        var tree = parse("""
            class Foo
            {
                void Bar()
                {
                }
            }
            """);

        assertThat(fix.fixAll(tree)).isSameAs(tree);
    }

    private static SyntaxTree parse(String source) {
        return CSharpParser.parse(source).unwrap();
    }

    private static List<Diagnostic> diagnostics(SyntaxTree tree) {
        var result = new ArrayList<Diagnostic>();
        new SingleLineBlockRule().analyze(tree, DiagnosticSink.collectingInto(result));
        return result;
    }
}
