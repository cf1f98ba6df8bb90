package org.pragmatica.sharplint;

import org.junit.jupiter.api.Test;
import org.pragmatica.sharplint.error.Diagnostic;
import org.pragmatica.sharplint.rules.SyntaxRule;
import org.pragmatica.sharplint.rules.ordering.MemberKind;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxNodes;
import org.pragmatica.sharplint.tree.SyntaxTree;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class SharpLintTest {

    private static final String SOURCE = """
        class Foo
        {
            private int a;
            public int b;

            void Bar()
            {
                if (x) { Y(); }
            }
        }
        """;

    private final SyntaxTree tree = SharpLint.parse(SOURCE).unwrap();

    @Test
    void analyze_runsAllRulesSortedByLocation() {
        var diagnostics = SharpLint.sharpLint().analyze(tree);

        assertThat(diagnostics).extracting(Diagnostic::id)
                               .containsExactly("SA1202", "SA1501");
        assertThat(diagnostics.get(0).message()).isEqualTo("All private fields must be placed after all public fields");
        assertThat(diagnostics.get(0).location().line()).isEqualTo(3);
        assertThat(diagnostics.get(1).location().line()).isEqualTo(8);
    }

    @Test
    void disabledRule_isNotRun() {
        var lint = SharpLint.builder()
                            .disable("SA1202")
                            .build();

        assertThat(lint.rules()).extracting(SyntaxRule::id)
                                .containsExactly("SA1501");
        assertThat(lint.analyze(tree)).extracting(Diagnostic::id)
                                      .containsExactly("SA1501");
    }

    @Test
    void orderedKinds_limitOrderingCheck() {
        var lint = SharpLint.builder()
                            .orderedKinds(EnumSet.of(MemberKind.METHODS))
                            .build();

        assertThat(lint.analyze(tree)).extracting(Diagnostic::id)
                                      .containsExactly("SA1501");
    }

    @Test
    void evaluateOrdering_checksOneContainer() {
        var container = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.CLASS_DECLARATION)
                                   .get(0);
        var lint = SharpLint.sharpLint();

        assertThat(lint.evaluateOrdering(tree, container)).hasSize(1);
        assertThat(lint.evaluateOrdering(tree, container, MemberKind.METHODS)).isEmpty();
    }

    @Test
    void evaluateOrdering_isEmptyWhenOrderingRuleDisabled() {
        var container = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.CLASS_DECLARATION)
                                   .get(0);
        var lint = SharpLint.builder()
                            .disable("SA1202")
                            .build();

        assertThat(lint.evaluateOrdering(tree, container)).isEmpty();
        assertThat(lint.evaluateOrdering(tree, container, MemberKind.FIELDS)).isEmpty();
    }

    @Test
    void defaultConfig_leavesPropertiesAndIndexersUnchecked() {
        assertThat(LintConfig.DEFAULT.orderedKinds()).containsExactlyInAnyOrder(MemberKind.FIELDS,
                                                                               MemberKind.METHODS,
                                                                               MemberKind.DELEGATES,
                                                                               MemberKind.EVENTS);
        var properties = SharpLint.parse("class Foo\n{\n    int P { get; set; }\n    public int Q { get; set; }\n}\n")
                                  .unwrap();

        assertThat(SharpLint.sharpLint().analyze(properties)).isEmpty();
        assertThat(SharpLint.builder()
                            .orderedKinds(EnumSet.of(MemberKind.PROPERTIES))
                            .build()
                            .analyze(properties)).extracting(Diagnostic::id)
                                                 .containsExactly("SA1202");
    }

    @Test
    void computeFix_onlyFixesSingleLineBlocks() {
        var lint = SharpLint.sharpLint();
        var diagnostics = lint.analyze(tree);

        assertThat(lint.computeFix(tree, diagnostics.get(0))).isEmpty();
        assertThat(lint.computeFix(tree, diagnostics.get(1)).orElseThrow().text()).contains("        if (x)\n        {\n            Y();\n        }\n");
    }

    @Test
    void fixAll_usesConfiguredIndentation() {
        var lint = SharpLint.builder()
                            .indentation(2, false)
                            .build();

        var fixed = lint.fixAll(tree);

        assertThat(fixed.text()).contains("if (x)\n    {\n      Y();\n    }\n");
        assertThat(lint.analyze(fixed)).extracting(Diagnostic::id)
                                       .containsExactly("SA1202");
    }

    @Test
    void fixAll_withSingleLineRuleDisabled_returnsInput() {
        var lint = SharpLint.builder()
                            .disable("SA1501")
                            .build();

        assertThat(lint.fixAll(tree)).isSameAs(tree);
    }
}
