package org.pragmatica.sharplint.rules.ordering;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.pragmatica.sharplint.error.Diagnostic;
import org.pragmatica.sharplint.parser.CSharpParser;
import org.pragmatica.sharplint.rules.DiagnosticSink;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxNodes;
import org.pragmatica.sharplint.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ElementsOrderedByAccessRuleTest {

    private static final String PROPERTIES_AND_INDEXERS = """
        class Foo
        {
            int P { get; set; }
            public int Q { get; set; }
            protected int this[int i] => i;
            public int this[string s] => 0;
        }
        """;

    private final ElementsOrderedByAccessRule rule = new ElementsOrderedByAccessRule();

    static Stream<Arguments> modifierCombinations() {
        return Stream.of(Arguments.of(null, "protected"),
                         Arguments.of(null, "protected internal"),
                         Arguments.of(null, "internal"),
                         Arguments.of(null, "public"),
                         Arguments.of("private", "protected"),
                         Arguments.of("private", "protected internal"),
                         Arguments.of("private", "internal"),
                         Arguments.of("private", "public"),
                         Arguments.of("protected", "protected internal"),
                         Arguments.of("protected", "internal"),
                         Arguments.of("protected", "public"),
                         Arguments.of("protected internal", "internal"),
                         Arguments.of("protected internal", "public"),
                         Arguments.of("internal", "public"));
    }

    @ParameterizedTest
    @MethodSource("modifierCombinations")
    void fieldsOutOfOrder_areReported(String modifier1, String modifier2) {
        var source = "class Foo\n{ \n    " + prefix(modifier1) + "int field1;\n    " + prefix(modifier2)
                     + "int field2;\n}";

        assertSingleDiagnostic(source, modifier1, modifier2, "fields");
    }

    @ParameterizedTest
    @MethodSource("modifierCombinations")
    void methodsOutOfOrder_areReported(String modifier1, String modifier2) {
        var source = "class Foo\n{ \n    " + prefix(modifier1) + "void Method1()\n    {\n    }\n\n    "
                     + prefix(modifier2) + "void Method2()\n    {\n    }\n}";

        assertSingleDiagnostic(source, modifier1, modifier2, "methods");
    }

    @ParameterizedTest
    @MethodSource("modifierCombinations")
    void delegatesOutOfOrder_areReported(String modifier1, String modifier2) {
        var source = "class Foo\n{ \n    " + prefix(modifier1) + "delegate void DoSomething1();\n    "
                     + prefix(modifier2) + "delegate void DoSomething2();\n}";

        assertSingleDiagnostic(source, modifier1, modifier2, "delegates");
    }

    @ParameterizedTest
    @MethodSource("modifierCombinations")
    void eventsOutOfOrder_areReported(String modifier1, String modifier2) {
        var source = "class Foo\n{ \n    " + prefix(modifier1)
                     + "event System.EventHandler<System.EventArgs> MyEvent1;\n    " + prefix(modifier2)
                     + "event System.EventHandler<System.EventArgs> MyEvent2;\n}";

        assertSingleDiagnostic(source, modifier1, modifier2, "events");
    }

    @Test
    void emptySource_reportsNothing() {
        assertThat(analyze("")).isEmpty();
    }

    @Test
    void correctOrder_reportsNothing() {
        var source = """
            class Foo
            {
                public int field1;
                internal int field2;
                protected internal int field3;
                protected int field4;
                private int field5;
            }
            """;

        assertThat(analyze(source)).isEmpty();
    }

    @Test
    void equalPriorities_neverTrigger() {
        var source = """
            class Foo
            {
                int a;
                private int b;
                private static int c;
            }
            """;

        assertThat(analyze(source)).isEmpty();
    }

    @Test
    void kindsDoNotCrossTrigger() {
        var source = """
            class Foo
            {
                private int field;
                public void Method() { }
            }
            """;

        assertThat(analyze(source)).isEmpty();
    }

    @Test
    void everyViolatingPair_isReportedWithNearestPresentPriority() {
        var source = """
            class Foo
            {
                private int a;
                internal int b;
                private int c;
                public int d;
            }
            """;

        var diagnostics = analyze(source);

        assertThat(diagnostics).extracting(Diagnostic::message)
                               .containsExactly("All private fields must be placed after all internal fields",
                                                "All private fields must be placed after all internal fields");
        assertThat(diagnostics).extracting(d -> d.location().line()).containsExactly(3, 5);
    }

    @Test
    void anchor_isFirstModifierOfAnyKind() {
        var source = """
            class Foo
            {
                static private int a;
                public int b;
            }
            """;

        var diagnostics = analyze(source);

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).location().column()).isEqualTo(5);
        assertThat(diagnostics.get(0).span().extract(source)).isEqualTo("static");
    }

    @Test
    void nestedTypesAndStructs_areContainersOfTheirOwn() {
        var source = """
            class Outer
            {
                public int a;

                struct Inner
                {
                    private void M() { }
                    public void N() { }
                }

                private int b;
            }
            """;

        var diagnostics = analyze(source);

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).arguments()).containsExactly("private", "public", "methods");
    }

    @Test
    void propertiesAndIndexers_areCheckedWhenConfigured() {
        var tree = parse(PROPERTIES_AND_INDEXERS);
        var container = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.CLASS_DECLARATION).get(0);

        var withAccessors = new ElementsOrderedByAccessRule(EnumSet.of(MemberKind.PROPERTIES, MemberKind.INDEXERS));

        assertThat(withAccessors.evaluateOrdering(tree, container)).extracting(d -> d.arguments().get(2))
                                                                   .containsExactly("properties", "indexers");
    }

    @Test
    void propertiesAndIndexers_areIgnoredByDefault() {
        assertThat(rule.memberKinds()).containsExactlyInAnyOrder(MemberKind.FIELDS,
                                                                 MemberKind.METHODS,
                                                                 MemberKind.DELEGATES,
                                                                 MemberKind.EVENTS);
        assertThat(analyze(PROPERTIES_AND_INDEXERS)).isEmpty();
    }

    @Test
    void configuredKinds_limitTheCheck() {
        var source = """
            class Foo
            {
                private int a;
                public int b;
                private void M() { }
                public void N() { }
            }
            """;
        var tree = parse(source);
        var container = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.CLASS_DECLARATION).get(0);

        var methodsOnly = new ElementsOrderedByAccessRule(EnumSet.of(MemberKind.METHODS));

        assertThat(methodsOnly.evaluateOrdering(tree, container)).extracting(d -> d.arguments().get(2))
                                                                 .containsExactly("methods");
        assertThat(rule.evaluateOrdering(tree, container, MemberKind.FIELDS)).hasSize(1);
    }

    @Test
    void evaluateOrdering_ignoresNonContainers() {
        var tree = parse("interface I { void B(); public void A(); }");
        var container = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.INTERFACE_DECLARATION).get(0);

        assertThat(rule.evaluateOrdering(tree, container)).isEmpty();
    }

    private void assertSingleDiagnostic(String source, String modifier1, String modifier2, String label) {
        var diagnostics = analyze(source);

        assertThat(diagnostics).hasSize(1);
        var diagnostic = diagnostics.get(0);
        assertThat(diagnostic.id()).isEqualTo("SA1202");
        assertThat(diagnostic.location().line()).isEqualTo(3);
        assertThat(diagnostic.location().column()).isEqualTo(5);
        assertThat(diagnostic.arguments()).containsExactly(modifier1 == null
                                                           ? "private"
                                                           : modifier1, modifier2, label);
    }

    private List<Diagnostic> analyze(String source) {
        var diagnostics = new ArrayList<Diagnostic>();
        rule.analyze(parse(source), DiagnosticSink.collectingInto(diagnostics));
        return diagnostics;
    }

    private static SyntaxTree parse(String source) {
        return CSharpParser.parse(source).unwrap();
    }

    private static String prefix(String modifier) {
        return modifier == null
               ? ""
               : modifier + " ";
    }
}
