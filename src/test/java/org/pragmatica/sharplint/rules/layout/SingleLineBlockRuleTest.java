package org.pragmatica.sharplint.rules.layout;

import org.junit.jupiter.api.Test;
import org.pragmatica.sharplint.error.Diagnostic;
import org.pragmatica.sharplint.parser.CSharpParser;
import org.pragmatica.sharplint.rules.DiagnosticSink;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SingleLineBlockRuleTest {

    private final SingleLineBlockRule rule = new SingleLineBlockRule();

    @Test
    void statementBlockOnOneLine_isReportedAtOpenBrace() {
        var source = """
            class Foo
            {
                void Bar()
                {
                    if (x) { DoWork(); }
                }
            }
            """;

        var diagnostics = analyze(source);

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).message()).isEqualTo("Statement must not be on a single line");
        assertThat(diagnostics.get(0).location().line()).isEqualTo(5);
        assertThat(diagnostics.get(0).location().column()).isEqualTo(16);
        assertThat(diagnostics.get(0).span().extract(source)).isEqualTo("{");
    }

    @Test
    void clausesSwitchSectionsAndLambdas_areReported() {
        var source = """
            class Foo
            {
                void Bar()
                {
                    try { A(); } catch { } finally { B(); }
                    if (x)
                    {
                    }
                    else { C(); }
                    switch (y)
                    {
                        case 1: { D(); break; }
                    }
                    Run(() => { E(); });
                    Run(delegate { F(); });
                }
            }
            """;

        assertThat(analyze(source)).extracting(d -> d.location().line())
                                   .containsExactly(5, 5, 5, 9, 12, 14, 15);
    }

    @Test
    void memberAndAccessorBodies_areNotReported() {
        var source = """
            class Foo
            {
                void Bar() { }
                int P { get { return 1; } set { } }
                Foo() { }
            }
            """;

        assertThat(analyze(source)).isEmpty();
    }

    @Test
    void multiLineBlocks_areNotReported() {
        var source = """
            class Foo
            {
                void Bar()
                {
                    while (true)
                    { Tick(); }
                    if (x) {
                        DoWork(); }
                }
            }
            """;

        assertThat(analyze(source)).extracting(d -> d.location().line()).containsExactly(6);
    }

    private List<Diagnostic> analyze(String source) {
        var diagnostics = new ArrayList<Diagnostic>();
        rule.analyze(CSharpParser.parse(source).unwrap(), DiagnosticSink.collectingInto(diagnostics));
        return diagnostics;
    }
}
