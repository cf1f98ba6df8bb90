package org.pragmatica.sharplint.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.sharplint.rules.layout.SingleLineBlockRule;
import org.pragmatica.sharplint.rules.ordering.ElementsOrderedByAccessRule;
import org.pragmatica.sharplint.tree.SourceLocation;
import org.pragmatica.sharplint.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticTest {

    private static final String SOURCE = "class Foo\n{\n    int a;\n    public int b;\n}\n";
    private static final SourceSpan FIELD_SPAN = SourceSpan.of(SourceLocation.at(3, 5, 16), SourceLocation.at(3, 11, 22));

    private final Diagnostic diagnostic = Diagnostic.create(ElementsOrderedByAccessRule.DESCRIPTOR,
                                                            FIELD_SPAN,
                                                            "private",
                                                            "public",
                                                            "fields");

    @Test
    void message_substitutesArguments() {
        assertThat(diagnostic.id()).isEqualTo("SA1202");
        assertThat(diagnostic.severity()).isEqualTo(Diagnostic.Severity.WARNING);
        assertThat(diagnostic.message()).isEqualTo("All private fields must be placed after all public fields");
    }

    @Test
    void formatMessage_keepsPlaceholdersWithoutArgument() {
        assertThat(ElementsOrderedByAccessRule.DESCRIPTOR.formatMessage(List.of("private")))
            .isEqualTo("All private {2} must be placed after all {1} {2}");
    }

    @Test
    void formatSimple_isSingleLine() {
        assertThat(diagnostic.formatSimple())
            .isEqualTo("input:3:5: warning SA1202: All private fields must be placed after all public fields");
        assertThat(diagnostic).hasToString(diagnostic.formatSimple());
    }

    @Test
    void format_rendersSourceExcerpt() {
        var expected = """
            warning[SA1202]: All private fields must be placed after all public fields
              --> Foo.cs:3:5
              |
            3 |     int a;
              |     ^^^^^^
              |
              = help: http://www.stylecop.com/docs/SA1202.html
            """;

        assertThat(diagnostic.format(SOURCE, "Foo.cs")).isEqualTo(expected);
    }

    @Test
    void byLocation_ordersByStartOffset() {
        var later = Diagnostic.create(SingleLineBlockRule.DESCRIPTOR,
                                      SourceSpan.of(SourceLocation.at(4, 5, 27), SourceLocation.at(4, 11, 33)));
        var list = new ArrayList<>(List.of(later, diagnostic));

        list.sort(Diagnostic.BY_LOCATION);

        assertThat(list).containsExactly(diagnostic, later);
    }
}
