package org.pragmatica.sharplint.error;

import org.pragmatica.sharplint.tree.SourceLocation;
import org.pragmatica.sharplint.tree.SourceSpan;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A rule violation found in source text.
 *
 * <p>Example output of {@link #format(String, String)}:
 * <pre>
 * warning[SA1202]: All private fields must be placed after all public fields
 *   --> Foo.cs:3:5
 *    |
 *  3 |     private int field1;
 *    |     ^^^^^^^
 *    |
 *    = help: http://www.stylecop.com/docs/SA1202.html
 * </pre>
 *
 * @param descriptor Rule description the diagnostic belongs to
 * @param span       Source span the diagnostic is reported at
 * @param arguments  Ordered message arguments
 */
public record Diagnostic(
    DiagnosticDescriptor descriptor,
    SourceSpan span,
    List<String> arguments) {

    /**
     * Orders diagnostics by position, then by rule id.
     */
    public static final Comparator<Diagnostic> BY_LOCATION = Comparator.comparing((Diagnostic d) -> d.span()
                                                                                                   .start())
                                                                       .thenComparing(Diagnostic::id);

    /**
     * Error severity levels.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info"),
        HINT("hint");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public Diagnostic {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(span, "span");
        arguments = List.copyOf(arguments);
    }

    public static Diagnostic create(DiagnosticDescriptor descriptor, SourceSpan span, String... arguments) {
        return new Diagnostic(descriptor, span, List.of(arguments));
    }

    public String id() {
        return descriptor.id();
    }

    public Severity severity() {
        return descriptor.severity();
    }

    public SourceLocation location() {
        return span.start();
    }

    public String message() {
        return descriptor.formatMessage(arguments);
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The source text
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\r\n|\r|\n", -1);

        // Header: warning[SA1202]: message
        sb.append(severity().display())
          .append("[")
          .append(id())
          .append("]: ")
          .append(message())
          .append("\n");

        // Location: --> filename:line:column
        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename)
              .append(":");
        }
        sb.append(loc.line())
          .append(":")
          .append(loc.column())
          .append("\n");

        int minLine = span.start()
                          .line();
        int maxLine = span.end()
                          .line();
        int gutterWidth = String.valueOf(maxLine)
                                .length();

        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");

        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(underline(lineNum, lineContent))
              .append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");

        if (descriptor.helpLink() != null) {
            sb.append(" ".repeat(gutterWidth + 1))
              .append("= help: ")
              .append(descriptor.helpLink())
              .append("\n");
        }
        return sb.toString();
    }

    private String underline(int lineNum, String lineContent) {
        int startCol = span.start()
                           .line() == lineNum
                       ? span.start()
                             .column()
                       : 1;
        int endCol = span.end()
                         .line() == lineNum
                     ? span.end()
                           .column()
                     : lineContent.length() + 1;
        return " ".repeat(startCol - 1) + "^".repeat(Math.max(1, endCol - startCol));
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        var loc = span.start();
        return String.format("%s:%d:%d: %s %s: %s", "input", loc.line(), loc.column(), severity().display(), id(), message());
    }

    @Override
    public String toString() {
        return formatSimple();
    }
}
