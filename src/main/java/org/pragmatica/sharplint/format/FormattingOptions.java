package org.pragmatica.sharplint.format;

import org.pragmatica.sharplint.tree.SyntaxFactory;
import org.pragmatica.sharplint.tree.Trivia;

import java.util.Objects;

/**
 * Whitespace conventions used when synthesizing trivia.
 *
 * @param indentationSize Columns per indentation step when indenting with spaces
 * @param useTabs         Indent with one tab per step instead of spaces
 * @param endOfLine       Line break inserted by the formatter: {@code "\n"}, {@code "\r\n"} or {@code "\r"}
 */
public record FormattingOptions(
    int indentationSize,
    boolean useTabs,
    String endOfLine) {

    public static final FormattingOptions DEFAULT = new FormattingOptions(
        4,
        false,
        "\n"
    );

    public FormattingOptions {
        Objects.requireNonNull(endOfLine, "endOfLine");
        if (indentationSize < 1) {
            throw new IllegalArgumentException("Indentation size must be positive, got " + indentationSize);
        }
        if (!endOfLine.equals("\n") && !endOfLine.equals("\r\n") && !endOfLine.equals("\r")) {
            throw new IllegalArgumentException("Unsupported end of line sequence");
        }
    }

    public FormattingOptions withIndentationSize(int size) {
        return new FormattingOptions(size, useTabs, endOfLine);
    }

    public FormattingOptions withTabs(boolean tabs) {
        return new FormattingOptions(indentationSize, tabs, endOfLine);
    }

    public FormattingOptions withEndOfLine(String eol) {
        return new FormattingOptions(indentationSize, useTabs, eol);
    }

    /**
     * Indentation text for the given number of steps.
     */
    public String indentation(int steps) {
        return useTabs
               ? "\t".repeat(steps)
               : " ".repeat(steps * indentationSize);
    }

    public Trivia endOfLineTrivia() {
        return SyntaxFactory.endOfLine(endOfLine);
    }
}
