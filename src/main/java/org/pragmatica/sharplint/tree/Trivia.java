package org.pragmatica.sharplint.tree;

/**
 * Trivia represents non-semantic content attached to a token: whitespace, line breaks,
 * comments and preprocessor directives.
 */
public sealed interface Trivia {
    String text();

    default int width() {
        return text().length();
    }

    default boolean isWhitespace() {
        return this instanceof Whitespace;
    }

    default boolean isEndOfLine() {
        return this instanceof EndOfLine;
    }

    default boolean isComment() {
        return this instanceof SingleLineComment || this instanceof MultiLineComment;
    }

    /**
     * Run of spaces and tabs, never containing a line break.
     */
    record Whitespace(String text) implements Trivia {}

    /**
     * One line break: {@code "\n"}, {@code "\r\n"} or {@code "\r"}.
     */
    record EndOfLine(String text) implements Trivia {}

    /**
     * {@code // ...} up to, but excluding, the line break.
     */
    record SingleLineComment(String text) implements Trivia {}

    record MultiLineComment(String text) implements Trivia {}

    /**
     * {@code #region}, {@code #if} and friends, up to the line break.
     */
    record Directive(String text) implements Trivia {}

    static Trivia whitespace(String text) {
        return new Whitespace(text);
    }

    static Trivia endOfLine(String text) {
        return new EndOfLine(text);
    }
}
