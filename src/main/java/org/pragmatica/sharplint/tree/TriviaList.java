package org.pragmatica.sharplint.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable ordered sequence of trivia attached to one side of a token.
 * Every editing operation returns a new list; the receiver is never changed.
 */
public record TriviaList(List<Trivia> items) {
    public static final TriviaList EMPTY = new TriviaList(List.of());

    public TriviaList {
        items = List.copyOf(items);
    }

    public static TriviaList of(Trivia... trivia) {
        return trivia.length == 0
               ? EMPTY
               : new TriviaList(List.of(trivia));
    }

    public static TriviaList of(List<Trivia> trivia) {
        return trivia.isEmpty()
               ? EMPTY
               : new TriviaList(trivia);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    public Trivia get(int index) {
        return items.get(index);
    }

    public int width() {
        int width = 0;
        for (var trivia : items) {
            width += trivia.width();
        }
        return width;
    }

    public boolean endsWithEndOfLine() {
        return !items.isEmpty() && items.get(items.size() - 1)
                                        .isEndOfLine();
    }

    public boolean containsEndOfLine() {
        return items.stream()
                    .anyMatch(Trivia::isEndOfLine);
    }

    /**
     * Drop whitespace trivia from the end of the list. When {@code includingEndOfLine} is set,
     * line breaks interleaved with that whitespace are dropped as well.
     */
    public TriviaList withoutTrailingWhitespace(boolean includingEndOfLine) {
        int end = items.size();
        while (end > 0 && isTrimmable(items.get(end - 1), includingEndOfLine)) {
            end-- ;
        }
        return end == items.size()
               ? this
               : of(items.subList(0, end));
    }

    public TriviaList withoutTrailingWhitespace() {
        return withoutTrailingWhitespace(false);
    }

    public TriviaList add(Trivia trivia) {
        var result = new ArrayList<Trivia>(items.size() + 1);
        result.addAll(items);
        result.add(trivia);
        return new TriviaList(result);
    }

    public TriviaList addAll(TriviaList other) {
        if (other.isEmpty()) {
            return this;
        }
        var result = new ArrayList<Trivia>(items.size() + other.size());
        result.addAll(items);
        result.addAll(other.items);
        return new TriviaList(result);
    }

    public String fullText() {
        var sb = new StringBuilder(width());
        writeTo(sb);
        return sb.toString();
    }

    void writeTo(StringBuilder sb) {
        for (var trivia : items) {
            sb.append(trivia.text());
        }
    }

    private static boolean isTrimmable(Trivia trivia, boolean includingEndOfLine) {
        return trivia.isWhitespace() || (includingEndOfLine && trivia.isEndOfLine());
    }

    @Override
    public String toString() {
        return fullText();
    }
}
