package org.pragmatica.sharplint.tree;

/**
 * A position in source text (line and column, both 1-based; offset 0-based).
 */
public record SourceLocation(int line, int column, int offset) implements Comparable<SourceLocation> {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    public boolean isBefore(SourceLocation other) {
        return offset < other.offset;
    }

    @Override
    public int compareTo(SourceLocation other) {
        return Integer.compare(offset, other.offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
