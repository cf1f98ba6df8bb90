package org.pragmatica.sharplint.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a syntax tree together with the indexes needed to navigate it.
 *
 * <p>Elements do not know their parent or their position. The snapshot assigns both on construction by
 * walking the root once; lookups are by reference, so an element resolves only against the snapshot it was
 * taken from. Two snapshots built from equal text never share positions for distinct element instances.
 *
 * <p>Instances are safe to share between threads: nothing is computed lazily.
 */
public final class SyntaxTree {
    private final SyntaxNode root;
    private final String text;
    private final Map<SyntaxElement, SyntaxNode> parents = new IdentityHashMap<>();
    private final Map<SyntaxElement, Integer> fullStarts = new IdentityHashMap<>();
    private final Map<SyntaxToken, Integer> tokenIndexes = new IdentityHashMap<>();
    private final List<SyntaxToken> tokens = new ArrayList<>();
    private final int[] tokenStarts;
    private final int[] lineStarts;

    private SyntaxTree(SyntaxNode root) {
        this.root = root;
        this.text = root.fullText();
        index(root, 0);
        this.tokenStarts = new int[tokens.size()];
        for (int i = 0; i < tokens.size(); i++) {
            tokenStarts[i] = fullStarts.get(tokens.get(i));
        }
        this.lineStarts = computeLineStarts(text);
    }

    public static SyntaxTree of(SyntaxNode root) {
        return new SyntaxTree(root);
    }

    /**
     * Snapshot of a different root, for example the result of a rewrite of this tree.
     */
    public SyntaxTree withRoot(SyntaxNode newRoot) {
        return newRoot == root
               ? this
               : new SyntaxTree(newRoot);
    }

    public SyntaxNode root() {
        return root;
    }

    /**
     * Full source text of the tree, trivia included.
     */
    public String text() {
        return text;
    }

    public List<SyntaxToken> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    public boolean contains(SyntaxElement element) {
        return fullStarts.containsKey(element);
    }

    public Optional<SyntaxNode> parent(SyntaxElement element) {
        requireMember(element);
        return Optional.ofNullable(parents.get(element));
    }

    /**
     * Proper ancestors of the element, nearest first.
     */
    public List<SyntaxNode> ancestors(SyntaxElement element) {
        requireMember(element);
        var result = new ArrayList<SyntaxNode>();
        var current = parents.get(element);
        while (current != null) {
            result.add(current);
            current = parents.get(current);
        }
        return result;
    }

    public Optional<SyntaxToken> nextToken(SyntaxToken token) {
        int index = tokenIndex(token);
        return index + 1 < tokens.size()
               ? Optional.of(tokens.get(index + 1))
               : Optional.empty();
    }

    public Optional<SyntaxToken> previousToken(SyntaxToken token) {
        int index = tokenIndex(token);
        return index > 0
               ? Optional.of(tokens.get(index - 1))
               : Optional.empty();
    }

    /**
     * Span of the element including all of its trivia.
     */
    public SourceSpan fullSpan(SyntaxElement element) {
        int start = fullStart(element);
        return SourceSpan.of(location(start), location(start + element.fullWidth()));
    }

    /**
     * Span of the element without the leading trivia of its first token and the trailing trivia of its last.
     */
    public SourceSpan span(SyntaxElement element) {
        int start = fullStart(element) + element.leadingTrivia()
                                                .width();
        int end = fullStart(element) + element.fullWidth() - element.trailingTrivia()
                                                                   .width();
        return SourceSpan.of(location(start), location(end));
    }

    /**
     * Line and column of a character offset. The offset equal to the text length is valid and denotes the end.
     */
    public SourceLocation location(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside of [0, " + text.length() + "]");
        }
        int line = lineIndex(offset);
        return SourceLocation.at(line + 1, offset - lineStarts[line] + 1, offset);
    }

    /**
     * Token whose full span, trivia included, covers the offset. The end offset resolves to the last token.
     */
    public Optional<SyntaxToken> findToken(int offset) {
        if (offset < 0 || offset > text.length() || tokens.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(floorIndex(tokenStarts, offset)));
    }

    /**
     * Node whose full span contains the given span. Resolution starts at the token covering the span start and
     * walks up the ancestors. When {@code innermost} is false, the outermost of several nodes with an identical
     * full span is returned.
     */
    public Optional<SyntaxNode> findNode(SourceSpan target, boolean innermost) {
        if (target.end()
                  .offset() > text.length()) {
            return Optional.empty();
        }
        return findToken(target.start()
                               .offset()).flatMap(token -> enclosingNode(token, target, innermost));
    }

    private Optional<SyntaxNode> enclosingNode(SyntaxToken token, SourceSpan target, boolean innermost) {
        var node = parents.get(token);
        while (node != null && !fullSpan(node).contains(target)) {
            node = parents.get(node);
        }
        if (node == null || innermost) {
            return Optional.ofNullable(node);
        }
        var parent = parents.get(node);
        while (parent != null && parent.fullWidth() == node.fullWidth()) {
            node = parent;
            parent = parents.get(node);
        }
        return Optional.of(node);
    }

    /**
     * Offset where the element's full span begins.
     */
    public int fullStart(SyntaxElement element) {
        requireMember(element);
        return fullStarts.get(element);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    private int index(SyntaxElement element, int offset) {
        fullStarts.put(element, offset);
        if (element instanceof SyntaxNode node) {
            int childOffset = offset;
            for (var child : node.children()) {
                if (fullStarts.containsKey(child)) {
                    throw new IllegalArgumentException("Element instance occurs twice in the tree: " + child);
                }
                parents.put(child, node);
                childOffset = index(child, childOffset);
            }
            return childOffset;
        }
        var token = (SyntaxToken) element;
        tokenIndexes.put(token, tokens.size());
        tokens.add(token);
        return offset + token.fullWidth();
    }

    private int tokenIndex(SyntaxToken token) {
        var index = tokenIndexes.get(token);
        if (index == null) {
            throw new IllegalArgumentException("Token does not belong to this tree: " + token);
        }
        return index;
    }

    private void requireMember(SyntaxElement element) {
        if (!fullStarts.containsKey(element)) {
            throw new IllegalArgumentException("Element does not belong to this tree: " + element);
        }
    }

    private int lineIndex(int offset) {
        return floorIndex(lineStarts, offset);
    }

    private static int floorIndex(int[] starts, int value) {
        int low = 0;
        int high = starts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (starts[mid] <= value) {
                low = mid;
            }else {
                high = mid - 1;
            }
        }
        return low;
    }

    private static int[] computeLineStarts(String text) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i++ );
            if (c == '\r' && i < text.length() && text.charAt(i) == '\n') {
                i++ ;
            }
            if (c == '\r' || c == '\n') {
                starts.add(i);
            }
        }
        return starts.stream()
                     .mapToInt(Integer::intValue)
                     .toArray();
    }
}
