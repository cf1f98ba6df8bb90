package org.pragmatica.sharplint.tree;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Structural construct of a C# syntax tree: a declaration, a statement, an expression or one of their parts.
 *
 * <p>A node never holds a position. Its children are kept in source order, and a node always covers at least
 * one token. Rebuilding a node with different children produces a new value; the original is left untouched.
 */
public record SyntaxNode(
    SyntaxKind kind,
    List<SyntaxElement> children,
    Set<SyntaxAnnotation> annotations) implements SyntaxElement {

    public SyntaxNode {
        Objects.requireNonNull(kind, "kind");
        if (!kind.isNode()) {
            throw new IllegalArgumentException("Not a node kind: " + kind);
        }
        children = List.copyOf(children);
        annotations = annotations.isEmpty()
                      ? Set.of()
                      : Set.copyOf(annotations);
        // every child node holds a token, so any child will do
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Node " + kind + " must contain at least one token");
        }
    }

    public SyntaxNode(SyntaxKind kind, List<SyntaxElement> children) {
        this(kind, children, Set.of());
    }

    public static SyntaxNode node(SyntaxKind kind, SyntaxElement... children) {
        return new SyntaxNode(kind, List.of(children));
    }

    public SyntaxToken firstToken() {
        var first = children.get(0);
        return first instanceof SyntaxNode node
               ? node.firstToken()
               : (SyntaxToken) first;
    }

    public SyntaxToken lastToken() {
        var last = children.get(children.size() - 1);
        return last instanceof SyntaxNode node
               ? node.lastToken()
               : (SyntaxToken) last;
    }

    /**
     * All tokens of this node in source order.
     */
    public List<SyntaxToken> tokens() {
        var result = new ArrayList<SyntaxToken>();
        collectTokens(this, result);
        return result;
    }

    public List<SyntaxNode> childNodes() {
        return children.stream()
                       .filter(SyntaxNode.class::isInstance)
                       .map(SyntaxNode.class::cast)
                       .toList();
    }

    public List<SyntaxToken> childTokens() {
        return children.stream()
                       .filter(SyntaxToken.class::isInstance)
                       .map(SyntaxToken.class::cast)
                       .toList();
    }

    public Optional<SyntaxNode> childNode(SyntaxKind childKind) {
        return childNodes().stream()
                           .filter(child -> child.kind() == childKind)
                           .findFirst();
    }

    public Optional<SyntaxToken> childToken(SyntaxKind childKind) {
        return childTokens().stream()
                            .filter(child -> child.kind() == childKind)
                            .findFirst();
    }

    public boolean hasAnnotation(SyntaxAnnotation annotation) {
        return annotations.contains(annotation);
    }

    public SyntaxNode withAnnotation(SyntaxAnnotation annotation) {
        if (annotations.contains(annotation)) {
            return this;
        }
        var updated = annotations.isEmpty()
                      ? EnumSet.noneOf(SyntaxAnnotation.class)
                      : EnumSet.copyOf(annotations);
        updated.add(annotation);
        return new SyntaxNode(kind, children, updated);
    }

    public SyntaxNode withoutAnnotation(SyntaxAnnotation annotation) {
        if (!annotations.contains(annotation)) {
            return this;
        }
        var updated = EnumSet.copyOf(annotations);
        updated.remove(annotation);
        return new SyntaxNode(kind, children, updated);
    }

    public SyntaxNode withChildren(List<SyntaxElement> newChildren) {
        return new SyntaxNode(kind, newChildren, annotations);
    }

    @Override
    public TriviaList leadingTrivia() {
        return firstToken().leadingTrivia();
    }

    @Override
    public TriviaList trailingTrivia() {
        return lastToken().trailingTrivia();
    }

    /**
     * Replace the leading trivia of the first token. Only the spine down to that token is rebuilt.
     */
    public SyntaxNode withLeadingTrivia(TriviaList trivia) {
        var first = children.get(0);
        SyntaxElement replaced = first instanceof SyntaxNode node
                                 ? node.withLeadingTrivia(trivia)
                                 : ((SyntaxToken) first).withLeadingTrivia(trivia);
        return withChildAt(0, replaced);
    }

    /**
     * Replace the trailing trivia of the last token. Only the spine down to that token is rebuilt.
     */
    public SyntaxNode withTrailingTrivia(TriviaList trivia) {
        int index = children.size() - 1;
        var last = children.get(index);
        SyntaxElement replaced = last instanceof SyntaxNode node
                                 ? node.withTrailingTrivia(trivia)
                                 : ((SyntaxToken) last).withTrailingTrivia(trivia);
        return withChildAt(index, replaced);
    }

    private SyntaxNode withChildAt(int index, SyntaxElement replacement) {
        var updated = new ArrayList<>(children);
        updated.set(index, replacement);
        return new SyntaxNode(kind, updated, annotations);
    }

    @Override
    public int fullWidth() {
        int width = 0;
        for (var child : children) {
            width += child.fullWidth();
        }
        return width;
    }

    @Override
    public String text() {
        var full = fullText();
        return full.substring(leadingTrivia().width(), full.length() - trailingTrivia().width());
    }

    @Override
    public void writeTo(StringBuilder sb) {
        for (var child : children) {
            child.writeTo(sb);
        }
    }

    @Override
    public String toString() {
        return kind + "[" + text() + "]";
    }

    private static void collectTokens(SyntaxNode node, List<SyntaxToken> result) {
        for (var child : node.children) {
            if (child instanceof SyntaxNode childNode) {
                collectTokens(childNode, result);
            }else {
                result.add((SyntaxToken) child);
            }
        }
    }
}
