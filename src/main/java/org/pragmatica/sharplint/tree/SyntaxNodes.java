package org.pragmatica.sharplint.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Static helpers over syntax nodes.
 */
public final class SyntaxNodes {
    private SyntaxNodes() {}

    /**
     * All nodes below {@code root} in pre-order, {@code root} excluded.
     */
    public static List<SyntaxNode> descendants(SyntaxNode root) {
        return descendants(root, node -> true);
    }

    public static List<SyntaxNode> descendants(SyntaxNode root, Predicate<SyntaxNode> filter) {
        var result = new ArrayList<SyntaxNode>();
        var stack = new ArrayDeque<SyntaxNode>();
        pushChildren(root, stack);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (filter.test(node)) {
                result.add(node);
            }
            pushChildren(node, stack);
        }
        return result;
    }

    public static List<SyntaxNode> descendantsOfKind(SyntaxNode root, SyntaxKind kind) {
        return descendants(root, node -> node.kind() == kind);
    }

    /**
     * Strip an annotation from every node of the tree. Nodes without it are returned unchanged.
     */
    public static SyntaxNode withoutAnnotation(SyntaxNode root, SyntaxAnnotation annotation) {
        return new SyntaxRewriter() {
            @Override
            public SyntaxElement visitNode(SyntaxNode node) {
                var visited = (SyntaxNode) super.visitNode(node);
                return visited.withoutAnnotation(annotation);
            }
        }.rewrite(root);
    }

    private static void pushChildren(SyntaxNode node, ArrayDeque<SyntaxNode> stack) {
        var children = node.childNodes();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }
}
