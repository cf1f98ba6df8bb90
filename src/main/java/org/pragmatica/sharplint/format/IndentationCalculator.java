package org.pragmatica.sharplint.format;

import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxNode;
import org.pragmatica.sharplint.tree.SyntaxTree;

import java.util.EnumSet;
import java.util.Set;

/**
 * Computes indentation from the structure of the tree rather than from existing whitespace.
 */
public final class IndentationCalculator {
    private static final Set<SyntaxKind> INDENTING_KINDS = EnumSet.of(SyntaxKind.BLOCK,
                                                                      SyntaxKind.CLASS_DECLARATION,
                                                                      SyntaxKind.STRUCT_DECLARATION,
                                                                      SyntaxKind.INTERFACE_DECLARATION,
                                                                      SyntaxKind.ENUM_DECLARATION,
                                                                      SyntaxKind.NAMESPACE_DECLARATION,
                                                                      SyntaxKind.ACCESSOR_LIST,
                                                                      SyntaxKind.SWITCH_STATEMENT,
                                                                      SyntaxKind.SWITCH_SECTION);

    private final FormattingOptions options;

    public IndentationCalculator(FormattingOptions options) {
        this.options = options;
    }

    public FormattingOptions options() {
        return options;
    }

    /**
     * Number of proper ancestors of {@code node} that indent their content.
     */
    public int steps(SyntaxTree tree, SyntaxNode node) {
        int steps = 0;
        for (var ancestor : tree.ancestors(node)) {
            if (INDENTING_KINDS.contains(ancestor.kind())) {
                steps++ ;
            }
        }
        return steps;
    }

    /**
     * Node whose indentation the braces of {@code block} line up with.
     */
    public SyntaxNode anchorOf(SyntaxTree tree, SyntaxNode block) {
        var parent = tree.parent(block);
        if (parent.isEmpty()) {
            return block;
        }
        var parentKind = parent.get()
                               .kind();
        if (parentKind == SyntaxKind.BLOCK || parentKind == SyntaxKind.SWITCH_SECTION) {
            return block;
        }
        var candidate = parent.get();
        while (!candidate.kind()
                         .isStatement() && !candidate.kind()
                                                     .isMemberDeclaration()) {
            var next = tree.parent(candidate);
            if (next.isEmpty()) {
                return candidate;
            }
            candidate = next.get();
        }
        return candidate;
    }

    /**
     * Indentation steps of the braces of {@code block}. Blocks of lambdas and anonymous methods get one extra step.
     */
    public int blockSteps(SyntaxTree tree, SyntaxNode block) {
        int steps = steps(tree, anchorOf(tree, block));
        boolean anonymousFunctionBody = tree.parent(block)
                                            .map(parent -> parent.kind()
                                                                 .isAnonymousFunction())
                                            .orElse(false);
        return anonymousFunctionBody
               ? steps + 1
               : steps;
    }

    public String render(int steps) {
        return options.indentation(steps);
    }
}
