package org.pragmatica.sharplint.rules.layout;

import org.pragmatica.sharplint.error.Diagnostic;
import org.pragmatica.sharplint.error.DiagnosticDescriptor;
import org.pragmatica.sharplint.rules.DiagnosticSink;
import org.pragmatica.sharplint.rules.SyntaxRule;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxNode;
import org.pragmatica.sharplint.tree.SyntaxNodes;
import org.pragmatica.sharplint.tree.SyntaxTree;

import java.util.EnumSet;
import java.util.Set;

/**
 * SA1501: a statement block must not open and close on the same line.
 *
 * <p>Member and accessor bodies are out of scope; only blocks owned by statements, clauses, switch sections
 * and anonymous functions are reported.
 */
public final class SingleLineBlockRule implements SyntaxRule {
    public static final DiagnosticDescriptor DESCRIPTOR = new DiagnosticDescriptor(
        "SA1501",
        "Statement must not be on a single line",
        "Statement must not be on a single line",
        "Layout",
        Diagnostic.Severity.WARNING,
        "A C# statement containing opening and closing curly brackets is written completely on a single line.",
        "http://www.stylecop.com/docs/SA1501.html");

    private static final Set<SyntaxKind> CLAUSES = EnumSet.of(SyntaxKind.ELSE_CLAUSE,
                                                              SyntaxKind.CATCH_CLAUSE,
                                                              SyntaxKind.FINALLY_CLAUSE,
                                                              SyntaxKind.SWITCH_SECTION);

    @Override
    public DiagnosticDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public void analyze(SyntaxTree tree, DiagnosticSink sink) {
        for (var block : SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.BLOCK)) {
            if (isSingleLine(tree, block) && isStatementOwned(tree, block)) {
                sink.report(Diagnostic.create(DESCRIPTOR, tree.span(block.firstToken())));
            }
        }
    }

    private static boolean isSingleLine(SyntaxTree tree, SyntaxNode block) {
        return tree.span(block.firstToken())
                   .start()
                   .line() == tree.span(block.lastToken())
                                  .start()
                                  .line();
    }

    private static boolean isStatementOwned(SyntaxTree tree, SyntaxNode block) {
        return tree.parent(block)
                   .map(SyntaxNode::kind)
                   .filter(kind -> kind.isStatement() || kind.isAnonymousFunction() || CLAUSES.contains(kind))
                   .isPresent();
    }
}
