package org.pragmatica.sharplint.format;

import org.pragmatica.sharplint.error.Diagnostic;
import org.pragmatica.sharplint.rules.DiagnosticSink;
import org.pragmatica.sharplint.rules.layout.SingleLineBlockRule;
import org.pragmatica.sharplint.tree.SourceSpan;
import org.pragmatica.sharplint.tree.SyntaxAnnotation;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxNodes;
import org.pragmatica.sharplint.tree.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Fix for single-line blocks: spreads the block at a location over several lines.
 */
public final class SingleLineBlockFix {
    private static final Logger log = LoggerFactory.getLogger(SingleLineBlockFix.class);

    private final BlockFormatter formatter;
    private final SingleLineBlockRule rule = new SingleLineBlockRule();

    public SingleLineBlockFix(FormattingOptions options) {
        this.formatter = new BlockFormatter(options);
    }

    /**
     * Reformat the block found at {@code location}. Empty when the innermost node there is not a block.
     */
    public Optional<SyntaxTree> computeFix(SyntaxTree tree, SourceSpan location) {
        var node = tree.findNode(location, true);
        if (node.isEmpty() || node.get()
                                  .kind() != SyntaxKind.BLOCK) {
            log.debug("No block at {}, nothing to fix", location);
            return Optional.empty();
        }
        var formatted = formatter.format(tree, node.get());
        var rewritten = new BlockRewriter(formatted).rewrite(tree.root());
        var cleaned = SyntaxNodes.withoutAnnotation(rewritten, SyntaxAnnotation.FORMAT);
        log.debug("Reformatted block at {}", location);
        return Optional.of(tree.withRoot(cleaned));
    }

    public Optional<SyntaxTree> computeFix(SyntaxTree tree, Diagnostic diagnostic) {
        return computeFix(tree, diagnostic.span());
    }

    /**
     * Fix single-line blocks one at a time until none is left.
     */
    public SyntaxTree fixAll(SyntaxTree tree) {
        var current = tree;
        int remaining = SyntaxNodes.descendantsOfKind(tree.root(), SyntaxKind.BLOCK)
                                   .size();
        while (true) {
            var diagnostics = new ArrayList<Diagnostic>();
            rule.analyze(current, DiagnosticSink.collectingInto(diagnostics));
            if (diagnostics.isEmpty()) {
                return current;
            }
            if (remaining-- == 0) {
                log.warn("Giving up on {} single-line block(s) left after fixing", diagnostics.size());
                return current;
            }
            var fixed = computeFix(current, diagnostics.get(0));
            if (fixed.isEmpty()) {
                log.warn("Could not fix single-line block at {}", diagnostics.get(0)
                                                                           .location());
                return current;
            }
            current = fixed.get();
        }
    }
}
