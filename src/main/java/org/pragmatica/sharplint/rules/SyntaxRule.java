package org.pragmatica.sharplint.rules;

import org.pragmatica.sharplint.error.DiagnosticDescriptor;
import org.pragmatica.sharplint.tree.SyntaxTree;

/**
 * A style rule that inspects a syntax tree snapshot and reports violations.
 *
 * <p>Rules are stateless between invocations and may be shared across threads.
 */
public interface SyntaxRule {
    DiagnosticDescriptor descriptor();

    default String id() {
        return descriptor().id();
    }

    /**
     * Analyze the whole tree, reporting every violation to the sink.
     */
    void analyze(SyntaxTree tree, DiagnosticSink sink);
}
