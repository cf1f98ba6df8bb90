package org.pragmatica.sharplint.rules;

import org.pragmatica.sharplint.error.Diagnostic;

import java.util.List;

/**
 * Receiver of diagnostics produced by rules.
 */
@FunctionalInterface
public interface DiagnosticSink {
    void report(Diagnostic diagnostic);

    /**
     * Sink appending to the given list.
     */
    static DiagnosticSink collectingInto(List<Diagnostic> target) {
        return target::add;
    }
}
