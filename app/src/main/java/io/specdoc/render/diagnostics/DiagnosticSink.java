package io.specdoc.render.diagnostics;

/**
 * Receives diagnostics. Implementations must not throw.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void report(Diagnostic diagnostic);
}
