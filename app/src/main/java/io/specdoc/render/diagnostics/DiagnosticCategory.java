package io.specdoc.render.diagnostics;

/**
 * How the converter recovers from a diagnosed condition.
 */
public enum DiagnosticCategory {
    /** Malformed or unsupported shape; a placeholder or nothing is emitted instead. */
    STRUCTURAL,
    /** Authoring inconsistency; the author's content is rendered unchanged. */
    CONSISTENCY,
    /** Unknown tag, id or node kind; a safe default is used. */
    UNRECOGNIZED,
    /** Informational record kept for change tracking. */
    TRACE
}
