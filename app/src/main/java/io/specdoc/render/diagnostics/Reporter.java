package io.specdoc.render.diagnostics;

import io.specdoc.render.markdown.SourceRange;
import java.util.Objects;

/**
 * Per-file front end to the diagnostic sink that stamps each report with the block being converted.
 */
public class Reporter {

    private final String file;
    private final DiagnosticSink sink;
    private SourceRange currentRange = SourceRange.UNKNOWN;

    public Reporter(String file, DiagnosticSink sink) {
        this.file = Objects.requireNonNull(file, "file");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public String file() {
        return file;
    }

    public void enter(SourceRange range) {
        if (range != null && range.isKnown()) {
            currentRange = range;
        }
    }

    public Location location() {
        return Location.of(file, currentRange);
    }

    public void error(DiagnosticCode code, String message) {
        sink.report(new Diagnostic(code, Severity.ERROR, message, location()));
    }

    public void warning(DiagnosticCode code, String message) {
        sink.report(new Diagnostic(code, Severity.WARNING, message, location()));
    }

    public void warning(DiagnosticCode code, String message, Location location) {
        sink.report(new Diagnostic(code, Severity.WARNING, message, location));
    }

    public void warning(DiagnosticCode code, String message, int lineOffset) {
        sink.report(new Diagnostic(code, Severity.WARNING, message, location(), lineOffset));
    }

    public void info(DiagnosticCode code, String message) {
        sink.report(new Diagnostic(code, Severity.INFO, message, location()));
    }
}
