package io.specdoc.render.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records every diagnostic of a conversion run and forwards it to a downstream sink.
 */
public class DiagnosticLog implements DiagnosticSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiagnosticLog.class);

    private final List<Diagnostic> entries = new ArrayList<>();
    private final DiagnosticSink downstream;

    public DiagnosticLog() {
        this(diagnostic -> {
        });
    }

    public DiagnosticLog(DiagnosticSink downstream) {
        this.downstream = Objects.requireNonNull(downstream, "downstream");
    }

    @Override
    public void report(Diagnostic diagnostic) {
        entries.add(diagnostic);
        try {
            downstream.report(diagnostic);
        } catch (RuntimeException ex) {
            LOGGER.warn("Diagnostic sink rejected {}: {}", diagnostic.code(), ex.getMessage());
        }
    }

    public List<Diagnostic> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Diagnostic> withCode(DiagnosticCode code) {
        return entries.stream().filter(entry -> entry.code() == code).collect(Collectors.toList());
    }

    public long count(Severity severity) {
        return entries.stream().filter(entry -> entry.severity() == severity).count();
    }

    public boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }
}
