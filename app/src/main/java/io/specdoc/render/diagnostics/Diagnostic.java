package io.specdoc.render.diagnostics;

import java.util.Objects;

/**
 * One reported condition. {@code lineOffset} is the zero-based line inside a code block, or -1.
 */
public record Diagnostic(DiagnosticCode code, Severity severity, String message, Location location, int lineOffset) {

    public Diagnostic {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(severity, "severity");
        message = Objects.requireNonNullElse(message, "");
        location = Objects.requireNonNullElse(location, Location.NONE);
    }

    public Diagnostic(DiagnosticCode code, Severity severity, String message, Location location) {
        this(code, severity, message, location, -1);
    }

    public boolean hasLineOffset() {
        return lineOffset >= 0;
    }

    public String format() {
        StringBuilder builder = new StringBuilder();
        builder.append(code).append(' ').append(severity).append(' ');
        if (!location.file().isEmpty()) {
            builder.append(location);
            if (hasLineOffset()) {
                builder.append(" (code line ").append(lineOffset).append(')');
            }
            builder.append(": ");
        }
        builder.append(message);
        return builder.toString();
    }
}
