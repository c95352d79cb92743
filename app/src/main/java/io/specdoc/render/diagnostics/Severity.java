package io.specdoc.render.diagnostics;

public enum Severity {
    ERROR,
    WARNING,
    INFO
}
