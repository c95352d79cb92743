package io.specdoc.render.document;

public enum VerticalPosition {
    BASELINE,
    SUBSCRIPT,
    SUPERSCRIPT
}
