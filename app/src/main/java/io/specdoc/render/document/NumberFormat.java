package io.specdoc.render.document;

public enum NumberFormat {
    DECIMAL,
    LOWER_LETTER,
    LOWER_ROMAN,
    BULLET
}
