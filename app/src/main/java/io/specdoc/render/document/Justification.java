package io.specdoc.render.document;

public enum Justification {
    LEFT,
    CENTER,
    RIGHT
}
