package io.specdoc.render.document;

/**
 * Explicit line break inside a paragraph.
 */
public record Break() implements Inline {

    public static final Break INSTANCE = new Break();
}
