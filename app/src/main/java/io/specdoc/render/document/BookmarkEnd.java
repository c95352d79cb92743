package io.specdoc.render.document;

public record BookmarkEnd(int id) implements Inline {
}
