package io.specdoc.render.document;

import java.util.Objects;

public record BookmarkStart(String name, int id) implements Inline {

    public BookmarkStart {
        name = Objects.requireNonNull(name, "name");
    }
}
