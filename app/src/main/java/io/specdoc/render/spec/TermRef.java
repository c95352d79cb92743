package io.specdoc.render.spec;

import io.specdoc.render.diagnostics.Location;
import java.util.Objects;

public record TermRef(String text, String bookmarkName, Location definitionLocation) {

    public TermRef {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(bookmarkName, "bookmarkName");
        Objects.requireNonNull(definitionLocation, "definitionLocation");
    }
}
