package io.specdoc.render.diagnostics;

import io.specdoc.render.markdown.SourceRange;
import java.util.Objects;

/**
 * Source position of a diagnostic. {@code line} is one-based; zero means the line is unknown.
 */
public record Location(String file, int line) {

    public static final Location NONE = new Location("", 0);

    public Location {
        file = Objects.requireNonNullElse(file, "");
    }

    public static Location of(String file, SourceRange range) {
        return new Location(file, range == null ? 0 : range.line());
    }

    @Override
    public String toString() {
        return line > 0 ? file + ":" + line : file;
    }
}
