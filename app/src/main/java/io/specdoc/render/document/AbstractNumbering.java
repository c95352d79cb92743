package io.specdoc.render.document;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record AbstractNumbering(int id, List<NumberingLevel> levels) {

    public AbstractNumbering {
        levels = List.copyOf(Objects.requireNonNull(levels, "levels"));
    }

    public AbstractNumbering shifted(int delta) {
        return new AbstractNumbering(id, levels.stream().map(level -> level.shifted(delta)).collect(Collectors.toList()));
    }
}
