package io.specdoc.render.document;

import java.util.List;
import java.util.Objects;

public record TableRow(List<TableCell> cells) {

    public TableRow {
        cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
    }
}
