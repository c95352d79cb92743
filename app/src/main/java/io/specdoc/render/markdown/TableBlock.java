package io.specdoc.render.markdown;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pipe table. The number of alignments is the declared column count.
 */
public record TableBlock(Optional<Row> header, List<Alignment> alignments, List<Row> rows, SourceRange range)
        implements Block {

    public TableBlock {
        header = header == null ? Optional.empty() : header;
        alignments = List.copyOf(Objects.requireNonNull(alignments, "alignments"));
        rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
    }

    public TableBlock(Optional<Row> header, List<Alignment> alignments, List<Row> rows) {
        this(header, alignments, rows, SourceRange.UNKNOWN);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTableBlock(this);
    }

    public enum Alignment {
        DEFAULT,
        LEFT,
        CENTER,
        RIGHT
    }

    public record Row(List<Cell> cells) {

        public Row {
            cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
        }

        public static Row of(Cell... cells) {
            return new Row(List.of(cells));
        }
    }

    /**
     * Cell content; an empty cell has no blocks at all.
     */
    public record Cell(List<Block> blocks) {

        public Cell {
            blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks"));
        }

        public static Cell empty() {
            return new Cell(List.of());
        }

        public static Cell of(Block... blocks) {
            return new Cell(List.of(blocks));
        }

        public boolean isEmpty() {
            return blocks.isEmpty();
        }
    }
}
