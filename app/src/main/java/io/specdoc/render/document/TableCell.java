package io.specdoc.render.document;

import java.util.List;
import java.util.Objects;

/**
 * Table cell. {@code verticalMerge} is null for cells outside any merge group.
 */
public record TableCell(List<DocBlock> content, VerticalMerge verticalMerge) {

    public TableCell {
        content = List.copyOf(Objects.requireNonNull(content, "content"));
    }

    public TableCell(List<DocBlock> content) {
        this(content, null);
    }

    public TableCell withVerticalMerge(VerticalMerge merge) {
        return new TableCell(content, merge);
    }

    public enum VerticalMerge {
        RESTART,
        CONTINUE
    }
}
