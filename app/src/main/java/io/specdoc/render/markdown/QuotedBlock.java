package io.specdoc.render.markdown;

import java.util.List;
import java.util.Objects;

/**
 * Block quote; in specifications these hold notes and examples.
 */
public record QuotedBlock(List<Block> children, SourceRange range) implements Block {

    public QuotedBlock {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
    }

    public QuotedBlock(List<Block> children) {
        this(children, SourceRange.UNKNOWN);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitQuotedBlock(this);
    }
}
