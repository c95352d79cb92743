package io.specdoc.render.markdown;

import java.util.Objects;

/**
 * Block the parser produced but the dialect does not support, named by the parser's node kind.
 */
public record UnsupportedBlock(String sourceKind, SourceRange range) implements Block {

    public UnsupportedBlock {
        sourceKind = Objects.requireNonNull(sourceKind, "sourceKind");
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
    }

    public UnsupportedBlock(String sourceKind) {
        this(sourceKind, SourceRange.UNKNOWN);
    }

    @Override
    public String kind() {
        return sourceKind;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }
}
