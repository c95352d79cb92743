package io.specdoc.render.markdown;

import java.util.Objects;

public record UnsupportedSpan(String sourceKind) implements Span {

    public UnsupportedSpan {
        sourceKind = Objects.requireNonNull(sourceKind, "sourceKind");
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
