package io.specdoc.render.markdown;

public record HardBreak() implements Span {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitHardBreak(this);
    }
}
