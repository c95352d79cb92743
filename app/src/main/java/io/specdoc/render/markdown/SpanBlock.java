package io.specdoc.render.markdown;

import java.util.List;
import java.util.Objects;

/**
 * Inline content of a tight list item, which carries no paragraph of its own.
 */
public record SpanBlock(List<Span> body, SourceRange range) implements Block {

    public SpanBlock {
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
    }

    public SpanBlock(List<Span> body) {
        this(body, SourceRange.UNKNOWN);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSpanBlock(this);
    }
}
