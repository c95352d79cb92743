package io.specdoc.render.markdown;

import java.util.List;
import java.util.Objects;

public record Paragraph(List<Span> body, SourceRange range) implements Block {

    public Paragraph {
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
    }

    public Paragraph(List<Span> body) {
        this(body, SourceRange.UNKNOWN);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitParagraph(this);
    }
}
