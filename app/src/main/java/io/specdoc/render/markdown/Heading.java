package io.specdoc.render.markdown;

import java.util.List;
import java.util.Objects;

public record Heading(int level, List<Span> body, SourceRange range) implements Block {

    public Heading {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("heading level must be between 1 and 6: " + level);
        }
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
    }

    public Heading(int level, List<Span> body) {
        this(level, body, SourceRange.UNKNOWN);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitHeading(this);
    }
}
