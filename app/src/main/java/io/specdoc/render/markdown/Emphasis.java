package io.specdoc.render.markdown;

import java.util.List;
import java.util.Objects;

public record Emphasis(List<Span> body) implements Span {

    public Emphasis {
        body = List.copyOf(Objects.requireNonNull(body, "body"));
    }

    public static Emphasis of(Span... body) {
        return new Emphasis(List.of(body));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitEmphasis(this);
    }
}
