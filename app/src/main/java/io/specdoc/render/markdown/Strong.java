package io.specdoc.render.markdown;

import java.util.List;
import java.util.Objects;

public record Strong(List<Span> body) implements Span {

    public Strong {
        body = List.copyOf(Objects.requireNonNull(body, "body"));
    }

    public static Strong of(Span... body) {
        return new Strong(List.of(body));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStrong(this);
    }
}
