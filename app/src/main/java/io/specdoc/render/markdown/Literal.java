package io.specdoc.render.markdown;

import java.util.Objects;

public record Literal(String text) implements Span {

    public Literal {
        text = Objects.requireNonNull(text, "text");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
