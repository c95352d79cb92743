package io.specdoc.render.markdown;

import java.util.Objects;

public record InlineCode(String code) implements Span {

    public InlineCode {
        code = Objects.requireNonNull(code, "code");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitInlineCode(this);
    }
}
