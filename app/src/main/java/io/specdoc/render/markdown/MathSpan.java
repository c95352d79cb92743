package io.specdoc.render.markdown;

import java.util.Objects;

/**
 * Inline LaTeX-style math, kept as source text.
 */
public record MathSpan(String code) implements Span {

    public MathSpan {
        code = Objects.requireNonNull(code, "code");
    }

    @Override
    public String kind() {
        return "Math";
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMath(this);
    }
}
