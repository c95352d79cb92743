package io.specdoc.render.markdown;

import java.util.Objects;

public record InlineHtmlBlock(String code, SourceRange range) implements Block {

    public InlineHtmlBlock {
        code = Objects.requireNonNull(code, "code");
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
    }

    public InlineHtmlBlock(String code) {
        this(code, SourceRange.UNKNOWN);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitInlineHtmlBlock(this);
    }
}
