package io.specdoc.render.markdown;

import java.util.Objects;

public record CodeBlock(String language, String code, SourceRange range) implements Block {

    public CodeBlock {
        language = language == null ? "" : language;
        code = Objects.requireNonNull(code, "code");
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
    }

    public CodeBlock(String language, String code) {
        this(language, code, SourceRange.UNKNOWN);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCodeBlock(this);
    }
}
