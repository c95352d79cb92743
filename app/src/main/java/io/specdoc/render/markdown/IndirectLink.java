package io.specdoc.render.markdown;

import java.util.List;
import java.util.Objects;

/**
 * Reference-style link, resolved against {@link MarkdownDocument#definedLinks()} by {@code key}.
 */
public record IndirectLink(List<Span> body, String original, String key) implements Span {

    public IndirectLink {
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        original = original == null ? "" : original;
        key = Objects.requireNonNull(key, "key");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIndirectLink(this);
    }
}
