package io.specdoc.render.markdown;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record DirectLink(List<Span> body, String url, Optional<String> title) implements Span {

    public DirectLink {
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        url = url == null ? "" : url;
        title = title == null ? Optional.empty() : title;
    }

    public DirectLink(List<Span> body, String url) {
        this(body, url, Optional.empty());
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDirectLink(this);
    }
}
