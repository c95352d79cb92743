package io.specdoc.render.markdown;

import java.util.Objects;
import java.util.Optional;

public record LinkDefinition(String url, Optional<String> title) {

    public LinkDefinition {
        url = Objects.requireNonNull(url, "url");
        title = title == null ? Optional.empty() : title;
    }
}
