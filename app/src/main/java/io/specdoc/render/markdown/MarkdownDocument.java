package io.specdoc.render.markdown;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed source file: top-level blocks plus the reference link definitions declared in it.
 */
public record MarkdownDocument(List<Block> blocks, Map<String, LinkDefinition> definedLinks) {

    public MarkdownDocument {
        blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks"));
        definedLinks = Map.copyOf(Objects.requireNonNull(definedLinks, "definedLinks"));
    }

    public MarkdownDocument(List<Block> blocks) {
        this(blocks, Map.of());
    }
}
