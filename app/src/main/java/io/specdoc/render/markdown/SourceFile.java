package io.specdoc.render.markdown;

import java.util.Objects;

/**
 * Parsed document together with the file name used in section urls and diagnostics.
 */
public record SourceFile(String name, MarkdownDocument document) {

    public SourceFile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(document, "document");
    }
}
