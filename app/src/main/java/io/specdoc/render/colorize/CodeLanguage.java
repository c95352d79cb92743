package io.specdoc.render.colorize;

import java.util.Optional;
import java.util.Set;

/**
 * Code block language tags the converter understands.
 */
public enum CodeLanguage {
    CSHARP(Set.of("csharp", "c#", "cs")),
    VB(Set.of("vb", "vbnet", "vb.net")),
    PLAIN(Set.of("", "console", "xml", "ANTLR"));

    private final Set<String> tags;

    CodeLanguage(Set<String> tags) {
        this.tags = tags;
    }

    public static Optional<CodeLanguage> fromTag(String tag) {
        String value = tag == null ? "" : tag;
        for (CodeLanguage language : values()) {
            if (language.tags.contains(value)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
