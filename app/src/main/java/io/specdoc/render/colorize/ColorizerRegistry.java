package io.specdoc.render.colorize;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps each supported language to its colorizer.
 */
public class ColorizerRegistry {

    private final Map<CodeLanguage, Colorizer> colorizers;

    public ColorizerRegistry(Map<CodeLanguage, Colorizer> colorizers) {
        this.colorizers = new EnumMap<>(CodeLanguage.class);
        this.colorizers.putAll(colorizers);
        this.colorizers.putIfAbsent(CodeLanguage.PLAIN, new PlainTextColorizer());
    }

    public static ColorizerRegistry standard() {
        return new ColorizerRegistry(Map.of(
                CodeLanguage.CSHARP, KeywordColorizer.csharp(),
                CodeLanguage.VB, KeywordColorizer.visualBasic(),
                CodeLanguage.PLAIN, new PlainTextColorizer()));
    }

    public Colorizer forLanguage(CodeLanguage language) {
        Objects.requireNonNull(language, "language");
        return colorizers.getOrDefault(language, colorizers.get(CodeLanguage.PLAIN));
    }
}
