package io.specdoc.render.document;

import java.util.Objects;

public record Run(String text, RunProperties properties) implements Inline {

    public Run {
        text = Objects.requireNonNull(text, "text");
        properties = Objects.requireNonNullElse(properties, RunProperties.PLAIN);
    }

    public static Run plain(String text) {
        return new Run(text, RunProperties.PLAIN);
    }

    public static Run styled(String text, String styleId) {
        return new Run(text, RunProperties.PLAIN.withStyle(styleId));
    }

    public Run withBold() {
        return new Run(text, properties.withBold());
    }

    public Run withItalic() {
        return new Run(text, properties.withItalic());
    }
}
