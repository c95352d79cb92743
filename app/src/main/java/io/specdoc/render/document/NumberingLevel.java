package io.specdoc.render.document;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/**
 * Format of one level in an abstract numbering definition. {@code symbolFont} is only set for bullets.
 */
public record NumberingLevel(
        int index,
        int start,
        NumberFormat format,
        String levelText,
        int leftIndentation,
        int hanging,
        String symbolFont
) {

    public NumberingLevel {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(levelText, "levelText");
    }

    @JsonIgnore
    public boolean isOrdered() {
        return format != NumberFormat.BULLET;
    }

    public NumberingLevel shifted(int delta) {
        return new NumberingLevel(index, start, format, levelText, leftIndentation + delta, hanging, symbolFont);
    }
}
