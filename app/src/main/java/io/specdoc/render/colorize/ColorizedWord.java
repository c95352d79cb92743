package io.specdoc.render.colorize;

import java.util.Locale;
import java.util.Objects;

/**
 * Token of colorized source; {@code rgb} is 0xRRGGBB, 0 meaning default (black).
 */
public record ColorizedWord(String text, int rgb, boolean italic) {

    public static final int BLACK = 0x000000;

    public ColorizedWord {
        Objects.requireNonNull(text, "text");
    }

    public static ColorizedWord plain(String text) {
        return new ColorizedWord(text, BLACK, false);
    }

    public boolean hasColor() {
        return rgb != BLACK;
    }

    public String hexColor() {
        return String.format(Locale.ROOT, "%06X", rgb & 0xFFFFFF);
    }
}
