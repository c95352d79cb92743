package io.specdoc.render.colorize;

import java.util.List;
import java.util.Objects;

public record ColorizedLine(List<ColorizedWord> words) {

    public ColorizedLine {
        words = List.copyOf(Objects.requireNonNull(words, "words"));
    }

    public static ColorizedLine of(ColorizedWord... words) {
        return new ColorizedLine(List.of(words));
    }

    public int visibleLength() {
        return words.stream().mapToInt(word -> word.text().length()).sum();
    }
}
