package io.specdoc.render.colorize;

import java.util.ArrayList;
import java.util.List;

public class PlainTextColorizer implements Colorizer {

    @Override
    public List<ColorizedLine> colorize(String code) {
        List<ColorizedLine> lines = new ArrayList<>();
        for (String line : splitLines(code)) {
            lines.add(line.isEmpty() ? new ColorizedLine(List.of()) : ColorizedLine.of(ColorizedWord.plain(line)));
        }
        return lines;
    }

    static String[] splitLines(String code) {
        return code.split("\r?\n", -1);
    }
}
