package io.specdoc.render.convert;

import io.specdoc.render.document.VerticalPosition;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits inline code at Unicode sub- and superscript characters, replacing each by its ASCII equivalent and
 * tagging every segment with the vertical position it is rendered at.
 */
public final class VerticalPositionSplitter {

    private static final Map<Character, Character> SUBSCRIPTS = Map.ofEntries(
            Map.entry('ᵢ', 'i'),
            Map.entry('ᵥ', 'v'),
            Map.entry('₀', '0'),
            Map.entry('₁', '1'),
            Map.entry('₂', '2'),
            Map.entry('₃', '3'),
            Map.entry('₄', '4'),
            Map.entry('₅', '5'),
            Map.entry('₆', '6'),
            Map.entry('₇', '7'),
            Map.entry('₈', '8'),
            Map.entry('₉', '9'),
            Map.entry('₊', '+'),
            Map.entry('₋', '-'),
            Map.entry('ₑ', 'e'),
            Map.entry('ₓ', 'x'));

    private static final Map<Character, Character> SUPERSCRIPTS = Map.of(
            'ª', 'a',
            'ⁿ', 'n',
            '¹', '1');

    private VerticalPositionSplitter() {
    }

    /**
     * Empty input yields a single empty baseline segment.
     */
    public static List<Segment> split(String text) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        VerticalPosition position = VerticalPosition.BASELINE;
        for (int index = 0; index < text.length(); index++) {
            char ch = text.charAt(index);
            VerticalPosition next = positionOf(ch);
            if (next != position && current.length() > 0) {
                segments.add(new Segment(current.toString(), position));
                current.setLength(0);
            }
            position = next;
            current.append(replacement(ch, next));
        }
        if (current.length() > 0 || segments.isEmpty()) {
            segments.add(new Segment(current.toString(), position));
        }
        return segments;
    }

    private static VerticalPosition positionOf(char ch) {
        if (SUBSCRIPTS.containsKey(ch)) {
            return VerticalPosition.SUBSCRIPT;
        }
        if (SUPERSCRIPTS.containsKey(ch)) {
            return VerticalPosition.SUPERSCRIPT;
        }
        return VerticalPosition.BASELINE;
    }

    private static char replacement(char ch, VerticalPosition position) {
        return switch (position) {
            case SUBSCRIPT -> SUBSCRIPTS.get(ch);
            case SUPERSCRIPT -> SUPERSCRIPTS.get(ch);
            case BASELINE -> ch;
        };
    }

    public record Segment(String text, VerticalPosition position) {
    }
}
