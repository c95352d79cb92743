package io.specdoc.render.colorize;

import java.util.List;

/**
 * Turns source text into colored lines. Implementations never fail: text they cannot classify stays plain.
 */
@FunctionalInterface
public interface Colorizer {

    List<ColorizedLine> colorize(String code);
}
