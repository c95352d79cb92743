package io.specdoc.render.convert;

import io.specdoc.render.document.AbstractNumbering;
import io.specdoc.render.document.NumberFormat;
import io.specdoc.render.document.NumberingDefinitions;
import io.specdoc.render.document.NumberingInstance;
import io.specdoc.render.document.NumberingLevel;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Registers one abstract numbering definition and one instance per source list.
 */
public class NumberingSchemeBuilder {

    public static final int INITIAL_INDENTATION = 540;
    public static final int LEVEL_INDENTATION = 360;
    public static final int LEVEL_COUNT = ListFlattener.MAX_LEVEL + 1;

    private static final String SOLID_BULLET = "·";
    private static final String HOLLOW_BULLET = "o";
    private static final String SOLID_BULLET_FONT = "Symbol";
    private static final String HOLLOW_BULLET_FONT = "Courier New";

    private final NumberingDefinitions numbering;

    public NumberingSchemeBuilder(NumberingDefinitions numbering) {
        this.numbering = Objects.requireNonNull(numbering, "numbering");
    }

    /**
     * @return the id of the new numbering instance
     */
    public int register(List<FlatItem> items) {
        boolean[] ordered = new boolean[LEVEL_COUNT];
        for (FlatItem item : items) {
            if (item.ordered()) {
                ordered[effectiveLevel(item.level())] = true;
            }
        }
        List<NumberingLevel> levels = new ArrayList<>();
        for (int level = 0; level < LEVEL_COUNT; level++) {
            levels.add(level(level, ordered[level]));
        }
        int abstractId = numbering.nextAbstractId();
        numbering.add(new AbstractNumbering(abstractId, levels));
        int instanceId = numbering.nextInstanceId();
        numbering.add(new NumberingInstance(instanceId, abstractId));
        return instanceId;
    }

    static NumberingLevel level(int level, boolean ordered) {
        if (ordered) {
            NumberFormat format = level == 0 ? NumberFormat.DECIMAL
                    : level == 1 ? NumberFormat.LOWER_LETTER : NumberFormat.LOWER_ROMAN;
            return new NumberingLevel(level, 1, format, "%" + (level + 1) + ".", indentation(level),
                    LEVEL_INDENTATION, null);
        }
        boolean solid = level % 2 == 0;
        return new NumberingLevel(level, 1, NumberFormat.BULLET, solid ? SOLID_BULLET : HOLLOW_BULLET,
                indentation(level), LEVEL_INDENTATION, solid ? SOLID_BULLET_FONT : HOLLOW_BULLET_FONT);
    }

    /**
     * Left indentation of list content at {@code level}; levels past the last one share its indentation.
     */
    public static int indentation(int level) {
        return INITIAL_INDENTATION + LEVEL_INDENTATION * effectiveLevel(level);
    }

    public static int effectiveLevel(int level) {
        return Math.min(level, LEVEL_COUNT - 1);
    }
}
