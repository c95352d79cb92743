package io.specdoc.render.convert;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Blocks generated in code rather than from Markdown, selected by a marker comment
 * {@code <!-- Custom Word conversion: id -->}.
 */
public enum CustomBlock {
    FUNCTION_MEMBERS("function_members"),
    FORMAT_STRINGS_1("format_strings_1"),
    FORMAT_STRINGS_2("format_strings_2"),
    TEST("test");

    static final Pattern MARKER = Pattern.compile("^<!-- Custom Word conversion: ([a-z0-9_]+) -->");

    private final String id;

    CustomBlock(String id) {
        this.id = id;
    }

    /**
     * Id named by the marker comment at the start of {@code html}, known or not.
     */
    public static Optional<String> markerId(String html) {
        Matcher matcher = MARKER.matcher(html);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public static Optional<CustomBlock> fromId(String id) {
        for (CustomBlock block : values()) {
            if (block.id.equals(id)) {
                return Optional.of(block);
            }
        }
        return Optional.empty();
    }
}
