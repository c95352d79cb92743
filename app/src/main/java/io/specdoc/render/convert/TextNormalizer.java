package io.specdoc.render.convert;

/**
 * Textual workarounds applied to every inline-code, math and code-block string, in this order:
 * <ol>
 *     <li>{@value #PIPE_TOKEN} becomes a literal pipe,</li>
 *     <li>the reserved prefix {@value #RESERVED_PREFIX} is removed,</li>
 *     <li>a backslash-escaped pipe (used inside table cells) loses its backslash.</li>
 * </ol>
 * The order matters: the pipe token starts with the reserved prefix.
 */
public final class TextNormalizer {

    public static final String PIPE_TOKEN = "ceci_n'est_pas_une_pipe";
    public static final String RESERVED_PREFIX = "ceci_n'est_pas_une_";
    public static final String ESCAPED_PIPE = "\\|";

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        return unescapePipe(stripReservedPrefix(decodePipeToken(text)));
    }

    static String decodePipeToken(String text) {
        return text.replace(PIPE_TOKEN, "|");
    }

    static String stripReservedPrefix(String text) {
        return text.replace(RESERVED_PREFIX, "");
    }

    static String unescapePipe(String text) {
        return text.replace(ESCAPED_PIPE, "|");
    }
}
