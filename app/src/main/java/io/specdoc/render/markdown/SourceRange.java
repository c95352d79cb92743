package io.specdoc.render.markdown;

/**
 * One-based source line of a block; {@link #UNKNOWN} when the producer did not track positions.
 */
public record SourceRange(int line) {

    public static final SourceRange UNKNOWN = new SourceRange(0);

    public SourceRange {
        if (line < 0) {
            throw new IllegalArgumentException("line must be zero or greater");
        }
    }

    public boolean isKnown() {
        return line > 0;
    }
}
