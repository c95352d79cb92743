package io.specdoc.render.document;

/**
 * Character formatting of a run. Each {@code with*} method adds one attribute and keeps the others.
 */
public record RunProperties(
        boolean bold,
        boolean italic,
        String styleId,
        String color,
        VerticalPosition verticalPosition,
        Underline underline
) {

    public static final RunProperties PLAIN = new RunProperties(false, false, null, null, VerticalPosition.BASELINE, null);

    public RunProperties {
        verticalPosition = verticalPosition == null ? VerticalPosition.BASELINE : verticalPosition;
    }

    public RunProperties withBold() {
        return new RunProperties(true, italic, styleId, color, verticalPosition, underline);
    }

    public RunProperties withItalic() {
        return new RunProperties(bold, true, styleId, color, verticalPosition, underline);
    }

    public RunProperties withStyle(String value) {
        return new RunProperties(bold, italic, value, color, verticalPosition, underline);
    }

    public RunProperties withColor(String value) {
        return new RunProperties(bold, italic, styleId, value, verticalPosition, underline);
    }

    public RunProperties withVerticalPosition(VerticalPosition value) {
        return new RunProperties(bold, italic, styleId, color, value, underline);
    }

    public RunProperties withUnderline(Underline value) {
        return new RunProperties(bold, italic, styleId, color, verticalPosition, value);
    }

    public record Underline(UnderlineStyle style, String color) {
    }

    public enum UnderlineStyle {
        SINGLE,
        DOTTED
    }
}
