package io.specdoc.render.document;

/**
 * Paragraph, run and table style names the document template defines.
 */
public final class StyleIds {

    public static final String HEADING_PREFIX = "Heading";
    public static final String CODE = "Code";
    public static final String CODE_EMBEDDED = "CodeEmbedded";
    public static final String LIST_PARAGRAPH = "ListParagraph";
    public static final String TABLE_CELL = "TableCellNormal";
    public static final String TABLE_LINE_BEFORE = "TableLineBefore";
    public static final String TABLE_LINE_AFTER = "TableLineAfter";
    public static final String TABLE_GRID = "TableGrid";
    public static final String HYPERLINK = "Hyperlink";

    private StyleIds() {
    }

    public static String heading(int level) {
        return HEADING_PREFIX + level;
    }
}
