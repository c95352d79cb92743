package io.specdoc.render.convert;

import io.specdoc.render.diagnostics.DiagnosticCode;
import io.specdoc.render.diagnostics.Reporter;
import io.specdoc.render.document.DocBlock;
import io.specdoc.render.document.Justification;
import io.specdoc.render.document.Paragraph;
import io.specdoc.render.document.ParagraphProperties;
import io.specdoc.render.document.Run;
import io.specdoc.render.document.StyleIds;
import io.specdoc.render.document.Table;
import io.specdoc.render.document.TableCell;
import io.specdoc.render.document.TableProperties;
import io.specdoc.render.document.TableRow;
import io.specdoc.render.markdown.Block;
import io.specdoc.render.markdown.Emphasis;
import io.specdoc.render.markdown.InlineCode;
import io.specdoc.render.markdown.Literal;
import io.specdoc.render.markdown.Span;
import io.specdoc.render.markdown.SpanBlock;
import io.specdoc.render.markdown.Strong;
import io.specdoc.render.markdown.TableBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts Markdown pipe tables into grid tables framed by a spacing paragraph on each side.
 */
public class TableBuilder {

    public static final int TABLE_INDENTATION = 360;

    private final Reporter reporter;
    private final BlockConverter blocks;

    public TableBuilder(Reporter reporter, BlockConverter blocks) {
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.blocks = Objects.requireNonNull(blocks, "blocks");
    }

    public List<DocBlock> build(TableBlock source) {
        Table table = newTable(TABLE_INDENTATION, null);
        int columns = source.alignments().size();
        if (source.header().isEmpty()) {
            reporter.error(DiagnosticCode.MDC010, "Table has no header row");
        } else if (!source.header().get().cells().stream().allMatch(TableBlock.Cell::isEmpty)) {
            table.addRow(row(source.header().get(), source.alignments(), columns));
        }
        for (TableBlock.Row row : source.rows()) {
            table.addRow(row(row, source.alignments(), columns));
        }
        return framed(table);
    }

    static Table newTable(int indentation, Integer width) {
        return new Table(new TableProperties(StyleIds.TABLE_GRID, indentation, width));
    }

    static List<DocBlock> framed(Table table) {
        return List.of(
                Paragraph.styled(StyleIds.TABLE_LINE_BEFORE, Run.plain("")),
                table,
                Paragraph.styled(StyleIds.TABLE_LINE_AFTER, Run.plain("")));
    }

    static Paragraph cellParagraph(List<Run> runs, Justification justification) {
        ParagraphProperties properties = new ParagraphProperties().styleId(StyleIds.TABLE_CELL);
        if (justification != null) {
            properties.justification(justification);
        }
        return new Paragraph(properties, runs);
    }

    private TableRow row(TableBlock.Row row, List<TableBlock.Alignment> alignments, int columns) {
        List<TableCell> cells = new ArrayList<>();
        int count = Math.min(columns, row.cells().size());
        for (int column = 0; column < count; column++) {
            cells.add(cell(row.cells().get(column), justification(alignments.get(column))));
        }
        return new TableRow(cells);
    }

    private TableCell cell(TableBlock.Cell cell, Justification justification) {
        List<DocBlock> content = new ArrayList<>();
        for (Block block : cell.blocks()) {
            content.addAll(blocks.convert(rewriteStarredCode(block)));
        }
        for (DocBlock element : content) {
            if (element instanceof Paragraph paragraph) {
                ParagraphProperties properties = paragraph.ensureProperties().styleId(StyleIds.TABLE_CELL);
                if (justification != null) {
                    properties.justification(justification);
                }
            }
        }
        if (content.isEmpty()) {
            Paragraph empty = cellParagraph(List.of(Run.plain("")), justification);
            empty.ensureProperties().spacingAfter(0);
            content.add(empty);
        }
        return new TableCell(content);
    }

    private static Justification justification(TableBlock.Alignment alignment) {
        return switch (alignment) {
            case CENTER -> Justification.CENTER;
            case RIGHT -> Justification.RIGHT;
            case DEFAULT, LEFT -> null;
        };
    }

    /**
     * Pipe tables cannot hold {@code **`code`**}, so authors write {@code *_`code`_*}, which parses as
     * literal stars around emphasized code. Turn that back into bold code.
     */
    static Block rewriteStarredCode(Block block) {
        List<Span> body;
        if (block instanceof io.specdoc.render.markdown.Paragraph paragraph) {
            body = paragraph.body();
        } else if (block instanceof SpanBlock spanBlock) {
            body = spanBlock.body();
        } else {
            return block;
        }
        if (body.size() == 3
                && body.get(0) instanceof Literal open && open.text().equals("*")
                && body.get(1) instanceof Emphasis emphasis
                && emphasis.body().size() == 1 && emphasis.body().get(0) instanceof InlineCode code
                && body.get(2) instanceof Literal close && close.text().equals("*")) {
            List<Span> rewritten = List.of(Strong.of(code));
            return block instanceof SpanBlock
                    ? new SpanBlock(rewritten, block.range())
                    : new io.specdoc.render.markdown.Paragraph(rewritten, block.range());
        }
        return block;
    }
}
