package io.specdoc.render.convert;

import io.specdoc.render.diagnostics.DiagnosticCode;
import io.specdoc.render.diagnostics.Reporter;
import io.specdoc.render.document.DocBlock;
import io.specdoc.render.document.Justification;
import io.specdoc.render.document.Run;
import io.specdoc.render.document.RunProperties;
import io.specdoc.render.document.StyleIds;
import io.specdoc.render.document.Table;
import io.specdoc.render.document.TableCell;
import io.specdoc.render.document.TableRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;

/**
 * Builds the function members table from its hand-written HTML. Only {@code tr}, {@code th}, {@code td} and
 * {@code code} are understood; the first {@code td} of a row may carry a {@code rowspan}.
 */
public class FunctionMembersTableBuilder {

    static final int WIDTH = 9000;

    private final Reporter reporter;

    public FunctionMembersTableBuilder(Reporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public List<DocBlock> build(String markup) {
        Document document = Jsoup.parse(markup, "", Parser.xmlParser());
        Table table = TableBuilder.newTable(TableBuilder.TABLE_INDENTATION, WIDTH);
        int rowsLeftToMerge = 0;
        for (Element row : document.select("tr")) {
            List<TableCell> cells = new ArrayList<>();
            for (Element cell : row.children()) {
                cells.add(cell(cell));
            }
            Element firstData = row.children().stream()
                    .filter(child -> child.normalName().equals("td"))
                    .findFirst()
                    .orElse(null);
            if (firstData != null && firstData.hasAttr("rowspan") && !cells.isEmpty()) {
                rowsLeftToMerge = rowSpan(firstData) - 1;
                cells.set(0, cells.get(0).withVerticalMerge(TableCell.VerticalMerge.RESTART));
            } else if (rowsLeftToMerge > 0) {
                TableCell merged = new TableCell(List.of(TableBuilder.cellParagraph(List.of(), Justification.CENTER)),
                        TableCell.VerticalMerge.CONTINUE);
                cells.add(0, merged);
                rowsLeftToMerge--;
            }
            table.addRow(new TableRow(cells));
        }
        return TableBuilder.framed(table);
    }

    private TableCell cell(Element cell) {
        List<Run> runs = new ArrayList<>();
        if (cell.normalName().equals("th")) {
            runs.add(new Run(cell.text(), RunProperties.PLAIN.withBold()));
        } else {
            List<Node> nodes = cell.childNodes();
            for (int index = 0; index < nodes.size(); index++) {
                Node node = nodes.get(index);
                if (node instanceof Element element && element.normalName().equals("code")) {
                    runs.add(Run.styled(TextNormalizer.normalize(element.wholeText()), StyleIds.CODE_EMBEDDED));
                } else if (node instanceof TextNode text) {
                    // blank text only separates inline nodes, never pads the cell
                    boolean edge = index == 0 || index == nodes.size() - 1;
                    if (!text.isBlank() || !edge) {
                        runs.add(Run.plain(text.getWholeText()));
                    }
                } else {
                    reporter.error(DiagnosticCode.MDC033, "Unexpected node <" + node.nodeName()
                            + "> in function members table");
                }
            }
        }
        return new TableCell(List.of(TableBuilder.cellParagraph(runs, Justification.LEFT)));
    }

    private int rowSpan(Element cell) {
        String value = cell.attr("rowspan").trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            reporter.error(DiagnosticCode.MDC033, "Invalid rowspan '" + value + "' in function members table");
            return 1;
        }
    }
}
