package io.specdoc.render.convert;

import io.specdoc.render.diagnostics.DiagnosticCode;
import io.specdoc.render.diagnostics.Reporter;
import io.specdoc.render.document.DocBlock;
import io.specdoc.render.document.Justification;
import io.specdoc.render.document.Paragraph;
import io.specdoc.render.document.Run;
import io.specdoc.render.document.Table;
import io.specdoc.render.document.TableCell;
import io.specdoc.render.document.TableRow;
import io.specdoc.render.markdown.InlineHtmlBlock;
import java.util.List;
import java.util.Objects;

public class CustomBlockGenerator {

    static final int TEST_TABLE_INDENTATION = 900;
    static final int TEST_TABLE_WIDTH = 8000;

    private final Reporter reporter;
    private final FunctionMembersTableBuilder functionMembers;

    public CustomBlockGenerator(Reporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.functionMembers = new FunctionMembersTableBuilder(reporter);
    }

    public List<DocBlock> generate(String id, InlineHtmlBlock block) {
        return CustomBlock.fromId(id)
                .map(known -> generate(known, block))
                .orElseGet(() -> {
                    reporter.error(DiagnosticCode.MDC029, "Invalid custom block id: " + id);
                    return List.of(Paragraph.of(Run.plain("Custom block " + id)));
                });
    }

    private List<DocBlock> generate(CustomBlock block, InlineHtmlBlock source) {
        return switch (block) {
            case FUNCTION_MEMBERS -> functionMembers.build(source.code());
            case FORMAT_STRINGS_1 -> List.of(Paragraph.of(Run.plain("Placeholder: first format strings table")));
            case FORMAT_STRINGS_2 -> List.of(Paragraph.of(Run.plain("Placeholder: second format strings table")));
            case TEST -> testTable();
        };
    }

    private static List<DocBlock> testTable() {
        Table table = TableBuilder.newTable(TEST_TABLE_INDENTATION, TEST_TABLE_WIDTH);
        Paragraph cell = TableBuilder.cellParagraph(List.of(Run.plain("Normal cell")), Justification.CENTER);
        table.addRow(new TableRow(List.of(new TableCell(List.of(cell)))));
        return TableBuilder.framed(table);
    }
}
