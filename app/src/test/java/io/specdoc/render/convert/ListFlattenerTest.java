package io.specdoc.render.convert;

import static io.specdoc.render.convert.ConversionFixtures.paragraph;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.specdoc.render.diagnostics.DiagnosticCode;
import io.specdoc.render.markdown.Block;
import io.specdoc.render.markdown.CodeBlock;
import io.specdoc.render.markdown.Heading;
import io.specdoc.render.markdown.InlineCode;
import io.specdoc.render.markdown.ListBlock;
import io.specdoc.render.markdown.ListBlock.Item;
import io.specdoc.render.markdown.Literal;
import io.specdoc.render.markdown.Paragraph;
import io.specdoc.render.markdown.QuotedBlock;
import io.specdoc.render.markdown.SpanBlock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ListFlattenerTest {

    private ConversionContext context;
    private ListFlattener flattener;

    @BeforeEach
    void setUp() {
        context = ConversionFixtures.context();
        flattener = new ListFlattener(ConversionFixtures.reporter(context));
    }

    @Test
    void flattensDepthFirstWithLevels() {
        ListBlock list = new ListBlock(true, List.of(
                Item.of(paragraph("one"), new ListBlock(false, List.of(Item.of(paragraph("one.a"))))),
                Item.of(paragraph("two"))));

        List<FlatItem> items = flattener.flatten(list);

        assertThat(items)
                .extracting(FlatItem::level, FlatItem::hasBullet, FlatItem::ordered, item -> text(item.content()))
                .containsExactly(
                        tuple(0, true, true, "one"),
                        tuple(1, true, false, "one.a"),
                        tuple(0, true, true, "two"));
        assertThat(context.diagnostics().entries()).isEmpty();
    }

    @Test
    void laterParagraphsOfAnItemHaveNoBullet() {
        ListBlock list = new ListBlock(false, List.of(Item.of(paragraph("first"), paragraph("second"))));

        List<FlatItem> items = flattener.flatten(list);

        assertThat(items).extracting(FlatItem::hasBullet, FlatItem::firstOfItem)
                .containsExactly(tuple(true, true), tuple(false, false));
    }

    @Test
    void quotesAndCodeAreContinuations() {
        CodeBlock code = new CodeBlock("csharp", "int x;");
        QuotedBlock quote = new QuotedBlock(List.of(paragraph("note")));
        ListBlock list = new ListBlock(false, List.of(Item.of(paragraph("text"), code, quote)));

        List<FlatItem> items = flattener.flatten(list);

        assertThat(items).extracting(FlatItem::content).containsExactly(items.get(0).content(), code, quote);
        assertThat(items.subList(1, 3)).extracting(FlatItem::hasBullet).containsOnly(false);
    }

    @Test
    void mixedOrderingAtOneLevelIsReportedPerItem() {
        ListBlock list = new ListBlock(true, List.of(
                Item.of(paragraph("a"), new ListBlock(false, List.of(Item.of(paragraph("x"))))),
                Item.of(paragraph("b"), new ListBlock(true, List.of(
                        Item.of(paragraph("y")), Item.of(paragraph("z")))))));

        flattener.flatten(list);

        assertThat(context.diagnostics().withCode(DiagnosticCode.MDC012)).hasSize(2);
    }

    @Test
    void fifthLevelIsReported() {
        Block deepest = new ListBlock(false, List.of(Item.of(paragraph("level 4"))));
        for (int level = 3; level >= 0; level--) {
            deepest = new ListBlock(false, List.of(Item.of(paragraph("level " + level), deepest)));
        }

        List<FlatItem> items = flattener.flatten((ListBlock) deepest);

        assertThat(items).extracting(FlatItem::level).containsExactly(0, 1, 2, 3, 4);
        assertThat(context.diagnostics().withCode(DiagnosticCode.MDC013)).hasSize(1);
    }

    @Test
    void indentResetMarkerMovesParagraphToFirstLevel() {
        ListBlock list = new ListBlock(false, List.of(Item.of(paragraph("outer"),
                new ListBlock(false, List.of(Item.of(
                        paragraph("inner"), paragraph(ListFlattener.INDENT_RESET_MARKER + "back")))))));

        List<FlatItem> items = flattener.flatten(list);

        FlatItem reset = items.get(2);
        assertThat(reset.level()).isZero();
        assertThat(text(reset.content())).isEqualTo("back");
    }

    @Test
    void csharpInlineCodeIsSplitIntoCodeBlock() {
        SpanBlock tight = new SpanBlock(List.of(
                new Literal("Example: "), new InlineCode("csharp\nint x = 1;"), new Literal("done")));
        ListBlock list = new ListBlock(false, List.of(Item.of(tight)));

        List<FlatItem> items = flattener.flatten(list);

        assertThat(items).hasSize(3);
        assertThat(text(items.get(0).content())).isEqualTo("Example: ");
        assertThat(items.get(1).content()).isEqualTo(new CodeBlock("csharp", "int x = 1;", tight.range()));
        assertThat(items.get(1).hasBullet()).isFalse();
        assertThat(items.get(2).content()).isInstanceOf(SpanBlock.class);
        assertThat(text(items.get(2).content())).isEqualTo("done");
    }

    @Test
    void headingInsideListIsDropped() {
        ListBlock list = new ListBlock(false, List.of(Item.of(paragraph("text"),
                new Heading(2, List.of(new Literal("Oops"))))));

        List<FlatItem> items = flattener.flatten(list);

        assertThat(items).hasSize(1);
        assertThat(context.diagnostics().withCode(DiagnosticCode.MDC014)).hasSize(1);
    }

    private static String text(Block block) {
        List<?> body = block instanceof Paragraph paragraph ? paragraph.body() : ((SpanBlock) block).body();
        return ((Literal) body.get(0)).text();
    }
}
