package io.specdoc.render.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import org.junit.jupiter.api.Test;

class NumberingDefinitionsTest {

    private static final NumberingLevel DECIMAL = new NumberingLevel(0, 1, NumberFormat.DECIMAL, "%1.", 540, 360, null);

    @Test
    void idsContinueFromHighestRegistered() {
        NumberingDefinitions numbering = new NumberingDefinitions();
        numbering.add(new AbstractNumbering(5, List.of(DECIMAL)));
        numbering.add(new NumberingInstance(3, 5));

        assertThat(numbering.nextAbstractId()).isEqualTo(6);
        assertThat(numbering.nextInstanceId()).isEqualTo(4);
    }

    @Test
    void shiftMovesEveryLevelOfTheInstanceDefinition() {
        NumberingDefinitions numbering = new NumberingDefinitions();
        numbering.add(new AbstractNumbering(1, List.of(DECIMAL, DECIMAL.shifted(360))));
        numbering.add(new NumberingInstance(1, 1));

        assertThat(numbering.shiftIndentation(1, 540)).isTrue();
        assertThat(numbering.shiftIndentation(9, 540)).isFalse();

        assertThat(numbering.abstractFor(1).orElseThrow().levels())
                .extracting(NumberingLevel::leftIndentation)
                .containsExactly(1080, 1440);
    }

    @Test
    void instanceMustReferToKnownDefinition() {
        NumberingDefinitions numbering = new NumberingDefinitions();

        Throwable thrown = catchThrowable(() -> numbering.add(new NumberingInstance(1, 7)));

        assertThat(thrown)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unknown abstract numbering 7");
    }

    @Test
    void hyperlinkNeedsExactlyOneTarget() {
        Throwable thrown = catchThrowable(() -> new Hyperlink("_Toc_1", "https://example.com", null, List.of()));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
        assertThat(Hyperlink.internal("_Toc_1", Run.plain("§1")).isInternal()).isTrue();
    }

    @Test
    void paragraphTextJoinsRunsAndLinks() {
        Paragraph paragraph = Paragraph.of(new BookmarkStart("_Toc_1", 1), Run.plain("See "),
                Hyperlink.internal("_Toc_2", Run.plain("§2")), Break.INSTANCE, new BookmarkEnd(1));

        assertThat(paragraph.text()).isEqualTo("See §2");
        assertThat(paragraph.properties()).isEmpty();
        paragraph.ensureProperties().leftIndentation(540);
        assertThat(paragraph.properties().flatMap(ParagraphProperties::leftIndentation)).contains(540);
    }
}
