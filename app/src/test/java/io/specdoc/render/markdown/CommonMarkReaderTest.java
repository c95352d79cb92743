package io.specdoc.render.markdown;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CommonMarkReaderTest {

    private final CommonMarkReader reader = new CommonMarkReader();

    @Test
    void readsHeadingsAndParagraphsWithLines() {
        MarkdownDocument document = reader.read("# 1 Scope\n\nThis **standard** applies.\n");

        assertThat(document.blocks()).hasSize(2);
        Heading heading = (Heading) document.blocks().get(0);
        assertThat(heading.level()).isEqualTo(1);
        assertThat(heading.body()).containsExactly(new Literal("1 Scope"));
        assertThat(heading.range().line()).isEqualTo(1);
        Paragraph paragraph = (Paragraph) document.blocks().get(1);
        assertThat(paragraph.range().line()).isEqualTo(3);
        assertThat(paragraph.body()).containsExactly(
                new Literal("This "), new Strong(List.of(new Literal("standard"))), new Literal(" applies."));
    }

    @Test
    void softBreaksStayInsideLiteral() {
        MarkdownDocument document = reader.read("first line\nsecond line\n");

        assertThat(((Paragraph) document.blocks().get(0)).body()).containsExactly(new Literal("first line\nsecond line"));
    }

    @Test
    void tightListItemsBecomeSpanBlocks() {
        MarkdownDocument document = reader.read("1. one\n2. two\n   - nested\n");

        ListBlock list = (ListBlock) document.blocks().get(0);
        assertThat(list.ordered()).isTrue();
        assertThat(list.items()).hasSize(2);
        assertThat(list.items().get(0).blocks()).singleElement().isInstanceOf(SpanBlock.class);
        ListBlock nested = (ListBlock) list.items().get(1).blocks().get(1);
        assertThat(nested.ordered()).isFalse();
    }

    @Test
    void looseListItemsKeepParagraphs() {
        MarkdownDocument document = reader.read("- one\n\n- two\n");

        ListBlock list = (ListBlock) document.blocks().get(0);
        assertThat(list.items().get(0).blocks()).singleElement().isInstanceOf(Paragraph.class);
    }

    @Test
    void fencedCodeKeepsLanguageAndDropsFinalNewline() {
        MarkdownDocument document = reader.read("```csharp\nclass C {}\n```\n");

        assertThat(document.blocks()).containsExactly(new CodeBlock("csharp", "class C {}", new SourceRange(1)));
    }

    @Test
    void readsTablesWithAlignments() {
        MarkdownDocument document = reader.read("| a | b |\n|:-:|--:|\n| 1 |   |\n");

        TableBlock table = (TableBlock) document.blocks().get(0);
        assertThat(table.alignments()).containsExactly(TableBlock.Alignment.CENTER, TableBlock.Alignment.RIGHT);
        assertThat(table.header()).isPresent();
        assertThat(table.rows()).singleElement().satisfies(row -> {
            assertThat(row.cells().get(0).blocks()).containsExactly(new Paragraph(List.of(new Literal("1"))));
            assertThat(row.cells().get(1).isEmpty()).isTrue();
        });
    }

    @Test
    void customBlockMarkerIsJoinedWithItsMarkup() {
        MarkdownDocument document = reader.read(
                "<!-- Custom Word conversion: function_members -->\n\n<table>\n<tr><td>x</td></tr>\n</table>\n");

        assertThat(document.blocks()).singleElement().satisfies(block -> {
            InlineHtmlBlock html = (InlineHtmlBlock) block;
            assertThat(html.code()).startsWith("<!-- Custom Word conversion: function_members -->\n<table>");
        });
    }

    @Test
    void linksAndReferenceDefinitions() {
        MarkdownDocument document = reader.read(
                "See [§7.1](basic-concepts.md#71-application-startup) and [ECMA][ecma].\n\n"
                        + "[ecma]: https://ecma-international.org \"Ecma\"\n");

        List<Span> body = ((Paragraph) document.blocks().get(0)).body();
        assertThat(body).contains(new DirectLink(List.of(new Literal("§7.1")),
                "basic-concepts.md#71-application-startup", Optional.empty()));
        assertThat(body).contains(new DirectLink(List.of(new Literal("ECMA")),
                "https://ecma-international.org", Optional.of("Ecma")));
        assertThat(document.definedLinks()).containsKey("ecma");
    }

    @Test
    void unknownNodesAreKeptAsUnsupported() {
        MarkdownDocument document = reader.read("---\n\ntext ![img](a.png)\n");

        assertThat(document.blocks().get(0)).isEqualTo(new UnsupportedBlock("ThematicBreak", new SourceRange(1)));
        assertThat(((Paragraph) document.blocks().get(1)).body()).contains(new UnsupportedSpan("Image"));
    }

    @Test
    void byteOrderMarkIsIgnored() {
        MarkdownDocument document = reader.read("\uFEFF# Title\n");

        assertThat(((Heading) document.blocks().get(0)).body()).containsExactly(new Literal("Title"));
    }

    @Test
    void readFileNamesSourceAfterFile(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("lexical-structure.md"), "# 6 Lexical structure\n",
                StandardCharsets.UTF_8);

        SourceFile source = reader.readFile(file);

        assertThat(source.name()).isEqualTo("lexical-structure.md");
        assertThat(source.document().blocks()).hasSize(1);
    }
}
