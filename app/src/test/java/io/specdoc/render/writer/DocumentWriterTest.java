package io.specdoc.render.writer;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.specdoc.render.diagnostics.Location;
import io.specdoc.render.document.BookmarkEnd;
import io.specdoc.render.document.BookmarkStart;
import io.specdoc.render.document.DocBlock;
import io.specdoc.render.document.Hyperlink;
import io.specdoc.render.document.NumberingDefinitions;
import io.specdoc.render.document.Paragraph;
import io.specdoc.render.document.RenderedDocument;
import io.specdoc.render.document.Run;
import io.specdoc.render.document.RunProperties;
import io.specdoc.render.document.Table;
import io.specdoc.render.document.TableCell;
import io.specdoc.render.document.TableProperties;
import io.specdoc.render.document.TableRow;
import io.specdoc.render.spec.SectionRef;
import io.specdoc.render.spec.TermRef;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    private final DocumentWriter writer = new DocumentWriter();

    @Test
    void writesTaggedBlocksAndInlines() throws IOException {
        Path target = tempDir.resolve("nested/spec.json");

        writer.write(target, List.of(document()));

        JsonNode root = new ObjectMapper().readTree(target.toFile());
        assertThat(root.isArray()).isTrue();
        JsonNode document = root.get(0);
        assertThat(document.get("sources").get(0).asText()).isEqualTo("basics.md");
        JsonNode paragraph = document.get("blocks").get(0);
        assertThat(paragraph.get("type").asText()).isEqualTo("paragraph");
        List<String> inlineTypes = new ArrayList<>();
        paragraph.get("content").forEach(inline -> inlineTypes.add(inline.get("type").asText()));
        assertThat(inlineTypes).containsExactly("bookmarkStart", "run", "bookmarkEnd", "hyperlink");
        JsonNode table = document.get("blocks").get(1);
        assertThat(table.get("type").asText()).isEqualTo("table");
        assertThat(table.get("properties").get("indentation").asInt()).isEqualTo(360);
        assertThat(document.get("terms").get(0).get("bookmarkName").asText()).isEqualTo("_Trm00001");
        assertThat(document.get("sections").get(0).get("number").asText()).isEqualTo("1");
    }

    @Test
    void leavesOutEmptyValues() {
        String json = writer.toJson(new RenderedDocument(List.of("a.md"),
                List.of(Paragraph.of(Run.plain("text"))), new NumberingDefinitions(), List.of(), List.of()));

        assertThat(json)
                .doesNotContain("\"terms\"")
                .doesNotContain("\"styleId\"")
                .doesNotContain("\"properties\" : null");
    }

    private static RenderedDocument document() {
        DocBlock paragraph = new Paragraph(List.of(
                new BookmarkStart("_Trm00001", 1),
                new Run("value type", RunProperties.PLAIN.withBold().withItalic()),
                new BookmarkEnd(1),
                Hyperlink.external("https://example.com", null, List.of(Run.plain("link")))));
        Table table = new Table(new TableProperties("TableGrid", 360, null))
                .addRow(new TableRow(List.of(new TableCell(List.of(Paragraph.of(Run.plain("cell")))))));
        return new RenderedDocument(
                List.of("basics.md"),
                List.of(paragraph, table),
                new NumberingDefinitions(),
                List.of(new TermRef("value type", "_Trm00001", new Location("basics.md", 3))),
                List.of(new SectionRef("basics.md#1-basics", "1 Basics", "Basics", Optional.of("1"), "_Toc_1")));
    }
}
