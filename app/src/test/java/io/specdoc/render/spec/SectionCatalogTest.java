package io.specdoc.render.spec;

import static org.assertj.core.api.Assertions.assertThat;

import io.specdoc.render.diagnostics.DiagnosticCode;
import io.specdoc.render.diagnostics.DiagnosticLog;
import io.specdoc.render.markdown.CommonMarkReader;
import io.specdoc.render.markdown.SourceFile;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SectionCatalogTest {

    private final CommonMarkReader reader = new CommonMarkReader();

    @Test
    void collectsHeadingsOfEveryFileInOrder() {
        DiagnosticLog log = new DiagnosticLog();

        SectionCatalog catalog = SectionCatalog.build(List.of(
                file("basics.md", "# 1 Basics\n\ntext\n\n## 1.1 Terms\n"),
                file("types.md", "# 2 Types\n")), log);

        assertThat(catalog.all()).extracting(SectionRef::url)
                .containsExactly("basics.md#1-basics", "basics.md#11-terms", "types.md#2-types");
        assertThat(catalog.find("basics.md#11-terms")).map(SectionRef::bookmarkName).contains("_Toc_1_1");
        assertThat(log.entries()).isEmpty();
    }

    @Test
    void duplicateUrlIsReportedAndFirstKept() {
        DiagnosticLog log = new DiagnosticLog();

        SectionCatalog catalog = SectionCatalog.build(List.of(file("notes.md", "# Note\n\n# Note\n")), log);

        assertThat(catalog.size()).isEqualTo(1);
        assertThat(log.withCode(DiagnosticCode.MDC035)).singleElement()
                .satisfies(diagnostic -> assertThat(diagnostic.location().line()).isEqualTo(3));
    }

    @Test
    void clashingBookmarkNamesGetSuffix() {
        SectionCatalog catalog = SectionCatalog.build(List.of(
                file("a.md", "# Introduction\n"),
                file("b.md", "# Introduction\n")), new DiagnosticLog());

        assertThat(catalog.all()).extracting(SectionRef::bookmarkName)
                .containsExactly("_Toc_introduction", "_Toc_introduction_2");
    }

    @Test
    void ofKeepsFirstOfDuplicateUrls() {
        SectionRef first = new SectionRef("a.md#x", "X", "X", Optional.empty(), "_Toc_x");
        SectionRef second = first.withBookmarkName("_Toc_other");

        SectionCatalog catalog = SectionCatalog.of(List.of(first, second));

        assertThat(catalog.find("a.md#x")).contains(first);
        assertThat(catalog.contains("a.md#y")).isFalse();
    }

    private SourceFile file(String name, String markdown) {
        return new SourceFile(name, reader.read(markdown));
    }
}
