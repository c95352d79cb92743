package io.specdoc.render.spec;

import static org.assertj.core.api.Assertions.assertThat;

import io.specdoc.render.markdown.Heading;
import io.specdoc.render.markdown.InlineCode;
import io.specdoc.render.markdown.Literal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SectionRefFactoryTest {

    @Test
    void numberedHeadingSplitsNumberFromTitle() {
        SectionRef ref = SectionRefFactory.create(new Heading(2, List.of(new Literal("6.4.3 Identifiers"))),
                "lexical-structure.md");

        assertThat(ref.url()).isEqualTo("lexical-structure.md#643-identifiers");
        assertThat(ref.title()).isEqualTo("6.4.3 Identifiers");
        assertThat(ref.titleWithoutNumber()).isEqualTo("Identifiers");
        assertThat(ref.number()).contains("6.4.3");
        assertThat(ref.bookmarkName()).isEqualTo("_Toc_6_4_3");
        assertThat(ref.file()).isEqualTo("lexical-structure.md");
    }

    @Test
    void annexNumbersAreRecognized() {
        SectionRef ref = SectionRefFactory.create(new Heading(2, List.of(new Literal("B.2 Grammar"))), "grammar.md");

        assertThat(ref.number()).contains("B.2");
        assertThat(ref.bookmarkName()).isEqualTo("_Toc_B_2");
    }

    @Test
    void unnumberedHeadingUsesSlugForBookmark() {
        SectionRef ref = SectionRefFactory.create(new Heading(1, List.of(new Literal("Foreword"))), "foreword.md");

        assertThat(ref.number()).isEqualTo(Optional.empty());
        assertThat(ref.titleWithoutNumber()).isEqualTo("Foreword");
        assertThat(ref.bookmarkName()).isEqualTo("_Toc_foreword");
    }

    @Test
    void headingTextIncludesInlineCode() {
        SectionRef ref = SectionRefFactory.create(new Heading(3,
                List.of(new Literal("12.8.4 The "), new InlineCode("is"), new Literal(" operator"))), "expressions.md");

        assertThat(ref.title()).isEqualTo("12.8.4 The is operator");
        assertThat(ref.url()).isEqualTo("expressions.md#1284-the-is-operator");
    }

    @Test
    void longBookmarksAreTruncated() {
        SectionRef ref = SectionRefFactory.create(new Heading(1,
                List.of(new Literal("Informative references and further reading material"))), "biblio.md");

        assertThat(ref.bookmarkName()).hasSize(SectionRefFactory.MAX_BOOKMARK_LENGTH).startsWith("_Toc_informative");
    }

    @Test
    void slugDropsPunctuation() {
        assertThat(SectionRefFactory.slug("C# (preview): what's new?")).isEqualTo("c-preview-whats-new");
    }
}
