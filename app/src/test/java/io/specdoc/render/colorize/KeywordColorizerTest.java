package io.specdoc.render.colorize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class KeywordColorizerTest {

    @Test
    void colorsCSharpKeywordsStringsAndComments() {
        List<ColorizedLine> lines = KeywordColorizer.csharp().colorize("string s = \"if\"; // note");

        assertThat(lines).singleElement().satisfies(line -> assertThat(line.words())
                .extracting(ColorizedWord::text, ColorizedWord::rgb)
                .containsExactly(
                        tuple("string", KeywordColorizer.KEYWORD_COLOR),
                        tuple(" ", ColorizedWord.BLACK),
                        tuple("s", ColorizedWord.BLACK),
                        tuple(" = ", ColorizedWord.BLACK),
                        tuple("\"if\"", KeywordColorizer.STRING_COLOR),
                        tuple("; ", ColorizedWord.BLACK),
                        tuple("// note", KeywordColorizer.COMMENT_COLOR)));
    }

    @Test
    void blockCommentSpansLines() {
        List<ColorizedLine> lines = KeywordColorizer.csharp().colorize("/* start\nstill comment */ int x;");

        assertThat(lines.get(0).words()).extracting(ColorizedWord::rgb).containsOnly(KeywordColorizer.COMMENT_COLOR);
        assertThat(lines.get(1).words().get(0).text()).isEqualTo("still comment */");
        assertThat(lines.get(1).words().get(0).rgb()).isEqualTo(KeywordColorizer.COMMENT_COLOR);
        assertThat(lines.get(1).words()).extracting(ColorizedWord::text).contains("int");
    }

    @Test
    void visualBasicKeywordsIgnoreCaseAndQuoteStartsComment() {
        List<ColorizedLine> lines = KeywordColorizer.visualBasic().colorize("Dim x As Integer ' counter");

        assertThat(lines.get(0).words())
                .filteredOn(ColorizedWord::hasColor)
                .extracting(ColorizedWord::text)
                .containsExactly("Dim", "As", "Integer", "' counter");
    }

    @Test
    void visibleLengthCountsEveryCharacter() {
        List<ColorizedLine> lines = KeywordColorizer.csharp().colorize("int  x;\n");

        assertThat(lines).hasSize(2);
        assertThat(lines.get(0).visibleLength()).isEqualTo(7);
        assertThat(lines.get(1).words()).isEmpty();
    }

    @Test
    void hexColorIsUpperCaseSixDigits() {
        assertThat(new ColorizedWord("x", KeywordColorizer.STRING_COLOR, false).hexColor()).isEqualTo("A31515");
        assertThat(ColorizedWord.plain("x").hasColor()).isFalse();
    }

    @Test
    void languageTagsMapToLanguages() {
        assertThat(CodeLanguage.fromTag("cs")).contains(CodeLanguage.CSHARP);
        assertThat(CodeLanguage.fromTag("vb")).contains(CodeLanguage.VB);
        assertThat(CodeLanguage.fromTag(null)).contains(CodeLanguage.PLAIN);
        assertThat(CodeLanguage.fromTag("ANTLR")).contains(CodeLanguage.PLAIN);
        assertThat(CodeLanguage.fromTag("cobol")).isEmpty();
    }

    @Test
    void registryFallsBackToPlainText() {
        ColorizerRegistry registry = new ColorizerRegistry(Map.of());

        assertThat(registry.forLanguage(CodeLanguage.CSHARP)).isInstanceOf(PlainTextColorizer.class);
        assertThat(ColorizerRegistry.standard().forLanguage(CodeLanguage.CSHARP)).isInstanceOf(KeywordColorizer.class);
    }
}
