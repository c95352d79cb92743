package io.specdoc.render.convert;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    @Test
    void pipeTokenBecomesLiteralPipe() {
        assertThat(TextNormalizer.normalize("a ceci_n'est_pas_une_pipe b")).isEqualTo("a | b");
    }

    @Test
    void reservedPrefixIsRemoved() {
        assertThat(TextNormalizer.normalize("ceci_n'est_pas_une_identifier")).isEqualTo("identifier");
    }

    @Test
    void escapedPipeLosesItsBackslash() {
        assertThat(TextNormalizer.normalize("x \\| y")).isEqualTo("x | y");
    }

    @Test
    void pipeTokenIsDecodedBeforeThePrefixIsStripped() {
        assertThat(TextNormalizer.normalize("ceci_n'est_pas_une_pipececi_n'est_pas_une_pipe")).isEqualTo("||");
    }

    @Test
    void ordinaryTextIsUnchanged() {
        assertThat(TextNormalizer.normalize("int x = a | b;")).isEqualTo("int x = a | b;");
    }
}
