package io.specdoc.render.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.specdoc.render.config.Config;
import io.specdoc.render.config.ConfigLoader;
import io.specdoc.render.config.LogFormat;
import io.specdoc.render.markdown.CommonMarkReader;
import io.specdoc.render.writer.DiagnosticsWriter;
import io.specdoc.render.writer.DocumentWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void runWritesDocumentAndDiagnostics() throws IOException {
        Path source = write("basics.md", "# 1 Basics\n\nA ***value type*** holds its data.\n");
        Path output = tempDir.resolve("out/spec.json");
        Path diagnostics = tempDir.resolve("out/diagnostics.jsonl");

        int exitCode = application(new ConfigLoader(key -> Optional.empty())).run(new String[] {
                source.toString(), "-o", output.toString(), "--diagnostics", diagnostics.toString()
        });

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output, StandardCharsets.UTF_8))
                .contains("\"type\" : \"paragraph\"")
                .contains("_Trm00001");
        assertThat(Files.readAllLines(diagnostics, StandardCharsets.UTF_8))
                .singleElement()
                .asString()
                .contains("\"code\":\"MDC999\"");
    }

    @Test
    void strictModeFailsWhenErrorsAreReported() throws IOException {
        Path source = write("broken.md", "```cobol\nMOVE A TO B\n```\n");
        Config config = new Config(List.of(source), tempDir.resolve("spec.json"), Optional.empty(), true, true,
                LogFormat.TEXT, 81);

        int exitCode = application(new FixedConfigLoader(config)).run(new String[] {source.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_ERRORS_REPORTED);
        assertThat(tempDir.resolve("spec.json")).exists();
    }

    @Test
    void errorsWithoutStrictModeStillSucceed() throws IOException {
        Path source = write("broken.md", "```cobol\nMOVE A TO B\n```\n");

        int exitCode = application(new ConfigLoader(key -> Optional.empty())).run(new String[] {
                source.toString(), "-o", tempDir.resolve("spec.json").toString()
        });

        assertThat(exitCode).isZero();
    }

    @Test
    void missingInputIsAUsageError() {
        int exitCode = application(new ConfigLoader(key -> Optional.empty())).run(new String[] {"--strict"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void helpExitsCleanly() {
        int exitCode = application(new ConfigLoader(key -> Optional.empty())).run(new String[] {"--help"});

        assertThat(exitCode).isZero();
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    private static CliApplication application(ConfigLoader configLoader) {
        return new CliApplication(configLoader, new CommonMarkReader(), new DocumentWriter(), new DiagnosticsWriter());
    }

    private static final class FixedConfigLoader extends ConfigLoader {

        private final Config config;

        FixedConfigLoader(Config config) {
            super(key -> Optional.empty());
            this.config = config;
        }

        @Override
        public Config load(CliArguments arguments) {
            return config;
        }
    }
}
