package io.specdoc.render.cli;

import io.specdoc.render.config.LogFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "spec-doc-renderer", mixinStandardHelpOptions = true, version = "spec-doc-renderer 0.1.0",
        description = "Converts Markdown specification sources into a structured word-processing document model")
public class CliArguments {

    @CommandLine.Parameters(arity = "1..*", paramLabel = "FILE", description = "Markdown files, converted in the order given")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-o", "--output"}, description = "JSON document output path", paramLabel = "PATH")
    private Path output;

    @CommandLine.Option(names = "--diagnostics", description = "Write diagnostics as JSON lines to this path", paramLabel = "PATH")
    private Path diagnostics;

    @CommandLine.Option(names = "--separate-contexts", description = "Convert each file with its own terms and bookmark ids")
    private boolean separateContexts;

    @CommandLine.Option(names = "--strict", description = "Exit with status 1 when any error diagnostic is reported")
    private boolean strict;

    @CommandLine.Option(names = "--max-code-line-length", description = "Longest code block line accepted without a warning", paramLabel = "CHARS")
    private Integer maxCodeLineLength;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public List<Path> inputs() {
        return inputs;
    }

    public Path output() {
        return output;
    }

    public Path diagnostics() {
        return diagnostics;
    }

    public boolean separateContexts() {
        return separateContexts;
    }

    public boolean strict() {
        return strict;
    }

    public Integer maxCodeLineLength() {
        return maxCodeLineLength;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
