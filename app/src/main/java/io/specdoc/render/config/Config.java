package io.specdoc.render.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        List<Path> inputs,
        Path output,
        Optional<Path> diagnosticsOutput,
        boolean sharedContext,
        boolean strict,
        LogFormat logFormat,
        int maxCodeLineLength
) {

    public Config {
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("at least one markdown input file must be provided");
        }
        Objects.requireNonNull(output, "output");
        diagnosticsOutput = diagnosticsOutput == null ? Optional.empty() : diagnosticsOutput;
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        if (maxCodeLineLength <= 0) {
            throw new IllegalArgumentException("maxCodeLineLength must be greater than zero");
        }
        if (diagnosticsOutput.filter(output::equals).isPresent()) {
            throw new IllegalArgumentException("diagnostics output must differ from the document output");
        }
    }
}
