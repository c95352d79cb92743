package io.specdoc.render.config;

import io.specdoc.render.cli.CliArguments;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_OUTPUT = "SPEC_OUTPUT";
    static final String ENV_DIAGNOSTICS = "SPEC_DIAGNOSTICS";
    static final String ENV_SHARED_CONTEXT = "SPEC_SHARED_CONTEXT";
    static final String ENV_STRICT = "SPEC_STRICT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_MAX_CODE_LINE_LENGTH = "SPEC_MAX_CODE_LINE_LENGTH";

    private static final String DEFAULT_OUTPUT = "spec-document.json";
    private static final int DEFAULT_MAX_CODE_LINE_LENGTH = 81;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        List<Path> inputs = arguments.inputs();
        Path output = resolvePath(arguments.output(), ENV_OUTPUT).orElse(Path.of(DEFAULT_OUTPUT));
        Optional<Path> diagnostics = resolvePath(arguments.diagnostics(), ENV_DIAGNOSTICS);
        boolean sharedContext = !arguments.separateContexts() && resolveFlag(ENV_SHARED_CONTEXT, true);
        boolean strict = arguments.strict() || resolveFlag(ENV_STRICT, false);
        LogFormat logFormat = resolveLogFormat(arguments);
        int maxCodeLineLength = resolveMaxCodeLineLength(arguments);
        return new Config(inputs, output, diagnostics, sharedContext, strict, logFormat, maxCodeLineLength);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(Path::of);
    }

    private boolean resolveFlag(String envKey, boolean defaultValue) {
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> parseBoolean(envKey, value))
                .orElse(defaultValue);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveMaxCodeLineLength(CliArguments arguments) {
        Integer cliValue = arguments.maxCodeLineLength();
        if (cliValue != null) {
            if (cliValue <= 0) {
                throw new IllegalArgumentException("--max-code-line-length must be greater than zero");
            }
            return cliValue;
        }
        return environmentReader.get(ENV_MAX_CODE_LINE_LENGTH)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parsePositiveInteger)
                .orElse(DEFAULT_MAX_CODE_LINE_LENGTH);
    }

    private static boolean parseBoolean(String envKey, String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "true", "1", "yes" -> {
                return true;
            }
            case "false", "0", "no" -> {
                return false;
            }
            default -> throw new IllegalArgumentException(envKey + " must be true or false, was '" + raw + "'");
        }
    }

    private static int parsePositiveInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value <= 0) {
                throw new IllegalArgumentException(ENV_MAX_CODE_LINE_LENGTH + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_MAX_CODE_LINE_LENGTH + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
