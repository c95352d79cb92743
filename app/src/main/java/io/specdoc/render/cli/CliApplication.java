package io.specdoc.render.cli;

import io.specdoc.render.colorize.ColorizerRegistry;
import io.specdoc.render.config.Config;
import io.specdoc.render.config.ConfigLoader;
import io.specdoc.render.config.SystemEnvironmentReader;
import io.specdoc.render.convert.ConversionResult;
import io.specdoc.render.convert.SpecConverter;
import io.specdoc.render.diagnostics.LoggingDiagnosticSink;
import io.specdoc.render.diagnostics.Severity;
import io.specdoc.render.logging.LoggingConfigurator;
import io.specdoc.render.markdown.CommonMarkReader;
import io.specdoc.render.markdown.SourceFile;
import io.specdoc.render.writer.DiagnosticsWriter;
import io.specdoc.render.writer.DocumentWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and conversion pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_ERRORS_REPORTED = 1;

    private final ConfigLoader configLoader;
    private final CommonMarkReader reader;
    private final DocumentWriter documentWriter;
    private final DiagnosticsWriter diagnosticsWriter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new CommonMarkReader(), new DocumentWriter(),
                new DiagnosticsWriter());
    }

    CliApplication(ConfigLoader configLoader, CommonMarkReader reader, DocumentWriter documentWriter,
            DiagnosticsWriter diagnosticsWriter) {
        this.configLoader = configLoader;
        this.reader = reader;
        this.documentWriter = documentWriter;
        this.diagnosticsWriter = diagnosticsWriter;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config = configLoader.load(cliArguments);
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Converting {} files (sharedContext={}, strict={})",
                config.inputs().size(), config.sharedContext(), config.strict());

        List<SourceFile> sources = new ArrayList<>();
        for (Path input : config.inputs()) {
            sources.add(reader.readFile(input));
        }
        SpecConverter converter = new SpecConverter(ColorizerRegistry.standard(), config.maxCodeLineLength(),
                new LoggingDiagnosticSink());
        ConversionResult result = converter.convert(sources, config.sharedContext());

        documentWriter.write(config.output(), result.documents());
        LOGGER.info("Wrote {} blocks to {}", result.blockCount(), config.output());
        config.diagnosticsOutput().ifPresent(path -> {
            diagnosticsWriter.write(path, result.diagnostics());
            LOGGER.info("Wrote {} diagnostics to {}", result.diagnostics().size(), path);
        });
        LOGGER.info("Conversion finished with {} errors and {} warnings",
                result.count(Severity.ERROR), result.count(Severity.WARNING));

        if (config.strict() && result.hasErrors()) {
            LOGGER.warn("Strict mode: failing because errors were reported");
            return EXIT_ERRORS_REPORTED;
        }
        return 0;
    }
}
