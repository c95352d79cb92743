package io.specdoc.render.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards diagnostics to SLF4J. Section traces go to debug so they do not drown the run log.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

    @Override
    public void report(Diagnostic diagnostic) {
        switch (diagnostic.severity()) {
            case ERROR -> LOGGER.error("{}", diagnostic.format());
            case WARNING -> LOGGER.warn("{}", diagnostic.format());
            case INFO -> LOGGER.debug("{}", diagnostic.format());
        }
    }
}
