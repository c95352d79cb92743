package io.specdoc.render.writer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specdoc.render.diagnostics.Diagnostic;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes diagnostics as JSON lines, one object per diagnostic, in the order they were reported.
 */
public class DiagnosticsWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public void write(Path target, List<Diagnostic> diagnostics) {
        if (target == null || diagnostics == null) {
            throw new IllegalArgumentException("target and diagnostics must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                for (Diagnostic diagnostic : diagnostics) {
                    writer.write(toJsonLine(diagnostic));
                    writer.newLine();
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write diagnostics: " + target, ex);
        }
    }

    String toJsonLine(Diagnostic diagnostic) throws IOException {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("code", diagnostic.code().name());
        node.put("category", diagnostic.code().category().name());
        node.put("severity", diagnostic.severity().name());
        node.put("file", diagnostic.location().file());
        if (diagnostic.location().line() > 0) {
            node.put("line", diagnostic.location().line());
        }
        if (diagnostic.hasLineOffset()) {
            node.put("lineOffset", diagnostic.lineOffset());
        }
        node.put("message", diagnostic.message());
        return MAPPER.writeValueAsString(node);
    }
}
