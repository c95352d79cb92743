package io.specdoc.render.writer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import io.specdoc.render.document.RenderedDocument;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes rendered documents as pretty-printed JSON, the hand-off format for document assembly.
 */
public class DocumentWriter {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .setSerializationInclusion(JsonInclude.Include.NON_EMPTY);

    public void write(Path target, List<RenderedDocument> documents) {
        if (target == null || documents == null) {
            throw new IllegalArgumentException("target and documents must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(target.toFile(), documents);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write rendered document: " + target, ex);
        }
    }

    public String toJson(RenderedDocument document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to serialize rendered document", ex);
        }
    }
}
