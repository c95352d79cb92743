package io.specdoc.render.convert;

import io.specdoc.render.diagnostics.Diagnostic;
import io.specdoc.render.diagnostics.Severity;
import io.specdoc.render.document.RenderedDocument;
import io.specdoc.render.spec.ItalicUse;
import java.util.List;
import java.util.Objects;

/**
 * Output of a batch conversion: one document per conversion context, plus everything that was reported.
 */
public record ConversionResult(List<RenderedDocument> documents, List<Diagnostic> diagnostics, List<ItalicUse> italicUses) {

    public ConversionResult {
        documents = List.copyOf(Objects.requireNonNull(documents, "documents"));
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
        italicUses = List.copyOf(Objects.requireNonNull(italicUses, "italicUses"));
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(diagnostic -> diagnostic.severity() == severity).count();
    }

    public boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }

    public int blockCount() {
        return documents.stream().mapToInt(document -> document.blocks().size()).sum();
    }
}
