package io.specdoc.render.convert;

import io.specdoc.render.colorize.ColorizerRegistry;
import io.specdoc.render.diagnostics.DiagnosticLog;
import io.specdoc.render.diagnostics.DiagnosticSink;
import io.specdoc.render.document.DocBlock;
import io.specdoc.render.document.NumberingDefinitions;
import io.specdoc.render.document.RenderedDocument;
import io.specdoc.render.markdown.SourceFile;
import io.specdoc.render.spec.ItalicUse;
import io.specdoc.render.spec.SectionCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a set of source files in order. With a shared context every file contributes to one document,
 * bookmark ids are unique across files and terms defined in one file are linked from the others. Otherwise
 * each file becomes a document of its own.
 */
public class SpecConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpecConverter.class);

    private final ColorizerRegistry colorizers;
    private final int maxCodeLineLength;
    private final DiagnosticSink downstream;

    public SpecConverter(ColorizerRegistry colorizers, int maxCodeLineLength, DiagnosticSink downstream) {
        this.colorizers = Objects.requireNonNull(colorizers, "colorizers");
        this.maxCodeLineLength = maxCodeLineLength;
        this.downstream = Objects.requireNonNull(downstream, "downstream");
    }

    public ConversionResult convert(List<SourceFile> files, boolean sharedContext) {
        DiagnosticLog diagnostics = new DiagnosticLog(downstream);
        SectionCatalog sections = SectionCatalog.build(files, diagnostics);
        LOGGER.info("Section table holds {} sections from {} files", sections.size(), files.size());
        List<RenderedDocument> documents = new ArrayList<>();
        List<ItalicUse> italicUses = new ArrayList<>();
        if (sharedContext) {
            ConversionContext context = new ConversionContext(sections, diagnostics, maxCodeLineLength);
            documents.add(render(files, context));
            italicUses.addAll(context.italicUses());
        } else {
            for (SourceFile file : files) {
                ConversionContext context = new ConversionContext(sections, diagnostics, maxCodeLineLength);
                documents.add(render(List.of(file), context));
                italicUses.addAll(context.italicUses());
            }
        }
        return new ConversionResult(documents, diagnostics.entries(), italicUses);
    }

    private RenderedDocument render(List<SourceFile> files, ConversionContext context) {
        NumberingDefinitions numbering = new NumberingDefinitions();
        List<DocBlock> blocks = new ArrayList<>();
        for (SourceFile file : files) {
            LOGGER.debug("Converting {}", file.name());
            new TreeWalker(file, context, numbering, colorizers).walk().forEachOrdered(blocks::add);
        }
        List<String> sources = files.stream().map(SourceFile::name).collect(Collectors.toList());
        return new RenderedDocument(sources, blocks, numbering, context.terms(), context.sections().all());
    }
}
