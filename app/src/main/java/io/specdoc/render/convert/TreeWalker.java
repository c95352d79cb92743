package io.specdoc.render.convert;

import io.specdoc.render.colorize.CodeLanguage;
import io.specdoc.render.colorize.ColorizedLine;
import io.specdoc.render.colorize.ColorizedWord;
import io.specdoc.render.colorize.ColorizerRegistry;
import io.specdoc.render.diagnostics.DiagnosticCode;
import io.specdoc.render.diagnostics.Reporter;
import io.specdoc.render.document.BookmarkEnd;
import io.specdoc.render.document.BookmarkStart;
import io.specdoc.render.document.Break;
import io.specdoc.render.document.DocBlock;
import io.specdoc.render.document.Inline;
import io.specdoc.render.document.NumberingDefinitions;
import io.specdoc.render.document.NumberingReference;
import io.specdoc.render.document.Paragraph;
import io.specdoc.render.document.ParagraphProperties;
import io.specdoc.render.document.Run;
import io.specdoc.render.document.RunProperties;
import io.specdoc.render.document.StyleIds;
import io.specdoc.render.document.Table;
import io.specdoc.render.markdown.Block;
import io.specdoc.render.markdown.CodeBlock;
import io.specdoc.render.markdown.Heading;
import io.specdoc.render.markdown.InlineHtmlBlock;
import io.specdoc.render.markdown.ListBlock;
import io.specdoc.render.markdown.Literal;
import io.specdoc.render.markdown.QuotedBlock;
import io.specdoc.render.markdown.SourceFile;
import io.specdoc.render.markdown.Span;
import io.specdoc.render.markdown.SpanBlock;
import io.specdoc.render.markdown.TableBlock;
import io.specdoc.render.markdown.UnsupportedBlock;
import io.specdoc.render.spec.SectionRef;
import io.specdoc.render.spec.SectionRefFactory;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Converts the blocks of one source file into output blocks. Problems are reported as diagnostics and replaced
 * by a substitute; conversion itself never fails.
 */
public class TreeWalker implements BlockConverter {

    static final int QUOTE_INDENTATION = 540;

    private final SourceFile file;
    private final ConversionContext context;
    private final NumberingDefinitions numbering;
    private final ColorizerRegistry colorizers;
    private final Reporter reporter;
    private final SpanRenderer spans;
    private final TableBuilder tables;
    private final CustomBlockGenerator customBlocks;
    private final ListFlattener flattener;
    private final NumberingSchemeBuilder schemes;

    public TreeWalker(SourceFile file, ConversionContext context, NumberingDefinitions numbering,
            ColorizerRegistry colorizers) {
        this.file = Objects.requireNonNull(file, "file");
        this.context = Objects.requireNonNull(context, "context");
        this.numbering = Objects.requireNonNull(numbering, "numbering");
        this.colorizers = Objects.requireNonNull(colorizers, "colorizers");
        this.reporter = new Reporter(file.name(), context.diagnostics());
        this.spans = new SpanRenderer(context, reporter, file.document().definedLinks());
        this.tables = new TableBuilder(reporter, this);
        this.customBlocks = new CustomBlockGenerator(reporter);
        this.flattener = new ListFlattener(reporter);
        this.schemes = new NumberingSchemeBuilder(numbering);
    }

    /**
     * Lazily converts the top-level blocks in order. The stream is meant to be consumed once.
     */
    public Stream<DocBlock> walk() {
        return file.document().blocks().stream().flatMap(block -> convert(block).stream());
    }

    @Override
    public List<DocBlock> convert(Block block) {
        reporter.enter(block.range());
        return block.accept(new Conversion());
    }

    private final class Conversion implements Block.Visitor<List<DocBlock>> {

        @Override
        public List<DocBlock> visitHeading(Heading heading) {
            SectionRef computed = SectionRefFactory.create(heading, file.name());
            SectionRef section = context.sections().find(computed.url()).orElseGet(() -> {
                reporter.error(DiagnosticCode.MDC034, "Heading '" + computed.title() + "' has no entry in the section table");
                return computed;
            });
            ParagraphProperties properties = new ParagraphProperties().styleId(StyleIds.heading(heading.level()));
            if (section.number().isEmpty()) {
                properties.numbering(NumberingReference.EXEMPT);
            }
            int bookmarkId = context.nextBookmarkId();
            List<Inline> content = new ArrayList<>();
            content.add(new BookmarkStart(section.bookmarkName(), bookmarkId));
            content.addAll(spans.render(List.of(new Literal(section.titleWithoutNumber()))));
            content.add(new BookmarkEnd(bookmarkId));
            reporter.info(DiagnosticCode.MDC999, section.file() + " " + "#".repeat(heading.level()) + " "
                    + section.title() + " [" + section.number().orElse("") + "]");
            return List.of(new Paragraph(properties, content));
        }

        @Override
        public List<DocBlock> visitParagraph(io.specdoc.render.markdown.Paragraph paragraph) {
            return List.of(new Paragraph(spans.render(paragraph.body())));
        }

        @Override
        public List<DocBlock> visitSpanBlock(SpanBlock spanBlock) {
            return List.of(new Paragraph(spans.render(spanBlock.body())));
        }

        @Override
        public List<DocBlock> visitQuotedBlock(QuotedBlock quotedBlock) {
            List<DocBlock> blocks = new ArrayList<>();
            Set<Integer> shiftedInstances = new HashSet<>();
            for (Block child : quotedBlock.children()) {
                for (DocBlock element : convert(child)) {
                    if (element instanceof Paragraph paragraph) {
                        ParagraphProperties properties = paragraph.ensureProperties();
                        Optional<NumberingReference> reference = properties.numbering().filter(ref -> !ref.isExempt());
                        if (reference.isPresent()) {
                            int instanceId = reference.get().numberingId();
                            if (shiftedInstances.add(instanceId)) {
                                numbering.shiftIndentation(instanceId, QUOTE_INDENTATION);
                            }
                        } else {
                            properties.leftIndentation(properties.leftIndentation().orElse(0) + QUOTE_INDENTATION);
                        }
                        blocks.add(paragraph);
                    } else if (element instanceof Table table) {
                        table.properties().indentation(table.properties().indentation() + QUOTE_INDENTATION);
                        blocks.add(table);
                    }
                }
            }
            return blocks;
        }

        @Override
        public List<DocBlock> visitListBlock(ListBlock listBlock) {
            List<FlatItem> items = flattener.flatten(listBlock);
            int instanceId = schemes.register(items);
            List<DocBlock> blocks = new ArrayList<>();
            for (FlatItem item : items) {
                reporter.enter(item.content().range());
                blocks.addAll(listItem(item, instanceId));
            }
            return blocks;
        }

        @Override
        public List<DocBlock> visitCodeBlock(CodeBlock codeBlock) {
            String code = TextNormalizer.normalize(codeBlock.code());
            CodeLanguage language = CodeLanguage.fromTag(codeBlock.language()).orElseGet(() -> {
                reporter.error(DiagnosticCode.MDC009, "Unrecognized language " + codeBlock.language());
                return CodeLanguage.PLAIN;
            });
            List<ColorizedLine> lines = colorizers.forLanguage(language).colorize(code);
            List<Inline> content = new ArrayList<>();
            for (int offset = 0; offset < lines.size(); offset++) {
                ColorizedLine line = lines.get(offset);
                if (line.visibleLength() > context.maxCodeLineLength()) {
                    reporter.warning(DiagnosticCode.MDC032, "Line length " + line.visibleLength() + " > maximum "
                            + context.maxCodeLineLength(), offset);
                }
                if (offset > 0) {
                    content.add(Break.INSTANCE);
                }
                for (ColorizedWord word : line.words()) {
                    RunProperties properties = RunProperties.PLAIN;
                    if (word.hasColor()) {
                        properties = properties.withColor(word.hexColor());
                    }
                    if (word.italic()) {
                        properties = properties.withItalic();
                    }
                    content.add(new Run(word.text(), properties));
                }
            }
            return List.of(new Paragraph(new ParagraphProperties().styleId(StyleIds.CODE), content));
        }

        @Override
        public List<DocBlock> visitTableBlock(TableBlock tableBlock) {
            return tables.build(tableBlock);
        }

        @Override
        public List<DocBlock> visitInlineHtmlBlock(InlineHtmlBlock inlineHtmlBlock) {
            Optional<String> customBlockId = CustomBlock.markerId(inlineHtmlBlock.code());
            if (customBlockId.isPresent()) {
                return customBlocks.generate(customBlockId.get(), inlineHtmlBlock);
            }
            if (inlineHtmlBlock.code().startsWith("<!--")) {
                return List.of();
            }
            return unrecognized(inlineHtmlBlock);
        }

        @Override
        public List<DocBlock> visitUnsupported(UnsupportedBlock unsupportedBlock) {
            return unrecognized(unsupportedBlock);
        }

        private List<DocBlock> unrecognized(Block block) {
            reporter.error(DiagnosticCode.MDC011, "Unrecognized markdown element " + block.kind());
            return List.of(Paragraph.of(Run.plain("[" + block.kind() + "]")));
        }
    }

    private List<DocBlock> listItem(FlatItem item, int instanceId) {
        Block content = item.content();
        int indentation = NumberingSchemeBuilder.indentation(item.level());
        List<Span> text = listText(content);
        if (text != null) {
            ParagraphProperties properties = new ParagraphProperties();
            if (item.hasBullet()) {
                properties.styleId(StyleIds.LIST_PARAGRAPH)
                        .numbering(new NumberingReference(NumberingSchemeBuilder.effectiveLevel(item.level()), instanceId));
            } else {
                properties.leftIndentation(indentation);
            }
            return List.of(new Paragraph(properties, spans.renderInList(text)));
        }
        if (content instanceof QuotedBlock || content instanceof CodeBlock || content instanceof TableBlock
                || content instanceof InlineHtmlBlock) {
            List<DocBlock> blocks = convert(content);
            for (DocBlock element : blocks) {
                if (element instanceof Paragraph paragraph) {
                    paragraph.ensureProperties().leftIndentation(indentation);
                } else if (element instanceof Table table) {
                    table.properties().indentation(indentation);
                }
            }
            return blocks;
        }
        reporter.error(DiagnosticCode.MDC008, "Unexpected item in list: " + content.kind());
        return List.of();
    }

    private static List<Span> listText(Block block) {
        if (block instanceof io.specdoc.render.markdown.Paragraph paragraph) {
            return paragraph.body();
        }
        if (block instanceof SpanBlock spanBlock) {
            return spanBlock.body();
        }
        return null;
    }
}
