package io.specdoc.render.markdown;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.commonmark.ext.gfm.tables.TableBody;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableHead;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.LinkReferenceDefinition;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

/**
 * Parses Markdown source with CommonMark (GFM tables enabled) and maps the result onto the closed node model.
 */
public class CommonMarkReader {

    private static final Pattern CUSTOM_BLOCK_MARKER = Pattern.compile("^<!-- Custom Word conversion: [a-z0-9_]+ -->\\s*$");

    private final Parser parser;

    public CommonMarkReader() {
        this.parser = Parser.builder()
                .extensions(List.of(TablesExtension.create()))
                .includeSourceSpans(IncludeSourceSpans.BLOCKS)
                .build();
    }

    public MarkdownDocument read(String source) {
        String text = source.startsWith("\uFEFF") ? source.substring(1) : source;
        Node document = parser.parse(text);
        Map<String, LinkDefinition> definedLinks = new LinkedHashMap<>();
        List<Block> blocks = readBlocks(document, false, definedLinks);
        return new MarkdownDocument(blocks, definedLinks);
    }

    /**
     * Reads a UTF-8 file; the resulting source is named after the file, which is what section urls refer to.
     */
    public SourceFile readFile(Path path) {
        try {
            return new SourceFile(path.getFileName().toString(), read(Files.readString(path, StandardCharsets.UTF_8)));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read markdown source: " + path, ex);
        }
    }

    private List<Block> readBlocks(Node parent, boolean tight, Map<String, LinkDefinition> definedLinks) {
        List<Block> blocks = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNext()) {
            if (node instanceof LinkReferenceDefinition definition) {
                definedLinks.putIfAbsent(definition.getLabel().toLowerCase(Locale.ROOT),
                        new LinkDefinition(definition.getDestination(), Optional.ofNullable(definition.getTitle())));
                continue;
            }
            if (node instanceof HtmlBlock html && isCustomBlockMarker(html) && node.getNext() instanceof HtmlBlock markup) {
                // The marker comment and the markup it introduces arrive as two HTML blocks.
                blocks.add(new InlineHtmlBlock(html.getLiteral() + "\n" + markup.getLiteral(), rangeOf(html)));
                node = markup;
                continue;
            }
            blocks.add(readBlock(node, tight, definedLinks));
        }
        return blocks;
    }

    private Block readBlock(Node node, boolean tight, Map<String, LinkDefinition> definedLinks) {
        SourceRange range = rangeOf(node);
        if (node instanceof org.commonmark.node.Heading heading) {
            return new Heading(heading.getLevel(), readSpans(heading), range);
        }
        if (node instanceof org.commonmark.node.Paragraph) {
            List<Span> spans = readSpans(node);
            return tight ? new SpanBlock(spans, range) : new Paragraph(spans, range);
        }
        if (node instanceof BlockQuote) {
            return new QuotedBlock(readBlocks(node, false, definedLinks), range);
        }
        if (node instanceof BulletList bulletList) {
            return readList(bulletList, false, bulletList.isTight(), range, definedLinks);
        }
        if (node instanceof OrderedList orderedList) {
            return readList(orderedList, true, orderedList.isTight(), range, definedLinks);
        }
        if (node instanceof FencedCodeBlock fenced) {
            return new CodeBlock(firstWord(fenced.getInfo()), stripTrailingNewline(fenced.getLiteral()), range);
        }
        if (node instanceof IndentedCodeBlock indented) {
            return new CodeBlock("", stripTrailingNewline(indented.getLiteral()), range);
        }
        if (node instanceof org.commonmark.ext.gfm.tables.TableBlock) {
            return readTable(node, range);
        }
        if (node instanceof HtmlBlock html) {
            return new InlineHtmlBlock(html.getLiteral(), range);
        }
        return new UnsupportedBlock(node.getClass().getSimpleName(), range);
    }

    private ListBlock readList(Node list, boolean ordered, boolean tight, SourceRange range,
                               Map<String, LinkDefinition> definedLinks) {
        List<ListBlock.Item> items = new ArrayList<>();
        for (Node child = list.getFirstChild(); child != null; child = child.getNext()) {
            if (child instanceof ListItem) {
                items.add(new ListBlock.Item(readBlocks(child, tight, definedLinks)));
            }
        }
        return new ListBlock(ordered, items, range);
    }

    private TableBlock readTable(Node table, SourceRange range) {
        Optional<TableBlock.Row> header = Optional.empty();
        List<TableBlock.Alignment> alignments = new ArrayList<>();
        List<TableBlock.Row> rows = new ArrayList<>();
        for (Node section = table.getFirstChild(); section != null; section = section.getNext()) {
            for (Node row = section.getFirstChild(); row != null; row = row.getNext()) {
                if (!(row instanceof TableRow)) {
                    continue;
                }
                if (section instanceof TableHead) {
                    header = Optional.of(readRow(row, alignments));
                } else if (section instanceof TableBody) {
                    rows.add(readRow(row, null));
                }
            }
        }
        return new TableBlock(header, alignments, rows, range);
    }

    private TableBlock.Row readRow(Node row, List<TableBlock.Alignment> alignmentsOut) {
        List<TableBlock.Cell> cells = new ArrayList<>();
        for (Node child = row.getFirstChild(); child != null; child = child.getNext()) {
            if (!(child instanceof TableCell cell)) {
                continue;
            }
            if (alignmentsOut != null) {
                alignmentsOut.add(toAlignment(cell.getAlignment()));
            }
            List<Span> spans = readSpans(cell);
            cells.add(spans.isEmpty() ? TableBlock.Cell.empty() : TableBlock.Cell.of(new Paragraph(spans)));
        }
        return new TableBlock.Row(cells);
    }

    private List<Span> readSpans(Node parent) {
        List<Span> spans = new ArrayList<>();
        StringBuilder pendingText = new StringBuilder();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNext()) {
            String text = literalText(node);
            if (text != null) {
                pendingText.append(text);
                continue;
            }
            if (pendingText.length() > 0) {
                spans.add(new Literal(pendingText.toString()));
                pendingText.setLength(0);
            }
            spans.add(readSpan(node));
        }
        if (pendingText.length() > 0) {
            spans.add(new Literal(pendingText.toString()));
        }
        return spans;
    }

    private String literalText(Node node) {
        if (node instanceof Text text) {
            return text.getLiteral();
        }
        if (node instanceof SoftLineBreak) {
            return "\n";
        }
        if (node instanceof HtmlInline html) {
            return html.getLiteral();
        }
        return null;
    }

    private Span readSpan(Node node) {
        if (node instanceof StrongEmphasis) {
            return new Strong(readSpans(node));
        }
        if (node instanceof org.commonmark.node.Emphasis) {
            return new Emphasis(readSpans(node));
        }
        if (node instanceof Code code) {
            return new InlineCode(code.getLiteral());
        }
        if (node instanceof Link link) {
            return new DirectLink(readSpans(link), link.getDestination(), Optional.ofNullable(link.getTitle()));
        }
        if (node instanceof HardLineBreak) {
            return new HardBreak();
        }
        return new UnsupportedSpan(node.getClass().getSimpleName());
    }

    private static boolean isCustomBlockMarker(HtmlBlock html) {
        return CUSTOM_BLOCK_MARKER.matcher(html.getLiteral()).matches();
    }

    private static TableBlock.Alignment toAlignment(TableCell.Alignment alignment) {
        if (alignment == null) {
            return TableBlock.Alignment.DEFAULT;
        }
        return switch (alignment) {
            case LEFT -> TableBlock.Alignment.LEFT;
            case CENTER -> TableBlock.Alignment.CENTER;
            case RIGHT -> TableBlock.Alignment.RIGHT;
        };
    }

    private static SourceRange rangeOf(Node node) {
        List<SourceSpan> spans = node.getSourceSpans();
        if (spans == null || spans.isEmpty()) {
            return SourceRange.UNKNOWN;
        }
        return new SourceRange(spans.get(0).getLineIndex() + 1);
    }

    private static String firstWord(String info) {
        if (info == null) {
            return "";
        }
        String trimmed = info.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    private static String stripTrailingNewline(String literal) {
        if (literal.endsWith("\n")) {
            return literal.substring(0, literal.length() - 1);
        }
        return literal;
    }
}
