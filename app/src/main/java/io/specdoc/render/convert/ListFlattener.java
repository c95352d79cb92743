package io.specdoc.render.convert;

import io.specdoc.render.diagnostics.DiagnosticCode;
import io.specdoc.render.diagnostics.Reporter;
import io.specdoc.render.markdown.Block;
import io.specdoc.render.markdown.CodeBlock;
import io.specdoc.render.markdown.Heading;
import io.specdoc.render.markdown.InlineCode;
import io.specdoc.render.markdown.InlineHtmlBlock;
import io.specdoc.render.markdown.ListBlock;
import io.specdoc.render.markdown.Literal;
import io.specdoc.render.markdown.Paragraph;
import io.specdoc.render.markdown.QuotedBlock;
import io.specdoc.render.markdown.Span;
import io.specdoc.render.markdown.SpanBlock;
import io.specdoc.render.markdown.TableBlock;
import io.specdoc.render.markdown.UnsupportedBlock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flattens a nested Markdown list depth first into leveled items and validates the result.
 */
public class ListFlattener {

    static final String INDENT_RESET_MARKER = "ceci-n'est-pas-une-indent";
    static final int MAX_LEVEL = 3;

    private static final String CODE_LANGUAGE = "csharp";

    private final Reporter reporter;

    public ListFlattener(Reporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public List<FlatItem> flatten(ListBlock list) {
        List<FlatItem> items = new ArrayList<>();
        flatten(splitCodeBlocks(list), 0, items);
        validate(items);
        return items;
    }

    private void flatten(ListBlock list, int level, List<FlatItem> items) {
        for (ListBlock.Item item : list.items()) {
            boolean first = true;
            for (Block block : item.blocks()) {
                reporter.enter(block.range());
                block.accept(new ItemCollector(level, list.ordered(), first, items));
                first = false;
            }
        }
    }

    private void validate(List<FlatItem> items) {
        Map<Integer, Boolean> referenceStyles = new HashMap<>();
        for (FlatItem item : items) {
            if (!item.hasBullet()) {
                continue;
            }
            Boolean reference = referenceStyles.putIfAbsent(item.level(), item.ordered());
            if (reference != null && reference != item.ordered()) {
                reporter.error(DiagnosticCode.MDC012, "List can't mix ordered and unordered items at level "
                        + item.level());
            }
            if (item.level() > MAX_LEVEL) {
                reporter.error(DiagnosticCode.MDC013, "Can't have more than " + (MAX_LEVEL + 1)
                        + " levels in a list, item is at level " + item.level());
            }
        }
    }

    /**
     * Inline code starting with {@code csharp} and a newline stands for a code block inside a list item, which the
     * upstream tooling cannot express. Split such paragraphs around a real code block.
     */
    static ListBlock splitCodeBlocks(ListBlock list) {
        List<ListBlock.Item> items = new ArrayList<>();
        for (ListBlock.Item item : list.items()) {
            List<Block> blocks = new ArrayList<>();
            for (Block block : item.blocks()) {
                if (block instanceof ListBlock nested) {
                    blocks.add(splitCodeBlocks(nested));
                } else if (block instanceof Paragraph paragraph) {
                    splitSpans(paragraph.body(), block, false, blocks);
                } else if (block instanceof SpanBlock spanBlock) {
                    splitSpans(spanBlock.body(), block, true, blocks);
                } else {
                    blocks.add(block);
                }
            }
            items.add(new ListBlock.Item(blocks));
        }
        return new ListBlock(list.ordered(), items, list.range());
    }

    private static void splitSpans(List<Span> body, Block source, boolean tight, List<Block> out) {
        List<Span> pending = new ArrayList<>();
        boolean split = false;
        for (Span span : body) {
            String code = span instanceof InlineCode inlineCode ? codeBlockText(inlineCode.code()) : null;
            if (code == null) {
                pending.add(span);
                continue;
            }
            split = true;
            if (!pending.isEmpty()) {
                out.add(textBlock(pending, source, tight));
                pending = new ArrayList<>();
            }
            out.add(new CodeBlock(CODE_LANGUAGE, code, source.range()));
        }
        if (!split) {
            out.add(source);
        } else if (!pending.isEmpty()) {
            out.add(textBlock(pending, source, tight));
        }
    }

    private static String codeBlockText(String code) {
        for (String newline : List.of("\r\n", "\n")) {
            if (code.startsWith(CODE_LANGUAGE + newline)) {
                return code.substring(CODE_LANGUAGE.length() + newline.length());
            }
        }
        return null;
    }

    private static Block textBlock(List<Span> spans, Block source, boolean tight) {
        return tight ? new SpanBlock(spans, source.range()) : new Paragraph(spans, source.range());
    }

    private final class ItemCollector implements Block.Visitor<Void> {

        private final int level;
        private final boolean ordered;
        private final boolean first;
        private final List<FlatItem> items;

        private ItemCollector(int level, boolean ordered, boolean first, List<FlatItem> items) {
            this.level = level;
            this.ordered = ordered;
            this.first = first;
            this.items = items;
        }

        @Override
        public Void visitParagraph(Paragraph paragraph) {
            List<Span> body = paragraph.body();
            if (startsWithIndentReset(body)) {
                items.add(new FlatItem(0, first, ordered, first, new Paragraph(withoutIndentReset(body), paragraph.range())));
            } else {
                items.add(new FlatItem(level, first, ordered, first, paragraph));
            }
            return null;
        }

        @Override
        public Void visitSpanBlock(SpanBlock spanBlock) {
            List<Span> body = spanBlock.body();
            if (startsWithIndentReset(body)) {
                items.add(new FlatItem(0, first, ordered, first, new SpanBlock(withoutIndentReset(body), spanBlock.range())));
            } else {
                items.add(new FlatItem(level, first, ordered, first, spanBlock));
            }
            return null;
        }

        @Override
        public Void visitQuotedBlock(QuotedBlock quotedBlock) {
            return continuation(quotedBlock);
        }

        @Override
        public Void visitCodeBlock(CodeBlock codeBlock) {
            return continuation(codeBlock);
        }

        @Override
        public Void visitTableBlock(TableBlock tableBlock) {
            return continuation(tableBlock);
        }

        @Override
        public Void visitInlineHtmlBlock(InlineHtmlBlock inlineHtmlBlock) {
            if (CustomBlock.markerId(inlineHtmlBlock.code()).isPresent()) {
                return continuation(inlineHtmlBlock);
            }
            return unexpected(inlineHtmlBlock);
        }

        @Override
        public Void visitListBlock(ListBlock listBlock) {
            flatten(listBlock, level + 1, items);
            return null;
        }

        @Override
        public Void visitHeading(Heading heading) {
            return unexpected(heading);
        }

        @Override
        public Void visitUnsupported(UnsupportedBlock unsupportedBlock) {
            return unexpected(unsupportedBlock);
        }

        private Void continuation(Block block) {
            items.add(new FlatItem(level, false, ordered, first, block));
            return null;
        }

        private Void unexpected(Block block) {
            reporter.error(DiagnosticCode.MDC014, "Unexpected item in list: " + block.kind());
            return null;
        }
    }

    private static boolean startsWithIndentReset(List<Span> body) {
        return !body.isEmpty() && body.get(0) instanceof Literal literal && literal.text().startsWith(INDENT_RESET_MARKER);
    }

    private static List<Span> withoutIndentReset(List<Span> body) {
        List<Span> spans = new ArrayList<>(body);
        Literal literal = (Literal) spans.get(0);
        spans.set(0, new Literal(literal.text().substring(INDENT_RESET_MARKER.length())));
        return spans;
    }
}
