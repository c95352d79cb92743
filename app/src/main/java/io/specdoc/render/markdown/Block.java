package io.specdoc.render.markdown;

/**
 * Closed set of block-level Markdown nodes handed to the converter.
 *
 * <p>Consumers dispatch through {@link Visitor}, so adding a node kind forces every converter to handle it.
 */
public sealed interface Block
        permits Heading, Paragraph, SpanBlock, QuotedBlock, ListBlock, CodeBlock, TableBlock, InlineHtmlBlock,
        UnsupportedBlock {

    SourceRange range();

    <R> R accept(Visitor<R> visitor);

    default String kind() {
        return getClass().getSimpleName();
    }

    interface Visitor<R> {

        R visitHeading(Heading heading);

        R visitParagraph(Paragraph paragraph);

        R visitSpanBlock(SpanBlock spanBlock);

        R visitQuotedBlock(QuotedBlock quotedBlock);

        R visitListBlock(ListBlock listBlock);

        R visitCodeBlock(CodeBlock codeBlock);

        R visitTableBlock(TableBlock tableBlock);

        R visitInlineHtmlBlock(InlineHtmlBlock inlineHtmlBlock);

        R visitUnsupported(UnsupportedBlock unsupportedBlock);
    }
}
