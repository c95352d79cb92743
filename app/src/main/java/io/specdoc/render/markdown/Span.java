package io.specdoc.render.markdown;

/**
 * Closed set of inline Markdown nodes.
 */
public sealed interface Span
        permits Literal, Strong, Emphasis, InlineCode, MathSpan, DirectLink, IndirectLink, HardBreak, UnsupportedSpan {

    <R> R accept(Visitor<R> visitor);

    default String kind() {
        return getClass().getSimpleName();
    }

    interface Visitor<R> {

        R visitLiteral(Literal literal);

        R visitStrong(Strong strong);

        R visitEmphasis(Emphasis emphasis);

        R visitInlineCode(InlineCode inlineCode);

        R visitMath(MathSpan math);

        R visitDirectLink(DirectLink link);

        R visitIndirectLink(IndirectLink link);

        R visitHardBreak(HardBreak hardBreak);

        R visitUnsupported(UnsupportedSpan unsupported);
    }
}
