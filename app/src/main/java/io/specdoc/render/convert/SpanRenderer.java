package io.specdoc.render.convert;

import io.specdoc.render.diagnostics.DiagnosticCode;
import io.specdoc.render.diagnostics.Location;
import io.specdoc.render.diagnostics.Reporter;
import io.specdoc.render.document.BookmarkEnd;
import io.specdoc.render.document.BookmarkStart;
import io.specdoc.render.document.Break;
import io.specdoc.render.document.Hyperlink;
import io.specdoc.render.document.Inline;
import io.specdoc.render.document.Run;
import io.specdoc.render.document.RunProperties;
import io.specdoc.render.document.StyleIds;
import io.specdoc.render.markdown.DirectLink;
import io.specdoc.render.markdown.Emphasis;
import io.specdoc.render.markdown.HardBreak;
import io.specdoc.render.markdown.IndirectLink;
import io.specdoc.render.markdown.InlineCode;
import io.specdoc.render.markdown.LinkDefinition;
import io.specdoc.render.markdown.Literal;
import io.specdoc.render.markdown.MathSpan;
import io.specdoc.render.markdown.Span;
import io.specdoc.render.markdown.Strong;
import io.specdoc.render.markdown.UnsupportedSpan;
import io.specdoc.render.spec.ItalicUse;
import io.specdoc.render.spec.SectionRef;
import io.specdoc.render.spec.TermRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Converts inline Markdown spans to output runs.
 *
 * <p>Spans inside a Strong or Emphasis are rendered in nested mode: no term indexing, no term definitions and
 * no italic bookkeeping, so the enclosing style can simply be layered onto every run they produce.</p>
 */
public class SpanRenderer {

    private static final Set<String> LIST_END_MARKERS = Set.of("end note", "end example");
    private static final String QUOTE_MARKER = "> ";

    private final ConversionContext context;
    private final Reporter reporter;
    private final Map<String, LinkDefinition> definedLinks;
    private final TermIndexer termIndexer;

    public SpanRenderer(ConversionContext context, Reporter reporter, Map<String, LinkDefinition> definedLinks) {
        this.context = Objects.requireNonNull(context, "context");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.definedLinks = Objects.requireNonNull(definedLinks, "definedLinks");
        this.termIndexer = new TermIndexer(context, reporter);
    }

    public List<Inline> render(List<Span> spans) {
        return render(spans, false, false);
    }

    /**
     * Renders the text of a list paragraph, where quote markers and end-of-note emphasis become line breaks.
     */
    public List<Inline> renderInList(List<Span> spans) {
        return render(spans, false, true);
    }

    List<Inline> render(List<Span> spans, boolean nested, boolean inList) {
        List<Inline> inlines = new ArrayList<>();
        Conversion conversion = new Conversion(nested, inList);
        for (Span span : spans) {
            inlines.addAll(span.accept(conversion));
        }
        if (!inlines.isEmpty() && inlines.get(inlines.size() - 1) instanceof Break) {
            inlines.remove(inlines.size() - 1);
        }
        return inlines;
    }

    private final class Conversion implements Span.Visitor<List<Inline>> {

        private final boolean nested;
        private final boolean inList;

        private Conversion(boolean nested, boolean inList) {
            this.nested = nested;
            this.inList = inList;
        }

        @Override
        public List<Inline> visitLiteral(Literal literal) {
            String text = literal.text();
            if (text.startsWith("\n<!--") || text.startsWith("\r\n<!--")) {
                return List.of();
            }
            if (inList) {
                if (text.equals(QUOTE_MARKER)) {
                    return List.of(Break.INSTANCE);
                }
                if (text.endsWith("\n" + QUOTE_MARKER)) {
                    int cut = text.endsWith("\r\n" + QUOTE_MARKER) ? text.length() - 4 : text.length() - 3;
                    return List.of(Run.plain(text.substring(0, cut)), Break.INSTANCE);
                }
            }
            if (nested) {
                return List.of(Run.plain(text));
            }
            return termIndexer.index(text);
        }

        @Override
        public List<Inline> visitStrong(Strong strong) {
            Optional<String> term = termDefinition(strong.body(), Emphasis.class);
            if (!nested && term.isPresent()) {
                return defineTerm(term.get());
            }
            return styled(strong.body(), Run::withBold);
        }

        @Override
        public List<Inline> visitEmphasis(Emphasis emphasis) {
            if (inList && isListEndMarker(emphasis)) {
                List<Inline> inlines = new ArrayList<>(new Conversion(nested, false).visitEmphasis(emphasis));
                inlines.add(Break.INSTANCE);
                return inlines;
            }
            if (!nested) {
                Optional<String> term = termDefinition(emphasis.body(), Strong.class);
                if (term.isPresent()) {
                    return defineTerm(term.get());
                }
                if (emphasis.body().size() == 1 && emphasis.body().get(0) instanceof Literal literal) {
                    context.recordItalicUse(new ItalicUse(literal.text(), ItalicUse.Kind.ITALIC, reporter.location()));
                } else {
                    reporter.warning(DiagnosticCode.MDC017, "Emphasis should hold a single piece of text, found "
                            + describe(emphasis.body()));
                }
            }
            return styled(emphasis.body(), Run::withItalic);
        }

        @Override
        public List<Inline> visitInlineCode(InlineCode inlineCode) {
            List<Inline> runs = new ArrayList<>();
            for (VerticalPositionSplitter.Segment segment
                    : VerticalPositionSplitter.split(TextNormalizer.normalize(inlineCode.code()))) {
                runs.add(new Run(segment.text(),
                        RunProperties.PLAIN.withStyle(StyleIds.CODE_EMBEDDED).withVerticalPosition(segment.position())));
            }
            return runs;
        }

        @Override
        public List<Inline> visitMath(MathSpan math) {
            return List.of(Run.styled(TextNormalizer.normalize(math.code()), StyleIds.CODE_EMBEDDED));
        }

        @Override
        public List<Inline> visitDirectLink(DirectLink link) {
            return renderLink(link.body(), link.url(), link.title());
        }

        @Override
        public List<Inline> visitIndirectLink(IndirectLink link) {
            LinkDefinition definition = definedLinks.get(link.key());
            if (definition == null) {
                definition = definedLinks.get(link.key().toLowerCase(Locale.ROOT));
            }
            if (definition == null) {
                return renderLink(link.body(), "", Optional.empty());
            }
            return renderLink(link.body(), definition.url(), definition.title());
        }

        @Override
        public List<Inline> visitHardBreak(HardBreak hardBreak) {
            return List.of();
        }

        @Override
        public List<Inline> visitUnsupported(UnsupportedSpan unsupported) {
            reporter.error(DiagnosticCode.MDC020, "Unrecognized span " + unsupported.kind());
            return List.of(Run.plain("[" + unsupported.kind() + "]"));
        }

        private List<Inline> styled(List<Span> body, UnaryOperator<Run> style) {
            List<Inline> inlines = new ArrayList<>();
            for (Inline inline : render(body, true, false)) {
                if (inline instanceof Run run) {
                    inlines.add(style.apply(run));
                } else if (inline instanceof Hyperlink hyperlink) {
                    inlines.add(hyperlink.mapRuns(style));
                } else {
                    inlines.add(inline);
                }
            }
            return inlines;
        }

        private boolean isListEndMarker(Emphasis emphasis) {
            return emphasis.body().size() == 1
                    && emphasis.body().get(0) instanceof Literal literal
                    && LIST_END_MARKERS.contains(literal.text());
        }
    }

    /**
     * Text of a term definition: a single literal wrapped in both strong and emphasis, in either order.
     */
    private static Optional<String> termDefinition(List<Span> body, Class<? extends Span> inner) {
        if (body.size() != 1 || !inner.isInstance(body.get(0))) {
            return Optional.empty();
        }
        List<Span> innerBody = body.get(0) instanceof Strong strong ? strong.body() : ((Emphasis) body.get(0)).body();
        if (innerBody.size() == 1 && innerBody.get(0) instanceof Literal literal) {
            return Optional.of(literal.text());
        }
        return Optional.empty();
    }

    private List<Inline> defineTerm(String text) {
        Run run = new Run(text, RunProperties.PLAIN.withBold().withItalic());
        Optional<TermRef> previous = context.term(text);
        if (previous.isPresent()) {
            Location earlier = previous.get().definitionLocation();
            reporter.warning(DiagnosticCode.MDC016, "Term '" + text + "' is already defined at " + earlier);
            reporter.warning(DiagnosticCode.MDC016B, "Previous definition of term '" + text + "', redefined at "
                    + reporter.location(), earlier);
            return List.of(run);
        }
        TermRef binding = context.defineTerm(text, reporter.location());
        int id = context.nextBookmarkId();
        return List.of(new BookmarkStart(binding.bookmarkName(), id), run, new BookmarkEnd(id));
    }

    private List<Inline> renderLink(List<Span> body, String url, Optional<String> title) {
        Optional<String> anchor = anchorText(body);
        if (anchor.isEmpty()) {
            reporter.error(DiagnosticCode.MDC018, "Link anchor must be plain text or inline code, found " + describe(body));
            return List.of();
        }
        String sectionUrl = url.startsWith("#") ? reporter.file() + url : url;
        Optional<SectionRef> section = context.sections().find(sectionUrl);
        if (section.isPresent()) {
            SectionRef target = section.get();
            target.number().ifPresent(number -> {
                if (!anchor.get().equals("§" + number)) {
                    reporter.warning(DiagnosticCode.MDC019, "Link anchor '" + anchor.get() + "' should be '§" + number
                            + "' for section " + target.url());
                }
            });
            return List.of(Hyperlink.internal(target.bookmarkName(), Run.plain(anchor.get())));
        }
        if (url.startsWith("http:") || url.startsWith("https:")) {
            List<Run> runs = new ArrayList<>();
            for (Inline inline : render(body, true, false)) {
                if (inline instanceof Run run) {
                    runs.add(run);
                } else if (inline instanceof Hyperlink hyperlink) {
                    runs.addAll(hyperlink.runs());
                }
            }
            runs.replaceAll(run -> new Run(run.text(), run.properties().withStyle(StyleIds.HYPERLINK)));
            return List.of(Hyperlink.external(url, title.orElse(null), runs));
        }
        if (!url.isEmpty()) {
            reporter.error(DiagnosticCode.MDC028, "Link target '" + url + "' is neither a known section nor an http url");
        }
        return List.of();
    }

    private static Optional<String> anchorText(List<Span> body) {
        if (body.size() != 1) {
            return Optional.empty();
        }
        Span span = body.get(0);
        if (span instanceof Literal literal) {
            return Optional.of(literal.text());
        }
        if (span instanceof InlineCode code) {
            return Optional.of(code.code());
        }
        return Optional.empty();
    }

    private static String describe(List<Span> spans) {
        List<String> kinds = new ArrayList<>();
        for (Span span : spans) {
            kinds.add(span.kind());
        }
        return kinds.isEmpty() ? "nothing" : String.join(", ", kinds);
    }
}
