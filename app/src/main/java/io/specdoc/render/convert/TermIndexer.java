package io.specdoc.render.convert;

import io.specdoc.render.diagnostics.Reporter;
import io.specdoc.render.document.Hyperlink;
import io.specdoc.render.document.Inline;
import io.specdoc.render.document.Run;
import io.specdoc.render.document.RunProperties;
import io.specdoc.render.spec.ItalicUse;
import io.specdoc.render.spec.TermRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns every occurrence of a defined term inside literal text into a link to the term's definition.
 */
public class TermIndexer {

    static final RunProperties TERM_USE = RunProperties.PLAIN
            .withUnderline(new RunProperties.Underline(RunProperties.UnderlineStyle.DOTTED, "4BACC6"));

    private final ConversionContext context;
    private final Reporter reporter;

    public TermIndexer(ConversionContext context, Reporter reporter) {
        this.context = Objects.requireNonNull(context, "context");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public List<Inline> index(String text) {
        List<TermMatcher.Match> matches = context.termMatcher().find(text);
        if (matches.isEmpty()) {
            return List.of(Run.plain(text));
        }
        List<Inline> inlines = new ArrayList<>();
        int position = 0;
        for (TermMatcher.Match match : matches) {
            if (match.start() > position) {
                inlines.add(Run.plain(text.substring(position, match.start())));
            }
            TermRef term = context.term(match.term()).orElseThrow();
            inlines.add(Hyperlink.internal(term.bookmarkName(), new Run(match.term(), TERM_USE)));
            context.recordItalicUse(new ItalicUse(match.term(), ItalicUse.Kind.TERM, reporter.location()));
            position = match.end();
        }
        if (position < text.length()) {
            inlines.add(Run.plain(text.substring(position)));
        }
        return inlines;
    }
}
