package io.specdoc.render.spec;

import io.specdoc.render.markdown.Emphasis;
import io.specdoc.render.markdown.DirectLink;
import io.specdoc.render.markdown.Heading;
import io.specdoc.render.markdown.IndirectLink;
import io.specdoc.render.markdown.InlineCode;
import io.specdoc.render.markdown.Literal;
import io.specdoc.render.markdown.MathSpan;
import io.specdoc.render.markdown.Span;
import io.specdoc.render.markdown.Strong;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the url, number and bookmark name of a heading the same way for the catalog and the converter.
 */
public final class SectionRefFactory {

    static final int MAX_BOOKMARK_LENGTH = 40;

    private static final Pattern NUMBERED_TITLE = Pattern.compile("^(\\d+(?:\\.\\d+)*|[A-Z](?:\\.\\d+)+)\\s+(.*)$");

    private SectionRefFactory() {
    }

    public static SectionRef create(Heading heading, String file) {
        String title = plainText(heading.body()).trim();
        Optional<String> number = Optional.empty();
        String titleWithoutNumber = title;
        Matcher matcher = NUMBERED_TITLE.matcher(title);
        if (matcher.matches()) {
            number = Optional.of(matcher.group(1));
            titleWithoutNumber = matcher.group(2);
        }
        String slug = slug(title);
        String bookmarkName = number
                .map(value -> "_Toc_" + value.replace('.', '_'))
                .orElseGet(() -> "_Toc_" + slug.replace('-', '_'));
        if (bookmarkName.length() > MAX_BOOKMARK_LENGTH) {
            bookmarkName = bookmarkName.substring(0, MAX_BOOKMARK_LENGTH);
        }
        return new SectionRef(file + "#" + slug, title, titleWithoutNumber, number, bookmarkName);
    }

    /**
     * GitHub-style heading anchor: lower case, punctuation other than hyphen and underscore dropped,
     * spaces turned into hyphens.
     */
    public static String slug(String title) {
        StringBuilder builder = new StringBuilder(title.length());
        title.toLowerCase(Locale.ROOT).codePoints().forEach(codePoint -> {
            if (Character.isLetterOrDigit(codePoint) || codePoint == '-' || codePoint == '_') {
                builder.appendCodePoint(codePoint);
            } else if (codePoint == ' ') {
                builder.append('-');
            }
        });
        return builder.toString();
    }

    static String plainText(List<Span> spans) {
        StringBuilder builder = new StringBuilder();
        for (Span span : spans) {
            if (span instanceof Literal literal) {
                builder.append(literal.text());
            } else if (span instanceof InlineCode code) {
                builder.append(code.code());
            } else if (span instanceof MathSpan math) {
                builder.append(math.code());
            } else if (span instanceof Strong strong) {
                builder.append(plainText(strong.body()));
            } else if (span instanceof Emphasis emphasis) {
                builder.append(plainText(emphasis.body()));
            } else if (span instanceof DirectLink link) {
                builder.append(plainText(link.body()));
            } else if (span instanceof IndirectLink link) {
                builder.append(plainText(link.body()));
            }
        }
        return builder.toString();
    }
}
