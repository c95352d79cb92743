package io.specdoc.render.document;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Paragraph with optional properties. Properties stay mutable so enclosing constructs (quotes, lists) can
 * re-indent paragraphs produced by nested conversions.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class Paragraph implements DocBlock {

    private ParagraphProperties properties;
    private final List<Inline> content;

    public Paragraph(List<? extends Inline> content) {
        this(null, content);
    }

    public Paragraph(ParagraphProperties properties, List<? extends Inline> content) {
        this.properties = properties;
        this.content = new ArrayList<>(Objects.requireNonNull(content, "content"));
    }

    public static Paragraph of(Inline... content) {
        return new Paragraph(List.of(content));
    }

    public static Paragraph styled(String styleId, Inline... content) {
        return new Paragraph(new ParagraphProperties().styleId(styleId), List.of(content));
    }

    public Optional<ParagraphProperties> properties() {
        return Optional.ofNullable(properties);
    }

    /**
     * Returns the paragraph properties, inserting an empty set first when the paragraph has none.
     */
    public ParagraphProperties ensureProperties() {
        if (properties == null) {
            properties = new ParagraphProperties();
        }
        return properties;
    }

    public List<Inline> content() {
        return Collections.unmodifiableList(content);
    }

    public String text() {
        StringBuilder builder = new StringBuilder();
        for (Inline inline : content) {
            builder.append(inline.text());
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return "Paragraph{" + properties + ", " + content + '}';
    }
}
