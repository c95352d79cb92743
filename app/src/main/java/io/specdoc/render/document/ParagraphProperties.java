package io.specdoc.render.document;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import java.util.Optional;

@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class ParagraphProperties {

    private String styleId;
    private Integer leftIndentation;
    private NumberingReference numbering;
    private Justification justification;
    private Integer spacingAfter;

    public Optional<String> styleId() {
        return Optional.ofNullable(styleId);
    }

    public ParagraphProperties styleId(String value) {
        this.styleId = value;
        return this;
    }

    public Optional<Integer> leftIndentation() {
        return Optional.ofNullable(leftIndentation);
    }

    public ParagraphProperties leftIndentation(int value) {
        this.leftIndentation = value;
        return this;
    }

    public Optional<NumberingReference> numbering() {
        return Optional.ofNullable(numbering);
    }

    public ParagraphProperties numbering(NumberingReference value) {
        this.numbering = value;
        return this;
    }

    public Optional<Justification> justification() {
        return Optional.ofNullable(justification);
    }

    public ParagraphProperties justification(Justification value) {
        this.justification = value;
        return this;
    }

    public Optional<Integer> spacingAfter() {
        return Optional.ofNullable(spacingAfter);
    }

    public ParagraphProperties spacingAfter(int value) {
        this.spacingAfter = value;
        return this;
    }

    @Override
    public String toString() {
        return "ParagraphProperties{style=" + styleId + ", indent=" + leftIndentation + ", numbering=" + numbering
                + ", justification=" + justification + ", spacingAfter=" + spacingAfter + '}';
    }
}
