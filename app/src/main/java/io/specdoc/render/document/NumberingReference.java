package io.specdoc.render.document;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Binds a paragraph to a level of a numbering instance. Instance id 0 opts the paragraph out of numbering
 * that its style would otherwise apply.
 */
public record NumberingReference(int level, int numberingId) {

    public static final NumberingReference EXEMPT = new NumberingReference(0, 0);

    @JsonIgnore
    public boolean isExempt() {
        return numberingId == 0;
    }
}
