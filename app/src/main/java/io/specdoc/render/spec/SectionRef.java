package io.specdoc.render.spec;

import java.util.Objects;
import java.util.Optional;

/**
 * Heading as the rest of the document refers to it. {@code number} is present only for sections that take
 * part in the numbering scheme.
 */
public record SectionRef(String url, String title, String titleWithoutNumber, Optional<String> number, String bookmarkName) {

    public SectionRef {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(titleWithoutNumber, "titleWithoutNumber");
        number = number == null ? Optional.empty() : number;
        Objects.requireNonNull(bookmarkName, "bookmarkName");
    }

    public SectionRef withBookmarkName(String value) {
        return new SectionRef(url, title, titleWithoutNumber, number, value);
    }

    public String file() {
        int hash = url.indexOf('#');
        return hash < 0 ? url : url.substring(0, hash);
    }
}
