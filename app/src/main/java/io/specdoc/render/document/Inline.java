package io.specdoc.render.document;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Paragraph-level content: text runs, breaks, bookmark markers and hyperlinks.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Run.class, name = "run"),
        @JsonSubTypes.Type(value = Break.class, name = "break"),
        @JsonSubTypes.Type(value = BookmarkStart.class, name = "bookmarkStart"),
        @JsonSubTypes.Type(value = BookmarkEnd.class, name = "bookmarkEnd"),
        @JsonSubTypes.Type(value = Hyperlink.class, name = "hyperlink")
})
public sealed interface Inline permits Run, Break, BookmarkStart, BookmarkEnd, Hyperlink {

    /**
     * Visible text of this element; markers contribute nothing.
     */
    default String text() {
        return "";
    }
}
