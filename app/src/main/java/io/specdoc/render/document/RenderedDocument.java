package io.specdoc.render.document;

import io.specdoc.render.spec.SectionRef;
import io.specdoc.render.spec.TermRef;
import java.util.List;
import java.util.Objects;

/**
 * Everything the document-assembly step needs: blocks in order, the numbering definitions they reference,
 * and the term and section tables their bookmarks were named from.
 */
public record RenderedDocument(
        List<String> sources,
        List<DocBlock> blocks,
        NumberingDefinitions numbering,
        List<TermRef> terms,
        List<SectionRef> sections
) {

    public RenderedDocument {
        sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
        blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks"));
        Objects.requireNonNull(numbering, "numbering");
        terms = List.copyOf(Objects.requireNonNull(terms, "terms"));
        sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    }
}
