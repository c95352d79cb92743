package io.specdoc.render.convert;

import io.specdoc.render.diagnostics.DiagnosticLog;
import io.specdoc.render.diagnostics.Location;
import io.specdoc.render.spec.ItalicUse;
import io.specdoc.render.spec.SectionCatalog;
import io.specdoc.render.spec.TermRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state shared by every converter of one run: the bookmark counter, the term table and its matcher,
 * the italic-use audit log, the section table and the diagnostic log.
 *
 * <p>Not thread safe. One instance is created per run and passed explicitly to each component.</p>
 */
public class ConversionContext {

    public static final int DEFAULT_MAX_CODE_LINE_LENGTH = 81;

    private final SectionCatalog sections;
    private final DiagnosticLog diagnostics;
    private final int maxCodeLineLength;
    private final Map<String, TermRef> terms = new LinkedHashMap<>();
    private final List<ItalicUse> italicUses = new ArrayList<>();
    private int lastBookmarkId;
    private TermMatcher termMatcher;

    public ConversionContext(SectionCatalog sections, DiagnosticLog diagnostics) {
        this(sections, diagnostics, DEFAULT_MAX_CODE_LINE_LENGTH);
    }

    public ConversionContext(SectionCatalog sections, DiagnosticLog diagnostics, int maxCodeLineLength) {
        this.sections = Objects.requireNonNull(sections, "sections");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        if (maxCodeLineLength <= 0) {
            throw new IllegalArgumentException("maxCodeLineLength must be positive");
        }
        this.maxCodeLineLength = maxCodeLineLength;
    }

    public SectionCatalog sections() {
        return sections;
    }

    public DiagnosticLog diagnostics() {
        return diagnostics;
    }

    public int maxCodeLineLength() {
        return maxCodeLineLength;
    }

    public int nextBookmarkId() {
        return ++lastBookmarkId;
    }

    public int lastBookmarkId() {
        return lastBookmarkId;
    }

    public Optional<TermRef> term(String text) {
        return Optional.ofNullable(terms.get(text));
    }

    public List<TermRef> terms() {
        return List.copyOf(terms.values());
    }

    /**
     * Binds {@code text} to a new term bookmark unless it is already defined.
     *
     * @return the binding in effect afterwards; its location differs from {@code location} for a redefinition
     */
    public TermRef defineTerm(String text, Location location) {
        TermRef existing = terms.get(text);
        if (existing != null) {
            return existing;
        }
        TermRef created = new TermRef(text, String.format(Locale.ROOT, "_Trm%05d", terms.size() + 1), location);
        terms.put(text, created);
        termMatcher = null;
        return created;
    }

    /**
     * Matcher over the current term keys, rebuilt only after the term table changed.
     */
    public TermMatcher termMatcher() {
        if (termMatcher == null) {
            termMatcher = TermMatcher.of(terms.keySet());
        }
        return termMatcher;
    }

    public void recordItalicUse(ItalicUse use) {
        italicUses.add(Objects.requireNonNull(use, "use"));
    }

    public List<ItalicUse> italicUses() {
        return Collections.unmodifiableList(italicUses);
    }
}
