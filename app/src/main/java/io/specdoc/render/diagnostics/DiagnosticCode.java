package io.specdoc.render.diagnostics;

public enum DiagnosticCode {
    MDC008(DiagnosticCategory.STRUCTURAL, "Unexpected item in list"),
    MDC009(DiagnosticCategory.UNRECOGNIZED, "Unrecognized code block language"),
    MDC010(DiagnosticCategory.STRUCTURAL, "Table has no header row"),
    MDC011(DiagnosticCategory.UNRECOGNIZED, "Unrecognized block element"),
    MDC012(DiagnosticCategory.CONSISTENCY, "Ordered and unordered items mixed at one list level"),
    MDC013(DiagnosticCategory.STRUCTURAL, "List nested deeper than four levels"),
    MDC014(DiagnosticCategory.STRUCTURAL, "Unsupported block inside list"),
    MDC016(DiagnosticCategory.CONSISTENCY, "Term defined more than once"),
    MDC016B(DiagnosticCategory.CONSISTENCY, "Previous definition of a redefined term"),
    MDC017(DiagnosticCategory.CONSISTENCY, "Emphasis holds something other than a single literal"),
    MDC018(DiagnosticCategory.STRUCTURAL, "Link anchor is neither literal nor inline code"),
    MDC019(DiagnosticCategory.CONSISTENCY, "Section link anchor does not match section number"),
    MDC020(DiagnosticCategory.UNRECOGNIZED, "Unrecognized inline element"),
    MDC028(DiagnosticCategory.STRUCTURAL, "Link target is neither a known section nor http"),
    MDC029(DiagnosticCategory.UNRECOGNIZED, "Unknown custom block id"),
    MDC030(DiagnosticCategory.STRUCTURAL, "Unsupported element inside quoted block"),
    MDC032(DiagnosticCategory.CONSISTENCY, "Code line too long"),
    MDC033(DiagnosticCategory.STRUCTURAL, "Unexpected markup in function members table"),
    MDC034(DiagnosticCategory.STRUCTURAL, "Heading missing from section table"),
    MDC035(DiagnosticCategory.STRUCTURAL, "Duplicate section url"),
    MDC999(DiagnosticCategory.TRACE, "Section trace");

    private final DiagnosticCategory category;
    private final String summary;

    DiagnosticCode(DiagnosticCategory category, String summary) {
        this.category = category;
        this.summary = summary;
    }

    public DiagnosticCategory category() {
        return category;
    }

    public String summary() {
        return summary;
    }
}
