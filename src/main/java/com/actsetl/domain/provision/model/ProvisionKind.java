package com.actsetl.domain.provision.model;

import java.util.List;

/**
 * Kinds of provision produced while reading a section.
 * <p>
 * Structural kinds nest according to {@link #level()}; the inline kinds
 * ({@link #TBLOCK}, {@link #TABLE}, {@link #MOD_BLOCK}, {@link #QUOTE_START})
 * are placed into the content block of the nearest open structural element.
 * </p>
 */
public enum ProvisionKind {
    PART("part", "part"),
    CHAPTER("chapter", "chapter"),
    SECTION("section", "sec"),
    SUBSECTION("subsection", "subsect"),
    PARAGRAPH("paragraph", "para"),
    SUBPARAGRAPH("subparagraph", "subpara"),
    CLAUSE("clause", "clause"),
    SUBCLAUSE("subclause", "subclause"),
    DIVISION("division", "division"),
    SCHEDULE("hcontainer", "sched"),
    ARTICLE("article", "art"),
    TABLE("table", null),
    TBLOCK("p", null),
    QUOTE_START("p", null),
    QUOTE_END(null, null),
    MOD_BLOCK("block", null),
    CONTAINER("div", null);

    /** Canonical nesting order, outermost first. */
    private static final List<ProvisionKind> LEVELS = List.of(
            PART, CHAPTER, SECTION, SUBSECTION, PARAGRAPH, SUBPARAGRAPH, CLAUSE, SUBCLAUSE);

    private final String elementName;
    private final String eidLabel;

    ProvisionKind(String elementName, String eidLabel) {
        this.elementName = elementName;
        this.eidLabel = eidLabel;
    }

    /**
     * Target element name, or null for kinds that never produce an element.
     */
    public String elementName() {
        return elementName;
    }

    /**
     * Prefix used when building identifier fragments, e.g. {@code sec} in {@code sec_118}.
     */
    public String eidLabel() {
        return eidLabel;
    }

    /**
     * Position in the canonical nesting order. Kinds outside that order sort after all of them,
     * except the synthetic {@link #CONTAINER}, which sits above everything.
     */
    public int level() {
        if (this == CONTAINER) {
            return -1;
        }
        int index = LEVELS.indexOf(this);
        return index >= 0 ? index : LEVELS.size();
    }

    public boolean isInline() {
        return this == TBLOCK || this == TABLE || this == MOD_BLOCK || this == QUOTE_START;
    }

    public boolean isStructural() {
        return LEVELS.contains(this) || this == DIVISION || this == SCHEDULE || this == ARTICLE;
    }
}
