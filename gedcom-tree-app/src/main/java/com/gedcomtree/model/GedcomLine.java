package com.gedcomtree.model;

/**
 * One tokenized line of a GEDCOM document: {@code LEVEL [XREF] TAG [VALUE]}.
 * The xref keeps its {@code @} delimiters and is null when the line carries none.
 */
public record GedcomLine(
    int level,
    String xref,
    String tag,
    String value
) {
    public boolean hasXref() {
        return xref != null;
    }
}
