package com.gedcomtree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/**
 * Finalized records of one parsed document. Maps keep document order and are
 * keyed by xref.
 */
public record GedcomData(
    Map<String, Individual> individuals,
    Map<String, Family> families,
    Header header
) {
    @JsonIgnore
    public boolean isEmpty() {
        return individuals.isEmpty() && families.isEmpty();
    }
}
