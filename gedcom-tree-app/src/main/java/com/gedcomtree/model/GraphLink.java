package com.gedcomtree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * An edge between two individuals, tagged with the family that produced it.
 * Marriage links run husband to wife; parent-child links run parent to child.
 */
public record GraphLink(
    String source,
    String target,
    LinkType type,
    String familyId
) {
    @JsonIgnore
    public boolean isMarriage() {
        return type == LinkType.MARRIAGE;
    }

    @JsonIgnore
    public boolean isParentChild() {
        return type == LinkType.PARENT_CHILD;
    }
}
