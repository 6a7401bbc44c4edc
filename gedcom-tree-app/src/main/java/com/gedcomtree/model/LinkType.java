package com.gedcomtree.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LinkType {
    MARRIAGE("marriage"),
    PARENT_CHILD("parent-child");

    private final String label;

    LinkType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
