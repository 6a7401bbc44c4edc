package com.gedcomtree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The HEAD record, kept as the ordered list of its subordinate lines.
 */
public class Header {

    private final List<GedcomLine> lines = new ArrayList<>();

    public static Header empty() {
        return new Header();
    }

    public void addLine(GedcomLine line) {
        lines.add(line);
    }

    public List<GedcomLine> getLines() {
        return lines;
    }

    /**
     * Value of the first line carrying the given tag, at any depth.
     */
    public Optional<String> firstValue(String tag) {
        return lines.stream()
                .filter(line -> line.tag().equals(tag))
                .map(GedcomLine::value)
                .findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
