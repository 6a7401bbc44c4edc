package com.gedcomtree.parser;

import com.gedcomtree.model.Name;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses NAME values of the form {@code Given /Surname/ Suffix}. Either slash may
 * be missing.
 */
public final class NameParser {

    private static final Pattern NAME = Pattern.compile("^([^/]*)/?([^/]*)/?(.*)$", Pattern.DOTALL);

    private NameParser() {
    }

    public static Name parse(String value) {
        String raw = value != null ? value : "";
        String full = raw.replace("/", "").trim();

        // every string matches; missing slashes leave the later groups empty
        Matcher m = NAME.matcher(raw);
        m.matches();
        return new Name(full, m.group(1).trim(), m.group(2).trim(), m.group(3).trim());
    }
}
