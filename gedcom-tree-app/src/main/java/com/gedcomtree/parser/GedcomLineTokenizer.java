package com.gedcomtree.parser;

import com.gedcomtree.model.GedcomLine;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one trimmed line into level, optional xref, tag and value.
 */
public class GedcomLineTokenizer {

    // LEVEL [@XREF@] TAG [VALUE]
    private static final Pattern LINE = Pattern.compile("^(\\d+)\\s+(?:(@[^@]+@)\\s+)?(\\S+)(?:\\s+(.*))?$");

    /**
     * @param line a non-empty, already-trimmed line
     * @return the token, or empty if the line does not have the expected shape
     */
    public Optional<GedcomLine> tokenize(String line) {
        if (line == null || line.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = LINE.matcher(line);
        if (!m.matches()) {
            return Optional.empty();
        }

        int level;
        try {
            level = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            // digits only, so this is an overflowing level
            return Optional.empty();
        }

        String value = m.group(4) != null ? m.group(4) : "";
        return Optional.of(new GedcomLine(level, m.group(2), m.group(3), value));
    }
}
