package com.gedcomtree.parser;

import com.gedcomtree.model.Family;
import com.gedcomtree.model.GedcomData;
import com.gedcomtree.model.GedcomLine;
import com.gedcomtree.model.Header;
import com.gedcomtree.model.Individual;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds individuals, families and the header from GEDCOM text.
 *
 * Level-0 lines open records; deeper lines are applied to the open record with
 * the nearest enclosing line's tag as context. A line's parent is the most
 * recent earlier line with a strictly smaller level, so gaps in the level
 * numbering are tolerated. Lines that cannot be tokenized are skipped and no
 * input makes the parser fail.
 *
 * Instances hold no per-document state and can be shared.
 */
public class GedcomParser {

    private static final Logger log = LoggerFactory.getLogger(GedcomParser.class);

    private final GedcomLineTokenizer tokenizer;

    public GedcomParser() {
        this(new GedcomLineTokenizer());
    }

    public GedcomParser(GedcomLineTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public GedcomData parse(String content) {
        ParseState state = new ParseState();
        int skipped = 0;

        for (String line : readLines(content)) {
            Optional<GedcomLine> token = tokenizer.tokenize(line);
            if (token.isEmpty()) {
                skipped++;
                continue;
            }
            state.accept(token.get());
        }
        state.finish();

        if (skipped > 0) {
            log.debug("Skipped {} malformed lines", skipped);
        }
        log.debug("Parsed {} individuals, {} families", state.individuals.size(), state.families.size());

        return new GedcomData(state.individuals, state.families, state.header);
    }

    /**
     * Splits on LF or CRLF, trims each line and drops blank ones.
     */
    static List<String> readLines(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        String text = content.charAt(0) == '\uFEFF' ? content.substring(1) : content;

        List<String> lines = new ArrayList<>();
        for (String raw : text.split("\\r?\\n")) {
            String line = raw.trim();
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        return lines;
    }

    // ========== NESTING STATE ==========

    private enum RecordKind { INDIVIDUAL, FAMILY, HEADER }

    private record OpenRecord(RecordKind kind, Object entity) {
    }

    private record OpenTag(int level, String tag) {
    }

    private static final class ParseState {

        private final Map<String, Individual> individuals = new LinkedHashMap<>();
        private final Map<String, Family> families = new LinkedHashMap<>();
        private Header header = Header.empty();

        private OpenRecord current;
        private final Deque<OpenTag> stack = new ArrayDeque<>();

        void accept(GedcomLine line) {
            if (line.level() == 0) {
                finish();
                current = open(line);
                stack.clear();
                stack.push(new OpenTag(0, line.tag()));
                return;
            }
            if (current == null) {
                return;
            }

            while (!stack.isEmpty() && stack.peek().level() >= line.level()) {
                stack.pop();
            }
            String parentTag = stack.isEmpty() ? null : stack.peek().tag();
            interpret(line, parentTag);
            stack.push(new OpenTag(line.level(), line.tag()));
        }

        /**
         * Stores the open record, if any. Called on every level-0 line and at end of input.
         */
        void finish() {
            if (current == null) {
                return;
            }
            switch (current.kind()) {
                case INDIVIDUAL -> {
                    Individual individual = (Individual) current.entity();
                    individuals.put(individual.getId(), individual);
                }
                case FAMILY -> {
                    Family family = (Family) current.entity();
                    families.put(family.getId(), family);
                }
                case HEADER -> header = (Header) current.entity();
            }
            current = null;
        }

        private static OpenRecord open(GedcomLine line) {
            if (line.hasXref() && "INDI".equals(line.tag())) {
                return new OpenRecord(RecordKind.INDIVIDUAL, new Individual(line.xref()));
            }
            if (line.hasXref() && "FAM".equals(line.tag())) {
                return new OpenRecord(RecordKind.FAMILY, new Family(line.xref()));
            }
            if ("HEAD".equals(line.tag())) {
                return new OpenRecord(RecordKind.HEADER, new Header());
            }
            return null;
        }

        private void interpret(GedcomLine line, String parentTag) {
            switch (current.kind()) {
                case INDIVIDUAL -> IndividualTagInterpreter.apply(
                        (Individual) current.entity(), line.tag(), line.value(), parentTag);
                case FAMILY -> FamilyTagInterpreter.apply(
                        (Family) current.entity(), line.tag(), line.value(), parentTag);
                case HEADER -> ((Header) current.entity()).addLine(line);
            }
        }
    }
}
