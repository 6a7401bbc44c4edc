package com.gedcomtree.graph;

import com.gedcomtree.model.GraphNode;
import com.gedcomtree.model.LifeEvent;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns every node a generation number.
 *
 * People without recorded parents start at generation 0 and the BFS pushes
 * children one generation below their deepest parent. Nodes the BFS never
 * reaches get an estimate from their birth year. Generations are then shifted
 * so the smallest is 0.
 */
public class GenerationAssigner {

    public static final int DEFAULT_BASE_YEAR = 1000;
    public static final int DEFAULT_YEARS_PER_GENERATION = 30;

    private static final Pattern YEAR = Pattern.compile("\\b(\\d{3,4})\\b");

    private final int baseYear;
    private final int yearsPerGeneration;

    public GenerationAssigner() {
        this(DEFAULT_BASE_YEAR, DEFAULT_YEARS_PER_GENERATION);
    }

    public GenerationAssigner(int baseYear, int yearsPerGeneration) {
        if (yearsPerGeneration <= 0) {
            throw new IllegalArgumentException("yearsPerGeneration must be positive: " + yearsPerGeneration);
        }
        this.baseYear = baseYear;
        this.yearsPerGeneration = yearsPerGeneration;
    }

    /**
     * Writes the generation of every node in the context and returns id -> generation.
     */
    public Map<String, Integer> assign(LayoutContext context) {
        List<GraphNode> nodes = context.nodes();
        Map<String, List<String>> childToParents = context.childToParents();
        Map<String, List<String>> parentToChildren = context.parentToChildren();

        // Roots: people without parents in this graph
        Map<String, Integer> generations = new HashMap<>();
        Queue<String> queue = new ArrayDeque<>();
        for (GraphNode node : nodes) {
            if (!childToParents.containsKey(node.getId())) {
                generations.put(node.getId(), 0);
                queue.add(node.getId());
            }
        }

        // Cyclic ancestry could raise generations forever; no real path is longer than the node count
        int ceiling = nodes.size();

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = generations.get(current) + 1;
            for (String child : parentToChildren.getOrDefault(current, List.of())) {
                Integer assigned = generations.get(child);
                if (assigned == null || (next > assigned && next <= ceiling)) {
                    generations.put(child, next);
                    queue.add(child);
                }
            }
        }

        // Unreached members: estimate from birth year
        for (GraphNode node : nodes) {
            if (!generations.containsKey(node.getId())) {
                generations.put(node.getId(), estimateFromBirth(node.getBirth()));
            }
        }

        int min = generations.values().stream().mapToInt(Integer::intValue).min().orElse(0);
        for (GraphNode node : nodes) {
            int generation = generations.get(node.getId()) - min;
            generations.put(node.getId(), generation);
            node.setGeneration(generation);
        }
        return generations;
    }

    /**
     * {@code floor((year - baseYear) / yearsPerGeneration)}, never below 0; 0 when
     * the birth date has no 3-4 digit year.
     */
    int estimateFromBirth(LifeEvent birth) {
        if (birth == null || birth.getDate() == null) {
            return 0;
        }
        Matcher m = YEAR.matcher(birth.getDate());
        if (!m.find()) {
            return 0;
        }
        int year = Integer.parseInt(m.group(1));
        return Math.max(0, Math.floorDiv(year - baseYear, yearsPerGeneration));
    }
}
