package com.gedcomtree.graph;

import com.gedcomtree.model.GraphNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Places nodes in generation rows.
 *
 * Rows are ordered by name with spouses kept side by side, spread evenly around
 * x = 0 and then refined: each pass pulls parents toward the mean x of their
 * children and pushes apart any nodes in a row closer than the horizontal
 * spacing. The finished tree is centered on x = 0.
 *
 * Expects generations to be assigned already.
 */
public class LayoutEngine {

    public static final double DEFAULT_HORIZONTAL_SPACING = 180;
    public static final double DEFAULT_VERTICAL_SPACING = 120;
    public static final int DEFAULT_REFINEMENT_PASSES = 3;
    public static final double DEFAULT_PARENT_RETAIN_WEIGHT = 0.3;

    private static final Comparator<GraphNode> BY_NAME =
            Comparator.comparing(GraphNode::getName).thenComparing(GraphNode::getId);

    private final double horizontalSpacing;
    private final double verticalSpacing;
    private final int refinementPasses;
    private final double parentRetainWeight;

    public LayoutEngine() {
        this(DEFAULT_HORIZONTAL_SPACING, DEFAULT_VERTICAL_SPACING,
                DEFAULT_REFINEMENT_PASSES, DEFAULT_PARENT_RETAIN_WEIGHT);
    }

    public LayoutEngine(double horizontalSpacing, double verticalSpacing,
                        int refinementPasses, double parentRetainWeight) {
        if (horizontalSpacing <= 0 || verticalSpacing <= 0) {
            throw new IllegalArgumentException("Spacing must be positive");
        }
        if (parentRetainWeight < 0 || parentRetainWeight > 1) {
            throw new IllegalArgumentException("parentRetainWeight must be within [0, 1]: " + parentRetainWeight);
        }
        this.horizontalSpacing = horizontalSpacing;
        this.verticalSpacing = verticalSpacing;
        this.refinementPasses = Math.max(0, refinementPasses);
        this.parentRetainWeight = parentRetainWeight;
    }

    public double horizontalSpacing() {
        return horizontalSpacing;
    }

    /**
     * Writes x and y on every node and returns the rows, top to bottom, in their
     * final left-to-right order.
     */
    public List<List<GraphNode>> layout(LayoutContext context) {
        List<GraphNode> nodes = context.nodes();
        if (nodes.isEmpty()) {
            return List.of();
        }

        // Group by generation
        Map<Integer, List<GraphNode>> byGeneration = new TreeMap<>();
        for (GraphNode node : nodes) {
            byGeneration.computeIfAbsent(node.getGeneration(), k -> new ArrayList<>()).add(node);
        }

        Map<String, String> spouses = context.spouses();
        List<List<GraphNode>> rows = new ArrayList<>();
        int rowIndex = 0;
        for (List<GraphNode> generation : byGeneration.values()) {
            List<GraphNode> row = orderRow(generation, spouses);
            double startX = -(row.size() * horizontalSpacing) / 2 + horizontalSpacing / 2;
            for (int i = 0; i < row.size(); i++) {
                GraphNode node = row.get(i);
                node.setX(startX + i * horizontalSpacing);
                node.setY(rowIndex * verticalSpacing);
            }
            rows.add(row);
            rowIndex++;
        }

        Map<String, List<GraphNode>> childrenOf = childrenOf(context);
        for (int pass = 0; pass < refinementPasses; pass++) {
            for (List<GraphNode> row : rows) {
                for (GraphNode node : row) {
                    List<GraphNode> children = childrenOf.get(node.getId());
                    if (children == null || children.isEmpty()) {
                        continue;
                    }
                    double mean = children.stream().mapToDouble(GraphNode::getX).average().orElse(node.getX());
                    node.setX(parentRetainWeight * node.getX() + (1 - parentRetainWeight) * mean);
                }
                resolveOverlap(row);
            }
        }

        center(nodes);
        return rows;
    }

    /**
     * Name order, except that a spouse in the same row is placed right after
     * the partner that comes first.
     */
    List<GraphNode> orderRow(List<GraphNode> generation, Map<String, String> spouses) {
        List<GraphNode> sorted = new ArrayList<>(generation);
        sorted.sort(BY_NAME);

        Map<String, GraphNode> inRow = new HashMap<>();
        for (GraphNode node : sorted) {
            inRow.put(node.getId(), node);
        }

        Set<GraphNode> placed = new LinkedHashSet<>();
        for (GraphNode node : sorted) {
            if (!placed.add(node)) {
                continue;
            }
            GraphNode spouse = inRow.get(spouses.get(node.getId()));
            if (spouse != null) {
                placed.add(spouse);
            }
        }
        return new ArrayList<>(placed);
    }

    /**
     * Re-sorts the row by x and shifts nodes right until neighbours are at least
     * one horizontal spacing apart.
     */
    void resolveOverlap(List<GraphNode> row) {
        row.sort(Comparator.comparingDouble(GraphNode::getX));
        for (int i = 1; i < row.size(); i++) {
            GraphNode previous = row.get(i - 1);
            GraphNode node = row.get(i);
            double minX = previous.getX() + horizontalSpacing;
            if (node.getX() < minX) {
                node.setX(minX);
            }
        }
    }

    private void center(List<GraphNode> nodes) {
        double minX = nodes.stream().mapToDouble(GraphNode::getX).min().orElse(0);
        double maxX = nodes.stream().mapToDouble(GraphNode::getX).max().orElse(0);
        double offset = -(minX + maxX) / 2;
        for (GraphNode node : nodes) {
            node.setX(node.getX() + offset);
        }
    }

    private Map<String, List<GraphNode>> childrenOf(LayoutContext context) {
        Map<String, List<GraphNode>> result = new HashMap<>();
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, List<String>> e : context.parentToChildren().entrySet()) {
            List<GraphNode> children = new ArrayList<>();
            seen.clear();
            for (String childId : e.getValue()) {
                if (seen.add(childId)) {
                    children.add(context.node(childId));
                }
            }
            result.put(e.getKey(), children);
        }
        return result;
    }
}
