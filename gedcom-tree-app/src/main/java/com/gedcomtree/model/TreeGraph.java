package com.gedcomtree.model;

import java.util.List;

/**
 * Laid-out graph handed to renderers.
 */
public record TreeGraph(
    List<GraphNode> nodes,
    List<GraphLink> links,
    GraphStats stats
) {
    public static TreeGraph empty() {
        return new TreeGraph(List.of(), List.of(), GraphStats.empty());
    }
}
