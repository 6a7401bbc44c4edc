package com.gedcomtree.model;

public record GraphStats(
    int individuals,
    int families,
    int connections,
    int generations,
    int droppedReferences
) {
    public static GraphStats empty() {
        return new GraphStats(0, 0, 0, 0, 0);
    }

    public String summary() {
        return individuals + " individuals | " + connections + " connections";
    }
}
