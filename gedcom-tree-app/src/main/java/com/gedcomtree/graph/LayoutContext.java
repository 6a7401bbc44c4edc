package com.gedcomtree.graph;

import com.gedcomtree.model.GraphLink;
import com.gedcomtree.model.GraphNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one graph/layout run: the nodes and links built from a
 * document plus the adjacency views the later stages need. One context per
 * document; never shared between runs.
 */
public class LayoutContext {

    private final Map<String, GraphNode> nodesById = new LinkedHashMap<>();
    private final List<GraphLink> links = new ArrayList<>();
    private int droppedReferences;

    void addNode(GraphNode node) {
        nodesById.put(node.getId(), node);
    }

    void addLink(GraphLink link) {
        links.add(link);
    }

    void recordDroppedReference() {
        droppedReferences++;
    }

    public List<GraphNode> nodes() {
        return new ArrayList<>(nodesById.values());
    }

    public GraphNode node(String id) {
        return nodesById.get(id);
    }

    public boolean hasNode(String id) {
        return id != null && nodesById.containsKey(id);
    }

    public List<GraphLink> links() {
        return links;
    }

    public int nodeCount() {
        return nodesById.size();
    }

    public int droppedReferences() {
        return droppedReferences;
    }

    /**
     * child id -> parent ids, from parent-child links.
     */
    public Map<String, List<String>> childToParents() {
        Map<String, List<String>> result = new HashMap<>();
        for (GraphLink link : links) {
            if (link.isParentChild()) {
                result.computeIfAbsent(link.target(), k -> new ArrayList<>()).add(link.source());
            }
        }
        return result;
    }

    /**
     * parent id -> child ids, from parent-child links.
     */
    public Map<String, List<String>> parentToChildren() {
        Map<String, List<String>> result = new HashMap<>();
        for (GraphLink link : links) {
            if (link.isParentChild()) {
                result.computeIfAbsent(link.source(), k -> new ArrayList<>()).add(link.target());
            }
        }
        return result;
    }

    /**
     * person id -> spouse id, from marriage links. A later marriage overwrites an
     * earlier one.
     */
    public Map<String, String> spouses() {
        Map<String, String> result = new HashMap<>();
        for (GraphLink link : links) {
            if (link.isMarriage()) {
                result.put(link.source(), link.target());
                result.put(link.target(), link.source());
            }
        }
        return result;
    }
}
