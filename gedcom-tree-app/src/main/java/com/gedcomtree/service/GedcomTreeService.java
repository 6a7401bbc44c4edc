package com.gedcomtree.service;

import com.gedcomtree.config.GedcomProperties;
import com.gedcomtree.graph.GenerationAssigner;
import com.gedcomtree.graph.GraphBuilder;
import com.gedcomtree.graph.LayoutContext;
import com.gedcomtree.graph.LayoutEngine;
import com.gedcomtree.model.GedcomData;
import com.gedcomtree.model.GraphNode;
import com.gedcomtree.model.GraphStats;
import com.gedcomtree.model.TreeGraph;
import com.gedcomtree.parser.GedcomParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Runs the parse -> graph -> generations -> layout pipeline over a whole document.
 */
@Service
public class GedcomTreeService {

    private static final Logger log = LoggerFactory.getLogger(GedcomTreeService.class);

    private final GedcomParser parser;
    private final GraphBuilder graphBuilder;
    private final GenerationAssigner generationAssigner;
    private final LayoutEngine layoutEngine;
    private final ResourceLoader resourceLoader;
    private final GedcomProperties properties;

    public GedcomTreeService(GedcomParser parser,
                             GraphBuilder graphBuilder,
                             GenerationAssigner generationAssigner,
                             LayoutEngine layoutEngine,
                             ResourceLoader resourceLoader,
                             GedcomProperties properties) {
        this.parser = parser;
        this.graphBuilder = graphBuilder;
        this.generationAssigner = generationAssigner;
        this.layoutEngine = layoutEngine;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    public GedcomData parse(String content) {
        return parser.parse(content);
    }

    /**
     * Parse a document and lay it out.
     *
     * @param content the whole document; null or blank gives an empty graph
     * @return nodes with coordinates and generations, links, and stats
     */
    public TreeGraph buildTree(String content) {
        return layout(parser.parse(content));
    }

    public TreeGraph layout(GedcomData data) {
        LayoutContext context = graphBuilder.build(data);
        generationAssigner.assign(context);
        List<List<GraphNode>> rows = layoutEngine.layout(context);

        GraphStats stats = new GraphStats(
                context.nodeCount(),
                data.families().size(),
                context.links().size(),
                rows.size(),
                context.droppedReferences());
        log.info("Laid out {} individuals, {} families, {} links in {} generations",
                stats.individuals(), stats.families(), stats.connections(), stats.generations());

        return new TreeGraph(context.nodes(), List.copyOf(context.links()), stats);
    }

    /**
     * Nodes whose display name contains the query, ignoring case. A blank query
     * matches every node. Order follows the graph's node order.
     */
    public List<GraphNode> search(TreeGraph graph, String query) {
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return graph.nodes();
        }
        return graph.nodes().stream()
                .filter(node -> node.getName().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    /**
     * Lay out the configured sample document.
     *
     * @throws GedcomSourceException if the document cannot be read
     */
    public TreeGraph buildSampleTree() {
        return buildTree(readSampleDocument());
    }

    String readSampleDocument() {
        String location = properties.getSampleDocument();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new GedcomSourceException("Sample document not found: " + location, null);
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GedcomSourceException("Failed to read sample document: " + location, e);
        }
    }

    public static class GedcomSourceException extends RuntimeException {
        public GedcomSourceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
