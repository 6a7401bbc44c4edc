package com.gedcomtree.controller;

import com.gedcomtree.model.GedcomData;
import com.gedcomtree.model.GraphNode;
import com.gedcomtree.model.TreeGraph;
import com.gedcomtree.service.GedcomTreeService;
import com.gedcomtree.service.GedcomTreeService.GedcomSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/gedcom")
public class GedcomTreeController {

    private static final Logger log = LoggerFactory.getLogger(GedcomTreeController.class);

    private final GedcomTreeService gedcomTreeService;

    public GedcomTreeController(GedcomTreeService gedcomTreeService) {
        this.gedcomTreeService = gedcomTreeService;
    }

    /**
     * Lay out a whole GEDCOM document sent as the request body.
     */
    @PostMapping(value = "/graph", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<TreeGraph> buildGraph(@RequestBody(required = false) String content) {
        return ResponseEntity.ok(gedcomTreeService.buildTree(content));
    }

    /**
     * Parse the document and return the raw records, for detail lookups.
     */
    @PostMapping(value = "/records", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<GedcomData> getRecords(@RequestBody(required = false) String content) {
        return ResponseEntity.ok(gedcomTreeService.parse(content));
    }

    /**
     * Find people in the document by name.
     */
    @PostMapping(value = "/search", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<List<GraphNode>> search(
            @RequestParam(name = "q", defaultValue = "") String query,
            @RequestBody(required = false) String content) {

        TreeGraph graph = gedcomTreeService.buildTree(content);
        return ResponseEntity.ok(gedcomTreeService.search(graph, query));
    }

    /**
     * Lay out the bundled sample document.
     */
    @GetMapping("/sample/graph")
    public ResponseEntity<TreeGraph> getSampleGraph() {
        try {
            return ResponseEntity.ok(gedcomTreeService.buildSampleTree());
        } catch (GedcomSourceException e) {
            log.warn("Sample document unavailable", e);
            return ResponseEntity.notFound().build();
        }
    }
}
