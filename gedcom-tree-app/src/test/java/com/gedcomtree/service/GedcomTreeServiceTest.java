package com.gedcomtree.service;

import com.gedcomtree.config.GedcomProperties;
import com.gedcomtree.graph.GenerationAssigner;
import com.gedcomtree.graph.GraphBuilder;
import com.gedcomtree.graph.LayoutEngine;
import com.gedcomtree.model.GraphLink;
import com.gedcomtree.model.GraphNode;
import com.gedcomtree.model.GraphStats;
import com.gedcomtree.model.TreeGraph;
import com.gedcomtree.parser.GedcomParser;
import com.gedcomtree.service.GedcomTreeService.GedcomSourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Pipeline tests against the three-generation fixture.
 *
 *     George Hartley (I1) ─┬─ Edith Moss (I2)
 *                          │
 *              ┌───────────┴───────────┐
 *              │                       │
 *     Frank Hartley (I3) ─┬─ Irene   Joan Hartley (I4)
 *                         │  (I5)
 *                  ┌──────┴──────┐
 *                  │             │
 *          Peter Hartley (I6)   @I99@ (missing)
 */
class GedcomTreeServiceTest {

    private static final String FIXTURE = "classpath:gedcom/three-generations.ged";

    private GedcomProperties properties;
    private GedcomTreeService service;

    @BeforeEach
    void setUp() {
        properties = new GedcomProperties();
        properties.setSampleDocument(FIXTURE);
        service = newService(new DefaultResourceLoader());
    }

    private GedcomTreeService newService(ResourceLoader resourceLoader) {
        return new GedcomTreeService(
                new GedcomParser(),
                new GraphBuilder(),
                new GenerationAssigner(),
                new LayoutEngine(),
                resourceLoader,
                properties);
    }

    private TreeGraph fixtureGraph() {
        return service.buildSampleTree();
    }

    private GraphNode node(TreeGraph graph, String id) {
        return graph.nodes().stream().filter(n -> n.getId().equals(id)).findFirst().orElseThrow();
    }

    @Nested
    @DisplayName("buildTree")
    class BuildTree {

        @Test
        void returnsEmptyGraphForEmptyContent() {
            TreeGraph graph = service.buildTree("");

            assertThat(graph.nodes()).isEmpty();
            assertThat(graph.links()).isEmpty();
            assertThat(graph.stats()).isEqualTo(GraphStats.empty());
        }

        @Test
        void returnsEmptyGraphForNullContent() {
            assertThat(service.buildTree(null).nodes()).isEmpty();
        }

        @Test
        void assignsGenerations() {
            TreeGraph graph = fixtureGraph();

            assertThat(node(graph, "@I1@").getGeneration()).isZero();
            assertThat(node(graph, "@I2@").getGeneration()).isZero();
            assertThat(node(graph, "@I5@").getGeneration()).isZero();
            assertThat(node(graph, "@I3@").getGeneration()).isEqualTo(1);
            assertThat(node(graph, "@I4@").getGeneration()).isEqualTo(1);
            assertThat(node(graph, "@I6@").getGeneration()).isEqualTo(2);
        }

        @Test
        void minimumGenerationIsZero() {
            TreeGraph graph = fixtureGraph();

            assertThat(graph.nodes()).extracting(GraphNode::getGeneration).contains(0).allMatch(g -> g >= 0);
        }

        @Test
        void reportsStats() {
            GraphStats stats = fixtureGraph().stats();

            assertThat(stats.individuals()).isEqualTo(6);
            assertThat(stats.families()).isEqualTo(2);
            assertThat(stats.connections()).isEqualTo(8);
            assertThat(stats.generations()).isEqualTo(3);
            assertThat(stats.droppedReferences()).isEqualTo(1);
            assertThat(stats.summary()).isEqualTo("6 individuals | 8 connections");
        }

        @Test
        void linksOnlyResolvedPeople() {
            TreeGraph graph = fixtureGraph();

            assertThat(graph.links()).extracting(GraphLink::target).doesNotContain("@I99@");
            assertThat(graph.links()).filteredOn(GraphLink::isMarriage)
                    .extracting(GraphLink::familyId)
                    .containsExactly("@F1@", "@F2@");
        }

        @Test
        void exposesAlternateNames() {
            TreeGraph graph = fixtureGraph();

            assertThat(node(graph, "@I2@").getAlternateNames()).containsExactly("Edie Hartley");
            assertThat(node(graph, "@I1@").getAlternateNames()).isEmpty();
        }

        @Test
        void sameContentGivesSameGraph() {
            String content = service.readSampleDocument();

            TreeGraph first = service.buildTree(content);
            TreeGraph second = service.buildTree(content);

            assertThat(second.links()).isEqualTo(first.links());
            assertThat(second.nodes()).hasSameSizeAs(first.nodes());
            for (GraphNode node : first.nodes()) {
                GraphNode other = node(second, node.getId());
                assertThat(other).isNotSameAs(node);
                assertThat(other.getGeneration()).isEqualTo(node.getGeneration());
                assertThat(other.getX()).isEqualTo(node.getX());
                assertThat(other.getY()).isEqualTo(node.getY());
            }
        }
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        void matchesIgnoringCase() {
            TreeGraph graph = fixtureGraph();

            assertThat(service.search(graph, "hartley")).extracting(GraphNode::getId)
                    .containsExactly("@I1@", "@I3@", "@I4@", "@I6@");
            assertThat(service.search(graph, "  EDITH ")).extracting(GraphNode::getId)
                    .containsExactly("@I2@");
        }

        @Test
        void blankQueryMatchesEveryone() {
            TreeGraph graph = fixtureGraph();

            assertThat(service.search(graph, " ")).hasSize(6);
            assertThat(service.search(graph, null)).hasSize(6);
        }

        @Test
        void noMatchGivesEmptyList() {
            assertThat(service.search(fixtureGraph(), "Nobody")).isEmpty();
        }
    }

    @Nested
    @DisplayName("sample document")
    class SampleDocument {

        @Test
        void failsWhenSampleMissing() {
            properties.setSampleDocument("classpath:gedcom/does-not-exist.ged");

            assertThatThrownBy(() -> service.buildSampleTree())
                    .isInstanceOf(GedcomSourceException.class)
                    .hasMessageContaining("does-not-exist.ged");
        }

        @Test
        void wrapsReadFailure() throws IOException {
            Resource resource = mock(Resource.class);
            when(resource.exists()).thenReturn(true);
            when(resource.getInputStream()).thenThrow(new IOException("disk gone"));
            ResourceLoader loader = mock(ResourceLoader.class);
            when(loader.getResource(FIXTURE)).thenReturn(resource);

            GedcomTreeService failing = newService(loader);

            assertThatThrownBy(failing::buildSampleTree)
                    .isInstanceOf(GedcomSourceException.class)
                    .hasCauseInstanceOf(IOException.class);
        }
    }
}
