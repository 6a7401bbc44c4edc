package com.gedcomtree.graph;

import com.gedcomtree.model.GraphNode;
import com.gedcomtree.model.LifeEvent;
import com.gedcomtree.parser.GedcomParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationAssignerTest {

    private GedcomParser parser;
    private GraphBuilder graphBuilder;
    private GenerationAssigner assigner;

    @BeforeEach
    void setUp() {
        parser = new GedcomParser();
        graphBuilder = new GraphBuilder();
        assigner = new GenerationAssigner();
    }

    private LayoutContext build(String content) {
        return graphBuilder.build(parser.parse(content));
    }

    @Nested
    @DisplayName("traversal")
    class Traversal {

        @Test
        void childIsOneBelowParent() {
            LayoutContext context = build("""
                0 @I1@ INDI
                1 BIRT
                2 DATE 1 JAN 1900
                1 FAMS @F1@
                0 @I2@ INDI
                1 FAMC @F1@
                0 @F1@ FAM
                1 HUSB @I1@
                1 CHIL @I2@
                """);

            Map<String, Integer> generations = assigner.assign(context);

            assertThat(generations).containsEntry("@I1@", 0).containsEntry("@I2@", 1);
            assertThat(context.node("@I1@").getGeneration()).isZero();
            assertThat(context.node("@I2@").getGeneration()).isEqualTo(1);
        }

        @Test
        void keepsDeepestGenerationAcrossPaths() {
            /*
             *        R
             *      ┌─┴─┐
             *      A   B
             *      │   │
             *      │   C
             *      └─┬─┘
             *        X      reachable via R-A-X (2) and R-B-C-X (3)
             */
            LayoutContext context = build("""
                0 @R@ INDI
                0 @A@ INDI
                0 @B@ INDI
                0 @C@ INDI
                0 @X@ INDI
                0 @F1@ FAM
                1 HUSB @R@
                1 CHIL @A@
                1 CHIL @B@
                0 @F2@ FAM
                1 HUSB @B@
                1 CHIL @C@
                0 @F3@ FAM
                1 HUSB @A@
                1 WIFE @C@
                1 CHIL @X@
                """);

            Map<String, Integer> generations = assigner.assign(context);

            assertThat(generations).containsEntry("@R@", 0)
                    .containsEntry("@A@", 1)
                    .containsEntry("@B@", 1)
                    .containsEntry("@C@", 2)
                    .containsEntry("@X@", 3);
        }

        @Test
        void marriedInSpouseWithoutParentsIsRoot() {
            LayoutContext context = build("""
                0 @I1@ INDI
                0 @I2@ INDI
                0 @I3@ INDI
                0 @F1@ FAM
                1 HUSB @I1@
                1 CHIL @I2@
                0 @F2@ FAM
                1 HUSB @I2@
                1 WIFE @I3@
                """);

            Map<String, Integer> generations = assigner.assign(context);

            assertThat(generations).containsEntry("@I2@", 1).containsEntry("@I3@", 0);
        }

        @Test
        void terminatesOnCycleReachableFromRoot() {
            LayoutContext context = build("""
                0 @R@ INDI
                0 @A@ INDI
                0 @B@ INDI
                0 @F1@ FAM
                1 HUSB @R@
                1 CHIL @A@
                0 @F2@ FAM
                1 HUSB @A@
                1 CHIL @B@
                0 @F3@ FAM
                1 HUSB @B@
                1 CHIL @A@
                """);

            Map<String, Integer> generations = assigner.assign(context);

            assertThat(generations).hasSize(3);
            assertThat(generations.values()).allMatch(g -> g >= 0 && g <= 3);
            assertThat(generations).containsEntry("@R@", 0);
        }

        @Test
        void handlesEmptyGraph() {
            assertThat(assigner.assign(build(""))).isEmpty();
        }
    }

    @Nested
    @DisplayName("birth-year fallback")
    class Fallback {

        @Test
        void estimatesUnreachedNodesFromBirthYear() {
            // A and B are each other's parents, so neither is a root
            LayoutContext context = build("""
                0 @R@ INDI
                0 @A@ INDI
                1 BIRT
                2 DATE 1900
                0 @B@ INDI
                1 BIRT
                2 DATE ABT 1930
                0 @F1@ FAM
                1 HUSB @A@
                1 CHIL @B@
                0 @F2@ FAM
                1 HUSB @B@
                1 CHIL @A@
                """);

            Map<String, Integer> generations = assigner.assign(context);

            assertThat(generations).containsEntry("@R@", 0)
                    .containsEntry("@A@", 30)
                    .containsEntry("@B@", 31);
        }

        @Test
        void normalizesSoMinimumIsZero() {
            LayoutContext context = build("""
                0 @A@ INDI
                1 BIRT
                2 DATE 1900
                0 @B@ INDI
                1 BIRT
                2 DATE 1930
                0 @F1@ FAM
                1 HUSB @A@
                1 CHIL @B@
                0 @F2@ FAM
                1 HUSB @B@
                1 CHIL @A@
                """);

            Map<String, Integer> generations = assigner.assign(context);

            assertThat(generations).containsEntry("@A@", 0).containsEntry("@B@", 1);
            assertThat(context.nodes()).extracting(GraphNode::getGeneration).containsExactly(0, 1);
        }

        @Test
        void estimatesFromFirstThreeOrFourDigitYear() {
            assertThat(assigner.estimateFromBirth(event("12 MAY 1850"))).isEqualTo(28);
            assertThat(assigner.estimateFromBirth(event("BET 1600 AND 1610"))).isEqualTo(20);
            assertThat(assigner.estimateFromBirth(event("1029"))).isZero();
        }

        @Test
        void floorsEarlyYearsAtZero() {
            assertThat(assigner.estimateFromBirth(event("850"))).isZero();
        }

        @Test
        void defaultsToZeroWithoutYear() {
            assertThat(assigner.estimateFromBirth(null)).isZero();
            assertThat(assigner.estimateFromBirth(event(""))).isZero();
            assertThat(assigner.estimateFromBirth(event("12 MAY"))).isZero();
            assertThat(assigner.estimateFromBirth(event("19850101"))).isZero();
        }

        @Test
        void usesConfiguredConstants() {
            GenerationAssigner tuned = new GenerationAssigner(1800, 25);

            assertThat(tuned.estimateFromBirth(event("1900"))).isEqualTo(4);
        }

        @Test
        void rejectsNonPositiveYearsPerGeneration() {
            assertThatThrownBy(() -> new GenerationAssigner(1000, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        private LifeEvent event(String date) {
            LifeEvent event = new LifeEvent();
            event.setDate(date);
            return event;
        }
    }
}
