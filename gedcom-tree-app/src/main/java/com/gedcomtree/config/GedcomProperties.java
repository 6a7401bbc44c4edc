package com.gedcomtree.config;

import com.gedcomtree.graph.GenerationAssigner;
import com.gedcomtree.graph.LayoutEngine;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Layout and generation tunables, plus the bundled sample document.
 * Set them in application.yml under 'gedcom'.
 */
@Configuration
@ConfigurationProperties(prefix = "gedcom")
public class GedcomProperties {

    private String sampleDocument = "classpath:gedcom/sample.ged";
    private Layout layout = new Layout();
    private Generation generation = new Generation();

    public String getSampleDocument() { return sampleDocument; }
    public void setSampleDocument(String sampleDocument) { this.sampleDocument = sampleDocument; }

    public Layout getLayout() { return layout; }
    public void setLayout(Layout layout) { this.layout = layout; }

    public Generation getGeneration() { return generation; }
    public void setGeneration(Generation generation) { this.generation = generation; }

    public static class Layout {
        private double horizontalSpacing = LayoutEngine.DEFAULT_HORIZONTAL_SPACING;
        private double verticalSpacing = LayoutEngine.DEFAULT_VERTICAL_SPACING;
        private int refinementPasses = LayoutEngine.DEFAULT_REFINEMENT_PASSES;
        private double parentRetainWeight = LayoutEngine.DEFAULT_PARENT_RETAIN_WEIGHT;

        public double getHorizontalSpacing() { return horizontalSpacing; }
        public void setHorizontalSpacing(double horizontalSpacing) { this.horizontalSpacing = horizontalSpacing; }

        public double getVerticalSpacing() { return verticalSpacing; }
        public void setVerticalSpacing(double verticalSpacing) { this.verticalSpacing = verticalSpacing; }

        public int getRefinementPasses() { return refinementPasses; }
        public void setRefinementPasses(int refinementPasses) { this.refinementPasses = refinementPasses; }

        public double getParentRetainWeight() { return parentRetainWeight; }
        public void setParentRetainWeight(double parentRetainWeight) { this.parentRetainWeight = parentRetainWeight; }
    }

    /**
     * Birth-year estimate for people not connected to any root:
     * floor((year - fallbackBaseYear) / fallbackYearsPerGeneration).
     */
    public static class Generation {
        private int fallbackBaseYear = GenerationAssigner.DEFAULT_BASE_YEAR;
        private int fallbackYearsPerGeneration = GenerationAssigner.DEFAULT_YEARS_PER_GENERATION;

        public int getFallbackBaseYear() { return fallbackBaseYear; }
        public void setFallbackBaseYear(int fallbackBaseYear) { this.fallbackBaseYear = fallbackBaseYear; }

        public int getFallbackYearsPerGeneration() { return fallbackYearsPerGeneration; }
        public void setFallbackYearsPerGeneration(int fallbackYearsPerGeneration) {
            this.fallbackYearsPerGeneration = fallbackYearsPerGeneration;
        }
    }
}
