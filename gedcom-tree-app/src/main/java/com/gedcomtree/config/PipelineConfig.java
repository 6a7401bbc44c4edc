package com.gedcomtree.config;

import com.gedcomtree.graph.GenerationAssigner;
import com.gedcomtree.graph.GraphBuilder;
import com.gedcomtree.graph.LayoutEngine;
import com.gedcomtree.parser.GedcomParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    @Bean
    public GedcomParser gedcomParser() {
        return new GedcomParser();
    }

    @Bean
    public GraphBuilder graphBuilder() {
        return new GraphBuilder();
    }

    @Bean
    public GenerationAssigner generationAssigner(GedcomProperties properties) {
        GedcomProperties.Generation generation = properties.getGeneration();
        return new GenerationAssigner(generation.getFallbackBaseYear(), generation.getFallbackYearsPerGeneration());
    }

    @Bean
    public LayoutEngine layoutEngine(GedcomProperties properties) {
        GedcomProperties.Layout layout = properties.getLayout();
        return new LayoutEngine(
                layout.getHorizontalSpacing(),
                layout.getVerticalSpacing(),
                layout.getRefinementPasses(),
                layout.getParentRetainWeight());
    }
}
