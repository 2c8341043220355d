package com.vidnyan.flowchart.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.flowchart.domain.render.FlowchartRenderer;
import com.vidnyan.flowchart.domain.select.FieldResolver;
import com.vidnyan.flowchart.domain.translate.FlowchartTranslator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the flowchart components.
 * The domain classes carry no framework annotations and are wired here.
 */
@Configuration
public class FlowchartConfiguration {

    /**
     * ObjectMapper for embedding DSL text into documents.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public FlowchartTranslator flowchartTranslator() {
        return new FlowchartTranslator();
    }

    @Bean
    public FieldResolver fieldResolver() {
        return new FieldResolver();
    }

    @Bean
    public FlowchartRenderer flowchartRenderer() {
        return new FlowchartRenderer();
    }
}
