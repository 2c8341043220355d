package com.vidnyan.flowchart.adapter.out.html;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.flowchart.FlowchartProperties;
import com.vidnyan.flowchart.application.port.out.DocumentExporter;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Standalone HTML page that draws the flowchart with flowchart.js.
 * The page template is loaded once from the classpath.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HtmlDocumentExporter implements DocumentExporter {

    static final String TITLE_PLACEHOLDER = "{{TITLE}}";
    static final String DSL_PLACEHOLDER = "{{DSL}}";

    private final ObjectMapper objectMapper;
    private final FlowchartProperties properties;

    private String template;

    @PostConstruct
    public void loadTemplate() {
        ClassPathResource resource = new ClassPathResource(properties.getTemplate());
        try {
            template = resource.getContentAsString(StandardCharsets.UTF_8);
            log.debug("Loaded document template from {}", properties.getTemplate());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load document template " + properties.getTemplate(), e);
        }
    }

    @Override
    public String export(String dsl, String title) {
        String literal;
        try {
            literal = objectMapper.writeValueAsString(dsl);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot encode flowchart for embedding", e);
        }
        return template
                .replace(TITLE_PLACEHOLDER, escape(title))
                // a literal "</script>" inside the DSL must not close the script element
                .replace(DSL_PLACEHOLDER, literal.replace("</", "<\\/"));
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
