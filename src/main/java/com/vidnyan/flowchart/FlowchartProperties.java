package com.vidnyan.flowchart;

import com.vidnyan.flowchart.domain.flow.Direction;
import com.vidnyan.flowchart.domain.translate.TranslationOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Configuration properties for flowchart generation.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "flowchart")
public class FlowchartProperties {

    /**
     * Collapse one-line if and loop statements.
     * Default: true
     */
    private boolean simplify = true;

    /**
     * Emit align-next=no between consecutive if statements.
     * Default: false
     */
    private boolean condsAlign = false;

    /**
     * Name on the start and end nodes of a whole-program flowchart.
     */
    private String moduleName = "main";

    /**
     * Functions whose calls become input nodes.
     */
    private List<String> inputFunctions = new ArrayList<>(List.of("input"));

    /**
     * Functions whose calls become output nodes. Empty keeps print() a subroutine.
     */
    private List<String> outputFunctions = new ArrayList<>();

    /**
     * Side that loop back-edges leave from: left, right, top or bottom.
     */
    private String backEdgeDirection = "left";

    /**
     * Output file suffixes that produce an HTML document instead of DSL text.
     */
    private List<String> documentExtensions = new ArrayList<>(List.of("html", "htm"));

    /**
     * Classpath location of the HTML document template.
     */
    private String template = "templates/flowchart.html";

    /**
     * Translation options with the configured defaults.
     */
    public TranslationOptions toTranslationOptions() {
        return TranslationOptions.builder()
                .simplify(simplify)
                .alignConsecutiveConditions(condsAlign)
                .moduleName(moduleName)
                .inputFunctions(new LinkedHashSet<>(inputFunctions))
                .outputFunctions(new LinkedHashSet<>(outputFunctions))
                .backEdgeDirection(Direction.parse(backEdgeDirection))
                .build();
    }
}
