package com.vidnyan.flowchart.application.service;

import com.vidnyan.flowchart.FlowchartProperties;
import com.vidnyan.flowchart.application.port.in.GenerateFlowchartUseCase;
import com.vidnyan.flowchart.application.port.out.DocumentExporter;
import com.vidnyan.flowchart.application.port.out.SourceCodeParser;
import com.vidnyan.flowchart.domain.flow.Flowchart;
import com.vidnyan.flowchart.domain.render.FlowchartRenderer;
import com.vidnyan.flowchart.domain.select.FieldResolver;
import com.vidnyan.flowchart.domain.syntax.Module;
import com.vidnyan.flowchart.domain.syntax.Stmt;
import com.vidnyan.flowchart.domain.translate.FlowchartTranslator;
import com.vidnyan.flowchart.domain.translate.TranslationOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application service that orchestrates the generation workflow.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowchartApplicationService implements GenerateFlowchartUseCase {

    private final SourceCodeParser sourceCodeParser;
    private final DocumentExporter documentExporter;
    private final FlowchartTranslator translator;
    private final FieldResolver fieldResolver;
    private final FlowchartRenderer renderer;
    private final FlowchartProperties properties;

    @Override
    public GenerationResult generate(GenerationRequest request) {
        Instant startTime = Instant.now();
        TranslationOptions options = optionsFor(request);

        // Step 1: Parse source code
        log.info("Step 1: Parsing source code...");
        Module module = sourceCodeParser.parse(request.source());
        log.info("Parsed {} top-level statements", module.body().size());

        // Step 2 and 3: Select the field and build the graph
        Flowchart flowchart;
        if (FieldResolver.isWholeProgram(request.field())) {
            log.info("Step 2: Selecting whole program");
            log.info("Step 3: Building flowchart...");
            flowchart = translator.translateModule(module, options);
        } else {
            log.info("Step 2: Selecting field '{}'", request.field());
            Stmt.Definition definition = fieldResolver.resolve(module, request.field());
            log.info("Step 3: Building flowchart (inner={})...", request.effectiveInner());
            flowchart = translator.translateDefinition(definition, request.effectiveInner(), options);
        }
        Flowchart.Stats graphStats = flowchart.stats();
        log.info("Built: {} nodes, {} edges", graphStats.nodeCount(), graphStats.edgeCount());
        if (graphStats.approximateLabels() > 0) {
            log.info("{} labels are best-effort renderings of the source", graphStats.approximateLabels());
        }

        // Step 4: Render
        log.info("Step 4: Rendering {}...", request.format());
        String dsl = renderer.render(flowchart);
        String content = request.format() == Format.HTML
                ? documentExporter.export(dsl, titleOf(request, options))
                : dsl;

        Duration totalDuration = Duration.between(startTime, Instant.now());
        GenerationStats stats = new GenerationStats(
                graphStats.nodeCount(),
                graphStats.edgeCount(),
                graphStats.approximateLabels(),
                totalDuration.toMillis()
        );
        log.info("Generation complete in {}ms", stats.durationMs());

        return new GenerationResult(content, request.format(), stats);
    }

    private TranslationOptions optionsFor(GenerationRequest request) {
        TranslationOptions.Builder builder = properties.toTranslationOptions().toBuilder()
                .simplify(request.simplify())
                .alignConsecutiveConditions(request.alignConsecutiveConditions());
        if (request.moduleName() != null && !request.moduleName().isBlank()) {
            builder.moduleName(request.moduleName());
        }
        return builder.build();
    }

    private static String titleOf(GenerationRequest request, TranslationOptions options) {
        return FieldResolver.isWholeProgram(request.field()) ? options.moduleName() : request.field();
    }
}
