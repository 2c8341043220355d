package com.vidnyan.flowchart.adapter.in.cli;

import com.vidnyan.flowchart.FlowchartProperties;
import com.vidnyan.flowchart.application.port.in.GenerateFlowchartUseCase;
import com.vidnyan.flowchart.application.port.in.GenerateFlowchartUseCase.Format;
import com.vidnyan.flowchart.application.port.in.GenerateFlowchartUseCase.GenerationRequest;
import com.vidnyan.flowchart.application.port.in.GenerateFlowchartUseCase.GenerationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command line entry point: translates one Python file and prints the flowchart.js DSL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Command(
    name = "python-flowchart",
    mixinStandardHelpOptions = true,
    version = "python-flowchart 0.1.0",
    description = "Translate Python source code into flowchart.js diagram code"
)
public class FlowchartCommand implements Callable<Integer> {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final GenerateFlowchartUseCase generateFlowchartUseCase;
    private final FlowchartProperties properties;

    @Spec
    private CommandSpec spec;

    @Parameters(paramLabel = "<file>", description = "Python source file")
    private Path file;

    @Option(names = {"-f", "--field"}, paramLabel = "<path>", defaultValue = "",
        description = "Dotted path of the function or class to draw, e.g. Bar.buzz (default: whole program)")
    private String field;

    @Option(names = {"-i", "--inner"}, description = "Draw the body of the selected field instead of a single node")
    private boolean inner;

    @Option(names = "--no-simplify", description = "Keep one-line if and loop statements as conditions")
    private boolean noSimplify;

    @Option(names = "--conds-align", description = "Align consecutive if statements")
    private boolean condsAlign;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>",
        description = "Write to a file; .html and .htm produce a page that draws the chart")
    private Path output;

    @Option(names = "--encoding", paramLabel = "<charset>",
        description = "Source encoding (default: UTF-8, falling back to ISO-8859-1)")
    private Charset encoding;

    @Override
    public Integer call() throws IOException {
        Format format = output != null && isDocument(output) ? Format.HTML : Format.DSL;
        GenerationRequest request = GenerationRequest.builder()
                .source(readSource(file))
                .field(field)
                .inner(inner)
                .simplify(!noSimplify && properties.isSimplify())
                .alignConsecutiveConditions(condsAlign || properties.isCondsAlign())
                .moduleName(moduleNameOf(file))
                .format(format)
                .build();

        GenerationResult result = generateFlowchartUseCase.generate(request);

        if (output == null) {
            spec.commandLine().getOut().print(result.content());
            spec.commandLine().getOut().flush();
        } else {
            Files.writeString(output, result.content(), StandardCharsets.UTF_8);
            log.info("Wrote {} ({} nodes) to {}", format, result.stats().nodeCount(), output);
        }
        return 0;
    }

    private String readSource(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        String text;
        if (encoding != null) {
            text = new String(bytes, encoding);
        } else {
            try {
                text = StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
            } catch (CharacterCodingException e) {
                log.warn("{} is not valid UTF-8, reading it as ISO-8859-1", path);
                text = new String(bytes, StandardCharsets.ISO_8859_1);
            }
        }
        return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
    }

    private boolean isDocument(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return properties.getDocumentExtensions().stream().anyMatch(extension::equalsIgnoreCase);
    }

    private static String moduleNameOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
