package com.vidnyan.flowchart.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.flowchart.FlowchartProperties;
import com.vidnyan.flowchart.adapter.out.html.HtmlDocumentExporter;
import com.vidnyan.flowchart.adapter.out.parser.AntlrPythonParser;
import com.vidnyan.flowchart.application.service.FlowchartApplicationService;
import com.vidnyan.flowchart.domain.render.FlowchartRenderer;
import com.vidnyan.flowchart.domain.select.FieldResolver;
import com.vidnyan.flowchart.domain.translate.FlowchartTranslator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FlowchartCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine commandLine;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() {
        FlowchartProperties properties = new FlowchartProperties();
        HtmlDocumentExporter exporter = new HtmlDocumentExporter(new ObjectMapper(), properties);
        exporter.loadTemplate();
        FlowchartApplicationService service = new FlowchartApplicationService(new AntlrPythonParser(), exporter,
                new FlowchartTranslator(), new FieldResolver(), new FlowchartRenderer(), properties);
        FlowchartCliRunner runner = new FlowchartCliRunner(new FlowchartCommand(service, properties));

        commandLine = runner.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void execute_ShouldPrintDslNamedAfterTheFile() throws IOException {
        // Arrange
        Path source = write("greet.py", "name = input()\nprint('hi', name)\n");

        // Act
        int exitCode = commandLine.execute(source.toString());

        // Assert
        assertEquals(0, exitCode);
        assertEquals("""
                st0=>start: start greet
                io1=>inputoutput: input: name
                sub2=>subroutine: print('hi', name)
                e3=>end: end greet

                st0->io1
                io1->sub2
                sub2->e3
                """, out.toString());
    }

    @Test
    void execute_WithFieldAndSwitches_ShouldSelectAndExpand() throws IOException {
        // Arrange
        Path source = write("shapes.py", """
                class Shape:
                    def area(self, scale):
                        if scale:
                            self.w *= scale
                        return self.w * self.h
                """);

        // Act
        int collapsed = commandLine.execute(source.toString(), "-f", "Shape.area");
        String single = out.toString();
        out.getBuffer().setLength(0);
        int expanded = commandLine.execute(source.toString(), "--field", "Shape.area", "--inner", "--no-simplify");

        // Assert
        assertEquals(0, collapsed);
        assertEquals("sub0=>subroutine: area(self, scale)\n\n", single);
        assertEquals(0, expanded);
        assertTrue(out.toString().contains("cond2=>condition: if scale\n"), out.toString());
    }

    @Test
    void execute_ShouldMapFailuresToExitCodes() throws IOException {
        // Arrange
        Path broken = write("broken.py", "def f(:\n    pass\n");
        Path loose = write("loose.py", "continue\n");
        Path fine = write("fine.py", "def f():\n    pass\n");

        // Act & Assert
        assertEquals(FlowchartCliRunner.EXIT_SYNTAX, commandLine.execute(broken.toString()));
        assertEquals(FlowchartCliRunner.EXIT_SCOPE, commandLine.execute(loose.toString()));
        assertEquals(FlowchartCliRunner.EXIT_SELECTION, commandLine.execute(fine.toString(), "-f", "g"));
        assertEquals(FlowchartCliRunner.EXIT_FAILURE, commandLine.execute(tempDir.resolve("absent.py").toString()));
        assertEquals(2, commandLine.execute());
        assertTrue(err.toString().contains("error: no such file: "), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    void execute_HtmlOutput_ShouldWriteDocument() throws IOException {
        // Arrange
        Path source = write("loop.py", "for i in range(3):\n    print(i)\n");
        Path target = tempDir.resolve("loop.html");

        // Act
        int exitCode = commandLine.execute(source.toString(), "-o", target.toString());

        // Assert
        assertEquals(0, exitCode);
        String html = Files.readString(target);
        assertTrue(html.contains("<title>loop</title>"));
        assertTrue(html.contains("print(i) while i in range(3)"));
        assertEquals("", out.toString());
    }

    @Test
    void execute_ShouldReadLatin1AndByteOrderMarks() throws IOException {
        // Arrange
        Path latin = tempDir.resolve("latin.py");
        Files.write(latin, "x = 'café'\n".getBytes(StandardCharsets.ISO_8859_1));
        Path bom = tempDir.resolve("bom.py");
        Files.write(bom, "\uFEFFy = 1\n".getBytes(StandardCharsets.UTF_8));

        // Act
        int latinExit = commandLine.execute(latin.toString());
        int bomExit = commandLine.execute(bom.toString());

        // Assert
        assertEquals(0, latinExit);
        assertEquals(0, bomExit);
        assertTrue(out.toString().contains("op1=>operation: x = 'café'\n"), out.toString());
        assertTrue(out.toString().contains("op1=>operation: y = 1\n"), out.toString());
    }

    @Test
    void commandArguments_ShouldDropSpringProperties() {
        assertArrayEquals(new String[] {"a.py", "-f", "foo"},
                FlowchartCliRunner.commandArguments("a.py", "--flowchart.simplify=false", "-f", "foo",
                        "--logging.level.root=DEBUG"));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
