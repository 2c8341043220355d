package com.vidnyan.flowchart.domain.translate;

import com.vidnyan.flowchart.adapter.out.parser.AntlrPythonParser;
import com.vidnyan.flowchart.domain.flow.Flowchart;
import com.vidnyan.flowchart.domain.flow.Node;
import com.vidnyan.flowchart.domain.flow.NodeKind;
import com.vidnyan.flowchart.domain.syntax.Module;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimplifierTest {

    private static final String PROGRAM = """
            a = 1
            if a == 1:
                print(a)
            while a < 4:
                a = a + 1
            """;

    private final AntlrPythonParser parser = new AntlrPythonParser();
    private final FlowchartTranslator translator = new FlowchartTranslator();

    @Test
    void simplify_ShouldCollapseOneLineIfAndLoop() {
        // Arrange
        Module module = parser.parse(PROGRAM);

        // Act
        Flowchart flowchart = translator.translateModule(module, TranslationOptions.defaults());

        // Assert
        List<String> texts = flowchart.nodes().stream().map(Node::text).toList();
        assertEquals(List.of("start main", "a = 1", "print(a) if a == 1", "a = a + 1 while a < 4", "end main"), texts);
        assertTrue(flowchart.nodesOfKind(NodeKind.CONDITION).isEmpty());
    }

    @Test
    void simplify_ShouldRemoveTwoNodesAndKeepTheEnd() {
        // Arrange
        Module module = parser.parse(PROGRAM);

        // Act
        Flowchart simplified = translator.translateModule(module, TranslationOptions.defaults());
        Flowchart full = translator.translateModule(module, TranslationOptions.builder().simplify(false).build());

        // Assert
        assertEquals(full.size() - 2, simplified.size());
        assertEquals(full.nodesOfKind(NodeKind.END).size(), simplified.nodesOfKind(NodeKind.END).size());
        assertEquals(full.nodesOfKind(NodeKind.END).get(0).text(), simplified.nodesOfKind(NodeKind.END).get(0).text());
    }

    @Test
    void simplify_ShouldKeepConditionsWithElseOrSeveralStatements() {
        // Arrange
        Module module = parser.parse("""
                if a:
                    x()
                else:
                    y()
                for i in items:
                    x()
                    y()
                while busy:
                    pass
                else:
                    done()
                """);

        // Act
        Flowchart flowchart = translator.translateModule(module, TranslationOptions.defaults());

        // Assert
        assertEquals(3, flowchart.nodesOfKind(NodeKind.CONDITION).size());
    }

    @Test
    void simplify_ForLoop_ShouldUseHeaderWithoutKeyword() {
        // Arrange
        Module module = parser.parse("for i in range(3):\n    total += i\n");

        // Act
        Flowchart flowchart = translator.translateModule(module, TranslationOptions.defaults());

        // Assert
        assertEquals("total += i while i in range(3)", flowchart.nodes().get(1).text());
        assertEquals(NodeKind.OPERATION, flowchart.nodes().get(1).kind());
    }

    @Test
    void guardOf_ShouldStripLoopKeywords() {
        assertEquals("x in y", Simplifier.guardOf("for x in y"));
        assertEquals("x in y", Simplifier.guardOf("async for x in y"));
        assertEquals("n > 0", Simplifier.guardOf("while n > 0"));
    }
}
