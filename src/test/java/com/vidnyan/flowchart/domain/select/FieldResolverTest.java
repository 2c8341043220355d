package com.vidnyan.flowchart.domain.select;

import com.vidnyan.flowchart.adapter.out.parser.AntlrPythonParser;
import com.vidnyan.flowchart.domain.flow.Flowchart;
import com.vidnyan.flowchart.domain.flow.NodeKind;
import com.vidnyan.flowchart.domain.syntax.Module;
import com.vidnyan.flowchart.domain.syntax.Stmt;
import com.vidnyan.flowchart.domain.translate.FlowchartTranslator;
import com.vidnyan.flowchart.domain.translate.TranslationOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldResolverTest {

    private static final String PROGRAM = """
            def foo(a, b):
                return a + b

            class Bar(Base):
                def buzz(self, c):
                    def g(self):
                        pass
                    return g

                def buzz(self):
                    def g(self):
                        print('second')
                    return g
            """;

    private final FieldResolver resolver = new FieldResolver();
    private Module module;

    @BeforeEach
    void setUp() {
        module = new AntlrPythonParser().parse(PROGRAM);
    }

    @Test
    void resolve_ShouldWalkNestedDefinitions() {
        // Act
        Stmt.Definition definition = resolver.resolve(module, "Bar.buzz.g");
        Flowchart flowchart = new FlowchartTranslator().translateDefinition(definition, true, TranslationOptions.defaults());

        // Assert
        assertEquals("g", definition.name());
        assertEquals("start g", flowchart.head().text());
        assertEquals(NodeKind.INPUT_OUTPUT, flowchart.nodes().get(1).kind());
        assertEquals("input: self", flowchart.nodes().get(1).text());
    }

    @Test
    void resolve_ShouldPreferTheLastDefinitionOfAName() {
        // Act
        Stmt.FunctionDef buzz = (Stmt.FunctionDef) resolver.resolve(module, "Bar.buzz");

        // Assert
        assertEquals(1, buzz.params().size());
    }

    @Test
    void resolve_UnknownSegment_ShouldFail() {
        // Act & Assert
        SelectionException error = assertThrows(SelectionException.class,
                () -> resolver.resolve(module, "Bar.nonexistent"));
        assertEquals("nonexistent", error.segment());
        assertEquals("Bar.nonexistent", error.path());
    }

    @Test
    void resolve_EmptySegment_ShouldFail() {
        assertThrows(SelectionException.class, () -> resolver.resolve(module, "Bar..g"));
        assertThrows(SelectionException.class, () -> resolver.resolve(module, "foo."));
    }

    @Test
    void isWholeProgram_ShouldAcceptBlankPaths() {
        assertTrue(FieldResolver.isWholeProgram(null));
        assertTrue(FieldResolver.isWholeProgram(" "));
        assertFalse(FieldResolver.isWholeProgram("foo"));
    }
}
