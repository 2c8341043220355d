package com.vidnyan.flowchart.domain.translate;

import com.vidnyan.flowchart.adapter.out.parser.AntlrPythonParser;
import com.vidnyan.flowchart.domain.flow.Edge;
import com.vidnyan.flowchart.domain.flow.Flowchart;
import com.vidnyan.flowchart.domain.flow.Node;
import com.vidnyan.flowchart.domain.flow.NodeKind;
import com.vidnyan.flowchart.domain.render.FlowchartRenderer;
import com.vidnyan.flowchart.domain.syntax.Module;
import com.vidnyan.flowchart.domain.syntax.Stmt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlowchartTranslatorTest {

    private static final TranslationOptions NO_SIMPLIFY = TranslationOptions.builder().simplify(false).build();

    private final AntlrPythonParser parser = new AntlrPythonParser();
    private final FlowchartTranslator translator = new FlowchartTranslator();
    private final FlowchartRenderer renderer = new FlowchartRenderer();

    @Test
    void translateDefinition_ShouldDrawIfElseLoopAndReturn() {
        // Arrange
        Module module = parser.parse("""
                def foo(a, b):
                    if a:
                        print("a")
                    else:
                        for i in range(3):
                            print("b")
                    return a + b
                """);

        // Act
        Flowchart flowchart = translator.translateDefinition(definition(module, 0), true, NO_SIMPLIFY);

        // Assert
        assertEquals("""
                st0=>start: start foo
                io1=>inputoutput: input: a, b
                cond2=>condition: if a
                sub3=>subroutine: print('a')
                cond4=>condition: for i in range(3)
                sub5=>subroutine: print('b')
                io6=>inputoutput: output: a + b
                e7=>end: end foo

                st0->io1
                io1->cond2
                cond2(yes)->sub3
                cond2(no)->cond4
                sub3->io6
                cond4(yes)->sub5
                cond4(no)->io6
                sub5(left)->cond4
                io6->e7
                """, renderer.render(flowchart));
    }

    @Test
    void translateModule_ShouldFrameProgramWithStartAndEnd() {
        // Arrange
        Module module = parser.parse("x = input('x? ')\ny = x * 2\n");
        TranslationOptions options = TranslationOptions.builder().moduleName("calc").build();

        // Act
        Flowchart flowchart = translator.translateModule(module, options);

        // Assert
        assertEquals("""
                st0=>start: start calc
                io1=>inputoutput: input: x
                op2=>operation: y = x * 2
                e3=>end: end calc

                st0->io1
                io1->op2
                op2->e3
                """, renderer.render(flowchart));
    }

    @Test
    void translateModule_EmptyProgram_ShouldConnectStartToEnd() {
        // Act
        Flowchart flowchart = translator.translateModule(new Module(List.of()), TranslationOptions.defaults());

        // Assert
        assertEquals(2, flowchart.size());
        assertSame(flowchart.nodes().get(1), flowchart.head().next().target());
    }

    @Test
    void translateModule_BreakAndContinue_ShouldLeaveOrReenterTheLoop() {
        // Arrange
        Module module = parser.parse("""
                while x:
                    if y:
                        break
                    if z:
                        continue
                    step()
                """);

        // Act
        String dsl = renderer.render(translator.translateModule(module, NO_SIMPLIFY));

        // Assert
        assertTrue(dsl.contains("cond1=>condition: while x\n"), dsl);
        assertTrue(dsl.contains("cond2(yes)->e5\n"), dsl);
        assertTrue(dsl.contains("cond3(yes,left)->cond1\n"), dsl);
        assertTrue(dsl.contains("sub4(left)->cond1\n"), dsl);
        assertTrue(dsl.contains("cond1(no)->e5\n"), dsl);
    }

    @Test
    void translateModule_BreakOutsideLoop_ShouldFail() {
        // Arrange
        Module module = parser.parse("x = 1\nbreak\n");

        // Act & Assert
        ScopeException error = assertThrows(ScopeException.class,
                () -> translator.translateModule(module, TranslationOptions.defaults()));
        assertEquals("break", error.keyword());
    }

    @Test
    void translateDefinition_ContinueOutsideLoop_ShouldFail() {
        // Arrange
        Module module = parser.parse("def f():\n    continue\n");

        // Act & Assert
        assertThrows(ScopeException.class,
                () -> translator.translateDefinition(definition(module, 0), true, TranslationOptions.defaults()));
    }

    @Test
    void translateDefinition_ShouldShareOneEndBetweenReturns() {
        // Arrange
        Module module = parser.parse("""
                def f(x):
                    if x:
                        return 1
                    return 2
                """);

        // Act
        Flowchart flowchart = translator.translateDefinition(definition(module, 0), true, TranslationOptions.defaults());

        // Assert
        List<Node> ends = flowchart.nodesOfKind(NodeKind.END);
        assertEquals(1, ends.size());
        List<Node> outputs = flowchart.nodesOfKind(NodeKind.INPUT_OUTPUT).stream()
                .filter(n -> n.text().startsWith("output: "))
                .toList();
        assertEquals(2, outputs.size());
        outputs.forEach(output -> assertSame(ends.get(0), output.next().target()));
    }

    @Test
    void translateDefinition_NotInner_ShouldDrawSingleNode() {
        // Arrange
        Module module = parser.parse("""
                def foo(a, *args, key=None, **kw):
                    pass

                class Bar(Base):
                    pass
                """);

        // Act
        Flowchart function = translator.translateDefinition(definition(module, 0), false, TranslationOptions.defaults());
        Flowchart type = translator.translateDefinition(definition(module, 1), false, TranslationOptions.defaults());

        // Assert
        assertEquals("sub0=>subroutine: foo(a, *args, key=None, **kw)\n\n", renderer.render(function));
        assertEquals("op0=>operation: class Bar(Base)\n\n", renderer.render(type));
    }

    @Test
    void translateModule_ShouldSkipNestedDefinitions() {
        // Arrange
        Module module = parser.parse("""
                def helper():
                    return 1

                class Point:
                    x = 0

                total = helper()
                """);

        // Act
        Flowchart flowchart = translator.translateModule(module, TranslationOptions.defaults());

        // Assert
        assertEquals(3, flowchart.size());
        assertEquals("total = helper()", flowchart.nodes().get(1).text());
    }

    @Test
    void translateModule_TryAndWith_ShouldInlineBodies() {
        // Arrange
        Module module = parser.parse("""
                try:
                    a()
                except ValueError:
                    b()
                finally:
                    c()
                with open(p) as fh:
                    d(fh)
                """);

        // Act
        Flowchart flowchart = translator.translateModule(module, TranslationOptions.defaults());

        // Assert
        List<String> texts = flowchart.nodes().stream().map(Node::text).toList();
        assertEquals(List.of("start main", "a()", "c()", "with open(p) as fh", "d(fh)", "end main"), texts);
        assertEquals(NodeKind.OPERATION, flowchart.nodes().get(3).kind());
    }

    @Test
    void translateModule_ElifChain_ShouldNestConditionsOnTheNoBranch() {
        // Arrange
        Module module = parser.parse("""
                if a:
                    x()
                elif b:
                    y()
                else:
                    z()
                """);

        // Act
        Flowchart flowchart = translator.translateModule(module, TranslationOptions.defaults());

        // Assert
        List<Node> conditions = flowchart.nodesOfKind(NodeKind.CONDITION);
        assertEquals(2, conditions.size());
        assertSame(conditions.get(1), conditions.get(0).branch(Edge.Branch.NO).target());
    }

    @Test
    void translateModule_ConsecutiveIfs_ShouldAlignWhenRequested() {
        // Arrange
        Module module = parser.parse("""
                if a:
                    x = 1
                    y = 1
                if b:
                    y = 2
                    z = 2
                """);
        TranslationOptions aligned = TranslationOptions.builder().alignConsecutiveConditions(true).build();

        // Act
        Flowchart withAlign = translator.translateModule(module, aligned);
        Flowchart withoutAlign = translator.translateModule(module, TranslationOptions.defaults());

        // Assert
        List<Node> conditions = withAlign.nodesOfKind(NodeKind.CONDITION);
        assertEquals("no", conditions.get(0).params().get("align-next"));
        assertTrue(conditions.get(1).params().isEmpty());
        assertTrue(withoutAlign.nodesOfKind(NodeKind.CONDITION).get(0).params().isEmpty());
    }

    @Test
    void translateModule_ShouldNumberNodesWithoutGaps() {
        // Arrange
        Module module = parser.parse("""
                a = 1
                if a == 1:
                    print(a)
                while a < 4:
                    a = a + 1
                for i in range(a):
                    if i:
                        break
                """);

        // Act
        Flowchart flowchart = translator.translateModule(module, TranslationOptions.defaults());

        // Assert
        for (int i = 0; i < flowchart.size(); i++) {
            assertEquals(i, flowchart.nodes().get(i).id());
        }
        flowchart.nodesOfKind(NodeKind.CONDITION).forEach(condition -> {
            assertNotNull(condition.branch(Edge.Branch.YES));
            assertNotNull(condition.branch(Edge.Branch.NO));
        });
    }

    @Test
    void translateModule_IsNotGuard_ShouldKeepOperatorWhole() {
        // Arrange
        Module module = parser.parse("""
                while x is not None:
                    print(x)
                    x = x.next
                if x is not None: y = 1
                """);

        // Act
        Flowchart flowchart = translator.translateModule(module, TranslationOptions.defaults());

        // Assert
        List<Node> conditions = flowchart.nodesOfKind(NodeKind.CONDITION);
        assertEquals(1, conditions.size());
        assertEquals("while x is not None", conditions.get(0).text());
        assertTrue(flowchart.nodes().stream().anyMatch(node -> "y = 1 if x is not None".equals(node.text())));
    }

    @Test
    void translateModule_ConditionalExpression_ShouldStayInOneOperation() {
        // Act
        Flowchart flowchart = translator.translateModule(parser.parse("x = a if c else b\n"),
                TranslationOptions.defaults());

        // Assert
        assertEquals(3, flowchart.size());
        assertTrue(flowchart.nodesOfKind(NodeKind.CONDITION).isEmpty());
        assertEquals("x = a if c else b", flowchart.nodes().get(1).text());
    }

    private static Stmt.Definition definition(Module module, int index) {
        return (Stmt.Definition) module.body().get(index);
    }
}
