package com.vidnyan.flowchart.adapter.out.parser;

import com.vidnyan.flowchart.domain.syntax.Expr;
import com.vidnyan.flowchart.domain.syntax.Module;
import com.vidnyan.flowchart.domain.syntax.Parameter;
import com.vidnyan.flowchart.domain.syntax.SourceSyntaxException;
import com.vidnyan.flowchart.domain.syntax.Stmt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AntlrPythonParserTest {

    private final AntlrPythonParser parser = new AntlrPythonParser();

    @Test
    void parse_ShouldFollowIndentation() {
        // Arrange
        String source = """
                def outer(a):
                    x = 1

                    # comment between statements
                    if a:
                        y = 2
                    z = 3
                done = True
                """;

        // Act
        Module module = parser.parse(source);

        // Assert
        assertEquals(2, module.body().size());
        Stmt.FunctionDef outer = (Stmt.FunctionDef) module.body().get(0);
        assertEquals(3, outer.body().size());
        Stmt.If condition = (Stmt.If) outer.body().get(1);
        assertEquals(1, condition.body().size());
        assertInstanceOf(Stmt.Assign.class, module.body().get(1));
    }

    @Test
    void parse_ShouldHandleMissingTrailingNewlineAndBrackets() {
        // Arrange
        String source = "total = sum([\n    1,\n    2,\n])\nprint(total)";

        // Act
        Module module = parser.parse(source);

        // Assert
        assertEquals(2, module.body().size());
    }

    @Test
    void parse_ShouldSplitSemicolonsAndOneLineBlocks() {
        // Act
        Module module = parser.parse("a = 1; b = 2\nwhile a: a -= 1\n");

        // Assert
        assertEquals(3, module.body().size());
        Stmt.While loop = (Stmt.While) module.body().get(2);
        assertInstanceOf(Stmt.AugAssign.class, loop.body().get(0));
        assertEquals("-", ((Stmt.AugAssign) loop.body().get(0)).op());
    }

    @Test
    void parse_ShouldChainElifIntoElseBlocks() {
        // Act
        Module module = parser.parse("""
                if a:
                    pass
                elif b:
                    pass
                elif c:
                    pass
                else:
                    pass
                """);

        // Assert
        Stmt.If first = (Stmt.If) module.body().get(0);
        assertFalse(first.elif());
        assertTrue(first.hasElifChain());
        Stmt.If second = (Stmt.If) first.orElse().get(0);
        Stmt.If third = (Stmt.If) second.orElse().get(0);
        assertTrue(second.elif());
        assertTrue(third.elif());
        assertInstanceOf(Stmt.Pass.class, third.orElse().get(0));
    }

    @Test
    void parse_ShouldReadParameterKinds() {
        // Act
        Stmt.FunctionDef function = (Stmt.FunctionDef) parser.parse(
                "@cache\ndef f(a, /, b: int = 2, *args, c, **kw):\n    pass\n").body().get(0);

        // Assert
        List<Parameter.Kind> kinds = function.params().stream().map(Parameter::kind).toList();
        assertEquals(List.of(Parameter.Kind.REGULAR, Parameter.Kind.POSITIONAL_ONLY_MARKER, Parameter.Kind.REGULAR,
                Parameter.Kind.VAR_POSITIONAL, Parameter.Kind.REGULAR, Parameter.Kind.VAR_KEYWORD), kinds);
        assertEquals(1, function.decorators().size());
        assertEquals(new Expr.Constant("2"), function.params().get(2).defaultValue());
    }

    @Test
    void parse_ShouldDecodeStringEscapes() {
        // Act
        Stmt.ExprStmt stmt = (Stmt.ExprStmt) parser.parse("'tab\\there' '\\x41\\u00e9' r'\\n'\n").body().get(0);

        // Assert
        assertEquals(new Expr.StringLiteral("tab\there" + "Aé" + "\\n", false), stmt.value());
    }

    @Test
    void parse_ShouldFlattenComparisonChains() {
        // Act
        Stmt.ExprStmt stmt = (Stmt.ExprStmt) parser.parse("0 <= i < n\n").body().get(0);

        // Assert
        Expr.Compare compare = (Expr.Compare) stmt.value();
        assertEquals(List.of("<=", "<"), compare.ops());
        assertEquals(new Expr.Name("n"), compare.comparators().get(1));
    }

    @Test
    void parse_IsNot_ShouldBeOneComparisonOperator() {
        // Act
        Stmt.ExprStmt isNot = (Stmt.ExprStmt) parser.parse("a is not None\n").body().get(0);
        Stmt.ExprStmt is = (Stmt.ExprStmt) parser.parse("a is b\n").body().get(0);

        // Assert
        Expr.Compare compare = (Expr.Compare) isNot.value();
        assertEquals(List.of("is not"), compare.ops());
        assertFalse(compare.comparators().get(0) instanceof Expr.UnaryOp);
        assertEquals(List.of("is"), ((Expr.Compare) is.value()).ops());
    }

    @Test
    void parse_ShouldReadTryAndWith() {
        // Act
        Module module = parser.parse("""
                try:
                    risky()
                except (KeyError, ValueError) as e:
                    handle(e)
                else:
                    ok()
                finally:
                    close()
                async def main():
                    async with session() as s:
                        pass
                """);

        // Assert
        Stmt.Try attempt = (Stmt.Try) module.body().get(0);
        assertEquals(1, attempt.handlers().size());
        assertEquals("e", attempt.handlers().get(0).name());
        assertEquals(1, attempt.orElse().size());
        assertEquals(1, attempt.finalBody().size());
        Stmt.FunctionDef main = (Stmt.FunctionDef) module.body().get(1);
        assertTrue(main.async());
        assertTrue(((Stmt.With) main.body().get(0)).async());
    }

    @Test
    void parse_MalformedSource_ShouldReportLine() {
        // Act & Assert
        SourceSyntaxException error = assertThrows(SourceSyntaxException.class,
                () -> parser.parse("x = 1\nif x y:\n    pass\n"));
        assertEquals(2, error.line());
    }

    @Test
    void parse_BadIndentation_ShouldFail() {
        assertThrows(SourceSyntaxException.class, () -> parser.parse("x = 1\n    y = 2\n"));
    }

    @Test
    void parse_DedentToUnknownLevel_ShouldFail() {
        // Act & Assert
        SourceSyntaxException error = assertThrows(SourceSyntaxException.class,
                () -> parser.parse("if a:\n        b()\n    c()\n"));
        assertEquals(3, error.line());
    }
}
