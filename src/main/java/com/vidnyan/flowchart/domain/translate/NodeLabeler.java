package com.vidnyan.flowchart.domain.translate;

import com.vidnyan.flowchart.domain.flow.NodeKind;
import com.vidnyan.flowchart.domain.syntax.Expr;
import com.vidnyan.flowchart.domain.syntax.Parameter;
import com.vidnyan.flowchart.domain.syntax.SourceUnparser;
import com.vidnyan.flowchart.domain.syntax.SourceUnparser.Unparsed;
import com.vidnyan.flowchart.domain.syntax.Stmt;
import com.vidnyan.flowchart.domain.syntax.StmtVisitor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides kind and text of the node for a simple statement.
 * Statements that do not map to exactly one node with a plain successor
 * (control transfers, compound statements, definitions) describe to null.
 */
public class NodeLabeler implements StmtVisitor<NodeSpec> {

    static final String INPUT_PREFIX = "input: ";
    static final String OUTPUT_PREFIX = "output: ";

    private final TranslationOptions options;

    public NodeLabeler(TranslationOptions options) {
        this.options = options;
    }

    public NodeSpec describe(Stmt stmt) {
        return stmt.accept(this);
    }

    /** Input label for a definition's parameters, or null when it takes none. */
    public static String parameterInput(List<Parameter> params) {
        String names = params.stream()
                .filter(p -> !p.isMarker())
                .map(Parameter::displayName)
                .collect(Collectors.joining(", "));
        return names.isEmpty() ? null : INPUT_PREFIX + names;
    }

    private static NodeSpec operation(Stmt stmt) {
        Unparsed text = SourceUnparser.statement(stmt);
        return new NodeSpec(NodeKind.OPERATION, text.text(), text.approximate());
    }

    private boolean isInputCall(Expr expr) {
        return expr instanceof Expr.Call call && call.calleeName() != null
                && options.inputFunctions().contains(call.calleeName());
    }

    @Override
    public NodeSpec visitExprStmt(Stmt.ExprStmt stmt) {
        Expr value = stmt.value();
        if (value instanceof Expr.Call call) {
            String callee = call.calleeName();
            if (callee != null && options.inputFunctions().contains(callee)) {
                Unparsed text = SourceUnparser.expression(call);
                return new NodeSpec(NodeKind.INPUT_OUTPUT, INPUT_PREFIX + text.text(), text.approximate());
            }
            if (callee != null && options.outputFunctions().contains(callee)) {
                Unparsed text = SourceUnparser.arguments(call.args());
                return new NodeSpec(NodeKind.INPUT_OUTPUT, OUTPUT_PREFIX + text.text(), text.approximate());
            }
            Unparsed text = SourceUnparser.expression(call);
            return new NodeSpec(NodeKind.SUBROUTINE, text.text(), text.approximate());
        }
        if (value instanceof Expr.Yield) {
            Unparsed text = SourceUnparser.statement(stmt);
            return new NodeSpec(NodeKind.INPUT_OUTPUT, OUTPUT_PREFIX + text.text(), text.approximate());
        }
        return operation(stmt);
    }

    @Override
    public NodeSpec visitAssign(Stmt.Assign stmt) {
        if (stmt.targets().size() == 1 && isInputCall(stmt.value())) {
            Unparsed target = SourceUnparser.expression(stmt.targets().get(0));
            return new NodeSpec(NodeKind.INPUT_OUTPUT, INPUT_PREFIX + target.text(), target.approximate());
        }
        return operation(stmt);
    }

    @Override
    public NodeSpec visitAugAssign(Stmt.AugAssign stmt) {
        return operation(stmt);
    }

    @Override
    public NodeSpec visitAnnAssign(Stmt.AnnAssign stmt) {
        return operation(stmt);
    }

    @Override
    public NodeSpec visitPass(Stmt.Pass stmt) {
        return operation(stmt);
    }

    @Override
    public NodeSpec visitBreak(Stmt.Break stmt) {
        return null;
    }

    @Override
    public NodeSpec visitContinue(Stmt.Continue stmt) {
        return null;
    }

    @Override
    public NodeSpec visitReturn(Stmt.Return stmt) {
        return null;
    }

    @Override
    public NodeSpec visitRaise(Stmt.Raise stmt) {
        return operation(stmt);
    }

    @Override
    public NodeSpec visitScopeDeclaration(Stmt.ScopeDeclaration stmt) {
        return operation(stmt);
    }

    @Override
    public NodeSpec visitDelete(Stmt.Delete stmt) {
        return operation(stmt);
    }

    @Override
    public NodeSpec visitAssert(Stmt.Assert stmt) {
        return operation(stmt);
    }

    @Override
    public NodeSpec visitImport(Stmt.Import stmt) {
        return operation(stmt);
    }

    @Override
    public NodeSpec visitIf(Stmt.If stmt) {
        return null;
    }

    @Override
    public NodeSpec visitWhile(Stmt.While stmt) {
        return null;
    }

    @Override
    public NodeSpec visitFor(Stmt.For stmt) {
        return null;
    }

    @Override
    public NodeSpec visitTry(Stmt.Try stmt) {
        return null;
    }

    @Override
    public NodeSpec visitWith(Stmt.With stmt) {
        return null;
    }

    @Override
    public NodeSpec visitFunctionDef(Stmt.FunctionDef stmt) {
        return null;
    }

    @Override
    public NodeSpec visitClassDef(Stmt.ClassDef stmt) {
        return null;
    }

    @Override
    public NodeSpec visitUnsupported(Stmt.Unsupported stmt) {
        return new NodeSpec(NodeKind.OPERATION, stmt.text(), true);
    }
}
