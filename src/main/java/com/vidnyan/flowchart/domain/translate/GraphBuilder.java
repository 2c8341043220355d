package com.vidnyan.flowchart.domain.translate;

import com.vidnyan.flowchart.domain.flow.Edge.Branch;
import com.vidnyan.flowchart.domain.flow.Node;
import com.vidnyan.flowchart.domain.flow.NodeKind;
import com.vidnyan.flowchart.domain.flow.PendingJoins;
import com.vidnyan.flowchart.domain.flow.PendingJoins.Slot;
import com.vidnyan.flowchart.domain.syntax.SourceUnparser;
import com.vidnyan.flowchart.domain.syntax.SourceUnparser.Unparsed;
import com.vidnyan.flowchart.domain.syntax.Stmt;
import com.vidnyan.flowchart.domain.syntax.StmtVisitor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Walks statement blocks and wires flowchart nodes, threading the context's
 * current tail from one statement to the next.
 * <p>
 * Each statement connects from the tail it finds and leaves the tail its
 * successor must attach from. Branches fan in through {@link PendingJoins};
 * loop bodies connect back to their condition.
 */
@Slf4j
public class GraphBuilder implements StmtVisitor<Void> {

    static final String ALIGN_NEXT = "align-next";

    private final TranslationContext context;
    private final NodeLabeler labeler;
    private final Simplifier simplifier;

    /** Condition created by the most recently translated {@code if}; null when simplified. */
    private Node lastIfCondition;

    public GraphBuilder(TranslationContext context) {
        this.context = context;
        this.labeler = new NodeLabeler(context.options());
        this.simplifier = new Simplifier(labeler);
    }

    /**
     * Translates a block entered from the given slots.
     * @return the block's first node and the slots left for its successor
     */
    public Fragment translateBlock(List<Stmt> body, PendingJoins entry) {
        int before = context.flowchart().size();
        PendingJoins tails = walk(body, entry);
        Node head = context.flowchart().size() > before ? context.flowchart().nodes().get(before) : null;
        return new Fragment(head, tails);
    }

    PendingJoins walk(List<Stmt> body, PendingJoins entry) {
        context.setTail(entry);
        Node previousCondition = null;
        for (Stmt stmt : body) {
            if (previousCondition != null && stmt instanceof Stmt.If
                    && context.options().alignConsecutiveConditions()) {
                previousCondition.setParam(ALIGN_NEXT, "no");
            }
            lastIfCondition = null;
            stmt.accept(this);
            previousCondition = stmt instanceof Stmt.If ? lastIfCondition : null;
        }
        return context.tail();
    }

    private Void simple(Stmt stmt) {
        NodeSpec spec = labeler.describe(stmt);
        if (spec.approximate()) {
            log.debug("Approximate label for {}: '{}'", stmt.getClass().getSimpleName(), spec.text());
        }
        context.attach(context.createNode(spec));
        return null;
    }

    private Node condition(Stmt header) {
        Unparsed text = SourceUnparser.statement(header);
        Node condition = context.createNode(NodeKind.CONDITION, text.text(), text.approximate());
        context.attach(condition);
        return condition;
    }

    private void loop(Stmt header, List<Stmt> body, List<Stmt> orElse) {
        Node simplified = simplifier.simplifyLoop(header, body, orElse, context);
        if (simplified != null) {
            context.attach(simplified);
            return;
        }

        Node condition = condition(header);
        TranslationContext.LoopFrame frame = context.enterLoop(condition);
        PendingJoins bodyTails = walk(body, PendingJoins.of(Slot.branch(condition, Branch.YES)));
        bodyTails.connectTo(condition, context.options().backEdgeDirection());
        context.exitLoop();

        PendingJoins exit = PendingJoins.of(Slot.branch(condition, Branch.NO));
        if (!orElse.isEmpty()) {
            exit = walk(orElse, exit);
        }
        context.setTail(exit.addAll(frame.breaks()));
    }

    private TranslationContext.LoopFrame enclosingLoop(String keyword) {
        TranslationContext.LoopFrame frame = context.innermostLoop();
        if (frame == null) {
            throw new ScopeException(keyword, context.scope().name());
        }
        return frame;
    }

    @Override
    public Void visitExprStmt(Stmt.ExprStmt stmt) {
        return simple(stmt);
    }

    @Override
    public Void visitAssign(Stmt.Assign stmt) {
        return simple(stmt);
    }

    @Override
    public Void visitAugAssign(Stmt.AugAssign stmt) {
        return simple(stmt);
    }

    @Override
    public Void visitAnnAssign(Stmt.AnnAssign stmt) {
        return simple(stmt);
    }

    @Override
    public Void visitPass(Stmt.Pass stmt) {
        return simple(stmt);
    }

    @Override
    public Void visitBreak(Stmt.Break stmt) {
        TranslationContext.LoopFrame frame = enclosingLoop("break");
        frame.breaks().addAll(context.tail());
        context.setTail(PendingJoins.empty());
        return null;
    }

    @Override
    public Void visitContinue(Stmt.Continue stmt) {
        TranslationContext.LoopFrame frame = enclosingLoop("continue");
        context.tail().connectTo(frame.condition(), context.options().backEdgeDirection());
        context.setTail(PendingJoins.empty());
        return null;
    }

    @Override
    public Void visitReturn(Stmt.Return stmt) {
        if (stmt.value() != null) {
            Unparsed value = SourceUnparser.expression(stmt.value());
            context.attach(context.createNode(NodeKind.INPUT_OUTPUT,
                    NodeLabeler.OUTPUT_PREFIX + value.text(), value.approximate()));
        }
        context.tail().connectTo(context.scope().end());
        context.setTail(PendingJoins.empty());
        return null;
    }

    @Override
    public Void visitRaise(Stmt.Raise stmt) {
        return simple(stmt);
    }

    @Override
    public Void visitScopeDeclaration(Stmt.ScopeDeclaration stmt) {
        return simple(stmt);
    }

    @Override
    public Void visitDelete(Stmt.Delete stmt) {
        return simple(stmt);
    }

    @Override
    public Void visitAssert(Stmt.Assert stmt) {
        return simple(stmt);
    }

    @Override
    public Void visitImport(Stmt.Import stmt) {
        return simple(stmt);
    }

    @Override
    public Void visitIf(Stmt.If stmt) {
        Node simplified = simplifier.simplifyIf(stmt, context);
        if (simplified != null) {
            context.attach(simplified);
            return null;
        }

        Node condition = condition(stmt);
        PendingJoins yes = walk(stmt.body(), PendingJoins.of(Slot.branch(condition, Branch.YES)));
        PendingJoins no = PendingJoins.of(Slot.branch(condition, Branch.NO));
        if (!stmt.orElse().isEmpty()) {
            no = walk(stmt.orElse(), no);
        }
        context.setTail(yes.addAll(no));
        lastIfCondition = condition;
        return null;
    }

    @Override
    public Void visitWhile(Stmt.While stmt) {
        loop(stmt, stmt.body(), stmt.orElse());
        return null;
    }

    @Override
    public Void visitFor(Stmt.For stmt) {
        loop(stmt, stmt.body(), stmt.orElse());
        return null;
    }

    @Override
    public Void visitTry(Stmt.Try stmt) {
        if (!stmt.handlers().isEmpty()) {
            log.debug("Leaving {} except handler(s) out of the normal flow", stmt.handlers().size());
        }
        walk(stmt.body(), context.tail());
        walk(stmt.orElse(), context.tail());
        walk(stmt.finalBody(), context.tail());
        return null;
    }

    @Override
    public Void visitWith(Stmt.With stmt) {
        Unparsed header = SourceUnparser.statement(stmt);
        context.attach(context.createNode(NodeKind.OPERATION, header.text(), header.approximate()));
        walk(stmt.body(), context.tail());
        return null;
    }

    @Override
    public Void visitFunctionDef(Stmt.FunctionDef stmt) {
        log.debug("Skipping nested function '{}'", stmt.name());
        return null;
    }

    @Override
    public Void visitClassDef(Stmt.ClassDef stmt) {
        log.debug("Skipping nested class '{}'", stmt.name());
        return null;
    }

    @Override
    public Void visitUnsupported(Stmt.Unsupported stmt) {
        return simple(stmt);
    }
}
