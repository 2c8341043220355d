package com.vidnyan.flowchart.domain.translate;

import com.vidnyan.flowchart.domain.flow.Node;
import com.vidnyan.flowchart.domain.flow.NodeKind;
import com.vidnyan.flowchart.domain.syntax.SourceUnparser;
import com.vidnyan.flowchart.domain.syntax.SourceUnparser.Unparsed;
import com.vidnyan.flowchart.domain.syntax.Stmt;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Collapses a one-statement {@code if} (no else, no elif chain) or loop into a single
 * operation node, e.g. {@code print(a) if a == 1} or {@code a = a + 1 while a < 4}.
 * <p>
 * Runs before the condition node would be created, so the collapsed nodes never
 * consume ids.
 */
@Slf4j
public class Simplifier {

    private final NodeLabeler labeler;

    public Simplifier(NodeLabeler labeler) {
        this.labeler = labeler;
    }

    /**
     * Returns the synthesized node, or null when the conditional must stay a condition.
     */
    public Node simplifyIf(Stmt.If stmt, TranslationContext context) {
        if (!context.options().simplify() || !stmt.orElse().isEmpty() || stmt.elif()) {
            return null;
        }
        NodeSpec action = singleAction(stmt.body());
        if (action == null) {
            return null;
        }
        Unparsed guard = SourceUnparser.expression(stmt.test());
        return synthesize(context, action, " if ", guard);
    }

    /**
     * Returns the synthesized node, or null when the loop must stay a condition.
     */
    public Node simplifyLoop(Stmt loop, List<Stmt> body, List<Stmt> orElse, TranslationContext context) {
        if (!context.options().simplify() || !orElse.isEmpty()) {
            return null;
        }
        NodeSpec action = singleAction(body);
        if (action == null) {
            return null;
        }
        Unparsed header = SourceUnparser.statement(loop);
        return synthesize(context, action, " while ", new Unparsed(guardOf(header.text()), header.approximate()));
    }

    private NodeSpec singleAction(List<Stmt> body) {
        return body.size() == 1 ? labeler.describe(body.get(0)) : null;
    }

    private Node synthesize(TranslationContext context, NodeSpec action, String joiner, Unparsed guard) {
        String text = action.text() + joiner + guard.text();
        log.debug("Simplified to '{}'", text);
        return context.createNode(NodeKind.OPERATION, text, action.approximate() || guard.approximate());
    }

    /** Loop header without its keyword: {@code for i in x} becomes {@code i in x}. */
    static String guardOf(String header) {
        for (String keyword : List.of("async for ", "for ", "while ")) {
            if (header.startsWith(keyword)) {
                return header.substring(keyword.length());
            }
        }
        return header;
    }
}
