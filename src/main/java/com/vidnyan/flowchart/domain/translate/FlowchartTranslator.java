package com.vidnyan.flowchart.domain.translate;

import com.vidnyan.flowchart.domain.flow.Flowchart;
import com.vidnyan.flowchart.domain.flow.Node;
import com.vidnyan.flowchart.domain.flow.NodeKind;
import com.vidnyan.flowchart.domain.flow.PendingJoins;
import com.vidnyan.flowchart.domain.syntax.Module;
import com.vidnyan.flowchart.domain.syntax.SourceUnparser;
import com.vidnyan.flowchart.domain.syntax.SourceUnparser.Unparsed;
import com.vidnyan.flowchart.domain.syntax.Stmt;

import java.util.List;

/**
 * Builds the flowchart of a whole module or of one selected definition.
 * Every call runs with a fresh {@link TranslationContext}, so instances are stateless.
 */
public class FlowchartTranslator {

    /**
     * Whole program: start node, module body, and an implicit end closing the sequence.
     */
    public Flowchart translateModule(Module module, TranslationOptions options) {
        TranslationContext context = new TranslationContext(options);
        context.enterScope(options.moduleName());
        Node start = context.createNode(NodeKind.START, "start " + options.moduleName(), false);
        return finish(context, module.body(), start);
    }

    /**
     * Selected definition. With {@code inner} its body is expanded between a start and
     * an end node, otherwise the definition becomes a single node.
     */
    public Flowchart translateDefinition(Stmt.Definition definition, boolean inner, TranslationOptions options) {
        TranslationContext context = new TranslationContext(options);
        context.enterScope(definition.name());
        if (!inner) {
            opaque(definition, context);
            return context.flowchart();
        }

        Node start = context.createNode(NodeKind.START, "start " + definition.name(), false);
        if (definition instanceof Stmt.FunctionDef function) {
            String input = NodeLabeler.parameterInput(function.params());
            if (input != null) {
                context.setTail(PendingJoins.after(start));
                Node args = context.createNode(NodeKind.INPUT_OUTPUT, input, false);
                context.attach(args);
                return finish(context, definition.body(), args);
            }
        }
        return finish(context, definition.body(), start);
    }

    private Flowchart finish(TranslationContext context, List<Stmt> body, Node entry) {
        GraphBuilder builder = new GraphBuilder(context);
        PendingJoins tails = builder.translateBlock(body, PendingJoins.after(entry)).tails();
        tails.connectTo(context.scope().end());
        return context.flowchart();
    }

    private void opaque(Stmt.Definition definition, TranslationContext context) {
        Unparsed header = SourceUnparser.statement(definition);
        if (definition instanceof Stmt.FunctionDef) {
            String call = header.text().replaceFirst("^(async )?def ", "");
            context.createNode(NodeKind.SUBROUTINE, call, header.approximate());
        } else {
            context.createNode(NodeKind.OPERATION, header.text(), header.approximate());
        }
    }
}
