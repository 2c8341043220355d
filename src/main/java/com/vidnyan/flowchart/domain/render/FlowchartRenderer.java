package com.vidnyan.flowchart.domain.render;

import com.vidnyan.flowchart.domain.flow.Edge;
import com.vidnyan.flowchart.domain.flow.Flowchart;
import com.vidnyan.flowchart.domain.flow.Node;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Serializes a flowchart into flowchart.js DSL: node declarations in creation order,
 * an empty line, then the edges of each node in the same order.
 * <pre>
 * st0=>start: start foo
 * cond1(align-next=no)=>condition: if a
 *
 * st0->cond1
 * cond1(yes)->op2
 * cond1(no,right)->
 * </pre>
 */
public class FlowchartRenderer {

    public String render(Flowchart flowchart) {
        StringBuilder out = new StringBuilder();
        for (Node node : flowchart.nodes()) {
            declaration(out, node);
        }
        out.append('\n');
        for (Node node : flowchart.nodes()) {
            connections(out, node);
        }
        return out.toString();
    }

    private void declaration(StringBuilder out, Node node) {
        out.append(node.name());
        Map<String, String> params = node.params();
        if (!params.isEmpty()) {
            out.append(params.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(",", "(", ")")));
        }
        out.append("=>").append(node.kind().dslType()).append(": ").append(node.text()).append('\n');
    }

    private void connections(StringBuilder out, Node node) {
        if (node.isCondition()) {
            branch(out, node, Edge.Branch.YES);
            branch(out, node, Edge.Branch.NO);
            return;
        }
        Edge edge = node.next();
        if (edge == null) {
            return;
        }
        out.append(node.name());
        if (edge.direction() != null) {
            out.append('(').append(edge.direction().dsl()).append(')');
        }
        out.append("->").append(edge.target().name()).append('\n');
    }

    private void branch(StringBuilder out, Node condition, Edge.Branch branch) {
        Edge edge = condition.branch(branch);
        out.append(condition.name()).append('(').append(branch.dsl());
        if (edge != null && edge.direction() != null) {
            out.append(',').append(edge.direction().dsl());
        }
        out.append(")->");
        if (edge != null && edge.target() != null) {
            out.append(edge.target().name());
        }
        out.append('\n');
    }
}
