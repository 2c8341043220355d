package com.vidnyan.flowchart.domain.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One flowchart node. Kind, id and text are fixed at creation; edges and
 * display parameters are wired afterwards by the graph builder.
 * <p>
 * A condition owns a {@code yes} and a {@code no} edge, every other kind at most
 * one unlabelled edge.
 */
public final class Node {

    private final int id;
    private final NodeKind kind;
    private final String text;
    private final boolean approximate;
    private final Map<String, String> params = new LinkedHashMap<>();

    private Edge next;
    private Edge yes;
    private Edge no;

    public Node(int id, NodeKind kind, String text, boolean approximate) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.approximate = approximate;
    }

    public int id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public String text() {
        return text;
    }

    /** True when the text is a best-effort rendering of the source. */
    public boolean approximate() {
        return approximate;
    }

    /** Name used in the DSL, e.g. {@code cond3}. */
    public String name() {
        return kind.namePrefix() + id;
    }

    public boolean isCondition() {
        return kind == NodeKind.CONDITION;
    }

    public Map<String, String> params() {
        return Collections.unmodifiableMap(params);
    }

    /**
     * Sets a display parameter. A key keeps the position of its first insertion.
     */
    public void setParam(String key, String value) {
        if (key == null || key.isEmpty() || value == null || value.isEmpty()) {
            return;
        }
        params.put(key, value);
    }

    /** Connects this node to its single successor, replacing any previous edge. */
    public void connect(Node target, Direction direction) {
        if (isCondition()) {
            throw new IllegalStateException("Condition " + name() + " needs a yes/no branch to connect");
        }
        this.next = new Edge(target, direction);
    }

    public void connect(Node target) {
        connect(target, null);
    }

    /** Connects one branch of this condition. */
    public void connectBranch(Edge.Branch branch, Node target, Direction direction) {
        if (!isCondition()) {
            throw new IllegalStateException("Only conditions have branches, " + name() + " is " + kind);
        }
        Edge edge = new Edge(target, direction);
        if (branch == Edge.Branch.YES) {
            this.yes = edge;
        } else {
            this.no = edge;
        }
    }

    /** Unlabelled edge of a non-condition node, or null. */
    public Edge next() {
        return next;
    }

    /** Branch edge of a condition node, or null when unset. */
    public Edge branch(Edge.Branch branch) {
        return branch == Edge.Branch.YES ? yes : no;
    }

    @Override
    public String toString() {
        return name() + "[" + text + "]";
    }
}
