package com.vidnyan.flowchart.domain.translate;

import com.vidnyan.flowchart.domain.flow.Flowchart;
import com.vidnyan.flowchart.domain.flow.Node;
import com.vidnyan.flowchart.domain.flow.NodeKind;
import com.vidnyan.flowchart.domain.flow.PendingJoins;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * State of one translation run: the id counter, the graph under construction,
 * the current tail, the enclosing loops and the current definition scope.
 * Created per run and discarded afterwards.
 */
public final class TranslationContext {

    private final TranslationOptions options;
    private final Flowchart flowchart = new Flowchart();
    private final Deque<LoopFrame> loops = new ArrayDeque<>();

    private int nextId;
    private PendingJoins tail = PendingJoins.empty();
    private Scope scope;

    public TranslationContext(TranslationOptions options) {
        this.options = options;
    }

    public TranslationOptions options() {
        return options;
    }

    public Flowchart flowchart() {
        return flowchart;
    }

    /** Creates a node with the next id and registers it with the graph. */
    public Node createNode(NodeKind kind, String text, boolean approximate) {
        Node node = new Node(nextId++, kind, singleLine(text), approximate);
        flowchart.add(node);
        return node;
    }

    public Node createNode(NodeSpec spec) {
        return createNode(spec.kind(), spec.text(), spec.approximate());
    }

    public PendingJoins tail() {
        return tail;
    }

    public void setTail(PendingJoins tail) {
        this.tail = tail;
    }

    /** Connects the current tail to the node and makes the node the new tail. */
    public void attach(Node node) {
        tail.connectTo(node);
        tail = PendingJoins.after(node);
    }

    public LoopFrame enterLoop(Node condition) {
        LoopFrame frame = new LoopFrame(condition, PendingJoins.empty());
        loops.push(frame);
        return frame;
    }

    public void exitLoop() {
        loops.pop();
    }

    /** Innermost enclosing loop, or null at loop depth zero. */
    public LoopFrame innermostLoop() {
        return loops.peek();
    }

    public void enterScope(String name) {
        this.scope = new Scope(name);
    }

    public Scope scope() {
        return scope;
    }

    private static String singleLine(String text) {
        return text.replaceAll("\\s*\\R\\s*", " ");
    }

    /**
     * Loop being translated: its condition node and the slots left by {@code break}.
     */
    public record LoopFrame(Node condition, PendingJoins breaks) {
    }

    /**
     * Definition or module being translated. Every return in it ends at one End node.
     */
    public final class Scope {
        private final String name;
        private Node end;

        private Scope(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        public Node end() {
            if (end == null) {
                end = createNode(NodeKind.END, "end " + name, false);
            }
            return end;
        }
    }
}
