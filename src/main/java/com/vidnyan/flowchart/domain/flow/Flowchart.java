package com.vidnyan.flowchart.domain.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All nodes created during one translation run, in creation order, plus the head node.
 */
public final class Flowchart {

    private final List<Node> nodes = new ArrayList<>();
    private Node head;

    public void add(Node node) {
        nodes.add(node);
        if (head == null) {
            head = node;
        }
    }

    public Node head() {
        return head;
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public List<Node> nodesOfKind(NodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).toList();
    }

    /** Number of rendered edge lines: two per condition, one per wired plain edge. */
    public int edgeCount() {
        int count = 0;
        for (Node node : nodes) {
            if (node.isCondition()) {
                count += 2;
            } else if (node.next() != null) {
                count++;
            }
        }
        return count;
    }

    public long approximateCount() {
        return nodes.stream().filter(Node::approximate).count();
    }

    public Stats stats() {
        return new Stats(nodes.size(), edgeCount(), (int) approximateCount());
    }

    public record Stats(int nodeCount, int edgeCount, int approximateLabels) {
    }
}
