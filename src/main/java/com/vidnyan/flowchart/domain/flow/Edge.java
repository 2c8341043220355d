package com.vidnyan.flowchart.domain.flow;

/**
 * Outgoing connection of a node. The direction hint is null for the default side.
 */
public record Edge(Node target, Direction direction) {

    /**
     * Branch labels of a condition node.
     */
    public enum Branch {
        YES, NO;

        public String dsl() {
            return this == YES ? "yes" : "no";
        }
    }
}
