package com.vidnyan.flowchart.domain.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outgoing slots still waiting for a common successor.
 * Produced when branches or loops leave more than one last-executed point.
 */
public final class PendingJoins {

    /**
     * An unwired outgoing edge: the plain edge of a node, or one branch of a condition.
     */
    public record Slot(Node source, Edge.Branch branch, Direction direction) {

        public static Slot after(Node source) {
            return new Slot(source, null, null);
        }

        public static Slot branch(Node condition, Edge.Branch branch) {
            return new Slot(condition, branch, null);
        }

        public Slot withDirection(Direction direction) {
            return new Slot(source, branch, direction);
        }

        void connect(Node target, Direction override) {
            Direction effective = override != null ? override : direction;
            if (branch == null) {
                source.connect(target, effective);
            } else {
                source.connectBranch(branch, target, effective);
            }
        }
    }

    private final List<Slot> slots = new ArrayList<>();

    private PendingJoins() {
    }

    public static PendingJoins empty() {
        return new PendingJoins();
    }

    public static PendingJoins of(Slot... slots) {
        PendingJoins joins = new PendingJoins();
        Collections.addAll(joins.slots, slots);
        return joins;
    }

    public static PendingJoins after(Node node) {
        return of(Slot.after(node));
    }

    public PendingJoins add(Slot slot) {
        slots.add(slot);
        return this;
    }

    public PendingJoins addAll(PendingJoins other) {
        slots.addAll(other.slots);
        return this;
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public List<Slot> slots() {
        return Collections.unmodifiableList(slots);
    }

    /** Wires every slot to the same successor. */
    public void connectTo(Node target) {
        connectTo(target, null);
    }

    /** Wires every slot to the same successor, overriding each slot's direction hint. */
    public void connectTo(Node target, Direction direction) {
        for (Slot slot : slots) {
            slot.connect(target, direction);
        }
    }
}
