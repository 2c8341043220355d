package com.vidnyan.flowchart.domain.flow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PendingJoinsTest {

    @Test
    void connectTo_ShouldWireEverySlotToTheSameTarget() {
        // Arrange
        Node condition = new Node(0, NodeKind.CONDITION, "if a", false);
        Node op = new Node(1, NodeKind.OPERATION, "x = 1", false);
        Node join = new Node(2, NodeKind.OPERATION, "y = 2", false);
        PendingJoins joins = PendingJoins.after(op)
                .add(PendingJoins.Slot.branch(condition, Edge.Branch.NO).withDirection(Direction.RIGHT));

        // Act
        joins.connectTo(join);

        // Assert
        assertSame(join, op.next().target());
        assertNull(op.next().direction());
        assertSame(join, condition.branch(Edge.Branch.NO).target());
        assertEquals(Direction.RIGHT, condition.branch(Edge.Branch.NO).direction());
        assertNull(condition.branch(Edge.Branch.YES));
    }

    @Test
    void connectTo_WithDirection_ShouldOverrideSlotHints() {
        // Arrange
        Node loop = new Node(0, NodeKind.CONDITION, "while a", false);
        Node body = new Node(1, NodeKind.OPERATION, "a -= 1", false);
        PendingJoins joins = PendingJoins.of(PendingJoins.Slot.after(body).withDirection(Direction.RIGHT));

        // Act
        joins.connectTo(loop, Direction.LEFT);

        // Assert
        assertEquals(Direction.LEFT, body.next().direction());
    }

    @Test
    void node_ShouldRejectWrongEdgeKinds() {
        // Arrange
        Node condition = new Node(0, NodeKind.CONDITION, "if a", false);
        Node op = new Node(1, NodeKind.OPERATION, "pass", false);

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> condition.connect(op));
        assertThrows(IllegalStateException.class, () -> op.connectBranch(Edge.Branch.YES, condition, null));
    }

    @Test
    void node_ShouldIgnoreEmptyParams() {
        // Arrange
        Node node = new Node(3, NodeKind.CONDITION, "if a", false);

        // Act
        node.setParam("", "no");
        node.setParam("align-next", "");
        node.setParam("align-next", "no");

        // Assert
        assertEquals("cond3", node.name());
        assertEquals(1, node.params().size());
        assertEquals("no", node.params().get("align-next"));
    }
}
