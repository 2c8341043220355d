package com.vidnyan.flowchart.domain.translate;

import com.vidnyan.flowchart.domain.flow.Node;
import com.vidnyan.flowchart.domain.flow.PendingJoins;

/**
 * Result of translating a block: its first node (null when the block created none)
 * and the slots the next statement attaches from.
 */
public record Fragment(Node head, PendingJoins tails) {
}
