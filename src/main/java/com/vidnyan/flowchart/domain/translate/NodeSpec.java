package com.vidnyan.flowchart.domain.translate;

import com.vidnyan.flowchart.domain.flow.NodeKind;

/**
 * Kind and text of the single node a simple statement maps to.
 */
public record NodeSpec(NodeKind kind, String text, boolean approximate) {
}
