package com.vidnyan.flowchart.domain.flow;

import java.util.Locale;

/**
 * Side of the source node an edge leaves from.
 */
public enum Direction {
    LEFT, RIGHT, TOP, BOTTOM;

    public String dsl() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Direction parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
