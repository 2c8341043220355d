package com.vidnyan.flowchart.domain.flow;

/**
 * flowchart.js node types.
 */
public enum NodeKind {
    START("start", "st"),
    END("end", "e"),
    OPERATION("operation", "op"),
    CONDITION("condition", "cond"),
    INPUT_OUTPUT("inputoutput", "io"),
    SUBROUTINE("subroutine", "sub");

    private final String dslType;
    private final String namePrefix;

    NodeKind(String dslType, String namePrefix) {
        this.dslType = dslType;
        this.namePrefix = namePrefix;
    }

    /** Type keyword after {@code =>} in a declaration. */
    public String dslType() {
        return dslType;
    }

    /** Prefix of the node name; the id follows it. */
    public String namePrefix() {
        return namePrefix;
    }
}
