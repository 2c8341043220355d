package com.vidnyan.flowchart.domain.translate;

import com.vidnyan.flowchart.domain.flow.Direction;

import java.util.Set;

/**
 * Per-run translation switches.
 */
public record TranslationOptions(
    boolean simplify,
    boolean alignConsecutiveConditions,
    String moduleName,
    Set<String> inputFunctions,
    Set<String> outputFunctions,
    Direction backEdgeDirection
) {

    public TranslationOptions {
        inputFunctions = Set.copyOf(inputFunctions);
        outputFunctions = Set.copyOf(outputFunctions);
    }

    public static TranslationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .simplify(simplify)
                .alignConsecutiveConditions(alignConsecutiveConditions)
                .moduleName(moduleName)
                .inputFunctions(inputFunctions)
                .outputFunctions(outputFunctions)
                .backEdgeDirection(backEdgeDirection);
    }

    public static class Builder {
        private boolean simplify = true;
        private boolean alignConsecutiveConditions = false;
        private String moduleName = "main";
        private Set<String> inputFunctions = Set.of("input");
        private Set<String> outputFunctions = Set.of();
        private Direction backEdgeDirection = Direction.LEFT;

        public Builder simplify(boolean value) { this.simplify = value; return this; }
        public Builder alignConsecutiveConditions(boolean value) { this.alignConsecutiveConditions = value; return this; }
        public Builder moduleName(String value) { this.moduleName = value; return this; }
        public Builder inputFunctions(Set<String> value) { this.inputFunctions = value; return this; }
        public Builder outputFunctions(Set<String> value) { this.outputFunctions = value; return this; }
        public Builder backEdgeDirection(Direction value) { this.backEdgeDirection = value; return this; }

        public TranslationOptions build() {
            return new TranslationOptions(simplify, alignConsecutiveConditions, moduleName,
                    inputFunctions, outputFunctions, backEdgeDirection);
        }
    }
}
