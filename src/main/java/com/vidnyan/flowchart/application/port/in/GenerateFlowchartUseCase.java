package com.vidnyan.flowchart.application.port.in;

/**
 * Primary use case: turn Python source into a flowchart.
 */
public interface GenerateFlowchartUseCase {

    /**
     * Generate a flowchart for the requested field of the source.
     * @param request Generation request parameters
     * @return Rendered content and statistics
     */
    GenerationResult generate(GenerationRequest request);

    /**
     * Translate source text to flowchart.js DSL.
     * @param sourceText Python source
     * @param fieldPath Dotted path of the function or class to draw, empty for the whole program
     * @param inner Expand the body of the selected definition; always on for the whole program
     * @param simplify Collapse one-line if and loop statements
     * @param alignConsecutiveConditions Emit align-next=no between consecutive if statements
     */
    default String translate(String sourceText, String fieldPath, boolean inner, boolean simplify,
                             boolean alignConsecutiveConditions) {
        return generate(GenerationRequest.builder()
                .source(sourceText)
                .field(fieldPath)
                .inner(inner)
                .simplify(simplify)
                .alignConsecutiveConditions(alignConsecutiveConditions)
                .build()).content();
    }

    /** Whole program with default switches. */
    default String translate(String sourceText) {
        return translate(sourceText, "", true, true, false);
    }

    /**
     * Output formats.
     */
    enum Format {
        DSL,    // flowchart.js text
        HTML    // standalone page drawing the DSL
    }

    /**
     * Generation request.
     */
    record GenerationRequest(
        String source,
        String field,              // Empty = whole program
        boolean inner,
        boolean simplify,
        boolean alignConsecutiveConditions,
        String moduleName,         // Null = configured default
        Format format
    ) {
        /** Inner expansion is forced for the whole program. */
        public boolean effectiveInner() {
            return inner || field == null || field.isBlank();
        }

        public static Builder builder() {
            return new Builder();
        }

        public static class Builder {
            private String source = "";
            private String field = "";
            private boolean inner = true;
            private boolean simplify = true;
            private boolean alignConsecutiveConditions = false;
            private String moduleName;
            private Format format = Format.DSL;

            public Builder source(String source) { this.source = source; return this; }
            public Builder field(String field) { this.field = field == null ? "" : field; return this; }
            public Builder inner(boolean inner) { this.inner = inner; return this; }
            public Builder simplify(boolean simplify) { this.simplify = simplify; return this; }
            public Builder alignConsecutiveConditions(boolean align) { this.alignConsecutiveConditions = align; return this; }
            public Builder moduleName(String moduleName) { this.moduleName = moduleName; return this; }
            public Builder format(Format format) { this.format = format; return this; }

            public GenerationRequest build() {
                return new GenerationRequest(source, field, inner, simplify, alignConsecutiveConditions,
                        moduleName, format);
            }
        }
    }

    /**
     * Generation result.
     */
    record GenerationResult(
        String content,
        Format format,
        GenerationStats stats
    ) {}

    /**
     * Generation statistics.
     */
    record GenerationStats(
        int nodeCount,
        int edgeCount,
        int approximateLabels,
        long durationMs
    ) {}
}
