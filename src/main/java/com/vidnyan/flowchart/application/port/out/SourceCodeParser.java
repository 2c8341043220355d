package com.vidnyan.flowchart.application.port.out;

import com.vidnyan.flowchart.domain.syntax.Module;

/**
 * Port for parsing source text into the syntax tree.
 * Implemented by adapters (e.g., the ANTLR Python adapter).
 */
public interface SourceCodeParser {

    /**
     * Parse a complete source file.
     * @param source Source text
     * @return Module holding the top-level statements
     * @throws com.vidnyan.flowchart.domain.syntax.SourceSyntaxException on malformed input
     */
    Module parse(String source);
}
