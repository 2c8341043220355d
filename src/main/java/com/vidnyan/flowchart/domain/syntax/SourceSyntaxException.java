package com.vidnyan.flowchart.domain.syntax;

import com.vidnyan.flowchart.domain.FlowchartException;

/**
 * Source text the front-end could not parse.
 */
public class SourceSyntaxException extends FlowchartException {

    private final int line;
    private final int column;

    public SourceSyntaxException(int line, int column, String detail, Throwable cause) {
        super("Syntax error at line " + line + ":" + column + ": " + detail, cause);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
