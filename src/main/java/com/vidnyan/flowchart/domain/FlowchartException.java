package com.vidnyan.flowchart.domain;

/**
 * Base of every failure the translation pipeline reports to its caller.
 */
public abstract class FlowchartException extends RuntimeException {

    protected FlowchartException(String message) {
        super(message);
    }

    protected FlowchartException(String message, Throwable cause) {
        super(message, cause);
    }
}
