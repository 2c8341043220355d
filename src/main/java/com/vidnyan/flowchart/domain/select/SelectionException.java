package com.vidnyan.flowchart.domain.select;

import com.vidnyan.flowchart.domain.FlowchartException;

/**
 * A field path does not resolve to a function or class.
 */
public class SelectionException extends FlowchartException {

    private final String path;
    private final String segment;

    public SelectionException(String path, String segment, String resolvedPrefix) {
        super(resolvedPrefix.isEmpty()
                ? "No top-level function or class named '" + segment + "' (field '" + path + "')"
                : "'" + resolvedPrefix + "' has no function or class named '" + segment + "' (field '" + path + "')");
        this.path = path;
        this.segment = segment;
    }

    public String path() {
        return path;
    }

    public String segment() {
        return segment;
    }
}
