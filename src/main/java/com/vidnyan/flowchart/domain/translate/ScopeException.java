package com.vidnyan.flowchart.domain.translate;

import com.vidnyan.flowchart.domain.FlowchartException;

/**
 * {@code break} or {@code continue} with no enclosing loop.
 */
public class ScopeException extends FlowchartException {

    private final String keyword;

    public ScopeException(String keyword, String scope) {
        super("'" + keyword + "' outside loop in " + scope);
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
