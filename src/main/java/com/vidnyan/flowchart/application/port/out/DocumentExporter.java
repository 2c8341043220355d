package com.vidnyan.flowchart.application.port.out;

/**
 * Port for wrapping rendered DSL into a standalone document.
 */
public interface DocumentExporter {

    /**
     * @param dsl Rendered flowchart.js text
     * @param title Document title
     * @return Complete document
     */
    String export(String dsl, String title);
}
