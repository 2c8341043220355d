package com.vidnyan.flowchart.domain.syntax;

import java.util.List;

/**
 * Root of a parsed source file.
 */
public record Module(List<Stmt> body) {

    public Module {
        body = List.copyOf(body);
    }
}
