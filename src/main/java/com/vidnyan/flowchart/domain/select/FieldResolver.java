package com.vidnyan.flowchart.domain.select;

import com.vidnyan.flowchart.domain.syntax.Module;
import com.vidnyan.flowchart.domain.syntax.Stmt;

import java.util.List;

/**
 * Resolves a dotted field path such as {@code Bar.buzz.g} to the definition it names.
 * <p>
 * The first segment matches a top-level function or class, each following segment a
 * function or class defined directly in the body of the previous match. When a name is
 * defined more than once in a body, the last definition wins.
 */
public class FieldResolver {

    public Stmt.Definition resolve(Module module, String path) {
        String[] segments = path.split("\\.", -1);
        List<Stmt> scope = module.body();
        Stmt.Definition current = null;
        StringBuilder resolved = new StringBuilder();

        for (String raw : segments) {
            String segment = raw.trim();
            Stmt.Definition match = segment.isEmpty() ? null : lastDefinitionNamed(scope, segment);
            if (match == null) {
                throw new SelectionException(path, segment, resolved.toString());
            }
            if (resolved.length() > 0) {
                resolved.append('.');
            }
            resolved.append(segment);
            current = match;
            scope = match.body();
        }
        return current;
    }

    public static boolean isWholeProgram(String path) {
        return path == null || path.isBlank();
    }

    private static Stmt.Definition lastDefinitionNamed(List<Stmt> body, String name) {
        Stmt.Definition found = null;
        for (Stmt stmt : body) {
            if (stmt instanceof Stmt.Definition definition && definition.name().equals(name)) {
                found = definition;
            }
        }
        return found;
    }
}
