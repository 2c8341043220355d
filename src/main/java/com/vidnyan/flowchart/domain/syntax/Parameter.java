package com.vidnyan.flowchart.domain.syntax;

/**
 * Function or lambda parameter.
 * Markers ({@code *} and {@code /}) have a null name.
 */
public record Parameter(String name, Kind kind, Expr annotation, Expr defaultValue) {

    public enum Kind {
        REGULAR,
        VAR_POSITIONAL,
        VAR_KEYWORD,
        KEYWORD_ONLY_MARKER,
        POSITIONAL_ONLY_MARKER
    }

    public static Parameter named(String name) {
        return new Parameter(name, Kind.REGULAR, null, null);
    }

    public boolean isMarker() {
        return kind == Kind.KEYWORD_ONLY_MARKER || kind == Kind.POSITIONAL_ONLY_MARKER;
    }

    /** Name as it appears in an input label, with its star prefix. */
    public String displayName() {
        return switch (kind) {
            case VAR_POSITIONAL -> "*" + name;
            case VAR_KEYWORD -> "**" + name;
            case KEYWORD_ONLY_MARKER -> "*";
            case POSITIONAL_ONLY_MARKER -> "/";
            case REGULAR -> name;
        };
    }
}
