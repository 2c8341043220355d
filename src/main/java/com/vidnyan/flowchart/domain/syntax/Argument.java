package com.vidnyan.flowchart.domain.syntax;

/**
 * Call argument. The keyword is set only for {@link Kind#KEYWORD}.
 */
public record Argument(Kind kind, String keyword, Expr value) {

    public enum Kind {
        POSITIONAL, KEYWORD, STAR, DOUBLE_STAR
    }

    public static Argument positional(Expr value) {
        return new Argument(Kind.POSITIONAL, null, value);
    }

    public static Argument keyword(String keyword, Expr value) {
        return new Argument(Kind.KEYWORD, keyword, value);
    }
}
