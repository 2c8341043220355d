package com.vidnyan.flowchart.domain.syntax;

import java.util.List;

/**
 * Python expression tree. One record per expression shape.
 */
public sealed interface Expr {

    <R> R accept(ExprVisitor<R> visitor);

    record Name(String id) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    /**
     * Literal kept as written: numbers, None, True, False and the ellipsis.
     */
    record Constant(String text) implements Expr {
        public static final Constant NONE = new Constant("None");

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }

    /**
     * Decoded string or bytes literal. Adjacent literals are already concatenated.
     */
    record StringLiteral(String value, boolean bytes) implements Expr {
        public static StringLiteral of(String value) {
            return new StringLiteral(value, false);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStringLiteral(this);
        }
    }

    record Attribute(Expr value, String attr) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAttribute(this);
        }
    }

    record Call(Expr func, List<Argument> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }

        /** Simple name of the called function, or null for computed callees. */
        public String calleeName() {
            return func instanceof Name name ? name.id() : null;
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    record Subscript(Expr value, Expr index) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSubscript(this);
        }
    }

    /** Slice bound parts are null when omitted. */
    record Slice(Expr lower, Expr upper, Expr step) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSlice(this);
        }
    }

    record Starred(Expr value) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStarred(this);
        }
    }

    record BinOp(Expr left, String op, Expr right) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinOp(this);
        }
    }

    /** Unary operator: one of {@code -}, {@code +}, {@code ~} or {@code not}. */
    record UnaryOp(String op, Expr operand) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    record BoolOp(String op, List<Expr> values) implements Expr {
        public BoolOp {
            values = List.copyOf(values);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBoolOp(this);
        }
    }

    record Compare(Expr left, List<String> ops, List<Expr> comparators) implements Expr {
        public Compare {
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCompare(this);
        }
    }

    record IfExp(Expr test, Expr body, Expr orElse) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIfExp(this);
        }
    }

    record Lambda(List<Parameter> params, Expr body) implements Expr {
        public Lambda {
            params = List.copyOf(params);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLambda(this);
        }
    }

    record NamedExpr(String target, Expr value) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNamedExpr(this);
        }
    }

    record Await(Expr value) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAwait(this);
        }
    }

    /** {@code yield value} or {@code yield from value}; value is null for a bare yield. */
    record Yield(Expr value, boolean from) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitYield(this);
        }
    }

    record Tuple(List<Expr> elements) implements Expr {
        public Tuple {
            elements = List.copyOf(elements);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTuple(this);
        }
    }

    record ListDisplay(List<Expr> elements) implements Expr {
        public ListDisplay {
            elements = List.copyOf(elements);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListDisplay(this);
        }
    }

    record SetDisplay(List<Expr> elements) implements Expr {
        public SetDisplay {
            elements = List.copyOf(elements);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetDisplay(this);
        }
    }

    record DictDisplay(List<DictEntry> entries) implements Expr {
        public DictDisplay {
            entries = List.copyOf(entries);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDictDisplay(this);
        }
    }

    /** A {@code key: value} pair, or {@code **value} when key is null. */
    record DictEntry(Expr key, Expr value) {
    }

    record Comprehension(Kind kind, Expr element, Expr value, List<ComprehensionClause> clauses) implements Expr {
        public Comprehension {
            clauses = List.copyOf(clauses);
        }

        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitComprehension(this);
        }

        public enum Kind {
            LIST, SET, DICT, GENERATOR
        }
    }

    record ComprehensionClause(Expr target, Expr iter, List<Expr> conditions, boolean async) {
        public ComprehensionClause {
            conditions = List.copyOf(conditions);
        }
    }

    /**
     * Expression kept as raw source text because it has no structured form (f-strings).
     * Labels built from it are approximate.
     */
    record Raw(String text) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRaw(this);
        }
    }
}
