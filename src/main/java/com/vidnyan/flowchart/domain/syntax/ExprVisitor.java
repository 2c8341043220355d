package com.vidnyan.flowchart.domain.syntax;

/**
 * Exhaustive dispatch over {@link Expr} shapes.
 */
public interface ExprVisitor<R> {

    R visitName(Expr.Name name);

    R visitConstant(Expr.Constant constant);

    R visitStringLiteral(Expr.StringLiteral literal);

    R visitAttribute(Expr.Attribute attribute);

    R visitCall(Expr.Call call);

    R visitSubscript(Expr.Subscript subscript);

    R visitSlice(Expr.Slice slice);

    R visitStarred(Expr.Starred starred);

    R visitBinOp(Expr.BinOp binOp);

    R visitUnaryOp(Expr.UnaryOp unaryOp);

    R visitBoolOp(Expr.BoolOp boolOp);

    R visitCompare(Expr.Compare compare);

    R visitIfExp(Expr.IfExp ifExp);

    R visitLambda(Expr.Lambda lambda);

    R visitNamedExpr(Expr.NamedExpr namedExpr);

    R visitAwait(Expr.Await await);

    R visitYield(Expr.Yield yield);

    R visitTuple(Expr.Tuple tuple);

    R visitListDisplay(Expr.ListDisplay list);

    R visitSetDisplay(Expr.SetDisplay set);

    R visitDictDisplay(Expr.DictDisplay dict);

    R visitComprehension(Expr.Comprehension comprehension);

    R visitRaw(Expr.Raw raw);
}
