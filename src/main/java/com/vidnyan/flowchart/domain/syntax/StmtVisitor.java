package com.vidnyan.flowchart.domain.syntax;

/**
 * Exhaustive dispatch over {@link Stmt} shapes.
 */
public interface StmtVisitor<R> {

    R visitExprStmt(Stmt.ExprStmt stmt);

    R visitAssign(Stmt.Assign stmt);

    R visitAugAssign(Stmt.AugAssign stmt);

    R visitAnnAssign(Stmt.AnnAssign stmt);

    R visitPass(Stmt.Pass stmt);

    R visitBreak(Stmt.Break stmt);

    R visitContinue(Stmt.Continue stmt);

    R visitReturn(Stmt.Return stmt);

    R visitRaise(Stmt.Raise stmt);

    R visitScopeDeclaration(Stmt.ScopeDeclaration stmt);

    R visitDelete(Stmt.Delete stmt);

    R visitAssert(Stmt.Assert stmt);

    R visitImport(Stmt.Import stmt);

    R visitIf(Stmt.If stmt);

    R visitWhile(Stmt.While stmt);

    R visitFor(Stmt.For stmt);

    R visitTry(Stmt.Try stmt);

    R visitWith(Stmt.With stmt);

    R visitFunctionDef(Stmt.FunctionDef stmt);

    R visitClassDef(Stmt.ClassDef stmt);

    R visitUnsupported(Stmt.Unsupported stmt);
}
