package com.vidnyan.flowchart.domain.syntax;

import java.util.List;

/**
 * Python statement tree. One record per statement shape.
 */
public sealed interface Stmt {

    <R> R accept(StmtVisitor<R> visitor);

    /**
     * Named statement that owns a body: a function or a class.
     */
    sealed interface Definition extends Stmt permits FunctionDef, ClassDef {
        String name();

        List<Stmt> body();
    }

    record ExprStmt(Expr value) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitExprStmt(this);
        }
    }

    /** {@code a = b = value}: one entry in targets per {@code =}. */
    record Assign(List<Expr> targets, Expr value) implements Stmt {
        public Assign {
            targets = List.copyOf(targets);
        }

        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    /** {@code target op= value}; op is the bare operator, e.g. {@code +}. */
    record AugAssign(Expr target, String op, Expr value) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitAugAssign(this);
        }
    }

    record AnnAssign(Expr target, Expr annotation, Expr value) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitAnnAssign(this);
        }
    }

    record Pass() implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitPass(this);
        }
    }

    record Break() implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    record Continue() implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }

    record Return(Expr value) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    record Raise(Expr exception, Expr cause) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitRaise(this);
        }
    }

    /** {@code global} or {@code nonlocal} declaration. */
    record ScopeDeclaration(String keyword, List<String> names) implements Stmt {
        public ScopeDeclaration {
            names = List.copyOf(names);
        }

        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitScopeDeclaration(this);
        }
    }

    record Delete(List<Expr> targets) implements Stmt {
        public Delete {
            targets = List.copyOf(targets);
        }

        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitDelete(this);
        }
    }

    record Assert(Expr test, Expr message) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitAssert(this);
        }
    }

    /**
     * {@code import a.b as c} when module is null, otherwise {@code from module import ...}.
     * Level counts the leading dots of a relative import.
     */
    record Import(String module, int level, List<Alias> names) implements Stmt {
        public Import {
            names = List.copyOf(names);
        }

        public boolean isFrom() {
            return module != null || level > 0;
        }

        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitImport(this);
        }
    }

    record Alias(String name, String asName) {
    }

    /**
     * Conditional. An {@code elif} clause is an {@code If} with {@code elif} set,
     * stored as the single statement of the enclosing else block.
     */
    record If(Expr test, List<Stmt> body, List<Stmt> orElse, boolean elif) implements Stmt {
        public If {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        public boolean hasElifChain() {
            return elif || (orElse.size() == 1 && orElse.get(0) instanceof If next && next.elif());
        }

        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record While(Expr test, List<Stmt> body, List<Stmt> orElse) implements Stmt {
        public While {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orElse, boolean async) implements Stmt {
        public For {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    record Try(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orElse, List<Stmt> finalBody)
            implements Stmt {
        public Try {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            orElse = List.copyOf(orElse);
            finalBody = List.copyOf(finalBody);
        }

        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitTry(this);
        }
    }

    record ExceptHandler(Expr type, String name, List<Stmt> body) {
        public ExceptHandler {
            body = List.copyOf(body);
        }
    }

    record With(List<WithItem> items, List<Stmt> body, boolean async) implements Stmt {
        public With {
            items = List.copyOf(items);
            body = List.copyOf(body);
        }

        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitWith(this);
        }
    }

    record WithItem(Expr context, Expr target) {
    }

    record FunctionDef(String name, List<Parameter> params, List<Stmt> body, List<Expr> decorators,
                       Expr returns, boolean async) implements Definition {
        public FunctionDef {
            params = List.copyOf(params);
            body = List.copyOf(body);
            decorators = List.copyOf(decorators);
        }

        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }
    }

    record ClassDef(String name, List<Argument> bases, List<Stmt> body, List<Expr> decorators)
            implements Definition {
        public ClassDef {
            bases = List.copyOf(bases);
            body = List.copyOf(body);
            decorators = List.copyOf(decorators);
        }

        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitClassDef(this);
        }
    }

    /**
     * Statement the front-end could not model, kept as its raw source line.
     */
    record Unsupported(String text) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitUnsupported(this);
        }
    }
}
