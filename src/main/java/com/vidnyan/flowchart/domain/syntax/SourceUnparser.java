package com.vidnyan.flowchart.domain.syntax;

import java.util.List;
import java.util.Map;

/**
 * Renders syntax back to single-line Python source, in the style of {@code ast.unparse}:
 * minimal parentheses by operator precedence and {@code repr}-style string literals.
 * <p>
 * Compound statements render as their header line without the trailing colon.
 */
public final class SourceUnparser {

    /**
     * Unparsed text. {@code approximate} is set when part of the input had no
     * structured form and was copied verbatim.
     */
    public record Unparsed(String text, boolean approximate) {
    }

    enum Precedence {
        NAMED_EXPR, TUPLE, YIELD, TEST, OR, AND, NOT, CMP, EXPR, BXOR, BAND, SHIFT, ARITH, TERM, FACTOR,
        POWER, AWAIT, ATOM;

        Precedence next() {
            return values()[Math.min(ordinal() + 1, values().length - 1)];
        }
    }

    private static final Map<String, Precedence> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("|", Precedence.EXPR),
            Map.entry("^", Precedence.BXOR),
            Map.entry("&", Precedence.BAND),
            Map.entry("<<", Precedence.SHIFT),
            Map.entry(">>", Precedence.SHIFT),
            Map.entry("+", Precedence.ARITH),
            Map.entry("-", Precedence.ARITH),
            Map.entry("*", Precedence.TERM),
            Map.entry("@", Precedence.TERM),
            Map.entry("/", Precedence.TERM),
            Map.entry("%", Precedence.TERM),
            Map.entry("//", Precedence.TERM),
            Map.entry("**", Precedence.POWER));

    private SourceUnparser() {
    }

    public static Unparsed expression(Expr expr) {
        Writer writer = new Writer();
        writer.write(expr, Precedence.TEST);
        return writer.result();
    }

    /** Unparses a simple statement, or the header line of a compound one. */
    public static Unparsed statement(Stmt stmt) {
        Writer writer = new Writer();
        stmt.accept(writer.statements);
        return writer.result();
    }

    /** Parameter list without the surrounding parentheses. */
    public static String parameters(List<Parameter> params) {
        Writer writer = new Writer();
        writer.parameters(params);
        return writer.out.toString();
    }

    public static Unparsed arguments(List<Argument> args) {
        Writer writer = new Writer();
        writer.arguments(args);
        return writer.result();
    }

    /** Python {@code repr} of a string or bytes value. */
    public static String repr(String value, boolean bytes) {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(value.length() + 3);
        if (bytes) {
            sb.append('b');
        }
        sb.append(quote);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == quote || ch == '\\') {
                sb.append('\\').append(ch);
            } else if (ch == '\n') {
                sb.append("\\n");
            } else if (ch == '\r') {
                sb.append("\\r");
            } else if (ch == '\t') {
                sb.append("\\t");
            } else if (ch < 0x20 || ch == 0x7f || (bytes && ch > 0x7f)) {
                sb.append(String.format("\\x%02x", (int) ch));
            } else {
                sb.append(ch);
            }
        }
        return sb.append(quote).toString();
    }

    private static final class Writer implements ExprVisitor<Void> {

        private final StringBuilder out = new StringBuilder();
        private final StatementWriter statements = new StatementWriter();
        private Precedence context = Precedence.TEST;
        private boolean approximate;

        Unparsed result() {
            return new Unparsed(out.toString(), approximate);
        }

        void write(Expr expr, Precedence precedence) {
            context = precedence;
            expr.accept(this);
        }

        private void write(String text) {
            out.append(text);
        }

        private void writeAll(List<Expr> exprs, Precedence precedence) {
            for (int i = 0; i < exprs.size(); i++) {
                if (i > 0) {
                    write(", ");
                }
                write(exprs.get(i), precedence);
            }
        }

        private boolean open(Precedence operator) {
            boolean parens = context.compareTo(operator) > 0;
            if (parens) {
                write("(");
            }
            return parens;
        }

        private void close(boolean parens) {
            if (parens) {
                write(")");
            }
        }

        @Override
        public Void visitName(Expr.Name name) {
            write(name.id());
            return null;
        }

        @Override
        public Void visitConstant(Expr.Constant constant) {
            write(constant.text());
            return null;
        }

        @Override
        public Void visitStringLiteral(Expr.StringLiteral literal) {
            write(repr(literal.value(), literal.bytes()));
            return null;
        }

        @Override
        public Void visitAttribute(Expr.Attribute attribute) {
            write(attribute.value(), Precedence.ATOM);
            write(".");
            write(attribute.attr());
            return null;
        }

        @Override
        public Void visitCall(Expr.Call call) {
            write(call.func(), Precedence.ATOM);
            write("(");
            List<Argument> args = call.args();
            if (args.size() == 1 && args.get(0).kind() == Argument.Kind.POSITIONAL
                    && args.get(0).value() instanceof Expr.Comprehension comprehension
                    && comprehension.kind() == Expr.Comprehension.Kind.GENERATOR) {
                comprehensionBody(comprehension);
            } else {
                arguments(args);
            }
            write(")");
            return null;
        }

        void arguments(List<Argument> args) {
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    write(", ");
                }
                Argument arg = args.get(i);
                switch (arg.kind()) {
                    case POSITIONAL -> write(arg.value(), Precedence.TEST);
                    case KEYWORD -> {
                        write(arg.keyword());
                        write("=");
                        write(arg.value(), Precedence.TEST);
                    }
                    case STAR -> {
                        write("*");
                        write(arg.value(), Precedence.EXPR);
                    }
                    case DOUBLE_STAR -> {
                        write("**");
                        write(arg.value(), Precedence.EXPR);
                    }
                }
            }
        }

        @Override
        public Void visitSubscript(Expr.Subscript subscript) {
            write(subscript.value(), Precedence.ATOM);
            write("[");
            if (subscript.index() instanceof Expr.Tuple tuple && !tuple.elements().isEmpty()) {
                tupleItems(tuple.elements());
            } else {
                write(subscript.index(), Precedence.TEST);
            }
            write("]");
            return null;
        }

        @Override
        public Void visitSlice(Expr.Slice slice) {
            if (slice.lower() != null) {
                write(slice.lower(), Precedence.TEST);
            }
            write(":");
            if (slice.upper() != null) {
                write(slice.upper(), Precedence.TEST);
            }
            if (slice.step() != null) {
                write(":");
                write(slice.step(), Precedence.TEST);
            }
            return null;
        }

        @Override
        public Void visitStarred(Expr.Starred starred) {
            write("*");
            write(starred.value(), Precedence.EXPR);
            return null;
        }

        @Override
        public Void visitBinOp(Expr.BinOp binOp) {
            Precedence operator = BINARY_PRECEDENCE.getOrDefault(binOp.op(), Precedence.EXPR);
            boolean rightAssociative = "**".equals(binOp.op());
            boolean parens = open(operator);
            write(binOp.left(), rightAssociative ? operator.next() : operator);
            write(" " + binOp.op() + " ");
            write(binOp.right(), rightAssociative ? operator : operator.next());
            close(parens);
            return null;
        }

        @Override
        public Void visitUnaryOp(Expr.UnaryOp unaryOp) {
            boolean not = "not".equals(unaryOp.op());
            Precedence operator = not ? Precedence.NOT : Precedence.FACTOR;
            boolean parens = open(operator);
            write(unaryOp.op());
            if (not) {
                write(" ");
            }
            write(unaryOp.operand(), operator);
            close(parens);
            return null;
        }

        @Override
        public Void visitBoolOp(Expr.BoolOp boolOp) {
            Precedence operator = "and".equals(boolOp.op()) ? Precedence.AND : Precedence.OR;
            boolean parens = open(operator);
            List<Expr> values = boolOp.values();
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) {
                    write(" " + boolOp.op() + " ");
                }
                write(values.get(i), operator.next());
            }
            close(parens);
            return null;
        }

        @Override
        public Void visitCompare(Expr.Compare compare) {
            boolean parens = open(Precedence.CMP);
            write(compare.left(), Precedence.CMP.next());
            for (int i = 0; i < compare.ops().size(); i++) {
                write(" " + compare.ops().get(i) + " ");
                write(compare.comparators().get(i), Precedence.CMP.next());
            }
            close(parens);
            return null;
        }

        @Override
        public Void visitIfExp(Expr.IfExp ifExp) {
            boolean parens = open(Precedence.TEST);
            write(ifExp.body(), Precedence.TEST.next());
            write(" if ");
            write(ifExp.test(), Precedence.TEST.next());
            write(" else ");
            write(ifExp.orElse(), Precedence.TEST);
            close(parens);
            return null;
        }

        @Override
        public Void visitLambda(Expr.Lambda lambda) {
            boolean parens = open(Precedence.TEST);
            write("lambda");
            if (!lambda.params().isEmpty()) {
                write(" ");
                parameters(lambda.params());
            }
            write(": ");
            write(lambda.body(), Precedence.TEST);
            close(parens);
            return null;
        }

        @Override
        public Void visitNamedExpr(Expr.NamedExpr namedExpr) {
            boolean parens = open(Precedence.NAMED_EXPR);
            write(namedExpr.target());
            write(" := ");
            write(namedExpr.value(), Precedence.NAMED_EXPR.next());
            close(parens);
            return null;
        }

        @Override
        public Void visitAwait(Expr.Await await) {
            boolean parens = open(Precedence.AWAIT);
            write("await ");
            write(await.value(), Precedence.ATOM);
            close(parens);
            return null;
        }

        @Override
        public Void visitYield(Expr.Yield yield) {
            boolean parens = open(Precedence.YIELD);
            write(yield.from() ? "yield from" : "yield");
            if (yield.value() != null) {
                write(" ");
                write(yield.value(), Precedence.TEST);
            }
            close(parens);
            return null;
        }

        @Override
        public Void visitTuple(Expr.Tuple tuple) {
            boolean parens = tuple.elements().isEmpty() || context.compareTo(Precedence.TUPLE) > 0;
            if (parens) {
                write("(");
            }
            tupleItems(tuple.elements());
            close(parens);
            return null;
        }

        private void tupleItems(List<Expr> elements) {
            if (elements.size() == 1) {
                write(elements.get(0), Precedence.TEST);
                write(",");
            } else {
                writeAll(elements, Precedence.TEST);
            }
        }

        @Override
        public Void visitListDisplay(Expr.ListDisplay list) {
            write("[");
            writeAll(list.elements(), Precedence.TEST);
            write("]");
            return null;
        }

        @Override
        public Void visitSetDisplay(Expr.SetDisplay set) {
            if (set.elements().isEmpty()) {
                write("{*()}");
                return null;
            }
            write("{");
            writeAll(set.elements(), Precedence.TEST);
            write("}");
            return null;
        }

        @Override
        public Void visitDictDisplay(Expr.DictDisplay dict) {
            write("{");
            List<Expr.DictEntry> entries = dict.entries();
            for (int i = 0; i < entries.size(); i++) {
                if (i > 0) {
                    write(", ");
                }
                dictEntry(entries.get(i));
            }
            write("}");
            return null;
        }

        private void dictEntry(Expr.DictEntry entry) {
            if (entry.key() == null) {
                write("**");
                write(entry.value(), Precedence.EXPR);
            } else {
                write(entry.key(), Precedence.TEST);
                write(": ");
                write(entry.value(), Precedence.TEST);
            }
        }

        @Override
        public Void visitComprehension(Expr.Comprehension comprehension) {
            switch (comprehension.kind()) {
                case LIST -> write("[");
                case SET, DICT -> write("{");
                case GENERATOR -> write("(");
            }
            comprehensionBody(comprehension);
            switch (comprehension.kind()) {
                case LIST -> write("]");
                case SET, DICT -> write("}");
                case GENERATOR -> write(")");
            }
            return null;
        }

        private void comprehensionBody(Expr.Comprehension comprehension) {
            if (comprehension.kind() == Expr.Comprehension.Kind.DICT) {
                dictEntry(new Expr.DictEntry(comprehension.element(), comprehension.value()));
            } else {
                write(comprehension.element(), Precedence.TEST);
            }
            for (Expr.ComprehensionClause clause : comprehension.clauses()) {
                write(clause.async() ? " async for " : " for ");
                write(clause.target(), Precedence.TUPLE);
                write(" in ");
                write(clause.iter(), Precedence.TEST.next());
                for (Expr condition : clause.conditions()) {
                    write(" if ");
                    write(condition, Precedence.TEST.next());
                }
            }
        }

        @Override
        public Void visitRaw(Expr.Raw raw) {
            approximate = true;
            write(raw.text());
            return null;
        }

        void parameters(List<Parameter> params) {
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) {
                    write(", ");
                }
                Parameter param = params.get(i);
                write(param.displayName());
                if (param.annotation() != null) {
                    write(": ");
                    write(param.annotation(), Precedence.TEST);
                }
                if (param.defaultValue() != null) {
                    write(param.annotation() != null ? " = " : "=");
                    write(param.defaultValue(), Precedence.TEST);
                }
            }
        }

        private final class StatementWriter implements StmtVisitor<Void> {

            @Override
            public Void visitExprStmt(Stmt.ExprStmt stmt) {
                write(stmt.value(), Precedence.YIELD);
                return null;
            }

            @Override
            public Void visitAssign(Stmt.Assign stmt) {
                for (Expr target : stmt.targets()) {
                    write(target, Precedence.TUPLE);
                    write(" = ");
                }
                write(stmt.value(), Precedence.TEST);
                return null;
            }

            @Override
            public Void visitAugAssign(Stmt.AugAssign stmt) {
                write(stmt.target(), Precedence.TEST);
                write(" " + stmt.op() + "= ");
                write(stmt.value(), Precedence.TEST);
                return null;
            }

            @Override
            public Void visitAnnAssign(Stmt.AnnAssign stmt) {
                write(stmt.target(), Precedence.TEST);
                write(": ");
                write(stmt.annotation(), Precedence.TEST);
                if (stmt.value() != null) {
                    write(" = ");
                    write(stmt.value(), Precedence.TEST);
                }
                return null;
            }

            @Override
            public Void visitPass(Stmt.Pass stmt) {
                write("pass");
                return null;
            }

            @Override
            public Void visitBreak(Stmt.Break stmt) {
                write("break");
                return null;
            }

            @Override
            public Void visitContinue(Stmt.Continue stmt) {
                write("continue");
                return null;
            }

            @Override
            public Void visitReturn(Stmt.Return stmt) {
                write("return");
                if (stmt.value() != null) {
                    write(" ");
                    write(stmt.value(), Precedence.TEST);
                }
                return null;
            }

            @Override
            public Void visitRaise(Stmt.Raise stmt) {
                write("raise");
                if (stmt.exception() != null) {
                    write(" ");
                    write(stmt.exception(), Precedence.TEST);
                    if (stmt.cause() != null) {
                        write(" from ");
                        write(stmt.cause(), Precedence.TEST);
                    }
                }
                return null;
            }

            @Override
            public Void visitScopeDeclaration(Stmt.ScopeDeclaration stmt) {
                write(stmt.keyword() + " " + String.join(", ", stmt.names()));
                return null;
            }

            @Override
            public Void visitDelete(Stmt.Delete stmt) {
                write("del ");
                writeAll(stmt.targets(), Precedence.TEST);
                return null;
            }

            @Override
            public Void visitAssert(Stmt.Assert stmt) {
                write("assert ");
                write(stmt.test(), Precedence.TEST);
                if (stmt.message() != null) {
                    write(", ");
                    write(stmt.message(), Precedence.TEST);
                }
                return null;
            }

            @Override
            public Void visitImport(Stmt.Import stmt) {
                if (stmt.isFrom()) {
                    write("from " + ".".repeat(stmt.level()) + (stmt.module() == null ? "" : stmt.module())
                            + " import ");
                } else {
                    write("import ");
                }
                List<Stmt.Alias> names = stmt.names();
                for (int i = 0; i < names.size(); i++) {
                    if (i > 0) {
                        write(", ");
                    }
                    write(names.get(i).name());
                    if (names.get(i).asName() != null) {
                        write(" as " + names.get(i).asName());
                    }
                }
                return null;
            }

            @Override
            public Void visitIf(Stmt.If stmt) {
                write("if ");
                write(stmt.test(), Precedence.TEST);
                return null;
            }

            @Override
            public Void visitWhile(Stmt.While stmt) {
                write("while ");
                write(stmt.test(), Precedence.TEST);
                return null;
            }

            @Override
            public Void visitFor(Stmt.For stmt) {
                write(stmt.async() ? "async for " : "for ");
                write(stmt.target(), Precedence.TUPLE);
                write(" in ");
                write(stmt.iter(), Precedence.TEST);
                return null;
            }

            @Override
            public Void visitTry(Stmt.Try stmt) {
                write("try");
                return null;
            }

            @Override
            public Void visitWith(Stmt.With stmt) {
                write(stmt.async() ? "async with " : "with ");
                List<Stmt.WithItem> items = stmt.items();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) {
                        write(", ");
                    }
                    write(items.get(i).context(), Precedence.TEST);
                    if (items.get(i).target() != null) {
                        write(" as ");
                        write(items.get(i).target(), Precedence.TUPLE);
                    }
                }
                return null;
            }

            @Override
            public Void visitFunctionDef(Stmt.FunctionDef stmt) {
                write(stmt.async() ? "async def " : "def ");
                write(stmt.name() + "(");
                parameters(stmt.params());
                write(")");
                if (stmt.returns() != null) {
                    write(" -> ");
                    write(stmt.returns(), Precedence.TEST);
                }
                return null;
            }

            @Override
            public Void visitClassDef(Stmt.ClassDef stmt) {
                write("class " + stmt.name());
                if (!stmt.bases().isEmpty()) {
                    write("(");
                    arguments(stmt.bases());
                    write(")");
                }
                return null;
            }

            @Override
            public Void visitUnsupported(Stmt.Unsupported stmt) {
                approximate = true;
                write(stmt.text());
                return null;
            }
        }
    }
}
