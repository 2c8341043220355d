package com.vidnyan.flowchart.adapter.out.parser;

import com.vidnyan.flowchart.adapter.out.parser.antlr.PythonParser;
import com.vidnyan.flowchart.domain.syntax.Argument;
import com.vidnyan.flowchart.domain.syntax.Expr;
import com.vidnyan.flowchart.domain.syntax.Module;
import com.vidnyan.flowchart.domain.syntax.Parameter;
import com.vidnyan.flowchart.domain.syntax.Stmt;
import lombok.extern.slf4j.Slf4j;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps an ANTLR parse tree onto the domain syntax tree.
 * <p>
 * Parenthesized expressions lose their parentheses, comparison chains and
 * boolean operator chains are flattened, and adjacent string literals are
 * concatenated. Formatted string literals are kept as raw source text.
 */
@Slf4j
class PythonAstBuilder {

    Module build(PythonParser.FileInputContext ctx) {
        List<Stmt> body = new ArrayList<>();
        for (PythonParser.StmtContext stmt : ctx.stmt()) {
            body.addAll(statements(stmt));
        }
        return new Module(body);
    }

    // ---------------------------------------------------------------- statements

    private List<Stmt> statements(PythonParser.StmtContext ctx) {
        if (ctx.simpleStmt() != null) {
            return simpleStatements(ctx.simpleStmt());
        }
        return List.of(compound(ctx.compoundStmt()));
    }

    private List<Stmt> simpleStatements(PythonParser.SimpleStmtContext ctx) {
        List<Stmt> result = new ArrayList<>();
        for (PythonParser.SmallStmtContext small : ctx.smallStmt()) {
            result.add(small(small));
        }
        return result;
    }

    private List<Stmt> block(PythonParser.BlockContext ctx) {
        if (ctx.simpleStmt() != null) {
            return simpleStatements(ctx.simpleStmt());
        }
        List<Stmt> result = new ArrayList<>();
        for (PythonParser.StmtContext stmt : ctx.stmt()) {
            result.addAll(statements(stmt));
        }
        return result;
    }

    private Stmt small(PythonParser.SmallStmtContext ctx) {
        if (ctx instanceof PythonParser.PassStmtContext) {
            return new Stmt.Pass();
        }
        if (ctx instanceof PythonParser.BreakStmtContext) {
            return new Stmt.Break();
        }
        if (ctx instanceof PythonParser.ContinueStmtContext) {
            return new Stmt.Continue();
        }
        if (ctx instanceof PythonParser.ReturnStmtContext ret) {
            return new Stmt.Return(ret.testListStarExpr() == null ? null : testList(ret.testListStarExpr()));
        }
        if (ctx instanceof PythonParser.RaiseStmtContext raise) {
            List<PythonParser.ExprContext> exprs = raise.expr();
            return new Stmt.Raise(
                    exprs.isEmpty() ? null : expr(exprs.get(0)),
                    exprs.size() > 1 ? expr(exprs.get(1)) : null);
        }
        if (ctx instanceof PythonParser.GlobalStmtContext global) {
            return new Stmt.ScopeDeclaration("global", names(global.NAME()));
        }
        if (ctx instanceof PythonParser.NonlocalStmtContext nonlocal) {
            return new Stmt.ScopeDeclaration("nonlocal", names(nonlocal.NAME()));
        }
        if (ctx instanceof PythonParser.DelStmtContext del) {
            return new Stmt.Delete(targets(del.targetList()));
        }
        if (ctx instanceof PythonParser.AssertStmtContext assertion) {
            List<PythonParser.ExprContext> exprs = assertion.expr();
            return new Stmt.Assert(expr(exprs.get(0)), exprs.size() > 1 ? expr(exprs.get(1)) : null);
        }
        if (ctx instanceof PythonParser.ImportStmtContext imports) {
            List<Stmt.Alias> aliases = new ArrayList<>();
            for (PythonParser.DottedAsNameContext name : imports.dottedAsName()) {
                aliases.add(new Stmt.Alias(name.dottedName().getText(),
                        name.NAME() == null ? null : name.NAME().getText()));
            }
            return new Stmt.Import(null, 0, aliases);
        }
        if (ctx instanceof PythonParser.FromImportStmtContext from) {
            return fromImport(from);
        }
        if (ctx instanceof PythonParser.AnnAssignStmtContext ann) {
            return new Stmt.AnnAssign(
                    testList(ann.testListStarExpr()),
                    expr(ann.expr()),
                    ann.yieldOrTests() == null ? null : yieldOrTests(ann.yieldOrTests()));
        }
        if (ctx instanceof PythonParser.AugAssignStmtContext aug) {
            String op = aug.augAssignOp().getText();
            return new Stmt.AugAssign(
                    testList(aug.testListStarExpr()),
                    op.substring(0, op.length() - 1),
                    yieldOrTests(aug.yieldOrTests()));
        }
        if (ctx instanceof PythonParser.AssignStmtContext assign) {
            List<Expr> targets = new ArrayList<>();
            targets.add(testList(assign.testListStarExpr()));
            List<PythonParser.YieldOrTestsContext> rest = assign.yieldOrTests();
            for (int i = 0; i < rest.size() - 1; i++) {
                targets.add(yieldOrTests(rest.get(i)));
            }
            return new Stmt.Assign(targets, yieldOrTests(rest.get(rest.size() - 1)));
        }
        if (ctx instanceof PythonParser.ExprStmtContext exprStmt) {
            return new Stmt.ExprStmt(yieldOrTests(exprStmt.yieldOrTests()));
        }
        log.debug("Keeping unrecognized statement as text: {}", text(ctx));
        return new Stmt.Unsupported(text(ctx));
    }

    private Stmt fromImport(PythonParser.FromImportStmtContext ctx) {
        PythonParser.ImportSourceContext source = ctx.importSource();
        int level = source.DOT().size() + 3 * source.ELLIPSIS().size();
        String module = source.dottedName() == null ? null : source.dottedName().getText();

        List<Stmt.Alias> aliases = new ArrayList<>();
        PythonParser.ImportTargetsContext targets = ctx.importTargets();
        if (targets.STAR() != null) {
            aliases.add(new Stmt.Alias("*", null));
        } else {
            for (PythonParser.ImportAsNameContext name : targets.importAsNames().importAsName()) {
                List<TerminalNode> parts = name.NAME();
                aliases.add(new Stmt.Alias(parts.get(0).getText(), parts.size() > 1 ? parts.get(1).getText() : null));
            }
        }
        return new Stmt.Import(module, level, aliases);
    }

    private Stmt compound(PythonParser.CompoundStmtContext ctx) {
        if (ctx.ifStmt() != null) {
            return ifStatement(ctx.ifStmt());
        }
        if (ctx.whileStmt() != null) {
            PythonParser.WhileStmtContext loop = ctx.whileStmt();
            return new Stmt.While(expr(loop.expr()), block(loop.block()), elseBlock(loop.elseClause()));
        }
        if (ctx.forStmt() != null) {
            PythonParser.ForStmtContext loop = ctx.forStmt();
            return new Stmt.For(
                    targetList(loop.targetList()),
                    testList(loop.testListStarExpr()),
                    block(loop.block()),
                    elseBlock(loop.elseClause()),
                    loop.ASYNC() != null);
        }
        if (ctx.tryStmt() != null) {
            return tryStatement(ctx.tryStmt());
        }
        if (ctx.withStmt() != null) {
            PythonParser.WithStmtContext with = ctx.withStmt();
            List<Stmt.WithItem> items = new ArrayList<>();
            for (PythonParser.WithItemContext item : with.withItem()) {
                items.add(new Stmt.WithItem(expr(item.expr()), item.target() == null ? null : target(item.target())));
            }
            return new Stmt.With(items, block(with.block()), with.ASYNC() != null);
        }
        if (ctx.funcDef() != null) {
            return functionDef(ctx.funcDef());
        }
        return classDef(ctx.classDef());
    }

    private Stmt ifStatement(PythonParser.IfStmtContext ctx) {
        List<Stmt> orElse = elseBlock(ctx.elseClause());
        List<PythonParser.ElifClauseContext> elifs = ctx.elifClause();
        for (int i = elifs.size() - 1; i >= 0; i--) {
            PythonParser.ElifClauseContext elif = elifs.get(i);
            orElse = List.of(new Stmt.If(expr(elif.expr()), block(elif.block()), orElse, true));
        }
        return new Stmt.If(expr(ctx.expr()), block(ctx.block()), orElse, false);
    }

    private List<Stmt> elseBlock(PythonParser.ElseClauseContext ctx) {
        return ctx == null ? List.of() : block(ctx.block());
    }

    private Stmt tryStatement(PythonParser.TryStmtContext ctx) {
        List<Stmt.ExceptHandler> handlers = new ArrayList<>();
        for (PythonParser.ExceptClauseContext clause : ctx.exceptClause()) {
            if (clause.STAR() != null) {
                log.debug("Treating except* at line {} as a plain handler", clause.getStart().getLine());
            }
            handlers.add(new Stmt.ExceptHandler(
                    clause.expr() == null ? null : expr(clause.expr()),
                    clause.NAME() == null ? null : clause.NAME().getText(),
                    block(clause.block())));
        }
        List<Stmt> finalBody = ctx.finallyClause() == null ? List.of() : block(ctx.finallyClause().block());
        return new Stmt.Try(block(ctx.block()), handlers, elseBlock(ctx.elseClause()), finalBody);
    }

    private Stmt functionDef(PythonParser.FuncDefContext ctx) {
        List<Parameter> params = new ArrayList<>();
        if (ctx.parameters().paramList() != null) {
            for (PythonParser.ParamContext param : ctx.parameters().paramList().param()) {
                params.add(parameter(param));
            }
        }
        return new Stmt.FunctionDef(
                ctx.NAME().getText(),
                params,
                block(ctx.block()),
                decorators(ctx.decorator()),
                ctx.expr() == null ? null : expr(ctx.expr()),
                ctx.ASYNC() != null);
    }

    private Stmt classDef(PythonParser.ClassDefContext ctx) {
        return new Stmt.ClassDef(
                ctx.NAME().getText(),
                arguments(ctx.arguments()),
                block(ctx.block()),
                decorators(ctx.decorator()));
    }

    private List<Expr> decorators(List<PythonParser.DecoratorContext> ctx) {
        List<Expr> result = new ArrayList<>();
        for (PythonParser.DecoratorContext decorator : ctx) {
            result.add(expr(decorator.expr()));
        }
        return result;
    }

    private Parameter parameter(PythonParser.ParamContext ctx) {
        if (ctx instanceof PythonParser.PlainParamContext plain) {
            int next = 0;
            Expr annotation = plain.COLON() != null ? expr(plain.expr(next++)) : null;
            Expr defaultValue = plain.ASSIGN() != null ? expr(plain.expr(next)) : null;
            return new Parameter(plain.NAME().getText(), Parameter.Kind.REGULAR, annotation, defaultValue);
        }
        if (ctx instanceof PythonParser.VarPositionalParamContext star) {
            if (star.NAME() == null) {
                return new Parameter(null, Parameter.Kind.KEYWORD_ONLY_MARKER, null, null);
            }
            return new Parameter(star.NAME().getText(), Parameter.Kind.VAR_POSITIONAL,
                    star.expr() == null ? null : expr(star.expr()), null);
        }
        if (ctx instanceof PythonParser.VarKeywordParamContext doubleStar) {
            return new Parameter(doubleStar.NAME().getText(), Parameter.Kind.VAR_KEYWORD,
                    doubleStar.expr() == null ? null : expr(doubleStar.expr()), null);
        }
        return new Parameter(null, Parameter.Kind.POSITIONAL_ONLY_MARKER, null, null);
    }

    private Parameter lambdaParameter(PythonParser.LambdaParamContext ctx) {
        if (ctx instanceof PythonParser.PlainLambdaParamContext plain) {
            return new Parameter(plain.NAME().getText(), Parameter.Kind.REGULAR, null,
                    plain.expr() == null ? null : expr(plain.expr()));
        }
        if (ctx instanceof PythonParser.VarPositionalLambdaParamContext star) {
            return star.NAME() == null
                    ? new Parameter(null, Parameter.Kind.KEYWORD_ONLY_MARKER, null, null)
                    : new Parameter(star.NAME().getText(), Parameter.Kind.VAR_POSITIONAL, null, null);
        }
        if (ctx instanceof PythonParser.VarKeywordLambdaParamContext doubleStar) {
            return new Parameter(doubleStar.NAME().getText(), Parameter.Kind.VAR_KEYWORD, null, null);
        }
        return new Parameter(null, Parameter.Kind.POSITIONAL_ONLY_MARKER, null, null);
    }

    // ---------------------------------------------------------------- targets

    private List<Expr> targets(PythonParser.TargetListContext ctx) {
        List<Expr> result = new ArrayList<>();
        for (PythonParser.TargetContext target : ctx.target()) {
            result.add(target(target));
        }
        return result;
    }

    /** Single target, or a tuple when the list has several entries or a trailing comma. */
    private Expr targetList(PythonParser.TargetListContext ctx) {
        List<Expr> targets = targets(ctx);
        return targets.size() == 1 && ctx.COMMA().isEmpty() ? targets.get(0) : new Expr.Tuple(targets);
    }

    private Expr target(PythonParser.TargetContext ctx) {
        Expr primary = primaryTarget(ctx.primaryTarget());
        return ctx.STAR() != null ? new Expr.Starred(primary) : primary;
    }

    private Expr primaryTarget(PythonParser.PrimaryTargetContext ctx) {
        if (ctx instanceof PythonParser.AttributeTargetContext attribute) {
            return new Expr.Attribute(primaryTarget(attribute.primaryTarget()), attribute.NAME().getText());
        }
        if (ctx instanceof PythonParser.SubscriptTargetContext subscript) {
            return new Expr.Subscript(primaryTarget(subscript.primaryTarget()), subscripts(subscript.subscripts()));
        }
        if (ctx instanceof PythonParser.CallTargetContext call) {
            return new Expr.Call(primaryTarget(call.primaryTarget()), arguments(call.arguments()));
        }
        return atom(((PythonParser.AtomTargetContext) ctx).atom());
    }

    // ---------------------------------------------------------------- expressions

    private Expr yieldOrTests(PythonParser.YieldOrTestsContext ctx) {
        return ctx.yieldExpr() != null ? yieldOf(ctx.yieldExpr()) : testList(ctx.testListStarExpr());
    }

    private Expr yieldOf(PythonParser.YieldExprContext ctx) {
        if (ctx.FROM() != null) {
            return new Expr.Yield(expr(ctx.expr()), true);
        }
        return new Expr.Yield(ctx.testListStarExpr() == null ? null : testList(ctx.testListStarExpr()), false);
    }

    /** Comma separated expressions: the expression itself, or a tuple. */
    private Expr testList(PythonParser.TestListStarExprContext ctx) {
        List<Expr> elements = elements(ctx);
        return elements.size() == 1 && ctx.COMMA().isEmpty() ? elements.get(0) : new Expr.Tuple(elements);
    }

    /** Expression and starred children in source order. */
    private List<Expr> elements(ParserRuleContext ctx) {
        List<Expr> result = new ArrayList<>();
        for (ParseTree child : ctx.children) {
            if (child instanceof PythonParser.ExprContext expr) {
                result.add(expr(expr));
            } else if (child instanceof PythonParser.StarExprContext star) {
                result.add(new Expr.Starred(expr(star.expr())));
            }
        }
        return result;
    }

    private Expr expr(PythonParser.ExprContext ctx) {
        if (ctx instanceof PythonParser.AtomExprContext atom) {
            return atom(atom.atom());
        }
        if (ctx instanceof PythonParser.AttributeExprContext attribute) {
            return new Expr.Attribute(expr(attribute.expr()), attribute.NAME().getText());
        }
        if (ctx instanceof PythonParser.CallExprContext call) {
            return new Expr.Call(expr(call.expr()), arguments(call.arguments()));
        }
        if (ctx instanceof PythonParser.SubscriptExprContext subscript) {
            return new Expr.Subscript(expr(subscript.expr()), subscripts(subscript.subscripts()));
        }
        if (ctx instanceof PythonParser.AwaitExprContext await) {
            return new Expr.Await(expr(await.expr()));
        }
        if (ctx instanceof PythonParser.PowerExprContext power) {
            return new Expr.BinOp(expr(power.expr(0)), "**", expr(power.expr(1)));
        }
        if (ctx instanceof PythonParser.UnaryExprContext unary) {
            return new Expr.UnaryOp(unary.op.getText(), expr(unary.expr()));
        }
        if (ctx instanceof PythonParser.BinaryExprContext binary) {
            return new Expr.BinOp(expr(binary.expr(0)), binary.op.getText(), expr(binary.expr(1)));
        }
        if (ctx instanceof PythonParser.CompareExprContext compare) {
            return compare(compare);
        }
        if (ctx instanceof PythonParser.NotExprContext not) {
            return new Expr.UnaryOp("not", expr(not.expr()));
        }
        if (ctx instanceof PythonParser.AndExprContext || ctx instanceof PythonParser.OrExprContext) {
            return boolOp(ctx);
        }
        if (ctx instanceof PythonParser.ConditionalExprContext conditional) {
            return new Expr.IfExp(expr(conditional.expr(1)), expr(conditional.expr(0)), expr(conditional.expr(2)));
        }
        if (ctx instanceof PythonParser.LambdaExprContext lambda) {
            List<Parameter> params = new ArrayList<>();
            if (lambda.lambdaParams() != null) {
                for (PythonParser.LambdaParamContext param : lambda.lambdaParams().lambdaParam()) {
                    params.add(lambdaParameter(param));
                }
            }
            return new Expr.Lambda(params, expr(lambda.expr()));
        }
        if (ctx instanceof PythonParser.NamedExprContext named) {
            return new Expr.NamedExpr(named.NAME().getText(), expr(named.expr()));
        }
        log.debug("Keeping unrecognized expression as text: {}", text(ctx));
        return new Expr.Raw(text(ctx));
    }

    /** {@code a < b < c} is one comparison with two operators. */
    private Expr compare(PythonParser.CompareExprContext ctx) {
        List<String> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        PythonParser.CompareExprContext current = ctx;
        List<PythonParser.CompareExprContext> chain = new ArrayList<>();
        while (true) {
            chain.add(0, current);
            if (!(current.expr(0) instanceof PythonParser.CompareExprContext left)) {
                break;
            }
            current = left;
        }
        Expr left = expr(chain.get(0).expr(0));
        for (PythonParser.CompareExprContext link : chain) {
            ops.add(compareOperator(link.compOp()));
            comparators.add(expr(link.expr(1)));
        }
        return new Expr.Compare(left, ops, comparators);
    }

    private static String compareOperator(PythonParser.CompOpContext ctx) {
        List<String> parts = new ArrayList<>();
        for (ParseTree child : ctx.children) {
            parts.add(child.getText());
        }
        String op = String.join(" ", parts);
        return "<>".equals(op) ? "!=" : op;
    }

    private Expr boolOp(PythonParser.ExprContext ctx) {
        String op = ctx instanceof PythonParser.AndExprContext ? "and" : "or";
        List<Expr> values = new ArrayList<>();
        collectBoolOperands(ctx, ctx.getClass(), values);
        return new Expr.BoolOp(op, values);
    }

    private void collectBoolOperands(PythonParser.ExprContext ctx, Class<?> kind, List<Expr> values) {
        if (ctx.getClass() != kind) {
            values.add(expr(ctx));
            return;
        }
        for (ParseTree child : ((ParserRuleContext) ctx).children) {
            if (child instanceof PythonParser.ExprContext operand) {
                collectBoolOperands(operand, kind, values);
            }
        }
    }

    private Expr atom(PythonParser.AtomContext ctx) {
        if (ctx instanceof PythonParser.NameAtomContext name) {
            return new Expr.Name(name.NAME().getText());
        }
        if (ctx instanceof PythonParser.NumberAtomContext number) {
            return new Expr.Constant(number.NUMBER().getText());
        }
        if (ctx instanceof PythonParser.StringAtomContext string) {
            return strings(string);
        }
        if (ctx instanceof PythonParser.NoneAtomContext) {
            return Expr.Constant.NONE;
        }
        if (ctx instanceof PythonParser.TrueAtomContext) {
            return new Expr.Constant("True");
        }
        if (ctx instanceof PythonParser.FalseAtomContext) {
            return new Expr.Constant("False");
        }
        if (ctx instanceof PythonParser.EllipsisAtomContext) {
            return new Expr.Constant("...");
        }
        if (ctx instanceof PythonParser.ParenAtomContext paren) {
            if (paren.yieldExpr() != null) {
                return yieldOf(paren.yieldExpr());
            }
            PythonParser.TestListCompContext contents = paren.testListComp();
            if (contents == null) {
                return new Expr.Tuple(List.of());
            }
            if (contents.compFor() != null) {
                return comprehension(Expr.Comprehension.Kind.GENERATOR, contents);
            }
            List<Expr> elements = elements(contents);
            return elements.size() == 1 && contents.COMMA().isEmpty() ? elements.get(0) : new Expr.Tuple(elements);
        }
        if (ctx instanceof PythonParser.ListAtomContext list) {
            PythonParser.TestListCompContext contents = list.testListComp();
            if (contents == null) {
                return new Expr.ListDisplay(List.of());
            }
            if (contents.compFor() != null) {
                return comprehension(Expr.Comprehension.Kind.LIST, contents);
            }
            return new Expr.ListDisplay(elements(contents));
        }
        return dictOrSet(((PythonParser.DictOrSetAtomContext) ctx).dictOrSetMaker());
    }

    private Expr comprehension(Expr.Comprehension.Kind kind, PythonParser.TestListCompContext ctx) {
        return new Expr.Comprehension(kind, elements(ctx).get(0), null, clauses(ctx.compFor()));
    }

    private Expr dictOrSet(PythonParser.DictOrSetMakerContext ctx) {
        if (ctx == null) {
            return new Expr.DictDisplay(List.of());
        }
        if (!ctx.dictEntry().isEmpty()) {
            List<Expr.DictEntry> entries = new ArrayList<>();
            for (PythonParser.DictEntryContext entry : ctx.dictEntry()) {
                entries.add(entry.POWER() != null
                        ? new Expr.DictEntry(null, expr(entry.expr(0)))
                        : new Expr.DictEntry(expr(entry.expr(0)), expr(entry.expr(1))));
            }
            if (ctx.compFor() != null) {
                Expr.DictEntry first = entries.get(0);
                return new Expr.Comprehension(Expr.Comprehension.Kind.DICT, first.key(), first.value(),
                        clauses(ctx.compFor()));
            }
            return new Expr.DictDisplay(entries);
        }
        List<Expr> elements = elements(ctx);
        if (ctx.compFor() != null) {
            return new Expr.Comprehension(Expr.Comprehension.Kind.SET, elements.get(0), null, clauses(ctx.compFor()));
        }
        return new Expr.SetDisplay(elements);
    }

    /** Flattens the {@code for}/{@code if} chain; each {@code if} belongs to the preceding {@code for}. */
    private List<Expr.ComprehensionClause> clauses(PythonParser.CompForContext first) {
        List<Expr.ComprehensionClause> result = new ArrayList<>();
        PythonParser.CompForContext loop = first;
        while (loop != null) {
            List<Expr> conditions = new ArrayList<>();
            PythonParser.CompForContext nextLoop = null;
            PythonParser.CompIterContext iter = loop.compIter();
            while (iter != null) {
                if (iter.compFor() != null) {
                    nextLoop = iter.compFor();
                    break;
                }
                conditions.add(expr(iter.compIf().expr()));
                iter = iter.compIf().compIter();
            }
            result.add(new Expr.ComprehensionClause(targetList(loop.targetList()), expr(loop.expr()),
                    conditions, loop.ASYNC() != null));
            loop = nextLoop;
        }
        return result;
    }

    private List<Argument> arguments(PythonParser.ArgumentsContext ctx) {
        List<Argument> result = new ArrayList<>();
        if (ctx == null) {
            return result;
        }
        for (PythonParser.ArgumentContext argument : ctx.argument()) {
            if (argument instanceof PythonParser.GeneratorArgumentContext generator) {
                result.add(Argument.positional(new Expr.Comprehension(Expr.Comprehension.Kind.GENERATOR,
                        expr(generator.expr()), null, clauses(generator.compFor()))));
            } else if (argument instanceof PythonParser.KeywordArgumentContext keyword) {
                result.add(Argument.keyword(keyword.NAME().getText(), expr(keyword.expr())));
            } else if (argument instanceof PythonParser.StarArgumentContext star) {
                result.add(new Argument(Argument.Kind.STAR, null, expr(star.expr())));
            } else if (argument instanceof PythonParser.DoubleStarArgumentContext doubleStar) {
                result.add(new Argument(Argument.Kind.DOUBLE_STAR, null, expr(doubleStar.expr())));
            } else {
                result.add(Argument.positional(expr(((PythonParser.PositionalArgumentContext) argument).expr())));
            }
        }
        return result;
    }

    private Expr subscripts(PythonParser.SubscriptsContext ctx) {
        List<Expr> items = new ArrayList<>();
        for (PythonParser.SubscriptContext subscript : ctx.subscript()) {
            items.add(subscript(subscript));
        }
        return items.size() == 1 && ctx.COMMA().isEmpty() ? items.get(0) : new Expr.Tuple(items);
    }

    private Expr subscript(PythonParser.SubscriptContext ctx) {
        if (ctx instanceof PythonParser.IndexSubscriptContext index) {
            return expr(index.expr());
        }
        if (ctx instanceof PythonParser.StarSubscriptContext star) {
            return new Expr.Starred(expr(star.starExpr().expr()));
        }
        Expr[] parts = new Expr[3];
        int colons = 0;
        for (ParseTree child : ((ParserRuleContext) ctx).children) {
            if (child instanceof PythonParser.ExprContext part) {
                parts[colons] = expr(part);
            } else {
                colons++;
            }
        }
        return new Expr.Slice(parts[0], parts[1], parts[2]);
    }

    // ---------------------------------------------------------------- strings

    private Expr strings(PythonParser.StringAtomContext ctx) {
        StringBuilder value = new StringBuilder();
        boolean bytes = false;
        for (int i = 0; i < ctx.STRING().size(); i++) {
            String token = ctx.STRING(i).getText();
            int quote = firstQuote(token);
            String prefix = token.substring(0, quote).toLowerCase();
            if (prefix.contains("f")) {
                return new Expr.Raw(text(ctx));
            }
            if (i == 0) {
                bytes = prefix.contains("b");
            }
            String body = stripQuotes(token.substring(quote));
            value.append(prefix.contains("r") ? body : PythonStrings.unescape(body, bytes));
        }
        return new Expr.StringLiteral(value.toString(), bytes);
    }

    private static int firstQuote(String token) {
        int i = 0;
        while (token.charAt(i) != '\'' && token.charAt(i) != '"') {
            i++;
        }
        return i;
    }

    private static String stripQuotes(String quoted) {
        int width = quoted.startsWith("'''") || quoted.startsWith("\"\"\"") ? 3 : 1;
        return quoted.substring(width, quoted.length() - width);
    }

    // ---------------------------------------------------------------- helpers

    private static List<String> names(List<TerminalNode> nodes) {
        List<String> result = new ArrayList<>();
        for (TerminalNode node : nodes) {
            result.add(node.getText());
        }
        return result;
    }

    /** Exact source text of a rule, whitespace and comments included. */
    private static String text(ParserRuleContext ctx) {
        return ctx.start.getInputStream().getText(Interval.of(ctx.start.getStartIndex(), ctx.stop.getStopIndex()));
    }
}
