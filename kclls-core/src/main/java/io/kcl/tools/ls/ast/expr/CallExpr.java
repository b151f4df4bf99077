package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * Function call; also the shape of schema and attribute decorators.
 */
public class CallExpr extends Expr {

    private final Expr func;
    private final List<Expr> args;
    private final List<KeywordExpr> keywords;

    public CallExpr(Span span, Expr func, List<Expr> args, List<KeywordExpr> keywords) {
        super(span);
        this.func = func;
        this.args = children(args);
        this.keywords = children(keywords);
    }

    public Expr getFunc() {
        return func;
    }

    public List<Expr> getArgs() {
        return args;
    }

    public List<KeywordExpr> getKeywords() {
        return keywords;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.CALL;
    }
}
