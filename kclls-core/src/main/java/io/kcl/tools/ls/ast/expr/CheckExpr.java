package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

/**
 * One line of a schema or rule {@code check:} block.
 */
public class CheckExpr extends Expr {

    private final Expr test;
    private final Expr ifCond;
    private final Expr msg;

    public CheckExpr(Span span, Expr test, Expr ifCond, Expr msg) {
        super(span);
        this.test = test;
        this.ifCond = ifCond;
        this.msg = msg;
    }

    public Expr getTest() {
        return test;
    }

    public Expr getIfCond() {
        return ifCond;
    }

    public Expr getMsg() {
        return msg;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.CHECK;
    }
}
