package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

public class ParenExpr extends Expr {

    private final Expr expr;

    public ParenExpr(Span span, Expr expr) {
        super(span);
        this.expr = expr;
    }

    public Expr getExpr() {
        return expr;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.PAREN;
    }
}
