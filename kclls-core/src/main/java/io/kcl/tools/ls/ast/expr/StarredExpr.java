package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

public class StarredExpr extends Expr {

    private final Expr value;

    public StarredExpr(Span span, Expr value) {
        super(span);
        this.value = value;
    }

    public Expr getValue() {
        return value;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.STARRED;
    }
}
