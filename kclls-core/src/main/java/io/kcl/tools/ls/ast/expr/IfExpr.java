package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

/**
 * Conditional expression {@code body if cond else orelse}.
 */
public class IfExpr extends Expr {

    private final Expr body;
    private final Expr cond;
    private final Expr orelse;

    public IfExpr(Span span, Expr body, Expr cond, Expr orelse) {
        super(span);
        this.body = body;
        this.cond = cond;
        this.orelse = orelse;
    }

    public Expr getBody() {
        return body;
    }

    public Expr getCond() {
        return cond;
    }

    public Expr getOrelse() {
        return orelse;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.IF;
    }
}
