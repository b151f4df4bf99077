package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * Conditional list items {@code [if cond: a, b else: c]}.
 */
public class ListIfItemExpr extends Expr {

    private final Expr ifCond;
    private final List<Expr> exprs;
    private final Expr orelse;

    public ListIfItemExpr(Span span, Expr ifCond, List<Expr> exprs, Expr orelse) {
        super(span);
        this.ifCond = ifCond;
        this.exprs = children(exprs);
        this.orelse = orelse;
    }

    public Expr getIfCond() {
        return ifCond;
    }

    public List<Expr> getExprs() {
        return exprs;
    }

    public Expr getOrelse() {
        return orelse;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LIST_IF_ITEM;
    }
}
