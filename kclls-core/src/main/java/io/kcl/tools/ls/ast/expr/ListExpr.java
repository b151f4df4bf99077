package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

public class ListExpr extends Expr {

    private final List<Expr> elts;

    public ListExpr(Span span, List<Expr> elts) {
        super(span);
        this.elts = children(elts);
    }

    public List<Expr> getElts() {
        return elts;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LIST;
    }
}
