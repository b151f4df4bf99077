package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

public class ListCompExpr extends Expr {

    private final Expr elt;
    private final List<CompClauseExpr> generators;

    public ListCompExpr(Span span, Expr elt, List<CompClauseExpr> generators) {
        super(span);
        this.elt = elt;
        this.generators = children(generators);
    }

    public Expr getElt() {
        return elt;
    }

    public List<CompClauseExpr> getGenerators() {
        return generators;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LIST_COMP;
    }
}
