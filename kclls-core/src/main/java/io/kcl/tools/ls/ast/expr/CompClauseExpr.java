package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * One {@code for targets in iter if ...} clause of a comprehension.
 */
public class CompClauseExpr extends Expr {

    private final List<IdentifierExpr> targets;
    private final Expr iter;
    private final List<Expr> ifs;

    public CompClauseExpr(Span span, List<IdentifierExpr> targets, Expr iter, List<Expr> ifs) {
        super(span);
        this.targets = children(targets);
        this.iter = iter;
        this.ifs = children(ifs);
    }

    public List<IdentifierExpr> getTargets() {
        return targets;
    }

    public Expr getIter() {
        return iter;
    }

    public List<Expr> getIfs() {
        return ifs;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.COMP_CLAUSE;
    }
}
