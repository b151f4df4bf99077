package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.expr.Expr;

import java.util.List;

public class ExprStmt extends Stmt {

    private final List<Expr> exprs;

    public ExprStmt(Span span, List<Expr> exprs) {
        super(span);
        this.exprs = children(exprs);
    }

    public List<Expr> getExprs() {
        return exprs;
    }

    @Override
    public StmtKind getKind() {
        return StmtKind.EXPR;
    }
}
