package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.expr.BinaryExpr;
import io.kcl.tools.ls.ast.expr.Expr;
import io.kcl.tools.ls.ast.expr.IdentifierExpr;

/**
 * {@code target op= value}, e.g. {@code a += 1}.
 */
public class AugAssignStmt extends Stmt {

    private final IdentifierExpr target;
    private final BinaryExpr.Op op;
    private final Expr value;

    public AugAssignStmt(Span span, IdentifierExpr target, BinaryExpr.Op op, Expr value) {
        super(span);
        this.target = target;
        this.op = op;
        this.value = value;
    }

    public IdentifierExpr getTarget() {
        return target;
    }

    public BinaryExpr.Op getOp() {
        return op;
    }

    public Expr getValue() {
        return value;
    }

    @Override
    public StmtKind getKind() {
        return StmtKind.AUG_ASSIGN;
    }
}
