package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.expr.Expr;

/**
 * {@code assert test if ifCond, msg}.
 */
public class AssertStmt extends Stmt {

    private final Expr test;
    private final Expr ifCond;
    private final Expr msg;

    public AssertStmt(Span span, Expr test, Expr ifCond, Expr msg) {
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
    public StmtKind getKind() {
        return StmtKind.ASSERT;
    }
}
