package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.expr.Expr;

import java.util.List;

/**
 * {@code if cond: body else: orelse}. An {@code elif} is an IfStmt nested in orelse.
 */
public class IfStmt extends Stmt {

    private final Expr cond;
    private final List<Stmt> body;
    private final List<Stmt> orelse;

    public IfStmt(Span span, Expr cond, List<Stmt> body, List<Stmt> orelse) {
        super(span);
        this.cond = cond;
        this.body = children(body);
        this.orelse = children(orelse);
    }

    public Expr getCond() {
        return cond;
    }

    public List<Stmt> getBody() {
        return body;
    }

    public List<Stmt> getOrelse() {
        return orelse;
    }

    @Override
    public StmtKind getKind() {
        return StmtKind.IF;
    }
}
