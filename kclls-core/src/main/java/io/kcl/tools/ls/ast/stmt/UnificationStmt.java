package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.expr.IdentifierExpr;
import io.kcl.tools.ls.ast.expr.SchemaExpr;

/**
 * {@code name: Schema {...}}.
 */
public class UnificationStmt extends Stmt {

    private final IdentifierExpr target;
    private final SchemaExpr value;

    public UnificationStmt(Span span, IdentifierExpr target, SchemaExpr value) {
        super(span);
        this.target = target;
        this.value = value;
    }

    public IdentifierExpr getTarget() {
        return target;
    }

    public SchemaExpr getValue() {
        return value;
    }

    @Override
    public StmtKind getKind() {
        return StmtKind.UNIFICATION;
    }
}
