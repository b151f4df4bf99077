package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

/**
 * Placeholder the parser inserts where an expression is missing.
 */
public class MissingExpr extends Expr {

    public MissingExpr(Span span) {
        super(span);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.MISSING;
    }
}
