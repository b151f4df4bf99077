package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

/**
 * Keyword argument {@code arg=value}.
 */
public class KeywordExpr extends Expr {

    private final IdentifierExpr arg;
    private final Expr value;

    public KeywordExpr(Span span, IdentifierExpr arg, Expr value) {
        super(span);
        this.arg = arg;
        this.value = value;
    }

    public IdentifierExpr getArg() {
        return arg;
    }

    public Expr getValue() {
        return value;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.KEYWORD;
    }
}
