package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

/**
 * Attribute access {@code value.attr} or {@code value?.attr}.
 */
public class SelectorExpr extends Expr {

    private final Expr value;
    private final IdentifierExpr attr;
    private final boolean hasQuestion;

    public SelectorExpr(Span span, Expr value, IdentifierExpr attr, boolean hasQuestion) {
        super(span);
        this.value = value;
        this.attr = attr;
        this.hasQuestion = hasQuestion;
    }

    public Expr getValue() {
        return value;
    }

    public IdentifierExpr getAttr() {
        return attr;
    }

    public boolean hasQuestion() {
        return hasQuestion;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.SELECTOR;
    }
}
