package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

/**
 * Index {@code value[index]} or slice {@code value[lower:upper:step]}.
 */
public class SubscriptExpr extends Expr {

    private final Expr value;
    private final Expr index;
    private final Expr lower;
    private final Expr upper;
    private final Expr step;
    private final boolean hasQuestion;

    public SubscriptExpr(Span span, Expr value, Expr index, Expr lower, Expr upper, Expr step, boolean hasQuestion) {
        super(span);
        this.value = value;
        this.index = index;
        this.lower = lower;
        this.upper = upper;
        this.step = step;
        this.hasQuestion = hasQuestion;
    }

    public static SubscriptExpr index(Span span, Expr value, Expr index) {
        return new SubscriptExpr(span, value, index, null, null, null, false);
    }

    public static SubscriptExpr slice(Span span, Expr value, Expr lower, Expr upper, Expr step) {
        return new SubscriptExpr(span, value, null, lower, upper, step, false);
    }

    public Expr getValue() {
        return value;
    }

    public Expr getIndex() {
        return index;
    }

    public Expr getLower() {
        return lower;
    }

    public Expr getUpper() {
        return upper;
    }

    public Expr getStep() {
        return step;
    }

    public boolean hasQuestion() {
        return hasQuestion;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.SUBSCRIPT;
    }
}
