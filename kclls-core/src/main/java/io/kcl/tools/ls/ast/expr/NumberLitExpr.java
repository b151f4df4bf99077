package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

/**
 * Int or float literal, with an optional unit suffix such as {@code Mi}.
 */
public class NumberLitExpr extends Expr {

    private final Number value;
    private final String binarySuffix;

    public NumberLitExpr(Span span, Number value, String binarySuffix) {
        super(span);
        this.value = value;
        this.binarySuffix = binarySuffix;
    }

    public NumberLitExpr(Span span, Number value) {
        this(span, value, null);
    }

    public Number getValue() {
        return value;
    }

    public String getBinarySuffix() {
        return binarySuffix;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.NUMBER_LIT;
    }
}
