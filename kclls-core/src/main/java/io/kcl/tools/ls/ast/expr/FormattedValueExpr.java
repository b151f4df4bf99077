package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

public class FormattedValueExpr extends Expr {

    private final Expr value;
    private final String formatSpec;

    public FormattedValueExpr(Span span, Expr value, String formatSpec) {
        super(span);
        this.value = value;
        this.formatSpec = formatSpec;
    }

    public Expr getValue() {
        return value;
    }

    public String getFormatSpec() {
        return formatSpec;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.FORMATTED_VALUE;
    }
}
