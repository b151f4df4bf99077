package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

public class StringLitExpr extends Expr {

    private final String value;
    private final String rawValue;
    private final boolean longString;

    public StringLitExpr(Span span, String value, String rawValue, boolean longString) {
        super(span);
        this.value = value;
        this.rawValue = rawValue;
        this.longString = longString;
    }

    public StringLitExpr(Span span, String value) {
        this(span, value, "\"" + value + "\"", false);
    }

    public String getValue() {
        return value;
    }

    public String getRawValue() {
        return rawValue;
    }

    public boolean isLongString() {
        return longString;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.STRING_LIT;
    }
}
