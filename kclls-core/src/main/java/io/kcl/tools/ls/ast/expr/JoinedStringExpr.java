package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * Interpolated string {@code "Hello ${name}"}; values alternate between string
 * literals and {@link FormattedValueExpr}s.
 */
public class JoinedStringExpr extends Expr {

    private final List<Expr> values;
    private final String rawValue;
    private final boolean longString;

    public JoinedStringExpr(Span span, List<Expr> values, String rawValue, boolean longString) {
        super(span);
        this.values = children(values);
        this.rawValue = rawValue;
        this.longString = longString;
    }

    public List<Expr> getValues() {
        return values;
    }

    public String getRawValue() {
        return rawValue;
    }

    public boolean isLongString() {
        return longString;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.JOINED_STRING;
    }
}
