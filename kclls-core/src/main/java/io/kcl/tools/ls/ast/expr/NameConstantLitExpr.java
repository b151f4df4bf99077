package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

/**
 * {@code True}, {@code False}, {@code None} or {@code Undefined}.
 */
public class NameConstantLitExpr extends Expr {

    public enum Value {
        TRUE("True"),
        FALSE("False"),
        NONE("None"),
        UNDEFINED("Undefined");

        private final String symbol;

        Value(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Value value;

    public NameConstantLitExpr(Span span, Value value) {
        super(span);
        this.value = value;
    }

    public Value getValue() {
        return value;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.NAME_CONSTANT_LIT;
    }
}
