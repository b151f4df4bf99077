package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

public class UnaryExpr extends Expr {

    public enum Op {
        UADD("+"),
        USUB("-"),
        INVERT("~"),
        NOT("not");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Op op;
    private final Expr operand;

    public UnaryExpr(Span span, Op op, Expr operand) {
        super(span);
        this.op = op;
        this.operand = operand;
    }

    public Op getOp() {
        return op;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.UNARY;
    }
}
