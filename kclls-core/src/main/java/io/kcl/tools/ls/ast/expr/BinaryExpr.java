package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

public class BinaryExpr extends Expr {

    public enum Op {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),
        POW("**"),
        FLOOR_DIV("//"),
        LSHIFT("<<"),
        RSHIFT(">>"),
        BIT_XOR("^"),
        BIT_AND("&"),
        BIT_OR("|"),
        AND("and"),
        OR("or"),
        AS("as");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Expr left;
    private final Op op;
    private final Expr right;

    public BinaryExpr(Span span, Expr left, Op op, Expr right) {
        super(span);
        this.left = left;
        this.op = op;
        this.right = right;
    }

    public Expr getLeft() {
        return left;
    }

    public Op getOp() {
        return op;
    }

    public Expr getRight() {
        return right;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.BINARY;
    }
}
