package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * Chained comparison {@code left op1 c1 op2 c2 ...}.
 */
public class CompareExpr extends Expr {

    public enum Op {
        EQ("=="),
        NOT_EQ("!="),
        LT("<"),
        LT_E("<="),
        GT(">"),
        GT_E(">="),
        IS("is"),
        IN("in"),
        NOT_IN("not in"),
        NOT("not"),
        IS_NOT("is not");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Expr left;
    private final List<Op> ops;
    private final List<Expr> comparators;

    public CompareExpr(Span span, Expr left, List<Op> ops, List<Expr> comparators) {
        super(span);
        this.left = left;
        this.ops = children(ops);
        this.comparators = children(comparators);
    }

    public Expr getLeft() {
        return left;
    }

    public List<Op> getOps() {
        return ops;
    }

    public List<Expr> getComparators() {
        return comparators;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.COMPARE;
    }
}
