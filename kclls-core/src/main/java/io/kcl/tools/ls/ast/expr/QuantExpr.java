package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * Quantifier expression, e.g. {@code all x in items { x > 0 }}.
 */
public class QuantExpr extends Expr {

    public enum Op {
        ALL,
        ANY,
        FILTER,
        MAP
    }

    private final Expr target;
    private final List<IdentifierExpr> variables;
    private final Op op;
    private final Expr test;
    private final Expr ifCond;

    public QuantExpr(Span span, Expr target, List<IdentifierExpr> variables, Op op, Expr test, Expr ifCond) {
        super(span);
        this.target = target;
        this.variables = children(variables);
        this.op = op;
        this.test = test;
        this.ifCond = ifCond;
    }

    public Expr getTarget() {
        return target;
    }

    public List<IdentifierExpr> getVariables() {
        return variables;
    }

    public Op getOp() {
        return op;
    }

    public Expr getTest() {
        return test;
    }

    public Expr getIfCond() {
        return ifCond;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.QUANT;
    }
}
