package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.AstNode;
import io.kcl.tools.ls.ast.Span;

/**
 * Base class of all expression nodes.
 */
public abstract class Expr extends AstNode {

    protected Expr(Span span) {
        super(span);
    }

    public abstract ExprKind getKind();
}
