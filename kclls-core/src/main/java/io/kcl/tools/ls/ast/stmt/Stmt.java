package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.AstNode;
import io.kcl.tools.ls.ast.Span;

/**
 * Base class of all statement nodes.
 */
public abstract class Stmt extends AstNode {

    protected Stmt(Span span) {
        super(span);
    }

    public abstract StmtKind getKind();
}
