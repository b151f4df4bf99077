package io.kcl.tools.ls.ast.types;

import io.kcl.tools.ls.ast.AstNode;
import io.kcl.tools.ls.ast.Span;

/**
 * Base class of parsed type annotations.
 */
public abstract class TypeNode extends AstNode {

    protected TypeNode(Span span) {
        super(span);
    }

    public abstract TypeKind getKind();
}
