package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * An identifier standing in for a fragment that is not an expression in the grammar,
 * such as a type annotation or a schema name. It is never part of a parsed tree.
 */
public class SyntheticIdentifier extends IdentifierExpr {

    public SyntheticIdentifier(Span span, List<String> names, String pkgpath) {
        super(span, names, pkgpath, Context.LOAD);
    }

    @Override
    public boolean isSynthetic() {
        return true;
    }
}
