package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * A possibly dotted name, e.g. {@code a.b.c}, optionally qualified by a package path.
 */
public class IdentifierExpr extends Expr {

    public enum Context {
        LOAD,
        STORE
    }

    private final List<String> names;
    private final String pkgpath;
    private final Context ctx;

    public IdentifierExpr(Span span, List<String> names, String pkgpath, Context ctx) {
        super(span);
        this.names = children(names);
        this.pkgpath = pkgpath == null ? "" : pkgpath;
        this.ctx = ctx == null ? Context.LOAD : ctx;
    }

    public IdentifierExpr(Span span, String... names) {
        this(span, List.of(names), "", Context.LOAD);
    }

    public List<String> getNames() {
        return names;
    }

    public String getPkgpath() {
        return pkgpath;
    }

    public Context getCtx() {
        return ctx;
    }

    public String getName() {
        return String.join(".", names);
    }

    /**
     * True for identifiers built from a non-expression fragment of the tree.
     */
    public boolean isSynthetic() {
        return false;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.IDENTIFIER;
    }

    @Override
    public String toString() {
        return getName();
    }
}
