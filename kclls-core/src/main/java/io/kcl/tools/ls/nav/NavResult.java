package io.kcl.tools.ls.nav;

import io.kcl.tools.ls.ast.expr.Expr;
import io.kcl.tools.ls.ast.expr.SchemaExpr;

import java.util.Objects;

/**
 * Outcome of a position query: the innermost expression at the position, if any, and the
 * schema instantiation whose config body encloses it, if any.
 */
public class NavResult {

    public static final NavResult NONE = new NavResult(null, null);

    private final Expr expr;
    private final SchemaExpr schemaContext;

    public NavResult(Expr expr, SchemaExpr schemaContext) {
        this.expr = expr;
        this.schemaContext = schemaContext;
    }

    public static NavResult of(Expr expr, SchemaExpr schemaContext) {
        return expr == null && schemaContext == null ? NONE : new NavResult(expr, schemaContext);
    }

    public Expr getExpr() {
        return expr;
    }

    public SchemaExpr getSchemaContext() {
        return schemaContext;
    }

    public boolean hasExpr() {
        return expr != null;
    }

    public boolean hasSchemaContext() {
        return schemaContext != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NavResult)) return false;
        NavResult that = (NavResult) o;
        return expr == that.expr && schemaContext == that.schemaContext;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(expr), System.identityHashCode(schemaContext));
    }

    @Override
    public String toString() {
        return "NavResult{expr=" + (expr == null ? "none" : expr.getKind() + "@" + expr.getSpan())
                + ", schemaContext=" + (schemaContext == null ? "none" : schemaContext.getName()) + "}";
    }
}
