package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.ConfigEntry;
import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * A {@code {k: v, ...}} config literal.
 */
public class ConfigExpr extends Expr {

    private final List<ConfigEntry> items;

    public ConfigExpr(Span span, List<ConfigEntry> items) {
        super(span);
        this.items = children(items);
    }

    public List<ConfigEntry> getItems() {
        return items;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.CONFIG;
    }
}
