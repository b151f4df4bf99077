package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.ConfigEntry;
import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * Conditional config entries {@code if cond: k = v else: ...} inside a config body.
 */
public class ConfigIfEntryExpr extends Expr {

    private final Expr ifCond;
    private final List<ConfigEntry> items;
    private final Expr orelse;

    public ConfigIfEntryExpr(Span span, Expr ifCond, List<ConfigEntry> items, Expr orelse) {
        super(span);
        this.ifCond = ifCond;
        this.items = children(items);
        this.orelse = orelse;
    }

    public Expr getIfCond() {
        return ifCond;
    }

    public List<ConfigEntry> getItems() {
        return items;
    }

    public Expr getOrelse() {
        return orelse;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.CONFIG_IF_ENTRY;
    }
}
