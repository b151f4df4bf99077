package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.ConfigEntry;
import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * Dict comprehension {@code {k: v for k, v in items}}.
 */
public class DictCompExpr extends Expr {

    private final ConfigEntry entry;
    private final List<CompClauseExpr> generators;

    public DictCompExpr(Span span, ConfigEntry entry, List<CompClauseExpr> generators) {
        super(span);
        this.entry = entry;
        this.generators = children(generators);
    }

    public ConfigEntry getEntry() {
        return entry;
    }

    public List<CompClauseExpr> getGenerators() {
        return generators;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.DICT_COMP;
    }
}
