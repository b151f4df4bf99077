package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * Schema instantiation, e.g. {@code Person(1) {name = "Alice"}}.
 * The config body is a {@link ConfigExpr} in well formed code.
 */
public class SchemaExpr extends Expr {

    private final IdentifierExpr name;
    private final List<Expr> args;
    private final List<KeywordExpr> kwargs;
    private final Expr config;

    public SchemaExpr(Span span, IdentifierExpr name, List<Expr> args, List<KeywordExpr> kwargs, Expr config) {
        super(span);
        this.name = name;
        this.args = children(args);
        this.kwargs = children(kwargs);
        this.config = config;
    }

    public IdentifierExpr getName() {
        return name;
    }

    public List<Expr> getArgs() {
        return args;
    }

    public List<KeywordExpr> getKwargs() {
        return kwargs;
    }

    public Expr getConfig() {
        return config;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.SCHEMA;
    }
}
