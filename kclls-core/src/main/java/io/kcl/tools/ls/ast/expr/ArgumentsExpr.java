package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.NameToken;
import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * Parameter list of a lambda, schema or rule. {@code defaults} and
 * {@code typeAnnotations} run parallel to {@code args} and hold null where a
 * parameter has no default or no annotation.
 */
public class ArgumentsExpr extends Expr {

    private final List<IdentifierExpr> args;
    private final List<Expr> defaults;
    private final List<NameToken> typeAnnotations;

    public ArgumentsExpr(Span span, List<IdentifierExpr> args, List<Expr> defaults, List<NameToken> typeAnnotations) {
        super(span);
        this.args = children(args);
        this.defaults = children(defaults);
        this.typeAnnotations = children(typeAnnotations);
    }

    public List<IdentifierExpr> getArgs() {
        return args;
    }

    public List<Expr> getDefaults() {
        return defaults;
    }

    public List<NameToken> getTypeAnnotations() {
        return typeAnnotations;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.ARGUMENTS;
    }
}
