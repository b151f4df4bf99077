package io.kcl.tools.ls.ast.expr;

import io.kcl.tools.ls.ast.NameToken;
import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.stmt.Stmt;

import java.util.List;

/**
 * {@code lambda x: int -> int { ... }}. The body is a statement list.
 */
public class LambdaExpr extends Expr {

    private final ArgumentsExpr args;
    private final NameToken returnType;
    private final List<Stmt> body;

    public LambdaExpr(Span span, ArgumentsExpr args, NameToken returnType, List<Stmt> body) {
        super(span);
        this.args = args;
        this.returnType = returnType;
        this.body = children(body);
    }

    public ArgumentsExpr getArgs() {
        return args;
    }

    public NameToken getReturnType() {
        return returnType;
    }

    public List<Stmt> getBody() {
        return body;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LAMBDA;
    }
}
