package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.NameToken;
import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.expr.Expr;
import io.kcl.tools.ls.ast.expr.IdentifierExpr;
import io.kcl.tools.ls.ast.types.TypeNode;

import java.util.List;

/**
 * {@code a = b = value} with an optional {@code : type} annotation.
 */
public class AssignStmt extends Stmt {

    private final List<IdentifierExpr> targets;
    private final Expr value;
    private final NameToken typeAnnotation;
    private final TypeNode ty;

    public AssignStmt(Span span, List<IdentifierExpr> targets, Expr value, NameToken typeAnnotation, TypeNode ty) {
        super(span);
        this.targets = children(targets);
        this.value = value;
        this.typeAnnotation = typeAnnotation;
        this.ty = ty;
    }

    public AssignStmt(Span span, List<IdentifierExpr> targets, Expr value) {
        this(span, targets, value, null, null);
    }

    public List<IdentifierExpr> getTargets() {
        return targets;
    }

    public Expr getValue() {
        return value;
    }

    public NameToken getTypeAnnotation() {
        return typeAnnotation;
    }

    public TypeNode getTy() {
        return ty;
    }

    @Override
    public StmtKind getKind() {
        return StmtKind.ASSIGN;
    }
}
