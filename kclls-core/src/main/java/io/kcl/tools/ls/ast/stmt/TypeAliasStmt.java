package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.NameToken;
import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.expr.IdentifierExpr;
import io.kcl.tools.ls.ast.types.TypeNode;

/**
 * {@code type Name = int | str}.
 */
public class TypeAliasStmt extends Stmt {

    private final IdentifierExpr typeName;
    private final NameToken typeValue;
    private final TypeNode ty;

    public TypeAliasStmt(Span span, IdentifierExpr typeName, NameToken typeValue, TypeNode ty) {
        super(span);
        this.typeName = typeName;
        this.typeValue = typeValue;
        this.ty = ty;
    }

    public IdentifierExpr getTypeName() {
        return typeName;
    }

    public NameToken getTypeValue() {
        return typeValue;
    }

    public TypeNode getTy() {
        return ty;
    }

    @Override
    public StmtKind getKind() {
        return StmtKind.TYPE_ALIAS;
    }
}
