package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.NameToken;
import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.expr.BinaryExpr;
import io.kcl.tools.ls.ast.expr.CallExpr;
import io.kcl.tools.ls.ast.expr.Expr;
import io.kcl.tools.ls.ast.types.TypeNode;

import java.util.List;

/**
 * An attribute declaration inside a schema body, e.g. {@code name?: str = "x"}.
 */
public class SchemaAttrStmt extends Stmt {

    private final String doc;
    private final NameToken name;
    private final TypeNode ty;
    private final BinaryExpr.Op op;
    private final Expr value;
    private final boolean optional;
    private final List<CallExpr> decorators;

    public SchemaAttrStmt(Span span, String doc, NameToken name, TypeNode ty, BinaryExpr.Op op, Expr value,
                          boolean optional, List<CallExpr> decorators) {
        super(span);
        this.doc = doc;
        this.name = name;
        this.ty = ty;
        this.op = op;
        this.value = value;
        this.optional = optional;
        this.decorators = children(decorators);
    }

    public String getDoc() {
        return doc;
    }

    public NameToken getName() {
        return name;
    }

    public TypeNode getTy() {
        return ty;
    }

    public BinaryExpr.Op getOp() {
        return op;
    }

    public Expr getValue() {
        return value;
    }

    public boolean isOptional() {
        return optional;
    }

    public List<CallExpr> getDecorators() {
        return decorators;
    }

    @Override
    public StmtKind getKind() {
        return StmtKind.SCHEMA_ATTR;
    }
}
