package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.NameToken;
import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.expr.ArgumentsExpr;
import io.kcl.tools.ls.ast.expr.CallExpr;
import io.kcl.tools.ls.ast.expr.CheckExpr;
import io.kcl.tools.ls.ast.expr.IdentifierExpr;

import java.util.List;

/**
 * A schema declaration. Attributes are {@link SchemaAttrStmt}s in the body, mixed with
 * ordinary statements.
 */
public class SchemaStmt extends Stmt {

    private final String doc;
    private final NameToken name;
    private final IdentifierExpr parentName;
    private final IdentifierExpr forHostName;
    private final boolean mixin;
    private final boolean protocol;
    private final ArgumentsExpr args;
    private final List<IdentifierExpr> mixins;
    private final List<Stmt> body;
    private final List<CallExpr> decorators;
    private final List<CheckExpr> checks;

    public SchemaStmt(Span span, String doc, NameToken name, IdentifierExpr parentName, IdentifierExpr forHostName,
                      boolean mixin, boolean protocol, ArgumentsExpr args, List<IdentifierExpr> mixins,
                      List<Stmt> body, List<CallExpr> decorators, List<CheckExpr> checks) {
        super(span);
        this.doc = doc;
        this.name = name;
        this.parentName = parentName;
        this.forHostName = forHostName;
        this.mixin = mixin;
        this.protocol = protocol;
        this.args = args;
        this.mixins = children(mixins);
        this.body = children(body);
        this.decorators = children(decorators);
        this.checks = children(checks);
    }

    public String getDoc() {
        return doc;
    }

    public NameToken getName() {
        return name;
    }

    public IdentifierExpr getParentName() {
        return parentName;
    }

    public IdentifierExpr getForHostName() {
        return forHostName;
    }

    public boolean isMixin() {
        return mixin;
    }

    public boolean isProtocol() {
        return protocol;
    }

    public ArgumentsExpr getArgs() {
        return args;
    }

    public List<IdentifierExpr> getMixins() {
        return mixins;
    }

    public List<Stmt> getBody() {
        return body;
    }

    public List<CallExpr> getDecorators() {
        return decorators;
    }

    public List<CheckExpr> getChecks() {
        return checks;
    }

    /**
     * Returns the attribute declared with the given name directly in this schema, or null.
     */
    public SchemaAttrStmt getAttr(String attrName) {
        for (Stmt stmt : body) {
            if (stmt instanceof SchemaAttrStmt) {
                SchemaAttrStmt attr = (SchemaAttrStmt) stmt;
                if (attr.getName() != null && attr.getName().getValue().equals(attrName)) {
                    return attr;
                }
            }
        }
        return null;
    }

    @Override
    public StmtKind getKind() {
        return StmtKind.SCHEMA;
    }
}
