package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.NameToken;
import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.expr.ArgumentsExpr;
import io.kcl.tools.ls.ast.expr.CallExpr;
import io.kcl.tools.ls.ast.expr.CheckExpr;
import io.kcl.tools.ls.ast.expr.IdentifierExpr;

import java.util.List;

public class RuleStmt extends Stmt {

    private final String doc;
    private final NameToken name;
    private final List<IdentifierExpr> parentRules;
    private final List<CallExpr> decorators;
    private final List<CheckExpr> checks;
    private final ArgumentsExpr args;
    private final IdentifierExpr forHostName;

    public RuleStmt(Span span, String doc, NameToken name, List<IdentifierExpr> parentRules,
                    List<CallExpr> decorators, List<CheckExpr> checks, ArgumentsExpr args,
                    IdentifierExpr forHostName) {
        super(span);
        this.doc = doc;
        this.name = name;
        this.parentRules = children(parentRules);
        this.decorators = children(decorators);
        this.checks = children(checks);
        this.args = args;
        this.forHostName = forHostName;
    }

    public String getDoc() {
        return doc;
    }

    public NameToken getName() {
        return name;
    }

    public List<IdentifierExpr> getParentRules() {
        return parentRules;
    }

    public List<CallExpr> getDecorators() {
        return decorators;
    }

    public List<CheckExpr> getChecks() {
        return checks;
    }

    public ArgumentsExpr getArgs() {
        return args;
    }

    public IdentifierExpr getForHostName() {
        return forHostName;
    }

    @Override
    public StmtKind getKind() {
        return StmtKind.RULE;
    }
}
