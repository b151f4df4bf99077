package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.ast.Module;
import io.kcl.tools.ls.ast.NameToken;
import io.kcl.tools.ls.ast.Program;
import io.kcl.tools.ls.ast.expr.IdentifierExpr;
import io.kcl.tools.ls.ast.stmt.RuleStmt;
import io.kcl.tools.ls.ast.stmt.SchemaStmt;
import io.kcl.tools.ls.ast.stmt.Stmt;

import java.util.List;

/**
 * Lookup of top-level schema and rule declarations by name.
 */
final class Declarations {

    private Declarations() {
    }

    /**
     * The last segment of a dotted name, e.g. {@code Deployment} for {@code apps.Deployment}.
     */
    static String simpleName(IdentifierExpr identifier) {
        if (identifier == null) {
            return "";
        }
        List<String> names = identifier.getNames();
        return names.isEmpty() ? "" : names.get(names.size() - 1);
    }

    static SchemaStmt findSchema(Program program, String name) {
        for (Module module : program.getAllModules()) {
            for (Stmt stmt : module.getBody()) {
                if (stmt instanceof SchemaStmt && named(((SchemaStmt) stmt).getName(), name)) {
                    return (SchemaStmt) stmt;
                }
            }
        }
        return null;
    }

    static RuleStmt findRule(Program program, String name) {
        for (Module module : program.getAllModules()) {
            for (Stmt stmt : module.getBody()) {
                if (stmt instanceof RuleStmt && named(((RuleStmt) stmt).getName(), name)) {
                    return (RuleStmt) stmt;
                }
            }
        }
        return null;
    }

    // parse recovery can leave a declaration without a name
    private static boolean named(NameToken token, String name) {
        return token != null && !name.isEmpty() && name.equals(token.getValue());
    }
}
