package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.ast.Pos;
import io.kcl.tools.ls.ast.Program;
import io.kcl.tools.ls.ast.expr.IdentifierExpr;
import io.kcl.tools.ls.ast.stmt.ImportStmt;
import io.kcl.tools.ls.ast.stmt.RuleStmt;
import io.kcl.tools.ls.ast.stmt.SchemaAttrStmt;
import io.kcl.tools.ls.ast.stmt.SchemaStmt;
import io.kcl.tools.ls.ast.stmt.Stmt;
import io.kcl.tools.ls.nav.ExprLocator;
import io.kcl.tools.ls.nav.NavResult;
import io.kcl.tools.ls.pkg.ImportPositions;
import org.eclipse.lsp4j.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolves go-to-definition targets: imported files, schema and rule declarations and,
 * inside a schema's config body, the declaration of the attribute being set.
 */
public class DefinitionProvider {

    private final ImportPositions importPositions;

    public DefinitionProvider(ImportPositions importPositions) {
        this.importPositions = importPositions;
    }

    public List<Location> definition(Program program, Pos pos) {
        Stmt stmt = program.posToStmt(pos);
        if (stmt == null) {
            return Collections.emptyList();
        }
        if (stmt instanceof ImportStmt) {
            List<Location> locations = new ArrayList<>();
            for (Pos target : importPositions.resolve(program, (ImportStmt) stmt)) {
                locations.add(LspConversions.lspLocation(target));
            }
            return locations;
        }

        NavResult found = ExprLocator.locateInStmt(stmt, pos, null);
        if (!(found.getExpr() instanceof IdentifierExpr)) {
            return Collections.emptyList();
        }
        IdentifierExpr identifier = (IdentifierExpr) found.getExpr();
        if (found.hasSchemaContext()) {
            SchemaAttrStmt attr = HoverProvider.attribute(program, found.getSchemaContext(), identifier);
            if (attr != null) {
                return List.of(LspConversions.lspLocation(attr.getName().getSpan()));
            }
        }
        String name = Declarations.simpleName(identifier);
        SchemaStmt schema = Declarations.findSchema(program, name);
        if (schema != null) {
            return List.of(LspConversions.lspLocation(schema.getName().getSpan()));
        }
        RuleStmt rule = Declarations.findRule(program, name);
        if (rule != null) {
            return List.of(LspConversions.lspLocation(rule.getName().getSpan()));
        }
        return Collections.emptyList();
    }
}
