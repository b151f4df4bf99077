package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.ast.Pos;
import io.kcl.tools.ls.ast.Program;
import io.kcl.tools.ls.ast.expr.Expr;
import io.kcl.tools.ls.ast.expr.IdentifierExpr;
import io.kcl.tools.ls.ast.expr.SchemaExpr;
import io.kcl.tools.ls.ast.stmt.SchemaAttrStmt;
import io.kcl.tools.ls.ast.stmt.SchemaStmt;
import io.kcl.tools.ls.nav.ExprLocator;
import io.kcl.tools.ls.nav.NavResult;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;

/**
 * Produces Hover content for the expression under the cursor.
 */
public class HoverProvider {

    /**
     * @param showSchemaContext name the schema whose config body holds the position
     * @return the hover, or null when no expression is at the position
     */
    public Hover hover(Program program, Pos pos, boolean showSchemaContext) {
        NavResult found = ExprLocator.locate(program, pos);
        if (!found.hasExpr()) {
            return null;
        }
        Expr expr = found.getExpr();
        SchemaExpr ctx = found.getSchemaContext();
        StringBuilder content = new StringBuilder();

        if (expr instanceof IdentifierExpr) {
            IdentifierExpr identifier = (IdentifierExpr) expr;
            SchemaAttrStmt attr = ctx == null ? null : attribute(program, ctx, identifier);
            SchemaStmt schema = Declarations.findSchema(program, Declarations.simpleName(identifier));
            if (attr != null) {
                content.append("**").append(attr.getName().getValue()).append("**");
                if (attr.getTy() != null) {
                    content.append(": `").append(attr.getTy()).append("`");
                }
                appendDoc(content, attr.getDoc());
            } else if (schema != null) {
                content.append("**schema** `").append(schema.getName().getValue()).append("`");
                appendDoc(content, schema.getDoc());
            } else {
                content.append("`").append(identifier.getName()).append("`");
            }
        } else {
            content.append(kindName(expr));
        }
        if (showSchemaContext && ctx != null && ctx.getName() != null) {
            content.append("\n\nIn schema `").append(ctx.getName().getName()).append("`");
        }

        MarkupContent markup = new MarkupContent();
        markup.setKind(MarkupKind.MARKDOWN);
        markup.setValue(content.toString());
        Hover hover = new Hover(markup);
        hover.setRange(LspConversions.lspRange(expr.getSpan()));
        return hover;
    }

    static SchemaAttrStmt attribute(Program program, SchemaExpr ctx, IdentifierExpr identifier) {
        if (ctx.getName() == null) {
            return null;
        }
        SchemaStmt schema = Declarations.findSchema(program, Declarations.simpleName(ctx.getName()));
        if (schema == null || identifier.getNames().isEmpty()) {
            return null;
        }
        return schema.getAttr(identifier.getNames().get(0));
    }

    private static void appendDoc(StringBuilder content, String doc) {
        if (doc != null && !doc.isBlank()) {
            content.append("\n\n").append(doc.strip());
        }
    }

    private static String kindName(Expr expr) {
        return expr.getKind().name().toLowerCase().replace('_', ' ') + " expression";
    }
}
