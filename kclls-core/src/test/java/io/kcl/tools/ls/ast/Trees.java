package io.kcl.tools.ls.ast;

import io.kcl.tools.ls.ast.expr.BinaryExpr;
import io.kcl.tools.ls.ast.expr.ConfigExpr;
import io.kcl.tools.ls.ast.expr.Expr;
import io.kcl.tools.ls.ast.expr.IdentifierExpr;
import io.kcl.tools.ls.ast.expr.NumberLitExpr;
import io.kcl.tools.ls.ast.expr.SchemaExpr;
import io.kcl.tools.ls.ast.expr.StringLitExpr;
import io.kcl.tools.ls.ast.stmt.AssignStmt;
import io.kcl.tools.ls.ast.stmt.Stmt;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builders for hand written syntax trees. Every node lives on {@link #FILE} and spans are
 * given as start line, start column, end line, end column.
 */
public final class Trees {

    public static final String FILE = "/work/main.k";

    private Trees() {
    }

    public static Span span(int line, int column, int endLine, int endColumn) {
        return new Span(FILE, line, column, endLine, endColumn);
    }

    /**
     * A span on one line starting at {@code column} covering {@code length} characters.
     */
    public static Span at(int line, int column, int length) {
        return span(line, column, line, column + length - 1);
    }

    public static Pos pos(int line, int column) {
        return Pos.of(FILE, line, column);
    }

    public static IdentifierExpr id(String name, int line, int column) {
        return new IdentifierExpr(at(line, column, name.length()), name.split("\\."));
    }

    public static NameToken token(String value, int line, int column) {
        return new NameToken(at(line, column, value.length()), value);
    }

    public static NumberLitExpr num(int value, int line, int column) {
        return new NumberLitExpr(at(line, column, String.valueOf(value).length()), value);
    }

    public static StringLitExpr str(String value, int line, int column) {
        return new StringLitExpr(at(line, column, value.length() + 2), value);
    }

    public static BinaryExpr add(Expr left, Expr right) {
        Span l = left.getSpan();
        Span r = right.getSpan();
        return new BinaryExpr(span(l.getLine(), l.getColumn(), r.getEndLine(), r.getEndColumn()), left, BinaryExpr.Op.ADD, right);
    }

    /**
     * {@code key = value}, spanning from the key to the end of the value.
     */
    public static ConfigEntry entry(Expr key, Expr value) {
        Span k = key.getSpan();
        Span v = value.getSpan();
        return new ConfigEntry(span(k.getLine(), k.getColumn(), v.getEndLine(), v.getEndColumn()), key, value,
                ConfigEntry.Operation.OVERRIDE);
    }

    public static ConfigExpr config(Span span, ConfigEntry... entries) {
        return new ConfigExpr(span, List.of(entries));
    }

    /**
     * {@code Name {...}} with the name starting where the expression starts.
     */
    public static SchemaExpr schema(IdentifierExpr name, ConfigExpr config) {
        Span n = name.getSpan();
        Span c = config.getSpan();
        return new SchemaExpr(span(n.getLine(), n.getColumn(), c.getEndLine(), c.getEndColumn()), name,
                Collections.emptyList(), Collections.emptyList(), config);
    }

    public static AssignStmt assign(IdentifierExpr target, Expr value) {
        Span t = target.getSpan();
        Span v = value.getSpan();
        return new AssignStmt(span(t.getLine(), t.getColumn(), v.getEndLine(), v.getEndColumn()), List.of(target), value);
    }

    public static Program program(Stmt... body) {
        Module module = new Module(FILE, Program.MAIN_PKG, null, List.of(body));
        return new Program("/work", Program.MAIN_PKG, Map.of(Program.MAIN_PKG, List.of(module)));
    }
}
