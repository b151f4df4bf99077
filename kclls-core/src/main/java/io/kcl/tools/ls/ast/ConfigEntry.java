package io.kcl.tools.ls.ast;

import io.kcl.tools.ls.ast.expr.Expr;

/**
 * One {@code key: value} entry of a config or config-if body.
 * The key is null for unpacking entries such as {@code **base}.
 */
public class ConfigEntry extends AstNode {

    public enum Operation {
        UNION(":"),
        OVERRIDE("="),
        INSERT("+=");

        private final String symbol;

        Operation(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Expr key;
    private final Expr value;
    private final Operation operation;
    private final int insertIndex;

    public ConfigEntry(Span span, Expr key, Expr value, Operation operation) {
        this(span, key, value, operation, -1);
    }

    public ConfigEntry(Span span, Expr key, Expr value, Operation operation, int insertIndex) {
        super(span);
        this.key = key;
        this.value = value;
        this.operation = operation;
        this.insertIndex = insertIndex;
    }

    public Expr getKey() {
        return key;
    }

    public Expr getValue() {
        return value;
    }

    public Operation getOperation() {
        return operation;
    }

    public int getInsertIndex() {
        return insertIndex;
    }
}
