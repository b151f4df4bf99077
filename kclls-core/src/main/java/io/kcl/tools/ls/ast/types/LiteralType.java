package io.kcl.tools.ls.ast.types;

import io.kcl.tools.ls.ast.Span;

/**
 * A literal value used as a type, e.g. {@code "dev" | "prod"} or {@code 1}.
 */
public class LiteralType extends TypeNode {

    private final String literal;

    public LiteralType(Span span, String literal) {
        super(span);
        this.literal = literal;
    }

    public String getLiteral() {
        return literal;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.LITERAL;
    }

    @Override
    public String toString() {
        return literal;
    }
}
