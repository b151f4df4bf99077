package io.kcl.tools.ls.ast.types;

import io.kcl.tools.ls.ast.Span;

public class AnyType extends TypeNode {

    public AnyType(Span span) {
        super(span);
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.ANY;
    }

    @Override
    public String toString() {
        return "any";
    }
}
