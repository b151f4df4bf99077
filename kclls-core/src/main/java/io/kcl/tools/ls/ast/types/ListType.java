package io.kcl.tools.ls.ast.types;

import io.kcl.tools.ls.ast.Span;

/**
 * {@code [T]}. The inner type is null for a bare {@code []}.
 */
public class ListType extends TypeNode {

    private final TypeNode innerType;

    public ListType(Span span, TypeNode innerType) {
        super(span);
        this.innerType = innerType;
    }

    public TypeNode getInnerType() {
        return innerType;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.LIST;
    }

    @Override
    public String toString() {
        return "[" + (innerType == null ? "" : innerType) + "]";
    }
}
