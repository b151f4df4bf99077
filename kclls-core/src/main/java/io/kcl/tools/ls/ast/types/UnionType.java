package io.kcl.tools.ls.ast.types;

import io.kcl.tools.ls.ast.Span;

import java.util.List;
import java.util.stream.Collectors;

public class UnionType extends TypeNode {

    private final List<TypeNode> elements;

    public UnionType(Span span, List<TypeNode> elements) {
        super(span);
        this.elements = children(elements);
    }

    public List<TypeNode> getElements() {
        return elements;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.UNION;
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(" | "));
    }
}
