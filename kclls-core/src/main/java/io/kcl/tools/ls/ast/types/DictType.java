package io.kcl.tools.ls.ast.types;

import io.kcl.tools.ls.ast.Span;

/**
 * {@code {K:V}}. Either side may be null when omitted.
 */
public class DictType extends TypeNode {

    private final TypeNode keyType;
    private final TypeNode valueType;

    public DictType(Span span, TypeNode keyType, TypeNode valueType) {
        super(span);
        this.keyType = keyType;
        this.valueType = valueType;
    }

    public TypeNode getKeyType() {
        return keyType;
    }

    public TypeNode getValueType() {
        return valueType;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.DICT;
    }

    @Override
    public String toString() {
        return "{" + (keyType == null ? "" : keyType) + ":" + (valueType == null ? "" : valueType) + "}";
    }
}
