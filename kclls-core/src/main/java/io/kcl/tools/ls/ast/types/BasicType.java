package io.kcl.tools.ls.ast.types;

import io.kcl.tools.ls.ast.Span;

public class BasicType extends TypeNode {

    public enum Basic {
        BOOL("bool"),
        INT("int"),
        FLOAT("float"),
        STR("str");

        private final String name;

        Basic(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    private final Basic basic;

    public BasicType(Span span, Basic basic) {
        super(span);
        this.basic = basic;
    }

    public Basic getBasic() {
        return basic;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.BASIC;
    }

    @Override
    public String toString() {
        return basic.getName();
    }
}
