package io.kcl.tools.ls.ast.types;

public enum TypeKind {
    ANY,
    NAMED,
    BASIC,
    LIST,
    DICT,
    UNION,
    LITERAL
}
