package io.kcl.tools.ls.ast.stmt;

public enum StmtKind {
    ASSIGN,
    TYPE_ALIAS,
    EXPR,
    UNIFICATION,
    AUG_ASSIGN,
    ASSERT,
    IF,
    SCHEMA,
    SCHEMA_ATTR,
    RULE,
    IMPORT
}
