package io.kcl.tools.ls.ast.expr;

/**
 * Closed set of expression variants of the KCL grammar.
 */
public enum ExprKind {
    IDENTIFIER,
    SELECTOR,
    SCHEMA,
    CONFIG,
    UNARY,
    BINARY,
    IF,
    CALL,
    PAREN,
    QUANT,
    LIST,
    LIST_IF_ITEM,
    LIST_COMP,
    STARRED,
    DICT_COMP,
    CONFIG_IF_ENTRY,
    COMP_CLAUSE,
    CHECK,
    LAMBDA,
    SUBSCRIPT,
    KEYWORD,
    ARGUMENTS,
    COMPARE,
    NUMBER_LIT,
    STRING_LIT,
    NAME_CONSTANT_LIT,
    JOINED_STRING,
    FORMATTED_VALUE,
    MISSING
}
