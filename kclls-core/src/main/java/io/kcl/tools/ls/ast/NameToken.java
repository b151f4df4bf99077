package io.kcl.tools.ls.ast;

/**
 * A raw name carrying its own span that is not an expression in the grammar,
 * e.g. a schema name or the type string of an annotation.
 */
public class NameToken extends AstNode {

    private final String value;

    public NameToken(Span span, String value) {
        super(span);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
