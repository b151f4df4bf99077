package io.kcl.tools.ls.ast.types;

import io.kcl.tools.ls.ast.Span;

import java.util.List;

/**
 * A reference to a schema type, possibly qualified: {@code pkg.Schema}.
 */
public class NamedType extends TypeNode {

    private final List<String> names;
    private final String pkgpath;

    public NamedType(Span span, List<String> names, String pkgpath) {
        super(span);
        this.names = children(names);
        this.pkgpath = pkgpath == null ? "" : pkgpath;
    }

    public List<String> getNames() {
        return names;
    }

    public String getPkgpath() {
        return pkgpath;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.NAMED;
    }

    @Override
    public String toString() {
        return String.join(".", names);
    }
}
