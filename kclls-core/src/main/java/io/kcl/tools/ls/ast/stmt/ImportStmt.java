package io.kcl.tools.ls.ast.stmt;

import io.kcl.tools.ls.ast.Span;

/**
 * {@code import a.b.c as d}. {@code path} is the resolved package path, {@code rawpath}
 * the text as written (relative imports start with a dot).
 */
public class ImportStmt extends Stmt {

    private final String path;
    private final String rawpath;
    private final String name;
    private final String asname;
    private final String pkgName;

    public ImportStmt(Span span, String path, String rawpath, String name, String asname, String pkgName) {
        super(span);
        this.path = path;
        this.rawpath = rawpath == null ? path : rawpath;
        this.name = name;
        this.asname = asname;
        this.pkgName = pkgName == null ? "" : pkgName;
    }

    public String getPath() {
        return path;
    }

    public String getRawpath() {
        return rawpath;
    }

    public String getName() {
        return name;
    }

    public String getAsname() {
        return asname;
    }

    /**
     * Name of the external package the import belongs to, or empty for a local import.
     */
    public String getPkgName() {
        return pkgName;
    }

    public boolean isRelative() {
        return rawpath != null && rawpath.startsWith(".");
    }

    @Override
    public StmtKind getKind() {
        return StmtKind.IMPORT;
    }
}
