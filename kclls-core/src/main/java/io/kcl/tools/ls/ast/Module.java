package io.kcl.tools.ls.ast;

import io.kcl.tools.ls.ast.stmt.Stmt;

import java.util.Collections;
import java.util.List;

/**
 * A parsed KCL file.
 */
public class Module {

    private final String filename;
    private final String pkg;
    private final String doc;
    private final List<Stmt> body;

    public Module(String filename, String pkg, String doc, List<Stmt> body) {
        this.filename = filename;
        this.pkg = pkg;
        this.doc = doc;
        this.body = body == null ? Collections.emptyList() : Collections.unmodifiableList(body);
    }

    public String getFilename() {
        return filename;
    }

    public String getPkg() {
        return pkg;
    }

    public String getDoc() {
        return doc;
    }

    public List<Stmt> getBody() {
        return body;
    }

    /**
     * Returns the top-level statement containing the position, or null.
     */
    public Stmt posToStmt(Pos pos) {
        for (Stmt stmt : body) {
            if (stmt.contains(pos)) {
                return stmt;
            }
        }
        return null;
    }
}
