package io.kcl.tools.ls.ast;

import io.kcl.tools.ls.ast.stmt.Stmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The modules of one compile unit grouped by package path.
 * Instances are immutable snapshots shared by concurrent queries.
 */
public class Program {

    public static final String MAIN_PKG = "__main__";

    private final String root;
    private final String main;
    private final Map<String, List<Module>> pkgs;

    public Program(String root, String main, Map<String, List<Module>> pkgs) {
        this.root = root == null ? "" : root;
        this.main = main == null ? MAIN_PKG : main;
        Map<String, List<Module>> copy = new LinkedHashMap<>();
        if (pkgs != null) {
            pkgs.forEach((name, modules) -> copy.put(name, Collections.unmodifiableList(new ArrayList<>(modules))));
        }
        this.pkgs = Collections.unmodifiableMap(copy);
    }

    public static Program empty(String root) {
        return new Program(root, MAIN_PKG, Collections.emptyMap());
    }

    public String getRoot() {
        return root;
    }

    public String getMain() {
        return main;
    }

    public Map<String, List<Module>> getPkgs() {
        return pkgs;
    }

    public List<Module> getModules(String pkg) {
        return pkgs.getOrDefault(pkg, Collections.emptyList());
    }

    public List<Module> getAllModules() {
        List<Module> rtrn = new ArrayList<>();
        pkgs.values().forEach(rtrn::addAll);
        return rtrn;
    }

    /**
     * Finds the module parsed from the given file, searching every package.
     */
    public Module getModule(String filename) {
        for (List<Module> modules : pkgs.values()) {
            for (Module module : modules) {
                if (module.getFilename() != null && module.getFilename().equals(filename)) {
                    return module;
                }
            }
        }
        return null;
    }

    /**
     * Returns the top-level statement of the position's file that contains it, or null.
     */
    public Stmt posToStmt(Pos pos) {
        Module module = getModule(pos.getFilename());
        return module == null ? null : module.posToStmt(pos);
    }
}
