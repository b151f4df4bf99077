package io.kcl.tools.ls.pkg;

import io.kcl.tools.ls.ast.Pos;
import io.kcl.tools.ls.ast.Program;
import io.kcl.tools.ls.ast.stmt.ImportStmt;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves import statements to the files they bring in. Each target is reported as the
 * first line of the file, without a column.
 */
public class ImportPositions {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private final ExternalPackages externalPackages;

    public ImportPositions(ExternalPackages externalPackages) {
        this.externalPackages = externalPackages;
    }

    /**
     * A module path points either at {@code path.k} or at a package directory.
     */
    public static List<Pos> fromRealPath(Path realPath) {
        Set<Pos> positions = new LinkedHashSet<>();
        Path kFile = KclFiles.withExtension(realPath, KclFiles.KCL_FILE_EXTENSION);
        if (Files.isRegularFile(kFile)) {
            positions.add(Pos.wholeLine(kFile.toString(), 1));
        } else if (Files.isDirectory(realPath)) {
            try {
                for (String file : KclFiles.kclFiles(realPath, false)) {
                    positions.add(Pos.wholeLine(file, 1));
                }
            } catch (IOException e) {
                logger.warnf("failed to list %s: %s", realPath, e.getMessage());
            }
        }
        return new ArrayList<>(positions);
    }

    /**
     * Looks in the program root first, then, for non relative imports, in the external
     * package the import belongs to.
     */
    public List<Pos> resolve(Program program, ImportStmt importStmt) {
        Path root = Paths.get(program.getRoot());
        Path realPath = root.resolve(importStmt.getPath().replace('.', '/'));
        List<Pos> positions = fromRealPath(realPath);
        if (positions.isEmpty() && !importStmt.isRelative()) {
            Path external = externalPackages.realPathFromExternal(importStmt.getPkgName(), importStmt.getPath(), root);
            positions = fromRealPath(external);
        }
        return positions;
    }
}
