package io.kcl.tools.ls.pkg;

import io.kcl.tools.ls.ast.Pos;
import io.kcl.tools.ls.ast.Program;
import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.stmt.ImportStmt;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ImportPositionsTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path root;

    @Before
    public void setUp() throws IOException {
        root = folder.newFolder("work").toPath();
    }

    private Path write(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
        return file;
    }

    @Test
    public void testModuleFile() throws IOException {
        Path models = write(root.resolve("app/models.k"));

        List<Pos> positions = ImportPositions.fromRealPath(root.resolve("app/models"));

        assertEquals(List.of(Pos.wholeLine(models.toString(), 1)), positions);
        assertFalse(positions.get(0).hasColumn());
    }

    @Test
    public void testPackageDirectory() throws IOException {
        Path b = write(root.resolve("lib/b.k"));
        Path a = write(root.resolve("lib/a.k"));
        write(root.resolve("lib/README.md"));

        List<Pos> positions = ImportPositions.fromRealPath(root.resolve("lib"));

        assertEquals(List.of(Pos.wholeLine(a.toString(), 1), Pos.wholeLine(b.toString(), 1)), positions);
    }

    @Test
    public void testNothingThere() {
        assertTrue(ImportPositions.fromRealPath(root.resolve("nope")).isEmpty());
    }

    @Test
    public void testResolveLocalImport() throws IOException {
        Path models = write(root.resolve("app/models.k"));
        ImportPositions imports = new ImportPositions(new ExternalPackages(path -> {
            fail("local import must not consult package metadata");
            return PackageMetadata.empty();
        }));

        List<Pos> positions = imports.resolve(Program.empty(root.toString()), importStmt("app.models", "app.models", ""));

        assertEquals(List.of(Pos.wholeLine(models.toString(), 1)), positions);
    }

    @Test
    public void testResolveExternalImport() throws IOException {
        Path dep = folder.newFolder("deps", "k8s_1.28").toPath();
        Path deployment = write(dep.resolve("api/apps/deployment.k"));
        ImportPositions imports = new ImportPositions(new ExternalPackages(path -> new PackageMetadata(
                Map.of("k8s", new Package("k8s", dep)))));

        List<Pos> positions = imports.resolve(Program.empty(root.toString()), importStmt("k8s.api.apps", "k8s.api.apps", "k8s"));

        assertEquals(List.of(Pos.wholeLine(deployment.toString(), 1)), positions);
    }

    @Test
    public void testRelativeImportSkipsExternalLookup() {
        ImportPositions imports = new ImportPositions(new ExternalPackages(path -> {
            fail("relative import must not consult package metadata");
            return PackageMetadata.empty();
        }));

        assertTrue(imports.resolve(Program.empty(root.toString()), importStmt("missing", ".missing", "")).isEmpty());
    }

    private static ImportStmt importStmt(String path, String rawpath, String pkgName) {
        return new ImportStmt(new Span("main.k", 1, 0, 1, 7 + rawpath.length()), path, rawpath, null, null, pkgName);
    }
}
