package io.kcl.tools.ls.compile;

import io.kcl.tools.ls.ast.Program;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class ProgramCompilerTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private List<String> loadedFiles;
    private LoadProgramOptions loadedOptions;
    private ProgramCompiler compiler;

    @Before
    public void setUp() {
        ProgramLoader recording = (files, options) -> {
            loadedFiles = files;
            loadedOptions = options;
            return new CompiledProgram(Program.empty(options.getWorkDir()), Collections.emptyList());
        };
        compiler = new ProgramCompiler(new CompileUnitResolver(null), recording);
    }

    @Test
    public void testOverlayCodeFollowsFileOrder() throws IOException {
        Path a = folder.newFile("a.k").toPath();
        Files.writeString(a, "a = 1\n");
        Path b = folder.newFile("b.k").toPath();
        Files.writeString(b, "b = 1\n");

        compiler.compile(b.toString(), path -> path.equals(b.normalize()) ? "b = 2\n" : null);

        assertEquals(List.of(a.toString(), b.toString()), loadedFiles);
        assertEquals(List.of("a = 1\n", "b = 2\n"), loadedOptions.getKCodeList());
        assertTrue(loadedOptions.isLoadPlugins());
    }

    @Test
    public void testNoOverlayLeavesCodeListEmpty() throws IOException {
        Path a = folder.newFile("a.k").toPath();

        CompiledProgram compiled = compiler.compile(a.toString(), null);

        assertNotNull(compiled.getProgram());
        assertTrue(loadedOptions.getKCodeList().isEmpty());
        assertTrue(loadedOptions.isLoadPlugins());
    }

    @Test(expected = OverlayReadException.class)
    public void testMissingUnitFile() throws IOException {
        Path settings = folder.getRoot().toPath().resolve(KclSettings.FILE_NAME);
        Files.writeString(settings, "kcl_cli_configs:\n  files:\n    - gone.k\n");
        Path main = folder.newFile("main.k").toPath();

        compiler.compile(main.toString(), path -> null);
    }
}
