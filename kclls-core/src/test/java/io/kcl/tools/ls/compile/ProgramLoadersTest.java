package io.kcl.tools.ls.compile;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ProgramLoadersTest {

    @Test
    public void testEmptyLoaderWhenNoneInstalled() {
        ProgramLoader loader = ProgramLoaders.discover(getClass().getClassLoader());
        assertSame(ProgramLoaders.EMPTY, loader);
    }

    @Test
    public void testEmptyLoaderUsesWorkDirAsRoot() {
        LoadProgramOptions options = new LoadProgramOptions();
        options.setWorkDir("/work");
        CompiledProgram compiled = ProgramLoaders.EMPTY.load(List.of("/work/main.k"), options);
        assertEquals("/work", compiled.getProgram().getRoot());
        assertTrue(compiled.getProgram().getAllModules().isEmpty());
        assertTrue(compiled.getDiagnostics().isEmpty());
    }
}
