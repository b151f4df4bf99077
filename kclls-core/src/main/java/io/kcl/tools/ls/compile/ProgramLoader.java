package io.kcl.tools.ls.compile;

import java.util.List;

/**
 * Parses and resolves a compile unit. Implementations are looked up with
 * {@link java.util.ServiceLoader}.
 */
public interface ProgramLoader {

    CompiledProgram load(List<String> files, LoadProgramOptions options);
}
