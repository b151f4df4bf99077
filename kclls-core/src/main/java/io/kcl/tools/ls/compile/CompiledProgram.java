package io.kcl.tools.ls.compile;

import io.kcl.tools.ls.ast.Program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A parsed program and the diagnostics produced while loading it.
 */
public class CompiledProgram {

    private final Program program;
    private final List<Diagnostic> diagnostics;

    public CompiledProgram(Program program, List<Diagnostic> diagnostics) {
        this.program = program;
        this.diagnostics = diagnostics == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public Program getProgram() {
        return program;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getDiagnostics(String filename) {
        return diagnostics.stream()
                .filter(d -> d.getStart() != null && d.getStart().getFilename().equals(filename))
                .collect(Collectors.toList());
    }
}
