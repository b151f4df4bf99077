package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.compile.CompiledProgram;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts compiler diagnostics of one file to LSP diagnostics.
 */
public class DiagnosticsProvider {

    public static final String SOURCE = "kcl";

    public List<Diagnostic> diagnose(CompiledProgram compiled, String filename) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (io.kcl.tools.ls.compile.Diagnostic diagnostic : compiled.getDiagnostics(filename)) {
            diagnostics.add(createDiagnostic(diagnostic));
        }
        return diagnostics;
    }

    private Diagnostic createDiagnostic(io.kcl.tools.ls.compile.Diagnostic source) {
        Diagnostic diag = new Diagnostic();
        diag.setRange(LspConversions.lspRange(source.getStart(), source.getEnd()));
        diag.setMessage(source.getMessage());
        diag.setSeverity(severity(source.getLevel()));
        diag.setSource(SOURCE);
        if (source.getCode() != null) {
            diag.setCode(source.getCode());
        }
        return diag;
    }

    static DiagnosticSeverity severity(io.kcl.tools.ls.compile.Diagnostic.Level level) {
        return switch (level) {
            case ERROR -> DiagnosticSeverity.Error;
            case WARNING -> DiagnosticSeverity.Warning;
            case SUGGESTIONS -> DiagnosticSeverity.Hint;
        };
    }
}
