package io.kcl.tools.ls.compile;

import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;

/**
 * Compiles the unit a file belongs to, reading open buffers in place of disk contents.
 */
public class ProgramCompiler {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private final CompileUnitResolver resolver;
    private final ProgramLoader loader;

    public ProgramCompiler(CompileUnitResolver resolver, ProgramLoader loader) {
        this.resolver = resolver;
        this.loader = loader;
    }

    /**
     * @param overlay open buffers, or null to compile from disk only
     * @throws PathConversionException when a unit file name is not an absolute path
     * @throws OverlayReadException    when a unit file can not be read
     */
    public CompiledProgram compile(String file, SourceOverlay overlay) {
        CompileUnit unit = resolver.lookup(file, true);
        LoadProgramOptions options = unit.getOptions();
        options.setLoadPlugins(true);
        if (overlay != null) {
            options.getKCodeList().addAll(SourceLoader.loadFilesCode(unit.getFiles(), overlay));
        }
        logger.debugf("compiling %s as %s", file, unit.getFiles());
        return loader.load(unit.getFiles(), options);
    }
}
