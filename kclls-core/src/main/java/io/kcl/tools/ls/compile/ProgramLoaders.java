package io.kcl.tools.ls.compile;

import io.kcl.tools.ls.ast.Program;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;
import java.util.Collections;
import java.util.Iterator;
import java.util.ServiceLoader;

public final class ProgramLoaders {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    /**
     * Loads nothing; every query against its programs finds no statement.
     */
    public static final ProgramLoader EMPTY = (files, options) ->
            new CompiledProgram(Program.empty(options == null ? "" : options.getWorkDir()), Collections.emptyList());

    private ProgramLoaders() {
    }

    /**
     * Returns the first installed {@link ProgramLoader}, or {@link #EMPTY} when there is none.
     */
    public static ProgramLoader discover(ClassLoader classLoader) {
        Iterator<ProgramLoader> loaders = ServiceLoader.load(ProgramLoader.class, classLoader).iterator();
        if (loaders.hasNext()) {
            ProgramLoader loader = loaders.next();
            logger.infof("using program loader %s", loader.getClass().getName());
            return loader;
        }
        logger.warn("no program loader installed, documents will not be parsed");
        return EMPTY;
    }
}
