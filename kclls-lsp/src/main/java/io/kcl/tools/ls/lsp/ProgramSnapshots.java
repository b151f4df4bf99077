package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.compile.CompiledProgram;
import io.kcl.tools.ls.compile.ProgramCompiler;
import io.kcl.tools.ls.compile.SourceOverlay;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Compiled programs keyed by the file they were compiled for. Queries share a snapshot
 * until an edit to one of its files drops it.
 */
public class ProgramSnapshots {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    static final int MAX_COMPILE_ATTEMPTS = 3;

    private final ProgramCompiler compiler;
    private final SourceOverlay overlay;
    private final Map<Path, CompiledProgram> snapshots = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    // bumped by every invalidation, guarded by lock
    private long generation;

    public ProgramSnapshots(ProgramCompiler compiler, SourceOverlay overlay) {
        this.compiler = compiler;
        this.overlay = overlay;
    }

    /**
     * Returns the cached snapshot for {@code file}, compiling it first when there is none.
     * A compile that overlapped an invalidation is not cached and runs again.
     */
    public CompiledProgram get(Path file) {
        CompiledProgram compiled = null;
        for (int attempt = 0; attempt < MAX_COMPILE_ATTEMPTS; attempt++) {
            long startGeneration;
            lock.readLock().lock();
            try {
                CompiledProgram cached = snapshots.get(file);
                if (cached != null) {
                    return cached;
                }
                startGeneration = generation;
            } finally {
                lock.readLock().unlock();
            }
            compiled = compiler.compile(file.toString(), overlay);
            lock.writeLock().lock();
            try {
                if (generation == startGeneration) {
                    CompiledProgram raced = snapshots.putIfAbsent(file, compiled);
                    return raced != null ? raced : compiled;
                }
            } finally {
                lock.writeLock().unlock();
            }
            logger.debugf("sources of %s changed while compiling, compiling again", file);
        }
        logger.warnf("sources of %s keep changing, answering with an uncached compile", file);
        return compiled;
    }

    /**
     * Drops every snapshot compiled for {@code file} or containing it.
     */
    public void invalidate(Path file) {
        String filename = file.toString();
        lock.writeLock().lock();
        try {
            generation++;
            Iterator<Map.Entry<Path, CompiledProgram>> entries = snapshots.entrySet().iterator();
            while (entries.hasNext()) {
                Map.Entry<Path, CompiledProgram> entry = entries.next();
                if (entry.getKey().equals(file) || entry.getValue().getProgram().getModule(filename) != null) {
                    logger.debugf("dropping snapshot of %s", entry.getKey());
                    entries.remove();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidateAll() {
        lock.writeLock().lock();
        try {
            generation++;
            snapshots.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isCached(Path file) {
        lock.readLock().lock();
        try {
            return snapshots.containsKey(file);
        } finally {
            lock.readLock().unlock();
        }
    }
}
