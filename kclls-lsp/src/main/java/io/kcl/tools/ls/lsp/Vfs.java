package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.compile.SourceOverlay;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Text of the documents open in the client, keyed by absolute path.
 * A batch of changes is applied under the write lock so readers never see a partial edit.
 */
public class Vfs implements SourceOverlay {

    private final Map<Path, String> files = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void open(Path path, String text) {
        lock.writeLock().lock();
        try {
            files.put(path, text == null ? "" : text);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the updated text, or null when the document is not open
     */
    public String change(Path path, List<TextDocumentContentChangeEvent> changes) {
        lock.writeLock().lock();
        try {
            String text = files.get(path);
            if (text == null) {
                return null;
            }
            String updated = DocumentChanges.apply(text, changes);
            files.put(path, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void close(Path path) {
        lock.writeLock().lock();
        try {
            files.remove(path);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String read(Path path) {
        lock.readLock().lock();
        try {
            return files.get(path);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isOpen(Path path) {
        return read(path) != null;
    }

    public List<Path> openPaths() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(files.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }
}
