package io.kcl.tools.ls.compile;

import java.nio.file.Path;

/**
 * In-memory contents of files open in the editor.
 */
public interface SourceOverlay {

    /**
     * @return the buffer text of {@code path}, or null when the file is not open
     */
    String read(Path path);
}
