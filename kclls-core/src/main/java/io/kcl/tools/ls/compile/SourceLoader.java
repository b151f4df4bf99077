package io.kcl.tools.ls.compile;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public final class SourceLoader {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private SourceLoader() {
    }

    /**
     * Returns one source text per file, in file order. Open buffers win over disk so that
     * unsaved edits are compiled.
     *
     * @throws PathConversionException when a file name is not a valid absolute path
     * @throws OverlayReadException    when a file is neither open nor readable on disk
     */
    public static List<String> loadFilesCode(List<String> files, SourceOverlay overlay) {
        List<String> rtrn = new ArrayList<>(files.size());
        for (String file : files) {
            Path path = toAbsPath(file);
            String text = overlay == null ? null : overlay.read(path);
            if (text == null) {
                try {
                    text = Files.readString(path, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new OverlayReadException("can't read file: " + file, e);
                }
            } else {
                logger.tracef("using open buffer for %s", path);
            }
            rtrn.add(text);
        }
        return rtrn;
    }

    static Path toAbsPath(String file) {
        Path path;
        try {
            path = Paths.get(file);
        } catch (RuntimeException e) {
            throw new PathConversionException("can't convert file to url: " + file, e);
        }
        if (!path.isAbsolute()) {
            throw new PathConversionException("can't convert file to url: " + file);
        }
        return path.normalize();
    }
}
