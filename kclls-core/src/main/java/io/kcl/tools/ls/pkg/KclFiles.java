package io.kcl.tools.ls.pkg;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File system helpers for KCL sources and module roots.
 */
public final class KclFiles {

    public static final String KCL_FILE_EXTENSION = "k";
    public static final String KCL_FILE_SUFFIX = ".k";
    public static final String KCL_TEST_FILE_SUFFIX = "_test.k";
    public static final String KCL_MOD_FILE = "kcl.mod";

    private KclFiles() {
    }

    public static boolean isKclFile(Path path) {
        return path.getFileName() != null && path.getFileName().toString().endsWith(KCL_FILE_SUFFIX);
    }

    /**
     * Lists the {@code .k} files under {@code dir}, sorted by path.
     *
     * @param recursive descend into sub directories
     */
    public static List<String> kclFiles(Path dir, boolean recursive) throws IOException {
        try (Stream<Path> paths = recursive ? Files.walk(dir) : Files.list(dir)) {
            return paths.filter(Files::isRegularFile)
                    .filter(KclFiles::isKclFile)
                    .map(Path::toString)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * The source files of the package in {@code dir}, test files excluded.
     */
    public static List<String> packageFiles(Path dir) throws IOException {
        return kclFiles(dir, false).stream()
                .filter(file -> !file.endsWith(KCL_TEST_FILE_SUFFIX))
                .collect(Collectors.toList());
    }

    /**
     * Walks up from {@code start} to the nearest directory holding {@code fileName}.
     *
     * @return that directory, or null when no ancestor has the file
     */
    public static Path lookupNearestDir(Path start, String fileName) {
        Path dir = Files.isDirectory(start) ? start : start.getParent();
        while (dir != null) {
            if (Files.isRegularFile(dir.resolve(fileName))) {
                return dir;
            }
            dir = dir.getParent();
        }
        return null;
    }

    /**
     * Replaces the extension of the last path element, or appends one when it has none.
     */
    public static Path withExtension(Path path, String extension) {
        Path name = path.getFileName();
        if (name == null) {
            return path;
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return path.resolveSibling(stem + "." + extension);
    }
}
