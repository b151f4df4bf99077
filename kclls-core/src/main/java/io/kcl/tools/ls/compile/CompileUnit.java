package io.kcl.tools.ls.compile;

import java.util.Collections;
import java.util.List;

/**
 * The files compiled together for one target file, with their load options.
 */
public class CompileUnit {

    private final List<String> files;
    private final LoadProgramOptions options;

    public CompileUnit(List<String> files, LoadProgramOptions options) {
        this.files = Collections.unmodifiableList(files);
        this.options = options == null ? new LoadProgramOptions() : options;
    }

    public List<String> getFiles() {
        return files;
    }

    public LoadProgramOptions getOptions() {
        return options;
    }
}
