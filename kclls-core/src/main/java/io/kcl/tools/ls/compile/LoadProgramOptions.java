package io.kcl.tools.ls.compile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options handed to a {@link ProgramLoader} together with the file list of a compile unit.
 * {@code kCodeList}, when not empty, holds the source text of each file in file order and
 * takes precedence over the file system.
 */
public class LoadProgramOptions {

    private String workDir = "";
    private final List<String> kCodeList = new ArrayList<>();
    private boolean loadPlugins;
    private boolean disableNone;
    private boolean strictRangeCheck;
    private final List<String> overrides = new ArrayList<>();
    private final Map<String, String> cmdArgs = new LinkedHashMap<>();
    private final Map<String, String> packageMaps = new LinkedHashMap<>();

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir == null ? "" : workDir;
    }

    public List<String> getKCodeList() {
        return kCodeList;
    }

    public boolean isLoadPlugins() {
        return loadPlugins;
    }

    public void setLoadPlugins(boolean loadPlugins) {
        this.loadPlugins = loadPlugins;
    }

    public boolean isDisableNone() {
        return disableNone;
    }

    public void setDisableNone(boolean disableNone) {
        this.disableNone = disableNone;
    }

    public boolean isStrictRangeCheck() {
        return strictRangeCheck;
    }

    public void setStrictRangeCheck(boolean strictRangeCheck) {
        this.strictRangeCheck = strictRangeCheck;
    }

    public List<String> getOverrides() {
        return overrides;
    }

    /**
     * Top level arguments from {@code kcl_options}, key to value.
     */
    public Map<String, String> getCmdArgs() {
        return cmdArgs;
    }

    /**
     * External package name to its local root directory.
     */
    public Map<String, String> getPackageMaps() {
        return packageMaps;
    }

    @Override
    public String toString() {
        return "LoadProgramOptions{workDir=" + workDir + ", kCodeList=" + kCodeList.size() + ", loadPlugins="
                + loadPlugins + ", disableNone=" + disableNone + ", strictRangeCheck=" + strictRangeCheck
                + ", overrides=" + overrides + ", cmdArgs=" + cmdArgs + ", packageMaps=" + packageMaps + "}";
    }
}
