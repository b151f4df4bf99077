package io.kcl.tools.ls.pkg;

import java.nio.file.Path;

/**
 * A dependency as reported by the package metadata: its name and the local
 * directory it was fetched into.
 */
public class Package {

    private final String name;
    private final Path manifestPath;

    public Package(String name, Path manifestPath) {
        this.name = name;
        this.manifestPath = manifestPath;
    }

    public String getName() {
        return name;
    }

    public Path getManifestPath() {
        return manifestPath;
    }

    @Override
    public String toString() {
        return name + "@" + manifestPath;
    }
}
