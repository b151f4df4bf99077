package io.kcl.tools.ls.pkg;

import java.nio.file.Path;

/**
 * Source of the dependency metadata of the KCL module enclosing a path.
 */
public interface PackageMetadataFetcher {

    /**
     * @param currentPkgPath a path inside the module
     * @throws MetadataFetchException when the metadata can not be produced
     */
    PackageMetadata fetch(Path currentPkgPath);
}
