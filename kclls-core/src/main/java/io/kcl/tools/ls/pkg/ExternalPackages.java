package io.kcl.tools.ls.pkg;

import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Maps package paths of external dependencies to local directories.
 */
public class ExternalPackages {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private final PackageMetadataFetcher fetcher;

    public ExternalPackages(PackageMetadataFetcher fetcher) {
        this.fetcher = fetcher;
    }

    /**
     * Computes where the sub package {@code pkgpath} of dependency {@code pkgName} lives. A
     * package {@code my_package} stored in {@code /user/my_package_v0.0.1} with pkgpath
     * {@code my_package.examples.apps} yields {@code /user/my_package_v0.0.1/examples/apps}.
     * <p>
     * The path is not checked for existence. An unknown package, or metadata that can not be
     * fetched, leaves the package root empty.
     */
    public Path realPathFromExternal(String pkgName, String pkgpath, Path currentPkgPath) {
        Path realPath = Paths.get("");
        try {
            Package pkg = fetcher.fetch(currentPkgPath).getPackage(pkgName);
            if (pkg != null) {
                realPath = realPath.resolve(pkg.getManifestPath());
            }
        } catch (MetadataFetchException e) {
            logger.debugf("no metadata for %s: %s", currentPkgPath, e.getMessage());
        }
        for (String segment : rmExternalPkgName(pkgpath).split("\\.")) {
            realPath = realPath.resolve(segment);
        }
        return realPath;
    }

    /**
     * Drops the leading package name segment: {@code a.b.c} becomes {@code b.c}.
     */
    public static String rmExternalPkgName(String pkgpath) {
        if (pkgpath == null) {
            return "";
        }
        int dot = pkgpath.indexOf('.');
        return dot < 0 ? "" : pkgpath.substring(dot + 1);
    }
}
