package io.kcl.tools.ls.compile;

import io.kcl.tools.ls.LanguageServiceException;
import io.kcl.tools.ls.pkg.KclFiles;
import io.kcl.tools.ls.pkg.MetadataFetchException;
import io.kcl.tools.ls.pkg.Package;
import io.kcl.tools.ls.pkg.PackageMetadata;
import io.kcl.tools.ls.pkg.PackageMetadataFetcher;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides which files are compiled together with a target file.
 */
public class CompileUnitResolver {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private final PackageMetadataFetcher metadataFetcher;

    public CompileUnitResolver(PackageMetadataFetcher metadataFetcher) {
        this.metadataFetcher = metadataFetcher;
    }

    /**
     * A {@code kcl.yaml} next to the file defines the unit. Without one the unit is the
     * file's package when {@code loadPkg} is set, or the file alone.
     */
    public CompileUnit lookup(String file, boolean loadPkg) {
        Path path = Paths.get(file);
        Path dir = path.toAbsolutePath().getParent();
        LoadProgramOptions options = new LoadProgramOptions();
        List<String> files = null;

        if (dir != null && Files.isRegularFile(dir.resolve(KclSettings.FILE_NAME))) {
            try {
                KclSettings settings = KclSettings.load(dir.resolve(KclSettings.FILE_NAME));
                files = new ArrayList<>();
                for (String entry : settings.getFiles()) {
                    Path entryPath = Paths.get(entry);
                    files.add(entryPath.isAbsolute() ? entryPath.normalize().toString() : dir.resolve(entryPath).normalize().toString());
                }
                options.setWorkDir(dir.toString());
                options.setDisableNone(settings.isDisableNone());
                options.setStrictRangeCheck(settings.isStrictRangeCheck());
                options.getOverrides().addAll(settings.getOverrides());
                options.getCmdArgs().putAll(settings.getOptions());
                if (files.isEmpty()) {
                    files.add(file);
                }
            } catch (LanguageServiceException e) {
                logger.warnf("ignoring %s: %s", dir.resolve(KclSettings.FILE_NAME), e.getMessage());
                files = null;
            }
        }
        if (files == null) {
            files = new ArrayList<>();
            if (loadPkg && dir != null && Files.isRegularFile(path) && KclFiles.isKclFile(path)) {
                try {
                    files.addAll(KclFiles.packageFiles(dir));
                } catch (IOException e) {
                    logger.warnf("failed to list package of %s: %s", file, e.getMessage());
                }
            }
            if (files.isEmpty()) {
                files.add(file);
            }
        }
        fillPackageMaps(path, options);
        return new CompileUnit(files, options);
    }

    private void fillPackageMaps(Path file, LoadProgramOptions options) {
        if (metadataFetcher == null || KclFiles.lookupNearestDir(file.toAbsolutePath(), KclFiles.KCL_MOD_FILE) == null) {
            return;
        }
        try {
            PackageMetadata metadata = metadataFetcher.fetch(file);
            for (Package pkg : metadata.getPackages().values()) {
                options.getPackageMaps().put(pkg.getName(), pkg.getManifestPath().toString());
            }
        } catch (MetadataFetchException e) {
            logger.warnf("failed to fetch package metadata for %s: %s", file, e.getMessage());
        }
    }
}
