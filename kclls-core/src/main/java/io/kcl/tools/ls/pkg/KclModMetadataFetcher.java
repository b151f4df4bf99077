package io.kcl.tools.ls.pkg;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the package manager's metadata command in the module root (the nearest
 * directory holding {@code kcl.mod}) and parses its standard output.
 */
public class KclModMetadataFetcher implements PackageMetadataFetcher {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    public static final List<String> DEFAULT_COMMAND = List.of("kcl", "mod", "metadata");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final List<String> command;
    private final Duration timeout;

    public KclModMetadataFetcher() {
        this(DEFAULT_COMMAND);
    }

    public KclModMetadataFetcher(List<String> command) {
        this(command, DEFAULT_TIMEOUT);
    }

    public KclModMetadataFetcher(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("metadata command must not be empty");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("metadata timeout must be positive");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    public List<String> getCommand() {
        return command;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public PackageMetadata fetch(Path currentPkgPath) {
        Path modRoot = KclFiles.lookupNearestDir(currentPkgPath.toAbsolutePath(), KclFiles.KCL_MOD_FILE);
        if (modRoot == null) {
            throw new MetadataFetchException("no " + KclFiles.KCL_MOD_FILE + " found from " + currentPkgPath);
        }
        String commandLine = String.join(" ", command);
        Path out = null;
        Path err = null;
        try {
            // files instead of pipes: a full pipe would stall the child
            out = Files.createTempFile("kcl-metadata", ".out");
            err = Files.createTempFile("kcl-metadata", ".err");
            ProcessBuilder builder = new ProcessBuilder();
            builder.command(new ArrayList<>(command));
            builder.directory(modRoot.toFile());
            builder.redirectOutput(out.toFile());
            builder.redirectError(err.toFile());
            logger.debugf("running %s in %s", commandLine, modRoot);
            Process p = builder.start();
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new MetadataFetchException(commandLine + " did not finish within " + timeout);
            }
            int result = p.exitValue();
            if (result != 0) {
                throw new MetadataFetchException(commandLine + " exited with " + result + ": "
                        + Files.readString(err, StandardCharsets.UTF_8).strip());
            }
            return PackageMetadata.parse(Files.readString(out, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new MetadataFetchException("failed to run " + commandLine, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetadataFetchException("interrupted while running " + commandLine, e);
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.debugf("failed to delete %s: %s", file, e.getMessage());
        }
    }
}
