package io.kcl.tools.ls.lsp;

import org.jboss.logging.Logger;
import org.junit.Test;
import picocli.CommandLine;

import java.util.List;

import static org.junit.Assert.assertEquals;

public class KclLspLauncherTest {

    @Test
    public void testDefaults() {
        KclLspLauncher launcher = new KclLspLauncher();
        new CommandLine(launcher).parseArgs();
        assertEquals(Logger.Level.INFO, launcher.logLevel);
        assertEquals(KclLspLauncher.DEFAULT_LOG_FORMAT, launcher.logFormat);
        assertEquals(List.of("kcl", "mod", "metadata"), launcher.metadataCommand());
    }

    @Test
    public void testOptions() {
        KclLspLauncher launcher = new KclLspLauncher();
        new CommandLine(launcher).parseArgs("--log-level", "DEBUG", "-m", "  /opt/kcl/bin/kcl  mod metadata --update ");
        assertEquals(Logger.Level.DEBUG, launcher.logLevel);
        assertEquals(List.of("/opt/kcl/bin/kcl", "mod", "metadata", "--update"), launcher.metadataCommand());
    }

    @Test
    public void testLogLevels() {
        assertEquals(org.jboss.logmanager.Level.DEBUG, KclLspLauncher.toLogManagerLevel(Logger.Level.DEBUG));
        assertEquals(org.jboss.logmanager.Level.WARN, KclLspLauncher.toLogManagerLevel(Logger.Level.WARN));
        assertEquals(org.jboss.logmanager.Level.TRACE, KclLspLauncher.toLogManagerLevel(Logger.Level.TRACE));
    }
}
