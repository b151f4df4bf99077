package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.compile.CompileUnitResolver;
import io.kcl.tools.ls.compile.ProgramCompiler;
import io.kcl.tools.ls.compile.ProgramLoader;
import io.kcl.tools.ls.compile.ProgramLoaders;
import io.kcl.tools.ls.pkg.ExternalPackages;
import io.kcl.tools.ls.pkg.ImportPositions;
import io.kcl.tools.ls.pkg.KclModMetadataFetcher;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.jboss.logging.Logger;
import org.jboss.logmanager.formatters.PatternFormatter;
import org.jboss.logmanager.handlers.ConsoleHandler;
import picocli.CommandLine;

import java.io.InputStream;
import java.io.OutputStream;
import java.lang.invoke.MethodHandles;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Entry point for the KCL Language Server.
 * Launches the LSP server using stdin/stdout JSON-RPC communication; logs go to stderr.
 */
@CommandLine.Command(name = "kcl-language-server", description = "language server for KCL", mixinStandardHelpOptions = true, version = KclLanguageServer.VERSION)
public class KclLspLauncher implements Callable<Integer> {

    static {
        System.setProperty("java.util.logging.manager", "org.jboss.logmanager.LogManager");
        System.setProperty("org.jboss.logging.provider", "jboss");
    }

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    public static final String LOGGER_NAME = "io.kcl.tools.ls";
    public static final String DEFAULT_LOG_FORMAT = "%d{HH:mm:ss.SSS} %-5p [%c{1}] %m%n";

    @CommandLine.Option(names = {"-l", "--log-level"}, description = "log level: ${COMPLETION-CANDIDATES}", defaultValue = "INFO")
    Logger.Level logLevel;
    @CommandLine.Option(names = {"-f", "--log-format"}, description = "log pattern for stderr", defaultValue = DEFAULT_LOG_FORMAT)
    String logFormat;
    @CommandLine.Option(names = {"-m", "--metadata-command"}, description = "command printing the kcl.mod dependency metadata", defaultValue = "kcl mod metadata")
    String metadataCommand;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new KclLspLauncher()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        configureLogging();
        logger.info("Starting KCL Language Server...");

        InputStream in = System.in;
        OutputStream out = System.out;

        // stdout carries JSON-RPC
        System.setOut(System.err);

        KclLanguageServer server = createServer(metadataCommand(), ProgramLoaders.discover(KclLspLauncher.class.getClassLoader()));

        Launcher<LanguageClient> launcher = LSPLauncher.createServerLauncher(server, in, out);
        server.connect(launcher.getRemoteProxy());

        Future<?> startListening = launcher.startListening();
        logger.info("KCL Language Server is listening");
        try {
            startListening.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("KCL Language Server interrupted", e);
            return 1;
        } catch (ExecutionException e) {
            logger.error("KCL Language Server error", e.getCause());
            return 1;
        }
        return server.getErrorCode();
    }

    static KclLanguageServer createServer(List<String> metadataCommand, ProgramLoader loader) {
        KclModMetadataFetcher fetcher = new KclModMetadataFetcher(metadataCommand);
        ProgramCompiler compiler = new ProgramCompiler(new CompileUnitResolver(fetcher), loader);
        ImportPositions importPositions = new ImportPositions(new ExternalPackages(fetcher));
        return new KclLanguageServer(compiler, importPositions);
    }

    List<String> metadataCommand() {
        return Arrays.asList(metadataCommand.trim().split("\\s+"));
    }

    private void configureLogging() {
        org.jboss.logmanager.Logger kclLogger = org.jboss.logmanager.Logger.getLogger(LOGGER_NAME);
        ConsoleHandler consoleHandler = new ConsoleHandler(ConsoleHandler.Target.SYSTEM_ERR, new PatternFormatter(logFormat));
        kclLogger.addHandler(consoleHandler);
        kclLogger.setUseParentHandlers(false);
        kclLogger.setLevel(toLogManagerLevel(logLevel));
    }

    static java.util.logging.Level toLogManagerLevel(Logger.Level level) {
        return switch (level) {
            case FATAL -> org.jboss.logmanager.Level.FATAL;
            case ERROR -> org.jboss.logmanager.Level.ERROR;
            case WARN -> org.jboss.logmanager.Level.WARN;
            case INFO -> org.jboss.logmanager.Level.INFO;
            case DEBUG -> org.jboss.logmanager.Level.DEBUG;
            case TRACE -> org.jboss.logmanager.Level.TRACE;
        };
    }
}
