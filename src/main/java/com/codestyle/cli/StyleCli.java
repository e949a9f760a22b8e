package com.codestyle.cli;

import com.codestyle.api.CancellationToken;
import com.codestyle.api.CodeFormatter;
import com.codestyle.api.FormatOptions;
import com.codestyle.api.FormatterResult;
import com.codestyle.api.error.ConfigurationException;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.config.ConfigurationLoader;
import com.codestyle.config.StyleConfig;
import com.codestyle.core.AnalysisOrchestrator;
import com.codestyle.core.DefaultAnalyzerRegistry;
import com.codestyle.core.DefaultCodeAnalysisRunner;
import com.codestyle.core.DefaultCodeFixApplier;
import com.codestyle.formatters.CharsetFormatter;
import com.codestyle.plugins.BuiltInRules;
import com.codestyle.util.DiagnosticFormatter;
import com.codestyle.util.LoggerUtil;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.FolderWorkspaceLoader;
import com.codestyle.workspace.FormattableDocument;
import com.codestyle.workspace.TextEncoding;
import com.codestyle.workspace.Workspace;
import com.codestyle.workspace.WorkspaceWriter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Command line interface: checks or fixes the code style of a folder or a single file.
 */
public class StyleCli {
    private static final Logger logger = LoggerUtil.getLogger(StyleCli.class);
    private static final String VERSION = "1.0.0";
    static final String CONFIG_FILE_NAME = ".codestyle.yml";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final PrintStream out;
    private final DiagnosticFormatter diagnosticFormatter;

    StyleCli(PrintStream out, boolean useColors) {
        this.out = out;
        this.diagnosticFormatter = new DiagnosticFormatter(useColors);
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args, System.out);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public static int run(String[] args, PrintStream out) {
        StyleCli cli = new StyleCli(out, !_hasOption(args, "--no-color"));
        try {
            if (args.length < 1) {
                cli._printUsage();
                return EXIT_FAILURE;
            }

            if (_hasOption(args, "--verbose")) {
                LoggerUtil.setConsoleLevel(Level.FINE);
            } else {
                LoggerUtil.setConsoleLevel(Level.INFO);
            }
            String logFile = _getOptionValue(args, "--log-file");
            if (logFile != null) {
                LoggerUtil.setLogFilePath(Paths.get(logFile));
            }

            String command = args[0];
            switch (command) {
                case "check":
                    return cli._runStyle(args, false);
                case "fix":
                    return cli._runStyle(args, true);
                case "init":
                    return cli._initializeConfig(args);
                case "--version":
                case "-v":
                    out.println("Code Style Enforcer version " + VERSION);
                    return EXIT_OK;
                case "--help":
                case "-h":
                    cli._printUsage();
                    return EXIT_OK;
                default:
                    cli._printError("Unknown command: " + command);
                    cli._printUsage();
                    return EXIT_FAILURE;
            }
        } catch (ConfigurationException e) {
            cli._printError("Configuration error: " + e.getMessage());
            logger.log(Level.FINE, "Configuration error", e);
            return EXIT_FAILURE;
        } catch (Exception e) {
            cli._printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                cli._printInfo("Use --verbose for stack trace");
            }
            return EXIT_FAILURE;
        }
    }

    private void _printUsage() {
        out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_BOLD, "Code Style Enforcer CLI v" + VERSION));
        out.println("Usage:");
        out.println("  codestyle init [--force]          - Initialize configuration file");
        out.println("  codestyle check <path>            - Report style violations without changing files");
        out.println("  codestyle fix <path>              - Fix style violations and save the files");
        out.println("  codestyle --help|-h               - Show this help");
        out.println("  codestyle --version|-v            - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        out.println("  --verbose                         - Show detailed output");
        out.println("  --changes-are-errors              - Report violations as errors and exit with 1");
        out.println("  --no-color                        - Disable colored output");
        out.println("  --include=<glob>                  - Only include files matching pattern");
        out.println("  --threads=<num>                   - Number of threads to use (default: available processors)");
        out.println("  --log-file=<file>                 - Also write the log to a file");
        out.println("  --force                           - Force overwrite (with init command)");
    }

    private int _runStyle(String[] args, boolean fix) throws IOException {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return EXIT_FAILURE;
        }

        Path path = Paths.get(args[1]).toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return EXIT_FAILURE;
        }

        Path folder = Files.isDirectory(path) ? path : path.getParent();
        Set<Path> filesToInclude = Files.isDirectory(path) ? Set.of() : Set.of(path);

        StyleConfig config = _loadConfig(args, folder);
        boolean changesAreErrors = _hasOption(args, "--changes-are-errors")
                || config.getGeneralConfig("changesAreErrors", false);
        int threads = _resolveThreads(args, config);
        int maxFixPasses = config.getGeneralConfig("maxFixPasses", 1);

        FolderWorkspaceLoader loader = new FolderWorkspaceLoader(
                config.getGeneralConfig("ignoreFiles", new ArrayList<String>()), TextEncoding.UTF_8);
        Workspace original = loader.load(folder, filesToInclude);
        List<FormattableDocument> documents = _filterIncluded(
                FolderWorkspaceLoader.getFormattableDocuments(original), folder, _getOptionValue(args, "--include"));

        _printInfo("Found " + documents.size() + " files to " + (fix ? "fix" : "check"));
        if (documents.isEmpty()) {
            return EXIT_OK;
        }

        DefaultAnalyzerRegistry registry = new DefaultAnalyzerRegistry(
                BuiltInRules.analyzers(), BuiltInRules.fixers(), config);
        List<CodeFormatter> formatters = List.of(
                new CharsetFormatter(registry),
                new AnalysisOrchestrator(registry, new DefaultCodeAnalysisRunner(),
                        new DefaultCodeFixApplier(registry, threads), threads));

        FormatOptions options = FormatOptions.builder()
                .workspaceFilePath(path)
                .saveFormattedFiles(fix)
                .changesAreErrors(changesAreErrors)
                .maxFixPasses(maxFixPasses)
                .build();

        CancellationToken cancellationToken = new CancellationToken();
        Workspace current = original;
        List<Diagnostic> reported = new ArrayList<>();
        boolean errorsReported = false;
        int failureCount = 0;
        Duration elapsed = Duration.ZERO;

        for (CodeFormatter formatter : formatters) {
            FormatterResult result = formatter.format(current, documents, options, logger, cancellationToken);
            current = result.getWorkspace();
            reported.addAll(result.getReportedDiagnostics());
            errorsReported |= result.isErrorsReported();
            failureCount += result.getFailureCount();
            elapsed = elapsed.plus(result.getElapsed());
            if (!result.getAppliedFixers().isEmpty()) {
                logger.fine(formatter.getFormatType() + " fixes applied: " + result.getAppliedFixers());
            }
        }

        Path workspaceFolder = DiagnosticFormatter.resolveWorkspaceFolder(path);
        if (fix) {
            List<Document> written = new WorkspaceWriter().writeChanges(original, current);
            for (Document document : written) {
                _printSuccess("Fixed: " + DiagnosticFormatter.displayPath(document.getFilePath(), workspaceFolder));
            }
            out.println("\nFix complete in " + _formatDuration(elapsed) + ":");
            out.println("  Checked files: " + documents.size());
            out.println("  Fixed files: " + written.size());
        } else {
            out.println("\nCheck complete in " + _formatDuration(elapsed) + ":");
            out.println("  Checked files: " + documents.size());
            out.println("  Issues found: " + reported.size());
            if (!reported.isEmpty()) {
                out.println("\n" + diagnosticFormatter.formatSummary(reported, workspaceFolder));
            }
        }
        if (failureCount > 0) {
            out.println("  Failures: " + failureCount);
        }

        if (errorsReported || (fix && failureCount > 0)) {
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_OK;
        }

        StyleConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private StyleConfig _loadConfig(String[] args, Path folder) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            Path configPath = Paths.get(configFile);
            if (!Files.exists(configPath)) {
                throw new ConfigurationException("Config file does not exist: " + configFile);
            }
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(configPath);
        }
        return ConfigurationLoader.loadConfig(folder.resolve(CONFIG_FILE_NAME));
    }

    private int _resolveThreads(String[] args, StyleConfig config) {
        int threads = config.getGeneralConfig("threads", 0);
        String threadsStr = _getOptionValue(args, "--threads");
        if (threadsStr != null) {
            try {
                threads = Integer.parseInt(threadsStr);
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    private static List<FormattableDocument> _filterIncluded(List<FormattableDocument> documents,
                                                             Path folder, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return documents;
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + includePattern);
        return documents.stream()
                .filter(d -> {
                    Path file = d.getFilePath().toAbsolutePath().normalize();
                    Path relative = file.startsWith(folder) ? folder.relativize(file) : file;
                    return matcher.matches(relative) || matcher.matches(file.getFileName());
                })
                .collect(Collectors.toList());
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private void _printSuccess(String message) {
        out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        out.println(diagnosticFormatter.colorize(DiagnosticFormatter.ANSI_BLUE, message));
    }
}
