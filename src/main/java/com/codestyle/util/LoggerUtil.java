package com.codestyle.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.*;

/**
 * Logging setup for the style checker.
 *
 * <p>Loads {@code /logging.properties} from the classpath when it is bundled, otherwise installs
 * a plain console handler. Report lines are emitted through these loggers, so the console level
 * decides whether the tool's FINE trace shows up next to them.
 */
public class LoggerUtil {
    static final String TOOL_LOGGER = "com.codestyle";
    private static final String LOGGING_PROPERTIES = "/logging.properties";

    private static final Logger rootLogger = Logger.getLogger("");
    private static final Logger toolLogger = Logger.getLogger(TOOL_LOGGER);
    private static boolean configured = false;

    private LoggerUtil() {
    }

    public static Logger getLogger(Class<?> clazz) {
        _ensureConfigured();
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Applies {@code level} to the console and lowers the tool logger to match when needed.
     */
    public static synchronized void setConsoleLevel(Level level) {
        _ensureConfigured();
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        Level current = toolLogger.getLevel();
        if (current == null || current.intValue() > level.intValue()) {
            toolLogger.setLevel(level);
        }
    }

    /**
     * Mirrors every record of the tool into {@code path}, appending. A previously
     * requested log file is closed first.
     */
    public static synchronized void setLogFilePath(Path path) {
        _ensureConfigured();
        _closeFileHandlers();
        try {
            FileHandler fileHandler = new FileHandler(path.toString(), true);
            fileHandler.setLevel(Level.ALL);
            fileHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(fileHandler);
        } catch (IOException e) {
            toolLogger.log(Level.SEVERE, "Cannot write log file " + path, e);
        }
    }

    public static synchronized void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
            handler.close();
        }
    }

    static synchronized void _closeFileHandlers() {
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof FileHandler) {
                rootLogger.removeHandler(handler);
                handler.close();
            }
        }
    }

    private static synchronized void _ensureConfigured() {
        if (configured) {
            return;
        }
        configured = true;

        try (InputStream properties = LoggerUtil.class.getResourceAsStream(LOGGING_PROPERTIES)) {
            if (properties != null) {
                LogManager.getLogManager().readConfiguration(properties);
                return;
            }
        } catch (IOException e) {
            System.err.println("Cannot read " + LOGGING_PROPERTIES + ", using console logging: " + e.getMessage());
        }

        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(Level.INFO);
        console.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(console);
        rootLogger.setLevel(Level.INFO);
    }
}
