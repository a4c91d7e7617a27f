package org.doc2pdf.log;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Properties;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Factory for creating file-based loggers, one log file per rendered document.
 */
public class LoggerFactory {
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Creates a logger that appends to {@code <logDir>/<documentName>.log}.
     * Handlers left over from an earlier logger of the same name are closed and replaced.
     *
     * @param loggerName The name for the logger
     * @param logDir The directory where the log file should be created
     * @param documentName The document name (will be sanitized for filename)
     * @param globalProps Global properties to read the {@code log.level} setting
     * @return A Logger instance configured to write to a file
     */
    public static Logger createFileLogger(String loggerName, Path logDir, String documentName, Properties globalProps) {
        Level logLevel = parseLogLevel(globalProps != null ? globalProps.getProperty("log.level") : null, Level.INFO);
        Logger logger = Logger.getLogger(loggerName);
        logger.setLevel(logLevel);
        try {
            Files.createDirectories(logDir);
            Path logFile = logDir.resolve(sanitizeFilename(documentName) + ".log");

            for (Handler handler : logger.getHandlers()) {
                logger.removeHandler(handler);
                handler.close();
            }
            logger.setUseParentHandlers(false); // Disable console output

            FileHandler fileHandler = new FileHandler(logFile.toString(), true);
            fileHandler.setEncoding("UTF-8");
            fileHandler.setFormatter(new SimpleFormatter());
            fileHandler.setLevel(logLevel);
            logger.addHandler(fileHandler);
            return logger;
        } catch (IOException e) {
            // Fallback to console logger if file creation fails
            logger.setUseParentHandlers(true);
            logger.log(Level.SEVERE, "Failed to create file logger: " + e.getMessage(), e);
            return logger;
        }
    }

    /**
     * Closes and detaches all handlers of the logger, releasing its log file.
     */
    public static void closeHandlers(Logger logger) {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
    }

    /**
     * Parses a log level string to a Level object.
     *
     * @param levelStr The log level string (SEVERE, WARNING, INFO, FINE, FINER, FINEST, ALL, OFF)
     * @param defaultLevel Level returned for a blank or invalid string
     */
    public static Level parseLogLevel(String levelStr, Level defaultLevel) {
        if (levelStr == null || levelStr.trim().isEmpty()) {
            return defaultLevel;
        }
        try {
            return Level.parse(levelStr.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return defaultLevel;
        }
    }

    /**
     * Sanitizes a string to be safe for use as a filename.
     * Replaces invalid characters with underscores and trims whitespace.
     */
    public static String sanitizeFilename(String filename) {
        if (filename == null) {
            return "unknown";
        }

        String sanitized = filename.replaceAll("[\\\\/:*?\"<>|]", "_");
        sanitized = sanitized.trim().replaceAll("\\s+", " ");

        // Leading/trailing dots and spaces are not portable
        sanitized = sanitized.replaceAll("^[\\.\\s]+|[\\.\\s]+$", "");

        if (sanitized.isEmpty()) {
            return "unknown";
        }
        return sanitized;
    }

    /**
     * Simple formatter that outputs: [yyyy-MM-dd HH:mm:ss] LEVEL message
     */
    static class SimpleFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            String timestamp = LocalDateTime.now().format(DATE_FORMAT);
            String level = record.getLevel().getName();
            String message = formatMessage(record);

            if (record.getThrown() != null) {
                return String.format("[%s] %s %s%n%s%n", timestamp, level, message,
                        getStackTrace(record.getThrown()));
            }
            return String.format("[%s] %s %s%n", timestamp, level, message);
        }

        private String getStackTrace(Throwable throwable) {
            StringWriter sw = new StringWriter();
            throwable.printStackTrace(new PrintWriter(sw));
            return sw.toString();
        }
    }
}
