package org.doc2pdf;

import org.doc2pdf.core.DocJob;
import org.doc2pdf.log.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main application entry point.
 */
public class Doc2PdfApp {
    static final String GLOBAL_CONFIG_FILE = "doc2pdf.properties";

    private static final String[] PDFBOX_LOGGERS = {
            "org.apache.pdfbox",
            "org.apache.pdfbox.pdmodel.font",
            "org.apache.fontbox",
            "org.apache.fontbox.ttf"
    };

    // Strong references so the configured levels survive garbage collection
    private static final List<Logger> CONFIGURED_LOGGERS = new ArrayList<>();

    public static void main(String[] args) {
        // Must be set before any PDFBox class is loaded
        System.setProperty("java.awt.headless", "true");

        System.out.println("=======================================");
        System.out.println("doc2pdf - API documentation to PDF");
        System.out.println("=======================================");

        Path configFile = Paths.get(args.length > 0 ? args[0] : GLOBAL_CONFIG_FILE);
        Properties globalProps = loadGlobalConfig(configFile);
        if (globalProps == null) {
            System.err.println("ERROR: Failed to load " + configFile);
            System.err.println("Please ensure " + configFile + " exists.");
            System.exit(1);
        }
        configurePdfBoxLogLevels(globalProps);

        List<Path> modelPaths = collectModelPaths(globalProps);
        if (modelPaths.isEmpty()) {
            System.err.println("ERROR: No documentation models found in " + configFile);
            System.err.println("Please add at least one doc.config.N property.");
            System.exit(1);
        }
        System.out.println("Found " + modelPaths.size() + " documentation model(s)");

        Logger consoleLogger = Logger.getLogger("doc2pdf.console");
        int[] counts = runAll(modelPaths, globalProps, consoleLogger);

        System.out.println("\n===================================");
        System.out.println("Processing Summary:");
        System.out.println("  Success: " + counts[0]);
        System.out.println("  Failed:  " + counts[1]);
        System.out.println("===================================");
        if (counts[1] > 0) {
            System.exit(2);
        }
    }

    /**
     * Renders each model in turn.
     *
     * @return {successCount, failureCount}
     */
    static int[] runAll(List<Path> modelPaths, Properties globalProps, Logger consoleLogger) {
        int successCount = 0;
        int failureCount = 0;
        for (Path modelPath : modelPaths) {
            System.out.println("\nProcessing model: " + modelPath);
            if (!Files.isRegularFile(modelPath)) {
                System.err.println("ERROR: Model file not found: " + modelPath.toAbsolutePath());
                failureCount++;
                continue;
            }
            DocJob job = new DocJob(modelPath, globalProps, consoleLogger);
            if (job.run()) {
                successCount++;
                System.out.println("Completed: " + job.getOutputFile());
            } else {
                failureCount++;
            }
        }
        return new int[]{successCount, failureCount};
    }

    static Properties loadGlobalConfig(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            return null;
        }
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(configFile)) {
            props.load(in);
            return props;
        } catch (IOException e) {
            System.err.println("Error reading " + configFile + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Reads doc.config.1, doc.config.2, ... up to the first missing index.
     * Relative paths are kept relative to the working directory.
     */
    static List<Path> collectModelPaths(Properties globalProps) {
        List<Path> paths = new ArrayList<>();
        int index = 1;
        while (true) {
            String value = globalProps.getProperty("doc.config." + index);
            if (value == null || value.trim().isEmpty()) {
                break;
            }
            paths.add(Paths.get(value.trim()));
            index++;
        }
        return paths;
    }

    /**
     * Configures PDFBox and FontBox log levels from {@code pdfbox.log.level} (default WARNING).
     */
    static void configurePdfBoxLogLevels(Properties globalProps) {
        Level level = LoggerFactory.parseLogLevel(
                globalProps != null ? globalProps.getProperty("pdfbox.log.level") : null, Level.WARNING);
        for (String name : PDFBOX_LOGGERS) {
            Logger logger = Logger.getLogger(name);
            logger.setLevel(level);
            CONFIGURED_LOGGERS.add(logger);
        }
    }
}
