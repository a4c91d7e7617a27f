package org.doc2pdf.core;

import org.doc2pdf.log.LoggerFactory;
import org.doc2pdf.model.TypeDoc;
import org.doc2pdf.model.TypeDocLoader;
import org.doc2pdf.pdf.PdfDocumentRenderer;
import org.doc2pdf.pdf.RenderedDocument;
import org.doc2pdf.util.TemplateEngine;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders one documentation model into one PDF file.
 * <p>
 * Failures are caught and reported here so that a batch of jobs keeps going when one
 * model is broken.
 */
public class DocJob {
    public static final String DEFAULT_OUTPUT_DIR = "output";
    public static final String DEFAULT_OUTPUT_TEMPLATE = "${namespace}/${name}";

    private final Path modelPath;
    private final Properties globalProps;
    private final Logger consoleLogger;

    private Path outputDir;
    private Path logDir;
    private Path outputFile;
    private RenderedDocument result;

    public DocJob(Path modelPath, Properties globalProps, Logger consoleLogger) {
        this.modelPath = modelPath;
        this.globalProps = globalProps != null ? globalProps : new Properties();
        this.consoleLogger = consoleLogger;
    }

    /**
     * Runs the job.
     *
     * @return true if the PDF was written
     */
    public boolean run() {
        Logger logger = null;
        try {
            resolveConfiguration();

            TypeDoc root = new TypeDocLoader(consoleLogger).load(modelPath);
            String documentName = root.getDisplayName();

            String logName = logName(root);
            String loggerName = "doc2pdf." + LoggerFactory.sanitizeFilename(logName);
            logger = LoggerFactory.createFileLogger(loggerName, logDir, logName, globalProps);
            logger.info("Starting document: " + documentName);
            logger.info("Model file: " + modelPath.toAbsolutePath());

            outputFile = resolveOutputFile(root);
            logger.info("Output file: " + outputFile.toAbsolutePath());

            long start = System.currentTimeMillis();
            result = new PdfDocumentRenderer(globalProps, logger).renderToFile(root, outputFile);
            logger.info("Document completed in " + (System.currentTimeMillis() - start) + "ms: "
                    + result.getPageCount() + " pages, " + result.getTocEntries().size() + " TOC entries");
            return true;
        } catch (Exception e) {
            String errorMsg = "Error processing " + modelPath + ": " + e.getMessage();
            if (logger != null) {
                logger.log(Level.SEVERE, errorMsg, e);
            } else {
                consoleLogger.log(Level.SEVERE, errorMsg, e);
            }
            System.err.println("ERROR: " + errorMsg);
            return false;
        } finally {
            if (logger != null) {
                LoggerFactory.closeHandlers(logger);
            }
        }
    }

    /**
     * @return The written PDF file, or null before a successful run
     */
    public Path getOutputFile() {
        return outputFile;
    }

    /**
     * @return The rendered document, or null before a successful run
     */
    public RenderedDocument getResult() {
        return result;
    }

    private void resolveConfiguration() {
        String dir = globalProps.getProperty("default.output.dir");
        outputDir = Paths.get(dir != null && !dir.trim().isEmpty() ? dir.trim() : DEFAULT_OUTPUT_DIR);

        String configuredLogDir = globalProps.getProperty("log.dir");
        if (configuredLogDir != null && !configuredLogDir.trim().isEmpty()) {
            logDir = Paths.get(configuredLogDir.trim());
        } else {
            logDir = outputDir.resolve("logs");
        }
    }

    /**
     * Namespace-qualified name, so same-named types from different namespaces log to
     * different files.
     */
    static String logName(TypeDoc root) {
        if (TypeDoc.GLOBAL_NAMESPACE.equals(root.getNamespace())) {
            return root.getDisplayName();
        }
        return root.getNamespace() + "." + root.getDisplayName();
    }

    /**
     * Each substituted value is sanitized on its own, so a '/' in the template splits
     * directories but a '/' in a type name does not.
     */
    private Path resolveOutputFile(TypeDoc root) {
        String template = globalProps.getProperty("output.file.template");
        if (template == null || template.trim().isEmpty()) {
            template = DEFAULT_OUTPUT_TEMPLATE;
        }
        String relative = TemplateEngine.applyTypeTemplate(template.trim(), root, LoggerFactory::sanitizeFilename);
        return outputDir.resolve(relative + ".pdf");
    }
}
