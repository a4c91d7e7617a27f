package org.doc2pdf.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.File;
import java.io.IOException;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Resolves the three font faces a theme needs (regular, bold, monospace) for one document.
 * <p>
 * A face configured with a TrueType file ({@code pdf.font.regular}, {@code pdf.font.bold},
 * {@code pdf.font.mono}) is embedded into the document; otherwise the matching Standard 14
 * font is used. A configured file that cannot be loaded is an error, not a fallback.
 */
public class FontResolver {
    public static final String REGULAR_KEY = "pdf.font.regular";
    public static final String BOLD_KEY = "pdf.font.bold";
    public static final String MONO_KEY = "pdf.font.mono";

    private final PDDocument document;
    private final Properties props;
    private final Logger logger;

    public FontResolver(PDDocument document, Properties props, Logger logger) {
        this.document = document;
        this.props = props != null ? props : new Properties();
        this.logger = logger;
    }

    public PDFont regular() throws IOException {
        return resolve(REGULAR_KEY, PDType1Font.HELVETICA);
    }

    public PDFont bold() throws IOException {
        return resolve(BOLD_KEY, PDType1Font.HELVETICA_BOLD);
    }

    public PDFont mono() throws IOException {
        return resolve(MONO_KEY, PDType1Font.COURIER);
    }

    private PDFont resolve(String key, PDFont standardFont) throws IOException {
        String path = props.getProperty(key);
        if (path == null || path.trim().isEmpty()) {
            return standardFont;
        }

        File fontFile = new File(path.trim());
        if (!fontFile.isFile()) {
            throw new IOException("Font file for " + key + " not found: " + fontFile.getAbsolutePath());
        }
        PDFont font = PDType0Font.load(document, fontFile);
        logger.info("Loaded font " + font.getName() + " from " + fontFile.getAbsolutePath());
        return font;
    }
}
