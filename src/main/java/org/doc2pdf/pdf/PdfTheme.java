package org.doc2pdf.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.awt.Color;
import java.io.IOException;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Visual settings of a rendered document: page size, margins, spacing, colours and fonts.
 * One theme is created per document, since embedded fonts belong to a document.
 */
public final class PdfTheme {
    private static final float LINE_HEIGHT_FACTOR = 1.5f;

    private final PDRectangle pageSize;
    private final float marginLeft;
    private final float marginRight;
    private final float marginTop;
    private final float marginBottom;
    private final float pageHeaderTop;
    private final float paragraphSpacing;
    private final float tableColumnGap;
    private final float lineSpacingHeading;

    private final Color colorPrimary = new Color(40, 40, 40);
    private final Color colorDark = new Color(30, 30, 30);
    private final Color colorMuted = Color.GRAY;

    private final PdfFont fontH1;
    private final PdfFont fontH2;
    private final PdfFont fontH3;
    private final PdfFont fontH4;
    private final PdfFont fontNormal;
    private final PdfFont fontNormalBold;
    private final PdfFont fontSmall;
    private final PdfFont fontSmallBold;
    private final PdfFont fontMono;

    private PdfTheme(Properties props, PDFont regular, PDFont bold, PDFont mono) {
        this.pageSize = parsePageSize(props.getProperty("pdf.page.size", "A4"));
        this.marginLeft = parseFloat(props, "pdf.margin.left", 54f);
        this.marginRight = parseFloat(props, "pdf.margin.right", 54f);
        this.marginTop = parseFloat(props, "pdf.margin.top", 72f);
        this.marginBottom = parseFloat(props, "pdf.margin.bottom", 72f);
        this.pageHeaderTop = parseFloat(props, "pdf.header.top", 36f);
        this.paragraphSpacing = parseFloat(props, "pdf.paragraph.spacing", 6f);
        this.tableColumnGap = parseFloat(props, "pdf.table.gap", 10f);
        this.lineSpacingHeading = 1.0f;

        this.fontH1 = new PdfFont(bold, 18f);
        this.fontH2 = new PdfFont(bold, 14f);
        this.fontH3 = new PdfFont(bold, 12f);
        this.fontH4 = new PdfFont(bold, 11f);
        this.fontNormal = new PdfFont(regular, 10f);
        this.fontNormalBold = new PdfFont(bold, 10f);
        this.fontSmall = new PdfFont(regular, 8f);
        this.fontSmallBold = new PdfFont(bold, 8f);
        this.fontMono = new PdfFont(mono, 9.5f);
    }

    /**
     * Creates a theme with default settings and Standard 14 fonts.
     */
    public static PdfTheme createDefault(PDDocument document, Logger logger) throws IOException {
        return create(document, new Properties(), logger);
    }

    /**
     * Creates a theme from {@code pdf.*} properties, resolving fonts for the given document.
     *
     * @throws IOException If a configured font cannot be loaded
     */
    public static PdfTheme create(PDDocument document, Properties props, Logger logger) throws IOException {
        Properties settings = props != null ? props : new Properties();
        FontResolver fonts = new FontResolver(document, settings, logger);
        return new PdfTheme(settings, fonts.regular(), fonts.bold(), fonts.mono());
    }

    /**
     * Returns the line height for the given font.
     */
    public float lineHeight(PdfFont font) {
        return font.getSize() * LINE_HEIGHT_FACTOR;
    }

    public PDRectangle getPageSize() {
        return pageSize;
    }

    public float getMarginLeft() {
        return marginLeft;
    }

    public float getMarginRight() {
        return marginRight;
    }

    public float getMarginTop() {
        return marginTop;
    }

    public float getMarginBottom() {
        return marginBottom;
    }

    public float getPageHeaderTop() {
        return pageHeaderTop;
    }

    public float getParagraphSpacing() {
        return paragraphSpacing;
    }

    public float getTableColumnGap() {
        return tableColumnGap;
    }

    public float getLineSpacingHeading() {
        return lineSpacingHeading;
    }

    public Color getColorPrimary() {
        return colorPrimary;
    }

    public Color getColorDark() {
        return colorDark;
    }

    public Color getColorMuted() {
        return colorMuted;
    }

    public PdfFont getFontH1() {
        return fontH1;
    }

    public PdfFont getFontH2() {
        return fontH2;
    }

    public PdfFont getFontH3() {
        return fontH3;
    }

    public PdfFont getFontH4() {
        return fontH4;
    }

    public PdfFont getFontNormal() {
        return fontNormal;
    }

    public PdfFont getFontNormalBold() {
        return fontNormalBold;
    }

    public PdfFont getFontSmall() {
        return fontSmall;
    }

    public PdfFont getFontSmallBold() {
        return fontSmallBold;
    }

    public PdfFont getFontMono() {
        return fontMono;
    }

    private static PDRectangle parsePageSize(String value) {
        if ("LETTER".equalsIgnoreCase(value.trim())) {
            return PDRectangle.LETTER;
        }
        return PDRectangle.A4;
    }

    private static float parseFloat(Properties props, String key, float defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            float parsed = Float.parseFloat(value.trim());
            return parsed >= 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            // Invalid value, use default
            return defaultValue;
        }
    }
}
