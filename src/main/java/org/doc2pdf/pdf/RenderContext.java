package org.doc2pdf.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.util.logging.Logger;

/**
 * State shared by everything that draws into one document: the document itself, its theme
 * and the titles used for running page headers.
 */
public class RenderContext {
    private final PDDocument document;
    private final PdfTheme theme;
    private final Logger logger;
    private final String documentTitle;
    private String currentSectionTitle;

    public RenderContext(PDDocument document, PdfTheme theme, String documentTitle, Logger logger) {
        PDRectangle size = theme.getPageSize();
        if (theme.getMarginTop() + theme.getMarginBottom() >= size.getHeight()
                || theme.getMarginLeft() + theme.getMarginRight() >= size.getWidth()) {
            throw new IllegalArgumentException("Page margins leave no content area");
        }
        this.document = document;
        this.theme = theme;
        this.documentTitle = documentTitle;
        this.logger = logger;
    }

    public PDDocument getDocument() {
        return document;
    }

    public PdfTheme getTheme() {
        return theme;
    }

    public Logger getLogger() {
        return logger;
    }

    public String getDocumentTitle() {
        return documentTitle;
    }

    public String getCurrentSectionTitle() {
        return currentSectionTitle;
    }

    public void setCurrentSectionTitle(String currentSectionTitle) {
        this.currentSectionTitle = currentSectionTitle;
    }

    /**
     * Appends a new empty page to the document.
     */
    public PDPage addPage() {
        PDPage page = new PDPage(theme.getPageSize());
        document.addPage(page);
        return page;
    }

    /**
     * Inserts a new empty page directly after the given page.
     */
    public PDPage insertPageAfter(PDPage previous) {
        PDPage page = new PDPage(theme.getPageSize());
        document.getPages().insertAfter(page, previous);
        return page;
    }

    /**
     * Number of pages in the document, which is the 1-based number of the last page.
     */
    public int getPageCount() {
        return document.getNumberOfPages();
    }

    /**
     * Returns the 1-based number of the given page, or -1 if it does not belong to this document.
     */
    public int pageNumberOf(PDPage page) {
        int index = document.getPages().indexOf(page);
        return index >= 0 ? index + 1 : -1;
    }
}
