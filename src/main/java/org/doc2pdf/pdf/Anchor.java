package org.doc2pdf.pdf;

import org.apache.pdfbox.pdmodel.PDPage;

/**
 * A position inside the document: a page and a top-down offset from the page's top edge.
 */
public final class Anchor {
    private final PDPage page;
    private final float y;

    public Anchor(PDPage page, float y) {
        this.page = page;
        this.y = y;
    }

    public PDPage getPage() {
        return page;
    }

    public float getY() {
        return y;
    }

    /**
     * The same position in PDF user space, where y grows upwards from the bottom edge.
     */
    public float getPdfTop() {
        return page.getMediaBox().getHeight() - y;
    }
}
