package org.doc2pdf.pdf;

import org.apache.pdfbox.pdmodel.PDPage;

/**
 * One table-of-contents line, recorded while the section it points at is rendered.
 */
public final class TocEntry {
    private final String title;
    private final String signature;
    private final String description;
    private final int level;
    private final int pageNumber;
    private final Anchor anchor;

    public TocEntry(String title, String signature, String description, int level, int pageNumber, Anchor anchor) {
        this.title = title != null ? title : "";
        this.signature = signature;
        this.description = description;
        this.level = level;
        this.pageNumber = pageNumber;
        this.anchor = anchor;
    }

    public String getTitle() {
        return title;
    }

    /**
     * @return The compact declaration of the section's type, or null
     */
    public String getSignature() {
        return signature;
    }

    /**
     * @return A one-sentence summary, or null
     */
    public String getDescription() {
        return description;
    }

    /**
     * Nesting depth of the section, 1 for the root.
     */
    public int getLevel() {
        return level;
    }

    /**
     * 1-based number of the page the section heading was drawn on.
     */
    public int getPageNumber() {
        return pageNumber;
    }

    public PDPage getPage() {
        return anchor.getPage();
    }

    /**
     * Top-down offset of the section heading on its page.
     */
    public float getY() {
        return anchor.getY();
    }

    public Anchor getAnchor() {
        return anchor;
    }

    /**
     * Text shown in the table of contents for this entry.
     */
    public String getLabel() {
        return TocLabel.compose(title, signature, description);
    }

    @Override
    public String toString() {
        return "TocEntry{" +
                "title='" + title + '\'' +
                ", pageNumber=" + pageNumber +
                ", y=" + anchor.getY() +
                '}';
    }
}
