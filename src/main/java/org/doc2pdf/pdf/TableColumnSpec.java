package org.doc2pdf.pdf;

/**
 * A table column: header text, width relative to the other columns and an optional cell font.
 */
public final class TableColumnSpec {
    private final String header;
    private final float widthRatio;
    private final PdfFont font;

    public TableColumnSpec(String header, float widthRatio) {
        this(header, widthRatio, null);
    }

    public TableColumnSpec(String header, float widthRatio, PdfFont font) {
        this.header = header != null ? header : "";
        this.widthRatio = widthRatio > 0 ? widthRatio : 0f;
        this.font = font;
    }

    public String getHeader() {
        return header;
    }

    public float getWidthRatio() {
        return widthRatio;
    }

    /**
     * @return The cell font, or null to use the theme's normal font
     */
    public PdfFont getFont() {
        return font;
    }
}
