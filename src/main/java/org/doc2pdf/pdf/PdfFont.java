package org.doc2pdf.pdf;

import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;

/**
 * A PDFBox font at a fixed point size.
 */
public final class PdfFont implements TextMeasurer {
    private static final char REPLACEMENT = '?';

    private final PDFont font;
    private final float size;

    public PdfFont(PDFont font, float size) {
        this.font = font;
        this.size = size;
    }

    public PDFont getFont() {
        return font;
    }

    public float getSize() {
        return size;
    }

    /**
     * Width of the text in points. Text the font cannot encode is measured as it will be drawn,
     * see {@link #sanitize(String)}.
     */
    @Override
    public float width(String text) throws IOException {
        return font.getStringWidth(sanitize(text)) / 1000f * size;
    }

    /**
     * Replaces control characters and characters the font has no encoding for with '?'.
     * PDFBox refuses to show such text.
     */
    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = null;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            int next = i + Character.charCount(codePoint);
            boolean keep = !Character.isISOControl(codePoint) && canEncode(text.substring(i, next));
            if (!keep && sb == null) {
                sb = new StringBuilder(text.length());
                sb.append(text, 0, i);
            }
            if (sb != null) {
                if (keep) {
                    sb.append(text, i, next);
                } else {
                    sb.append(REPLACEMENT);
                }
            }
            i = next;
        }
        return sb != null ? sb.toString() : text;
    }

    private boolean canEncode(String glyph) {
        try {
            font.encode(glyph);
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return font.getName() + " " + size + "pt";
    }
}
