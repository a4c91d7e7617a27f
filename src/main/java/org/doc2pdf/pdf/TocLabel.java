package org.doc2pdf.pdf;

/**
 * Builds the left-hand text of table-of-contents lines.
 */
public final class TocLabel {
    public static final String SEPARATOR = " — ";
    public static final String ELLIPSIS = "…";
    public static final int MAX_SIGNATURE_LENGTH = 70;
    public static final int MAX_DESCRIPTION_LENGTH = 90;

    private TocLabel() {
    }

    /**
     * Joins title, signature and description with a dash separator, capping the two snippets.
     * Blank snippets, and a signature equal to the title, are left out.
     */
    public static String compose(String title, String signature, String description) {
        StringBuilder sb = new StringBuilder(title != null ? title.trim() : "");
        String sig = collapse(signature);
        if (!sig.isEmpty() && !sig.equals(sb.toString())) {
            sb.append(SEPARATOR).append(ellipsize(sig, MAX_SIGNATURE_LENGTH));
        }
        String desc = collapse(description);
        if (!desc.isEmpty()) {
            sb.append(SEPARATOR).append(ellipsize(desc, MAX_DESCRIPTION_LENGTH));
        }
        return sb.toString();
    }

    /**
     * Returns the first sentence of a summary: text up to and including the first '.', '!' or '?'
     * that is followed by whitespace or ends the text. Whitespace is collapsed.
     */
    public static String firstSentence(String summary) {
        String text = collapse(summary);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c == '.' || c == '!' || c == '?')
                    && (i + 1 == text.length() || Character.isWhitespace(text.charAt(i + 1)))) {
                return text.substring(0, i + 1);
            }
        }
        return text;
    }

    /**
     * Cuts text longer than {@code maxLength} and appends an ellipsis, keeping the result
     * within {@code maxLength} characters.
     */
    public static String ellipsize(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        int cut = Math.max(0, maxLength - ELLIPSIS.length());
        return text.substring(0, cut).trim() + ELLIPSIS;
    }

    private static String collapse(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ");
    }
}
