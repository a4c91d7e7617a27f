package org.doc2pdf.pdf;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Greedy word wrapping against a measured line width.
 */
public final class TextWrapper {

    private TextWrapper() {
    }

    /**
     * Wraps text into lines no wider than {@code maxWidth}.
     * <p>
     * Words are separated by any run of whitespace and re-joined with single spaces. A word
     * that is wider than {@code maxWidth} on its own is cut character by character into chunks
     * that each fit; a single glyph wider than {@code maxWidth} becomes a chunk of its own.
     * Blank input yields one empty line.
     *
     * @param text The text to wrap, may be null
     * @param measurer Measures candidate lines
     * @param maxWidth The maximum line width in points
     * @return The wrapped lines, never empty
     * @throws IOException If the measurer cannot measure a glyph
     */
    public static List<String> wrap(String text, TextMeasurer measurer, float maxWidth) throws IOException {
        if (text == null || text.trim().isEmpty()) {
            return Collections.singletonList("");
        }

        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();

        for (String word : text.trim().split("\\s+")) {
            String candidate = line.length() == 0 ? word : line + " " + word;
            if (measurer.width(candidate) <= maxWidth) {
                line.setLength(0);
                line.append(candidate);
                continue;
            }

            if (line.length() > 0) {
                lines.add(line.toString());
                line.setLength(0);
            }

            if (measurer.width(word) <= maxWidth) {
                line.append(word);
            } else {
                // The last chunk stays open so following words can join it
                List<String> chunks = hardCut(word, measurer, maxWidth);
                lines.addAll(chunks.subList(0, chunks.size() - 1));
                line.append(chunks.get(chunks.size() - 1));
            }
        }

        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }

    private static List<String> hardCut(String word, TextMeasurer measurer, float maxWidth) throws IOException {
        List<String> chunks = new ArrayList<>();
        StringBuilder chunk = new StringBuilder();
        int i = 0;
        while (i < word.length()) {
            int next = word.offsetByCodePoints(i, 1);
            String glyph = word.substring(i, next);
            if (chunk.length() > 0 && measurer.width(chunk + glyph) > maxWidth) {
                chunks.add(chunk.toString());
                chunk.setLength(0);
            }
            chunk.append(glyph);
            i = next;
        }
        if (chunk.length() > 0) {
            chunks.add(chunk.toString());
        }
        return chunks;
    }
}
