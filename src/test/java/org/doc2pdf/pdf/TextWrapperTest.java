package org.doc2pdf.pdf;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TextWrapperTest {

    // 5pt per character
    private static final TextMeasurer FIXED = text -> text.length() * 5f;

    @Test
    public void blankTextIsOneEmptyLine() throws Exception {
        assertEquals(Collections.singletonList(""), TextWrapper.wrap(null, FIXED, 100f));
        assertEquals(Collections.singletonList(""), TextWrapper.wrap("", FIXED, 100f));
        assertEquals(Collections.singletonList(""), TextWrapper.wrap("   \t ", FIXED, 100f));
    }

    @Test
    public void packsWordsGreedily() throws Exception {
        List<String> lines = TextWrapper.wrap("aaa bbb ccc", FIXED, 35f);
        assertEquals(Arrays.asList("aaa bbb", "ccc"), lines);
    }

    @Test
    public void collapsesWhitespaceRuns() throws Exception {
        List<String> lines = TextWrapper.wrap("  one \n two\t\tthree  ", FIXED, 1000f);
        assertEquals(Collections.singletonList("one two three"), lines);
    }

    @Test
    public void cutsWordsWiderThanTheLine() throws Exception {
        List<String> lines = TextWrapper.wrap("abcdefghijkl mn", FIXED, 25f);
        assertEquals(Arrays.asList("abcde", "fghij", "kl mn"), lines);
    }

    @Test
    public void singleGlyphWiderThanLineStandsAlone() throws Exception {
        List<String> lines = TextWrapper.wrap("abc", FIXED, 3f);
        assertEquals(Arrays.asList("a", "b", "c"), lines);
    }

    @Test
    public void everyLineFitsAndWordsArePreserved() throws Exception {
        String text = "The quick brown fox jumps over the lazy dog while the documentation generator "
                + "keeps wrapping words onto new lines until nothing is left to place on the page";
        for (float width : new float[]{70f, 77f, 120f, 333f}) {
            List<String> lines = TextWrapper.wrap(text, FIXED, width);
            for (String line : lines) {
                assertTrue("'" + line + "' exceeds " + width, FIXED.width(line) <= width);
            }
            assertEquals(text, String.join(" ", lines));
        }
    }

    @Test
    public void keepsSurrogatePairsTogether() throws Exception {
        String word = "😀😀😀";
        TextMeasurer perCodePoint = text -> text.codePointCount(0, text.length()) * 5f;
        List<String> lines = TextWrapper.wrap(word, perCodePoint, 10f);
        assertEquals(Arrays.asList("😀😀", "😀"), lines);
    }
}
