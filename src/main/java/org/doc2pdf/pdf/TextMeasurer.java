package org.doc2pdf.pdf;

import java.io.IOException;

/**
 * Measures the advance width of a string in PDF points.
 */
@FunctionalInterface
public interface TextMeasurer {

    float width(String text) throws IOException;
}
