package org.doc2pdf.pdf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of rendering one documentation tree: the serialized PDF and a summary of its layout.
 * The page handles inside the TOC entries belong to a closed document and are only useful
 * for identity comparisons.
 */
public final class RenderedDocument {
    private final byte[] bytes;
    private final int pageCount;
    private final int tocPageCount;
    private final List<TocEntry> tocEntries;

    public RenderedDocument(byte[] bytes, int pageCount, int tocPageCount, List<TocEntry> tocEntries) {
        this.bytes = bytes;
        this.pageCount = pageCount;
        this.tocPageCount = tocPageCount;
        this.tocEntries = Collections.unmodifiableList(new ArrayList<>(tocEntries));
    }

    public byte[] getBytes() {
        return bytes;
    }

    public int getPageCount() {
        return pageCount;
    }

    /**
     * Number of pages reserved at the front of the document for the table of contents.
     */
    public int getTocPageCount() {
        return tocPageCount;
    }

    /**
     * Table of contents entries in document order.
     */
    public List<TocEntry> getTocEntries() {
        return tocEntries;
    }
}
