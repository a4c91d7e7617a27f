package org.doc2pdf.pdf;

import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSInteger;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionGoTo;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.destination.PDPageXYZDestination;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineNode;

import java.io.IOException;

/**
 * Internal document links: clickable go-to annotations and outline (bookmark) items.
 */
public final class PdfLinks {

    private PdfLinks() {
    }

    /**
     * Adds a borderless link annotation on {@code fromPage} covering {@code rect} (PDF user space)
     * that jumps to the anchor's page, scrolled to the anchor's offset.
     */
    public static PDAnnotationLink addGoToLink(PDPage fromPage, PDRectangle rect, Anchor target) throws IOException {
        PDActionGoTo action = new PDActionGoTo();
        action.setDestination(destination(target));

        PDAnnotationLink link = new PDAnnotationLink();
        link.setRectangle(rect);
        link.setAction(action);

        // Border array: [horizontal corner radius, vertical corner radius, width]
        COSArray border = new COSArray();
        border.add(COSInteger.ZERO);
        border.add(COSInteger.ZERO);
        border.add(COSInteger.ZERO);
        link.getCOSObject().setItem(COSName.BORDER, border);

        fromPage.getAnnotations().add(link);
        return link;
    }

    /**
     * Appends an outline item pointing at the anchor to the given parent (outline or item).
     */
    public static PDOutlineItem addBookmark(PDOutlineNode parent, String title, Anchor target) {
        PDOutlineItem item = new PDOutlineItem();
        item.setTitle(title);
        item.setDestination(destination(target));
        parent.addLast(item);
        return item;
    }

    static PDPageXYZDestination destination(Anchor target) {
        PDPageXYZDestination destination = new PDPageXYZDestination();
        destination.setPage(target.getPage());
        destination.setLeft(0);
        destination.setTop(Math.round(target.getPdfTop()));
        return destination;
    }
}
