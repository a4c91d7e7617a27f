package org.doc2pdf.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionGoTo;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.destination.PDPageXYZDestination;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.text.PDFTextStripper;
import org.doc2pdf.model.MemberDoc;
import org.doc2pdf.model.MemberKind;
import org.doc2pdf.model.TypeDoc;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.logging.Logger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PdfDocumentRendererTest {
    private static final Logger LOGGER = Logger.getLogger(PdfDocumentRendererTest.class.getName());

    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    private static TypeDoc type(String name, String parent, String summary) {
        return new TypeDoc("class", name, "Sample.Space", "public",
                Collections.singletonList("Serializable"), Collections.singletonList("Base"),
                summary, "src/" + name + ".cs", parent);
    }

    private static PdfDocumentRenderer renderer() {
        return new PdfDocumentRenderer(new Properties(), LOGGER);
    }

    @Test
    public void smallTypeFitsOnTocPageAndOneContentPage() throws Exception {
        TypeDoc widget = type("Widget", null, "Draws a widget. Supports themes.");
        widget.addMember(new MemberDoc(MemberKind.METHOD, "void Draw()", "public", "Draws."));

        RenderedDocument result = renderer().render(widget);

        assertEquals(2, result.getPageCount());
        assertEquals(1, result.getTocPageCount());
        assertEquals(1, result.getTocEntries().size());
        TocEntry entry = result.getTocEntries().get(0);
        assertEquals("Widget", entry.getTitle());
        assertEquals(2, entry.getPageNumber());
        assertEquals(1, entry.getLevel());
        assertEquals("Draws a widget.", entry.getDescription());

        try (PDDocument document = PDDocument.load(result.getBytes())) {
            assertEquals(2, document.getNumberOfPages());
            String toc = pageText(document, 1);
            assertTrue(toc, toc.contains("Table of Contents"));
            assertTrue(toc, toc.contains("Widget — public class Widget : Base — Draws a widget."));

            String content = pageText(document, 2);
            assertTrue(content.contains("Overview"));
            assertTrue(content.contains("Sample.Space"));
            assertTrue(content.contains("Description"));
            assertTrue(content.contains("Methods"));
            assertTrue(content.contains("void Draw()"));
            assertEquals("Widget", document.getDocumentInformation().getTitle());
        }
    }

    @Test
    public void tocLinksPointAtSectionHeadings() throws Exception {
        TypeDoc root = type("Outer", null, "Outer type.");
        for (int i = 0; i < 3; i++) {
            TypeDoc nested = type("Inner" + i, "Outer", "Nested type " + i + ".");
            for (int m = 0; m < 40; m++) {
                nested.addMember(new MemberDoc(MemberKind.PROPERTY, "int Value" + m + " { get; }", "public",
                        "Property number " + m + " of the nested type."));
            }
            root.addNestedType(nested);
        }

        RenderedDocument result = renderer().render(root);

        try (PDDocument document = PDDocument.load(result.getBytes())) {
            List<PDAnnotationLink> links = new ArrayList<>();
            for (PDAnnotation annotation : document.getPage(0).getAnnotations()) {
                if (annotation instanceof PDAnnotationLink) {
                    links.add((PDAnnotationLink) annotation);
                }
            }
            assertEquals(result.getTocEntries().size(), links.size());

            for (int i = 0; i < links.size(); i++) {
                TocEntry entry = result.getTocEntries().get(i);
                PDActionGoTo action = (PDActionGoTo) links.get(i).getAction();
                PDPageXYZDestination destination = (PDPageXYZDestination) action.getDestination();
                int pageIndex = document.getPages().indexOf(destination.getPage());
                assertEquals(entry.getPageNumber(), pageIndex + 1);

                PDPage target = document.getPage(pageIndex);
                int expectedTop = Math.round(target.getMediaBox().getHeight() - entry.getY());
                assertEquals(expectedTop, destination.getTop());
                assertEquals(0, destination.getLeft());

                String text = pageText(document, entry.getPageNumber());
                assertTrue(entry.getTitle() + " not on page " + entry.getPageNumber(),
                        text.contains(entry.getTitle()));
            }
            assertTrue(result.getPageCount() > 4);
        }
    }

    @Test
    public void nestedTypesAreListedInPreOrder() throws Exception {
        TypeDoc root = type("A", null, "");
        TypeDoc b = type("B", "A", "");
        TypeDoc c = type("C", "A.B", "");
        TypeDoc d = type("D", "A", "");
        b.addNestedType(c);
        root.addNestedType(b);
        root.addNestedType(d);

        RenderedDocument result = renderer().render(root);

        List<String> titles = new ArrayList<>();
        List<Integer> levels = new ArrayList<>();
        for (TocEntry entry : result.getTocEntries()) {
            titles.add(entry.getTitle());
            levels.add(entry.getLevel());
        }
        assertEquals(Arrays.asList("A", "A.B", "A.B.C", "A.D"), titles);
        assertEquals(Arrays.asList(1, 2, 3, 2), levels);

        try (PDDocument document = PDDocument.load(result.getBytes())) {
            PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
            assertNotNull(outline);
            PDOutlineItem top = outline.getFirstChild();
            assertEquals("A", top.getTitle());
            assertEquals("A.B", top.getFirstChild().getTitle());
            assertEquals("A.B.C", top.getFirstChild().getFirstChild().getTitle());
            assertEquals("A.D", top.getLastChild().getTitle());

            String content = pageText(document, 2);
            assertTrue(content, content.contains("Nested types: B, D"));
        }
    }

    @Test
    public void pageNumbersNeverDecrease() throws Exception {
        TypeDoc root = type("Big", null, "Large type.");
        for (int m = 0; m < 200; m++) {
            root.addMember(new MemberDoc(MemberKind.METHOD, "void Method" + m + "(string argument, int count)",
                    "public static", "Does thing number " + m + " and explains it at some length so that the "
                    + "summary column wraps onto several lines."));
        }
        for (int i = 0; i < 5; i++) {
            root.addNestedType(type("Part" + i, "Big", "Part " + i + "."));
        }

        RenderedDocument result = renderer().render(root);

        assertEquals(1, result.getTocPageCount());
        assertEquals(2, result.getTocEntries().get(0).getPageNumber());
        int previous = 0;
        for (TocEntry entry : result.getTocEntries()) {
            assertTrue(entry.getPageNumber() >= previous);
            assertTrue(entry.getPageNumber() <= result.getPageCount());
            assertTrue(entry.getPageNumber() > result.getTocPageCount());
            previous = entry.getPageNumber();
        }
        assertTrue(result.getPageCount() > 5);
    }

    @Test
    public void longTableOfContentsGetsReservedPages() throws Exception {
        TypeDoc root = type("Catalog", null, "Holds many types.");
        for (int i = 0; i < 120; i++) {
            root.addNestedType(type("Entry" + i, "Catalog", "Entry number " + i + " of the catalog."));
        }

        RenderedDocument result = renderer().render(root);

        assertTrue(result.getTocPageCount() > 1);
        assertEquals(result.getTocPageCount() + 1, result.getTocEntries().get(0).getPageNumber());
        try (PDDocument document = PDDocument.load(result.getBytes())) {
            int links = 0;
            for (int p = 0; p < result.getTocPageCount(); p++) {
                for (PDAnnotation annotation : document.getPage(p).getAnnotations()) {
                    if (annotation instanceof PDAnnotationLink) {
                        links++;
                    }
                }
            }
            assertEquals(121, links);
            assertTrue(pageText(document, result.getTocPageCount() + 1).contains("Catalog"));
            assertFalse(pageText(document, result.getTocPageCount() + 1).contains("Table of Contents"));
        }
    }

    @Test
    public void renderingIsDeterministic() throws Exception {
        TypeDoc root = type("Stable", null, "Renders the same way twice.");
        for (int m = 0; m < 50; m++) {
            root.addMember(new MemberDoc(MemberKind.FIELD, "int field" + m, "private", "Field " + m + "."));
        }
        root.addNestedType(type("Child", "Stable", "Child."));

        RenderedDocument first = renderer().render(root);
        RenderedDocument second = renderer().render(root);

        assertEquals(first.getPageCount(), second.getPageCount());
        assertEquals(first.getTocEntries().size(), second.getTocEntries().size());
        for (int i = 0; i < first.getTocEntries().size(); i++) {
            TocEntry a = first.getTocEntries().get(i);
            TocEntry b = second.getTocEntries().get(i);
            assertEquals(a.getTitle(), b.getTitle());
            assertEquals(a.getPageNumber(), b.getPageNumber());
            assertEquals(a.getY(), b.getY(), 0.0001f);
        }
    }

    @Test
    public void headerTemplateReplacesSectionTitle() throws Exception {
        Properties props = new Properties();
        props.setProperty("pdf.header.template", "${kind} ${name} in ${namespace}");
        RenderedDocument result = new PdfDocumentRenderer(props, LOGGER).render(type("Widget", null, ""));
        try (PDDocument document = PDDocument.load(result.getBytes())) {
            assertTrue(pageText(document, 2).contains("class Widget in Sample.Space"));
        }
    }

    @Test
    public void letterPageSizeIsApplied() throws Exception {
        Properties props = new Properties();
        props.setProperty("pdf.page.size", "LETTER");
        RenderedDocument result = new PdfDocumentRenderer(props, LOGGER).render(type("Widget", null, ""));
        try (PDDocument document = PDDocument.load(result.getBytes())) {
            assertEquals(792f, document.getPage(1).getMediaBox().getHeight(), 0.01f);
        }
    }

    @Test
    public void missingFontFileFailsTheRender() {
        Properties props = new Properties();
        props.setProperty("pdf.font.regular", temp.getRoot().toPath().resolve("missing.ttf").toString());
        try {
            new PdfDocumentRenderer(props, LOGGER).render(type("Widget", null, ""));
            fail("expected IOException");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("pdf.font.regular"));
        }
    }

    @Test
    public void writesFileAndCreatesDirectories() throws Exception {
        Path out = temp.getRoot().toPath().resolve("a/b/widget.pdf");
        RenderedDocument result = renderer().renderToFile(type("Widget", null, "W."), out);
        assertTrue(Files.exists(out));
        assertEquals(result.getBytes().length, Files.size(out));
    }

    private static String pageText(PDDocument document, int pageNumber) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        return stripper.getText(document);
    }
}
