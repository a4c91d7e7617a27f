package org.doc2pdf.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineNode;
import org.doc2pdf.model.MemberDoc;
import org.doc2pdf.model.MemberKind;
import org.doc2pdf.model.TypeDoc;
import org.doc2pdf.util.TemplateEngine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Calendar;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Renders a documentation tree into a PDF document.
 * <p>
 * The table of contents comes first but can only be drawn once every section's page is known.
 * Rendering therefore reserves the TOC pages up front, renders all sections depth-first while
 * recording a {@link TocEntry} per section, and finally goes back to the reserved pages to
 * draw the TOC lines with their page numbers and links.
 */
public class PdfDocumentRenderer {
    public static final String TOC_TITLE = "Table of Contents";
    private static final String CREATOR = "doc2pdf";

    private final Properties props;
    private final Logger logger;

    public PdfDocumentRenderer(Properties props, Logger logger) {
        this.props = props != null ? props : new Properties();
        this.logger = logger;
    }

    /**
     * Renders the tree and writes the PDF to the given file, creating parent directories.
     *
     * @return The rendered document
     * @throws IOException If rendering fails or the file cannot be written
     */
    public RenderedDocument renderToFile(TypeDoc root, Path outputFile) throws IOException {
        RenderedDocument rendered = render(root);
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(outputFile, rendered.getBytes());
        logger.info("PDF saved to: " + outputFile.toAbsolutePath() + " (" + rendered.getPageCount() + " pages)");
        return rendered;
    }

    /**
     * Renders the tree into an in-memory PDF.
     *
     * @throws IOException If a font cannot be loaded or drawing fails
     */
    public RenderedDocument render(TypeDoc root) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PdfTheme theme = PdfTheme.create(document, props, logger);
            RenderContext ctx = new RenderContext(document, theme, root.getDisplayName(), logger);
            List<TocEntry> toc = new ArrayList<>();
            List<PDPage> tocPages = new ArrayList<>();

            tocPages.add(ctx.addPage());
            int tocPageCount;
            try (PageWriter writer = new PageWriter(ctx, tocPages.get(0), false)) {
                List<String> labels = new ArrayList<>();
                for (TypeDoc type : root.flatten()) {
                    labels.add(TocLabel.compose(type.getDisplayName(), type.getSignature(), description(type)));
                }
                tocPageCount = writer.countTocPages(TOC_TITLE, labels);
                for (int i = 1; i < tocPageCount; i++) {
                    tocPages.add(ctx.addPage());
                }
                logger.fine("Reserved " + tocPageCount + " page(s) for " + labels.size() + " TOC entries");

                writer.setDrawHeaderFooter(true);
                ctx.setCurrentSectionTitle(root.getDisplayName());
                writer.setPageHeaderOverride(headerFor(root));
                writer.bind(ctx.addPage());

                PDDocumentOutline outline = new PDDocumentOutline();
                document.getDocumentCatalog().setDocumentOutline(outline);
                renderType(writer, ctx, root, 1, outline, toc);

                drawToc(writer, ctx, tocPages, toc);
            }

            PDDocumentInformation info = document.getDocumentInformation();
            info.setTitle(root.getDisplayName());
            info.setCreator(CREATOR);
            info.setCreationDate(Calendar.getInstance());

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            logger.info("Rendered " + root.getDisplayName() + ": " + document.getNumberOfPages() + " pages, "
                    + toc.size() + " sections");
            return new RenderedDocument(out.toByteArray(), document.getNumberOfPages(), tocPageCount, toc);
        }
    }

    private void renderType(PageWriter writer, RenderContext ctx, TypeDoc type, int level,
                            PDOutlineNode parentOutline, List<TocEntry> toc) throws IOException {
        ctx.setCurrentSectionTitle(type.getDisplayName());
        writer.setPageHeaderOverride(headerFor(type));

        Anchor anchor = writer.heading(level, type.getDisplayName());
        toc.add(new TocEntry(type.getDisplayName(), type.getSignature(), description(type), level,
                ctx.pageNumberOf(anchor.getPage()), anchor));
        PDOutlineItem bookmark = PdfLinks.addBookmark(parentOutline, type.getDisplayName(), anchor);

        writer.definitionList("Overview", overview(type));

        if (!type.getSummary().trim().isEmpty()) {
            writer.subheading("Description");
            writer.paragraph(type.getSummary());
        }

        PdfTheme theme = ctx.getTheme();
        List<TableColumnSpec> columns = Arrays.asList(
                new TableColumnSpec("Signature", 0.45f, theme.getFontMono()),
                new TableColumnSpec("Modifiers", 0.20f),
                new TableColumnSpec("Summary", 0.35f));
        for (MemberKind kind : MemberKind.values()) {
            List<MemberDoc> members = type.getMembers(kind);
            if (members.isEmpty()) {
                continue;
            }
            List<String[]> rows = new ArrayList<>();
            for (MemberDoc member : members) {
                rows.add(new String[]{member.getSignature(), member.getModifiers(), member.getSummary()});
            }
            writer.subheading(kind.getSectionTitle());
            writer.table(columns, rows);
            writer.spacer(theme.getParagraphSpacing());
        }

        if (!type.getNestedTypes().isEmpty()) {
            List<String> names = new ArrayList<>();
            for (TypeDoc nested : type.getNestedTypes()) {
                names.add(nested.getName());
            }
            writer.bulletLine("Nested types", String.join(", ", names));
        }

        for (TypeDoc nested : type.getNestedTypes()) {
            renderType(writer, ctx, nested, level + 1, bookmark, toc);
        }
    }

    private void drawToc(PageWriter writer, RenderContext ctx, List<PDPage> tocPages, List<TocEntry> toc)
            throws IOException {
        ctx.setCurrentSectionTitle(TOC_TITLE);
        writer.setPageHeaderOverride(null);

        Iterator<PDPage> reserved = tocPages.iterator();
        PDPage first = reserved.next();
        writer.setPageSource(current -> {
            if (reserved.hasNext()) {
                return reserved.next();
            }
            logger.warning("Table of contents needs more pages than reserved, page numbers may be off");
            return ctx.insertPageAfter(current);
        });
        writer.bind(first);

        writer.heading(1, TOC_TITLE);
        for (TocEntry entry : toc) {
            PDRectangle area = writer.tocLineWrapped(entry.getLabel(), entry.getPageNumber());
            PdfLinks.addGoToLink(writer.getPage(), area, entry.getAnchor());
        }
    }

    private String headerFor(TypeDoc type) {
        String template = props.getProperty("pdf.header.template");
        if (template == null || template.trim().isEmpty()) {
            return null;
        }
        return TemplateEngine.applyTypeTemplate(template, type);
    }

    private static Map<String, String> overview(TypeDoc type) {
        Map<String, String> items = new LinkedHashMap<>();
        items.put("Kind", type.getKind());
        items.put("Namespace", type.getNamespace());
        if (!type.getModifiers().isEmpty()) {
            items.put("Modifiers", type.getModifiers());
        }
        if (!type.getAttributes().isEmpty()) {
            items.put("Attributes", String.join(", ", type.getAttributes()));
        }
        if (!type.getBaseTypes().isEmpty()) {
            items.put("Base types", String.join(", ", type.getBaseTypes()));
        }
        if (!type.getFilePath().isEmpty()) {
            items.put("Source", type.getFilePath());
        }
        return items;
    }

    private static String description(TypeDoc type) {
        String sentence = TocLabel.firstSentence(type.getSummary());
        return sentence.isEmpty() ? null : sentence;
    }
}
