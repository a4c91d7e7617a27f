package org.doc2pdf.pdf;

import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDPageContentStream.AppendMode;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.state.PDExtendedGraphicsState;

import java.awt.Color;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Writes structured content (headings, paragraphs, definition lists, tables, TOC lines) onto
 * the pages of a document, top to bottom, starting a new page whenever the next block would
 * not fit above the bottom margin.
 * <p>
 * The write cursor {@link #getY()} is measured from the top edge of the page and always stays
 * between {@link #getTop()} and {@link #getBottom()}. Every drawing operation first calls
 * {@link #ensureSpace(float)} with the height it is about to use. Blocks that are taller than a
 * whole content area continue on the next page line by line instead of paginating forever.
 */
public final class PageWriter implements Closeable {
    static final float MIN_COLUMN_WIDTH = 30f;
    static final float CELL_PADDING = 2f;
    static final float KEY_GAP = 6f;
    static final float ROW_PADDING = 4f;
    static final float TOC_LINE_GAP = 2f;
    static final float TOC_NUMBER_PADDING = 6f;
    static final float DEFAULT_HANGING_INDENT = 10f;
    private static final String TOC_NUMBER_RESERVE = "0000";
    private static final String FALLBACK_HEADER = "doc2pdf";
    private static final Color RULE_COLOR = Color.LIGHT_GRAY;

    /**
     * Supplies the page to continue on when the current page is full.
     */
    @FunctionalInterface
    public interface PageSource {
        PDPage nextPage(PDPage current) throws IOException;
    }

    private final RenderContext ctx;
    private final PdfTheme theme;
    private final Logger logger;

    private final float pageHeight;
    private final float left;
    private final float right;
    private final float top;
    private final float bottom;
    private final float contentWidth;

    private final Map<Float, PDExtendedGraphicsState> alphaStates = new HashMap<>();

    private PDPage page;
    private PDPageContentStream stream;
    private PageSource pageSource;
    private boolean drawHeaderFooter;
    private String pageHeaderOverride;
    private float y;

    public PageWriter(RenderContext ctx, PDPage page, boolean drawHeaderFooter) throws IOException {
        this.ctx = ctx;
        this.theme = ctx.getTheme();
        this.logger = ctx.getLogger();
        this.drawHeaderFooter = drawHeaderFooter;
        this.pageSource = current -> ctx.addPage();

        PDRectangle size = theme.getPageSize();
        this.pageHeight = size.getHeight();
        this.left = theme.getMarginLeft();
        this.right = size.getWidth() - theme.getMarginRight();
        this.top = theme.getMarginTop();
        this.bottom = size.getHeight() - theme.getMarginBottom();
        this.contentWidth = right - left;

        bind(page);
    }

    // ------------------------------------------------------------------
    // Page and cursor state
    // ------------------------------------------------------------------

    /**
     * Continues writing on the given page: the cursor moves to the top margin and the
     * header/footer are drawn if enabled.
     */
    public void bind(PDPage newPage) throws IOException {
        closeStream();
        page = newPage;
        stream = new PDPageContentStream(ctx.getDocument(), page, AppendMode.APPEND, true, true);
        y = top;
        if (drawHeaderFooter) {
            drawHeaderFooterArea();
        }
    }

    /**
     * Starts a new page if fewer than {@code height} points are left above the bottom margin.
     * An empty page is never left for another one, so blocks taller than the content area
     * stay on the current page and must be split by the caller.
     */
    public void ensureSpace(float height) throws IOException {
        if (y + height <= bottom) {
            return;
        }
        if (isPageEmpty()) {
            logger.fine("Block of " + height + "pt exceeds the content height of " + getContentHeight() + "pt");
            return;
        }
        newPage();
    }

    private void newPage() throws IOException {
        PDPage next = pageSource.nextPage(page);
        bind(next);
        logger.fine("Continued on page " + ctx.pageNumberOf(next));
    }

    public void spacer(float points) {
        y = Math.min(y + points, bottom);
    }

    public boolean isPageEmpty() {
        return y <= top;
    }

    public Anchor currentAnchor() {
        return new Anchor(page, y);
    }

    public PDPage getPage() {
        return page;
    }

    public float getY() {
        return y;
    }

    public float getTop() {
        return top;
    }

    public float getBottom() {
        return bottom;
    }

    public float getLeft() {
        return left;
    }

    public float getContentWidth() {
        return contentWidth;
    }

    public float getContentHeight() {
        return bottom - top;
    }

    public void setPageSource(PageSource pageSource) {
        this.pageSource = pageSource;
    }

    public boolean isDrawHeaderFooter() {
        return drawHeaderFooter;
    }

    public void setDrawHeaderFooter(boolean drawHeaderFooter) {
        this.drawHeaderFooter = drawHeaderFooter;
    }

    public String getPageHeaderOverride() {
        return pageHeaderOverride;
    }

    /**
     * Sets a fixed page header text, or null to show the current section title.
     */
    public void setPageHeaderOverride(String pageHeaderOverride) {
        this.pageHeaderOverride = pageHeaderOverride;
    }

    // ------------------------------------------------------------------
    // Headings, paragraphs, lists
    // ------------------------------------------------------------------

    /**
     * Draws a heading (level 1 is the largest; levels above 3 render as 3) followed by a rule.
     *
     * @return Where the heading's first line was drawn
     */
    public Anchor heading(int level, String text) throws IOException {
        PdfFont font = headingFont(level);
        Color color = level <= 2 ? theme.getColorPrimary() : theme.getColorDark();
        float lineHeight = theme.lineHeight(font) * theme.getLineSpacingHeading();
        List<String> lines = TextWrapper.wrap(text, font, contentWidth);

        ensureSpace(lines.size() * lineHeight + headingSpacing(level));
        Anchor anchor = currentAnchor();
        drawLines(lines, font, color, left, lineHeight);
        spacer(headingSpacing(level));
        hairline(0.35f);
        spacer(headingGap(level));
        return anchor;
    }

    public void subheading(String text) throws IOException {
        PdfFont font = theme.getFontH4();
        float lineHeight = theme.lineHeight(font);
        List<String> lines = TextWrapper.wrap(text, font, contentWidth);
        // keep the rule and at least one following line on the same page
        ensureSpace(lines.size() * lineHeight + 4 + theme.lineHeight(theme.getFontNormal()));
        drawLines(lines, font, Color.BLACK, left, lineHeight);
        hairline(0.25f);
        spacer(4);
    }

    public void paragraph(String text) throws IOException {
        paragraph(text, theme.getFontNormal());
    }

    public void paragraph(String text, PdfFont font) throws IOException {
        PdfFont f = font != null ? font : theme.getFontNormal();
        List<String> lines = TextWrapper.wrap(text, f, contentWidth);
        drawLines(lines, f, Color.BLACK, left, theme.lineHeight(f));
        spacer(theme.getParagraphSpacing());
    }

    public void bulletLine(String title, String value) throws IOException {
        PdfFont font = theme.getFontNormal();
        List<String> lines = TextWrapper.wrap(title + ": " + value, font, contentWidth);
        drawLines(lines, font, Color.BLACK, left, theme.lineHeight(font));
        spacer(4);
    }

    /**
     * Draws a subheading and a two-column key/value list. The key column is as wide as the
     * widest key, clamped to 12%..35% of the content width.
     */
    public void definitionList(String title, Map<String, String> items) throws IOException {
        subheading(title);
        PdfFont keyFont = theme.getFontNormalBold();
        PdfFont valueFont = theme.getFontNormal();

        float widest = 0f;
        for (String key : items.keySet()) {
            widest = Math.max(widest, keyFont.width(key));
        }
        float keyWidth = clamp(widest, contentWidth * 0.12f, contentWidth * 0.35f);
        float valueX = left + keyWidth + KEY_GAP;
        float valueWidth = right - valueX;
        float rowLineHeight = Math.max(theme.lineHeight(keyFont), theme.lineHeight(valueFont));

        for (Map.Entry<String, String> item : items.entrySet()) {
            List<Cell> cells = new ArrayList<>();
            cells.add(new Cell(left, keyWidth, keyFont, rowLineHeight,
                    TextWrapper.wrap(item.getKey(), keyFont, keyWidth)));
            cells.add(new Cell(valueX, valueWidth, valueFont, rowLineHeight,
                    TextWrapper.wrap(item.getValue(), valueFont, valueWidth)));
            drawRow(cells, false, false, 2f);
            spacer(2);
        }
        spacer(4);
    }

    // ------------------------------------------------------------------
    // Tables
    // ------------------------------------------------------------------

    /**
     * Draws a header row and one row per cell array. Rows are never split across pages unless a
     * single row is taller than the content area.
     */
    public void table(List<TableColumnSpec> columns, Iterable<String[]> rows) throws IOException {
        int count = columns.size();
        if (count == 0) {
            return;
        }
        float gap = theme.getTableColumnGap();
        float[] ratios = new float[count];
        for (int c = 0; c < count; c++) {
            ratios[c] = columns.get(c).getWidthRatio();
        }
        float[] widths = columnWidths(ratios, contentWidth - gap * (count - 1));
        float[] xs = new float[count];
        float x = left;
        for (int c = 0; c < count; c++) {
            xs[c] = x;
            x += widths[c] + gap;
        }

        PdfFont headerFont = theme.getFontSmallBold();
        List<Cell> headerCells = new ArrayList<>();
        for (int c = 0; c < count; c++) {
            headerCells.add(new Cell(xs[c], widths[c], headerFont, theme.lineHeight(headerFont),
                    TextWrapper.wrap(columns.get(c).getHeader(), headerFont, innerWidth(widths[c]))));
        }

        Iterator<String[]> it = rows.iterator();
        List<Cell> firstRow = it.hasNext() ? rowCells(columns, it.next(), xs, widths) : null;

        // keep the header together with the first row
        float needed = rowHeight(headerCells) + ROW_PADDING;
        if (firstRow != null) {
            needed += rowHeight(firstRow) + ROW_PADDING;
        }
        if (needed <= getContentHeight()) {
            ensureSpace(needed);
        }

        drawRow(headerCells, true, true, ROW_PADDING);
        hairline(0.5f);
        spacer(ROW_PADDING);

        List<Cell> cells = firstRow;
        while (cells != null) {
            drawRow(cells, true, true, ROW_PADDING);
            spacer(ROW_PADDING);
            hairline(0.1f);
            spacer(2);
            cells = it.hasNext() ? rowCells(columns, it.next(), xs, widths) : null;
        }
    }

    private List<Cell> rowCells(List<TableColumnSpec> columns, String[] row, float[] xs, float[] widths)
            throws IOException {
        List<Cell> cells = new ArrayList<>();
        for (int c = 0; c < columns.size(); c++) {
            PdfFont font = columns.get(c).getFont() != null ? columns.get(c).getFont() : theme.getFontNormal();
            String text = row != null && row.length > c && row[c] != null ? row[c] : "";
            cells.add(new Cell(xs[c], widths[c], font, theme.lineHeight(font),
                    TextWrapper.wrap(text, font, innerWidth(widths[c]))));
        }
        return cells;
    }

    /**
     * Converts relative column ratios into widths that fill {@code available} points. Every
     * column gets at least {@link #MIN_COLUMN_WIDTH}; wider columns give up space for that.
     */
    static float[] columnWidths(float[] ratios, float available) {
        int count = ratios.length;
        float sum = 0f;
        for (float ratio : ratios) {
            sum += Math.max(0f, ratio);
        }

        float[] widths = new float[count];
        float total = 0f;
        for (int c = 0; c < count; c++) {
            float share = sum > 0 ? Math.max(0f, ratios[c]) / sum : 1f / count;
            widths[c] = Math.max(MIN_COLUMN_WIDTH, available * share);
            total += widths[c];
        }

        float excess = total - available;
        if (excess > 0) {
            float shrinkable = 0f;
            for (float width : widths) {
                shrinkable += width - MIN_COLUMN_WIDTH;
            }
            if (shrinkable > 0) {
                float factor = Math.min(1f, excess / shrinkable);
                for (int c = 0; c < count; c++) {
                    widths[c] -= (widths[c] - MIN_COLUMN_WIDTH) * factor;
                }
            }
        }
        return widths;
    }

    private static float innerWidth(float columnWidth) {
        return Math.max(1f, columnWidth - 2 * CELL_PADDING);
    }

    // ------------------------------------------------------------------
    // Table of contents
    // ------------------------------------------------------------------

    /**
     * Draws a single-line TOC entry: the title (shortened with an ellipsis if needed), dot
     * leaders and the right-aligned page number.
     *
     * @return The line's area in PDF user space
     */
    public PDRectangle tocLine(String title, int pageNumber) throws IOException {
        PdfFont font = theme.getFontNormal();
        String text = fitWithEllipsis(title != null ? title.trim() : "", font, tocTextWidth());
        List<String> lines = new ArrayList<>();
        lines.add(text);
        return drawTocBlock(lines, pageNumber, 0f);
    }

    public PDRectangle tocLineWrapped(String label, int pageNumber) throws IOException {
        return tocLineWrapped(label, pageNumber, DEFAULT_HANGING_INDENT);
    }

    /**
     * Draws a TOC entry whose label may wrap. Dot leaders follow the first line only, the page
     * number is aligned with the first line and continuation lines are indented.
     *
     * @return The area of the whole entry in PDF user space
     */
    public PDRectangle tocLineWrapped(String label, int pageNumber, float hangingIndent) throws IOException {
        return drawTocBlock(wrapTocLabel(label, hangingIndent), pageNumber, hangingIndent);
    }

    /**
     * Number of pages a table of contents needs: a level 1 heading followed by one
     * {@link #tocLineWrapped(String, int)} entry per label, starting on an empty page.
     * <p>
     * Wrapping does not depend on page numbers (their column has a fixed width), so this can be
     * computed before any page number is known. The arithmetic repeats the drawing code step by
     * step so both agree on every page break.
     */
    public int countTocPages(String title, List<String> labels) throws IOException {
        PdfFont headingFont = headingFont(1);
        float headingLineHeight = theme.lineHeight(headingFont) * theme.getLineSpacingHeading();
        float cursor = top;
        int headingLines = TextWrapper.wrap(title, headingFont, contentWidth).size();
        for (int i = 0; i < headingLines; i++) {
            cursor = Math.min(cursor + headingLineHeight, bottom);
        }
        cursor = Math.min(cursor + headingSpacing(1), bottom);
        cursor = Math.min(cursor + headingGap(1), bottom);

        float lineHeight = theme.lineHeight(theme.getFontNormal());
        int pages = 1;
        for (String label : labels) {
            int lines = wrapTocLabel(label, DEFAULT_HANGING_INDENT).size();
            if (cursor + (lines * lineHeight + TOC_LINE_GAP) > bottom && cursor > top) {
                pages++;
                cursor = top;
            }
            cursor = Math.min(cursor + lines * lineHeight + TOC_LINE_GAP, bottom);
        }
        return pages;
    }

    private PDRectangle drawTocBlock(List<String> lines, int pageNumber, float hangingIndent) throws IOException {
        PdfFont font = theme.getFontNormal();
        float lineHeight = theme.lineHeight(font);
        float available = tocTextWidth();

        ensureSpace(lines.size() * lineHeight + TOC_LINE_GAP);
        float blockTop = y;

        String first = lines.get(0);
        float dotWidth = Math.max(1f, font.width("."));
        float remaining = Math.max(0f, available - font.width(first));
        int dotCount = (int) Math.floor(Math.max(0f, remaining - 1f) / dotWidth);
        showText(first + ".".repeat(dotCount), font, Color.BLACK, left, y);
        showTextRight(String.valueOf(pageNumber), font, Color.BLACK, right, y);

        for (int i = 1; i < lines.size(); i++) {
            showText(lines.get(i), font, Color.BLACK, left + hangingIndent, y + i * lineHeight);
        }

        float blockHeight = lines.size() * lineHeight;
        y = Math.min(y + blockHeight + TOC_LINE_GAP, bottom);
        return new PDRectangle(left, pageHeight - (blockTop + blockHeight), contentWidth, blockHeight);
    }

    /**
     * Wraps a TOC label: the first line spans the full text column, the rest is wrapped as one
     * text at the indented width.
     */
    List<String> wrapTocLabel(String label, float hangingIndent) throws IOException {
        PdfFont font = theme.getFontNormal();
        float available = tocTextWidth();
        float indent = Math.max(0f, Math.min(hangingIndent, available / 2));

        List<String> lines = new ArrayList<>();
        String first = TextWrapper.wrap(label, font, available).get(0);
        lines.add(first);
        // wrapped lines are single-space joined, so the first line is a prefix of the normalized label
        String normalized = label == null ? "" : label.trim().replaceAll("\\s+", " ");
        String rest = normalized.substring(first.length()).trim();
        if (!rest.isEmpty()) {
            lines.addAll(TextWrapper.wrap(rest, font, available - indent));
        }

        int maxLines = Math.max(1, (int) ((getContentHeight() - TOC_LINE_GAP) / theme.lineHeight(font)));
        if (lines.size() > maxLines) {
            List<String> cut = new ArrayList<>(lines.subList(0, maxLines));
            int last = maxLines - 1;
            float width = last == 0 ? available : available - indent;
            cut.set(last, fitWithEllipsis(cut.get(last) + TocLabel.ELLIPSIS, font, width));
            return cut;
        }
        return lines;
    }

    float tocTextWidth() throws IOException {
        return contentWidth - (theme.getFontNormal().width(TOC_NUMBER_RESERVE) + TOC_NUMBER_PADDING);
    }

    // ------------------------------------------------------------------
    // Drawing primitives
    // ------------------------------------------------------------------

    /**
     * Draws a thin horizontal rule across the content width at the cursor.
     */
    public void hairline(float alpha) throws IOException {
        stream.saveGraphicsState();
        stream.setGraphicsStateParameters(alphaState(alpha));
        stream.setStrokingColor(Color.BLACK);
        stream.setLineWidth(0.5f);
        stream.moveTo(left, pageHeight - y);
        stream.lineTo(right, pageHeight - y);
        stream.stroke();
        stream.restoreGraphicsState();
    }

    private PDExtendedGraphicsState alphaState(float alpha) {
        return alphaStates.computeIfAbsent(alpha, a -> {
            PDExtendedGraphicsState state = new PDExtendedGraphicsState();
            state.setStrokingAlphaConstant(a);
            return state;
        });
    }

    /**
     * Draws lines top to bottom. If the whole block fits on a page it is kept together,
     * otherwise it flows over as many pages as needed.
     */
    private void drawLines(List<String> lines, PdfFont font, Color color, float x, float lineHeight)
            throws IOException {
        float blockHeight = lines.size() * lineHeight;
        if (blockHeight <= getContentHeight()) {
            ensureSpace(blockHeight);
        }
        for (String line : lines) {
            ensureSpace(lineHeight);
            showText(line, font, color, x, y);
            y = Math.min(y + lineHeight, bottom);
        }
    }

    /**
     * Draws a row of cells side by side and advances by the tallest cell. A row that fits on a
     * page is moved to a new page as a whole; a taller row is split into page-sized slices.
     */
    private void drawRow(List<Cell> cells, boolean clip, boolean separators, float trailingSpace)
            throws IOException {
        float rowHeight = rowHeight(cells);
        if (rowHeight + trailingSpace <= getContentHeight()) {
            ensureSpace(rowHeight + trailingSpace);
        } else if (rowHeight <= getContentHeight()) {
            ensureSpace(rowHeight);
        }

        int[] drawn = new int[cells.size()];
        while (true) {
            float available = bottom - y;
            int[] take = new int[cells.size()];
            boolean pending = false;
            boolean any = false;
            for (int c = 0; c < cells.size(); c++) {
                Cell cell = cells.get(c);
                int remainingLines = cell.lines.size() - drawn[c];
                if (remainingLines == 0) {
                    continue;
                }
                pending = true;
                take[c] = Math.min(remainingLines, (int) Math.floor((available + 0.01f) / cell.lineHeight));
                any |= take[c] > 0;
            }
            if (!pending) {
                break;
            }
            if (!any) {
                if (!isPageEmpty()) {
                    newPage();
                    continue;
                }
                // not even one line fits on an empty page, draw one line per cell clipped
                for (int c = 0; c < cells.size(); c++) {
                    take[c] = Math.min(1, cells.get(c).lines.size() - drawn[c]);
                }
            }

            float sliceHeight = 0f;
            for (int c = 0; c < cells.size(); c++) {
                if (take[c] == 0) {
                    continue;
                }
                Cell cell = cells.get(c);
                float cellHeight = Math.min(take[c] * cell.lineHeight, Math.max(available, 0f));
                drawCell(cell, drawn[c], take[c], cellHeight, clip);
                sliceHeight = Math.max(sliceHeight, take[c] * cell.lineHeight);
                drawn[c] += take[c];
            }
            if (separators) {
                drawColumnSeparators(cells, Math.min(sliceHeight, available));
            }
            y = Math.min(y + sliceHeight, bottom);
        }
    }

    private void drawCell(Cell cell, int from, int count, float height, boolean clip) throws IOException {
        if (clip) {
            stream.saveGraphicsState();
            stream.addRect(cell.x, pageHeight - (y + height), cell.width, height);
            stream.clip();
        }
        float textX = clip ? cell.x + CELL_PADDING : cell.x;
        for (int i = 0; i < count; i++) {
            showText(cell.lines.get(from + i), cell.font, Color.BLACK, textX, y + i * cell.lineHeight);
        }
        if (clip) {
            stream.restoreGraphicsState();
        }
    }

    private void drawColumnSeparators(List<Cell> cells, float height) throws IOException {
        if (cells.size() < 2 || height <= 0) {
            return;
        }
        stream.saveGraphicsState();
        stream.setStrokingColor(RULE_COLOR);
        stream.setLineWidth(0.5f);
        stream.setLineDashPattern(new float[]{1f, 2f}, 0f);
        for (int c = 0; c < cells.size() - 1; c++) {
            Cell cell = cells.get(c);
            float gapStart = cell.x + cell.width;
            float x = gapStart + (cells.get(c + 1).x - gapStart) / 2f;
            stream.moveTo(x, pageHeight - y);
            stream.lineTo(x, pageHeight - (y + height));
        }
        stream.stroke();
        stream.restoreGraphicsState();
    }

    private static float rowHeight(List<Cell> cells) {
        float height = 0f;
        for (Cell cell : cells) {
            height = Math.max(height, cell.lines.size() * cell.lineHeight);
        }
        return height;
    }

    private void drawHeaderFooterArea() throws IOException {
        PdfFont font = theme.getFontSmall();
        float lineHeight = theme.lineHeight(font);

        String header = pageHeaderOverride;
        if (header == null) {
            header = ctx.getCurrentSectionTitle() != null ? ctx.getCurrentSectionTitle() : ctx.getDocumentTitle();
        }
        if (header == null || header.trim().isEmpty()) {
            header = FALLBACK_HEADER;
        }
        float headerTop = theme.getPageHeaderTop();
        showText(fitWithEllipsis(header, font, contentWidth), font, theme.getColorMuted(), left, headerTop);

        // light rule under the header
        stream.saveGraphicsState();
        stream.setStrokingColor(RULE_COLOR);
        stream.setLineWidth(0.5f);
        stream.moveTo(left, pageHeight - (headerTop + lineHeight));
        stream.lineTo(right, pageHeight - (headerTop + lineHeight));
        stream.stroke();
        stream.restoreGraphicsState();

        String pageNumber = String.valueOf(ctx.pageNumberOf(page));
        showTextRight(pageNumber, font, theme.getColorMuted(), right, bottom + 6);
    }

    private void showText(String text, PdfFont font, Color color, float x, float lineTop) throws IOException {
        String safe = font.sanitize(text);
        if (safe.isEmpty()) {
            return;
        }
        stream.setNonStrokingColor(color);
        stream.beginText();
        stream.setFont(font.getFont(), font.getSize());
        stream.newLineAtOffset(x, pageHeight - lineTop - font.getSize());
        stream.showText(safe);
        stream.endText();
    }

    private void showTextRight(String text, PdfFont font, Color color, float rightEdge, float lineTop)
            throws IOException {
        showText(text, font, color, rightEdge - font.width(text), lineTop);
    }

    private static String fitWithEllipsis(String text, PdfFont font, float maxWidth) throws IOException {
        if (font.width(text) <= maxWidth) {
            return text;
        }
        String base = text.endsWith(TocLabel.ELLIPSIS) ? text.substring(0, text.length() - 1) : text;
        while (base.length() > 1 && font.width(base + TocLabel.ELLIPSIS) > maxWidth) {
            base = base.substring(0, base.length() - 1);
        }
        return base.trim() + TocLabel.ELLIPSIS;
    }

    private PdfFont headingFont(int level) {
        switch (level) {
            case 1:
                return theme.getFontH1();
            case 2:
                return theme.getFontH2();
            default:
                return theme.getFontH3();
        }
    }

    private static float headingSpacing(int level) {
        return level == 1 ? 10f : level == 2 ? 8f : 6f;
    }

    private static float headingGap(int level) {
        return level == 1 ? 8f : 6f;
    }

    private static float clamp(float value, float min, float max) {
        return Math.max(min, Math.min(max, value));
    }

    private void closeStream() throws IOException {
        if (stream != null) {
            stream.close();
            stream = null;
        }
    }

    @Override
    public void close() throws IOException {
        closeStream();
    }

    private static final class Cell {
        final float x;
        final float width;
        final PdfFont font;
        final float lineHeight;
        final List<String> lines;

        Cell(float x, float width, PdfFont font, float lineHeight, List<String> lines) {
            this.x = x;
            this.width = width;
            this.font = font;
            this.lineHeight = lineHeight;
            this.lines = lines;
        }
    }
}
