/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.reportgrid.export.pdf;

import io.reportgrid.config.PdfSettings;
import io.reportgrid.view.ReportRegion;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.awt.Color;
import java.io.IOException;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.GregorianCalendar;
import java.util.List;
import java.util.Locale;

/**
 * Lays out a captured report region as a paginated PDF table.
 *
 * <p>The first page starts with a header block: the title, the generation time and the
 * "filtered / total" row counts. Every page repeats the column header row. Columns share
 * the page width evenly; cell text that does not fit is cut with an ellipsis.</p>
 */
public class TableDocumentRenderer {

    static final DateTimeFormatter GENERATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z", Locale.ROOT);

    private static final Color HEADER_FILL = new Color(0xE8, 0xEE, 0xF7);
    private static final Color RULE = new Color(0xC8, 0xC8, 0xC8);

    private final PdfSettings settings;

    public TableDocumentRenderer(PdfSettings settings) {
        this.settings = settings;
    }

    public static PDRectangle pageSize(PdfSettings settings) {
        PDRectangle a4 = PDRectangle.A4;
        return settings.landscape() ? new PDRectangle(a4.getHeight(), a4.getWidth()) : a4;
    }

    /**
     * @param document the document to add pages to
     * @param region the captured rows
     * @param regular font for cells
     * @param bold font for the title and header row
     * @param generatedAt the export time
     * @return the number of pages added
     * @throws IOException when PDFBox cannot write the content
     */
    public int render(PDDocument document, ReportRegion region, PDFont regular, PDFont bold,
                      ZonedDateTime generatedAt) throws IOException {
        PDDocumentInformation info = document.getDocumentInformation();
        info.setTitle(PdfText.sanitize(region.title(), regular));
        info.setSubject("Report export");
        info.setCreator("reportgrid");
        info.setCreationDate(GregorianCalendar.from(generatedAt));

        PDRectangle size = pageSize(settings);
        float margin = settings.marginPoints();
        float fontSize = settings.fontSize();
        float rowHeight = fontSize * 1.8f;
        float tableWidth = size.getWidth() - 2 * margin;
        List<String> columns = region.columns();
        float columnWidth = columns.isEmpty() ? tableWidth : tableWidth / columns.size();
        float padding = 2f;

        int pages = 0;
        int next = 0;
        do {
            PDPage page = new PDPage(size);
            document.addPage(page);
            pages++;
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                float y = size.getHeight() - margin;
                if (pages == 1) {
                    y = writeHeaderBlock(content, region, regular, bold, generatedAt, margin, y);
                }
                if (columns.isEmpty() || region.rows().isEmpty()) {
                    text(content, regular, fontSize + 2, margin, y - rowHeight, "No data");
                    break;
                }
                y = writeRow(content, bold, columns, margin, y, columnWidth, rowHeight, padding, HEADER_FILL);
                int rowsOnPage = 0;
                while (next < region.rows().size() && (y - rowHeight >= margin || rowsOnPage == 0)) {
                    y = writeRow(content, regular, region.rows().get(next), margin, y, columnWidth, rowHeight,
                        padding, null);
                    next++;
                    rowsOnPage++;
                }
            }
        } while (next < region.rows().size());
        return pages;
    }

    private float writeHeaderBlock(PDPageContentStream content, ReportRegion region, PDFont regular, PDFont bold,
                                   ZonedDateTime generatedAt, float margin, float top) throws IOException {
        float y = top - 16;
        text(content, bold, 14, margin, y, PdfText.sanitize(region.title(), bold));
        y -= 16;
        text(content, regular, 9, margin, y, "Generated: " + GENERATED.format(generatedAt));
        y -= 12;
        text(content, regular, 9, margin, y, "Rows: " + region.filteredCount() + " / " + region.totalCount());
        return y - 12;
    }

    private float writeRow(PDPageContentStream content, PDFont font, List<String> cells, float x, float top,
                           float columnWidth, float rowHeight, float padding, Color fill) throws IOException {
        float bottom = top - rowHeight;
        float width = columnWidth * cells.size();
        if (fill != null) {
            content.setNonStrokingColor(fill);
            content.addRect(x, bottom, width, rowHeight);
            content.fill();
            content.setNonStrokingColor(Color.BLACK);
        }
        content.setStrokingColor(RULE);
        content.setLineWidth(0.5f);
        content.moveTo(x, bottom);
        content.lineTo(x + width, bottom);
        content.stroke();

        float baseline = bottom + (rowHeight - settings.fontSize()) / 2f + 1f;
        for (int c = 0; c < cells.size(); c++) {
            String cell = PdfText.fit(cells.get(c), font, settings.fontSize(), columnWidth - 2 * padding);
            if (!cell.isEmpty()) {
                text(content, font, settings.fontSize(), x + c * columnWidth + padding, baseline, cell);
            }
        }
        return bottom;
    }

    private static void text(PDPageContentStream content, PDFont font, float size, float x, float y, String text)
        throws IOException {
        content.beginText();
        content.setFont(font, size);
        content.newLineAtOffset(x, y);
        content.showText(text);
        content.endText();
    }
}
