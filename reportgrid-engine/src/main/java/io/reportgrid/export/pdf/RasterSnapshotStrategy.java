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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Second tier: draws the captured rows into one image and slices it across PDF pages.
 *
 * <ul>
 *   <li>The image is clamped to the configured canvas size.</li>
 *   <li>JPEG quality drops while the encoded image is above the size thresholds.</li>
 *   <li>At most {@code max-pages} pages are produced; the rest is cut off with a warning.</li>
 *   <li>A document under {@code min-plausible-bytes} gets a diagnostic page appended,
 *       since that size means the image came out empty.</li>
 * </ul>
 */
public class RasterSnapshotStrategy implements PdfExportStrategy {
    private static final Logger logger = LogManager.getLogger(RasterSnapshotStrategy.class);

    public static final String NAME = "raster";

    static final float HEADER_HEIGHT = 40f;
    private static final int BLANK_PROBE = 10;

    private final RegionRasterizer rasterizer;
    private final JpegEncoder encoder;

    public RasterSnapshotStrategy() {
        this(new Graphics2DRegionRasterizer(), new JpegEncoder());
    }

    public RasterSnapshotStrategy(RegionRasterizer rasterizer, JpegEncoder encoder) {
        this.rasterizer = rasterizer;
        this.encoder = encoder;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return DocumentSnapshotStrategy.isClassPresent("org.apache.pdfbox.pdmodel.PDDocument")
            && JpegEncoder.isAvailable();
    }

    @Override
    public CompletionStage<TierResult> attemptExport(PdfExportRequest request) {
        return SurfacePreparation.captureFullRegion(request.surface(), request.settings().settleDelay(),
            region -> CompletableFuture.completedFuture(write(request, region)));
    }

    private TierResult write(PdfExportRequest request, ReportRegion region) {
        PdfSettings settings = request.settings();
        BufferedImage image = rasterizer.rasterize(region, settings.maxCanvasWidth(), settings.maxCanvasHeight());
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            return TierResult.failure("rasterizer produced no image");
        }
        if (isBlank(image)) {
            logger.warn("Raster of '{}' looks blank ({}x{})", region.title(), image.getWidth(), image.getHeight());
        }

        try (PDDocument document = new PDDocument()) {
            JpegEncoder.Encoded jpeg = encoder.encode(image, settings.jpegQualities(), settings.qualityThresholds());
            PDImageXObject xobject = JPEGFactory.createFromByteArray(document, jpeg.bytes());
            int pages = slice(document, xobject, region, request, settings);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            if (out.size() < settings.minPlausibleBytes()) {
                logger.warn("Raster PDF of '{}' is only {} bytes, appending a diagnostic page", region.title(),
                    out.size());
                addDiagnosticPage(document, image, jpeg, settings);
                out.reset();
                document.save(out);
            }
            Files.write(request.outputFile(), out.toByteArray());
            logger.info("Wrote raster PDF of '{}' with {} pages at JPEG quality {} to {}", region.title(), pages,
                jpeg.quality(), request.outputFile());
            return TierResult.success(request.outputFile(), "PDF file " + request.outputFile().getFileName()
                + " saved as an image (" + Math.round(out.size() / 1024.0) + " KB)");
        } catch (IOException e) {
            logger.warn("Raster tier could not write {}", request.outputFile(), e);
            return TierResult.failure("could not write " + request.outputFile().getFileName() + ": " + e.getMessage());
        }
    }

    /**
     * Places the image scaled to the page width across as many pages as it needs, up to
     * the page limit. Page 1 starts below a title header.
     */
    int slice(PDDocument document, PDImageXObject image, ReportRegion region, PdfExportRequest request,
              PdfSettings settings) throws IOException {
        PDRectangle size = TableDocumentRenderer.pageSize(settings);
        float margin = settings.marginPoints();
        float usableWidth = size.getWidth() - 2 * margin;
        float scale = usableWidth / image.getWidth();
        float drawnHeight = image.getHeight() * scale;
        PDFont font = PDType1Font.HELVETICA;

        float consumed = 0f;
        int pages = 0;
        while (pages == 0 || consumed < drawnHeight) {
            if (pages == settings.maxPages()) {
                logger.warn("Raster of '{}' needs more than {} pages, the rest is cut off", region.title(),
                    settings.maxPages());
                break;
            }
            PDPage page = new PDPage(size);
            document.addPage(page);
            float header = pages == 0 ? HEADER_HEIGHT : 0f;
            float sliceHeight = size.getHeight() - 2 * margin - header;
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                if (pages == 0) {
                    content.beginText();
                    content.setFont(PDType1Font.HELVETICA_BOLD, 14);
                    content.newLineAtOffset(margin, size.getHeight() - margin - 14);
                    content.showText(PdfText.sanitize(region.title(), PDType1Font.HELVETICA_BOLD));
                    content.setFont(font, 9);
                    content.newLineAtOffset(0, -14);
                    content.showText("Generated: " + TableDocumentRenderer.GENERATED.format(request.generatedAt()));
                    content.endText();
                }
                content.saveGraphicsState();
                content.addRect(margin, margin, usableWidth, sliceHeight);
                content.clip();
                float top = size.getHeight() - margin - header + consumed;
                content.drawImage(image, margin, top - drawnHeight, usableWidth, drawnHeight);
                content.restoreGraphicsState();
            }
            consumed += sliceHeight;
            pages++;
        }
        return pages;
    }

    private static void addDiagnosticPage(PDDocument document, BufferedImage image, JpegEncoder.Encoded jpeg,
                                          PdfSettings settings) throws IOException {
        PDRectangle size = TableDocumentRenderer.pageSize(settings);
        PDPage page = new PDPage(size);
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            content.beginText();
            content.setFont(PDType1Font.HELVETICA, 12);
            content.newLineAtOffset(settings.marginPoints(), size.getHeight() - settings.marginPoints() - 12);
            content.showText("PDF generation completed with minimal content");
            content.newLineAtOffset(0, -16);
            content.showText("Canvas size: " + image.getWidth() + "x" + image.getHeight());
            content.newLineAtOffset(0, -16);
            content.showText("Image data size: " + jpeg.bytes().length + " bytes at quality " + jpeg.quality());
            content.endText();
        }
    }

    static boolean isBlank(BufferedImage image) {
        int width = Math.min(image.getWidth(), BLANK_PROBE);
        int height = Math.min(image.getHeight(), BLANK_PROBE);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if ((image.getRGB(x, y) & 0xFFFFFF) != 0xFFFFFF) {
                    return false;
                }
            }
        }
        return true;
    }
}
