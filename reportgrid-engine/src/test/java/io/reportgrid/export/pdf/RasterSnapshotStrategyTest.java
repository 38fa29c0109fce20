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

import io.reportgrid.ReportFixtures;
import io.reportgrid.config.EngineConfig;
import io.reportgrid.config.PdfSettings;
import io.reportgrid.model.RowModelBuilder;
import io.reportgrid.notify.sched.VirtualTimeScheduler;
import io.reportgrid.paging.PageState;
import io.reportgrid.view.ReportViewStore;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RasterSnapshotStrategy")
class RasterSnapshotStrategyTest {

    private static final ZonedDateTime GENERATED = ZonedDateTime.parse("2024-05-07T08:59:00+09:00[Asia/Tokyo]");

    @TempDir
    Path tempDir;

    private ReportViewStore store;

    @BeforeEach
    void setUp() {
        store = new ReportViewStore(RowModelBuilder.build(ReportFixtures.users(57)), EngineConfig.defaults(),
            new VirtualTimeScheduler());
        store.setPageSize(10);
        store.goToPage(4);
    }

    /// Draws a grey block of the given height instead of text, so no fonts are needed.
    private static RegionRasterizer filled(int width, int height) {
        return (region, maxWidth, maxHeight) -> {
            BufferedImage image = new BufferedImage(Math.min(width, maxWidth), Math.min(height, maxHeight),
                BufferedImage.TYPE_INT_RGB);
            Graphics2D g = image.createGraphics();
            try {
                g.setColor(Color.GRAY);
                g.fillRect(0, 0, image.getWidth(), image.getHeight());
            } finally {
                g.dispose();
            }
            return image;
        };
    }

    private TierResult export(RasterSnapshotStrategy strategy, PdfSettings settings, Path file) {
        return strategy.attemptExport(new PdfExportRequest(store, file, settings, GENERATED))
            .toCompletableFuture().join();
    }

    private static int pageCount(Path file) throws IOException {
        try (PDDocument document = PDDocument.load(file.toFile())) {
            return document.getNumberOfPages();
        }
    }

    @Test
    @DisplayName("should slice a tall image across as many pages as it needs")
    void shouldSliceAcrossPages() throws IOException {
        Path file = tempDir.resolve("tall.pdf");

        TierResult result = export(new RasterSnapshotStrategy(filled(800, 4000), new JpegEncoder()),
            ReportFixtures.pdfSettings(10, 0), file);

        assertThat(result.status()).isEqualTo(TierResult.Status.SUCCESS);
        assertThat(result.message()).startsWith("PDF file tall.pdf saved as an image (");
        assertThat(pageCount(file)).isEqualTo(8);
    }

    @Test
    @DisplayName("should cut off at the page limit")
    void shouldCapPages() throws IOException {
        Path file = tempDir.resolve("capped.pdf");

        TierResult result = export(new RasterSnapshotStrategy(filled(800, 4000), new JpegEncoder()),
            ReportFixtures.pdfSettings(3, 0), file);

        assertThat(result.isFailure()).isFalse();
        assertThat(pageCount(file)).isEqualTo(3);
    }

    @Test
    @DisplayName("should put the title on the first page")
    void shouldWriteTitle() throws IOException {
        Path file = tempDir.resolve("short.pdf");

        export(new RasterSnapshotStrategy(filled(800, 200), new JpegEncoder()), ReportFixtures.pdfSettings(10, 0),
            file);

        assertThat(pageCount(file)).isEqualTo(1);
        try (PDDocument document = PDDocument.load(file.toFile())) {
            assertThat(new PDFTextStripper().getText(document))
                .contains("User Report")
                .contains("Generated: 2024-05-07 08:59");
        }
    }

    @Test
    @DisplayName("should append a diagnostic page to an implausibly small document")
    void shouldAppendDiagnosticPage() throws IOException {
        Path file = tempDir.resolve("small.pdf");

        TierResult result = export(new RasterSnapshotStrategy(filled(100, 50), new JpegEncoder()),
            ReportFixtures.pdfSettings(10, 10_000_000), file);

        assertThat(result.isFailure()).isFalse();
        try (PDDocument document = PDDocument.load(file.toFile())) {
            assertThat(document.getNumberOfPages()).isEqualTo(2);
            assertThat(new PDFTextStripper().getText(document))
                .contains("PDF generation completed with minimal content")
                .contains("Canvas size: 100x50");
        }
    }

    @Test
    @DisplayName("should clamp the canvas to the configured limits")
    void shouldClampCanvas() {
        AtomicInteger seenMaxHeight = new AtomicInteger();
        RegionRasterizer rasterizer = (region, maxWidth, maxHeight) -> {
            seenMaxHeight.set(maxHeight);
            return filled(800, 100).rasterize(region, maxWidth, maxHeight);
        };
        PdfSettings defaults = ReportFixtures.pdfSettings(10, 0);
        PdfSettings settings = new PdfSettings(defaults.landscape(), null, defaults.fontTimeout(),
            defaults.settleDelay(), defaults.marginPoints(), defaults.fontSize(), defaults.maxPages(), 1024, 64,
            defaults.jpegQualities(), defaults.qualityThresholds(), defaults.minPlausibleBytes());

        export(new RasterSnapshotStrategy(rasterizer, new JpegEncoder()), settings, tempDir.resolve("clamped.pdf"));

        assertThat(seenMaxHeight).hasValue(64);
    }

    @Test
    @DisplayName("should rasterize every filtered row and restore the page")
    void shouldCaptureAllRows() {
        AtomicInteger rows = new AtomicInteger();
        RegionRasterizer rasterizer = (region, maxWidth, maxHeight) -> {
            rows.set(region.rows().size());
            return filled(800, 100).rasterize(region, maxWidth, maxHeight);
        };

        export(new RasterSnapshotStrategy(rasterizer, new JpegEncoder()), ReportFixtures.pdfSettings(10, 0),
            tempDir.resolve("all.pdf"));

        assertThat(rows).hasValue(57);
        assertThat(store.pageState()).isEqualTo(new PageState(4, 10));
    }

    @Test
    @DisplayName("should fail the tier when the rasterizer produces nothing")
    void shouldFailWithoutImage() {
        Path file = tempDir.resolve("none.pdf");

        TierResult result = export(new RasterSnapshotStrategy((region, w, h) -> null, new JpegEncoder()),
            ReportFixtures.pdfSettings(10, 0), file);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.message()).isEqualTo("rasterizer produced no image");
        assertThat(file).doesNotExist();
    }

    @Test
    @DisplayName("should detect a blank top-left corner")
    void shouldDetectBlankImage() {
        BufferedImage image = new BufferedImage(20, 20, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 20; y++) {
            for (int x = 0; x < 20; x++) {
                image.setRGB(x, y, 0xFFFFFF);
            }
        }
        assertThat(RasterSnapshotStrategy.isBlank(image)).isTrue();

        image.setRGB(5, 5, 0x000000);
        assertThat(RasterSnapshotStrategy.isBlank(image)).isFalse();
    }
}
