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
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * First tier: lays the captured rows out as real PDF text with PDFBox. Waits for the
 * configured TrueType font first. With that font, the odd character it lacks is replaced.
 * Without it, text is set in Helvetica, and a report holding characters Helvetica cannot
 * show (Japanese text, for one) fails this tier so that the raster tier draws it instead.
 */
public class DocumentSnapshotStrategy implements PdfExportStrategy {
    private static final Logger logger = LogManager.getLogger(DocumentSnapshotStrategy.class);

    public static final String NAME = "document";
    static final String MISSING_GLYPHS = "font cannot show the report text";

    private final FontReadiness fontReadiness;

    public DocumentSnapshotStrategy(FontReadiness fontReadiness) {
        this.fontReadiness = fontReadiness;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return isClassPresent("org.apache.pdfbox.pdmodel.PDDocument");
    }

    @Override
    public CompletionStage<TierResult> attemptExport(PdfExportRequest request) {
        PdfSettings settings = request.settings();
        AtomicReference<Optional<byte[]>> font = new AtomicReference<>(Optional.empty());
        return SurfacePreparation.captureFullRegion(
            request.surface(),
            () -> fontReadiness.await(request.surface().scheduler(), settings.fontTimeout()).thenAccept(font::set),
            settings.settleDelay(),
            region -> CompletableFuture.completedFuture(write(request, region, font.get()))
        );
    }

    private TierResult write(PdfExportRequest request, ReportRegion region, Optional<byte[]> fontBytes) {
        try (PDDocument document = new PDDocument()) {
            PDFont regular = PDType1Font.HELVETICA;
            PDFont bold = PDType1Font.HELVETICA_BOLD;
            if (fontBytes.isPresent()) {
                regular = PDType0Font.load(document, new ByteArrayInputStream(fontBytes.get()));
                bold = regular;
            } else if (!standardFontsCanShow(region, regular, bold)) {
                logger.info("Standard fonts cannot show the text of '{}', leaving it to the next tier",
                    region.title());
                return TierResult.failure(MISSING_GLYPHS);
            }
            int pages = new TableDocumentRenderer(request.settings())
                .render(document, region, regular, bold, request.generatedAt());
            document.save(request.outputFile().toFile());
            logger.info("Wrote {} rows of '{}' on {} pages to {}", region.rows().size(), region.title(), pages,
                request.outputFile());
            return TierResult.success(request.outputFile(),
                "PDF file " + request.outputFile().getFileName() + " saved (" + region.rows().size() + " rows, "
                    + pages + " pages)");
        } catch (IOException e) {
            logger.warn("Document tier could not write {}", request.outputFile(), e);
            return TierResult.failure("could not write " + request.outputFile().getFileName() + ": " + e.getMessage());
        }
    }

    static boolean standardFontsCanShow(ReportRegion region, PDFont regular, PDFont bold) {
        if (!PdfText.canShow(region.title(), bold)) {
            return false;
        }
        for (String column : region.columns()) {
            if (!PdfText.canShow(column, bold)) {
                return false;
            }
        }
        for (List<String> row : region.rows()) {
            for (String cell : row) {
                if (!PdfText.canShow(cell, regular)) {
                    return false;
                }
            }
        }
        return true;
    }

    static boolean isClassPresent(String className) {
        try {
            Class.forName(className, false, DocumentSnapshotStrategy.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }
}
