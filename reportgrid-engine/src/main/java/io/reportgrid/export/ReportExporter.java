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


package io.reportgrid.export;

import io.reportgrid.config.PdfSettings;
import io.reportgrid.export.csv.CsvExporter;
import io.reportgrid.export.pdf.CascadingPdfExporter;
import io.reportgrid.export.pdf.PdfExportRequest;
import io.reportgrid.notify.NotificationCenter;
import io.reportgrid.view.ReportSurface;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * The export triggers of one report view. Every request ends with exactly one
 * notification: success, degraded fallback, or error. A PDF export requested while
 * another is still running is ignored with an info notification and a
 * {@link ExportStatus#BUSY} outcome.
 */
public class ReportExporter {
    private static final Logger logger = LogManager.getLogger(ReportExporter.class);

    public static final String PDF_OVERLAY_LABEL = "Generating PDF";

    private final ReportSurface surface;
    private final NotificationCenter notifications;
    private final ReportFileNames fileNames;
    private final CsvExporter csvExporter;
    private final CascadingPdfExporter pdfExporter;
    private final PdfSettings pdfSettings;
    private final Path outputDirectory;
    private boolean pdfInFlight;

    public ReportExporter(ReportSurface surface, NotificationCenter notifications, ReportFileNames fileNames,
                          CascadingPdfExporter pdfExporter, PdfSettings pdfSettings, Path outputDirectory) {
        this.surface = surface;
        this.notifications = notifications;
        this.fileNames = fileNames;
        this.csvExporter = new CsvExporter(fileNames);
        this.pdfExporter = pdfExporter;
        this.pdfSettings = pdfSettings;
        this.outputDirectory = outputDirectory;
    }

    public ExportOutcome exportCsv() {
        ExportOutcome outcome;
        try {
            Path file = csvExporter.export(surface, outputDirectory);
            outcome = ExportOutcome.success(file, "csv", "CSV file " + file.getFileName() + " saved ("
                + surface.filteredAndSorted().size() + " rows)", List.of());
        } catch (IOException | RuntimeException e) {
            logger.error("CSV export of '{}' failed", surface.title(), e);
            outcome = ExportOutcome.failed("CSV export failed: " + e.getMessage(), List.of("csv: " + e));
        }
        announce(outcome);
        return outcome;
    }

    public synchronized boolean isPdfExportInFlight() {
        return pdfInFlight;
    }

    public CompletionStage<ExportOutcome> exportPdf() {
        synchronized (this) {
            if (pdfInFlight) {
                logger.info("Ignoring PDF export of '{}', another one is still running", surface.title());
                ExportOutcome busy = ExportOutcome.busy("A PDF export is already running");
                notifications.info(busy.message());
                return CompletableFuture.completedFuture(busy);
            }
            pdfInFlight = true;
        }

        PdfExportRequest request;
        try {
            Files.createDirectories(outputDirectory);
            request = new PdfExportRequest(surface, outputDirectory.resolve(fileNames.fileName(surface.title(), "pdf")),
                pdfSettings, fileNames.now());
        } catch (IOException | RuntimeException e) {
            logger.error("Cannot prepare PDF export of '{}' into {}", surface.title(), outputDirectory, e);
            return CompletableFuture.completedFuture(finishPdf(
                ExportOutcome.failed("PDF export failed: " + e.getMessage(), List.of(e.toString()))));
        }

        logger.info("Exporting '{}' as PDF to {}", surface.title(), request.outputFile());
        return notifications.withLoadingOverlay(PDF_OVERLAY_LABEL, () -> pdfExporter.export(request))
            .handle((outcome, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                    logger.error("PDF export of '{}' failed unexpectedly", surface.title(), cause);
                    return finishPdf(ExportOutcome.failed("PDF export failed: " + cause.getMessage(),
                        List.of(cause.toString())));
                }
                return finishPdf(outcome);
            });
    }

    private ExportOutcome finishPdf(ExportOutcome outcome) {
        synchronized (this) {
            pdfInFlight = false;
        }
        announce(outcome);
        return outcome;
    }

    private void announce(ExportOutcome outcome) {
        notifications.notify(outcome.message(), outcome.status().getNotificationKind());
    }
}
