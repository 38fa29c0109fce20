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

import io.reportgrid.view.ReportRegion;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.print.PrintServiceLookup;
import java.awt.Font;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.GraphicsEnvironment;
import java.awt.print.PageFormat;
import java.awt.print.Printable;
import java.awt.print.PrinterException;
import java.awt.print.PrinterJob;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BooleanSupplier;

/**
 * Last tier: hands the captured rows to the platform print dialog, where the user can
 * print or save them. No file is written by the engine, so the result is always
 * reported as degraded. Unavailable on headless hosts and without a print service.
 */
public class PrintDialogStrategy implements PdfExportStrategy {
    private static final Logger logger = LogManager.getLogger(PrintDialogStrategy.class);

    public static final String NAME = "print";

    /** Shows the print flow for a region. Returns whether the user confirmed printing. */
    @FunctionalInterface
    public interface PrintFlow {
        boolean print(ReportRegion region) throws PrinterException;
    }

    private final PrintFlow flow;
    private final BooleanSupplier available;

    public PrintDialogStrategy() {
        this(PrintDialogStrategy::showDialog, PrintDialogStrategy::platformCanPrint);
    }

    public PrintDialogStrategy(PrintFlow flow, BooleanSupplier available) {
        this.flow = flow;
        this.available = available;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return available.getAsBoolean();
    }

    @Override
    public CompletionStage<TierResult> attemptExport(PdfExportRequest request) {
        return SurfacePreparation.captureFullRegion(request.surface(), request.settings().settleDelay(),
            region -> {
                try {
                    boolean printed = flow.print(region);
                    logger.info("Print dialog for '{}' closed, printed={}", region.title(), printed);
                    return CompletableFuture.completedFuture(TierResult.degraded(printed
                        ? "PDF libraries are unavailable; the report was sent to the print dialog instead"
                        : "PDF libraries are unavailable and printing was cancelled"));
                } catch (PrinterException e) {
                    return CompletableFuture.completedFuture(TierResult.failure("printing failed: " + e.getMessage()));
                }
            });
    }

    static boolean platformCanPrint() {
        return !GraphicsEnvironment.isHeadless() && PrintServiceLookup.lookupDefaultPrintService() != null;
    }

    static boolean showDialog(ReportRegion region) throws PrinterException {
        PrinterJob job = PrinterJob.getPrinterJob();
        job.setJobName(region.title());
        job.setPrintable(new RegionPrintable(region));
        if (!job.printDialog()) {
            return false;
        }
        job.print();
        return true;
    }

    /** Prints the region as text lines, as many per page as fit. */
    static final class RegionPrintable implements Printable {
        private static final int LINE_HEIGHT = 12;

        private final ReportRegion region;

        RegionPrintable(ReportRegion region) {
            this.region = region;
        }

        @Override
        public int print(Graphics graphics, PageFormat format, int pageIndex) {
            int linesPerPage = Math.max(1, (int) (format.getImageableHeight() / LINE_HEIGHT) - 2);
            int first = pageIndex * linesPerPage;
            if (pageIndex > 0 && first >= region.rows().size()) {
                return NO_SUCH_PAGE;
            }
            Graphics2D g = (Graphics2D) graphics;
            g.translate(format.getImageableX(), format.getImageableY());
            g.setFont(new Font(Font.MONOSPACED, Font.PLAIN, 9));
            int y = LINE_HEIGHT;
            g.drawString(region.title() + "  " + String.join(" | ", region.columns()), 0, y);
            int end = Math.min(region.rows().size(), first + linesPerPage);
            for (int r = first; r < end; r++) {
                y += LINE_HEIGHT;
                g.drawString(String.join(" | ", region.rows().get(r)), 0, y);
            }
            return PAGE_EXISTS;
        }
    }
}
