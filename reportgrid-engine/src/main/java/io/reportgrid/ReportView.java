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


package io.reportgrid;

import io.reportgrid.config.EngineConfig;
import io.reportgrid.config.PdfSettings;
import io.reportgrid.export.ExportOutcome;
import io.reportgrid.export.ReportExporter;
import io.reportgrid.export.ReportFileNames;
import io.reportgrid.export.pdf.CascadingPdfExporter;
import io.reportgrid.export.pdf.DocumentSnapshotStrategy;
import io.reportgrid.export.pdf.FontReadiness;
import io.reportgrid.export.pdf.PdfExportStrategy;
import io.reportgrid.export.pdf.PrintDialogStrategy;
import io.reportgrid.export.pdf.RasterSnapshotStrategy;
import io.reportgrid.model.ReportTable;
import io.reportgrid.model.RowModel;
import io.reportgrid.model.RowModelBuilder;
import io.reportgrid.notify.NotificationCenter;
import io.reportgrid.notify.sched.TaskScheduler;
import io.reportgrid.view.ReportViewStore;
import io.reportgrid.view.ViewListener;
import io.reportgrid.view.ViewSnapshot;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/// One interactive report: the view store wired to its exporters and notifications.
///
/// Like the store, a report view is confined to its scheduler. Hosts on another thread
/// use {@link #onDispatch(Function)} to run work on the dispatch context.
///
/// ```java
/// ReportView view = ReportView.open(table, config, scheduler, notifications, Clock.systemUTC(), outDir);
/// view.onDispatch(v -> { v.store().setSearchTerm("amy"); return v.exportCsv(); }).join();
/// ```
public class ReportView {

    private final ReportViewStore store;
    private final ReportExporter exporter;
    private final NotificationCenter notifications;
    private final TaskScheduler scheduler;

    public ReportView(ReportViewStore store, ReportExporter exporter, NotificationCenter notifications,
                      TaskScheduler scheduler) {
        this.store = store;
        this.exporter = exporter;
        this.notifications = notifications;
        this.scheduler = scheduler;
    }

    /// Builds a report view with the standard PDF tiers: document, raster, print.
    public static ReportView open(ReportTable table, EngineConfig config, TaskScheduler scheduler,
                                  NotificationCenter notifications, Clock clock, Path outputDirectory) {
        return open(table, config, scheduler, notifications, clock, outputDirectory,
            defaultStrategies(config.pdf()));
    }

    public static ReportView open(ReportTable table, EngineConfig config, TaskScheduler scheduler,
                                  NotificationCenter notifications, Clock clock, Path outputDirectory,
                                  List<? extends PdfExportStrategy> strategies) {
        RowModel model = RowModelBuilder.build(table);
        ReportViewStore store = new ReportViewStore(model, config, scheduler);
        ReportFileNames fileNames = new ReportFileNames(clock, config.zone(), config.fallbackStem());
        ReportExporter exporter = new ReportExporter(store, notifications, fileNames,
            new CascadingPdfExporter(strategies), config.pdf(), outputDirectory);
        return new ReportView(store, exporter, notifications, scheduler);
    }

    public static List<PdfExportStrategy> defaultStrategies(PdfSettings settings) {
        return List.of(
            new DocumentSnapshotStrategy(new FontReadiness(settings.fontPath())),
            new RasterSnapshotStrategy(),
            new PrintDialogStrategy()
        );
    }

    public ReportViewStore store() {
        return store;
    }

    public ReportExporter exporter() {
        return exporter;
    }

    public NotificationCenter notifications() {
        return notifications;
    }

    public TaskScheduler scheduler() {
        return scheduler;
    }

    public ViewSnapshot snapshot() {
        return store.snapshot();
    }

    public void subscribe(ViewListener listener) {
        store.addListener(listener);
    }

    public ExportOutcome exportCsv() {
        return exporter.exportCsv();
    }

    public CompletionStage<ExportOutcome> exportPdf() {
        return exporter.exportPdf();
    }

    /// Runs work on the dispatch context.
    /// @param work the work, given this view
    /// @param <T> the work's result type
    /// @return a future completed with the work's result, or its exception
    public <T> CompletableFuture<T> onDispatch(Function<ReportView, T> work) {
        return CompletableFuture.supplyAsync(() -> work.apply(this), scheduler);
    }
}
