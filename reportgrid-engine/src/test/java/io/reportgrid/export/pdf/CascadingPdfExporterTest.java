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
import io.reportgrid.export.ExportOutcome;
import io.reportgrid.export.ExportStatus;
import io.reportgrid.model.ReportTable;
import io.reportgrid.model.RowModelBuilder;
import io.reportgrid.notify.sched.VirtualTimeScheduler;
import io.reportgrid.view.ReportViewStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CascadingPdfExporter")
class CascadingPdfExporterTest {

    private PdfExportRequest request;

    @BeforeEach
    void setUp() {
        ReportViewStore store = new ReportViewStore(RowModelBuilder.build(ReportFixtures.users(5)),
            EngineConfig.defaults(), new VirtualTimeScheduler());
        request = new PdfExportRequest(store, Path.of("out.pdf"), ReportFixtures.pdfSettings(10, 0),
            ZonedDateTime.parse("2024-05-07T08:59:00+09:00[Asia/Tokyo]"));
    }

    private static ExportOutcome run(CascadingPdfExporter exporter, PdfExportRequest request) {
        return exporter.export(request).toCompletableFuture().join();
    }

    @Test
    @DisplayName("should stop at the first tier that succeeds")
    void shouldStopAtFirstSuccess() {
        FakeStrategy first = FakeStrategy.succeeding("document");
        FakeStrategy second = FakeStrategy.succeeding("raster");

        ExportOutcome outcome = run(new CascadingPdfExporter(List.of(first, second)), request);

        assertThat(outcome.status()).isEqualTo(ExportStatus.SUCCESS);
        assertThat(outcome.route()).isEqualTo("document");
        assertThat(outcome.file()).isEqualTo(Path.of("out.pdf"));
        assertThat(outcome.failures()).isEmpty();
        assertThat(second.attempts).isEmpty();
    }

    @Test
    @DisplayName("should fall through failed and unavailable tiers, keeping their reasons")
    void shouldFallThrough() {
        FakeStrategy document = FakeStrategy.failing("document", "font exploded");
        FakeStrategy raster = FakeStrategy.unavailable("raster");
        FakeStrategy print = new FakeStrategy("print", true,
            r -> CompletableFuture.completedFuture(TierResult.degraded("sent to printer")));

        ExportOutcome outcome = run(new CascadingPdfExporter(List.of(document, raster, print)), request);

        assertThat(outcome.status()).isEqualTo(ExportStatus.DEGRADED);
        assertThat(outcome.route()).isEqualTo("print");
        assertThat(outcome.message()).isEqualTo("sent to printer");
        assertThat(outcome.failures()).containsExactly("document: font exploded", "raster: not available");
        assertThat(document.attempts).hasSize(1);
        assertThat(print.attempts).hasSize(1);
    }

    @Test
    @DisplayName("should treat thrown exceptions and failed stages as tier failures")
    void shouldTreatExceptionsAsFailures() {
        FakeStrategy thrower = new FakeStrategy("thrower", true, r -> {
            throw new IllegalStateException("boom");
        });
        FakeStrategy failedStage = new FakeStrategy("stage", true,
            r -> CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full"))));
        FakeStrategy last = FakeStrategy.succeeding("last");

        ExportOutcome outcome = run(new CascadingPdfExporter(List.of(thrower, failedStage, last)), request);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.route()).isEqualTo("last");
        assertThat(outcome.failures()).hasSize(2);
        assertThat(outcome.failures().get(0)).isEqualTo("thrower: boom");
        assertThat(outcome.failures().get(1)).startsWith("stage: ").contains("disk full");
    }

    @Test
    @DisplayName("should report every reason when all tiers fail")
    void shouldFailWhenAllFail() {
        ExportOutcome outcome = run(new CascadingPdfExporter(List.of(
            FakeStrategy.failing("document", "a"),
            FakeStrategy.unavailable("raster"),
            FakeStrategy.failing("print", "c"))), request);

        assertThat(outcome.status()).isEqualTo(ExportStatus.FAILED);
        assertThat(outcome.file()).isNull();
        assertThat(outcome.message()).isEqualTo("PDF export failed: document: a; raster: not available; print: c");
        assertThat(outcome.failures()).hasSize(3);
    }

    @Test
    @DisplayName("should hand Japanese reports to the raster tier when the document tier lacks glyphs")
    void shouldRasterizeJapaneseWithoutFont() {
        ReportViewStore store = new ReportViewStore(
            RowModelBuilder.build(ReportTable.of("ライセンス分析", "ユーザー名", "部署").withRow("山田太郎", "営業部")),
            EngineConfig.defaults(), new VirtualTimeScheduler());
        PdfExportRequest japanese = new PdfExportRequest(store, Path.of("license.pdf"),
            ReportFixtures.pdfSettings(10, 0), ZonedDateTime.parse("2024-05-07T08:59:00+09:00[Asia/Tokyo]"));
        FakeStrategy raster = FakeStrategy.succeeding("raster");

        ExportOutcome outcome = run(new CascadingPdfExporter(List.of(
            new DocumentSnapshotStrategy(new FontReadiness(null)), raster)), japanese);

        assertThat(outcome.status()).isEqualTo(ExportStatus.SUCCESS);
        assertThat(outcome.route()).isEqualTo("raster");
        assertThat(outcome.failures()).containsExactly("document: font cannot show the report text");
        assertThat(raster.attempts).hasSize(1);
    }

    @Test
    @DisplayName("should fail without tiers")
    void shouldFailWithoutTiers() {
        ExportOutcome outcome = run(new CascadingPdfExporter(List.of()), request);

        assertThat(outcome.status()).isEqualTo(ExportStatus.FAILED);
        assertThat(outcome.message()).isEqualTo("No PDF export method is configured");
    }

    @Test
    @DisplayName("should treat a null result as a failure")
    void shouldRejectNullResult() {
        ExportOutcome outcome = run(new CascadingPdfExporter(List.of(
            new FakeStrategy("silent", true, r -> CompletableFuture.completedFuture(null)))), request);

        assertThat(outcome.failures()).containsExactly("silent: no result");
    }
}
