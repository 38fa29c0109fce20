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
import io.reportgrid.model.RowModelBuilder;
import io.reportgrid.notify.sched.VirtualTimeScheduler;
import io.reportgrid.view.ChromeState;
import io.reportgrid.view.ReportRegion;
import io.reportgrid.view.ReportViewStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.print.PrinterException;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PrintDialogStrategy")
class PrintDialogStrategyTest {

    private ReportViewStore store;
    private PdfExportRequest request;

    @BeforeEach
    void setUp() {
        store = new ReportViewStore(RowModelBuilder.build(ReportFixtures.users(30)), EngineConfig.defaults(),
            new VirtualTimeScheduler());
        store.setPageSize(10);
        request = new PdfExportRequest(store, Path.of("unused.pdf"), ReportFixtures.pdfSettings(10, 0),
            ZonedDateTime.parse("2024-05-07T08:59:00+09:00[Asia/Tokyo]"));
    }

    private static TierResult run(PrintDialogStrategy strategy, PdfExportRequest request) {
        return strategy.attemptExport(request).toCompletableFuture().join();
    }

    @Test
    @DisplayName("should report a confirmed print as degraded")
    void shouldDegradeWhenPrinted() {
        AtomicReference<ReportRegion> printed = new AtomicReference<>();

        TierResult result = run(new PrintDialogStrategy(region -> {
            printed.set(region);
            return true;
        }, () -> true), request);

        assertThat(result.status()).isEqualTo(TierResult.Status.DEGRADED);
        assertThat(result.file()).isNull();
        assertThat(result.message()).contains("print dialog");
        assertThat(printed.get().rows()).hasSize(30);
        assertThat(printed.get().chrome()).isEqualTo(ChromeState.hidden());
        assertThat(store.chrome()).isEqualTo(ChromeState.visible());
        assertThat(store.pageState().pageSize()).isEqualTo(10);
    }

    @Test
    @DisplayName("should report a cancelled dialog as degraded too")
    void shouldDegradeWhenCancelled() {
        TierResult result = run(new PrintDialogStrategy(region -> false, () -> true), request);

        assertThat(result.status()).isEqualTo(TierResult.Status.DEGRADED);
        assertThat(result.message()).contains("cancelled");
    }

    @Test
    @DisplayName("should fail the tier when printing fails")
    void shouldFailOnPrinterError() {
        TierResult result = run(new PrintDialogStrategy(region -> {
            throw new PrinterException("no printer");
        }, () -> true), request);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.message()).isEqualTo("printing failed: no printer");
    }

    @Test
    @DisplayName("should take availability from the platform check")
    void shouldReportAvailability() {
        assertThat(new PrintDialogStrategy(region -> true, () -> false).isAvailable()).isFalse();
        assertThat(new PrintDialogStrategy(region -> true, () -> true).isAvailable()).isTrue();
        assertThat(new PrintDialogStrategy(region -> true, () -> true).name()).isEqualTo("print");
    }
}
