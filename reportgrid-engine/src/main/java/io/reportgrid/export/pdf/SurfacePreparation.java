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

import io.reportgrid.paging.PageState;
import io.reportgrid.view.ChromeState;
import io.reportgrid.view.ReportRegion;
import io.reportgrid.view.ReportSurface;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Prepares a report view for capture and puts it back afterwards.
 *
 * <ol>
 *   <li>show every filtered row on one page</li>
 *   <li>hide the chrome</li>
 *   <li>wait for the given readiness stage, then for the settle delay</li>
 *   <li>capture the shown region and hand it to the capture work</li>
 *   <li>restore the previous page state and chrome</li>
 * </ol>
 *
 * The last step runs whether the work succeeds, fails, or throws before returning a stage.
 */
public final class SurfacePreparation {
    private static final Logger logger = LogManager.getLogger(SurfacePreparation.class);

    private SurfacePreparation() {
    }

    public static <T> CompletionStage<T> captureFullRegion(ReportSurface surface, Duration settleDelay,
                                                           Function<ReportRegion, ? extends CompletionStage<T>> work) {
        return captureFullRegion(surface, () -> CompletableFuture.completedFuture(null), settleDelay, work);
    }

    public static <T> CompletionStage<T> captureFullRegion(ReportSurface surface,
                                                           Supplier<? extends CompletionStage<?>> readiness,
                                                           Duration settleDelay,
                                                           Function<ReportRegion, ? extends CompletionStage<T>> work) {
        PageState savedPage = surface.pageState();
        ChromeState savedChrome = surface.chrome();

        CompletableFuture<T> result;
        try {
            int rows = surface.filteredAndSorted().size();
            surface.forcePageState(PageState.first(Math.max(1, rows)));
            surface.setChrome(ChromeState.hidden());
            logger.debug("Showing all {} rows of '{}' without chrome for capture", rows, surface.title());

            result = readiness.get().toCompletableFuture()
                .thenCompose(ready -> surface.scheduler().delay(settleDelay))
                .thenCompose(settled -> work.apply(surface.captureRegion()));
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.whenComplete((value, error) -> restore(surface, savedPage, savedChrome));
    }

    private static void restore(ReportSurface surface, PageState page, ChromeState chrome) {
        try {
            surface.forcePageState(page);
        } finally {
            surface.setChrome(chrome);
        }
        logger.debug("Restored '{}' to {} with {}", surface.title(), page, chrome);
    }
}
