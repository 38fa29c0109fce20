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

import io.reportgrid.export.ExportOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Tries the PDF tiers in order until one succeeds. Unavailable tiers are skipped, and
 * every skipped or failed tier adds a reason to the outcome. When no tier succeeds the
 * outcome is a failure listing all reasons.
 */
public class CascadingPdfExporter {
    private static final Logger logger = LogManager.getLogger(CascadingPdfExporter.class);

    private final List<PdfExportStrategy> strategies;

    public CascadingPdfExporter(List<? extends PdfExportStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public CompletionStage<ExportOutcome> export(PdfExportRequest request) {
        return attempt(0, request, new ArrayList<>());
    }

    private CompletionStage<ExportOutcome> attempt(int position, PdfExportRequest request, List<String> failures) {
        if (position >= strategies.size()) {
            String reasons = String.join("; ", failures);
            logger.error("PDF export of '{}' failed in every tier: {}", request.surface().title(), reasons);
            return CompletableFuture.completedFuture(ExportOutcome.failed(
                strategies.isEmpty() ? "No PDF export method is configured" : "PDF export failed: " + reasons,
                failures));
        }
        PdfExportStrategy strategy = strategies.get(position);
        if (!isAvailable(strategy)) {
            logger.info("PDF tier '{}' is not available, skipping it", strategy.name());
            failures.add(strategy.name() + ": not available");
            return attempt(position + 1, request, failures);
        }

        logger.debug("Attempting PDF tier '{}' for {}", strategy.name(), request.outputFile());
        CompletionStage<TierResult> stage;
        try {
            stage = strategy.attemptExport(request);
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        return stage
            .handle((result, error) -> {
                if (error != null) {
                    Throwable cause = unwrap(error);
                    logger.warn("PDF tier '{}' failed: {}", strategy.name(), cause.toString(), cause);
                    return TierResult.failure(describe(cause));
                }
                if (result == null) {
                    return TierResult.failure("no result");
                }
                if (result.isFailure()) {
                    logger.warn("PDF tier '{}' failed: {}", strategy.name(), result.message());
                }
                return result;
            })
            .thenCompose(result -> {
                switch (result.status()) {
                    case SUCCESS:
                        logger.info("PDF tier '{}' wrote {}", strategy.name(), result.file());
                        return CompletableFuture.completedFuture(
                            ExportOutcome.success(result.file(), strategy.name(), result.message(), failures));
                    case DEGRADED:
                        return CompletableFuture.completedFuture(
                            ExportOutcome.degraded(result.file(), strategy.name(), result.message(), failures));
                    default:
                        failures.add(strategy.name() + ": " + result.message());
                        return attempt(position + 1, request, failures);
                }
            });
    }

    private static boolean isAvailable(PdfExportStrategy strategy) {
        try {
            return strategy.isAvailable();
        } catch (RuntimeException | LinkageError e) {
            logger.warn("Could not check availability of PDF tier '{}'", strategy.name(), e);
            return false;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
