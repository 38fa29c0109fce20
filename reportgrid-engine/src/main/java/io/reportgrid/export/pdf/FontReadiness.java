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

import io.reportgrid.notify.sched.ScheduledTask;
import io.reportgrid.notify.sched.TaskScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Loads the TrueType font used by the document tier in the background and lets the
 * tier wait for it with a time limit. A font that is not configured, fails to load,
 * or is not loaded in time yields an empty result, and the document falls back to the
 * standard PDF fonts.
 *
 * <p>The font file is read once; later exports reuse the bytes.</p>
 */
public class FontReadiness {
    private static final Logger logger = LogManager.getLogger(FontReadiness.class);

    private final Path fontPath;
    private final Executor loader;
    private CompletableFuture<byte[]> loading;

    public FontReadiness(String fontPath) {
        this(fontPath, ForkJoinPool.commonPool());
    }

    public FontReadiness(String fontPath, Executor loader) {
        this.fontPath = fontPath == null || fontPath.isBlank() ? null : Path.of(fontPath);
        this.loader = loader;
    }

    public Optional<Path> getFontPath() {
        return Optional.ofNullable(fontPath);
    }

    /**
     * @param scheduler the dispatch context to complete on
     * @param timeout how long to wait for the font
     * @return the font bytes, or empty when no font is ready in time
     */
    public CompletionStage<Optional<byte[]>> await(TaskScheduler scheduler, Duration timeout) {
        if (fontPath == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        CompletableFuture<Optional<byte[]>> ready = new CompletableFuture<>();
        ScheduledTask timer = scheduler.schedule(() -> {
            if (ready.complete(Optional.empty())) {
                logger.warn("Font {} was not ready within {}, using standard fonts", fontPath, timeout);
            }
        }, timeout);
        startLoading().whenComplete((bytes, error) -> scheduler.execute(() -> {
            timer.cancel();
            if (error != null) {
                if (ready.complete(Optional.empty())) {
                    logger.warn("Could not load font {}, using standard fonts: {}", fontPath, error.getMessage());
                }
            } else {
                ready.complete(Optional.of(bytes));
            }
        }));
        return ready;
    }

    private synchronized CompletableFuture<byte[]> startLoading() {
        if (loading == null || loading.isCompletedExceptionally()) {
            loading = CompletableFuture.supplyAsync(() -> {
                try {
                    byte[] bytes = Files.readAllBytes(fontPath);
                    logger.debug("Read font {} ({} bytes)", fontPath, bytes.length);
                    return bytes;
                } catch (IOException e) {
                    throw new UncheckedIOException("could not read font " + fontPath, e);
                }
            }, loader);
        }
        return loading;
    }
}
