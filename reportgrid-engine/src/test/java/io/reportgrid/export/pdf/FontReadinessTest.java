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

import io.reportgrid.notify.sched.VirtualTimeScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FontReadiness")
class FontReadinessTest {

    private static final Executor INLINE = Runnable::run;

    @TempDir
    Path tempDir;

    private final VirtualTimeScheduler scheduler = new VirtualTimeScheduler();

    @Test
    @DisplayName("should resolve empty at once without a configured font")
    void shouldSkipWithoutFont() {
        FontReadiness readiness = new FontReadiness("  ", INLINE);

        CompletableFuture<Optional<byte[]>> ready = readiness.await(scheduler, Duration.ofSeconds(1))
            .toCompletableFuture();

        assertThat(readiness.getFontPath()).isEmpty();
        assertThat(ready).isCompletedWithValue(Optional.empty());
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    @DisplayName("should hand over the font bytes and cancel the timer")
    void shouldLoadFont() throws IOException {
        Path font = Files.write(tempDir.resolve("font.ttf"), new byte[]{1, 2, 3});
        FontReadiness readiness = new FontReadiness(font.toString(), INLINE);

        Optional<byte[]> bytes = readiness.await(scheduler, Duration.ofSeconds(1)).toCompletableFuture().join();

        assertThat(bytes).hasValueSatisfying(b -> assertThat(b).containsExactly(1, 2, 3));
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    @DisplayName("should resolve empty when the font file cannot be read")
    void shouldFallBackOnMissingFile() {
        FontReadiness readiness = new FontReadiness(tempDir.resolve("missing.ttf").toString(), INLINE);

        CompletableFuture<Optional<byte[]>> ready = readiness.await(scheduler, Duration.ofSeconds(1))
            .toCompletableFuture();

        assertThat(ready).isCompletedWithValue(Optional.empty());
    }

    @Test
    @DisplayName("should resolve empty when the font is not loaded in time")
    void shouldTimeOut() {
        Executor never = command -> {
        };
        FontReadiness readiness = new FontReadiness(tempDir.resolve("slow.ttf").toString(), never);

        CompletableFuture<Optional<byte[]>> ready = readiness.await(scheduler, Duration.ofSeconds(1))
            .toCompletableFuture();
        assertThat(ready).isNotDone();

        scheduler.advance(Duration.ofSeconds(1));

        assertThat(ready).isCompletedWithValue(Optional.empty());
    }

    @Test
    @DisplayName("should read the font file only once")
    void shouldCacheFont() throws IOException {
        Path font = Files.write(tempDir.resolve("font.ttf"), new byte[]{7});
        AtomicInteger loads = new AtomicInteger();
        FontReadiness readiness = new FontReadiness(font.toString(), command -> {
            loads.incrementAndGet();
            command.run();
        });

        readiness.await(scheduler, Duration.ofSeconds(1)).toCompletableFuture().join();
        readiness.await(scheduler, Duration.ofSeconds(1)).toCompletableFuture().join();

        assertThat(loads).hasValue(1);
    }
}
