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

package io.reportgrid.notify.sched;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * The single dispatch context that report view state is confined to. Every state
 * mutation of a report view, every notification timer and every continuation of an
 * asynchronous export runs through one scheduler, which gives the engine its
 * single-threaded, cooperative execution model.
 *
 * <p>{@link #execute(Runnable)} runs work as soon as the dispatch context is free;
 * {@link #schedule(Runnable, Duration)} runs it after a delay and hands back a
 * {@link ScheduledTask} that can be cancelled before it fires. Cancellation is how
 * debounced input and notification auto-dismissal are implemented.</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link DispatchScheduler} - one daemon thread, real time</li>
 *   <li>{@link VirtualTimeScheduler} - caller-driven virtual time, for headless
 *       hosts and deterministic tests</li>
 * </ul>
 */
public interface TaskScheduler extends Executor {

    /**
     * Schedules a task to run once after the given delay.
     *
     * @param task the work to run on the dispatch context
     * @param delay how long to wait; zero or negative means "as soon as possible"
     * @return a handle that can cancel the task before it runs
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Returns a future that completes on the dispatch context once the given duration
     * has elapsed. A zero, negative or null duration yields an already completed future.
     *
     * @param duration the delay
     * @return a future completing after the delay
     */
    default CompletableFuture<Void> delay(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        schedule(() -> future.complete(null), duration);
        return future;
    }
}
