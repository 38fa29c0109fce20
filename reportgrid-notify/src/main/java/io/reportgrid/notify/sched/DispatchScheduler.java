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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * A {@link TaskScheduler} backed by a single daemon thread. All work submitted through
 * this scheduler runs sequentially on that thread, in submission order for
 * {@link #execute(Runnable)} and in due-time order for scheduled tasks.
 *
 * <pre>{@code
 * try (DispatchScheduler dispatch = new DispatchScheduler("report-view")) {
 *     NotificationCenter notifications = new NotificationCenter(dispatch);
 *     ReportView view = ReportView.open(table, config, dispatch, notifications, clock, outputDir);
 *     ...
 * }
 * }</pre>
 */
public class DispatchScheduler implements TaskScheduler, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DispatchScheduler.class);

    private final ScheduledThreadPoolExecutor executor;
    private final String name;

    public DispatchScheduler() {
        this("reportgrid-dispatch");
    }

    public DispatchScheduler(String name) {
        this.name = name;
        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public void execute(Runnable command) {
        executor.execute(guarded(command));
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        long millis = delay == null ? 0L : Math.max(0L, delay.toMillis());
        ScheduledFuture<?> future = executor.schedule(guarded(task), millis, TimeUnit.MILLISECONDS);
        return new ScheduledTask() {
            @Override
            public boolean cancel() {
                return future.cancel(false);
            }

            @Override
            public boolean isDone() {
                return future.isDone();
            }
        };
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Task on dispatch thread '{}' failed: {}", name, e.getMessage(), e);
            }
        };
    }

    /**
     * Stops accepting work and waits briefly for queued work to finish. Delayed tasks
     * that are not due yet are dropped.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                logger.debug("Dispatch thread '{}' did not drain in time, forcing shutdown", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
