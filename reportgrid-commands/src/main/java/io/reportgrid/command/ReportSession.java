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


package io.reportgrid.command;

import io.reportgrid.ReportView;
import io.reportgrid.config.EngineConfig;
import io.reportgrid.model.ReportTable;
import io.reportgrid.notify.NotificationCenter;
import io.reportgrid.notify.NotificationSink;
import io.reportgrid.notify.sched.DispatchScheduler;
import io.reportgrid.notify.sinks.ConsoleNotificationSink;
import io.reportgrid.notify.sinks.LoggerNotificationSink;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/// A report view running on its own dispatch thread for the length of one command.
/// Notifications go to the console and to the log.
public class ReportSession implements AutoCloseable {

    /// The longest a command waits for work on the dispatch thread, exports included.
    public static final Duration WAIT_LIMIT = Duration.ofMinutes(5);

    private final DispatchScheduler scheduler;
    private final ReportView view;

    public ReportSession(ReportTable table, EngineConfig config, Path outputDirectory, PrintStream console) {
        this.scheduler = new DispatchScheduler("reportgrid-cli");
        List<NotificationSink> sinks = List.of(new ConsoleNotificationSink(console, false),
            new LoggerNotificationSink());
        NotificationCenter notifications = new NotificationCenter(scheduler, sinks, config.lifetimes());
        this.view = ReportView.open(table, config, scheduler, notifications, Clock.systemUTC(), outputDirectory);
    }

    /// Runs work on the dispatch thread and waits for its result.
    /// @param work the work, given the report view
    /// @param <T> the result type
    /// @return the work's result
    /// @throws ExecutionException when the work fails
    /// @throws InterruptedException when interrupted while waiting
    /// @throws TimeoutException when the work takes longer than {@link #WAIT_LIMIT}
    public <T> T call(Function<ReportView, T> work)
        throws ExecutionException, InterruptedException, TimeoutException {
        return view.onDispatch(work).get(WAIT_LIMIT.toMillis(), TimeUnit.MILLISECONDS);
    }

    /// Like {@link #call(Function)}, for work that completes later on the dispatch thread.
    public <T> T await(Function<ReportView, CompletionStage<T>> work)
        throws ExecutionException, InterruptedException, TimeoutException {
        return view.onDispatch(work).thenCompose(stage -> stage)
            .get(WAIT_LIMIT.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        scheduler.close();
    }
}
