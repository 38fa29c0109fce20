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


package io.reportgrid.view;

import io.reportgrid.notify.sched.ScheduledTask;
import io.reportgrid.notify.sched.TaskScheduler;

import java.time.Duration;

/**
 * Coalesces bursts of input: only the last action submitted within the quiet period
 * runs, once the input has paused for the whole period.
 */
public class Debouncer {

    private final TaskScheduler scheduler;
    private final Duration quietPeriod;
    private ScheduledTask pending;
    private Runnable pendingAction;

    public Debouncer(TaskScheduler scheduler, Duration quietPeriod) {
        this.scheduler = scheduler;
        this.quietPeriod = quietPeriod;
    }

    public Duration getQuietPeriod() {
        return quietPeriod;
    }

    public synchronized void submit(Runnable action) {
        if (pending != null) {
            pending.cancel();
        }
        pendingAction = action;
        pending = scheduler.schedule(this::fire, quietPeriod);
    }

    /**
     * Runs the pending action now instead of waiting for the quiet period.
     *
     * @return whether there was an action to run
     */
    public boolean flush() {
        Runnable action;
        synchronized (this) {
            if (pending == null) {
                return false;
            }
            pending.cancel();
            action = takePending();
        }
        action.run();
        return true;
    }

    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel();
            takePending();
        }
    }

    public synchronized boolean isPending() {
        return pending != null;
    }

    private void fire() {
        Runnable action;
        synchronized (this) {
            if (pendingAction == null) {
                return;
            }
            action = takePending();
        }
        action.run();
    }

    private Runnable takePending() {
        Runnable action = pendingAction;
        pending = null;
        pendingAction = null;
        return action;
    }
}
