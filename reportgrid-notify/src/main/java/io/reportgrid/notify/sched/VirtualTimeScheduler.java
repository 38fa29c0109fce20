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
import java.util.PriorityQueue;

/**
 * A scheduler whose clock only moves when the caller moves it. Immediate work passed
 * to {@link #execute(Runnable)} runs inline on the calling thread; delayed work waits
 * in a queue until {@link #advance(Duration)} or {@link #drain()} moves virtual time
 * past its due time.
 *
 * <p>This gives headless hosts (the command line tool, unit tests) a fully
 * deterministic dispatch context: debounce windows, notification lifetimes and
 * settle delays elapse exactly when asked to, and never on a wall clock.</p>
 *
 * <h2>Example Usage</h2>
 * <pre>{@code
 * VirtualTimeScheduler scheduler = new VirtualTimeScheduler();
 * scheduler.schedule(() -> System.out.println("fired"), Duration.ofMillis(300));
 * scheduler.advance(Duration.ofMillis(299)); // nothing
 * scheduler.advance(Duration.ofMillis(1));   // prints "fired"
 * }</pre>
 *
 * <p>Not thread-safe. Use it from one thread only.</p>
 */
public class VirtualTimeScheduler implements TaskScheduler {

    private final PriorityQueue<Entry> queue = new PriorityQueue<>();
    private long nowMillis;
    private long sequence;

    @Override
    public void execute(Runnable command) {
        command.run();
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        long millis = delay == null ? 0L : Math.max(0L, delay.toMillis());
        Entry entry = new Entry(nowMillis + millis, sequence++, task);
        queue.add(entry);
        return entry;
    }

    /**
     * Moves virtual time forward, running every task that falls due on the way, in
     * due-time order. Tasks scheduled by running tasks are honoured if they fall due
     * before the target time.
     *
     * @param duration how far to move the clock
     */
    public void advance(Duration duration) {
        long target = nowMillis + Math.max(0L, duration.toMillis());
        while (!queue.isEmpty() && queue.peek().dueMillis <= target) {
            Entry next = queue.poll();
            nowMillis = Math.max(nowMillis, next.dueMillis);
            next.fire();
        }
        nowMillis = target;
    }

    /**
     * Runs every queued task, moving the clock to each task's due time in turn.
     */
    public void drain() {
        while (!queue.isEmpty()) {
            Entry next = queue.poll();
            nowMillis = Math.max(nowMillis, next.dueMillis);
            next.fire();
        }
    }

    /**
     * @return the virtual time elapsed since construction
     */
    public Duration now() {
        return Duration.ofMillis(nowMillis);
    }

    /**
     * @return the number of scheduled tasks that have neither run nor been cancelled
     */
    public int pendingCount() {
        return (int) queue.stream().filter(e -> !e.isDone()).count();
    }

    private static final class Entry implements ScheduledTask, Comparable<Entry> {
        private final long dueMillis;
        private final long order;
        private final Runnable task;
        private boolean done;

        private Entry(long dueMillis, long order, Runnable task) {
            this.dueMillis = dueMillis;
            this.order = order;
            this.task = task;
        }

        private void fire() {
            if (!done) {
                done = true;
                task.run();
            }
        }

        @Override
        public boolean cancel() {
            if (done) {
                return false;
            }
            done = true;
            return true;
        }

        @Override
        public boolean isDone() {
            return done;
        }

        @Override
        public int compareTo(Entry other) {
            int byDue = Long.compare(dueMillis, other.dueMillis);
            return byDue != 0 ? byDue : Long.compare(order, other.order);
        }
    }
}
