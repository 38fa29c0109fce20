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

package io.reportgrid.notify;

import io.reportgrid.notify.sched.ScheduledTask;
import io.reportgrid.notify.sched.TaskScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Ephemeral user feedback for a report view: slot-based notifications that dismiss
 * themselves, and a blocking loading overlay for long-running operations.
 *
 * <h2>Notifications</h2>
 * <p>{@link #notify(String, NotificationKind)} shows a message in the default slot.
 * A notification stays up for its kind's lifetime, then is dismissed with
 * {@link DismissReason#EXPIRED}. Showing another notification in the same slot
 * dismisses the current one at once with {@link DismissReason#REPLACED}; its pending
 * expiry is cancelled so it can never dismiss the newer notification.</p>
 *
 * <h2>Loading Overlay</h2>
 * <p>{@link #withLoadingOverlay(String, Supplier)} shows the overlay, starts the
 * operation and hides the overlay when the returned stage completes, normally or
 * exceptionally. A synchronous throw from the operation supplier also hides the
 * overlay. Overlays nest: the overlay stays visible until the outermost operation
 * has completed.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * NotificationCenter center = new NotificationCenter(scheduler, List.of(new LoggerNotificationSink()));
 * center.withLoadingOverlay("Preparing PDF", () -> exporter.exportPdf())
 *       .thenAccept(outcome -> center.notify(outcome.message(), NotificationKind.SUCCESS));
 * }</pre>
 *
 * <h2>Threading</h2>
 * <p>Timers run on the supplied {@link TaskScheduler}. Public methods are synchronized
 * so a sink may be called from the dispatch thread or a completing export thread.</p>
 */
public class NotificationCenter {
    private static final Logger logger = LogManager.getLogger(NotificationCenter.class);

    /** The slot used when none is given. */
    public static final String DEFAULT_SLOT = "toast";

    private final TaskScheduler scheduler;
    private final List<NotificationSink> sinks = new CopyOnWriteArrayList<>();
    private final Map<NotificationKind, Duration> lifetimes = new EnumMap<>(NotificationKind.class);
    private final Map<String, Active> active = new HashMap<>();
    private long nextId = 1;
    private int overlayDepth;

    public NotificationCenter(TaskScheduler scheduler) {
        this(scheduler, List.of(), Map.of());
    }

    public NotificationCenter(TaskScheduler scheduler, List<? extends NotificationSink> sinks) {
        this(scheduler, sinks, Map.of());
    }

    /**
     * @param scheduler the dispatch context that runs expiry timers
     * @param sinks the sinks that render notifications
     * @param lifetimes per-kind lifetime overrides; kinds not present use their default
     */
    public NotificationCenter(TaskScheduler scheduler,
                              List<? extends NotificationSink> sinks,
                              Map<NotificationKind, Duration> lifetimes) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.sinks.addAll(Objects.requireNonNull(sinks, "sinks"));
        for (NotificationKind kind : NotificationKind.values()) {
            Duration configured = lifetimes.get(kind);
            this.lifetimes.put(kind, configured != null ? configured : kind.getDefaultLifetime());
        }
    }

    public void addSink(NotificationSink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink"));
    }

    public List<NotificationSink> getSinks() {
        return Collections.unmodifiableList(new ArrayList<>(sinks));
    }

    /**
     * Shows a notification in the {@link #DEFAULT_SLOT}.
     */
    public Notification notify(String message, NotificationKind kind) {
        return notify(DEFAULT_SLOT, message, kind);
    }

    public Notification success(String message) {
        return notify(message, NotificationKind.SUCCESS);
    }

    public Notification error(String message) {
        return notify(message, NotificationKind.ERROR);
    }

    public Notification info(String message) {
        return notify(message, NotificationKind.INFO);
    }

    /**
     * Shows a notification in the given slot, replacing whatever occupies it.
     *
     * @param slot the display position
     * @param message the text to show
     * @param kind the kind, which selects the lifetime
     * @return the notification now showing
     */
    public synchronized Notification notify(String slot, String message, NotificationKind kind) {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(kind, "kind");
        Active previous = active.remove(slot);
        if (previous != null) {
            previous.expiry.cancel();
            fire(sink -> sink.notificationDismissed(previous.notification, DismissReason.REPLACED));
        }

        Notification notification = new Notification(nextId++, slot, message, kind, lifetimes.get(kind));
        fire(sink -> sink.notificationShown(notification));
        ScheduledTask expiry = scheduler.schedule(() -> expire(notification), notification.lifetime());
        active.put(slot, new Active(notification, expiry));
        return notification;
    }

    /**
     * Dismisses whatever notification occupies the slot.
     *
     * @return true if a notification was dismissed
     */
    public synchronized boolean dismiss(String slot) {
        Active current = active.remove(slot);
        if (current == null) {
            return false;
        }
        current.expiry.cancel();
        fire(sink -> sink.notificationDismissed(current.notification, DismissReason.DISMISSED));
        return true;
    }

    /**
     * @return the notification currently shown in the slot, if any
     */
    public synchronized Optional<Notification> current(String slot) {
        Active current = active.get(slot);
        return current == null ? Optional.empty() : Optional.of(current.notification);
    }

    public Optional<Notification> current() {
        return current(DEFAULT_SLOT);
    }

    private synchronized void expire(Notification notification) {
        Active current = active.get(notification.slot());
        if (current != null && current.notification.id() == notification.id()) {
            active.remove(notification.slot());
            fire(sink -> sink.notificationDismissed(notification, DismissReason.EXPIRED));
        }
    }

    /**
     * Runs an asynchronous operation behind the blocking overlay. The overlay is
     * removed when the operation's stage completes, whatever the outcome.
     *
     * @param label short description shown on the overlay
     * @param operation starts the operation and returns its completion stage
     * @param <T> the operation's result type
     * @return a stage that completes after the overlay has been removed
     */
    public <T> CompletionStage<T> withLoadingOverlay(String label, Supplier<? extends CompletionStage<T>> operation) {
        showOverlay(label);
        CompletionStage<T> stage;
        try {
            stage = operation.get();
        } catch (RuntimeException e) {
            hideOverlay(label);
            return CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            hideOverlay(label);
            return CompletableFuture.failedFuture(
                new IllegalStateException("Operation '" + label + "' returned no completion stage"));
        }
        return stage.whenComplete((result, error) -> hideOverlay(label));
    }

    public synchronized boolean isOverlayVisible() {
        return overlayDepth > 0;
    }

    private synchronized void showOverlay(String label) {
        overlayDepth++;
        if (overlayDepth == 1) {
            fire(sink -> sink.overlayShown(label));
        }
    }

    private synchronized void hideOverlay(String label) {
        if (overlayDepth == 0) {
            logger.warn("Overlay '{}' hidden more often than shown", label);
            return;
        }
        overlayDepth--;
        if (overlayDepth == 0) {
            fire(sink -> sink.overlayHidden(label));
        }
    }

    private void fire(Consumer<NotificationSink> event) {
        for (NotificationSink sink : sinks) {
            try {
                event.accept(sink);
            } catch (RuntimeException e) {
                logger.warn("Notification sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private record Active(Notification notification, ScheduledTask expiry) {
    }
}
