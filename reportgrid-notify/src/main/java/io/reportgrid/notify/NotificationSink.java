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

import io.reportgrid.notify.sinks.ConsoleNotificationSink;
import io.reportgrid.notify.sinks.LoggerNotificationSink;
import io.reportgrid.notify.sinks.MetricsNotificationSink;
import io.reportgrid.notify.sinks.NoopNotificationSink;

/**
 * A contract for objects that present notifications and the loading overlay. The
 * {@link NotificationCenter} owns the notification lifecycle (slots, lifetimes,
 * overlay depth); sinks only render what they are told.
 *
 * <h2>Lifecycle Events</h2>
 * <ol>
 *   <li><strong>notificationShown:</strong> a notification entered its slot</li>
 *   <li><strong>notificationDismissed:</strong> the same notification left its slot,
 *       exactly once, with the reason</li>
 * </ol>
 * <p>Overlay events come in matched pairs: every {@link #overlayShown(String)} is
 * followed by one {@link #overlayHidden(String)}, whether the covered operation
 * succeeded or failed.</p>
 *
 * <h2>Built-in Implementations</h2>
 * <ul>
 *   <li>{@link ConsoleNotificationSink} - human-readable console output</li>
 *   <li>{@link LoggerNotificationSink} - Log4j 2 integration</li>
 *   <li>{@link MetricsNotificationSink} - counters per kind and overlay usage</li>
 *   <li>{@link NoopNotificationSink} - discards everything</li>
 * </ul>
 *
 * <h2>Error Handling</h2>
 * <p>Exceptions thrown by a sink are caught and logged by the center; one failing
 * sink never keeps the other sinks from receiving an event.</p>
 */
public interface NotificationSink {

    /**
     * Called when a notification is shown.
     *
     * @param notification the notification now occupying its slot
     */
    void notificationShown(Notification notification);

    /**
     * Called when a notification is removed from its slot.
     *
     * @param notification the notification leaving
     * @param reason why it left
     */
    void notificationDismissed(Notification notification, DismissReason reason);

    /**
     * Called when the blocking overlay appears.
     *
     * @param label short text describing the covered operation
     */
    default void overlayShown(String label) {
        // No-op by default - sinks can override to render the overlay
    }

    /**
     * Called when the blocking overlay is removed.
     *
     * @param label the label the overlay was shown with
     */
    default void overlayHidden(String label) {
        // No-op by default - sinks can override to render the overlay
    }
}
