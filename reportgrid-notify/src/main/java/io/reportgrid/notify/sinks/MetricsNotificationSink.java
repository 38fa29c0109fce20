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

package io.reportgrid.notify.sinks;

import io.reportgrid.notify.DismissReason;
import io.reportgrid.notify.Notification;
import io.reportgrid.notify.NotificationKind;
import io.reportgrid.notify.NotificationSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts notification and overlay events. Besides the counters it keeps the shown
 * notifications in order, which makes it the sink of choice for asserting what a
 * user would have seen.
 */
public class MetricsNotificationSink implements NotificationSink {

    private final Map<NotificationKind, AtomicLong> shownByKind = new EnumMap<>(NotificationKind.class);
    private final Map<DismissReason, AtomicLong> dismissedByReason = new EnumMap<>(DismissReason.class);
    private final List<Notification> shown = Collections.synchronizedList(new ArrayList<>());
    private final AtomicLong overlaysShown = new AtomicLong();
    private final AtomicLong overlaysHidden = new AtomicLong();
    private final AtomicInteger overlayDepth = new AtomicInteger();

    public MetricsNotificationSink() {
        for (NotificationKind kind : NotificationKind.values()) {
            shownByKind.put(kind, new AtomicLong());
        }
        for (DismissReason reason : DismissReason.values()) {
            dismissedByReason.put(reason, new AtomicLong());
        }
    }

    @Override
    public void notificationShown(Notification notification) {
        shownByKind.get(notification.kind()).incrementAndGet();
        shown.add(notification);
    }

    @Override
    public void notificationDismissed(Notification notification, DismissReason reason) {
        dismissedByReason.get(reason).incrementAndGet();
    }

    @Override
    public void overlayShown(String label) {
        overlaysShown.incrementAndGet();
        overlayDepth.incrementAndGet();
    }

    @Override
    public void overlayHidden(String label) {
        overlaysHidden.incrementAndGet();
        overlayDepth.decrementAndGet();
    }

    public long getShownCount(NotificationKind kind) {
        return shownByKind.get(kind).get();
    }

    public long getDismissedCount(DismissReason reason) {
        return dismissedByReason.get(reason).get();
    }

    public long getOverlaysShown() {
        return overlaysShown.get();
    }

    public long getOverlaysHidden() {
        return overlaysHidden.get();
    }

    public boolean isOverlayShowing() {
        return overlayDepth.get() > 0;
    }

    public List<Notification> getShown() {
        synchronized (shown) {
            return List.copyOf(shown);
        }
    }

    public Notification getLastShown() {
        synchronized (shown) {
            return shown.isEmpty() ? null : shown.get(shown.size() - 1);
        }
    }

    public String generateReport() {
        StringBuilder report = new StringBuilder();
        report.append("=== Notification Metrics ===\n");
        for (NotificationKind kind : NotificationKind.values()) {
            report.append(kind).append(": ").append(getShownCount(kind)).append("\n");
        }
        for (DismissReason reason : DismissReason.values()) {
            report.append("dismissed ").append(reason).append(": ").append(getDismissedCount(reason)).append("\n");
        }
        report.append("overlays: ").append(overlaysShown.get()).append(" shown, ")
            .append(overlaysHidden.get()).append(" hidden\n");
        return report.toString();
    }
}
