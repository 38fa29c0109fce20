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
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * A notification sink that writes to Log4j 2. Error notifications are logged at
 * {@code ERROR}, everything else at the configured level ({@code INFO} by default).
 * Dismissals and overlay transitions are logged at {@code DEBUG}.
 *
 * <h2>Log Message Format</h2>
 * <ul>
 *   <li><strong>Shown:</strong> "Notification [kind] slot: message"</li>
 *   <li><strong>Dismissed:</strong> "Notification #id dismissed (reason)"</li>
 *   <li><strong>Overlay:</strong> "Overlay shown: label" / "Overlay hidden: label"</li>
 * </ul>
 */
public class LoggerNotificationSink implements NotificationSink {

    private final Logger logger;
    private final Level level;

    public LoggerNotificationSink() {
        this(LogManager.getLogger(LoggerNotificationSink.class));
    }

    public LoggerNotificationSink(Logger logger) {
        this(logger, Level.INFO);
    }

    public LoggerNotificationSink(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
    }

    public LoggerNotificationSink(String loggerName) {
        this(LogManager.getLogger(loggerName));
    }

    @Override
    public void notificationShown(Notification notification) {
        Level effective = notification.kind() == NotificationKind.ERROR ? Level.ERROR : level;
        if (logger.isEnabled(effective)) {
            logger.log(effective, "Notification [{}] {}: {}",
                notification.kind(), notification.slot(), notification.message());
        }
    }

    @Override
    public void notificationDismissed(Notification notification, DismissReason reason) {
        logger.debug("Notification #{} dismissed ({})", notification.id(), reason);
    }

    @Override
    public void overlayShown(String label) {
        logger.debug("Overlay shown: {}", label);
    }

    @Override
    public void overlayHidden(String label) {
        logger.debug("Overlay hidden: {}", label);
    }
}
