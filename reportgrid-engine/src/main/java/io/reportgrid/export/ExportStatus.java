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


package io.reportgrid.export;

import io.reportgrid.notify.NotificationKind;

/**
 * How an export request ended. Every status is reported to the
 * user with a notification of the matching kind.
 */
public enum ExportStatus {
    /** The file was written by the preferred route. */
    SUCCESS(NotificationKind.SUCCESS),
    /** A fallback route produced output with reduced fidelity. */
    DEGRADED(NotificationKind.INFO),
    /** No route produced output. */
    FAILED(NotificationKind.ERROR),
    /** Another export was still running; this request was ignored. */
    BUSY(NotificationKind.INFO);

    private final NotificationKind notificationKind;

    ExportStatus(NotificationKind notificationKind) {
        this.notificationKind = notificationKind;
    }

    public NotificationKind getNotificationKind() {
        return notificationKind;
    }
}
