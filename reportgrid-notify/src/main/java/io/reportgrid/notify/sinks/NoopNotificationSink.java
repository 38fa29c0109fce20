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
import io.reportgrid.notify.NotificationSink;

/**
 * A sink that discards every event. Used where a notification center is required
 * but nobody is watching, such as quiet command line runs.
 */
public final class NoopNotificationSink implements NotificationSink {

    private static final NoopNotificationSink INSTANCE = new NoopNotificationSink();

    private NoopNotificationSink() {
    }

    public static NoopNotificationSink getInstance() {
        return INSTANCE;
    }

    @Override
    public void notificationShown(Notification notification) {
    }

    @Override
    public void notificationDismissed(Notification notification, DismissReason reason) {
    }
}
