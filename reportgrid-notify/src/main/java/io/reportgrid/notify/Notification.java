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

import java.time.Duration;
import java.util.Objects;

/**
 * One notification shown to the user.
 *
 * @param id monotonically increasing identity, unique per {@link NotificationCenter}
 * @param slot the display position this notification occupies
 * @param message the text shown
 * @param kind the notification kind
 * @param lifetime how long it stays up unless replaced or dismissed earlier
 */
public record Notification(long id, String slot, String message, NotificationKind kind, Duration lifetime) {

    public Notification {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
        lifetime = lifetime == null ? kind.getDefaultLifetime() : lifetime;
    }

    @Override
    public String toString() {
        return kind + "[" + slot + "#" + id + "]: " + message;
    }
}
