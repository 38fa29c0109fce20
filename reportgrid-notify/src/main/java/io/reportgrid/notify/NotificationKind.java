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

/**
 * The kind of a user-facing notification. The kind decides how a notification is
 * styled by a presentation layer and how long it stays up before it dismisses itself.
 *
 * <p>Default lifetimes:
 * <ul>
 *   <li>{@link #SUCCESS} and {@link #INFO}: 5 seconds</li>
 *   <li>{@link #ERROR}: 8 seconds, since errors usually need to be read twice</li>
 * </ul>
 *
 * @see Notification
 * @see NotificationCenter
 */
public enum NotificationKind {
    /**
     * An operation finished the way the user asked for.
     */
    SUCCESS("✅", Duration.ofSeconds(5)),

    /**
     * An operation failed and nothing was produced.
     */
    ERROR("❌", Duration.ofSeconds(8)),

    /**
     * Neutral information, including degraded outcomes.
     */
    INFO("ℹ", Duration.ofSeconds(5));

    private final String glyph;
    private final Duration defaultLifetime;

    NotificationKind(String glyph, Duration defaultLifetime) {
        this.glyph = glyph;
        this.defaultLifetime = defaultLifetime;
    }

    /**
     * @return a Unicode glyph representing this kind for console display
     */
    public String getGlyph() {
        return glyph;
    }

    /**
     * @return how long a notification of this kind stays up unless configured otherwise
     */
    public Duration getDefaultLifetime() {
        return defaultLifetime;
    }
}
