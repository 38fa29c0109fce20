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

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Prints notifications to a console stream, one line each, prefixed with the kind's
 * glyph. Dismissals are silent; the overlay prints a start and an end line.
 *
 * <pre>{@code
 * [10:31:07.412] ✅ PDF file "License_Analysis_20240801_1031.pdf" saved
 * [10:31:09.003] ⏳ Preparing PDF ...
 * [10:31:11.870] ⌛ Preparing PDF done
 * }</pre>
 */
public class ConsoleNotificationSink implements NotificationSink {

    private final PrintStream output;
    private final boolean showTimestamp;
    private final DateTimeFormatter timeFormatter;

    public ConsoleNotificationSink() {
        this(System.out, true);
    }

    public ConsoleNotificationSink(PrintStream output) {
        this(output, true);
    }

    /**
     * @param output where lines are printed
     * @param showTimestamp whether each line starts with a wall clock time
     */
    public ConsoleNotificationSink(PrintStream output, boolean showTimestamp) {
        this.output = output;
        this.showTimestamp = showTimestamp;
        this.timeFormatter = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");
    }

    @Override
    public void notificationShown(Notification notification) {
        output.println(prefix() + notification.kind().getGlyph() + " " + notification.message());
    }

    @Override
    public void notificationDismissed(Notification notification, DismissReason reason) {
    }

    @Override
    public void overlayShown(String label) {
        output.println(prefix() + "⏳ " + label + " ...");
    }

    @Override
    public void overlayHidden(String label) {
        output.println(prefix() + "⌛ " + label + " done");
    }

    private String prefix() {
        return showTimestamp ? "[" + LocalDateTime.now().format(timeFormatter) + "] " : "";
    }
}
