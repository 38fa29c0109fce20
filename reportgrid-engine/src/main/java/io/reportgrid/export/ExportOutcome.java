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

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/// The result of one export request.
///
/// @param status how the export ended
/// @param file the written file, if any
/// @param route the name of the tier or target that produced the result
/// @param message the text shown to the user
/// @param failures reasons of every tier that failed before the result, in attempt order
public record ExportOutcome(ExportStatus status, Path file, String route, String message, List<String> failures) {

    public ExportOutcome {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static ExportOutcome success(Path file, String route, String message, List<String> failures) {
        return new ExportOutcome(ExportStatus.SUCCESS, file, route, message, failures);
    }

    public static ExportOutcome degraded(Path file, String route, String message, List<String> failures) {
        return new ExportOutcome(ExportStatus.DEGRADED, file, route, message, failures);
    }

    public static ExportOutcome failed(String message, List<String> failures) {
        return new ExportOutcome(ExportStatus.FAILED, null, null, message, failures);
    }

    public static ExportOutcome busy(String message) {
        return new ExportOutcome(ExportStatus.BUSY, null, null, message, List.of());
    }

    public Optional<Path> fileIfWritten() {
        return Optional.ofNullable(file);
    }

    public boolean isSuccess() {
        return status == ExportStatus.SUCCESS;
    }
}
