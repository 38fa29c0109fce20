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


package io.reportgrid.export.pdf;

import java.nio.file.Path;

/// What one tier of the PDF cascade achieved.
///
/// @param status whether the tier succeeded, succeeded with reduced fidelity, or failed
/// @param file the written file, null when the tier wrote none
/// @param message the user-facing message for a success, or the failure reason
public record TierResult(Status status, Path file, String message) {

    public enum Status {
        SUCCESS,
        DEGRADED,
        FAILURE
    }

    public static TierResult success(Path file, String message) {
        return new TierResult(Status.SUCCESS, file, message);
    }

    public static TierResult degraded(String message) {
        return new TierResult(Status.DEGRADED, null, message);
    }

    public static TierResult failure(String reason) {
        return new TierResult(Status.FAILURE, null, reason);
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }
}
