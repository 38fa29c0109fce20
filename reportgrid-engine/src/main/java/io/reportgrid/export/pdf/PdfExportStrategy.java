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

import java.util.concurrent.CompletionStage;

/**
 * One tier of the PDF export cascade. Tiers are independent: a tier must leave the
 * report view as it found it, whether it succeeds or fails, so that the next tier
 * starts from the same state.
 */
public interface PdfExportStrategy {

    /**
     * @return a short name used in logs and failure reasons
     */
    String name();

    /**
     * @return whether the libraries or platform features this tier needs are present
     */
    boolean isAvailable();

    /**
     * Attempts the export. Failures are reported either as a {@link TierResult} with
     * status {@link TierResult.Status#FAILURE} or as an exceptionally completed stage;
     * the cascade treats both the same.
     *
     * @param request the export to perform
     * @return the tier's result
     */
    CompletionStage<TierResult> attemptExport(PdfExportRequest request);
}
