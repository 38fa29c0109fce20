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

import io.reportgrid.config.PdfSettings;
import io.reportgrid.view.ReportSurface;

import java.nio.file.Path;
import java.time.ZonedDateTime;

/// One PDF export, as handed to every tier of the cascade.
///
/// @param surface the report view to capture
/// @param outputFile where a tier that writes a file writes it
/// @param settings the PDF settings
/// @param generatedAt the export time printed in document headers
public record PdfExportRequest(ReportSurface surface, Path outputFile, PdfSettings settings,
                               ZonedDateTime generatedAt) {
}
