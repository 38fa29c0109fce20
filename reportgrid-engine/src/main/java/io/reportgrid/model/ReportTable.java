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

package io.reportgrid.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// A finished report table as handed over by the report generator: a title used for
/// export file names, header labels in display order, and body rows of text cells.
///
/// Nothing is validated here beyond null-safety; ragged rows and empty tables are the
/// {@link RowModelBuilder}'s business.
///
/// @param title the human-readable report title
/// @param headers header labels in display order
/// @param rows body rows, each a list of cell texts in header order
public record ReportTable(String title, List<String> headers, List<List<String>> rows) {

    public ReportTable {
        title = title == null ? "" : title;
        headers = headers == null ? List.of() : List.copyOf(nullsToEmpty(headers));
        List<List<String>> copied = new ArrayList<>();
        if (rows != null) {
            for (List<String> row : rows) {
                copied.add(row == null ? List.of() : List.copyOf(nullsToEmpty(row)));
            }
        }
        rows = List.copyOf(copied);
    }

    /// Convenience factory for code and tests that build tables inline.
    /// @param title the report title
    /// @param headers the header labels
    /// @return a builder-style table with no rows yet
    public static ReportTable of(String title, String... headers) {
        return new ReportTable(title, Arrays.asList(headers), List.of());
    }

    /// @param cells the cells of one more body row
    /// @return a copy of this table with the row appended
    public ReportTable withRow(String... cells) {
        List<List<String>> more = new ArrayList<>(rows);
        more.add(Arrays.asList(cells));
        return new ReportTable(title, headers, more);
    }

    private static List<String> nullsToEmpty(List<String> values) {
        List<String> cleaned = new ArrayList<>(values.size());
        for (String value : values) {
            cleaned.add(value == null ? "" : value);
        }
        return cleaned;
    }
}
