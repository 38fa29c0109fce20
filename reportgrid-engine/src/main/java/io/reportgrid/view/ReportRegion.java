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


package io.reportgrid.view;

import io.reportgrid.paging.PageState;

import java.util.List;

/// What an exporter captures from a report view: the title, the column headers and
/// the rows currently shown, along with the state they were captured in.
///
/// @param title the report title
/// @param columns the column headers
/// @param rows the shown rows, as cell texts in column order
/// @param filteredCount rows matching the current filters
/// @param totalCount rows in the report
/// @param pageState the page state at capture time
/// @param chrome the controls shown at capture time
public record ReportRegion(String title, List<String> columns, List<List<String>> rows,
                           int filteredCount, int totalCount, PageState pageState, ChromeState chrome) {

    public ReportRegion {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
