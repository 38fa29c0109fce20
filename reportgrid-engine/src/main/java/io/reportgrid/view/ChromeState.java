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

/// Which interactive controls around the table are shown. Exports hide all of them so
/// they do not end up in the captured document.
///
/// @param filterControls the search box and column selects
/// @param paginationControls the page buttons and page-size selector
/// @param actionButtons the export and print triggers
public record ChromeState(boolean filterControls, boolean paginationControls, boolean actionButtons) {

    private static final ChromeState VISIBLE = new ChromeState(true, true, true);
    private static final ChromeState HIDDEN = new ChromeState(false, false, false);

    public static ChromeState visible() {
        return VISIBLE;
    }

    public static ChromeState hidden() {
        return HIDDEN;
    }

    public boolean anyVisible() {
        return filterControls || paginationControls || actionButtons;
    }
}
