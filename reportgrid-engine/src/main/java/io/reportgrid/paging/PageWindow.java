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


package io.reportgrid.paging;

import java.util.ArrayList;
import java.util.List;

/// The numbered page buttons around the current page. At most
/// {@link #MAX_BUTTONS} numbered buttons are shown; when the window does not reach the
/// first or last page, a shortcut to that page is shown, with an ellipsis when pages
/// are skipped in between.
///
/// @param pages the numbered buttons, ascending
/// @param current the current page, which is always one of `pages`
/// @param showFirst whether a shortcut to page 1 precedes the window
/// @param leadingEllipsis whether pages are skipped between page 1 and the window
/// @param showLast whether a shortcut to the last page follows the window
/// @param trailingEllipsis whether pages are skipped between the window and the last page
public record PageWindow(List<Integer> pages, int current, boolean showFirst, boolean leadingEllipsis,
                         boolean showLast, boolean trailingEllipsis) {

    public static final int MAX_BUTTONS = 7;

    public PageWindow {
        pages = List.copyOf(pages);
    }

    public static PageWindow around(int current, int totalPages) {
        return around(current, totalPages, MAX_BUTTONS);
    }

    public static PageWindow around(int current, int totalPages, int maxButtons) {
        int start = Math.max(1, current - maxButtons / 2);
        int end = Math.min(totalPages, start + maxButtons - 1);
        if (end - start < maxButtons - 1) {
            start = Math.max(1, end - maxButtons + 1);
        }
        List<Integer> pages = new ArrayList<>(end - start + 1);
        for (int p = start; p <= end; p++) {
            pages.add(p);
        }
        return new PageWindow(pages, current, start > 1, start > 2, end < totalPages, end < totalPages - 1);
    }
}
