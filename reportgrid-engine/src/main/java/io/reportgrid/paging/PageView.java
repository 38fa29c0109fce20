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

import io.reportgrid.model.Row;

import java.util.Arrays;
import java.util.List;

/**
 * The result of paginating a filtered and sorted row list.
 *
 * <p>{@link #visibility()} is addressed by {@link Row#index()} over the whole row
 * collection: an entry is true exactly when that row is on the current page. The
 * presentation layer renders from it and never decides visibility itself.</p>
 */
public final class PageView {

    private final PageState state;
    private final int totalPages;
    private final int filteredCount;
    private final int totalCount;
    private final List<Row> pageRows;
    private final boolean[] visibility;

    PageView(PageState state, int totalPages, int filteredCount, int totalCount,
             List<Row> pageRows, boolean[] visibility) {
        this.state = state;
        this.totalPages = totalPages;
        this.filteredCount = filteredCount;
        this.totalCount = totalCount;
        this.pageRows = List.copyOf(pageRows);
        this.visibility = visibility;
    }

    /**
     * @return the page state actually shown, already clamped
     */
    public PageState state() {
        return state;
    }

    public int page() {
        return state.page();
    }

    public int pageSize() {
        return state.pageSize();
    }

    public int totalPages() {
        return totalPages;
    }

    public int filteredCount() {
        return filteredCount;
    }

    public int totalCount() {
        return totalCount;
    }

    public List<Row> pageRows() {
        return pageRows;
    }

    /**
     * @return a copy of the visibility array
     */
    public boolean[] visibility() {
        return Arrays.copyOf(visibility, visibility.length);
    }

    public boolean isVisible(int rowIndex) {
        return rowIndex >= 0 && rowIndex < visibility.length && visibility[rowIndex];
    }

    /**
     * @return true when the no-data placeholder is shown instead of the table
     */
    public boolean showPlaceholder() {
        return filteredCount == 0;
    }

    /**
     * @return the 1-based ordinal of the first row on the page, 0 when there are none
     */
    public int firstOrdinal() {
        return pageRows.isEmpty() ? 0 : (state.page() - 1) * state.pageSize() + 1;
    }

    /**
     * @return the 1-based ordinal of the last row on the page, 0 when there are none
     */
    public int lastOrdinal() {
        return pageRows.isEmpty() ? 0 : firstOrdinal() + pageRows.size() - 1;
    }

    public PageWindow window() {
        return PageWindow.around(state.page(), totalPages);
    }

    /**
     * @return the "showing X-Y of N" line of the pagination bar
     */
    public String summary() {
        if (filteredCount == totalCount) {
            return String.format("%d-%d of %d", firstOrdinal(), lastOrdinal(), filteredCount);
        }
        return String.format("%d-%d of %d (filtered from %d)", firstOrdinal(), lastOrdinal(), filteredCount,
            totalCount);
    }

    @Override
    public String toString() {
        return "PageView{page=" + state.page() + "/" + totalPages + ", size=" + state.pageSize()
            + ", rows=" + pageRows.size() + ", filtered=" + filteredCount + ", total=" + totalCount + "}";
    }
}
