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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Splits the filtered and sorted rows into pages and derives row visibility. This is
 * the only place where visibility is computed.
 *
 * <p>Navigation targets outside {@code [1, totalPages]} are ignored rather than
 * rejected: the state comes back unchanged.</p>
 */
public final class PaginationController {
    private static final Logger logger = LogManager.getLogger(PaginationController.class);

    private PaginationController() {
    }

    /**
     * @param rows the filtered and sorted rows
     * @param state the requested page state; the page is clamped to the rows at hand
     * @param totalRowCount size of the whole row collection, the length of the
     *                      visibility array
     * @return the page to show
     */
    public static PageView paginate(List<Row> rows, PageState state, int totalRowCount) {
        int count = rows.size();
        PageState clamped = state.clamp(count);
        if (clamped != state) {
            logger.debug("Page {} is past the last page for {} rows, showing page {}",
                state.page(), count, clamped.page());
        }
        int from = Math.min(count, (clamped.page() - 1) * clamped.pageSize());
        int to = Math.min(count, from + clamped.pageSize());
        List<Row> pageRows = rows.subList(from, to);

        boolean[] visibility = new boolean[totalRowCount];
        for (Row row : pageRows) {
            if (row.index() < totalRowCount) {
                visibility[row.index()] = true;
            }
        }
        return new PageView(clamped, clamped.totalPages(count), count, totalRowCount, pageRows, visibility);
    }

    public static PageState first(PageState state, int rowCount) {
        return goTo(state, rowCount, 1);
    }

    public static PageState previous(PageState state, int rowCount) {
        return goTo(state, rowCount, state.page() - 1);
    }

    public static PageState next(PageState state, int rowCount) {
        return goTo(state, rowCount, state.page() + 1);
    }

    public static PageState last(PageState state, int rowCount) {
        return goTo(state, rowCount, state.totalPages(rowCount));
    }

    /**
     * @return the state showing {@code page}, or {@code state} itself when the page
     * does not exist
     */
    public static PageState goTo(PageState state, int rowCount, int page) {
        if (page < 1 || page > state.totalPages(rowCount)) {
            logger.debug("Ignoring navigation to page {} of {}", page, state.totalPages(rowCount));
            return state;
        }
        return page == state.page() ? state : state.withPage(page);
    }

    /**
     * @return the first page at the new size, or {@code state} for a non-positive size
     */
    public static PageState setPageSize(PageState state, int pageSize) {
        if (pageSize <= 0) {
            logger.warn("Ignoring page size {}, page sizes must be positive", pageSize);
            return state;
        }
        return PageState.first(pageSize);
    }
}
