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

import java.util.List;

/// The page the user is on and how many rows a page holds. Immutable.
///
/// @param page the current page, starting at 1
/// @param pageSize rows per page, always positive
public record PageState(int page, int pageSize) {

    /// The page sizes offered by the page-size selector.
    public static final List<Integer> PAGE_SIZE_CHOICES = List.of(10, 25, 50, 100);
    public static final int DEFAULT_PAGE_SIZE = 50;

    public PageState {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("page size must be positive, got " + pageSize);
        }
        if (page < 1) {
            throw new IllegalArgumentException("page must be 1 or more, got " + page);
        }
    }

    public static PageState first(int pageSize) {
        return new PageState(1, pageSize);
    }

    public static PageState initial() {
        return first(DEFAULT_PAGE_SIZE);
    }

    /// @param rowCount number of rows being paged
    /// @return `max(1, ceil(rowCount / pageSize))`
    public int totalPages(int rowCount) {
        if (rowCount <= 0) {
            return 1;
        }
        return (rowCount + pageSize - 1) / pageSize;
    }

    /// @param rowCount number of rows being paged
    /// @return this state with the page moved into `[1, totalPages]`
    public PageState clamp(int rowCount) {
        int last = totalPages(rowCount);
        return page > last ? new PageState(last, pageSize) : this;
    }

    public PageState withPage(int newPage) {
        return new PageState(newPage, pageSize);
    }
}
