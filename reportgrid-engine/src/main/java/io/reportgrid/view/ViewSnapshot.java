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

import io.reportgrid.filter.FilterState;
import io.reportgrid.model.ColumnFilterOptions;
import io.reportgrid.model.Row;
import io.reportgrid.paging.PageState;
import io.reportgrid.paging.PageView;
import io.reportgrid.paging.PageWindow;
import io.reportgrid.sort.SortIndicator;
import io.reportgrid.sort.SortState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a presentation layer needs to render a report view, taken right after a
 * recomputation. Snapshots are immutable; the view publishes a new one on every change.
 */
public final class ViewSnapshot {

    private final long version;
    private final String title;
    private final List<String> columns;
    private final FilterState filterState;
    private final SortState sortState;
    private final ChromeState chrome;
    private final PageView pageView;
    private final ColumnFilterOptions filterOptions;
    private final List<Integer> pageSizeChoices;

    ViewSnapshot(long version, String title, List<String> columns, FilterState filterState, SortState sortState,
                 ChromeState chrome, PageView pageView, ColumnFilterOptions filterOptions,
                 List<Integer> pageSizeChoices) {
        this.version = version;
        this.title = title;
        this.columns = columns;
        this.filterState = filterState;
        this.sortState = sortState;
        this.chrome = chrome;
        this.pageView = pageView;
        this.filterOptions = filterOptions;
        this.pageSizeChoices = pageSizeChoices;
    }

    /**
     * @return a counter that grows with every published snapshot
     */
    public long version() {
        return version;
    }

    public String title() {
        return title;
    }

    public List<String> columns() {
        return columns;
    }

    public FilterState filterState() {
        return filterState;
    }

    public SortState sortState() {
        return sortState;
    }

    public PageState pageState() {
        return pageView.state();
    }

    public ChromeState chrome() {
        return chrome;
    }

    public PageView pageView() {
        return pageView;
    }

    public List<Row> pageRows() {
        return pageView.pageRows();
    }

    public int filteredCount() {
        return pageView.filteredCount();
    }

    public int totalCount() {
        return pageView.totalCount();
    }

    public int totalPages() {
        return pageView.totalPages();
    }

    public boolean[] visibility() {
        return pageView.visibility();
    }

    public boolean showPlaceholder() {
        return pageView.showPlaceholder();
    }

    public PageWindow pageWindow() {
        return pageView.window();
    }

    public List<String> activeFilterTags() {
        return filterState.activeFilterTags();
    }

    public ColumnFilterOptions filterOptions() {
        return filterOptions;
    }

    public List<Integer> pageSizeChoices() {
        return pageSizeChoices;
    }

    /**
     * @return the header indicator of every column, in column order
     */
    public Map<String, SortIndicator> sortIndicators() {
        Map<String, SortIndicator> indicators = new LinkedHashMap<>();
        for (String column : columns) {
            indicators.put(column, sortState.indicatorFor(column));
        }
        return indicators;
    }

    @Override
    public String toString() {
        return "ViewSnapshot{v" + version + ", " + filterState + ", " + sortState + ", " + pageView + "}";
    }
}
