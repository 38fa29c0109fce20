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

import io.reportgrid.config.EngineConfig;
import io.reportgrid.filter.FilterPipeline;
import io.reportgrid.filter.FilterState;
import io.reportgrid.model.ColumnFilterOptions;
import io.reportgrid.model.Row;
import io.reportgrid.model.RowModel;
import io.reportgrid.notify.sched.TaskScheduler;
import io.reportgrid.paging.PageState;
import io.reportgrid.paging.PageView;
import io.reportgrid.paging.PaginationController;
import io.reportgrid.sort.SortEngine;
import io.reportgrid.sort.SortState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The observable state of one report view. Holds the filter, sort, page and chrome
 * state, runs the filter, sort and pagination stages when they change, and publishes a
 * {@link ViewSnapshot} to its listeners after every change.
 *
 * <p>The store is confined to its {@link TaskScheduler}: call its methods from the
 * dispatch context only. Changes are applied in call order.</p>
 *
 * <p>No stage failure escapes the store. A failing filter stage keeps every row, a
 * failing sort stage keeps the filtered order, and a failing listener is logged and
 * skipped.</p>
 */
public class ReportViewStore implements ReportSurface {
    private static final Logger logger = LogManager.getLogger(ReportViewStore.class);

    private final RowModel model;
    private final TaskScheduler scheduler;
    private final SortEngine sortEngine;
    private final ColumnFilterOptions filterOptions;
    private final List<Integer> pageSizeChoices;
    private final Debouncer searchDebouncer;
    private final List<ViewListener> listeners = new CopyOnWriteArrayList<>();

    private FilterState filterState = FilterState.empty();
    private PageState pageState;
    private ChromeState chrome = ChromeState.visible();
    private List<Row> filtered;
    private List<Row> filteredAndSorted;
    private PageView pageView;
    private ViewSnapshot snapshot;
    private long version;

    public ReportViewStore(RowModel model, EngineConfig config, TaskScheduler scheduler) {
        this.model = model;
        this.scheduler = scheduler;
        this.sortEngine = new SortEngine(model.columns(), config.locale());
        this.filterOptions = ColumnFilterOptions.of(model);
        this.pageSizeChoices = config.pageSizeChoices();
        this.searchDebouncer = new Debouncer(scheduler, config.debounce());
        this.pageState = PageState.first(config.pageSize());
        this.filtered = model.rows();
        this.filteredAndSorted = model.rows();
        this.pageView = PaginationController.paginate(filteredAndSorted, pageState, model.size());
        this.pageState = pageView.state();
        this.snapshot = buildSnapshot();
    }

    public void addListener(ViewListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ViewListener listener) {
        listeners.remove(listener);
    }

    public RowModel model() {
        return model;
    }

    public ViewSnapshot snapshot() {
        return snapshot;
    }

    public FilterState filterState() {
        return filterState;
    }

    public SortState sortState() {
        return sortEngine.getState();
    }

    public List<String> suggest(String term) {
        return model.suggest(term);
    }

    // filtering

    /**
     * Takes a keystroke in the search box. The term is applied once typing has paused
     * for the debounce period; earlier terms of the burst are dropped.
     */
    public void typeSearch(String term) {
        searchDebouncer.submit(() -> setSearchTerm(term));
    }

    /**
     * Applies a pending debounced search term right away.
     *
     * @return whether a term was pending
     */
    public boolean flushSearch() {
        return searchDebouncer.flush();
    }

    public boolean isSearchPending() {
        return searchDebouncer.isPending();
    }

    public void setSearchTerm(String term) {
        updateFilters(filterState.withSearchTerm(term));
    }

    public void setColumnFilter(String column, String value) {
        if (!model.hasColumn(column)) {
            logger.warn("Ignoring filter on unknown column '{}'", column);
            return;
        }
        updateFilters(filterState.withColumnFilter(column, value));
    }

    public void removeFilter(String column) {
        updateFilters(filterState.withoutColumnFilter(column));
    }

    public void resetFilters() {
        searchDebouncer.cancel();
        updateFilters(filterState.reset());
    }

    private void updateFilters(FilterState next) {
        if (next.equals(filterState)) {
            return;
        }
        filterState = next;
        filtered = runFilterStage();
        filteredAndSorted = runSortStage(filtered);
        repaginate("filter " + filterState);
    }

    // sorting

    /**
     * Handles a click on a column header: sorts by the column ascending, or flips the
     * direction when it is already the sorted column.
     */
    public void sortBy(String column) {
        SortState before = sortEngine.getState();
        List<Row> sorted;
        try {
            sorted = sortEngine.sortTable(filtered, column);
        } catch (RuntimeException e) {
            logger.error("Sorting by '{}' failed, keeping the current order", column, e);
            sortEngine.setState(before);
            return;
        }
        if (sortEngine.getState().equals(before)) {
            return;
        }
        filteredAndSorted = sorted;
        repaginate("sort " + sortEngine.getState());
    }

    // paging

    public void firstPage() {
        navigate(PaginationController.first(pageState, filteredAndSorted.size()));
    }

    public void previousPage() {
        navigate(PaginationController.previous(pageState, filteredAndSorted.size()));
    }

    public void nextPage() {
        navigate(PaginationController.next(pageState, filteredAndSorted.size()));
    }

    public void lastPage() {
        navigate(PaginationController.last(pageState, filteredAndSorted.size()));
    }

    public void goToPage(int page) {
        navigate(PaginationController.goTo(pageState, filteredAndSorted.size(), page));
    }

    /**
     * Takes a choice from the page-size selector and goes back to page 1. Sizes that
     * are not offered by the selector are ignored.
     */
    public void setPageSize(int pageSize) {
        if (!pageSizeChoices.contains(pageSize)) {
            logger.warn("Ignoring page size {}, choices are {}", pageSize, pageSizeChoices);
            return;
        }
        navigate(PaginationController.setPageSize(pageState, pageSize));
    }

    private void navigate(PageState next) {
        if (next.equals(pageState)) {
            return;
        }
        pageState = next;
        repaginate("page " + next);
    }

    // export support

    @Override
    public String title() {
        return model.title();
    }

    @Override
    public List<String> columns() {
        return model.columns();
    }

    @Override
    public List<Row> filteredAndSorted() {
        return filteredAndSorted;
    }

    @Override
    public int totalCount() {
        return model.size();
    }

    @Override
    public PageState pageState() {
        return pageState;
    }

    @Override
    public void forcePageState(PageState state) {
        pageState = state;
        repaginate("forced " + state);
    }

    @Override
    public ChromeState chrome() {
        return chrome;
    }

    @Override
    public void setChrome(ChromeState next) {
        if (next.equals(chrome)) {
            return;
        }
        chrome = next;
        publish("chrome " + next);
    }

    @Override
    public ReportRegion captureRegion() {
        List<List<String>> rows = new ArrayList<>(pageView.pageRows().size());
        for (Row row : pageView.pageRows()) {
            rows.add(row.cells(model.columns()));
        }
        return new ReportRegion(model.title(), model.columns(), rows, pageView.filteredCount(),
            pageView.totalCount(), pageState, chrome);
    }

    @Override
    public TaskScheduler scheduler() {
        return scheduler;
    }

    // stages

    private List<Row> runFilterStage() {
        try {
            return FilterPipeline.applyFilters(model.rows(), filterState);
        } catch (RuntimeException e) {
            logger.error("Filter stage failed for {}, showing all rows", filterState, e);
            return model.rows();
        }
    }

    private List<Row> runSortStage(List<Row> rows) {
        try {
            return sortEngine.apply(rows);
        } catch (RuntimeException e) {
            logger.error("Sort stage failed for {}, keeping filtered order", sortEngine.getState(), e);
            return rows;
        }
    }

    private void repaginate(String cause) {
        pageView = PaginationController.paginate(filteredAndSorted, pageState, model.size());
        pageState = pageView.state();
        publish(cause);
    }

    private void publish(String cause) {
        snapshot = buildSnapshot();
        logger.trace("Publishing {} after {}", snapshot, cause);
        for (ViewListener listener : listeners) {
            try {
                listener.viewChanged(snapshot);
            } catch (RuntimeException e) {
                logger.error("View listener {} failed on {}", listener, snapshot, e);
            }
        }
    }

    private ViewSnapshot buildSnapshot() {
        return new ViewSnapshot(version++, model.title(), model.columns(), filterState, sortEngine.getState(),
            chrome, pageView, filterOptions, pageSizeChoices);
    }
}
