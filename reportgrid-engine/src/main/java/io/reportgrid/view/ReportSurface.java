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

import io.reportgrid.model.Row;
import io.reportgrid.notify.sched.TaskScheduler;
import io.reportgrid.paging.PageState;

import java.util.List;

/**
 * The part of a report view that exporters work against. Exporters read the filtered
 * and sorted rows, temporarily force the page state and hide the chrome, and capture
 * the shown region.
 */
public interface ReportSurface {

    String title();

    List<String> columns();

    /**
     * @return the current filtered and sorted rows, independent of pagination
     */
    List<Row> filteredAndSorted();

    int totalCount();

    PageState pageState();

    /**
     * Shows the given page state as is. Unlike user navigation, any positive page size
     * is accepted.
     */
    void forcePageState(PageState state);

    ChromeState chrome();

    void setChrome(ChromeState chrome);

    ReportRegion captureRegion();

    /**
     * @return the dispatch context the surface is confined to
     */
    TaskScheduler scheduler();
}
