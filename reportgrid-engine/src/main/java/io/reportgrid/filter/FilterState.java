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


package io.reportgrid.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The constraints currently in effect: a free-text search term and per-column equality
 * selections. Instances are immutable; every change produces a new state.
 *
 * <p>A blank search term and an empty or null selection mean "no constraint".
 * Selections keep the order in which they were made, which is the order of the active
 * filter tags.</p>
 */
public final class FilterState {

    private static final FilterState EMPTY = new FilterState("", new LinkedHashMap<>());

    private final String searchTerm;
    private final Map<String, String> columnFilters;

    private FilterState(String searchTerm, LinkedHashMap<String, String> columnFilters) {
        this.searchTerm = searchTerm;
        this.columnFilters = Collections.unmodifiableMap(columnFilters);
    }

    public static FilterState empty() {
        return EMPTY;
    }

    /**
     * @param searchTerm the free-text search, may be null
     * @param columnFilters column name to selected value; blank values are dropped
     * @return the corresponding state
     */
    public static FilterState of(String searchTerm, Map<String, String> columnFilters) {
        LinkedHashMap<String, String> selected = new LinkedHashMap<>();
        if (columnFilters != null) {
            columnFilters.forEach((column, value) -> {
                if (column != null && value != null && !value.isEmpty()) {
                    selected.put(column, value);
                }
            });
        }
        String term = searchTerm == null ? "" : searchTerm;
        if (term.isBlank() && selected.isEmpty()) {
            return EMPTY;
        }
        return new FilterState(term, selected);
    }

    public String searchTerm() {
        return searchTerm;
    }

    /**
     * @return the term as matched against cell values, or null when the term is blank
     */
    public String normalizedSearchTerm() {
        return searchTerm.isBlank() ? null : searchTerm.toLowerCase(Locale.ROOT);
    }

    public Map<String, String> columnFilters() {
        return columnFilters;
    }

    public boolean isEmpty() {
        return searchTerm.isBlank() && columnFilters.isEmpty();
    }

    public FilterState withSearchTerm(String term) {
        return of(term, columnFilters);
    }

    /**
     * Selects a value for a column. An empty or null value clears the column's
     * selection, like choosing the "all" entry of a select control.
     */
    public FilterState withColumnFilter(String column, String value) {
        LinkedHashMap<String, String> next = new LinkedHashMap<>(columnFilters);
        if (value == null || value.isEmpty()) {
            next.remove(column);
        } else {
            next.put(column, value);
        }
        return of(searchTerm, next);
    }

    public FilterState withoutColumnFilter(String column) {
        return withColumnFilter(column, null);
    }

    /**
     * @return the empty state: no search term and no selections
     */
    public FilterState reset() {
        return EMPTY;
    }

    /**
     * @return one {@code "column: value"} tag per selection, in selection order
     */
    public List<String> activeFilterTags() {
        List<String> tags = new ArrayList<>(columnFilters.size());
        columnFilters.forEach((column, value) -> tags.add(column + ": " + value));
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterState other)) {
            return false;
        }
        return searchTerm.equals(other.searchTerm) && columnFilters.equals(other.columnFilters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(searchTerm, columnFilters);
    }

    @Override
    public String toString() {
        return "FilterState{search='" + searchTerm + "', columns=" + columnFilters + "}";
    }
}
