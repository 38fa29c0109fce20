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


package io.reportgrid.sort;

import io.reportgrid.model.Row;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders rows by one column and remembers the active {@link SortState} so that it can
 * be re-applied after every filter change.
 *
 * <p>Sorting is stable: rows with equal values keep their original order, in both
 * directions. Sorting never fails outward. An unknown column, or values that the
 * comparator cannot order consistently, leave the rows as they were.</p>
 */
public class SortEngine {
    private static final Logger logger = LogManager.getLogger(SortEngine.class);

    private final List<String> columns;
    private final Locale collationLocale;
    private SortState state = SortState.none();

    /**
     * @param columns the columns that may be sorted
     * @param collationLocale the locale used to collate text values
     */
    public SortEngine(List<String> columns, Locale collationLocale) {
        this.columns = List.copyOf(columns);
        this.collationLocale = collationLocale;
    }

    public SortState getState() {
        return state;
    }

    public void setState(SortState state) {
        this.state = state == null ? SortState.none() : state;
    }

    /**
     * Handles a header selection: toggles the sort state and sorts by it.
     *
     * @param rows the rows to order, usually the filtered rows
     * @param column the selected column
     * @return the ordered rows, or {@code rows} unchanged for an unknown column or for
     * values that cannot be ordered; in both cases the sort state is kept as it was
     */
    public List<Row> sortTable(List<Row> rows, String column) {
        if (column == null || !columns.contains(column)) {
            logger.warn("Cannot sort by unknown column '{}', known columns are {}", column, columns);
            return rows;
        }
        SortState next = state.toggle(column);
        List<Row> sorted = order(rows, next);
        if (sorted == null) {
            return rows;
        }
        state = next;
        return sorted;
    }

    /**
     * @param rows freshly filtered rows
     * @return the rows ordered by the current sort state
     */
    public List<Row> apply(List<Row> rows) {
        return sort(rows, state);
    }

    /**
     * @param rows the rows to order
     * @param sortState the order to apply
     * @return a new, ordered list, or {@code rows} when nothing needs to be ordered
     */
    public List<Row> sort(List<Row> rows, SortState sortState) {
        List<Row> sorted = order(rows, sortState);
        return sorted == null ? rows : sorted;
    }

    /**
     * @return the ordered rows, {@code rows} itself when nothing needs ordering, or null
     * when the values cannot be ordered consistently
     */
    private List<Row> order(List<Row> rows, SortState sortState) {
        if (sortState == null || !sortState.isActive() || rows.size() < 2) {
            return rows;
        }
        String column = sortState.column();
        if (!columns.contains(column)) {
            logger.warn("Sort state refers to unknown column '{}', leaving rows unsorted", column);
            return rows;
        }

        ValueComparator values = new ValueComparator(collationLocale);
        List<Keyed> keyed = new ArrayList<>(rows.size());
        for (Row row : rows) {
            keyed.add(new Keyed(row, values.key(row.value(column))));
        }
        Comparator<Keyed> byValue = (a, b) -> values.compareKeys(a.key, b.key);
        if (sortState.direction() == SortDirection.DESCENDING) {
            byValue = byValue.reversed();
        }
        Comparator<Keyed> order = byValue.thenComparingInt(k -> k.row.index());

        try {
            sortInPlace(keyed, order);
        } catch (IllegalArgumentException e) {
            logger.warn("Values of column '{}' cannot be ordered consistently, leaving rows unsorted: {}",
                column, e.getMessage());
            return null;
        }
        List<Row> sorted = new ArrayList<>(keyed.size());
        for (Keyed k : keyed) {
            sorted.add(k.row);
        }
        logger.debug("Sorted {} rows by {}", sorted.size(), sortState);
        return sorted;
    }

    /**
     * Runs the list sort. {@link List#sort} throws {@link IllegalArgumentException} when
     * it detects a comparator that breaks its contract.
     */
    <T> void sortInPlace(List<T> items, Comparator<? super T> order) {
        items.sort(order);
    }

    private static final class Keyed {
        private final Row row;
        private final ValueComparator.Key key;

        private Keyed(Row row, ValueComparator.Key key) {
            this.row = row;
            this.key = key;
        }
    }
}
