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

import io.reportgrid.model.Row;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Narrows the row collection to the rows satisfying a {@link FilterState}. Every call
 * starts from the rows it is given, never from an earlier result, so the outcome only
 * depends on the state.
 *
 * <p>A row passes when it satisfies the search predicate and every column predicate:</p>
 * <ul>
 *   <li>search: some cell contains the term, ignoring case</li>
 *   <li>column: the cell equals the selected value exactly</li>
 * </ul>
 */
public final class FilterPipeline {
    private static final Logger logger = LogManager.getLogger(FilterPipeline.class);

    private FilterPipeline() {
    }

    /**
     * @param rows the full row collection
     * @param state the constraints to apply
     * @return the matching rows in input order; {@code rows} itself when the state is empty
     */
    public static List<Row> applyFilters(List<Row> rows, FilterState state) {
        if (state == null || state.isEmpty()) {
            return rows;
        }
        String term = state.normalizedSearchTerm();
        Map<String, String> columns = state.columnFilters();
        List<Row> matched = new ArrayList<>();
        for (Row row : rows) {
            if (matches(row, term, columns)) {
                matched.add(row);
            }
        }
        logger.debug("Filter {} kept {} of {} rows", state, matched.size(), rows.size());
        return matched;
    }

    private static boolean matches(Row row, String term, Map<String, String> columns) {
        try {
            for (Map.Entry<String, String> selection : columns.entrySet()) {
                if (!selection.getValue().equals(row.value(selection.getKey()))) {
                    return false;
                }
            }
            return term == null || containsTerm(row, term);
        } catch (RuntimeException e) {
            logger.warn("Could not evaluate filter on row {}, treating it as no match", row.index(), e);
            return false;
        }
    }

    private static boolean containsTerm(Row row, String term) {
        for (String value : row.values().values()) {
            if (value.toLowerCase(Locale.ROOT).contains(term)) {
                return true;
            }
        }
        return false;
    }
}
