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

package io.reportgrid.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One record of a report: display values keyed by column name, in column order, plus
 * the row's position in the source table. The position doubles as the row's address
 * in the visibility array and as the sort tie-break.
 *
 * <p>Rows are immutable. Whether a row is visible is not a property of the row; it is
 * derived by the pagination controller.</p>
 */
public final class Row {

    private final int index;
    private final Map<String, String> values;

    Row(int index, Map<String, String> values) {
        this.index = index;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @return the row's original, zero-based position in the source table
     */
    public int index() {
        return index;
    }

    /**
     * @param column a column name
     * @return the display value, or null when the row has no such column
     */
    public String value(String column) {
        return values.get(column);
    }

    /**
     * @return all values keyed by column name, in column order
     */
    public Map<String, String> values() {
        return values;
    }

    /**
     * @param columns column names in the wanted order
     * @return the values for those columns, {@code ""} for unknown columns
     */
    public List<String> cells(List<String> columns) {
        return columns.stream().map(c -> values.getOrDefault(c, "")).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Row other)) {
            return false;
        }
        return index == other.index && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * index + values.hashCode();
    }

    @Override
    public String toString() {
        return "Row#" + index + values;
    }
}
