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
import java.util.TreeSet;

/**
 * The choices offered by the per-column select controls. A column gets a select only
 * when it has more than one and at most {@link #MAX_CHOICES} distinct non-empty
 * values; free-text columns like names or mail addresses get none.
 */
public final class ColumnFilterOptions {

    public static final int MAX_CHOICES = 10;

    private final Map<String, List<String>> choices;

    private ColumnFilterOptions(Map<String, List<String>> choices) {
        this.choices = Collections.unmodifiableMap(choices);
    }

    public static ColumnFilterOptions of(RowModel model) {
        Map<String, List<String>> choices = new LinkedHashMap<>();
        for (String column : model.columns()) {
            TreeSet<String> distinct = new TreeSet<>();
            for (Row row : model.rows()) {
                String value = row.value(column);
                if (value != null && !value.isEmpty()) {
                    distinct.add(value);
                    if (distinct.size() > MAX_CHOICES) {
                        break;
                    }
                }
            }
            if (distinct.size() > 1 && distinct.size() <= MAX_CHOICES) {
                choices.put(column, List.copyOf(distinct));
            }
        }
        return new ColumnFilterOptions(choices);
    }

    /**
     * @return column name to sorted choices, in column order
     */
    public Map<String, List<String>> choices() {
        return choices;
    }

    public boolean hasSelect(String column) {
        return choices.containsKey(column);
    }

    public List<String> choicesFor(String column) {
        return choices.getOrDefault(column, List.of());
    }
}
