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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a {@link ReportTable} into a {@link RowModel}.
 *
 * <ul>
 *   <li>Header and cell text is trimmed.</li>
 *   <li>A row shorter than the header gets {@code ""} for the missing cells; extra
 *       cells are ignored.</li>
 *   <li>A table without headers or without body rows yields an empty model. This is
 *       logged, not thrown: the view shows its no-data placeholder instead.</li>
 *   <li>Repeated header text is made unique by appending {@code " (2)"},
 *       {@code " (3)"}, ... so that no column's data is shadowed by another.</li>
 * </ul>
 */
public final class RowModelBuilder {
    private static final Logger logger = LogManager.getLogger(RowModelBuilder.class);

    /** Cell values must be longer than this to become search suggestions. */
    static final int MIN_TOKEN_LENGTH = 3;

    private RowModelBuilder() {
    }

    public static RowModel build(ReportTable table) {
        if (table == null) {
            logger.warn("No report table given, building an empty row model");
            return RowModel.empty("");
        }
        if (table.headers().isEmpty()) {
            logger.warn("Report '{}' has no header cells, building an empty row model", table.title());
            return RowModel.empty(table.title());
        }
        if (table.rows().isEmpty()) {
            logger.warn("Report '{}' has no body rows, building an empty row model", table.title());
            return RowModel.empty(table.title());
        }

        List<String> columns = uniqueColumnNames(table.headers(), table.title());
        List<Row> rows = new ArrayList<>(table.rows().size());
        LinkedHashSet<String> tokens = new LinkedHashSet<>();

        for (int r = 0; r < table.rows().size(); r++) {
            List<String> cells = table.rows().get(r);
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                String value = c < cells.size() ? cells.get(c).trim() : "";
                values.put(columns.get(c), value);
                if (value.length() >= MIN_TOKEN_LENGTH) {
                    tokens.add(value);
                }
            }
            if (cells.size() > columns.size()) {
                logger.debug("Row {} of '{}' has {} cells for {} columns, extra cells ignored",
                    r, table.title(), cells.size(), columns.size());
            }
            rows.add(new Row(r, values));
        }

        logger.debug("Built row model for '{}': {} columns, {} rows, {} search tokens",
            table.title(), columns.size(), rows.size(), tokens.size());
        return new RowModel(table.title(), columns, rows, tokens);
    }

    static List<String> uniqueColumnNames(List<String> headers, String title) {
        List<String> names = new ArrayList<>(headers.size());
        Set<String> taken = new HashSet<>();
        for (String header : headers) {
            String base = header.trim();
            String name = base;
            int occurrence = 2;
            while (!taken.add(name)) {
                name = base + " (" + occurrence++ + ")";
            }
            if (!name.equals(base)) {
                logger.warn("Report '{}' repeats column '{}', renamed to '{}'", title, base, name);
            }
            names.add(name);
        }
        return names;
    }
}
