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


package io.reportgrid.command;

import io.reportgrid.model.ColumnFilterOptions;
import io.reportgrid.model.Row;
import io.reportgrid.paging.PageWindow;
import io.reportgrid.sort.SortIndicator;
import io.reportgrid.view.ViewSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a view snapshot as plain text: title, active filters, the page as an aligned
 * table, and a footer with the row summary and the page buttons.
 */
public class TextTableRenderer {

    /** Cells wider than this are cut and end with "...". */
    public static final int MAX_CELL_WIDTH = 32;
    public static final String NO_DATA = "No data";

    private final int maxCellWidth;

    public TextTableRenderer() {
        this(MAX_CELL_WIDTH);
    }

    public TextTableRenderer(int maxCellWidth) {
        this.maxCellWidth = Math.max(4, maxCellWidth);
    }

    public String render(ViewSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        sb.append(snapshot.title()).append('\n');

        List<String> tags = new ArrayList<>(snapshot.activeFilterTags());
        String term = snapshot.filterState().searchTerm();
        if (term != null && !term.isBlank()) {
            tags.add("search: " + term);
        }
        if (!tags.isEmpty()) {
            sb.append("Filters: ").append(String.join(", ", tags)).append('\n');
        }

        if (snapshot.columns().isEmpty() || snapshot.showPlaceholder()) {
            sb.append(NO_DATA).append('\n');
        } else {
            appendTable(sb, snapshot);
        }

        sb.append("Rows ").append(snapshot.pageView().summary())
            .append("  Page ").append(snapshot.pageState().page()).append('/').append(snapshot.totalPages())
            .append("  ").append(pageButtons(snapshot.pageWindow(), snapshot.totalPages()))
            .append('\n');
        return sb.toString();
    }

    public String renderFilterOptions(ColumnFilterOptions options) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<String>> entry : options.choices().entrySet()) {
            sb.append(entry.getKey()).append(": ").append(String.join(", ", entry.getValue())).append('\n');
        }
        return sb.toString();
    }

    private void appendTable(StringBuilder sb, ViewSnapshot snapshot) {
        List<String> columns = snapshot.columns();
        Map<String, SortIndicator> indicators = snapshot.sortIndicators();
        List<String> header = new ArrayList<>(columns.size());
        for (String column : columns) {
            SortIndicator indicator = indicators.get(column);
            header.add(indicator == null || indicator == SortIndicator.NEUTRAL
                ? column : column + " " + indicator.getGlyph());
        }
        List<List<String>> body = new ArrayList<>();
        for (Row row : snapshot.pageRows()) {
            body.add(row.cells(columns));
        }

        int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = width(header.get(c));
            for (List<String> cells : body) {
                widths[c] = Math.max(widths[c], width(cells.get(c)));
            }
        }

        appendLine(sb, header, widths);
        for (int c = 0; c < widths.length; c++) {
            sb.append(c == 0 ? "" : "-+-").append("-".repeat(widths[c]));
        }
        sb.append('\n');
        for (List<String> cells : body) {
            appendLine(sb, cells, widths);
        }
    }

    private void appendLine(StringBuilder sb, List<String> cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int c = 0; c < widths.length; c++) {
            if (c > 0) {
                line.append(" | ");
            }
            String cell = cut(cells.get(c));
            line.append(cell).append(" ".repeat(widths[c] - cell.codePointCount(0, cell.length())));
        }
        sb.append(line.toString().stripTrailing()).append('\n');
    }

    private int width(String text) {
        String cell = cut(text);
        return cell.codePointCount(0, cell.length());
    }

    private String cut(String text) {
        String single = text.replace('\n', ' ').replace('\r', ' ');
        if (single.codePointCount(0, single.length()) <= maxCellWidth) {
            return single;
        }
        return single.substring(0, single.offsetByCodePoints(0, maxCellWidth - 3)) + "...";
    }

    static String pageButtons(PageWindow window, int totalPages) {
        StringBuilder sb = new StringBuilder();
        if (window.showFirst()) {
            sb.append("1 ");
            if (window.leadingEllipsis()) {
                sb.append("... ");
            }
        }
        for (int page : window.pages()) {
            sb.append(page == window.current() ? "[" + page + "]" : String.valueOf(page)).append(' ');
        }
        if (window.showLast()) {
            if (window.trailingEllipsis()) {
                sb.append("... ");
            }
            sb.append(totalPages).append(' ');
        }
        return sb.toString().trim();
    }
}
