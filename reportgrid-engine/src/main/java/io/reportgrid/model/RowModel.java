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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The in-memory row collection of one report document: column names, the rows in
 * source order, and the corpus of searchable tokens used for search suggestions.
 * Built once by {@link RowModelBuilder}; never changed afterwards.
 */
public final class RowModel {

    /** Suggestions are only offered once the user has typed this many characters. */
    public static final int MIN_SUGGESTION_TERM = 2;
    public static final int DEFAULT_SUGGESTION_LIMIT = 10;

    private static final RowModel EMPTY = new RowModel("", List.of(), List.of(), new LinkedHashSet<>());

    private final String title;
    private final List<String> columns;
    private final List<Row> rows;
    private final Set<String> searchTokens;

    RowModel(String title, List<String> columns, List<Row> rows, LinkedHashSet<String> searchTokens) {
        this.title = title;
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
        this.searchTokens = Collections.unmodifiableSet(searchTokens);
    }

    static RowModel empty(String title) {
        return title == null || title.isEmpty()
            ? EMPTY
            : new RowModel(title, List.of(), List.of(), new LinkedHashSet<>());
    }

    public String title() {
        return title;
    }

    public List<String> columns() {
        return columns;
    }

    /**
     * @return every row in source order; the same list instance on every call
     */
    public List<Row> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * @return distinct cell values longer than two characters, in first-seen order
     */
    public Set<String> searchTokens() {
        return searchTokens;
    }

    public List<String> suggest(String term) {
        return suggest(term, DEFAULT_SUGGESTION_LIMIT);
    }

    /**
     * Search-box suggestions: tokens that contain the typed term, ignoring case.
     *
     * @param term what the user typed so far
     * @param limit the most suggestions to return
     * @return matching tokens in corpus order, empty for terms shorter than
     * {@link #MIN_SUGGESTION_TERM}
     */
    public List<String> suggest(String term, int limit) {
        if (term == null || term.length() < MIN_SUGGESTION_TERM || limit <= 0) {
            return List.of();
        }
        String needle = term.toLowerCase(Locale.ROOT);
        List<String> matches = new ArrayList<>();
        for (String token : searchTokens) {
            if (token.toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(token);
                if (matches.size() == limit) {
                    break;
                }
            }
        }
        return matches;
    }

    @Override
    public String toString() {
        return "RowModel{title='" + title + "', columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
