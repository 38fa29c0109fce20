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


package io.reportgrid.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.reportgrid.model.ReportTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// Loads report tables from files.
///
/// - `.json`: `{"title": "...", "headers": ["..."], "rows": [["...", 1, null]]}`.
///   Cells may be strings, numbers or booleans; null cells become empty strings.
/// - `.csv`: the first record holds the headers, the title is the file name without
///   its extension. Blank records are skipped.
///
/// Unreadable files raise {@link UncheckedIOException}, malformed content raises
/// {@link IllegalArgumentException}; both name the file.
public final class ReportDocuments {
    private static final Logger logger = LogManager.getLogger(ReportDocuments.class);

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private ReportDocuments() {
    }

    public static ReportTable load(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ReportTable table;
        if (name.endsWith(".json")) {
            table = loadJson(path);
        } else if (name.endsWith(".csv")) {
            table = loadCsv(path);
        } else {
            throw new IllegalArgumentException("unsupported report document " + path + ", expected .json or .csv");
        }
        logger.info("Loaded report '{}' from {}: {} columns, {} rows",
            table.title(), path, table.headers().size(), table.rows().size());
        return table;
    }

    public static ReportTable loadJson(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Document document = GSON.fromJson(reader, Document.class);
            if (document == null) {
                throw new IllegalArgumentException("report document " + path + " is empty");
            }
            return document.toTable();
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            throw new IllegalArgumentException("malformed report document " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("could not read report document " + path, e);
        }
    }

    public static ReportTable loadCsv(Path path) {
        List<List<String>> records;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            records = CsvReader.read(reader);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("malformed CSV report " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("could not read CSV report " + path, e);
        }
        List<List<String>> nonBlank = new ArrayList<>();
        for (List<String> record : records) {
            if (!(record.size() == 1 && record.get(0).isBlank())) {
                nonBlank.add(record);
            }
        }
        String fileName = path.getFileName().toString();
        String title = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;
        if (nonBlank.isEmpty()) {
            return new ReportTable(title, List.of(), List.of());
        }
        return new ReportTable(title, nonBlank.get(0), nonBlank.subList(1, nonBlank.size()));
    }

    /// Writes a table in the JSON document format read by {@link #loadJson(Path)}.
    /// @param table the table to write
    /// @param writer the destination; not closed
    public static void writeJson(ReportTable table, Writer writer) {
        Document document = new Document();
        document.title = table.title();
        document.headers = table.headers();
        document.rows = new ArrayList<>();
        for (List<String> row : table.rows()) {
            List<JsonElement> cells = new ArrayList<>();
            for (String cell : row) {
                cells.add(GSON.toJsonTree(cell));
            }
            document.rows.add(cells);
        }
        GSON.toJson(document, writer);
    }

    private static final class Document {
        @SerializedName("title")
        private String title;

        @SerializedName("headers")
        private List<String> headers;

        @SerializedName("rows")
        private List<List<JsonElement>> rows;

        ReportTable toTable() {
            List<List<String>> cells = new ArrayList<>();
            if (rows != null) {
                for (List<JsonElement> row : rows) {
                    List<String> texts = new ArrayList<>();
                    if (row != null) {
                        for (JsonElement cell : row) {
                            texts.add(cell == null || cell.isJsonNull() ? "" : cell.getAsString());
                        }
                    }
                    cells.add(texts);
                }
            }
            return new ReportTable(title, headers, cells);
        }
    }
}
