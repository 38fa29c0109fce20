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


package io.reportgrid.export.csv;

import io.reportgrid.export.ReportFileNames;
import io.reportgrid.model.Row;
import io.reportgrid.view.ReportSurface;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the filtered and sorted rows of a report view as RFC 4180 CSV: a UTF-8
 * byte-order mark, the header record, then one record per row, CRLF after every record.
 * The current page does not matter; every matching row is written.
 */
public class CsvExporter {
    private static final Logger logger = LogManager.getLogger(CsvExporter.class);

    public static final String BOM = "\uFEFF";
    public static final String LINE_END = "\r\n";

    private final ReportFileNames fileNames;

    public CsvExporter(ReportFileNames fileNames) {
        this.fileNames = fileNames;
    }

    /**
     * @param surface the view to export
     * @param directory where to write the file; created when missing
     * @return the written file
     * @throws IOException when the file cannot be written
     */
    public Path export(ReportSurface surface, Path directory) throws IOException {
        List<Row> rows = surface.filteredAndSorted();
        Path file = directory.resolve(fileNames.fileName(surface.title(), "csv"));
        Files.createDirectories(directory);
        Files.writeString(file, toCsv(surface.columns(), rows), StandardCharsets.UTF_8);
        logger.info("Exported {} of {} rows of '{}' to {}", rows.size(), surface.totalCount(), surface.title(), file);
        return file;
    }

    public static String toCsv(List<String> columns, List<Row> rows) {
        StringBuilder sb = new StringBuilder(BOM);
        appendRecord(sb, columns);
        for (Row row : rows) {
            appendRecord(sb, row.cells(columns));
        }
        return sb.toString();
    }

    private static void appendRecord(StringBuilder sb, List<String> fields) {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(fields.get(i)));
        }
        sb.append(LINE_END);
    }

    public static String escape(String field) {
        if (field == null) {
            return "";
        }
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\r') < 0
            && field.indexOf('\n') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
