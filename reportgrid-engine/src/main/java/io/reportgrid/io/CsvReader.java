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

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads RFC 4180 comma separated text: fields may be quoted, quotes inside quoted
 * fields are doubled, and quoted fields may span lines. Records end with CRLF or LF.
 * A leading UTF-8 byte-order mark is skipped.
 */
public final class CsvReader {

    private static final char BOM = '\uFEFF';

    private CsvReader() {
    }

    public static List<List<String>> parse(String text) {
        try {
            return read(new StringReader(text));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @param reader the text to read; not closed
     * @return the records, each a list of field values
     * @throws IOException when reading fails
     * @throws IllegalArgumentException when a quoted field is not closed
     */
    public static List<List<String>> read(Reader reader) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> record = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldStarted = false;
        boolean first = true;
        int line = 1;

        PushbackReader in = new PushbackReader(reader, 1);
        int c;
        while ((c = in.read()) != -1) {
            char ch = (char) c;
            if (first) {
                first = false;
                if (ch == BOM) {
                    continue;
                }
            }
            if (quoted) {
                if (ch == '"') {
                    int next = in.read();
                    if (next == '"') {
                        field.append('"');
                    } else {
                        quoted = false;
                        if (next != -1) {
                            in.unread(next);
                        }
                    }
                } else {
                    if (ch == '\n') {
                        line++;
                    }
                    field.append(ch);
                }
                continue;
            }
            switch (ch) {
                case '"':
                    if (field.length() == 0) {
                        quoted = true;
                        fieldStarted = true;
                    } else {
                        field.append(ch);
                    }
                    break;
                case ',':
                    record.add(field.toString());
                    field.setLength(0);
                    fieldStarted = true;
                    break;
                case '\r':
                    break;
                case '\n':
                    line++;
                    record.add(field.toString());
                    records.add(record);
                    record = new ArrayList<>();
                    field.setLength(0);
                    fieldStarted = false;
                    break;
                default:
                    field.append(ch);
                    fieldStarted = true;
            }
        }
        if (quoted) {
            throw new IllegalArgumentException("unterminated quoted field at line " + line);
        }
        if (fieldStarted || field.length() > 0 || !record.isEmpty()) {
            record.add(field.toString());
            records.add(record);
        }
        return records;
    }
}
