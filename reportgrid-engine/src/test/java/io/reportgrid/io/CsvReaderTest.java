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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CsvReaderTest {

    @Test
    void readsQuotedFieldsWithEmbeddedDelimitersQuotesAndLineBreaks() {
        List<List<String>> records = CsvReader.parse("Name,Note\r\n\"Doe, Jane\",\"said \"\"hi\"\"\r\nthen left\"\r\n");

        assertThat(records).containsExactly(
            List.of("Name", "Note"),
            List.of("Doe, Jane", "said \"hi\"\r\nthen left"));
    }

    @Test
    void skipsTheByteOrderMarkAndAcceptsBareLineFeeds() {
        List<List<String>> records = CsvReader.parse("\uFEFFa,b\n1,2");

        assertThat(records).containsExactly(List.of("a", "b"), List.of("1", "2"));
    }

    @Test
    void keepsEmptyFields() {
        assertThat(CsvReader.parse(",x,\n")).containsExactly(List.of("", "x", ""));
        assertThat(CsvReader.parse("\"\"\n")).containsExactly(List.of(""));
    }

    @Test
    void rejectsUnterminatedQuotes() {
        assertThatThrownBy(() -> CsvReader.parse("a,\"b\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unterminated");
    }
}
