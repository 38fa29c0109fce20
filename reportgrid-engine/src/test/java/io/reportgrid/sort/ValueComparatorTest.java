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


package io.reportgrid.sort;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class ValueComparatorTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "42|42",
        "'1,234,567'|1234567",
        "¥1,200|1200",
        "$9.99|9.99",
        "-€3|-3",
        "85%|85",
        "' 7 '|7",
        "-0.5|-0.5"
    })
    void parsesDecoratedNumbers(String text, String expected) {
        assertThat(ValueComparator.parseNumber(text)).isEqualByComparingTo(new BigDecimal(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "1.2.3", "12a", "$", "%", "2024-01-01", "1e5"})
    void rejectsNonNumbers(String text) {
        assertThat(ValueComparator.parseNumber(text)).isNull();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "2024-02-29|2024-02-29T00:00",
        "2024/02/29|2024-02-29T00:00",
        "2024-02-29 13:05|2024-02-29T13:05",
        "2024/02/29 13:05:09|2024-02-29T13:05:09",
        "2024-02-29T13:05|2024-02-29T13:05"
    })
    void parsesRecognizedDates(String text, String expected) {
        assertThat(ValueComparator.parseDate(text)).isEqualTo(LocalDateTime.parse(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2023-02-29", "29/02/2024", "2024-13-01", "yesterday", "2024-01-01Z"})
    void rejectsOtherDates(String text) {
        assertThat(ValueComparator.parseDate(text)).isNull();
    }

    @Test
    void fallsBackToTextWhenOnlyOneSideIsNumeric() {
        ValueComparator comparator = new ValueComparator(Locale.ENGLISH);

        assertThat(comparator.compare("10", "9")).isPositive();
        assertThat(comparator.compare("10", "abc")).isNegative();
        assertThat(comparator.compare("n/a", "n/a")).isZero();
    }
}
