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

import java.math.BigDecimal;
import java.text.CollationKey;
import java.text.Collator;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Compares display values the way a reader expects, deciding per pair:
 * <ol>
 *   <li>both numeric: by numeric value. Thousands separators are ignored, as are a
 *       leading currency sign and a trailing percent sign.</li>
 *   <li>both dates in one of the recognized patterns: chronologically</li>
 *   <li>otherwise: by locale-aware collation</li>
 * </ol>
 *
 * <p>Values that cannot be read as numbers or dates fall through to text comparison;
 * nothing here throws for odd data. Each instance owns its own {@link Collator}, so an
 * instance must not be shared between threads.</p>
 */
public final class ValueComparator implements Comparator<String> {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d+)?|\\.\\d+)");
    private static final String CURRENCY_SIGNS = "¥$€£￥";

    private static final List<DateTimeFormatter> DATE_TIMES = List.of(
        strict("uuuu-MM-dd HH:mm:ss"),
        strict("uuuu-MM-dd HH:mm"),
        strict("uuuu/MM/dd HH:mm:ss"),
        strict("uuuu/MM/dd HH:mm"),
        strict("uuuu-MM-dd'T'HH:mm:ss"),
        strict("uuuu-MM-dd'T'HH:mm")
    );
    private static final List<DateTimeFormatter> DATES = List.of(
        strict("uuuu-MM-dd"),
        strict("uuuu/MM/dd")
    );

    private final Collator collator;

    public ValueComparator(Locale locale) {
        this.collator = (Collator) Collator.getInstance(locale).clone();
    }

    @Override
    public int compare(String left, String right) {
        return compareKeys(key(left), key(right));
    }

    /**
     * Pre-parses a value once so that sorting n rows parses n values instead of
     * n log n pairs.
     */
    Key key(String value) {
        String raw = value == null ? "" : value;
        return new Key(parseNumber(raw), parseDate(raw), collator.getCollationKey(raw));
    }

    int compareKeys(Key left, Key right) {
        if (left.number != null && right.number != null) {
            return left.number.compareTo(right.number);
        }
        if (left.date != null && right.date != null) {
            return left.date.compareTo(right.date);
        }
        return left.text.compareTo(right.text);
    }

    /**
     * @return the numeric value, or null when the text is not a number
     */
    static BigDecimal parseNumber(String value) {
        String text = value.trim().replace(",", "");
        if (text.isEmpty()) {
            return null;
        }
        boolean negative = false;
        if (text.charAt(0) == '-' && text.length() > 1 && CURRENCY_SIGNS.indexOf(text.charAt(1)) >= 0) {
            negative = true;
            text = text.substring(1);
        }
        if (CURRENCY_SIGNS.indexOf(text.charAt(0)) >= 0) {
            text = text.substring(1).trim();
        }
        if (text.endsWith("%")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        if (!NUMBER.matcher(text).matches()) {
            return null;
        }
        BigDecimal number = new BigDecimal(text);
        return negative ? number.negate() : number;
    }

    /**
     * @return the point in time, or null when the text is not a recognized date
     */
    static LocalDateTime parseDate(String value) {
        String text = value.trim();
        if (text.length() < 10 || !Character.isDigit(text.charAt(0))) {
            return null;
        }
        for (DateTimeFormatter format : DATE_TIMES) {
            try {
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // try the next pattern
            }
        }
        for (DateTimeFormatter format : DATES) {
            try {
                return LocalDate.parse(text, format).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                // try the next pattern
            }
        }
        return null;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    static final class Key {
        private final BigDecimal number;
        private final LocalDateTime date;
        private final CollationKey text;

        private Key(BigDecimal number, LocalDateTime date, CollationKey text) {
            this.number = number;
            this.date = date;
            this.text = text;
        }
    }
}
