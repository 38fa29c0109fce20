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

/**
 * What a column header shows about sorting. Exactly one column at a time shows
 * {@link #ASCENDING} or {@link #DESCENDING}; all others show {@link #NEUTRAL}.
 */
public enum SortIndicator {
    NEUTRAL("⇅"),
    ASCENDING("▲"),
    DESCENDING("▼");

    private final String glyph;

    SortIndicator(String glyph) {
        this.glyph = glyph;
    }

    public String getGlyph() {
        return glyph;
    }
}
