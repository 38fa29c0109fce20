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

import java.util.Objects;

/// The active sort: at most one column and its direction. Immutable.
///
/// Selecting a different column sorts it ascending; selecting the active column again
/// flips its direction.
public final class SortState {

    private static final SortState NONE = new SortState(null, SortDirection.ASCENDING);

    private final String column;
    private final SortDirection direction;

    private SortState(String column, SortDirection direction) {
        this.column = column;
        this.direction = direction;
    }

    public static SortState none() {
        return NONE;
    }

    public static SortState of(String column, SortDirection direction) {
        if (column == null) {
            return NONE;
        }
        return new SortState(column, Objects.requireNonNull(direction, "direction"));
    }

    /// @return the active column, or null when nothing is sorted
    public String column() {
        return column;
    }

    public SortDirection direction() {
        return direction;
    }

    public boolean isActive() {
        return column != null;
    }

    /// @param selected the column whose header was selected
    /// @return the state after the selection
    public SortState toggle(String selected) {
        if (selected.equals(column)) {
            return new SortState(column, direction.flip());
        }
        return new SortState(selected, SortDirection.ASCENDING);
    }

    public SortIndicator indicatorFor(String candidate) {
        if (column == null || !column.equals(candidate)) {
            return SortIndicator.NEUTRAL;
        }
        return direction == SortDirection.ASCENDING ? SortIndicator.ASCENDING : SortIndicator.DESCENDING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SortState other)) {
            return false;
        }
        return Objects.equals(column, other.column) && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, direction);
    }

    @Override
    public String toString() {
        return column == null ? "SortState{none}" : "SortState{" + column + " " + direction + "}";
    }
}
