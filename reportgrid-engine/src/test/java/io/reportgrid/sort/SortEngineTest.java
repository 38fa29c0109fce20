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

import io.reportgrid.ReportFixtures;
import io.reportgrid.model.ReportTable;
import io.reportgrid.model.Row;
import io.reportgrid.model.RowModel;
import io.reportgrid.model.RowModelBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import static io.reportgrid.ReportFixtures.values;
import static org.assertj.core.api.Assertions.*;

@DisplayName("SortEngine")
class SortEngineTest {

    private static SortEngine engineFor(RowModel model) {
        return new SortEngine(model.columns(), Locale.JAPANESE);
    }

    @Nested
    @DisplayName("numeric columns")
    class Numeric {

        @Test
        @DisplayName("should compare numbers by value and keep ties in original order")
        void shouldSortScoresNumerically() {
            RowModel model = RowModelBuilder.build(ReportFixtures.scores());

            List<Row> sorted = engineFor(model).sortTable(model.rows(), "Score");

            assertThat(values(sorted, "Name")).containsExactly("amy", "Amy", "Bob");
            assertThat(values(sorted, "Score")).containsExactly("2", "2", "10");
        }

        @Test
        @DisplayName("should ignore thousands separators, currency signs and percent signs")
        void shouldParseDecoratedNumbers() {
            RowModel model = RowModelBuilder.build(ReportTable.of("t", "Cost")
                .withRow("¥1,200")
                .withRow("$950")
                .withRow("12,000")
                .withRow("-5")
                .withRow("15%"));

            List<Row> sorted = engineFor(model).sortTable(model.rows(), "Cost");

            assertThat(values(sorted, "Cost")).containsExactly("-5", "15%", "$950", "¥1,200", "12,000");
        }
    }

    @Nested
    @DisplayName("date and text columns")
    class DatesAndText {

        @Test
        @DisplayName("should order dates chronologically across recognized patterns")
        void shouldSortDates() {
            RowModel model = RowModelBuilder.build(ReportTable.of("t", "LastSignIn")
                .withRow("2024/03/01 09:00")
                .withRow("2023-12-31")
                .withRow("2024-03-01T08:30:00")
                .withRow("2024-01-15 23:59:59"));

            List<Row> sorted = engineFor(model).sortTable(model.rows(), "LastSignIn");

            assertThat(values(sorted, "LastSignIn")).containsExactly(
                "2023-12-31", "2024-01-15 23:59:59", "2024-03-01T08:30:00", "2024/03/01 09:00");
        }

        @Test
        @DisplayName("should collate text that is neither number nor date")
        void shouldCollateText() {
            RowModel model = RowModelBuilder.build(ReportTable.of("t", "Name")
                .withRow("charlie")
                .withRow("Bob")
                .withRow("alice"));

            List<Row> sorted = engineFor(model).sortTable(model.rows(), "Name");

            assertThat(values(sorted, "Name")).containsExactly("alice", "Bob", "charlie");
        }
    }

    @Nested
    @DisplayName("toggling")
    class Toggling {

        @Test
        @DisplayName("should sort ascending first and descending on the second selection")
        void shouldToggle() {
            RowModel model = RowModelBuilder.build(ReportFixtures.users(12));
            SortEngine engine = engineFor(model);

            List<Row> ascending = engine.sortTable(model.rows(), "Score");
            assertThat(engine.getState()).isEqualTo(SortState.of("Score", SortDirection.ASCENDING));
            assertThat(values(ascending, "Score")).isSortedAccordingTo(
                (a, b) -> Integer.compare(Integer.parseInt(a), Integer.parseInt(b)));

            List<Row> descending = engine.sortTable(model.rows(), "Score");
            assertThat(engine.getState()).isEqualTo(SortState.of("Score", SortDirection.DESCENDING));
            assertThat(values(descending, "Score")).isSortedAccordingTo(
                (a, b) -> Integer.compare(Integer.parseInt(b), Integer.parseInt(a)));
        }

        @Test
        @DisplayName("should start ascending when switching columns")
        void shouldResetDirectionOnNewColumn() {
            RowModel model = RowModelBuilder.build(ReportFixtures.users(5));
            SortEngine engine = engineFor(model);
            engine.sortTable(model.rows(), "Score");
            engine.sortTable(model.rows(), "Score");

            engine.sortTable(model.rows(), "Name");

            assertThat(engine.getState()).isEqualTo(SortState.of("Name", SortDirection.ASCENDING));
        }

        @Test
        @DisplayName("should keep original order among equal values in both directions")
        void shouldBeStable() {
            RowModel model = RowModelBuilder.build(ReportFixtures.users(30));
            SortEngine engine = engineFor(model);

            List<Row> ascending = engine.sortTable(model.rows(), "Dept");
            List<Row> descending = engine.sortTable(model.rows(), "Dept");

            for (List<Row> sorted : List.of(ascending, descending)) {
                for (String dept : List.of("Sales", "Ops", "Dev")) {
                    assertThat(sorted.stream().filter(r -> r.value("Dept").equals(dept)).map(Row::index))
                        .isSorted();
                }
            }
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should leave rows and state alone for an unknown column")
        void shouldIgnoreUnknownColumn() {
            RowModel model = RowModelBuilder.build(ReportFixtures.scores());
            SortEngine engine = engineFor(model);

            List<Row> result = engine.sortTable(model.rows(), "Missing");

            assertThat(result).isSameAs(model.rows());
            assertThat(engine.getState().isActive()).isFalse();
        }

        @Test
        @DisplayName("should not throw for columns mixing numbers, dates and text")
        void shouldTolerateMixedColumns() {
            ReportTable table = ReportTable.of("t", "Mixed");
            for (int i = 0; i < 200; i++) {
                table = table.withRow(switch (i % 4) {
                    case 0 -> String.valueOf(i);
                    case 1 -> "2024-01-" + String.format("%02d", i % 28 + 1);
                    case 2 -> "x" + i;
                    default -> "";
                });
            }
            RowModel model = RowModelBuilder.build(table);

            List<Row> sorted = engineFor(model).sortTable(model.rows(), "Mixed");

            assertThat(sorted).hasSize(200).containsExactlyInAnyOrderElementsOf(model.rows());
        }
    }

    @Test
    @DisplayName("should re-apply the current state to freshly filtered rows")
    void shouldApplyCurrentState() {
        RowModel model = RowModelBuilder.build(ReportFixtures.scores());
        SortEngine engine = engineFor(model);
        engine.sortTable(model.rows(), "Score");
        engine.sortTable(model.rows(), "Score");

        List<Row> subset = List.of(model.rows().get(1), model.rows().get(0));
        assertThat(values(engine.apply(subset), "Name")).containsExactly("Bob", "amy");
    }

    @Nested
    @DisplayName("inconsistent values")
    class Inconsistent {

        private boolean failing;

        private SortEngine engine(RowModel model) {
            return new SortEngine(model.columns(), Locale.JAPANESE) {
                @Override
                <T> void sortInPlace(List<T> items, Comparator<? super T> order) {
                    if (failing) {
                        throw new IllegalArgumentException("Comparison method violates its general contract!");
                    }
                    super.sortInPlace(items, order);
                }
            };
        }

        @Test
        @DisplayName("should leave rows and sort state alone when the first sort cannot order the values")
        void shouldKeepNoSort() {
            RowModel model = RowModelBuilder.build(ReportFixtures.scores());
            SortEngine engine = engine(model);
            failing = true;

            List<Row> result = engine.sortTable(model.rows(), "Score");

            assertThat(result).isSameAs(model.rows());
            assertThat(engine.getState().isActive()).isFalse();
        }

        @Test
        @DisplayName("should keep the previous direction when flipping cannot order the values")
        void shouldKeepPreviousDirection() {
            RowModel model = RowModelBuilder.build(ReportFixtures.scores());
            SortEngine engine = engine(model);
            List<Row> ascending = engine.sortTable(model.rows(), "Score");
            failing = true;

            List<Row> result = engine.sortTable(ascending, "Score");

            assertThat(result).isSameAs(ascending);
            assertThat(engine.getState()).isEqualTo(SortState.of("Score", SortDirection.ASCENDING));
        }
    }
}
