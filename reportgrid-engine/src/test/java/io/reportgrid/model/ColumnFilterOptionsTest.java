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

import io.reportgrid.ReportFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnFilterOptionsTest {

    @Test
    void offersSelectsOnlyForLowCardinalityColumns() {
        ColumnFilterOptions options = ColumnFilterOptions.of(RowModelBuilder.build(ReportFixtures.users(30)));

        assertThat(options.hasSelect("Dept")).isTrue();
        assertThat(options.choicesFor("Dept")).containsExactly("Dev", "Ops", "Sales");
        assertThat(options.hasSelect("Id")).isFalse();
        assertThat(options.hasSelect("Name")).isFalse();
        assertThat(options.choicesFor("Name")).isEmpty();
    }

    @Test
    void skipsColumnsWithASingleValueAndEmptyCells() {
        RowModel model = RowModelBuilder.build(ReportTable.of("t", "Licensed", "Note")
            .withRow("yes", "")
            .withRow("yes", "")
            .withRow("yes", "checked"));

        ColumnFilterOptions options = ColumnFilterOptions.of(model);
        assertThat(options.choices()).isEmpty();
    }
}
