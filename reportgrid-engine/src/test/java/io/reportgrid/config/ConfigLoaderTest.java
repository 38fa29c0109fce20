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


package io.reportgrid.config;

import io.reportgrid.notify.NotificationKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    @Test
    @DisplayName("should read the bundled defaults")
    void shouldReadDefaults() {
        EngineConfig config = ConfigLoader.loadDefaults();

        assertThat(config).isEqualTo(EngineConfig.defaults());
        assertThat(config.locale()).isEqualTo(Locale.JAPANESE);
        assertThat(config.pageSizeChoices()).containsExactly(10, 25, 50, 100);
        assertThat(config.lifetimes()).containsEntry(NotificationKind.ERROR, Duration.ofSeconds(8));
        assertThat(config.pdf().qualityThresholds()).containsExactly(10_000_000L, 20_000_000L);
        assertThat(config.pdf().fontPath()).isNull();
    }

    @Test
    @DisplayName("should merge an override file key by key")
    void shouldMergeOverrides(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("reportgrid.yaml");
        Files.writeString(file, String.join("\n",
            "locale: en-US",
            "zone: UTC",
            "paging:",
            "  page-size: 25",
            "export:",
            "  pdf:",
            "    landscape: false",
            "    max-pages: 3",
            ""));

        EngineConfig config = ConfigLoader.load(file);

        assertThat(config.locale()).isEqualTo(Locale.US);
        assertThat(config.zone()).isEqualTo(ZoneId.of("UTC"));
        assertThat(config.pageSize()).isEqualTo(25);
        assertThat(config.pageSizeChoices()).containsExactly(10, 25, 50, 100);
        assertThat(config.pdf().landscape()).isFalse();
        assertThat(config.pdf().maxPages()).isEqualTo(3);
        assertThat(config.pdf().settleDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.fallbackStem()).isEqualTo("Microsoft365_Report");
    }

    @Test
    @DisplayName("should name the offending key for a wrong type")
    void shouldReportInvalidValue() {
        assertThatThrownBy(() -> ConfigLoader.loadFromString("search:\n  debounce-ms: soon\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("search.debounce-ms");
    }

    @Test
    @DisplayName("should reject settings the records do not allow")
    void shouldValidateRecords() {
        assertThatThrownBy(() -> ConfigLoader.loadFromString("export:\n  pdf:\n    jpeg-qualities: [0.9]\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("quality threshold");
        assertThatThrownBy(() -> ConfigLoader.loadFromString("export:\n  fallback-stem: 'bad name'\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("fallback-stem");
    }

    @Test
    @DisplayName("should report a missing override file")
    void shouldReportMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> ConfigLoader.load(dir.resolve("absent.yaml")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("absent.yaml");
    }

    @Test
    @DisplayName("should merge nested maps without dropping sibling keys")
    void shouldMergeNested() {
        Map<String, Object> base = ConfigLoader.parse("a:\n  b: 1\n  c: 2\nd: [1, 2]\n", "base");
        ConfigLoader.merge(base, ConfigLoader.parse("a:\n  c: 3\nd: [9]\n", "override"));

        assertThat(base.get("a")).isEqualTo(Map.of("b", 1, "c", 3));
        assertThat(base.get("d")).isEqualTo(List.of(9));
    }
}
