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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads {@link EngineConfig} from YAML. The bundled {@value #DEFAULTS_RESOURCE} is
 * always read first; an override file only needs to contain the keys it changes.
 * Nested sections are merged key by key, lists and scalars are replaced.
 *
 * <p>Unreadable files and invalid values are reported as
 * {@link UncheckedIOException} and {@link IllegalArgumentException} naming the
 * offending file or key.</p>
 */
public final class ConfigLoader {
    private static final Logger logger = LogManager.getLogger(ConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "reportgrid-defaults.yaml";

    private ConfigLoader() {
    }

    public static EngineConfig loadDefaults() {
        return fromMap(readDefaults());
    }

    /**
     * @param override a YAML file with keys to change, or null for the defaults alone
     * @return the merged configuration
     */
    public static EngineConfig load(Path override) {
        Map<String, Object> merged = readDefaults();
        if (override != null) {
            if (!Files.isRegularFile(override)) {
                throw new IllegalArgumentException("config file " + override + " does not exist");
            }
            try {
                merge(merged, parse(Files.readString(override, StandardCharsets.UTF_8), override.toString()));
            } catch (IOException e) {
                throw new UncheckedIOException("could not read config file " + override, e);
            }
            logger.debug("Merged configuration overrides from {}", override);
        }
        return fromMap(merged);
    }

    /**
     * @param yaml configuration text, merged over the defaults
     * @return the merged configuration
     */
    public static EngineConfig loadFromString(String yaml) {
        Map<String, Object> merged = readDefaults();
        merge(merged, parse(yaml, "<string>"));
        return fromMap(merged);
    }

    private static Map<String, Object> readDefaults() {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("{} is not on the classpath, using built-in defaults", DEFAULTS_RESOURCE);
                return new LinkedHashMap<>();
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + DEFAULTS_RESOURCE, e);
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> parse(String yaml, String source) {
        LoadSettings loadSettings = LoadSettings.builder().setLabel(source).build();
        Load load = new Load(loadSettings);
        Object loaded;
        try {
            loaded = load.loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException("invalid YAML in " + source + ": " + e.getMessage(), e);
        }
        if (loaded == null) {
            return new LinkedHashMap<>();
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(source + " must contain a mapping at the top level");
        }
        return new LinkedHashMap<>((Map<String, Object>) map);
    }

    @SuppressWarnings("unchecked")
    static void merge(Map<String, Object> base, Map<String, Object> overrides) {
        overrides.forEach((key, value) -> {
            Object existing = base.get(key);
            if (existing instanceof Map<?, ?> existingMap && value instanceof Map<?, ?> valueMap) {
                Map<String, Object> nested = new LinkedHashMap<>((Map<String, Object>) existingMap);
                merge(nested, (Map<String, Object>) valueMap);
                base.put(key, nested);
            } else {
                base.put(key, value);
            }
        });
    }

    static EngineConfig fromMap(Map<String, Object> root) {
        EngineConfig defaults = EngineConfig.defaults();
        Section top = new Section("", root);
        Section search = top.section("search");
        Section paging = top.section("paging");
        Section notifications = top.section("notifications");
        Section export = top.section("export");

        Map<NotificationKind, Duration> lifetimes = new EnumMap<>(NotificationKind.class);
        lifetimes.put(NotificationKind.SUCCESS, Duration.ofSeconds(notifications.getLong("success-seconds", 5)));
        lifetimes.put(NotificationKind.INFO, Duration.ofSeconds(notifications.getLong("info-seconds", 5)));
        lifetimes.put(NotificationKind.ERROR, Duration.ofSeconds(notifications.getLong("error-seconds", 8)));

        return new EngineConfig(
            Locale.forLanguageTag(top.getString("locale", defaults.locale().toLanguageTag())),
            top.getZone("zone", defaults.zone()),
            Duration.ofMillis(search.getLong("debounce-ms", defaults.debounce().toMillis())),
            (int) search.getLong("suggestion-limit", defaults.suggestionLimit()),
            (int) paging.getLong("page-size", defaults.pageSize()),
            paging.getIntList("page-size-choices", defaults.pageSizeChoices()),
            lifetimes,
            export.getString("fallback-stem", defaults.fallbackStem()),
            pdfSettings(export.section("pdf"), defaults.pdf())
        );
    }

    private static PdfSettings pdfSettings(Section pdf, PdfSettings defaults) {
        List<Long> thresholds = new ArrayList<>();
        for (Integer megabytes : pdf.getIntList("quality-thresholds-mb", List.of(10, 20))) {
            thresholds.add(megabytes * 1_000_000L);
        }
        return new PdfSettings(
            pdf.getBoolean("landscape", defaults.landscape()),
            pdf.getString("font-path", ""),
            Duration.ofMillis(pdf.getLong("font-timeout-ms", defaults.fontTimeout().toMillis())),
            Duration.ofMillis(pdf.getLong("settle-delay-ms", defaults.settleDelay().toMillis())),
            (float) pdf.getDouble("margin-points", defaults.marginPoints()),
            (float) pdf.getDouble("font-size", defaults.fontSize()),
            (int) pdf.getLong("max-pages", defaults.maxPages()),
            (int) pdf.getLong("max-canvas-width", defaults.maxCanvasWidth()),
            (int) pdf.getLong("max-canvas-height", defaults.maxCanvasHeight()),
            pdf.getFloatList("jpeg-qualities", defaults.jpegQualities()),
            thresholds,
            (int) pdf.getLong("min-plausible-bytes", defaults.minPlausibleBytes())
        );
    }

    /** Typed, path-aware access to one mapping of the YAML tree. */
    private static final class Section {
        private final String path;
        private final Map<?, ?> values;

        private Section(String path, Map<?, ?> values) {
            this.path = path;
            this.values = values;
        }

        Section section(String key) {
            Object value = values.get(key);
            if (value == null) {
                return new Section(qualify(key), Map.of());
            }
            if (!(value instanceof Map<?, ?> map)) {
                throw invalid(key, "a mapping", value);
            }
            return new Section(qualify(key), map);
        }

        String getString(String key, String fallback) {
            Object value = values.get(key);
            return value == null ? fallback : value.toString();
        }

        boolean getBoolean(String key, boolean fallback) {
            Object value = values.get(key);
            if (value == null) {
                return fallback;
            }
            if (!(value instanceof Boolean b)) {
                throw invalid(key, "true or false", value);
            }
            return b;
        }

        long getLong(String key, long fallback) {
            Object value = values.get(key);
            if (value == null) {
                return fallback;
            }
            if (!(value instanceof Number n) || n.doubleValue() != n.longValue()) {
                throw invalid(key, "a whole number", value);
            }
            return n.longValue();
        }

        double getDouble(String key, double fallback) {
            Object value = values.get(key);
            if (value == null) {
                return fallback;
            }
            if (!(value instanceof Number n)) {
                throw invalid(key, "a number", value);
            }
            return n.doubleValue();
        }

        ZoneId getZone(String key, ZoneId fallback) {
            Object value = values.get(key);
            if (value == null) {
                return fallback;
            }
            try {
                return ZoneId.of(value.toString());
            } catch (DateTimeException e) {
                throw invalid(key, "a time zone id", value);
            }
        }

        List<Integer> getIntList(String key, List<Integer> fallback) {
            List<Integer> result = new ArrayList<>();
            for (Number n : numbers(key)) {
                result.add(n.intValue());
            }
            return result.isEmpty() && !values.containsKey(key) ? fallback : result;
        }

        List<Float> getFloatList(String key, List<Float> fallback) {
            List<Float> result = new ArrayList<>();
            for (Number n : numbers(key)) {
                result.add(n.floatValue());
            }
            return result.isEmpty() && !values.containsKey(key) ? fallback : result;
        }

        private List<Number> numbers(String key) {
            Object value = values.get(key);
            if (value == null) {
                return List.of();
            }
            if (!(value instanceof List<?> list)) {
                throw invalid(key, "a list of numbers", value);
            }
            List<Number> numbers = new ArrayList<>();
            for (Object element : list) {
                if (!(element instanceof Number n)) {
                    throw invalid(key, "a list of numbers", value);
                }
                numbers.add(n);
            }
            return numbers;
        }

        private String qualify(String key) {
            return path.isEmpty() ? key : path + "." + key;
        }

        private IllegalArgumentException invalid(String key, String expected, Object actual) {
            return new IllegalArgumentException("config key '" + qualify(key) + "' must be " + expected
                + ", got '" + actual + "'");
        }
    }
}
