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

import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Everything a report view and its exporters can be tuned with. Loaded by
/// {@link ConfigLoader}; {@link #defaults()} matches the bundled defaults file.
///
/// @param locale collation locale for sorting text
/// @param zone zone of export timestamps
/// @param debounce quiet period before a typed search term is applied
/// @param suggestionLimit most search suggestions offered
/// @param pageSize initial page size
/// @param pageSizeChoices sizes offered by the page-size selector
/// @param lifetimes how long each kind of notification stays up
/// @param fallbackStem file name stem for titles no keyword matches
/// @param pdf PDF export settings
public record EngineConfig(
    Locale locale,
    ZoneId zone,
    Duration debounce,
    int suggestionLimit,
    int pageSize,
    List<Integer> pageSizeChoices,
    Map<NotificationKind, Duration> lifetimes,
    String fallbackStem,
    PdfSettings pdf
) {

    public EngineConfig {
        if (debounce == null || debounce.isNegative()) {
            throw new IllegalArgumentException("debounce-ms must not be negative, got " + debounce);
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("page-size must be positive, got " + pageSize);
        }
        pageSizeChoices = List.copyOf(pageSizeChoices);
        for (Integer choice : pageSizeChoices) {
            if (choice <= 0) {
                throw new IllegalArgumentException("page-size-choices must be positive, got " + pageSizeChoices);
            }
        }
        EnumMap<NotificationKind, Duration> copied = new EnumMap<>(NotificationKind.class);
        for (NotificationKind kind : NotificationKind.values()) {
            copied.put(kind, lifetimes.getOrDefault(kind, kind.getDefaultLifetime()));
        }
        lifetimes = Map.copyOf(copied);
        if (fallbackStem == null || !fallbackStem.matches("[A-Za-z0-9_-]+")) {
            throw new IllegalArgumentException("fallback-stem must only use A-Z, a-z, 0-9, '_' and '-', got '"
                + fallbackStem + "'");
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(Locale.JAPANESE, ZoneId.of("Asia/Tokyo"), Duration.ofMillis(300), 10, 50,
            List.of(10, 25, 50, 100), Map.of(), "Microsoft365_Report", PdfSettings.defaults());
    }

    public EngineConfig withPdf(PdfSettings settings) {
        return new EngineConfig(locale, zone, debounce, suggestionLimit, pageSize, pageSizeChoices, lifetimes,
            fallbackStem, settings);
    }

    public EngineConfig withZone(ZoneId newZone) {
        return new EngineConfig(locale, newZone, debounce, suggestionLimit, pageSize, pageSizeChoices, lifetimes,
            fallbackStem, pdf);
    }
}
