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

import java.time.Duration;
import java.util.List;

/// Settings of the PDF export tiers.
///
/// @param landscape whether pages are A4 landscape rather than portrait
/// @param fontPath a TrueType font to embed, or null for the standard fonts
/// @param fontTimeout how long the document tier waits for the font to load
/// @param settleDelay pause between showing all rows and capturing them
/// @param marginPoints page margin in PDF points
/// @param fontSize body text size in PDF points
/// @param maxPages most pages the raster tier produces
/// @param maxCanvasWidth widest raster the raster tier draws, in pixels
/// @param maxCanvasHeight tallest raster the raster tier draws, in pixels
/// @param jpegQualities JPEG qualities tried in order, highest first
/// @param qualityThresholds encoded sizes in bytes above which the next quality is tried
/// @param minPlausibleBytes documents smaller than this get a diagnostic page
public record PdfSettings(
    boolean landscape,
    String fontPath,
    Duration fontTimeout,
    Duration settleDelay,
    float marginPoints,
    float fontSize,
    int maxPages,
    int maxCanvasWidth,
    int maxCanvasHeight,
    List<Float> jpegQualities,
    List<Long> qualityThresholds,
    int minPlausibleBytes
) {

    private static final long MB = 1_000_000L;

    public PdfSettings {
        if (fontPath != null && fontPath.isBlank()) {
            fontPath = null;
        }
        requireNonNegative("font-timeout-ms", fontTimeout);
        requireNonNegative("settle-delay-ms", settleDelay);
        if (maxPages < 1) {
            throw new IllegalArgumentException("max-pages must be at least 1, got " + maxPages);
        }
        if (maxCanvasWidth < 1 || maxCanvasHeight < 1) {
            throw new IllegalArgumentException("canvas limits must be positive, got "
                + maxCanvasWidth + "x" + maxCanvasHeight);
        }
        if (marginPoints < 0 || fontSize <= 0) {
            throw new IllegalArgumentException("invalid margin " + marginPoints + " or font size " + fontSize);
        }
        jpegQualities = List.copyOf(jpegQualities);
        qualityThresholds = List.copyOf(qualityThresholds);
        if (jpegQualities.isEmpty()) {
            throw new IllegalArgumentException("jpeg-qualities must not be empty");
        }
        for (Float quality : jpegQualities) {
            if (quality <= 0f || quality > 1f) {
                throw new IllegalArgumentException("jpeg quality must be in (0, 1], got " + quality);
            }
        }
        if (qualityThresholds.size() != jpegQualities.size() - 1) {
            throw new IllegalArgumentException("need one quality threshold between each pair of jpeg qualities, got "
                + qualityThresholds + " for " + jpegQualities);
        }
    }

    public static PdfSettings defaults() {
        return new PdfSettings(true, null, Duration.ofSeconds(1), Duration.ofMillis(500), 28f, 8f, 10,
            4096, 4096, List.of(0.8f, 0.5f, 0.3f), List.of(10 * MB, 20 * MB), 1000);
    }

    public PdfSettings withFontPath(String path) {
        return new PdfSettings(landscape, path, fontTimeout, settleDelay, marginPoints, fontSize, maxPages,
            maxCanvasWidth, maxCanvasHeight, jpegQualities, qualityThresholds, minPlausibleBytes);
    }

    public PdfSettings withDelays(Duration fontTimeout, Duration settleDelay) {
        return new PdfSettings(landscape, fontPath, fontTimeout, settleDelay, marginPoints, fontSize, maxPages,
            maxCanvasWidth, maxCanvasHeight, jpegQualities, qualityThresholds, minPlausibleBytes);
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
    }
}
