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


package io.reportgrid.export.pdf;

import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;

/**
 * Makes text safe to show with a given PDF font. Characters the font cannot encode are
 * replaced with {@code ?} and control characters with spaces, so odd cell values never
 * abort an export.
 */
final class PdfText {

    static final String REPLACEMENT = "?";
    static final String ELLIPSIS = "...";

    private PdfText() {
    }

    static String sanitize(String text, PDFont font) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            if (Character.isISOControl(cp)) {
                sb.append(' ');
                return;
            }
            String ch = new String(Character.toChars(cp));
            sb.append(canEncode(font, ch) ? ch : REPLACEMENT);
        });
        return sb.toString();
    }

    /**
     * @return true when every character of {@code text} is a control character or one
     * the font can encode, so {@link #sanitize} would replace nothing
     */
    static boolean canShow(String text, PDFont font) {
        if (text == null || text.isEmpty()) {
            return true;
        }
        return text.codePoints()
            .allMatch(cp -> Character.isISOControl(cp) || canEncode(font, new String(Character.toChars(cp))));
    }

    /**
     * @return the sanitized text, cut and ended with {@value #ELLIPSIS} when wider than
     * {@code maxWidth} points
     */
    static String fit(String text, PDFont font, float fontSize, float maxWidth) throws IOException {
        String safe = sanitize(text, font);
        if (width(safe, font, fontSize) <= maxWidth) {
            return safe;
        }
        float ellipsisWidth = width(ELLIPSIS, font, fontSize);
        int end = safe.length();
        while (end > 0 && width(safe.substring(0, end), font, fontSize) + ellipsisWidth > maxWidth) {
            end = safe.offsetByCodePoints(end, -1);
        }
        return end == 0 ? "" : safe.substring(0, end) + ELLIPSIS;
    }

    static float width(String text, PDFont font, float fontSize) throws IOException {
        return font.getStringWidth(text) / 1000f * fontSize;
    }

    private static boolean canEncode(PDFont font, String ch) {
        try {
            font.encode(ch);
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }
}
