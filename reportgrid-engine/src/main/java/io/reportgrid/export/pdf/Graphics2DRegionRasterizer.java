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

import io.reportgrid.view.ReportRegion;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Draws the region as a plain table with Java2D: a title line, a shaded header row and
 * one line per row. Columns are as wide as their widest text, up to a limit. The image
 * is clamped to the given size; whatever does not fit is cut off.
 */
public class Graphics2DRegionRasterizer implements RegionRasterizer {
    private static final Logger logger = LogManager.getLogger(Graphics2DRegionRasterizer.class);

    private static final int PADDING = 6;
    private static final int MAX_COLUMN_WIDTH = 320;

    private final Font font;

    public Graphics2DRegionRasterizer() {
        this(new Font(Font.SANS_SERIF, Font.PLAIN, 12));
    }

    public Graphics2DRegionRasterizer(Font font) {
        this.font = font;
    }

    @Override
    public BufferedImage rasterize(ReportRegion region, int maxWidth, int maxHeight) {
        BufferedImage probe = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
        Graphics2D measure = probe.createGraphics();
        measure.setFont(font);
        FontMetrics metrics = measure.getFontMetrics();
        measure.dispose();

        List<String> columns = region.columns();
        int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = metrics.stringWidth(columns.get(c));
            for (List<String> row : region.rows()) {
                widths[c] = Math.max(widths[c], metrics.stringWidth(row.get(c)));
            }
            widths[c] = Math.min(MAX_COLUMN_WIDTH, widths[c]) + 2 * PADDING;
        }
        int lineHeight = metrics.getHeight() + PADDING;
        int naturalWidth = Math.max(200, sum(widths) + 2 * PADDING);
        int naturalHeight = lineHeight * (region.rows().size() + 3);
        int width = Math.min(naturalWidth, maxWidth);
        int height = Math.min(naturalHeight, maxHeight);
        if (width < naturalWidth || height < naturalHeight) {
            logger.warn("Raster of '{}' clamped from {}x{} to {}x{}", region.title(), naturalWidth, naturalHeight,
                width, height);
        }

        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.setFont(font.deriveFont(Font.BOLD, font.getSize2D() + 4));
            g.setColor(Color.BLACK);
            int baseline = lineHeight;
            g.drawString(region.title(), PADDING, baseline);

            g.setFont(font);
            int top = lineHeight + PADDING;
            g.setColor(new Color(0xE8, 0xEE, 0xF7));
            g.fillRect(PADDING, top, sum(widths), lineHeight);
            g.setColor(Color.BLACK);
            drawLine(g, columns, widths, top + metrics.getAscent() + PADDING / 2);
            top += lineHeight;
            for (List<String> row : region.rows()) {
                if (top > height) {
                    break;
                }
                drawLine(g, row, widths, top + metrics.getAscent() + PADDING / 2);
                g.setColor(Color.LIGHT_GRAY);
                g.drawLine(PADDING, top + lineHeight - 1, PADDING + sum(widths), top + lineHeight - 1);
                g.setColor(Color.BLACK);
                top += lineHeight;
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    private static void drawLine(Graphics2D g, List<String> cells, int[] widths, int baseline) {
        int x = PADDING;
        for (int c = 0; c < widths.length; c++) {
            Graphics2D cell = (Graphics2D) g.create(x, 0, widths[c] - PADDING, Integer.MAX_VALUE / 2);
            try {
                cell.drawString(c < cells.size() ? cells.get(c) : "", PADDING, baseline);
            } finally {
                cell.dispose();
            }
            x += widths[c];
        }
    }

    private static int sum(int[] values) {
        int total = 0;
        for (int value : values) {
            total += value;
        }
        return total;
    }
}
