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

import java.awt.image.BufferedImage;

/**
 * Draws a captured report region into a single image for the raster tier.
 */
@FunctionalInterface
public interface RegionRasterizer {

    /**
     * @param region the captured rows
     * @param maxWidth widest image allowed, in pixels
     * @param maxHeight tallest image allowed, in pixels
     * @return an RGB image no larger than the limits
     */
    BufferedImage rasterize(ReportRegion region, int maxWidth, int maxHeight);
}
