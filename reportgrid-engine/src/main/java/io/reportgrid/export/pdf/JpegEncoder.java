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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * Encodes raster images as JPEG, lowering the quality step by step while the encoded
 * size stays above the configured thresholds.
 */
public class JpegEncoder {
    private static final Logger logger = LogManager.getLogger(JpegEncoder.class);

    /// @param bytes the encoded image
    /// @param quality the quality it was encoded with
    public record Encoded(byte[] bytes, float quality) {
    }

    public static boolean isAvailable() {
        return ImageIO.getImageWritersByFormatName("jpeg").hasNext();
    }

    /**
     * @param image the image to encode
     * @param qualities the qualities to try, highest first
     * @param thresholds {@code thresholds[i]} is the size above which {@code qualities[i + 1]}
     *                   is tried
     * @return the last encoding made
     * @throws IOException when no JPEG writer is available or encoding fails
     */
    public Encoded encode(BufferedImage image, List<Float> qualities, List<Long> thresholds) throws IOException {
        float quality = qualities.get(0);
        byte[] bytes = encode(image, quality);
        logger.debug("Encoded {}x{} raster at quality {}: {} bytes", image.getWidth(), image.getHeight(), quality,
            bytes.length);
        for (int i = 0; i < thresholds.size() && i + 1 < qualities.size(); i++) {
            if (bytes.length <= thresholds.get(i)) {
                break;
            }
            quality = qualities.get(i + 1);
            logger.info("Raster is {} bytes, above {}; encoding again at quality {}", bytes.length, thresholds.get(i),
                quality);
            bytes = encode(image, quality);
        }
        return new Encoded(bytes, quality);
    }

    public byte[] encode(BufferedImage image, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("no JPEG image writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(stream);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
