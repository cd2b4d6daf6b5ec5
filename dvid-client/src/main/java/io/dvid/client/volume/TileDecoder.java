package io.dvid.client.volume;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.dvid.client.CompressionException;
import io.dvid.client.geometry.Dims;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/// Decodes pre-computed PNG or JPEG tiles into 2D grayscale volumes.
public final class TileDecoder {

    private TileDecoder() {
    }

    /// @param encoded tile bytes as stored
    /// @return a grayscale volume of `Dims.of(width, height)`
    /// @throws CompressionException if the bytes are not a readable image
    public static Volume decodeGrayscale(byte[] encoded) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(encoded));
        } catch (IOException e) {
            throw new CompressionException("Failed to decode tile of " + encoded.length + " bytes", e);
        }
        if (image == null) {
            throw new CompressionException("Tile of " + encoded.length + " bytes is not a supported image format");
        }
        int width = image.getWidth();
        int height = image.getHeight();
        byte[] pixels = new byte[width * height];
        Raster raster = image.getRaster();
        boolean singleBand = raster.getNumBands() == 1;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int value;
                if (singleBand) {
                    value = raster.getSample(x, y, 0);
                } else {
                    int rgb = image.getRGB(x, y);
                    int r = (rgb >> 16) & 0xFF;
                    int g = (rgb >> 8) & 0xFF;
                    int b = rgb & 0xFF;
                    value = (r * 299 + g * 587 + b * 114) / 1000;
                }
                pixels[y * width + x] = (byte) value;
            }
        }
        return Volume.grayscale(Dims.of(width, height), pixels);
    }
}
