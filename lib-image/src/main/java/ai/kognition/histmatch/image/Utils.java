/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.histmatch.image;

import static java.awt.image.BufferedImage.TYPE_3BYTE_BGR;
import static java.awt.image.BufferedImage.TYPE_4BYTE_ABGR;
import static java.awt.image.BufferedImage.TYPE_BYTE_GRAY;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between {@link BufferedImage}s and {@link RgbRaster}s.
 */
public class Utils {
    private static final Logger LOGGER = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * <p>
     * Copy the image into a new interleaved {@link RgbRaster}. Any color model is accepted and
     * alpha is dropped.
     * </p>
     *
     * <p>
     * 8-bit gray, BGR and ABGR images have their samples copied as stored. A gray sample
     * is replicated into all three channels. Everything else goes through
     * {@link BufferedImage#getRGB(int, int, int, int, int[], int, int)} and ends up as
     * 8-bit sRGB.
     * </p>
     */
    public static RgbRaster img2RgbRaster(final BufferedImage bufferedImage) {
        final int width = bufferedImage.getWidth();
        final int height = bufferedImage.getHeight();
        if(bufferedImage.getColorModel().hasAlpha())
            LOGGER.debug("Dropping the alpha channel of {}", bufferedImage);

        final RgbRaster ret = RgbRaster.createInterleaved(width, height);
        final int type = isEightBitGray(bufferedImage) ? TYPE_BYTE_GRAY : bufferedImage.getType();
        switch(type) {
            case TYPE_BYTE_GRAY:
            case TYPE_3BYTE_BGR:
            case TYPE_4BYTE_ABGR: {
                LOGGER.trace("Copying raw samples of image type {}", type);
                final Raster raster = bufferedImage.getRaster();
                final int numBands = raster.getNumBands();
                final int[] rowSamples = new int[width * numBands];
                for(int row = 0; row < height; row++) {
                    raster.getPixels(0, row, width, 1, rowSamples);
                    for(int col = 0; col < width; col++) {
                        final int pos = col * numBands;
                        if(numBands == 1)
                            ret.set(row, col, rowSamples[pos], rowSamples[pos], rowSamples[pos]);
                        else
                            // bands are R, G, B (then A) regardless of the byte order in the buffer
                            ret.set(row, col, rowSamples[pos], rowSamples[pos + 1], rowSamples[pos + 2]);
                    }
                }
                break;
            }
            default: {
                final int[] rowArgb = new int[width];
                for(int row = 0; row < height; row++) {
                    bufferedImage.getRGB(0, row, width, 1, rowArgb, 0, width);
                    for(int col = 0; col < width; col++) {
                        final int argb = rowArgb[col];
                        ret.set(row, col, (argb >> 16) & 0xff, (argb >> 8) & 0xff, argb & 0xff);
                    }
                }
            }
        }
        return ret;
    }

    // decoders sometimes hand back a TYPE_CUSTOM image for plain 8-bit gray
    private static boolean isEightBitGray(final BufferedImage bufferedImage) {
        final Raster raster = bufferedImage.getRaster();
        return raster.getNumBands() == 1 && raster.getSampleModel().getSampleSize(0) == 8
            && !(bufferedImage.getColorModel() instanceof IndexColorModel);
    }

    /**
     * Copy the raster into a new {@link BufferedImage#TYPE_INT_RGB} image.
     */
    public static BufferedImage rgbRaster2Img(final RgbRaster raster) {
        final int width = raster.width();
        final int height = raster.height();
        final BufferedImage ret = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        final int[] rowRgb = new int[width];
        for(int row = 0; row < height; row++) {
            for(int col = 0; col < width; col++) {
                rowRgb[col] = (raster.get(Channel.RED, row, col) << 16)
                    | (raster.get(Channel.GREEN, row, col) << 8)
                    | raster.get(Channel.BLUE, row, col);
            }
            ret.setRGB(0, row, width, 1, rowRgb, 0, width);
        }
        return ret;
    }
}
