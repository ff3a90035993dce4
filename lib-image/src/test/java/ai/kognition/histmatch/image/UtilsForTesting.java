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

import java.util.Random;

public class UtilsForTesting {

    public static byte[] randomBytes(final int length, final long seed) {
        final byte[] ret = new byte[length];
        new Random(seed).nextBytes(ret);
        return ret;
    }

    public static RgbRaster randomInterleaved(final int width, final int height, final long seed) {
        return RgbRaster.interleaved(randomBytes(width * height * 3, seed), width, height);
    }

    /**
     * The same samples as {@code raster} held planar.
     */
    public static RgbRaster toPlanar(final RgbRaster raster) {
        return RgbRaster.planar(raster.channelBytes(Channel.RED), raster.channelBytes(Channel.GREEN), raster.channelBytes(Channel.BLUE),
            raster.width(), raster.height());
    }

    /**
     * An interleaved raster built from pixels given as {r,g,b} triplets in row major order.
     */
    public static RgbRaster fromPixels(final int width, final int height, final int[]... pixels) {
        final RgbRaster ret = RgbRaster.createInterleaved(width, height);
        for(int pos = 0; pos < pixels.length; pos++)
            ret.set(pos / width, pos % width, pixels[pos][0], pixels[pos][1], pixels[pos][2]);
        return ret;
    }
}
