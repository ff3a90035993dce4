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

package ai.kognition.histmatch.image.calc;

import java.util.Arrays;

import ai.kognition.histmatch.image.Channel;
import ai.kognition.histmatch.image.RgbRaster;
import ai.kognition.histmatch.image.RgbRaster.PixelAggregate;

/**
 * Per channel frequency counts of an {@link RgbRaster}. There's one 256 bin histogram for
 * each {@link Channel}, indexed by the channel's ordinal.
 */
public class Histogram {

    private final long[][] histograms;

    private Histogram() {
        histograms = new long[Channel.values().length][Channel.NUM_VALUES];
    }

    public static PixelAggregate<Histogram> makeAggregate() {
        final Channel[] channels = Channel.values();
        return (final Histogram prev, final int[] pixel, final int row, final int col) -> {
            for(final Channel channel: channels)
                prev.histograms[channel.ordinal()][pixel[channel.offset]]++;
            return prev;
        };
    }

    public static Histogram makeInitialValue() {
        return new Histogram();
    }

    public static Histogram makeHistogram(final RgbRaster raster) {
        return raster.reduce(makeInitialValue(), makeAggregate());
    }

    /**
     * A copy of the counts for the given channel.
     */
    public long[] counts(final Channel channel) {
        final long[] hist = histograms[channel.ordinal()];
        return Arrays.copyOf(hist, hist.length);
    }

    public long count(final Channel channel, final int value) {
        return histograms[channel.ordinal()][value];
    }

    public long total(final Channel channel) {
        long ret = 0;
        for(final long count: histograms[channel.ordinal()])
            ret += count;
        return ret;
    }
}
