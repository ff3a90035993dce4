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

import org.apache.commons.lang3.Validate;

import ai.kognition.histmatch.image.Channel;
import ai.kognition.histmatch.image.EmptyImageException;

/**
 * Conversions from a channel histogram to its cumulative distribution and from there to
 * 8-bit levels.
 */
public class CumulativeDistribution {

    private CumulativeDistribution() {}

    /**
     * Inclusive running sum of the histogram.
     */
    public static long[] cumulativeSum(final long[] histogram) {
        checkLength(histogram.length);
        final long[] cumsum = new long[histogram.length];
        cumsum[0] = histogram[0];
        for(int i = 1; i < histogram.length; i++)
            cumsum[i] = cumsum[i - 1] + histogram[i];
        return cumsum;
    }

    /**
     * The cumulative distribution of the histogram normalized to [0, 1]. The result is
     * non-decreasing and the last entry is exactly 1.0.
     *
     * @throws EmptyImageException if the histogram has no counts in it.
     */
    public static double[] normalize(final long[] histogram) throws EmptyImageException {
        final long[] cumsum = cumulativeSum(histogram);
        final long total = cumsum[cumsum.length - 1];
        if(total == 0)
            throw new EmptyImageException("Can't normalize the distribution of a channel with no pixels");

        final double totalD = total;
        final double[] normalized = new double[cumsum.length];
        for(int i = 0; i < cumsum.length; i++)
            normalized[i] = cumsum[i] / totalD;
        return normalized;
    }

    /**
     * Scale a normalized distribution up to 8-bit levels rounding up. Rounding up keeps the
     * levels non-decreasing and drives the last one to 255.
     */
    public static int[] equalize(final double[] normalized) {
        checkLength(normalized.length);
        final int[] levels = new int[normalized.length];
        for(int i = 0; i < normalized.length; i++) {
            final double val = normalized[i];
            Validate.isTrue(val >= 0.0 && val <= 1.0, "Normalized distribution value %s at %d is outside of [0, 1]", val, i);
            levels[i] = (int)Math.ceil(val * Channel.MAX_VALUE);
        }
        return levels;
    }

    /**
     * {@link #normalize(long[])} followed by {@link #equalize(double[])}.
     */
    public static int[] quantized(final long[] histogram) throws EmptyImageException {
        return equalize(normalize(histogram));
    }

    private static void checkLength(final int length) {
        Validate.isTrue(length == Channel.NUM_VALUES, "Expected %d bins but got %d", Channel.NUM_VALUES, length);
    }
}
