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
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.histmatch.image.Channel;
import ai.kognition.histmatch.image.EmptyImageException;
import ai.kognition.histmatch.image.RgbRaster;
import ai.kognition.histmatch.util.Timer;

/**
 * <p>
 * Histogram matching of 8-bit RGB rasters. The source's channels are remapped so that each
 * one's distribution approximates the same channel of the reference. Only the value of a
 * sample and the global statistics of the two rasters decide its new value so the spatial
 * layout of the source is untouched and the two rasters don't need the same dimensions.
 * </p>
 *
 * <pre>
 * <code>
 * final HistogramMatcher matcher = new HistogramMatcher.Builder().tieBreak(TieBreak.FIRST_INDEX_WINS).build();
 * final RgbRaster result = matcher.match(source, reference);
 * </code>
 * </pre>
 *
 * <p>
 * Instances are immutable and can be shared between threads.
 * </p>
 */
public class HistogramMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(HistogramMatcher.class);

    private final LookupTableMapper mapper;
    private final boolean parallelChannels;

    private HistogramMatcher(final TieBreak tieBreak, final boolean parallelChannels) {
        this.mapper = new LookupTableMapper(tieBreak);
        this.parallelChannels = parallelChannels;
    }

    public static class Builder {
        private TieBreak tieBreak = TieBreak.FIRST_INDEX_WINS;
        private boolean parallelChannels = false;

        public Builder tieBreak(final TieBreak tieBreak) {
            if(tieBreak == null)
                throw new NullPointerException("The tie break policy can't be null");
            this.tieBreak = tieBreak;
            return this;
        }

        /**
         * Work on the three channels concurrently. The result is the same either way.
         */
        public Builder parallelChannels(final boolean parallelChannels) {
            this.parallelChannels = parallelChannels;
            return this;
        }

        public HistogramMatcher build() {
            return new HistogramMatcher(tieBreak, parallelChannels);
        }
    }

    public TieBreak tieBreak() {
        return mapper.tieBreak();
    }

    public boolean isParallelChannels() {
        return parallelChannels;
    }

    /**
     * Compute, for each channel, the table taking the source's values to the reference's.
     *
     * @throws EmptyImageException if either raster has no pixels.
     */
    public Map<Channel, LookupTable> computeTables(final RgbRaster source, final RgbRaster reference) throws EmptyImageException {
        checkNotEmpty("source", source);
        checkNotEmpty("reference", reference);

        final Histogram sourceHist = Histogram.makeHistogram(source);
        final Histogram referenceHist = Histogram.makeHistogram(reference);

        final Map<Channel, LookupTable> tables = Collections.synchronizedMap(new EnumMap<>(Channel.class));
        channels().forEach(channel -> {
            final int[] sourceLevels = CumulativeDistribution.quantized(sourceHist.counts(channel));
            final int[] referenceLevels = CumulativeDistribution.quantized(referenceHist.counts(channel));
            final LookupTable table = mapper.map(sourceLevels, referenceLevels);
            LOGGER.trace("{} channel table: {}", channel, table);
            tables.put(channel, table);
        });

        final Map<Channel, LookupTable> ret = new EnumMap<>(Channel.class);
        ret.putAll(tables);
        return ret;
    }

    /**
     * Match the source to the reference leaving the source untouched.
     *
     * @return a new raster with the source's dimensions and sample layout.
     */
    public RgbRaster match(final RgbRaster source, final RgbRaster reference) throws EmptyImageException {
        final Map<Channel, LookupTable> tables = computeTables(source, reference);
        final RgbRaster ret = source.copy();
        applyAll(tables, ret);
        return ret;
    }

    /**
     * Match the source to the reference rewriting the source's samples.
     *
     * @return the source.
     */
    public RgbRaster matchInPlace(final RgbRaster source, final RgbRaster reference) throws EmptyImageException {
        final Map<Channel, LookupTable> tables = computeTables(source, reference);
        applyAll(tables, source);
        return source;
    }

    private void applyAll(final Map<Channel, LookupTable> tables, final RgbRaster target) {
        final Timer timer = Timer.started();
        channels().forEach(channel -> tables.get(channel).apply(target, channel));
        LOGGER.debug("Remapped {} pixels of {} in {} seconds", target.numPixels(), target, timer.stop());
    }

    private Stream<Channel> channels() {
        final Stream<Channel> ret = Arrays.stream(Channel.values());
        return parallelChannels ? ret.parallel() : ret;
    }

    private static void checkNotEmpty(final String which, final RgbRaster raster) {
        if(raster == null)
            throw new NullPointerException("The " + which + " raster can't be null");
        if(raster.numPixels() == 0)
            throw new EmptyImageException("The " + which + " image " + raster + " has no pixels");
    }
}
