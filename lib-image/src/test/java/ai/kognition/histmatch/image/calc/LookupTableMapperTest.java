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

import static ai.kognition.histmatch.image.UtilsForTesting.randomInterleaved;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import ai.kognition.histmatch.image.Channel;
import ai.kognition.histmatch.image.RgbRaster;

public class LookupTableMapperTest {

    private static final LookupTableMapper FIRST = new LookupTableMapper(TieBreak.FIRST_INDEX_WINS);
    private static final LookupTableMapper LAST = new LookupTableMapper(TieBreak.LAST_INDEX_WINS);

    private static int[] levels(final int fill) {
        final int[] ret = new int[Channel.NUM_VALUES];
        Arrays.fill(ret, fill);
        return ret;
    }

    private static int[] identityLevels() {
        final int[] ret = new int[Channel.NUM_VALUES];
        for(int i = 0; i < ret.length; i++)
            ret[i] = i;
        return ret;
    }

    @Test
    public void testDegenerateReference() {
        // source with one black and one white pixel; reference all black
        final int[] source = levels(128);
        source[255] = 255;
        final int[] reference = levels(255);

        final LookupTable first = FIRST.map(source, reference);
        for(int v = 0; v < 256; v++)
            assertEquals(0, first.map(v));

        final LookupTable last = LAST.map(source, reference);
        for(int v = 0; v < 256; v++)
            assertEquals(255, last.map(v));
    }

    @Test
    public void testLowerFallbackAndUpperWinsTies() {
        // reference levels start at 10 so there's nothing below levels 0 through 10
        final int[] reference = new int[Channel.NUM_VALUES];
        for(int i = 0; i < reference.length; i++)
            reference[i] = Math.max(10, i);
        final int[] source = identityLevels();

        final LookupTable first = FIRST.map(source, reference);
        final LookupTable last = LAST.map(source, reference);

        // closer to the fallback (level 0 -> 255) than to level 10
        assertEquals(255, first.map(0));
        assertEquals(255, first.map(4));
        assertEquals(255, last.map(4));
        // equidistant goes up
        assertEquals(0, first.map(5));
        assertEquals(10, last.map(5));
        assertEquals(0, first.map(6));
        assertEquals(0, first.map(10));
        assertEquals(10, last.map(10));
        assertEquals(11, first.map(11));
        assertEquals(200, first.map(200));
        assertEquals(200, last.map(200));
    }

    @Test
    public void testUpperFallback() {
        // not a real distribution: the top level never reaches 255
        final int[] reference = levels(100);
        final int[] source = levels(50);
        source[1] = 100;
        source[2] = 200;

        final LookupTable table = FIRST.map(source, reference);
        assertEquals(0, table.map(0));
        assertEquals(0, table.map(1));
        assertEquals(255, table.map(2));
    }

    @Test
    public void testNearestLevelIsChosen() {
        final int[] reference = levels(255);
        for(int i = 0; i < 100; i++)
            reference[i] = 50;
        final int[] source = levels(255);
        source[0] = 60;
        source[1] = 160;
        source[2] = 152;
        source[3] = 153;

        final LookupTable table = FIRST.map(source, reference);
        assertEquals(0, table.map(0)); // 10 below vs 195 above
        assertEquals(100, table.map(1)); // 110 below vs 95 above
        assertEquals(0, table.map(2)); // 102 below vs 103 above
        assertEquals(100, table.map(3)); // 103 below vs 102 above
    }

    @Test
    public void testTotality() {
        for(int seed = 0; seed < 20; seed++) {
            final RgbRaster src = randomInterleaved(3 + seed, 5, seed);
            final RgbRaster ref = randomInterleaved(2, 1 + seed, 1000 + seed);
            final int[] srcLevels = CumulativeDistribution.quantized(Histogram.makeHistogram(src).counts(Channel.RED));
            final int[] refLevels = CumulativeDistribution.quantized(Histogram.makeHistogram(ref).counts(Channel.RED));

            for(final LookupTableMapper mapper: new LookupTableMapper[] {FIRST,LAST}) {
                final LookupTable table = mapper.map(srcLevels, refLevels);
                assertEquals(256, table.size());
                for(int v = 0; v < 256; v++)
                    assertTrue(table.map(v) >= 0 && table.map(v) <= 255);
            }
        }
    }

    @Test
    public void testSelfMatch() {
        final RgbRaster raster = randomInterleaved(9, 4, 7L);
        for(final Channel ch: Channel.values()) {
            final int[] levels = CumulativeDistribution.quantized(Histogram.makeHistogram(raster).counts(ch));

            final LookupTable first = FIRST.map(levels, levels);
            final LookupTable last = LAST.map(levels, levels);
            for(int v = 0; v < 256; v++) {
                assertEquals(levels[v], levels[first.map(v)]);
                assertEquals(levels[v], levels[last.map(v)]);

                if(v == 0 || levels[v - 1] < levels[v])
                    assertEquals(v, first.map(v));
                if(v == 255 || levels[v + 1] > levels[v])
                    assertEquals(v, last.map(v));
            }
        }
    }

    @Test
    public void testStrictlyIncreasingSelfMatchIsIdentity() {
        final int[] levels = identityLevels();
        assertEquals(LookupTable.identity(), FIRST.map(levels, levels));
        assertEquals(LookupTable.identity(), LAST.map(levels, levels));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongLength() {
        FIRST.map(new int[255], levels(255));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLevelOutOfRange() {
        final int[] reference = levels(255);
        reference[3] = 256;
        FIRST.map(levels(255), reference);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeLevel() {
        final int[] source = levels(255);
        source[0] = -1;
        FIRST.map(source, levels(255));
    }
}
