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

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.histmatch.image.Channel;

/**
 * <p>
 * Builds the {@link LookupTable} that takes a source channel to a reference channel given
 * both channels' quantized cumulative distributions (see
 * {@link CumulativeDistribution#quantized(long[])}).
 * </p>
 *
 * <p>
 * Each source value is sent to the reference value whose cumulative level is closest to the
 * source value's level. The candidates are the nearest level at or above the source level
 * ("upper") and the nearest level strictly below it ("lower"). Upper wins ties. When there's
 * no candidate on one side it's replaced by the fallback entry of level 0 mapping to 255.
 * </p>
 *
 * <p>
 * Several reference values can share a level. Which of them represents the level is decided
 * by the {@link TieBreak}.
 * </p>
 */
public class LookupTableMapper {
    private static final Logger LOGGER = LoggerFactory.getLogger(LookupTableMapper.class);

    public static final int FALLBACK_LEVEL = 0;
    public static final int FALLBACK_VALUE = Channel.MAX_VALUE;

    private final TieBreak tieBreak;

    public LookupTableMapper(final TieBreak tieBreak) {
        if(tieBreak == null)
            throw new NullPointerException("The tie break policy can't be null");
        this.tieBreak = tieBreak;
    }

    public TieBreak tieBreak() {
        return tieBreak;
    }

    public LookupTable map(final int[] sourceLevels, final int[] referenceLevels) {
        checkLevels("source", sourceLevels);
        checkLevels("reference", referenceLevels);

        final ReferenceIndex index = new ReferenceIndex(referenceLevels, tieBreak);
        LOGGER.trace("Reference has {} distinct cumulative levels", index.levels.length);

        final int[] table = new int[Channel.NUM_VALUES];
        for(int v = 0; v < table.length; v++)
            table[v] = index.closest(sourceLevels[v]);

        return LookupTable.of(table);
    }

    private static void checkLevels(final String which, final int[] levels) {
        Validate.isTrue(levels.length == Channel.NUM_VALUES, "The %s distribution needs %d levels but has %d", which, Channel.NUM_VALUES,
            levels.length);
        for(int i = 0; i < levels.length; i++)
            Validate.inclusiveBetween(0, Channel.MAX_VALUE, levels[i], "The %s level at %d is out of range", which, i);
    }

    /**
     * The reference distribution inverted: distinct levels in ascending order and, in the
     * parallel array, the value chosen to represent each one.
     */
    private static class ReferenceIndex {
        final int[] levels;
        final int[] values;

        ReferenceIndex(final int[] referenceLevels, final TieBreak tieBreak) {
            final int[] valueForLevel = new int[Channel.NUM_VALUES];
            Arrays.fill(valueForLevel, -1);
            for(int v = 0; v < referenceLevels.length; v++) {
                final int level = referenceLevels[v];
                if(valueForLevel[level] < 0 || tieBreak == TieBreak.LAST_INDEX_WINS)
                    valueForLevel[level] = v;
            }

            int count = 0;
            for(final int v: valueForLevel)
                if(v >= 0)
                    count++;

            levels = new int[count];
            values = new int[count];
            int pos = 0;
            for(int level = 0; level < valueForLevel.length; level++) {
                if(valueForLevel[level] >= 0) {
                    levels[pos] = level;
                    values[pos] = valueForLevel[level];
                    pos++;
                }
            }
        }

        int closest(final int key) {
            // position of the first level >= key
            final int found = Arrays.binarySearch(levels, key);
            final int upperPos = found >= 0 ? found : -(found + 1);
            final int lowerPos = upperPos - 1;

            final int upperLevel;
            final int upperValue;
            if(upperPos < levels.length) {
                upperLevel = levels[upperPos];
                upperValue = values[upperPos];
            } else {
                upperLevel = FALLBACK_LEVEL;
                upperValue = FALLBACK_VALUE;
            }

            final int lowerLevel;
            final int lowerValue;
            if(lowerPos >= 0) {
                lowerLevel = levels[lowerPos];
                lowerValue = values[lowerPos];
            } else {
                lowerLevel = FALLBACK_LEVEL;
                lowerValue = FALLBACK_VALUE;
            }

            final int upperDistance = upperLevel - key;
            final int lowerDistance = key - lowerLevel;
            return upperDistance <= lowerDistance ? upperValue : lowerValue;
        }
    }
}
