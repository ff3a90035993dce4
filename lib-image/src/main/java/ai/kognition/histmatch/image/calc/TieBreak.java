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

/**
 * Decides which reference value represents a cumulative level reached by more than one
 * value (a plateau in the reference distribution).
 */
public enum TieBreak {
    /**
     * The lowest value reaching the level. This is the first value that actually has pixels.
     */
    FIRST_INDEX_WINS,

    /**
     * The highest value reaching the level.
     */
    LAST_INDEX_WINS;

    /**
     * Accepts {@code first}/{@code last} as well as the constant names, ignoring case.
     */
    public static TieBreak parse(final String value) {
        if(value == null)
            throw new IllegalArgumentException("No tie break given");
        final String val = value.trim();
        if("first".equalsIgnoreCase(val))
            return FIRST_INDEX_WINS;
        if("last".equalsIgnoreCase(val))
            return LAST_INDEX_WINS;
        for(final TieBreak tb: values()) {
            if(tb.name().equalsIgnoreCase(val))
                return tb;
        }
        throw new IllegalArgumentException("Unknown tie break \"" + value + "\". Expected one of first or last");
    }
}
