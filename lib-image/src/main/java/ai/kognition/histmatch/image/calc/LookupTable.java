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

import ai.kognition.histmatch.image.Channel;
import ai.kognition.histmatch.image.RgbRaster;

/**
 * A 256 entry table giving, for every 8-bit input value, the value to substitute for it.
 */
public class LookupTable {
    private final int[] table;

    private LookupTable(final int[] table) {
        this.table = table;
    }

    /**
     * Copies the entries, which must be 256 values each in [0, 255].
     */
    public static LookupTable of(final int[] entries) {
        Validate.isTrue(entries.length == Channel.NUM_VALUES, "A lookup table needs %d entries but got %d", Channel.NUM_VALUES,
            entries.length);
        for(int i = 0; i < entries.length; i++)
            Validate.inclusiveBetween(0, Channel.MAX_VALUE, entries[i], "Lookup table entry %d is out of range", i);
        return new LookupTable(Arrays.copyOf(entries, entries.length));
    }

    public static LookupTable identity() {
        final int[] entries = new int[Channel.NUM_VALUES];
        for(int i = 0; i < entries.length; i++)
            entries[i] = i;
        return new LookupTable(entries);
    }

    public int map(final int value) {
        return table[value];
    }

    public int size() {
        return table.length;
    }

    public int[] toArray() {
        return Arrays.copyOf(table, table.length);
    }

    /**
     * Rewrite every sample of the channel in the raster through this table.
     */
    public void apply(final RgbRaster raster, final Channel channel) {
        raster.apply(channel, this::map);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(table);
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(obj == null || getClass() != obj.getClass())
            return false;
        return Arrays.equals(table, ((LookupTable)obj).table);
    }

    @Override
    public String toString() {
        return "LookupTable " + Arrays.toString(table);
    }
}
