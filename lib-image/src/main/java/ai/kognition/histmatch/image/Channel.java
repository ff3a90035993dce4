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

/**
 * The three independent color components of an 8-bit RGB raster. Each constant knows
 * where its sample sits within an interleaved pixel.
 */
public enum Channel {
    RED(0), GREEN(1), BLUE(2);

    /**
     * The number of distinct values an 8-bit channel sample can take.
     */
    public static final int NUM_VALUES = 256;

    /**
     * The largest value an 8-bit channel sample can take.
     */
    public static final int MAX_VALUE = NUM_VALUES - 1;

    public final int offset;

    private Channel(final int offset) {
        this.offset = offset;
    }
}
