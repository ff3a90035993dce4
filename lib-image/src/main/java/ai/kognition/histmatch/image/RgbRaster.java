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

import java.util.Arrays;

/**
 * <p>
 * {@link RgbRaster} is the in-memory form of a decoded 8-bit RGB image. The samples are
 * held either interleaved in a single buffer (R,G,B,R,G,B,...) or planar as one buffer
 * per {@link Channel}. Which one is used is decided by the factory that wraps the data and
 * is otherwise invisible to the code that works on the raster.
 * </p>
 *
 * <pre>
 * <code>
 * final RgbRaster raster = RgbRaster.interleaved(bytes, width, height);
 * final long sumOfReds = raster.reduce(Long.valueOf(0),
 *     (prev, pixel, row, col) -> Long.valueOf(prev.longValue() + pixel[Channel.RED.offset]));
 * </code>
 * </pre>
 *
 * <p>
 * The buffers passed to the factories are wrapped, not copied, so changes through
 * {@link #set(Channel, int, int)} are visible in the caller's arrays. The shape of the data
 * is validated once, at construction, and a {@link ShapeMismatchException} is thrown if it
 * doesn't agree with the dimensions.
 * </p>
 */
public abstract class RgbRaster {

    private final int width;
    private final int height;

    private RgbRaster(final int width, final int height) {
        this.width = width;
        this.height = height;
    }

    /**
     * Wrap an interleaved buffer of {@code width * height * 3} samples.
     */
    public static RgbRaster interleaved(final byte[] data, final int width, final int height) {
        if(data == null)
            throw new NullPointerException("Can't create an " + RgbRaster.class.getSimpleName() + " from a null buffer");
        checkDimensions(width, height);
        if(data.length % 3 != 0)
            throw new ShapeMismatchException("Interleaved RGB buffer length " + data.length + " isn't divisible by 3");
        final long expected = (long)width * height * 3;
        if(data.length != expected)
            throw new ShapeMismatchException("Interleaved RGB buffer length " + data.length + " doesn't match " + width + "x" + height
                + "x3 (" + expected + ")");
        return new Interleaved(data, width, height);
    }

    /**
     * Wrap three per-channel buffers of {@code width * height} samples each.
     */
    public static RgbRaster planar(final byte[] red, final byte[] green, final byte[] blue, final int width, final int height) {
        if(red == null || green == null || blue == null)
            throw new NullPointerException("Can't create an " + RgbRaster.class.getSimpleName() + " from a null channel buffer");
        checkDimensions(width, height);
        final long expected = (long)width * height;
        checkPlane(Channel.RED, red, expected, width, height);
        checkPlane(Channel.GREEN, green, expected, width, height);
        checkPlane(Channel.BLUE, blue, expected, width, height);
        return new Planar(new byte[][] {red,green,blue}, width, height);
    }

    /**
     * A new, zeroed, interleaved raster.
     */
    public static RgbRaster createInterleaved(final int width, final int height) {
        checkDimensions(width, height);
        return new Interleaved(new byte[Math.multiplyExact(Math.multiplyExact(width, height), 3)], width, height);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int numPixels() {
        return width * height;
    }

    /**
     * Get the sample for the channel at the flattened pixel position {@code pos}
     * ({@code row * width + col}) as a value in [0, 255].
     */
    public abstract int get(Channel channel, int pos);

    /**
     * Set the sample for the channel at the flattened pixel position {@code pos}. Only the
     * low 8 bits of {@code value} are kept.
     */
    public abstract void set(Channel channel, int pos, int value);

    /**
     * A deep copy using the same sample layout.
     */
    public abstract RgbRaster copy();

    public abstract boolean isInterleaved();

    /**
     * A copy of one channel's samples, one byte per pixel.
     */
    public abstract byte[] channelBytes(Channel channel);

    /**
     * A copy of the samples laid out interleaved, regardless of how they're held.
     */
    public abstract byte[] interleavedBytes();

    public int get(final Channel channel, final int row, final int col) {
        return get(channel, (row * width) + col);
    }

    public void set(final int row, final int col, final int red, final int green, final int blue) {
        final int pos = (row * width) + col;
        set(Channel.RED, pos, red);
        set(Channel.GREEN, pos, green);
        set(Channel.BLUE, pos, blue);
    }

    /**
     * Reduce the raster to a single value of type {@code U} by applying the aggregator to
     * each pixel in row major order. The pixel array handed to the aggregator is reused
     * between calls.
     */
    public <U> U reduce(final U identity, final PixelAggregate<U> seqOp) {
        U prev = identity;
        final int[] pixel = new int[3];
        for(int r = 0; r < height; r++) {
            final int rowStart = r * width;
            for(int c = 0; c < width; c++) {
                final int pos = rowStart + c;
                pixel[0] = get(Channel.RED, pos);
                pixel[1] = get(Channel.GREEN, pos);
                pixel[2] = get(Channel.BLUE, pos);
                prev = seqOp.apply(prev, pixel, r, c);
            }
        }
        return prev;
    }

    /**
     * Replace every sample of the given channel with the result of the mapper.
     */
    public void apply(final Channel channel, final ChannelValueMapper mapper) {
        final int numPixels = numPixels();
        for(int pos = 0; pos < numPixels; pos++)
            set(channel, pos, mapper.map(get(channel, pos)));
    }

    /**
     * Compare the dimensions and samples of two rasters ignoring how the samples are held.
     */
    public static boolean pixelsIdentical(final RgbRaster r1, final RgbRaster r2) {
        if(r1 == r2)
            return true;
        if(r1 == null || r2 == null)
            return false;
        if(r1.width != r2.width || r1.height != r2.height)
            return false;
        return Arrays.equals(r1.interleavedBytes(), r2.interleavedBytes());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " [width=" + width + ", height=" + height + "]";
    }

    @FunctionalInterface
    public static interface PixelAggregate<R> {
        public R apply(R prev, int[] pixel, int row, int col);
    }

    @FunctionalInterface
    public static interface ChannelValueMapper {
        public int map(int channelValue);
    }

    private static void checkDimensions(final int width, final int height) {
        if(width < 0 || height < 0)
            throw new ShapeMismatchException("Invalid raster dimensions " + width + "x" + height);
    }

    private static void checkPlane(final Channel channel, final byte[] plane, final long expected, final int width, final int height) {
        if(plane.length != expected)
            throw new ShapeMismatchException(channel + " channel buffer length " + plane.length + " doesn't match " + width + "x" + height
                + " (" + expected + ")");
    }

    private static class Interleaved extends RgbRaster {
        private final byte[] data;

        private Interleaved(final byte[] data, final int width, final int height) {
            super(width, height);
            this.data = data;
        }

        @Override
        public int get(final Channel channel, final int pos) {
            return data[(pos * 3) + channel.offset] & 0xff;
        }

        @Override
        public void set(final Channel channel, final int pos, final int value) {
            data[(pos * 3) + channel.offset] = (byte)value;
        }

        @Override
        public RgbRaster copy() {
            return new Interleaved(Arrays.copyOf(data, data.length), width(), height());
        }

        @Override
        public boolean isInterleaved() {
            return true;
        }

        @Override
        public byte[] channelBytes(final Channel channel) {
            final byte[] ret = new byte[numPixels()];
            for(int pos = 0; pos < ret.length; pos++)
                ret[pos] = data[(pos * 3) + channel.offset];
            return ret;
        }

        @Override
        public byte[] interleavedBytes() {
            return Arrays.copyOf(data, data.length);
        }
    }

    private static class Planar extends RgbRaster {
        private final byte[][] planes;

        private Planar(final byte[][] planes, final int width, final int height) {
            super(width, height);
            this.planes = planes;
        }

        @Override
        public int get(final Channel channel, final int pos) {
            return planes[channel.offset][pos] & 0xff;
        }

        @Override
        public void set(final Channel channel, final int pos, final int value) {
            planes[channel.offset][pos] = (byte)value;
        }

        @Override
        public RgbRaster copy() {
            final byte[][] copied = new byte[planes.length][];
            for(int i = 0; i < planes.length; i++)
                copied[i] = Arrays.copyOf(planes[i], planes[i].length);
            return new Planar(copied, width(), height());
        }

        @Override
        public boolean isInterleaved() {
            return false;
        }

        @Override
        public byte[] channelBytes(final Channel channel) {
            final byte[] plane = planes[channel.offset];
            return Arrays.copyOf(plane, plane.length);
        }

        @Override
        public byte[] interleavedBytes() {
            final int numPixels = numPixels();
            final byte[] ret = new byte[numPixels * 3];
            for(int pos = 0; pos < numPixels; pos++) {
                final int base = pos * 3;
                ret[base] = planes[0][pos];
                ret[base + 1] = planes[1][pos];
                ret[base + 2] = planes[2][pos];
            }
            return ret;
        }
    }
}
