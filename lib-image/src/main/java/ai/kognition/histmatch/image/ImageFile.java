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

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Iterator;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reading and writing image files through ImageIO. This is the boundary between files on
 * disk and the {@link RgbRaster}s the matching works on.
 */
public class ImageFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageFile.class);

    private ImageFile() {}

    /**
     * <p>
     * Read a {@link BufferedImage} from a file. Each ImageIO reader that claims the file is
     * tried in turn and the first successful decode is returned.
     * </p>
     *
     * @throws FileNotFoundException if the file doesn't exist.
     * @throws IllegalArgumentException if no reader could decode the file.
     */
    public static BufferedImage readBufferedImageFromFile(final String filename) throws IOException {
        final File f = new File(filename);
        if(!f.exists())
            throw new FileNotFoundException(filename);

        Exception lastException = null;
        int cur = 0;
        while(true) {
            try(ReaderAndStream ras = getNextReaderAndStream(f, cur)) {
                if(ras == null)
                    break;

                final ImageReader reader = ras.reader;
                final ImageReadParam param = reader.getDefaultReadParam();
                try {
                    LOGGER.trace("IIO attempt {}. Using reader {} to read {} ", cur, reader, filename);
                    return reader.read(0, param);
                } catch(final IOException | RuntimeException ioe) {
                    LOGGER.debug("IIO attempt {} using reader {} failed with ", cur, reader, ioe);
                    lastException = ioe;
                } finally {
                    reader.dispose();
                }
            }
            cur++;
        }

        if(cur == 0)
            LOGGER.debug("IIO No ImageIO reader's available for {}", filename);
        else
            LOGGER.debug("IIO No more ImageIO readers to try for {}", filename);

        if(lastException != null)
            throw new IllegalArgumentException("Can't read '" + filename + "' as an image. No codec worked in ImageIO", lastException);
        throw new IllegalArgumentException("Can't read '" + filename + "' as an image. No codec worked in ImageIO");
    }

    /**
     * Read and decode the file straight into an interleaved {@link RgbRaster}.
     */
    public static RgbRaster readRasterFromFile(final String filename) throws IOException {
        final RgbRaster ret = Utils.img2RgbRaster(readBufferedImageFromFile(filename));
        LOGGER.trace("IIO Read {} from {}", ret, filename);
        return ret;
    }

    /**
     * Write the image using an ImageIO writer chosen by the filename's extension. Missing
     * parent directories are created.
     *
     * @throws IOException if the filename has no extension or every writer failed.
     * @throws IllegalArgumentException if there's no writer for the extension.
     */
    public static void writeImageFile(final BufferedImage ri, final String filename) throws IOException {
        if(!doWrite(ri, filename))
            throw new IllegalArgumentException("Failed to write '" + filename + "'. No ImageIO writer for the extension accepted the image");
    }

    public static void writeImageFile(final RgbRaster raster, final String filename) throws IOException {
        writeImageFile(Utils.rgbRaster2Img(raster), filename);
    }

    private static class ReaderAndStream implements AutoCloseable {
        public final ImageReader reader;
        public final ImageInputStream stream;

        public ReaderAndStream(final ImageReader reader, final ImageInputStream stream) {
            this.reader = reader;
            this.stream = stream;
            reader.setInput(stream, true, true);
        }

        @Override
        public void close() throws IOException {
            stream.close();
        }
    }

    private static ReaderAndStream getNextReaderAndStream(final File f, final int index) throws IOException {
        final ImageInputStream input = ImageIO.createImageInputStream(f);
        if(input == null)
            return null;

        final Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
        int cur = 0;
        while(readers.hasNext() && cur <= (index - 1)) {
            readers.next();
            cur++;
        }

        ImageReader reader = null;
        if(readers.hasNext())
            reader = readers.next();

        if(reader == null)
            input.close();

        return reader == null ? null : new ReaderAndStream(reader, input);
    }

    private static boolean doWrite(final BufferedImage ri, final String filename) throws IOException {
        LOGGER.trace("Writing image {} to {}", ri, filename);
        final String ext = FilenameUtils.getExtension(filename);
        if(ext == null || ext.isEmpty())
            throw new IOException("No extention on " + filename);

        final File f = new File(filename).getCanonicalFile();
        final File p = f.getParentFile();
        // make sure the output directory exists.
        if(p != null)
            p.mkdirs();

        final Iterator<ImageWriter> iter = ImageIO.getImageWritersBySuffix(ext);
        IOException last = null;
        int cur = 0;
        while(iter.hasNext()) {
            final ImageWriter writer = iter.next();
            try(final ImageOutputStream ios = ImageIO.createImageOutputStream(f);) {
                final ImageWriteParam param = writer.getDefaultWriteParam();
                writer.setOutput(ios);
                writer.write(null, new IIOImage(ri, null, null), param);
                return true;
            } catch(final IOException ioe) {
                LOGGER.debug("IIO attempt {} using writer {} failed with ", cur, writer, ioe);
                last = ioe;
            } finally {
                writer.dispose();
            }
            cur++;
        }

        if(last != null)
            throw last;
        return false;
    }
}
