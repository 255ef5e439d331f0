package org.janelia.piv.image;

import ij.ImagePlus;
import ij.io.FileInfo;
import ij.io.Opener;
import ij.io.TiffEncoder;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.Locale;

import javax.imageio.ImageIO;
import javax.imageio.ImageWriter;
import javax.imageio.stream.FileImageOutputStream;

import org.janelia.piv.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities for reading, inverting, and saving PIV frame images.
 * Decoding and encoding is delegated to ImageJ and ImageIO.
 *
 * @author Eric Trautman
 */
public class FrameImageUtil {

    public static final String TIFF_FORMAT = "tiff";
    public static final String TIF_FORMAT = "tif";

    public static final int MAX_GREY_LEVEL = 255;

    private FrameImageUtil() {
    }

    /**
     * @return processor for the specified image file as stored (no conversion).
     *
     * @throws IOException
     *   if the file does not exist or cannot be decoded.
     */
    public static ImageProcessor readImage(final String path)
            throws IOException {
        return readImage(path, false);
    }

    /**
     * @param  path     image file to read.
     * @param  flatten  if true, colour images are converted to grey levels.
     *
     * @return processor for the specified image file.
     *
     * @throws IOException
     *   if the file does not exist or cannot be decoded.
     */
    public static ImageProcessor readImage(final String path,
                                           final boolean flatten)
            throws IOException {

        final File file = new File(path);
        if (! file.isFile()) {
            throw new IOException("image file " + file.getAbsolutePath() + " does not exist");
        }

        final ImagePlus imagePlus = new Opener().openImage(file.getAbsolutePath());
        if ((imagePlus == null) || (imagePlus.getProcessor() == null)) {
            throw new IOException("failed to open image " + file.getAbsolutePath());
        }

        ImageProcessor imageProcessor = imagePlus.getProcessor();
        if (flatten && (imageProcessor instanceof ColorProcessor)) {
            imageProcessor = imageProcessor.convertToFloatProcessor();
        }

        LOG.debug("readImage: loaded {}x{} {} from {}",
                  imageProcessor.getWidth(), imageProcessor.getHeight(),
                  imageProcessor.getClass().getSimpleName(), file.getAbsolutePath());

        return imageProcessor;
    }

    /**
     * @return new processor containing the negative (255 - value) of the specified grey level image.
     */
    public static FloatProcessor negative(final ImageProcessor imageProcessor) {

        final ImageProcessor greyProcessor = (imageProcessor instanceof ColorProcessor) ?
                                             imageProcessor.convertToFloatProcessor() : imageProcessor;

        final int width = greyProcessor.getWidth();
        final int height = greyProcessor.getHeight();
        final FloatProcessor negativeProcessor = new FloatProcessor(width, height);
        for (int i = 0; i < width * height; i++) {
            negativeProcessor.setf(i, MAX_GREY_LEVEL - greyProcessor.getf(i));
        }

        return negativeProcessor;
    }

    /**
     * Saves the specified grey level image to a file whose format is derived from the path extension.
     * TIFF files are written with ImageJ's {@link TiffEncoder}, all other formats with ImageIO.
     *
     * @throws IllegalArgumentException
     *   if the image is not grey level or has values outside of [0, 255].
     *
     * @throws IOException
     *   if no writer exists for the format or the file cannot be written.
     */
    public static void saveImage(final ImageProcessor imageProcessor,
                                 final String path)
            throws IllegalArgumentException, IOException {

        final ByteProcessor byteProcessor = toByteProcessor(imageProcessor);

        final File file = FileUtil.prepareFileForWrite(path);
        final String fileName = file.getName();
        final String format = fileName.substring(fileName.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);

        if (TIFF_FORMAT.equals(format) || TIF_FORMAT.equals(format)) {

            try (final OutputStream outputStream = new FileOutputStream(file)) {
                final FileInfo fileInfo = new ImagePlus("", byteProcessor).getFileInfo();
                new TiffEncoder(fileInfo).write(outputStream);
            }

        } else {

            final Iterator<ImageWriter> writersForFormat = ImageIO.getImageWritersByFormatName(format);
            if ((writersForFormat == null) || (! writersForFormat.hasNext())) {
                throw new IOException("no ImageIO writers exist for the '" + format + "' format");
            }

            final BufferedImage image = byteProcessor.getBufferedImage();
            final ImageWriter writer = writersForFormat.next();
            try (final FileImageOutputStream outputStream = new FileImageOutputStream(file)) {
                writer.setOutput(outputStream);
                writer.write(image);
            } finally {
                writer.dispose();
            }

        }

        LOG.info("saveImage: exit, saved {}", file.getAbsolutePath());
    }

    static ByteProcessor toByteProcessor(final ImageProcessor imageProcessor)
            throws IllegalArgumentException {

        if (imageProcessor instanceof ColorProcessor) {
            throw new IllegalArgumentException("please provide a grey level image, colour images cannot be saved");
        }

        final int pixelCount = imageProcessor.getWidth() * imageProcessor.getHeight();
        float min = Float.MAX_VALUE;
        float max = -Float.MAX_VALUE;
        for (int i = 0; i < pixelCount; i++) {
            final float value = imageProcessor.getf(i);
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        if ((pixelCount > 0) && ((min < 0) || (max >= MAX_GREY_LEVEL + 1))) {
            throw new IllegalArgumentException("please provide grey levels in [0, " + MAX_GREY_LEVEL +
                                               "], image has values in [" + min + ", " + max + "]");
        }

        final ByteProcessor byteProcessor = new ByteProcessor(imageProcessor.getWidth(),
                                                              imageProcessor.getHeight());
        for (int i = 0; i < pixelCount; i++) {
            byteProcessor.set(i, (int) imageProcessor.getf(i));
        }

        return byteProcessor;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameImageUtil.class);
}
